package com.github.dimitryivaniuta.canvas.exception;

public class MissingOAuthTokenException extends CanvasApiException {

    public MissingOAuthTokenException(String message) {
        super(message == null || message.isBlank() ? "OAuth token is not available" : message);
    }
}
