package com.github.dimitryivaniuta.canvas.exception;

public class OAuthRefreshFailedException extends CanvasApiException {

    public OAuthRefreshFailedException(String message) {
        this(message, null);
    }

    public OAuthRefreshFailedException(String message, Throwable cause) {
        super(message == null || message.isBlank() ? "Failed to refresh OAuth token" : message, cause);
    }
}
