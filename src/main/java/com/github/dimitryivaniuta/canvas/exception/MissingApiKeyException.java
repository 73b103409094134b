package com.github.dimitryivaniuta.canvas.exception;

public class MissingApiKeyException extends CanvasApiException {

    public MissingApiKeyException() {
        super("API key is not set");
    }
}
