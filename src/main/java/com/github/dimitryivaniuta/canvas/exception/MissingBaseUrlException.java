package com.github.dimitryivaniuta.canvas.exception;

public class MissingBaseUrlException extends CanvasApiException {

    public MissingBaseUrlException() {
        super("Base URL is not set");
    }
}
