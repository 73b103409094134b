package com.github.dimitryivaniuta.canvas.exception;

public class ConfigurationException extends CanvasApiException {

    public ConfigurationException(String message) {
        super(message);
    }
}
