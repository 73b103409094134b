package com.github.dimitryivaniuta.canvas.exception;

import java.util.List;

/**
 * Root of every failure raised by the Canvas HTTP toolkit.
 */
public class CanvasApiException extends RuntimeException {

    private final transient List<String> errors;

    public CanvasApiException(String message) {
        this(message, null, List.of());
    }

    public CanvasApiException(String message, Throwable cause) {
        this(message, cause, List.of());
    }

    public CanvasApiException(String message, Throwable cause, List<String> errors) {
        super(message, cause);
        this.errors = (errors == null) ? List.of() : List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
