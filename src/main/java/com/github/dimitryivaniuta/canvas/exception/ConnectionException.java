package com.github.dimitryivaniuta.canvas.exception;

import com.github.dimitryivaniuta.canvas.http.CanvasRequest;

/**
 * No response at all: connect failure, reset or timeout at the transport.
 */
public class ConnectionException extends CanvasApiException {

    private final transient CanvasRequest request;

    public ConnectionException(String message, CanvasRequest request, Throwable cause) {
        super(message, cause);
        this.request = request;
    }

    public CanvasRequest getRequest() {
        return request;
    }
}
