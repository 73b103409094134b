package com.github.dimitryivaniuta.canvas.exception;

import com.github.dimitryivaniuta.canvas.http.CanvasRequest;
import com.github.dimitryivaniuta.canvas.http.CanvasResponse;

/**
 * A response was received but its status signals a failure (4xx/5xx).
 * Middleware unwrap the response from this exception to decide on retries, refunds and refreshes.
 */
public class HttpResponseException extends CanvasApiException {

    private final transient CanvasRequest request;
    private final transient CanvasResponse response;

    public HttpResponseException(String message, CanvasRequest request, CanvasResponse response) {
        super(message);
        this.request = request;
        this.response = response;
    }

    public static HttpResponseException of(CanvasRequest request, CanvasResponse response) {
        String kind = response.getStatusCode() >= 500 ? "Server error" : "Client error";
        String message = kind + ": `" + request.getMethod() + " " + request.getUri()
                + "` resulted in a `" + response.getStatusCode() + " " + response.getReasonPhrase() + "` response";
        return new HttpResponseException(message, request, response);
    }

    public CanvasRequest getRequest() {
        return request;
    }

    public CanvasResponse getResponse() {
        return response;
    }

    public int getStatusCode() {
        return response.getStatusCode();
    }
}
