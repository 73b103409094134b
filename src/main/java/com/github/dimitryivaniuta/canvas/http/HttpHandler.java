package com.github.dimitryivaniuta.canvas.http;

/**
 * One link of the request pipeline: the transport itself, or a middleware wrapping the next link.
 *
 * <p>Failures are reported with unchecked {@link com.github.dimitryivaniuta.canvas.exception.CanvasApiException}s.
 */
@FunctionalInterface
public interface HttpHandler {

    CanvasResponse handle(CanvasRequest request, RequestOptions options);
}
