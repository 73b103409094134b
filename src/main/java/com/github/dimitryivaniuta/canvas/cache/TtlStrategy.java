package com.github.dimitryivaniuta.canvas.cache;

import com.github.dimitryivaniuta.canvas.http.CanvasRequest;
import com.github.dimitryivaniuta.canvas.http.RequestOptions;

/**
 * How long a response may be cached, in seconds. 0 means "do not store".
 */
@FunctionalInterface
public interface TtlStrategy {

    long getTtl(CanvasRequest request, RequestOptions options);
}
