package com.github.dimitryivaniuta.canvas.cache;

import com.github.dimitryivaniuta.canvas.http.CanvasRequest;
import com.github.dimitryivaniuta.canvas.http.RequestOptions;

@FunctionalInterface
public interface CacheKeyGenerator {

    String generate(CanvasRequest request, RequestOptions options);
}
