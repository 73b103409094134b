package com.github.dimitryivaniuta.canvas.cache;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

final class CacheFixtures {
    private CacheFixtures() {}

    static CachedResponse ok(String body) {
        return new CachedResponse(
                true,
                200,
                "OK",
                Map.of("Content-Type", List.of("application/json")),
                body.getBytes(StandardCharsets.UTF_8),
                "1.1",
                null
        );
    }
}
