package com.github.dimitryivaniuta.canvas.cache;

import com.github.dimitryivaniuta.canvas.http.CanvasHeaders;
import com.github.dimitryivaniuta.canvas.http.CanvasResponse;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts responses to and from their cached form. Bodies larger than {@code maxBodySize} are
 * never stored.
 *
 * <p>Rate-limit headers are dropped: they describe the bucket at the time of the original call
 * and must not be replayed on a hit.
 */
public class ResponseSerializer {

    public static final int DEFAULT_MAX_BODY_SIZE = 1024 * 1024;

    private static final Set<String> VOLATILE_HEADERS = Set.of(
            CanvasHeaders.RATE_LIMIT_REMAINING.toLowerCase(Locale.ROOT),
            CanvasHeaders.REQUEST_COST.toLowerCase(Locale.ROOT),
            CanvasHeaders.CACHE_STATUS.toLowerCase(Locale.ROOT));

    private final int maxBodySize;

    public ResponseSerializer() {
        this(DEFAULT_MAX_BODY_SIZE);
    }

    public ResponseSerializer(int maxBodySize) {
        this.maxBodySize = maxBodySize;
    }

    public CachedResponse serialize(CanvasResponse response) {
        if (response.getBodySize() > maxBodySize) {
            return CachedResponse.notCacheable("Response too large");
        }
        Map<String, List<String>> headers = new LinkedHashMap<>();
        response.getHeaders().forEach((name, values) -> {
            if (!VOLATILE_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                headers.put(name, List.copyOf(values));
            }
        });
        return new CachedResponse(
                true,
                response.getStatusCode(),
                response.getReasonPhrase(),
                headers,
                response.getBody(),
                response.getProtocolVersion(),
                null
        );
    }

    /** Empty when the entry was stored as not cacheable. */
    public Optional<CanvasResponse> deserialize(CachedResponse cached) {
        if (cached == null || !cached.cacheable()) {
            return Optional.empty();
        }
        return Optional.of(CanvasResponse.builder()
                .statusCode(cached.status() == 0 ? 200 : cached.status())
                .reasonPhrase(cached.reasonPhrase())
                .headers(cached.headers())
                .body(cached.body())
                .protocolVersion(cached.protocolVersion())
                .build());
    }
}
