package com.github.dimitryivaniuta.canvas.cache;

import java.util.List;
import java.util.Map;

/**
 * Stored form of a response. {@code cacheable=false} entries carry only the reason they were refused.
 */
public record CachedResponse(
        boolean cacheable,
        int status,
        String reasonPhrase,
        Map<String, List<String>> headers,
        byte[] body,
        String protocolVersion,
        String notCacheableReason
) {

    public static CachedResponse notCacheable(String reason) {
        return new CachedResponse(false, 0, null, Map.of(), null, null, reason);
    }

    /** Approximate footprint used for cache statistics. */
    public long estimatedSize() {
        long size = (body == null) ? 0 : body.length;
        if (headers != null) {
            for (Map.Entry<String, List<String>> e : headers.entrySet()) {
                size += e.getKey().length();
                for (String v : e.getValue()) size += v.length();
            }
        }
        return size;
    }
}
