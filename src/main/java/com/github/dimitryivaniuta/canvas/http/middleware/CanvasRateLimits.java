package com.github.dimitryivaniuta.canvas.http.middleware;

import com.github.dimitryivaniuta.canvas.exception.HttpResponseException;
import com.github.dimitryivaniuta.canvas.http.CanvasHeaders;
import com.github.dimitryivaniuta.canvas.http.CanvasResponse;

/**
 * Canvas signals throttling with a 403, not a 429. A 403 is a rate limit only when
 * {@code X-Rate-Limit-Remaining} is present and not positive, or the body says "Rate Limit Exceeded";
 * any other 403 is a real authorization failure.
 */
public final class CanvasRateLimits {
    private CanvasRateLimits() {}

    public static boolean isRateLimited(CanvasResponse response) {
        if (response == null || response.getStatusCode() != 403) return false;
        return hasRateLimitMarkers(response);
    }

    /** Same check for a failure that carries a response. */
    public static boolean isRateLimitError(Throwable error) {
        return error instanceof HttpResponseException e && isRateLimited(e.getResponse());
    }

    static boolean hasRateLimitMarkers(CanvasResponse response) {
        if (response.hasHeader(CanvasHeaders.RATE_LIMIT_REMAINING)) {
            return parseDouble(response.getHeaderLine(CanvasHeaders.RATE_LIMIT_REMAINING)) <= 0;
        }
        return response.getBodyAsString().contains(CanvasHeaders.RATE_LIMIT_EXCEEDED_BODY);
    }

    /** Lenient numeric header parsing; garbage reads as 0. */
    public static double parseDouble(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) return 0;
        try {
            return Double.parseDouble(headerValue.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
