package com.github.dimitryivaniuta.canvas.http.middleware.ratelimit;

import com.github.dimitryivaniuta.canvas.exception.HttpResponseException;
import com.github.dimitryivaniuta.canvas.http.CanvasRequest;
import com.github.dimitryivaniuta.canvas.http.CanvasResponse;
import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Raised locally, before anything is sent, when the bucket is too low and waiting is not allowed.
 * Carries a synthetic 429 response so callers can treat it like any other HTTP failure.
 */
public class RateLimitExceededException extends HttpResponseException {

    private final long retryAfterSeconds;

    public RateLimitExceededException(CanvasRequest request, long retryAfterSeconds) {
        this("Rate limit would be exceeded. Would need to wait " + retryAfterSeconds + " seconds.",
                request, retryAfterSeconds);
    }

    protected RateLimitExceededException(String message, CanvasRequest request, long retryAfterSeconds) {
        super(message, request, syntheticResponse(message, retryAfterSeconds));
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    private static CanvasResponse syntheticResponse(String message, long retryAfterSeconds) {
        return CanvasResponse.builder()
                .statusCode(429)
                .headers(Map.of(HttpHeaders.RETRY_AFTER, List.of(String.valueOf(retryAfterSeconds))))
                .body(message.getBytes(StandardCharsets.UTF_8))
                .build();
    }
}
