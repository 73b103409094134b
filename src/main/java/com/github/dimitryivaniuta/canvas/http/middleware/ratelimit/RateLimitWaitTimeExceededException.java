package com.github.dimitryivaniuta.canvas.http.middleware.ratelimit;

import com.github.dimitryivaniuta.canvas.http.CanvasRequest;

/**
 * The bucket would refill, but not within {@code max_wait_time}.
 */
public class RateLimitWaitTimeExceededException extends RateLimitExceededException {

    private final long maxWaitSeconds;

    public RateLimitWaitTimeExceededException(CanvasRequest request, long waitSeconds, long maxWaitSeconds) {
        super("Rate limit wait time (" + waitSeconds + "s) exceeds maximum (" + maxWaitSeconds + "s).",
                request, waitSeconds);
        this.maxWaitSeconds = maxWaitSeconds;
    }

    public long getMaxWaitSeconds() {
        return maxWaitSeconds;
    }
}
