package com.github.dimitryivaniuta.canvas.http.middleware;

import com.github.dimitryivaniuta.canvas.exception.CanvasApiException;

import java.time.Duration;

/**
 * Blocks the calling thread. Swappable so tests do not wait in real time.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration);

    Sleeper THREAD = duration -> {
        if (duration.isZero() || duration.isNegative()) return;
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CanvasApiException("Interrupted while waiting " + duration.toMillis() + " ms", e);
        }
    };
}
