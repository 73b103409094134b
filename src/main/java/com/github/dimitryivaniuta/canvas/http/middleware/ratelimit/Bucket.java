package com.github.dimitryivaniuta.canvas.http.middleware.ratelimit;

import java.time.Clock;

/**
 * Leaky-bucket state for one host/credential pair.
 *
 * <p>Units leak back in lazily: every access first adds {@code elapsed * leakRate}, capped at the
 * bucket size. {@code remaining} is kept as a double so slow leak rates still accumulate between
 * frequent accesses. Each method is one atomic read-modify-write on this bucket only.
 */
public final class Bucket {

    /** Capacity and refill speed, passed on each access so reconfiguration applies immediately. */
    public record Limits(double bucketSize, double leakRate) {}

    private final Clock clock;

    private double remaining;
    private double cost;
    private long timestampMillis;

    Bucket(double initialRemaining, Clock clock) {
        this.clock = clock;
        this.remaining = initialRemaining;
        this.timestampMillis = clock.millis();
    }

    public synchronized double remaining(Limits limits) {
        leak(limits);
        return remaining;
    }

    /** Units charged by the last {@link #consume}. */
    public synchronized double lastCost() {
        return cost;
    }

    public synchronized void consume(double units, Limits limits) {
        leak(limits);
        remaining = Math.max(0, remaining - units);
        cost = units;
    }

    public synchronized void refund(double units, Limits limits) {
        leak(limits);
        remaining = Math.min(limits.bucketSize(), remaining + units);
    }

    /** Replaces the local estimate with the server's figure. */
    public synchronized void overwrite(double serverRemaining, Limits limits) {
        remaining = clamp(serverRemaining, limits);
        timestampMillis = clock.millis();
    }

    private void leak(Limits limits) {
        long now = clock.millis();
        double elapsedSeconds = Math.max(0, now - timestampMillis) / 1000.0;
        remaining = clamp(remaining + elapsedSeconds * limits.leakRate(), limits);
        timestampMillis = now;
    }

    private static double clamp(double value, Limits limits) {
        return Math.max(0, Math.min(limits.bucketSize(), value));
    }

    @Override
    public synchronized String toString() {
        return "Bucket[remaining=" + remaining + ", cost=" + cost + "]";
    }
}
