package com.github.dimitryivaniuta.canvas.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public class MiddlewareMetrics {

    private final MeterRegistry registry;

    public MiddlewareMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /** Metrics kept in a private in-memory registry, for use outside a Spring context. */
    public static MiddlewareMetrics standalone() {
        return new MiddlewareMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return registry;
    }

    // ---- Retry ----
    public void retryAttempt(String method, String reason) {
        Counter.builder("canvas_http_retry_attempts_total")
                .tag("method", method)
                .tag("reason", reason) // status code or exception type
                .register(registry)
                .increment();
    }

    public void retryExhausted(String method) {
        Counter.builder("canvas_http_retry_exhausted_total")
                .tag("method", method)
                .register(registry)
                .increment();
    }

    // ---- Rate limiting ----
    public void rateLimitWaited(long seconds) {
        Timer.builder("canvas_http_ratelimit_wait_seconds")
                .register(registry)
                .record(seconds, TimeUnit.SECONDS);
    }

    public void rateLimitRejected(String reason) {
        Counter.builder("canvas_http_ratelimit_rejected_total")
                .tag("reason", reason) // no_wait | max_wait
                .register(registry)
                .increment();
    }

    // ---- Cache ----
    public void cacheHit() {
        Counter.builder("canvas_http_cache_hits_total")
                .register(registry)
                .increment();
    }

    public void cacheMiss() {
        Counter.builder("canvas_http_cache_misses_total")
                .register(registry)
                .increment();
    }

    public void cacheInvalidated(String resource, int entries) {
        Counter.builder("canvas_http_cache_invalidated_total")
                .tag("resource", resource)
                .register(registry)
                .increment(entries);
    }

    // ---- OAuth ----
    public void oauthRefresh(String trigger, boolean success) {
        Counter.builder("canvas_http_oauth_refresh_total")
                .tag("trigger", trigger) // proactive | reactive
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    // ---- Duration ----
    public void recordDuration(String method, int status, long nanos) {
        Timer.builder("canvas_http_request_duration_seconds")
                .tag("method", method)
                .tag("status", String.valueOf(status))
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}
