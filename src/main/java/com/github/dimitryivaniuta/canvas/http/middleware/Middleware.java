package com.github.dimitryivaniuta.canvas.http.middleware;

import com.github.dimitryivaniuta.canvas.http.HttpHandler;

import java.util.Map;

/**
 * A named, configurable interceptor of the HTTP pipeline.
 *
 * <p>{@link #wrap(HttpHandler)} does not execute anything: it returns a handler that runs this
 * middleware's logic around {@code next}. {@link MiddlewareStack} performs the composition.
 */
public interface Middleware {

    /** Stable, non-empty identifier used in diagnostics and ordering. */
    String getName();

    /**
     * Merges {@code options} over the current configuration. Later calls override only the keys
     * they supply; unknown keys are kept and never rejected.
     */
    void configure(Map<String, ?> options);

    /** Defaults every configuration starts from. */
    Map<String, Object> getDefaultConfig();

    /** Effective configuration (immutable snapshot). */
    Map<String, Object> getConfig();

    HttpHandler wrap(HttpHandler next);
}
