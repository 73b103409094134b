package com.github.dimitryivaniuta.canvas.cache;

import java.util.Optional;

/**
 * Storage behind the response cache. Implementations must be safe for concurrent use.
 *
 * <p>Keys are plain strings. Patterns for {@link #deleteByPattern(String)} are globs where
 * {@code *} matches any run of characters, anchored at both ends.
 */
public interface CacheAdapter {

    /** Live entry for {@code key}; expired entries count as misses. */
    Optional<CachedResponse> get(String key);

    /**
     * @param ttlSeconds lifetime; 0 or less keeps the entry until it is deleted or evicted
     */
    void set(String key, CachedResponse value, long ttlSeconds);

    boolean delete(String key);

    boolean has(String key);

    /** Drops every entry and resets hit/miss counters. */
    void clear();

    /** @return number of entries removed */
    int deleteByPattern(String pattern);

    CacheStats getStats();
}
