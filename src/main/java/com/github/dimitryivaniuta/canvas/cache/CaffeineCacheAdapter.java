package com.github.dimitryivaniuta.canvas.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Caffeine-backed adapter. Unlike a cache-wide {@code expireAfterWrite}, every entry keeps the TTL
 * it was stored with, so one cache can hold 60 s submissions next to 1 h course lists.
 */
public class CaffeineCacheAdapter implements CacheAdapter {

    public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    // 24h safety cap; also used for "no TTL"
    private static final long MAX_TTL_SECONDS = 24 * 60 * 60;

    private record Entry(CachedResponse value, long ttlSeconds) {}

    private final Cache<String, Entry> cache;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public CaffeineCacheAdapter() {
        this(DEFAULT_MAXIMUM_SIZE, Ticker.systemTicker());
    }

    public CaffeineCacheAdapter(long maximumSize, Ticker ticker) {
        Objects.requireNonNull(ticker, "ticker must not be null");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new PerEntryTtl())
                .build();
    }

    @Override
    public Optional<CachedResponse> get(String key) {
        Entry e = cache.getIfPresent(key);
        if (e == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(e.value());
    }

    @Override
    public void set(String key, CachedResponse value, long ttlSeconds) {
        cache.put(key, new Entry(value, ttlSeconds));
    }

    @Override
    public boolean delete(String key) {
        return cache.asMap().remove(key) != null;
    }

    @Override
    public boolean has(String key) {
        return cache.getIfPresent(key) != null;
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        hits.set(0);
        misses.set(0);
    }

    @Override
    public int deleteByPattern(String pattern) {
        Pattern regex = GlobPatterns.toRegex(pattern);
        int[] deleted = {0};
        cache.asMap().keySet().removeIf(key -> {
            boolean match = regex.matcher(key).matches();
            if (match) deleted[0]++;
            return match;
        });
        return deleted[0];
    }

    @Override
    public CacheStats getStats() {
        cache.cleanUp();
        long size = cache.asMap().values().stream().mapToLong(e -> e.value().estimatedSize()).sum();
        return new CacheStats(hits.get(), misses.get(), size, cache.estimatedSize());
    }

    private static final class PerEntryTtl implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return toNanos(entry.ttlSeconds());
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return toNanos(entry.ttlSeconds());
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private static long toNanos(long ttlSeconds) {
            long clamped = (ttlSeconds <= 0) ? MAX_TTL_SECONDS : Math.min(ttlSeconds, MAX_TTL_SECONDS);
            return Duration.ofSeconds(clamped).toNanos();
        }
    }
}
