package com.github.dimitryivaniuta.canvas.cache;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Process-local cache with a fixed entry limit. When full, the oldest inserted entry is evicted.
 */
public class InMemoryCacheAdapter implements CacheAdapter {

    public static final int DEFAULT_MAX_ENTRIES = 1000;

    private record Entry(CachedResponse value, long expiresAtMillis, long size) {
        boolean isExpired(long now) {
            return expiresAtMillis > 0 && expiresAtMillis <= now;
        }
    }

    private final int maxEntries;
    private final Clock clock;

    // insertion order = eviction order; guarded by "this"
    private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();
    private long sizeBytes;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public InMemoryCacheAdapter() {
        this(DEFAULT_MAX_ENTRIES, Clock.systemUTC());
    }

    /** @param maxEntries 0 or less means unbounded */
    public InMemoryCacheAdapter(int maxEntries, Clock clock) {
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    @Override
    public synchronized Optional<CachedResponse> get(String key) {
        Entry e = entries.get(key);
        if (e == null || e.isExpired(clock.millis())) {
            if (e != null) remove(key);
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(e.value());
    }

    @Override
    public synchronized void set(String key, CachedResponse value, long ttlSeconds) {
        remove(key);
        if (maxEntries > 0 && entries.size() >= maxEntries) {
            evictOldest();
        }
        long expiresAt = ttlSeconds > 0 ? clock.millis() + ttlSeconds * 1000 : 0;
        Entry e = new Entry(value, expiresAt, value.estimatedSize());
        entries.put(key, e);
        sizeBytes += e.size();
    }

    @Override
    public synchronized boolean delete(String key) {
        return remove(key);
    }

    @Override
    public synchronized boolean has(String key) {
        Entry e = entries.get(key);
        if (e == null) return false;
        if (e.isExpired(clock.millis())) {
            remove(key);
            return false;
        }
        return true;
    }

    @Override
    public synchronized void clear() {
        entries.clear();
        sizeBytes = 0;
        hits.set(0);
        misses.set(0);
    }

    @Override
    public synchronized int deleteByPattern(String pattern) {
        Pattern regex = GlobPatterns.toRegex(pattern);
        int deleted = 0;
        Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Entry> e = it.next();
            if (regex.matcher(e.getKey()).matches()) {
                sizeBytes -= e.getValue().size();
                it.remove();
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public synchronized CacheStats getStats() {
        cleanExpired();
        return new CacheStats(hits.get(), misses.get(), sizeBytes, entries.size());
    }

    private void cleanExpired() {
        long now = clock.millis();
        Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Entry e = it.next().getValue();
            if (e.isExpired(now)) {
                sizeBytes -= e.size();
                it.remove();
            }
        }
    }

    private void evictOldest() {
        Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
        if (it.hasNext()) {
            sizeBytes -= it.next().getValue().size();
            it.remove();
        }
    }

    private boolean remove(String key) {
        Entry e = entries.remove(key);
        if (e == null) return false;
        sizeBytes -= e.size();
        return true;
    }
}
