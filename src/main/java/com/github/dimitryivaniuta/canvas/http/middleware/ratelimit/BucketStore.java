package com.github.dimitryivaniuta.canvas.http.middleware.ratelimit;

import java.time.Clock;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rate-limit buckets by key. Buckets are created on first use, full, and live until reset.
 *
 * <p>{@link #shared()} is the process-wide default, so separate clients for the same account draw
 * from the same quota. Tests create their own store.
 */
public final class BucketStore {

    private static final BucketStore SHARED = new BucketStore(Clock.systemUTC());

    private final Clock clock;
    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    public BucketStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static BucketStore shared() {
        return SHARED;
    }

    public Bucket bucket(String key, Bucket.Limits limits) {
        return buckets.computeIfAbsent(key, k -> new Bucket(limits.bucketSize(), clock));
    }

    public Set<String> keys() {
        return Set.copyOf(buckets.keySet());
    }

    public void reset() {
        buckets.clear();
    }

    public void reset(String key) {
        buckets.remove(key);
    }
}
