package com.github.dimitryivaniuta.canvas.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static com.github.dimitryivaniuta.canvas.cache.CacheFixtures.ok;
import static org.assertj.core.api.Assertions.assertThat;

class CaffeineCacheAdapterTest {

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;

    private void advance(Duration d) {
        nanos.addAndGet(d.toNanos());
    }

    @Test
    void shouldHonourPerEntryTtl() {
        CaffeineCacheAdapter cache = new CaffeineCacheAdapter(100, ticker);
        cache.set("submissions", ok("[]"), 60);
        cache.set("courses", ok("[]"), 3600);

        advance(Duration.ofSeconds(61));

        assertThat(cache.get("submissions")).isEmpty();
        assertThat(cache.get("courses")).isPresent();
    }

    @Test
    void shouldCapEntriesWithoutTtlAtOneDay() {
        CaffeineCacheAdapter cache = new CaffeineCacheAdapter(100, ticker);
        cache.set("k", ok("[]"), 0);

        advance(Duration.ofHours(23));
        assertThat(cache.has("k")).isTrue();

        advance(Duration.ofHours(2));
        assertThat(cache.has("k")).isFalse();
    }

    @Test
    void shouldDeleteMatchingKeysOnly() {
        CaffeineCacheAdapter cache = new CaffeineCacheAdapter(100, ticker);
        cache.set("canvas:v1:GET:/api/v1/courses/7/assignments", ok("a"), 300);
        cache.set("canvas:v1:GET:/api/v1/courses/70", ok("b"), 300);

        assertThat(cache.deleteByPattern("*/courses/7/*")).isEqualTo(1);
        assertThat(cache.has("canvas:v1:GET:/api/v1/courses/70")).isTrue();
    }

    @Test
    void shouldCountHitsAndMisses() {
        CaffeineCacheAdapter cache = new CaffeineCacheAdapter(100, ticker);
        cache.set("k", ok("abc"), 300);

        cache.get("k");
        cache.get("k");
        cache.get("nope");

        CacheStats stats = cache.getStats();
        assertThat(stats.hits()).isEqualTo(2);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.entries()).isEqualTo(1);
    }
}
