package com.github.dimitryivaniuta.canvas.cache;

import com.github.dimitryivaniuta.canvas.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.github.dimitryivaniuta.canvas.cache.CacheFixtures.ok;
import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCacheAdapterTest {

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");

    @Test
    void shouldExpireEntriesAfterTtl() {
        InMemoryCacheAdapter cache = new InMemoryCacheAdapter(10, clock);
        cache.set("k", ok("[1]"), 60);

        clock.advance(Duration.ofSeconds(59));
        assertThat(cache.get("k")).isPresent();

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.has("k")).isFalse();
    }

    @Test
    void shouldKeepEntriesWithoutTtlUntilDeleted() {
        InMemoryCacheAdapter cache = new InMemoryCacheAdapter(10, clock);
        cache.set("k", ok("[1]"), 0);

        clock.advance(Duration.ofDays(30));

        assertThat(cache.has("k")).isTrue();
        assertThat(cache.delete("k")).isTrue();
        assertThat(cache.delete("k")).isFalse();
    }

    @Test
    void shouldEvictOldestInsertedEntryWhenFull() {
        InMemoryCacheAdapter cache = new InMemoryCacheAdapter(2, clock);
        cache.set("a", ok("a"), 60);
        cache.set("b", ok("b"), 60);
        cache.get("a"); // reads do not refresh position

        cache.set("c", ok("c"), 60);

        assertThat(cache.has("a")).isFalse();
        assertThat(cache.has("b")).isTrue();
        assertThat(cache.has("c")).isTrue();
    }

    @Test
    void shouldDeleteByGlobPattern() {
        InMemoryCacheAdapter cache = new InMemoryCacheAdapter(10, clock);
        cache.set("canvas:v1:GET:/api/v1/courses/1", ok("1"), 60);
        cache.set("canvas:v1:GET:/api/v1/courses/1/assignments", ok("2"), 60);
        cache.set("canvas:v1:GET:/api/v1/users/1", ok("3"), 60);

        int deleted = cache.deleteByPattern("*/courses/1*");

        assertThat(deleted).isEqualTo(2);
        assertThat(cache.has("canvas:v1:GET:/api/v1/users/1")).isTrue();
    }

    @Test
    void shouldTrackHitsMissesAndSize() {
        InMemoryCacheAdapter cache = new InMemoryCacheAdapter(10, clock);
        cache.set("k", ok("12345"), 60);

        cache.get("k");
        cache.get("missing");

        CacheStats stats = cache.getStats();
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.entries()).isEqualTo(1);
        assertThat(stats.size()).isEqualTo(ok("12345").estimatedSize());

        cache.clear();
        assertThat(cache.getStats()).isEqualTo(new CacheStats(0, 0, 0, 0));
    }
}
