package com.tsl.search.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class TtlCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    @Test
    void keyReputAfterExpiryIsNotEvictedBeforeOlderEntries() {
        TtlCache<String> cache = new TtlCache<>(2, clock);
        cache.put("a", "first", 1_000L);
        clock.advance(Duration.ofSeconds(2));
        assertThat(cache.get("a")).isEmpty();

        cache.put("b", "value", 60_000L);
        cache.put("a", "second", 60_000L);
        cache.put("c", "value", 60_000L);

        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("a")).map(CacheEntry::getValue).contains("second");
        assertThat(cache.get("c")).isPresent();
    }

    @Test
    void expireAndReputCyclesStayBounded() {
        TtlCache<String> cache = new TtlCache<>(100, clock);
        for (int i = 0; i < 10_000; i++) {
            cache.put("hot", "v" + i, 1_000L);
            clock.advance(Duration.ofSeconds(2));
            cache.get("hot");
        }

        assertThat(cache.size()).isZero();
        assertThat(cache.trackedSlots()).isZero();
    }

    @Test
    void overwriteMovesKeyToBackOfEvictionOrder() {
        TtlCache<String> cache = new TtlCache<>(2, clock);
        cache.put("a", "v1", 60_000L);
        cache.put("b", "v1", 60_000L);
        cache.put("a", "v2", 60_000L);
        cache.put("c", "v1", 60_000L);

        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("a")).map(CacheEntry::getValue).contains("v2");
        assertThat(cache.trackedSlots()).isEqualTo(2);
    }

    @Test
    void removeDropsKeyFromEvictionOrder() {
        TtlCache<String> cache = new TtlCache<>(2, clock);
        cache.put("a", "v", 60_000L);

        assertThat(cache.remove("a")).isTrue();
        assertThat(cache.remove("a")).isFalse();
        assertThat(cache.trackedSlots()).isZero();
    }
}
