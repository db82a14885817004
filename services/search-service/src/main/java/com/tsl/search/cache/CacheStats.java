package com.tsl.search.cache;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public class CacheStats {
    private static final CacheStats UNAVAILABLE = new CacheStats(0L, 0L, 0L, false);

    private final long hits;
    private final long misses;
    private final long keyCount;
    private final boolean available;

    private CacheStats(long hits, long misses, long keyCount, boolean available) {
        this.hits = hits;
        this.misses = misses;
        this.keyCount = keyCount;
        this.available = available;
    }

    public static CacheStats of(long hits, long misses, long keyCount) {
        return new CacheStats(hits, misses, keyCount, true);
    }

    public static CacheStats unavailable() {
        return UNAVAILABLE;
    }

    @JsonProperty("hits")
    public long getHits() {
        return hits;
    }

    @JsonProperty("misses")
    public long getMisses() {
        return misses;
    }

    @JsonProperty("key_count")
    public long getKeyCount() {
        return keyCount;
    }

    @JsonProperty("hit_rate")
    public double getHitRate() {
        return (double) hits / Math.max(hits + misses, 1L);
    }

    @JsonIgnore
    public boolean isAvailable() {
        return available;
    }
}
