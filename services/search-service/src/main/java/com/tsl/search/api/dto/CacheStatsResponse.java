package com.tsl.search.api.dto;

import com.tsl.search.cache.CacheStats;

public class CacheStatsResponse {
    private final String status;
    private final CacheStats stats;

    public CacheStatsResponse(String status, CacheStats stats) {
        this.status = status;
        this.stats = stats;
    }

    public String getStatus() {
        return status;
    }

    public CacheStats getStats() {
        return stats;
    }
}
