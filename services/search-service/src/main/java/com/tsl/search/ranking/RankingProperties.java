package com.tsl.search.ranking;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ranking")
public class RankingProperties {
    private RerankMode mode = RerankMode.HTTP;
    private String baseUrl;
    private String model = "cross-encoder/ms-marco-MiniLM-L-6-v2";
    private int timeoutMs = 2000;
    private int poolSize = 4;
    private int minSegmentLength = 15;

    public RerankMode getMode() {
        return mode;
    }

    public void setMode(RerankMode mode) {
        this.mode = mode;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public int getMinSegmentLength() {
        return minSegmentLength;
    }

    public void setMinSegmentLength(int minSegmentLength) {
        this.minSegmentLength = minSegmentLength;
    }
}
