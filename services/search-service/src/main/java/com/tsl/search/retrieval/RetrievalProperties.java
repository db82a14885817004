package com.tsl.search.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.retrieval")
public class RetrievalProperties {
    private String table = "candidates";
    private int overFetchFactor = 4;
    private int defaultTopK = 5;
    private int maxTopK = 50;

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    public int getOverFetchFactor() {
        return overFetchFactor;
    }

    public void setOverFetchFactor(int overFetchFactor) {
        this.overFetchFactor = overFetchFactor;
    }

    public int getDefaultTopK() {
        return defaultTopK;
    }

    public void setDefaultTopK(int defaultTopK) {
        this.defaultTopK = defaultTopK;
    }

    public int getMaxTopK() {
        return maxTopK;
    }

    public void setMaxTopK(int maxTopK) {
        this.maxTopK = maxTopK;
    }
}
