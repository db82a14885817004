package com.tsl.search.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.resilience")
public class SearchResilienceProperties {
    private int embedFailureThreshold = 3;
    private long embedOpenMs = 30000;
    private int rerankFailureThreshold = 3;
    private long rerankOpenMs = 30000;

    public int getEmbedFailureThreshold() {
        return embedFailureThreshold;
    }

    public void setEmbedFailureThreshold(int embedFailureThreshold) {
        this.embedFailureThreshold = embedFailureThreshold;
    }

    public long getEmbedOpenMs() {
        return embedOpenMs;
    }

    public void setEmbedOpenMs(long embedOpenMs) {
        this.embedOpenMs = embedOpenMs;
    }

    public int getRerankFailureThreshold() {
        return rerankFailureThreshold;
    }

    public void setRerankFailureThreshold(int rerankFailureThreshold) {
        this.rerankFailureThreshold = rerankFailureThreshold;
    }

    public long getRerankOpenMs() {
        return rerankOpenMs;
    }

    public void setRerankOpenMs(long rerankOpenMs) {
        this.rerankOpenMs = rerankOpenMs;
    }
}
