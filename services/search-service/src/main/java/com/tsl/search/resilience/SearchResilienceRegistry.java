package com.tsl.search.resilience;

import org.springframework.stereotype.Component;

@Component
public class SearchResilienceRegistry {
    private final CircuitBreaker embedBreaker;
    private final CircuitBreaker rerankBreaker;

    public SearchResilienceRegistry(SearchResilienceProperties properties) {
        this.embedBreaker = new CircuitBreaker(
            "embed",
            properties.getEmbedFailureThreshold(),
            properties.getEmbedOpenMs()
        );
        this.rerankBreaker = new CircuitBreaker(
            "rerank",
            properties.getRerankFailureThreshold(),
            properties.getRerankOpenMs()
        );
    }

    public CircuitBreaker getEmbedBreaker() {
        return embedBreaker;
    }

    public CircuitBreaker getRerankBreaker() {
        return rerankBreaker;
    }
}
