package com.tsl.search.embed;

import com.tsl.search.resilience.CircuitBreaker;
import com.tsl.search.resilience.SearchResilienceRegistry;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class EmbeddingService implements EmbeddingProvider {
    private final EmbeddingProperties properties;
    private final EmbeddingGateway embeddingGateway;
    private final ToyEmbedder toyEmbedder;
    private final SearchResilienceRegistry resilienceRegistry;

    public EmbeddingService(
        EmbeddingProperties properties,
        EmbeddingGateway embeddingGateway,
        ToyEmbedder toyEmbedder,
        SearchResilienceRegistry resilienceRegistry
    ) {
        this.properties = properties;
        this.embeddingGateway = embeddingGateway;
        this.toyEmbedder = toyEmbedder;
        this.resilienceRegistry = resilienceRegistry;
    }

    @Override
    public List<List<Double>> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        if (properties.getMode() == EmbeddingMode.TOY) {
            List<List<Double>> vectors = new ArrayList<>(texts.size());
            for (String text : texts) {
                vectors.add(toyEmbedder.embed(text));
            }
            return vectors;
        }
        CircuitBreaker breaker = resilienceRegistry.getEmbedBreaker();
        if (!breaker.allowRequest()) {
            throw new EmbeddingUnavailableException("embed_circuit_open");
        }
        try {
            List<List<Double>> vectors = embeddingGateway.embedBatch(texts);
            breaker.recordSuccess();
            return vectors;
        } catch (EmbeddingUnavailableException ex) {
            breaker.recordFailure();
            throw ex;
        }
    }
}
