package com.tsl.search.embed;

import java.util.List;

public interface EmbeddingProvider {
    /**
     * Embeds every text in one logical call. The result holds one vector per input, in input order.
     *
     * @throws EmbeddingUnavailableException when the provider cannot produce vectors
     */
    List<List<Double>> embedBatch(List<String> texts);

    default List<Double> embed(String text) {
        List<List<Double>> vectors = embedBatch(List.of(text));
        if (vectors.isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_response");
        }
        return vectors.get(0);
    }
}
