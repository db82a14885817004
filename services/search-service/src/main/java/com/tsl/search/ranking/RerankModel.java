package com.tsl.search.ranking;

import java.util.List;

/**
 * Cross-encoder relevance model.
 */
public interface RerankModel {
    /**
     * Scores every pair; the result has one score per pair, in pair order. Higher is more relevant.
     *
     * @throws RankingUnavailableException when the model cannot score the batch
     */
    List<Double> predict(List<ScoringPair> pairs);

    String modelId();
}
