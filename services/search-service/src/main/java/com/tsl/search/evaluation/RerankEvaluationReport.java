package com.tsl.search.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public class RerankEvaluationReport {
    @JsonProperty("test_queries_count")
    private final int queryCount;

    @JsonProperty("metrics_without_reranker")
    private final Map<String, Double> withoutReranker;

    @JsonProperty("metrics_with_reranker")
    private final Map<String, Double> withReranker;

    @JsonProperty("improvements_percent")
    private final Map<String, Double> improvementsPercent;

    @JsonProperty("detailed_without_reranker")
    private final List<SearchQualityMetrics.Judgement> detailedWithoutReranker;

    @JsonProperty("detailed_with_reranker")
    private final List<SearchQualityMetrics.Judgement> detailedWithReranker;

    public RerankEvaluationReport(
        int queryCount,
        Map<String, Double> withoutReranker,
        Map<String, Double> withReranker,
        Map<String, Double> improvementsPercent,
        List<SearchQualityMetrics.Judgement> detailedWithoutReranker,
        List<SearchQualityMetrics.Judgement> detailedWithReranker
    ) {
        this.queryCount = queryCount;
        this.withoutReranker = withoutReranker;
        this.withReranker = withReranker;
        this.improvementsPercent = improvementsPercent;
        this.detailedWithoutReranker = detailedWithoutReranker;
        this.detailedWithReranker = detailedWithReranker;
    }

    public int getQueryCount() {
        return queryCount;
    }

    public Map<String, Double> getWithoutReranker() {
        return withoutReranker;
    }

    public Map<String, Double> getWithReranker() {
        return withReranker;
    }

    public Map<String, Double> getImprovementsPercent() {
        return improvementsPercent;
    }

    public List<SearchQualityMetrics.Judgement> getDetailedWithoutReranker() {
        return detailedWithoutReranker;
    }

    public List<SearchQualityMetrics.Judgement> getDetailedWithReranker() {
        return detailedWithReranker;
    }
}
