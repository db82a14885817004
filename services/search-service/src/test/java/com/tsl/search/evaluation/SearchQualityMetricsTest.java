package com.tsl.search.evaluation;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SearchQualityMetricsTest {

    private static final double EPSILON = 1e-9;

    @Test
    void precisionAndRecallAtK() {
        List<String> retrieved = List.of("a", "x", "b", "y", "c");
        List<String> relevant = List.of("a", "b", "z");

        assertEquals(2.0 / 3.0, SearchQualityMetrics.precisionAtK(retrieved, relevant, 3), EPSILON);
        assertEquals(2.0 / 3.0, SearchQualityMetrics.recallAtK(retrieved, relevant, 3), EPSILON);
        assertEquals(0.0, SearchQualityMetrics.precisionAtK(List.of(), relevant, 3), EPSILON);
        assertEquals(0.0, SearchQualityMetrics.recallAtK(retrieved, List.of(), 3), EPSILON);
    }

    @Test
    void ndcgIsOneForIdealRanking() {
        assertEquals(1.0, SearchQualityMetrics.ndcgAtK(List.of("a", "b", "x"), List.of("a", "b"), 3), EPSILON);

        double expected = (1.0 / log2(3)) / (1.0 + 1.0 / log2(3));
        assertEquals(expected, SearchQualityMetrics.ndcgAtK(List.of("x", "a", "y"), List.of("a", "b"), 3), 1e-6);
    }

    @Test
    void meanReciprocalRankAveragesFirstHits() {
        List<SearchQualityMetrics.Judgement> judgements = List.of(
            new SearchQualityMetrics.Judgement(List.of("a", "b"), List.of("a")),
            new SearchQualityMetrics.Judgement(List.of("x", "y", "b"), List.of("b")),
            new SearchQualityMetrics.Judgement(List.of("x"), List.of("b"))
        );

        assertEquals((1.0 + 1.0 / 3.0 + 0.0) / 3.0, SearchQualityMetrics.meanReciprocalRank(judgements), EPSILON);
    }

    @Test
    void mapSkipsQueriesWithoutRelevantIds() {
        List<SearchQualityMetrics.Judgement> judgements = List.of(
            new SearchQualityMetrics.Judgement(List.of("a", "x", "b"), List.of("a", "b")),
            new SearchQualityMetrics.Judgement(List.of("a"), List.of())
        );

        assertEquals((1.0 + 2.0 / 3.0) / 2.0, SearchQualityMetrics.mapAtK(judgements, 3), EPSILON);
    }

    @Test
    void summarizeNamesMetricsByCutoff() {
        Map<String, Double> metrics = SearchQualityMetrics.summarize(List.of("a"), List.of("a"), 5);

        assertEquals(List.of("precision@5", "recall@5", "ndcg@5"), List.copyOf(metrics.keySet()));
        assertEquals(0.2, metrics.get("precision@5"), EPSILON);
    }

    private static double log2(double value) {
        return Math.log(value) / Math.log(2);
    }
}
