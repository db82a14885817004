package com.tsl.search.evaluation;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Offline ranking-quality metrics over candidate id lists. {@code retrieved} is in ranked order;
 * relevance is binary.
 */
public final class SearchQualityMetrics {
    private SearchQualityMetrics() {
    }

    /**
     * One judged query: the ranked ids returned and the ids known to be relevant.
     */
    public record Judgement(List<String> retrieved, List<String> relevant) {
        public Judgement {
            retrieved = retrieved == null ? List.of() : List.copyOf(retrieved);
            relevant = relevant == null ? List.of() : List.copyOf(relevant);
        }
    }

    public static double precisionAtK(List<String> retrieved, List<String> relevant, int k) {
        if (k <= 0 || isEmpty(retrieved) || isEmpty(relevant)) {
            return 0.0;
        }
        return (double) hits(top(retrieved, k), new HashSet<>(relevant)) / k;
    }

    public static double recallAtK(List<String> retrieved, List<String> relevant, int k) {
        if (isEmpty(relevant) || retrieved == null) {
            return 0.0;
        }
        Set<String> relevantSet = new HashSet<>(relevant);
        return (double) hits(top(retrieved, k), relevantSet) / relevantSet.size();
    }

    public static double ndcgAtK(List<String> retrieved, List<String> relevant, int k) {
        if (k <= 0 || isEmpty(retrieved) || isEmpty(relevant)) {
            return 0.0;
        }
        Set<String> relevantSet = new HashSet<>(relevant);
        List<String> ranked = top(retrieved, k);
        double dcg = 0.0;
        for (int i = 0; i < ranked.size(); i++) {
            if (relevantSet.contains(ranked.get(i))) {
                dcg += discount(i + 1);
            }
        }
        double idcg = 0.0;
        int ideal = Math.min(relevant.size(), k);
        for (int i = 1; i <= ideal; i++) {
            idcg += discount(i);
        }
        return idcg > 0 ? dcg / idcg : 0.0;
    }

    public static double meanReciprocalRank(List<Judgement> judgements) {
        if (isEmpty(judgements)) {
            return 0.0;
        }
        double total = 0.0;
        for (Judgement judgement : judgements) {
            Set<String> relevantSet = new HashSet<>(judgement.relevant());
            List<String> retrieved = judgement.retrieved();
            for (int i = 0; i < retrieved.size(); i++) {
                if (relevantSet.contains(retrieved.get(i))) {
                    total += 1.0 / (i + 1);
                    break;
                }
            }
        }
        return total / judgements.size();
    }

    /**
     * Mean average precision at k. Queries without relevant ids are left out of the mean.
     */
    public static double mapAtK(List<Judgement> judgements, int k) {
        if (isEmpty(judgements)) {
            return 0.0;
        }
        double total = 0.0;
        int counted = 0;
        for (Judgement judgement : judgements) {
            Set<String> relevantSet = new HashSet<>(judgement.relevant());
            if (relevantSet.isEmpty()) {
                continue;
            }
            List<String> ranked = top(judgement.retrieved(), k);
            double precisionSum = 0.0;
            int found = 0;
            for (int i = 0; i < ranked.size(); i++) {
                if (relevantSet.contains(ranked.get(i))) {
                    found++;
                    precisionSum += (double) found / (i + 1);
                }
            }
            total += precisionSum / relevantSet.size();
            counted++;
        }
        return counted == 0 ? 0.0 : total / counted;
    }

    public static Map<String, Double> summarize(List<String> retrieved, List<String> relevant, int k) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("precision@" + k, precisionAtK(retrieved, relevant, k));
        metrics.put("recall@" + k, recallAtK(retrieved, relevant, k));
        metrics.put("ndcg@" + k, ndcgAtK(retrieved, relevant, k));
        return metrics;
    }

    private static double discount(int rank) {
        return 1.0 / (Math.log(rank + 1) / Math.log(2));
    }

    private static List<String> top(List<String> retrieved, int k) {
        if (k <= 0) {
            return List.of();
        }
        return retrieved.subList(0, Math.min(k, retrieved.size()));
    }

    private static int hits(List<String> ranked, Set<String> relevant) {
        int hits = 0;
        for (String id : ranked) {
            if (relevant.contains(id)) {
                hits++;
            }
        }
        return hits;
    }

    private static boolean isEmpty(List<?> values) {
        return values == null || values.isEmpty();
    }
}
