package com.tsl.search.ranking;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic token-overlap scorer for local runs without a model server. The score is the share
 * of distinct query tokens that occur in the document.
 */
public class ToyCrossEncoder implements RerankModel {
    static final String MODEL_ID = "toy-overlap-v1";

    @Override
    public String modelId() {
        return MODEL_ID;
    }

    @Override
    public List<Double> predict(List<ScoringPair> pairs) {
        if (pairs == null || pairs.isEmpty()) {
            return List.of();
        }
        List<Double> scores = new ArrayList<>(pairs.size());
        for (ScoringPair pair : pairs) {
            scores.add(score(pair.query(), pair.text()));
        }
        return scores;
    }

    private static double score(String query, String text) {
        Set<String> queryTokens = tokenize(query);
        if (queryTokens.isEmpty()) {
            return 0.0;
        }
        Set<String> docTokens = tokenize(text);
        int matched = 0;
        for (String token : queryTokens) {
            if (docTokens.contains(token)) {
                matched++;
            }
        }
        return (double) matched / queryTokens.size();
    }

    private static Set<String> tokenize(String value) {
        Set<String> tokens = new LinkedHashSet<>();
        if (value == null) {
            return tokens;
        }
        for (String token : value.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}+#]+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
