package com.tsl.search.ranking;

import com.tsl.search.model.CandidateRecord;
import com.tsl.search.resilience.CircuitBreaker;
import com.tsl.search.resilience.SearchResilienceRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Second-stage reranking. Scores every retrieved candidate against the query, orders by score
 * (ties keep retrieval order) and keeps the first {@code topK}. On any model failure the first
 * {@code topK} candidates are returned in retrieval order without scores.
 */
@Component
public class CandidateReranker {
    private static final Logger logger = LoggerFactory.getLogger(CandidateReranker.class);

    private final RerankModel rerankModel;
    private final CandidateTextBuilder textBuilder;
    private final ExecutorService rerankExecutor;
    private final SearchResilienceRegistry resilienceRegistry;
    private final RankingProperties properties;

    public CandidateReranker(
        RerankModel rerankModel,
        CandidateTextBuilder textBuilder,
        @Qualifier("rerankExecutor") ExecutorService rerankExecutor,
        SearchResilienceRegistry resilienceRegistry,
        RankingProperties properties
    ) {
        this.rerankModel = rerankModel;
        this.textBuilder = textBuilder;
        this.rerankExecutor = rerankExecutor;
        this.resilienceRegistry = resilienceRegistry;
        this.properties = properties;
    }

    public RerankOutcome rerank(String query, List<CandidateRecord> candidates, int topK) {
        if (candidates == null || candidates.isEmpty()) {
            return RerankOutcome.empty();
        }
        int limit = Math.max(0, Math.min(topK, candidates.size()));
        CircuitBreaker breaker = resilienceRegistry.getRerankBreaker();
        if (!breaker.allowRequest()) {
            return fallback(candidates, limit, "rerank_circuit_open");
        }

        List<ScoringPair> pairs = new ArrayList<>(candidates.size());
        for (CandidateRecord candidate : candidates) {
            pairs.add(new ScoringPair(query, textBuilder.build(candidate)));
        }

        long started = System.nanoTime();
        CompletableFuture<List<Double>> future = CompletableFuture.supplyAsync(
            () -> rerankModel.predict(pairs),
            rerankExecutor
        );
        List<Double> scores;
        try {
            int timeoutMs = properties.getTimeoutMs();
            scores = timeoutMs > 0 ? future.get(timeoutMs, TimeUnit.MILLISECONDS) : future.get();
        } catch (TimeoutException e) {
            future.cancel(true);
            breaker.recordFailure();
            return fallback(candidates, limit, "rerank_timeout");
        } catch (ExecutionException e) {
            breaker.recordFailure();
            return fallback(candidates, limit, errorMessage(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return fallback(candidates, limit, "rerank_interrupted");
        }

        if (scores == null || scores.size() != candidates.size()) {
            breaker.recordFailure();
            return fallback(candidates, limit, "rerank_score_count_mismatch");
        }
        breaker.recordSuccess();

        List<CandidateRecord> ranked = new ArrayList<>(candidates);
        for (int i = 0; i < ranked.size(); i++) {
            Double score = scores.get(i);
            ranked.get(i).setRerankScore(score == null ? Double.NEGATIVE_INFINITY : score);
        }
        // List.sort is stable, so equal scores keep retrieval order.
        ranked.sort(Comparator.comparingDouble(CandidateRecord::getRerankScore).reversed());
        long tookMs = (System.nanoTime() - started) / 1_000_000L;
        logger.debug(
            "candidate_rerank_done model={} candidates={} top_k={} took_ms={}",
            rerankModel.modelId(),
            candidates.size(),
            topK,
            tookMs
        );
        return RerankOutcome.applied(ranked.subList(0, limit), tookMs);
    }

    private RerankOutcome fallback(List<CandidateRecord> candidates, int limit, String reason) {
        logger.warn("candidate_rerank_fallback reason={} candidates={}", reason, candidates.size());
        return RerankOutcome.fallback(new ArrayList<>(candidates.subList(0, limit)), reason);
    }

    private static String errorMessage(ExecutionException e) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        if (cause instanceof RankingUnavailableException && cause.getMessage() != null) {
            return cause.getMessage();
        }
        return "rerank_error";
    }
}
