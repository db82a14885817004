package com.tsl.search.evaluation;

import com.tsl.search.model.CandidateRecord;
import com.tsl.search.ranking.CandidateReranker;
import com.tsl.search.ranking.RerankOutcome;
import com.tsl.search.retrieval.CandidateRetriever;
import com.tsl.search.retrieval.RetrievalResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Replays judged queries through retrieval alone and through retrieval plus rerank, then reports
 * the averaged quality metrics of both runs side by side. Bypasses the result cache.
 */
@Component
public class RerankEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(RerankEvaluator.class);

    static final List<Integer> K_VALUES = List.of(1, 3, 5);
    static final int MAP_K = 5;

    private final CandidateRetriever retriever;
    private final CandidateReranker reranker;

    public RerankEvaluator(CandidateRetriever retriever, CandidateReranker reranker) {
        this.retriever = retriever;
        this.reranker = reranker;
    }

    public RerankEvaluationReport evaluate(List<JudgedQuery> queries, int topK) {
        List<JudgedQuery> judged = queries == null ? List.of() : queries;
        List<SearchQualityMetrics.Judgement> baseline = new ArrayList<>(judged.size());
        List<SearchQualityMetrics.Judgement> reranked = new ArrayList<>(judged.size());

        for (JudgedQuery judgedQuery : judged) {
            String query = judgedQuery.getQuery() == null || judgedQuery.getQuery().isBlank()
                ? null
                : judgedQuery.getQuery().trim();
            List<String> relevant = judgedQuery.getRelevantCandidates();
            RetrievalResult retrieval = retriever.retrieve(query, judgedQuery.toFilterSet(), topK);
            List<CandidateRecord> candidates = retrieval.getCandidates();

            List<String> baselineIds = ids(candidates.subList(0, Math.min(topK, candidates.size())));
            List<String> rerankedIds = baselineIds;
            if (query != null && !candidates.isEmpty()) {
                RerankOutcome outcome = reranker.rerank(query, candidates, topK);
                rerankedIds = ids(outcome.getCandidates());
            }
            baseline.add(new SearchQualityMetrics.Judgement(baselineIds, relevant));
            reranked.add(new SearchQualityMetrics.Judgement(rerankedIds, relevant));
        }

        Map<String, Double> withoutReranker = aggregate(baseline);
        Map<String, Double> withReranker = aggregate(reranked);
        Map<String, Double> improvements = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : withoutReranker.entrySet()) {
            double before = entry.getValue();
            double after = withReranker.get(entry.getKey());
            improvements.put(entry.getKey(), before > 0 ? (after - before) / before * 100.0 : 0.0);
        }
        logger.info(
            "rerank_evaluation_done queries={} top_k={} without={} with={}",
            judged.size(),
            topK,
            withoutReranker,
            withReranker
        );
        return new RerankEvaluationReport(judged.size(), withoutReranker, withReranker, improvements, baseline, reranked);
    }

    static Map<String, Double> aggregate(List<SearchQualityMetrics.Judgement> judgements) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        for (int k : K_VALUES) {
            double precision = 0.0;
            double recall = 0.0;
            double ndcg = 0.0;
            for (SearchQualityMetrics.Judgement judgement : judgements) {
                precision += SearchQualityMetrics.precisionAtK(judgement.retrieved(), judgement.relevant(), k);
                recall += SearchQualityMetrics.recallAtK(judgement.retrieved(), judgement.relevant(), k);
                ndcg += SearchQualityMetrics.ndcgAtK(judgement.retrieved(), judgement.relevant(), k);
            }
            int count = judgements.size();
            metrics.put("precision@" + k, count == 0 ? 0.0 : precision / count);
            metrics.put("recall@" + k, count == 0 ? 0.0 : recall / count);
            metrics.put("ndcg@" + k, count == 0 ? 0.0 : ndcg / count);
        }
        metrics.put("mrr", SearchQualityMetrics.meanReciprocalRank(judgements));
        metrics.put("map@" + MAP_K, SearchQualityMetrics.mapAtK(judgements, MAP_K));
        return metrics;
    }

    private static List<String> ids(List<CandidateRecord> candidates) {
        List<String> ids = new ArrayList<>(candidates.size());
        for (CandidateRecord candidate : candidates) {
            ids.add(candidate.getId());
        }
        return ids;
    }
}
