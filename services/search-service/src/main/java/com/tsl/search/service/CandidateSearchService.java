package com.tsl.search.service;

import com.tsl.search.cache.CacheLookup;
import com.tsl.search.cache.CacheStats;
import com.tsl.search.cache.SearchCacheService;
import com.tsl.search.model.CandidateRecord;
import com.tsl.search.model.FilterSet;
import com.tsl.search.model.SearchResult;
import com.tsl.search.ranking.CandidateReranker;
import com.tsl.search.ranking.RerankOutcome;
import com.tsl.search.retrieval.CandidateRetriever;
import com.tsl.search.retrieval.RetrievalProperties;
import com.tsl.search.retrieval.RetrievalResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cache lookup, then retrieval, then rerank (only when a query is present), then cache population.
 * Upstream failures degrade to fewer or unranked results; only invalid input is thrown.
 */
@Service
public class CandidateSearchService {
    private static final Logger logger = LoggerFactory.getLogger(CandidateSearchService.class);

    static final String CACHE_METRIC = "tsl_search_cache_total";
    static final String RERANK_METRIC = "tsl_search_rerank_total";
    static final String RETRIEVAL_METRIC = "tsl_search_retrieval_total";

    private final SearchCacheService cacheService;
    private final CandidateRetriever retriever;
    private final CandidateReranker reranker;
    private final RetrievalProperties retrievalProperties;
    private final MeterRegistry meterRegistry;

    public CandidateSearchService(
        SearchCacheService cacheService,
        CandidateRetriever retriever,
        CandidateReranker reranker,
        RetrievalProperties retrievalProperties,
        MeterRegistry meterRegistry
    ) {
        this.cacheService = cacheService;
        this.retriever = retriever;
        this.reranker = reranker;
        this.retrievalProperties = retrievalProperties;
        this.meterRegistry = meterRegistry;
    }

    public SearchResult search(String query, FilterSet filters, int topK) {
        int maxTopK = retrievalProperties.getMaxTopK();
        if (topK < 1 || topK > maxTopK) {
            throw new InvalidSearchRequestException("top_k must be between 1 and " + maxTopK);
        }
        String normalizedQuery = query == null || query.isBlank() ? null : query.trim();
        FilterSet effectiveFilters = filters == null ? FilterSet.none() : filters;

        CacheLookup lookup = cacheService.lookup(normalizedQuery, effectiveFilters);
        meterRegistry.counter(CACHE_METRIC, "result", lookup.getStatus().name().toLowerCase(Locale.ROOT)).increment();
        if (lookup.isHit()) {
            List<CandidateRecord> cached = lookup.getResults();
            return new SearchResult(cached.subList(0, Math.min(topK, cached.size())), true);
        }

        RetrievalResult retrieval = retriever.retrieve(normalizedQuery, effectiveFilters, topK);
        meterRegistry.counter(RETRIEVAL_METRIC, "outcome", retrievalOutcome(retrieval)).increment();
        if (retrieval.isEmpty()) {
            if (retrieval.isError()) {
                logger.warn("candidate_search_degraded reason={}", retrieval.getReason());
            }
            return SearchResult.empty();
        }

        List<CandidateRecord> results;
        if (normalizedQuery == null) {
            List<CandidateRecord> candidates = retrieval.getCandidates();
            results = candidates.subList(0, Math.min(topK, candidates.size()));
        } else {
            RerankOutcome outcome = reranker.rerank(normalizedQuery, retrieval.getCandidates(), topK);
            meterRegistry.counter(RERANK_METRIC, "outcome", outcome.isApplied() ? "applied" : "fallback").increment();
            results = outcome.getCandidates();
        }

        cacheService.put(normalizedQuery, effectiveFilters, results);
        logger.info(
            "candidate_search_done query_present={} filters={} top_k={} results={}",
            normalizedQuery != null,
            effectiveFilters,
            topK,
            results.size()
        );
        return new SearchResult(results, false);
    }

    public long invalidateCache(String pattern) {
        return cacheService.invalidate(pattern);
    }

    public CacheStats cacheStats() {
        return cacheService.stats();
    }

    private static String retrievalOutcome(RetrievalResult retrieval) {
        if (retrieval.isSkipped()) {
            return "skipped";
        }
        if (retrieval.isError()) {
            return "error";
        }
        return retrieval.isEmpty() ? "empty" : "success";
    }
}
