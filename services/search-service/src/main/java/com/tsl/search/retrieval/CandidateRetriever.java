package com.tsl.search.retrieval;

import com.tsl.search.embed.EmbeddingProvider;
import com.tsl.search.embed.EmbeddingUnavailableException;
import com.tsl.search.model.CandidateRecord;
import com.tsl.search.model.FilterSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Hybrid filter + vector retrieval. Never throws for upstream failures; an unavailable embedding
 * provider or store yields an empty result that carries the reason.
 */
@Component
public class CandidateRetriever {
    private static final Logger logger = LoggerFactory.getLogger(CandidateRetriever.class);

    private final HybridQueryBuilder queryBuilder;
    private final CandidateRepository repository;
    private final CandidateRowDecoder rowDecoder;
    private final EmbeddingProvider embeddingProvider;
    private final RetrievalProperties properties;

    public CandidateRetriever(
        HybridQueryBuilder queryBuilder,
        CandidateRepository repository,
        CandidateRowDecoder rowDecoder,
        EmbeddingProvider embeddingProvider,
        RetrievalProperties properties
    ) {
        this.queryBuilder = queryBuilder;
        this.repository = repository;
        this.rowDecoder = rowDecoder;
        this.embeddingProvider = embeddingProvider;
        this.properties = properties;
    }

    public RetrievalResult retrieve(String query, FilterSet filters, int topK) {
        if (topK <= 0) {
            return RetrievalResult.success(List.of(), 0, 0L);
        }
        boolean similarity = query != null && !query.isBlank();
        int limit = similarity ? topK * Math.max(1, properties.getOverFetchFactor()) : topK;

        List<Double> queryVector = null;
        if (similarity) {
            try {
                queryVector = embeddingProvider.embed(query);
            } catch (EmbeddingUnavailableException e) {
                logger.error("candidate_retrieval_embed_failed reason={}", e.getMessage());
                return RetrievalResult.skipped("embed_unavailable");
            } catch (RuntimeException e) {
                logger.error("candidate_retrieval_embed_failed reason={}", e.getMessage(), e);
                return RetrievalResult.skipped("embed_unavailable");
            }
        }

        HybridQuery hybridQuery = queryBuilder.build(filters, queryVector, limit);
        long started = System.nanoTime();
        List<Map<String, Object>> rows;
        try {
            rows = repository.findCandidates(hybridQuery);
        } catch (DataAccessException e) {
            logger.error("candidate_retrieval_store_failed limit={} reason={}", limit, e.getMessage());
            return RetrievalResult.error("store_unavailable", limit);
        } catch (RuntimeException e) {
            logger.error("candidate_retrieval_store_failed limit={} reason={}", limit, e.getMessage(), e);
            return RetrievalResult.error("store_error", limit);
        }

        List<CandidateRecord> candidates = new ArrayList<>(rows == null ? 0 : rows.size());
        if (rows != null) {
            for (Map<String, Object> row : rows) {
                candidates.add(rowDecoder.decode(row));
            }
        }
        long tookMs = (System.nanoTime() - started) / 1_000_000L;
        logger.debug(
            "candidate_retrieval_done similarity={} filters={} limit={} rows={} took_ms={}",
            similarity,
            filters,
            limit,
            candidates.size(),
            tookMs
        );
        return RetrievalResult.success(candidates, limit, tookMs);
    }
}
