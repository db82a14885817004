package com.tsl.search.api;

import com.tsl.search.api.dto.CacheInvalidateResponse;
import com.tsl.search.api.dto.CacheStatsResponse;
import com.tsl.search.api.dto.ErrorResponse;
import com.tsl.search.api.dto.SearchRequest;
import com.tsl.search.api.dto.SearchResponse;
import com.tsl.search.evaluation.JudgedQuery;
import com.tsl.search.evaluation.RerankEvaluator;
import com.tsl.search.model.FilterSet;
import com.tsl.search.model.SearchResult;
import com.tsl.search.retrieval.RetrievalProperties;
import com.tsl.search.service.CandidateSearchService;
import com.tsl.search.service.InvalidSearchRequestException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    private static final String API_KEY_HEADER = "X-API-Key";

    private final CandidateSearchService searchService;
    private final SearchApiProperties apiProperties;
    private final RetrievalProperties retrievalProperties;
    private final RerankEvaluator rerankEvaluator;

    public SearchController(
        CandidateSearchService searchService,
        SearchApiProperties apiProperties,
        RetrievalProperties retrievalProperties,
        RerankEvaluator rerankEvaluator
    ) {
        this.searchService = searchService;
        this.apiProperties = apiProperties;
        this.retrievalProperties = retrievalProperties;
        this.rerankEvaluator = rerankEvaluator;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/search")
    public ResponseEntity<?> search(
        @RequestBody(required = false) SearchRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceIdHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestIdHeader);
        if (request == null) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "request body is required", traceId, requestId)
            );
        }

        int topK = request.getTopK() == null ? retrievalProperties.getDefaultTopK() : request.getTopK();
        try {
            FilterSet filters = FilterSet.of(request.getLocation(), request.getMinExperience());
            SearchResult result = searchService.search(request.getQuery(), filters, topK);
            return ResponseEntity.ok(new SearchResponse(result.getResults(), result.isCached()));
        } catch (InvalidSearchRequestException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), traceId, requestId)
            );
        }
    }

    @PostMapping("/cache/invalidate")
    public ResponseEntity<?> invalidateCache(
        @RequestParam(value = "pattern", required = false) String pattern,
        @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        ResponseEntity<ErrorResponse> denied = checkAdminKey(apiKey, traceIdHeader, requestIdHeader);
        if (denied != null) {
            return denied;
        }
        long deleted = searchService.invalidateCache(pattern);
        return ResponseEntity.ok(new CacheInvalidateResponse("success", deleted));
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<?> cacheStats(
        @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        ResponseEntity<ErrorResponse> denied = checkAdminKey(apiKey, traceIdHeader, requestIdHeader);
        if (denied != null) {
            return denied;
        }
        return ResponseEntity.ok(new CacheStatsResponse("success", searchService.cacheStats()));
    }

    @PostMapping("/evaluation/rerank")
    public ResponseEntity<?> evaluateRerank(
        @RequestBody(required = false) List<JudgedQuery> queries,
        @RequestParam(value = "top_k", required = false) Integer topKParam,
        @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        ResponseEntity<ErrorResponse> denied = checkAdminKey(apiKey, traceIdHeader, requestIdHeader);
        if (denied != null) {
            return denied;
        }
        String traceId = RequestIdUtil.resolveOrGenerate(traceIdHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestIdHeader);
        int topK = topKParam == null ? retrievalProperties.getDefaultTopK() : topKParam;
        if (queries == null || queries.isEmpty()) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "judged queries are required", traceId, requestId)
            );
        }
        if (topK < 1 || topK > retrievalProperties.getMaxTopK()) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse(
                    "bad_request",
                    "top_k must be between 1 and " + retrievalProperties.getMaxTopK(),
                    traceId,
                    requestId
                )
            );
        }
        try {
            return ResponseEntity.ok(rerankEvaluator.evaluate(queries, topK));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), traceId, requestId)
            );
        }
    }

    private ResponseEntity<ErrorResponse> checkAdminKey(String apiKey, String traceIdHeader, String requestIdHeader) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceIdHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestIdHeader);
        if (apiKey == null || apiKey.isBlank()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(
                new ErrorResponse("unauthorized", "X-API-Key header is required", traceId, requestId)
            );
        }
        String expected = apiProperties.getAdminApiKey();
        if (expected == null || expected.isBlank() || !constantTimeEquals(expected, apiKey)) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(
                new ErrorResponse("forbidden", "invalid API key", traceId, requestId)
            );
        }
        return null;
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            actual.getBytes(StandardCharsets.UTF_8)
        );
    }
}
