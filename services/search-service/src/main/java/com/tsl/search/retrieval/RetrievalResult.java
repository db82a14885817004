package com.tsl.search.retrieval;

import com.tsl.search.model.CandidateRecord;
import java.util.List;

public class RetrievalResult {
    private final List<CandidateRecord> candidates;
    private final int requestedLimit;
    private final boolean error;
    private final boolean skipped;
    private final long tookMs;
    private final String reason;

    private RetrievalResult(
        List<CandidateRecord> candidates,
        int requestedLimit,
        boolean error,
        boolean skipped,
        long tookMs,
        String reason
    ) {
        this.candidates = candidates == null ? List.of() : List.copyOf(candidates);
        this.requestedLimit = requestedLimit;
        this.error = error;
        this.skipped = skipped;
        this.tookMs = tookMs;
        this.reason = reason;
    }

    public static RetrievalResult success(List<CandidateRecord> candidates, int requestedLimit, long tookMs) {
        return new RetrievalResult(candidates, requestedLimit, false, false, tookMs, null);
    }

    public static RetrievalResult error(String reason, int requestedLimit) {
        return new RetrievalResult(List.of(), requestedLimit, true, false, 0L, reason);
    }

    public static RetrievalResult skipped(String reason) {
        return new RetrievalResult(List.of(), 0, true, true, 0L, reason);
    }

    public List<CandidateRecord> getCandidates() {
        return candidates;
    }

    public int getRequestedLimit() {
        return requestedLimit;
    }

    public boolean isError() {
        return error;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public long getTookMs() {
        return tookMs;
    }

    public String getReason() {
        return reason;
    }
}
