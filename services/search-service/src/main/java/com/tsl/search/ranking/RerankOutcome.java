package com.tsl.search.ranking;

import com.tsl.search.model.CandidateRecord;
import java.util.List;

public class RerankOutcome {
    private final List<CandidateRecord> candidates;
    private final boolean applied;
    private final long tookMs;
    private final String reason;

    private RerankOutcome(List<CandidateRecord> candidates, boolean applied, long tookMs, String reason) {
        this.candidates = candidates == null ? List.of() : List.copyOf(candidates);
        this.applied = applied;
        this.tookMs = tookMs;
        this.reason = reason;
    }

    public static RerankOutcome applied(List<CandidateRecord> candidates, long tookMs) {
        return new RerankOutcome(candidates, true, tookMs, null);
    }

    public static RerankOutcome fallback(List<CandidateRecord> candidates, String reason) {
        return new RerankOutcome(candidates, false, 0L, reason);
    }

    public static RerankOutcome empty() {
        return new RerankOutcome(List.of(), false, 0L, "no_candidates");
    }

    public List<CandidateRecord> getCandidates() {
        return candidates;
    }

    public boolean isApplied() {
        return applied;
    }

    public boolean isFallback() {
        return !applied && reason != null && !"no_candidates".equals(reason);
    }

    public long getTookMs() {
        return tookMs;
    }

    public String getReason() {
        return reason;
    }
}
