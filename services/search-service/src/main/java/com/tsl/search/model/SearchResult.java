package com.tsl.search.model;

import java.util.List;

public class SearchResult {
    private final List<CandidateRecord> results;
    private final boolean cached;

    public SearchResult(List<CandidateRecord> results, boolean cached) {
        this.results = results == null ? List.of() : List.copyOf(results);
        this.cached = cached;
    }

    public static SearchResult empty() {
        return new SearchResult(List.of(), false);
    }

    public List<CandidateRecord> getResults() {
        return results;
    }

    public boolean isCached() {
        return cached;
    }
}
