package com.tsl.search.api.dto;

import com.tsl.search.model.CandidateRecord;
import java.util.List;

public class SearchResponse {
    private List<CandidateRecord> results;
    private boolean cached;

    public SearchResponse() {
    }

    public SearchResponse(List<CandidateRecord> results, boolean cached) {
        this.results = results;
        this.cached = cached;
    }

    public List<CandidateRecord> getResults() {
        return results;
    }

    public void setResults(List<CandidateRecord> results) {
        this.results = results;
    }

    public boolean isCached() {
        return cached;
    }

    public void setCached(boolean cached) {
        this.cached = cached;
    }
}
