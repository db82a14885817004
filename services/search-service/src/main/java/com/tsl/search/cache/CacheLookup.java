package com.tsl.search.cache;

import com.tsl.search.model.CandidateRecord;
import java.util.List;

public class CacheLookup {
    public enum Status {
        HIT,
        MISS,
        UNAVAILABLE
    }

    private static final CacheLookup MISS = new CacheLookup(Status.MISS, List.of(), null);

    private final Status status;
    private final List<CandidateRecord> results;
    private final String reason;

    private CacheLookup(Status status, List<CandidateRecord> results, String reason) {
        this.status = status;
        this.results = results;
        this.reason = reason;
    }

    public static CacheLookup hit(List<CandidateRecord> results) {
        return new CacheLookup(Status.HIT, List.copyOf(results), null);
    }

    public static CacheLookup miss() {
        return MISS;
    }

    public static CacheLookup unavailable(String reason) {
        return new CacheLookup(Status.UNAVAILABLE, List.of(), reason);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isHit() {
        return status == Status.HIT;
    }

    public List<CandidateRecord> getResults() {
        return results;
    }

    public String getReason() {
        return reason;
    }
}
