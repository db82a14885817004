package com.tsl.search.ranking;

public class RankingUnavailableException extends RuntimeException {
    public RankingUnavailableException(String message) {
        super(message);
    }

    public RankingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
