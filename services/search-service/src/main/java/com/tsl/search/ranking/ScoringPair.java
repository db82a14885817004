package com.tsl.search.ranking;

public record ScoringPair(String query, String text) {}
