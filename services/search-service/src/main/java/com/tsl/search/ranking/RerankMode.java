package com.tsl.search.ranking;

public enum RerankMode {
    HTTP,
    TOY
}
