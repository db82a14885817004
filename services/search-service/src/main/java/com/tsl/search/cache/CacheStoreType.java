package com.tsl.search.cache;

public enum CacheStoreType {
    REDIS,
    MEMORY
}
