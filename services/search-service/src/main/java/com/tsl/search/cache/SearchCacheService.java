package com.tsl.search.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsl.search.model.CandidateRecord;
import com.tsl.search.model.FilterSet;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cache-aside layer for search results, keyed by a fingerprint of the query and its filters.
 *
 * <p>Every failure of the backing store is logged and reported as a miss (reads), {@code false}
 * (writes), {@code 0} (invalidation) or unavailable stats; nothing is rethrown.
 */
@Service
public class SearchCacheService {
    private static final Logger logger = LoggerFactory.getLogger(SearchCacheService.class);
    private static final TypeReference<List<CandidateRecord>> LIST_TYPE = new TypeReference<>() {};

    private final SearchCacheStore store;
    private final ObjectMapper objectMapper;
    private final SearchCacheProperties properties;

    public SearchCacheService(SearchCacheStore store, ObjectMapper objectMapper, SearchCacheProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public String fingerprint(String query, FilterSet filters) {
        return fingerprint(query, filters == null ? Map.of() : filters.asMap());
    }

    /**
     * {@code prefix + sha256({"filters":{...sorted...},"query":"..."})}. Filter insertion order does
     * not matter; a missing query hashes like the empty string.
     */
    public String fingerprint(String query, Map<String, ?> filters) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("filters", filters == null ? new TreeMap<>() : new TreeMap<>(filters));
        canonical.put("query", query == null ? "" : query);
        String hash = CacheKeyUtil.hashJson(objectMapper, canonical);
        if (hash == null) {
            throw new IllegalArgumentException("filters are not serializable");
        }
        return properties.getKeyPrefix() + hash;
    }

    public CacheLookup lookup(String query, FilterSet filters) {
        if (!properties.isEnabled()) {
            return CacheLookup.miss();
        }
        String key = fingerprint(query, filters);
        try {
            Optional<String> payload = store.get(key);
            if (payload.isEmpty() || payload.get().isBlank()) {
                logger.debug("search_cache_miss key={}", key);
                return CacheLookup.miss();
            }
            List<CandidateRecord> results = objectMapper.readValue(payload.get(), LIST_TYPE);
            logger.debug("search_cache_hit key={} results={}", key, results.size());
            return CacheLookup.hit(results);
        } catch (Exception ex) {
            logger.error("search_cache_read_failed key={} store={} reason={}", key, store.name(), ex.getMessage());
            return CacheLookup.unavailable(ex.getClass().getSimpleName());
        }
    }

    public Optional<List<CandidateRecord>> get(String query, FilterSet filters) {
        CacheLookup lookup = lookup(query, filters);
        return lookup.isHit() ? Optional.of(lookup.getResults()) : Optional.empty();
    }

    public boolean put(String query, FilterSet filters, List<CandidateRecord> results) {
        return put(query, filters, results, Duration.ofSeconds(properties.getTtlSeconds()));
    }

    public boolean put(String query, FilterSet filters, List<CandidateRecord> results, Duration ttl) {
        if (!properties.isEnabled() || results == null || results.isEmpty()) {
            return false;
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        String key = fingerprint(query, filters);
        try {
            String payload = objectMapper.writeValueAsString(results);
            store.set(key, payload, ttl);
            logger.debug("search_cache_put key={} results={} ttl_s={}", key, results.size(), ttl.getSeconds());
            return true;
        } catch (Exception ex) {
            logger.error("search_cache_write_failed key={} store={} reason={}", key, store.name(), ex.getMessage());
            return false;
        }
    }

    public long invalidate() {
        return invalidate(null);
    }

    public long invalidate(String pattern) {
        String effective = pattern == null || pattern.isBlank() ? defaultPattern() : pattern;
        try {
            long deleted = store.deleteMatching(effective, properties.getScanCount());
            logger.info("search_cache_invalidated pattern={} deleted={}", effective, deleted);
            return deleted;
        } catch (Exception ex) {
            logger.error("search_cache_invalidate_failed pattern={} reason={}", effective, ex.getMessage());
            return 0L;
        }
    }

    public CacheStats stats() {
        try {
            SearchCacheStore.CommandStats commandStats = store.commandStats();
            long keyCount = store.countMatching(defaultPattern(), properties.getScanCount());
            return CacheStats.of(commandStats.hits(), commandStats.misses(), keyCount);
        } catch (Exception ex) {
            logger.error("search_cache_stats_failed store={} reason={}", store.name(), ex.getMessage());
            return CacheStats.unavailable();
        }
    }

    private String defaultPattern() {
        return properties.getKeyPrefix() + "*";
    }
}
