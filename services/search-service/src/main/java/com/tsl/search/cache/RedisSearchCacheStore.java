package com.tsl.search.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed store. Pattern operations use {@code SCAN MATCH ... COUNT n} and never {@code KEYS};
 * hit/miss figures come from the server's {@code INFO stats} section.
 */
public class RedisSearchCacheStore implements SearchCacheStore {
    static final String KEYSPACE_HITS = "keyspace_hits";
    static final String KEYSPACE_MISSES = "keyspace_misses";

    private final StringRedisTemplate redis;

    public RedisSearchCacheStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public void set(String key, String payload, Duration ttl) {
        redis.opsForValue().set(key, payload, ttl);
    }

    @Override
    public long deleteMatching(String pattern, int scanCount) {
        int batchSize = Math.max(1, scanCount);
        long deleted = 0;
        List<String> batch = new ArrayList<>(batchSize);
        try (Cursor<String> cursor = redis.scan(scanOptions(pattern, batchSize))) {
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() >= batchSize) {
                    deleted += deleteBatch(batch);
                }
            }
        }
        deleted += deleteBatch(batch);
        return deleted;
    }

    @Override
    public long countMatching(String pattern, int scanCount) {
        long count = 0;
        try (Cursor<String> cursor = redis.scan(scanOptions(pattern, Math.max(1, scanCount)))) {
            while (cursor.hasNext()) {
                cursor.next();
                count++;
            }
        }
        return count;
    }

    @Override
    public CommandStats commandStats() {
        Properties info = redis.execute((RedisCallback<Properties>) connection -> connection.serverCommands().info("stats"));
        if (info == null) {
            return new CommandStats(0L, 0L);
        }
        return new CommandStats(parseLong(info.getProperty(KEYSPACE_HITS)), parseLong(info.getProperty(KEYSPACE_MISSES)));
    }

    @Override
    public String name() {
        return "redis";
    }

    private long deleteBatch(List<String> batch) {
        if (batch.isEmpty()) {
            return 0L;
        }
        Long removed = redis.delete(new ArrayList<>(batch));
        batch.clear();
        return removed == null ? 0L : removed;
    }

    private static ScanOptions scanOptions(String pattern, int count) {
        return ScanOptions.scanOptions().match(pattern).count(count).build();
    }

    private static long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return 0L;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
