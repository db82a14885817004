package com.tsl.search.cache;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@EnableConfigurationProperties(SearchCacheProperties.class)
public class SearchCacheConfig {
    private static final Logger logger = LoggerFactory.getLogger(SearchCacheConfig.class);

    @Bean
    public SearchCacheStore searchCacheStore(
        SearchCacheProperties properties,
        ObjectProvider<StringRedisTemplate> redisProvider
    ) {
        if (properties.getStore() == CacheStoreType.REDIS) {
            StringRedisTemplate redis = redisProvider.getIfAvailable();
            if (redis != null) {
                return new RedisSearchCacheStore(redis);
            }
            logger.warn("search_cache_redis_missing fallback=memory");
        }
        return new InMemorySearchCacheStore(properties.getMaxEntries(), Clock.systemUTC());
    }
}
