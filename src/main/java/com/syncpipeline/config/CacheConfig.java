package com.syncpipeline.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.syncpipeline.model.RawRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine cache backing the local record store.
 *
 * Size-bounded only: synced records do not expire, the oldest are evicted once
 * the store holds more than {@code app.store.max-size} ids.
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Value("${app.store.max-size:100000}")
    private long storeMaxSize;

    @Bean
    public Cache<String, RawRecord> recordCache() {
        log.info("Creating record store cache: maxSize={}", storeMaxSize);
        return Caffeine.newBuilder()
                .maximumSize(storeMaxSize)
                .recordStats()
                .build();
    }
}
