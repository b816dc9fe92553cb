package com.chartsignal.backend.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
@EnableCaching
public class CacheConfig {

    public static final String CANDLE_CACHE = "candleCache";

    @Value("${analysis.cache.candle-ttl-seconds:60}")
    private long candleTtlSeconds;

    @Value("${analysis.cache.candle-max-entries:500}")
    private long candleMaxEntries;

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(CANDLE_CACHE);
        // Candles for the open bar change every tick, keep the expiry short
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .initialCapacity(50)
                .maximumSize(candleMaxEntries)
                .expireAfterWrite(candleTtlSeconds, TimeUnit.SECONDS)
                .recordStats());
        return cacheManager;
    }
}
