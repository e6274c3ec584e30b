package com.snapshotclaim.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches.
 * The redistribution cache is keyed by claim store generation; stale generations age out by size and TTL.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String REDISTRIBUTION_CACHE = "redistributionCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(REDISTRIBUTION_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(30, TimeUnit.SECONDS)
                .maximumSize(4)
                .build());
        return manager;
    }
}
