package com.example.demo.batchpdf.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine-backed caches. Stats are always recorded so the admin endpoint can report them.
 * The caches are unbounded: a converted template stays cached until shutdown.
 */
@Configuration
@EnableCaching
public class CacheConfiguration {
    public static final String NORMALIZED_TEMPLATES = "normalizedTemplates";

    @Bean
    public CacheManager cacheManager() {
        return newCacheManager();
    }

    /**
     * Also used directly by unit tests that construct services without a Spring context.
     */
    public static CaffeineCacheManager newCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager(NORMALIZED_TEMPLATES);
        manager.setCaffeine(Caffeine.newBuilder().recordStats());
        return manager;
    }
}
