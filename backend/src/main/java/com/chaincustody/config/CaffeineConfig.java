package com.chaincustody.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    /** Explorer/API transaction lists keyed by (address, chain); 30 minute expiry. */
    public static final String OBSERVED_TRANSACTION_CACHE = "observedTransactionCache";
    public static final String ACCOUNT_ACTIVATION_CACHE = "accountActivationCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(OBSERVED_TRANSACTION_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(30, TimeUnit.MINUTES)
                .maximumSize(10_000)
                .build());
        manager.registerCustomCache(ACCOUNT_ACTIVATION_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(5_000)
                .build());
        return manager;
    }
}
