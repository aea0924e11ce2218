package com.carhire.rental.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.SimpleCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caching configuration using Caffeine (in-process cache).
 *
 * Caches defined:
 *
 *   vehicleCatalog: categories, brands and features. Read on every vehicle
 *                    listing and search form, changed only by staff.
 *                    TTL: 60 minutes. Max entries: 20.
 *
 *   bookingExtras:  active add-ons and payment methods, read on every
 *                    booking and checkout screen.
 *                    TTL: 30 minutes. Max entries: 10.
 *
 * Eviction:
 *   1. Explicit → CatalogCacheService evicts on every catalogue write.
 *   2. TTL      → expireAfterWrite bounds staleness from direct DB edits.
 *   3. Size     → maximumSize caps memory.
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfig {

    public static final String CACHE_VEHICLE_CATALOG = "vehicleCatalog";

    public static final String CACHE_BOOKING_EXTRAS = "bookingExtras";

    @Bean
    public CacheManager cacheManager() {
        log.info("[CACHE] Initialising Caffeine CacheManager: caches '{}', '{}'",
                CACHE_VEHICLE_CATALOG, CACHE_BOOKING_EXTRAS);

        SimpleCacheManager manager = new SimpleCacheManager();
        manager.setCaches(List.of(
                buildCache(CACHE_VEHICLE_CATALOG, 60, 20),
                buildCache(CACHE_BOOKING_EXTRAS,  30, 10)
        ));
        return manager;
    }

    private CaffeineCache buildCache(String name, int ttlMinutes, int maxSize) {
        return new CaffeineCache(name,
                Caffeine.newBuilder()
                        .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
                        .maximumSize(maxSize)
                        .recordStats()
                        .build());
    }
}
