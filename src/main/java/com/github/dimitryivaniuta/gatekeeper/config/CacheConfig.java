package com.github.dimitryivaniuta.gatekeeper.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.gatekeeper.cache.TtlCaffeineCacheManager;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;

/**
 * Local Caffeine caches. Each named cache gets its own TTL from configuration.
 */
@Configuration
public class CacheConfig {

    public static final String API_KEY_LOOKUP = "apiKeyLookup";

    @Bean
    public CacheManager cacheManager(GatekeeperProperties properties) {
        return new TtlCaffeineCacheManager(
                () -> Caffeine.newBuilder()
                        .maximumSize(50_000)
                        .recordStats(),
                Map.of(API_KEY_LOOKUP, properties.getKeyStore().getLookupCacheTtl()),
                Duration.ofMinutes(10)
        );
    }
}
