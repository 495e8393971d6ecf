package com.github.dimitryivaniuta.gatekeeper.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.AbstractCacheManager;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Caffeine CacheManager with a configured expireAfterWrite per cache name.
 *
 * Names without a configured TTL use the default TTL. TTLs are clamped to [1s, 24h].
 * Caffeine builders are mutable, so a fresh builder is taken from the supplier for every cache.
 */
public final class TtlCaffeineCacheManager extends AbstractCacheManager {

    static final Duration MIN_TTL = Duration.ofSeconds(1);
    static final Duration MAX_TTL = Duration.ofHours(24);

    private final Supplier<Caffeine<Object, Object>> baseBuilderFactory;
    private final Map<String, Duration> ttlByName;
    private final Duration defaultTtl;
    private final Map<String, Cache> cacheMap = new ConcurrentHashMap<>();

    public TtlCaffeineCacheManager(Supplier<Caffeine<Object, Object>> baseBuilderFactory,
                                   Map<String, Duration> ttlByName,
                                   Duration defaultTtl) {
        this.baseBuilderFactory = Objects.requireNonNull(baseBuilderFactory, "baseBuilderFactory must not be null");
        this.ttlByName = Map.copyOf(ttlByName);
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl must not be null");
    }

    @Override
    protected Collection<? extends Cache> loadCaches() {
        // created lazily in getMissingCache(...)
        return List.of();
    }

    @Override
    protected Cache getMissingCache(String name) {
        return cacheMap.computeIfAbsent(name, this::createCache);
    }

    Duration ttlFor(String name) {
        return clamp(ttlByName.getOrDefault(name, defaultTtl));
    }

    private Cache createCache(String name) {
        Caffeine<Object, Object> builder = baseBuilderFactory.get();
        builder = builder.expireAfterWrite(ttlFor(name));
        return new CaffeineCache(name, builder.build());
    }

    private static Duration clamp(Duration ttl) {
        if (ttl == null || ttl.compareTo(MIN_TTL) < 0) return MIN_TTL;
        return ttl.compareTo(MAX_TTL) > 0 ? MAX_TTL : ttl;
    }
}
