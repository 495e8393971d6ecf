package com.github.dimitryivaniuta.gatekeeper.keystore;

import com.github.dimitryivaniuta.gatekeeper.config.CacheConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.Optional;

/**
 * Key store over the {@code api_key} table. Hits and misses are cached briefly; failures are not.
 */
@Service
@RequiredArgsConstructor
public class JpaKeyStore implements KeyStore {

    private final ApiKeyRepository repo;
    private final CacheManager cacheManager;

    @Override
    @SuppressWarnings("unchecked")
    public Optional<KeyRecord> lookupByHash(String keyHash) {
        Cache cache = cacheManager.getCache(CacheConfig.API_KEY_LOOKUP);
        if (cache != null) {
            Optional<KeyRecord> cached = cache.get(keyHash, Optional.class);
            if (cached != null) return cached;
        }

        Optional<KeyRecord> loaded;
        try {
            loaded = repo.findByKeyHash(keyHash).map(ApiKey::toRecord);
        } catch (DataAccessException | TransactionException ex) {
            throw new KeyStoreUnavailableException("API key lookup failed", ex);
        }

        if (cache != null) cache.put(keyHash, loaded);
        return loaded;
    }
}
