package com.github.dimitryivaniuta.gatekeeper.identity;

import com.github.dimitryivaniuta.gatekeeper.metrics.GatekeeperMetrics;
import io.jsonwebtoken.security.Jwk;
import io.jsonwebtoken.security.JwkSet;
import io.jsonwebtoken.security.Jwks;
import lombok.extern.slf4j.Slf4j;

import java.security.Key;
import java.security.PrivateKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * JWKS-backed key provider. The key set is an immutable map swapped atomically on every successful
 * refresh; a failed or empty refresh keeps the last-known set. An unknown {@code kid} triggers at most
 * one on-demand refresh per cooldown.
 */
@Slf4j
public class JwksVerificationKeyProvider implements VerificationKeyProvider {

    private final JwksClient client;
    private final Clock clock;
    private final Duration refreshCooldown;
    private final GatekeeperMetrics metrics;

    private final AtomicReference<Map<String, Key>> keys = new AtomicReference<>(Map.of());
    private final AtomicReference<Instant> lastOnDemandRefresh = new AtomicReference<>();

    public JwksVerificationKeyProvider(JwksClient client, Clock clock, Duration refreshCooldown,
                                       GatekeeperMetrics metrics) {
        this.client = client;
        this.clock = clock;
        this.refreshCooldown = refreshCooldown;
        this.metrics = metrics;
    }

    @Override
    public Map<String, Key> currentKeys() {
        return keys.get();
    }

    @Override
    public Optional<Key> keyFor(String keyId) {
        Optional<Key> found = lookup(keys.get(), keyId);
        if (found.isPresent() || !claimOnDemandRefresh()) {
            return found;
        }
        log.info("Unknown verification key id '{}', refreshing JWKS", keyId);
        refresh();
        return lookup(keys.get(), keyId);
    }

    @Override
    public boolean refresh() {
        Map<String, Key> parsed;
        try {
            parsed = parse(client.fetch());
        } catch (RuntimeException ex) {
            log.warn("JWKS refresh from {} failed, keeping {} known keys: {}",
                    client.url(), keys.get().size(), ex.getMessage());
            metrics.verificationKeyRefreshFailed();
            return false;
        }
        if (parsed.isEmpty()) {
            log.warn("JWKS from {} contained no usable keys, keeping {} known keys", client.url(), keys.get().size());
            metrics.verificationKeyRefreshFailed();
            return false;
        }
        keys.set(parsed);
        log.debug("Loaded {} verification keys from {}", parsed.size(), client.url());
        return true;
    }

    static Map<String, Key> parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("empty JWKS document");
        }
        JwkSet set = Jwks.setParser().build().parse(json);
        Map<String, Key> out = new LinkedHashMap<>();
        for (Jwk<?> jwk : set.getKeys()) {
            Key key = jwk.toKey();
            if (jwk.getId() == null || key instanceof PrivateKey) continue;
            out.put(jwk.getId(), key);
        }
        return Collections.unmodifiableMap(out);
    }

    private static Optional<Key> lookup(Map<String, Key> snapshot, String keyId) {
        if (keyId == null) {
            return snapshot.size() == 1 ? snapshot.values().stream().findFirst() : Optional.empty();
        }
        return Optional.ofNullable(snapshot.get(keyId));
    }

    private boolean claimOnDemandRefresh() {
        Instant now = clock.instant();
        Instant last = lastOnDemandRefresh.get();
        if (last != null && now.isBefore(last.plus(refreshCooldown))) {
            return false;
        }
        return lastOnDemandRefresh.compareAndSet(last, now);
    }
}
