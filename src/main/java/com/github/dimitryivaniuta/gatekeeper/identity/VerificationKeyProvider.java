package com.github.dimitryivaniuta.gatekeeper.identity;

import java.security.Key;
import java.util.Map;
import java.util.Optional;

/**
 * Source of public keys for signed-token verification, addressed by JWS {@code kid}.
 */
public interface VerificationKeyProvider {

    /** Immutable snapshot of the currently known keys. */
    Map<String, Key> currentKeys();

    /**
     * Key for the given id. Implementations may refresh on a miss. A {@code null} id only matches when
     * exactly one key is known.
     */
    Optional<Key> keyFor(String keyId);

    /**
     * Reloads the key set, keeping the previous one on failure.
     *
     * @return whether the reload succeeded
     */
    boolean refresh();

    /** Provider with no keys; every token fails verification. */
    static VerificationKeyProvider none() {
        return new VerificationKeyProvider() {
            @Override
            public Map<String, Key> currentKeys() {
                return Map.of();
            }

            @Override
            public Optional<Key> keyFor(String keyId) {
                return Optional.empty();
            }

            @Override
            public boolean refresh() {
                return false;
            }
        };
    }
}
