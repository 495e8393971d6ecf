package com.github.dimitryivaniuta.gatekeeper.keystore;

import java.util.Optional;

/**
 * Hashed credential to metadata lookup.
 */
public interface KeyStore {

    /**
     * @param keyHash lowercase hex SHA-256 of the presented key
     * @return the record, or empty when no credential has that hash
     * @throws KeyStoreUnavailableException when the backing store cannot be reached
     */
    Optional<KeyRecord> lookupByHash(String keyHash);
}
