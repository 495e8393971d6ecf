package com.github.dimitryivaniuta.gatekeeper.keystore;

public enum ApiKeyStatus {
    ACTIVE,
    BLOCKED,
    REVOKED,
    EXPIRED
}
