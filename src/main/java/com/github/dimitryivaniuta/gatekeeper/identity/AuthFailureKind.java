package com.github.dimitryivaniuta.gatekeeper.identity;

/**
 * Why a credential could not be turned into a {@link Principal}. All of these surface as 401.
 */
public enum AuthFailureKind {
    MISSING("Missing authentication: provide an Authorization Bearer token or an X-API-Key header"),
    MALFORMED("Credential is malformed or its signature could not be verified"),
    EXPIRED("Credential has expired"),
    BLOCKED("Credential has been blocked or revoked"),
    UNKNOWN_PRINCIPAL("Credential is not recognised");

    private final String defaultDetail;

    AuthFailureKind(String defaultDetail) {
        this.defaultDetail = defaultDetail;
    }

    public String defaultDetail() {
        return defaultDetail;
    }
}
