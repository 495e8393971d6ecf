package com.github.dimitryivaniuta.gatekeeper.identity;

import java.util.Locale;

/**
 * The raw credential a request carried, tagged by mechanism. Resolved once from the two
 * credential headers; everything downstream switches on {@link Kind} instead of re-reading headers.
 */
public record PresentedCredential(Kind kind, String secret) {

    public enum Kind { API_KEY, BEARER_TOKEN }

    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String AUTHORIZATION_HEADER = "Authorization";

    private static final String BEARER_PREFIX = "bearer ";

    /**
     * Extraction outcome: exactly one of {@code credential} / {@code failure} is set.
     */
    public record Extraction(PresentedCredential credential, AuthFailureKind failure, String detail) {
        public boolean isPresent() {
            return credential != null;
        }
    }

    /**
     * Precedence rule: exactly one header may carry a credential. Both present is ambiguous and rejected
     * as {@link AuthFailureKind#MALFORMED}; neither present is {@link AuthFailureKind#MISSING}.
     */
    public static Extraction extract(String apiKeyHeader, String authorizationHeader) {
        String apiKey = trimToNull(apiKeyHeader);
        String authorization = trimToNull(authorizationHeader);

        if (apiKey == null && authorization == null) {
            return new Extraction(null, AuthFailureKind.MISSING, AuthFailureKind.MISSING.defaultDetail());
        }
        if (apiKey != null && authorization != null) {
            return new Extraction(null, AuthFailureKind.MALFORMED,
                    "Ambiguous authentication: send either an Authorization Bearer token or an X-API-Key header, not both");
        }
        if (apiKey != null) {
            return new Extraction(new PresentedCredential(Kind.API_KEY, apiKey), null, null);
        }

        if (!authorization.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
            return new Extraction(null, AuthFailureKind.MALFORMED, "Authorization header must use the Bearer scheme");
        }
        String token = trimToNull(authorization.substring(BEARER_PREFIX.length()));
        if (token == null) {
            return new Extraction(null, AuthFailureKind.MALFORMED, "Bearer token is empty");
        }
        return new Extraction(new PresentedCredential(Kind.BEARER_TOKEN, token), null, null);
    }

    private static String trimToNull(String v) {
        if (v == null) return null;
        String t = v.trim();
        return t.isEmpty() ? null : t;
    }

    @Override
    public String toString() {
        // never log the secret
        return "PresentedCredential[" + kind + "]";
    }
}
