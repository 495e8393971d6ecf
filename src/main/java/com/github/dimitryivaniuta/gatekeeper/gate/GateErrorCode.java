package com.github.dimitryivaniuta.gatekeeper.gate;

import com.github.dimitryivaniuta.gatekeeper.identity.AuthFailureKind;
import org.springframework.http.HttpStatus;

import java.util.Locale;

/**
 * Machine-readable rejection codes, carried as {@code code} in the problem payload.
 */
public enum GateErrorCode {
    AUTH_MISSING(HttpStatus.UNAUTHORIZED, "Authentication required"),
    AUTH_MALFORMED(HttpStatus.UNAUTHORIZED, "Malformed credential"),
    AUTH_EXPIRED(HttpStatus.UNAUTHORIZED, "Credential expired"),
    AUTH_BLOCKED(HttpStatus.UNAUTHORIZED, "Credential blocked"),
    AUTH_UNKNOWN(HttpStatus.UNAUTHORIZED, "Unknown credential"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "Forbidden"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "Too many requests"),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Service unavailable"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error");

    private final HttpStatus status;
    private final String title;

    GateErrorCode(HttpStatus status, String title) {
        this.status = status;
        this.title = title;
    }

    public HttpStatus status() { return status; }

    public String title() { return title; }

    /** Problem type path, e.g. {@code /errors/auth_expired}. */
    public String type() {
        return "/errors/" + name().toLowerCase(Locale.ROOT);
    }

    public static GateErrorCode of(AuthFailureKind failure) {
        return switch (failure) {
            case MISSING -> AUTH_MISSING;
            case MALFORMED -> AUTH_MALFORMED;
            case EXPIRED -> AUTH_EXPIRED;
            case BLOCKED -> AUTH_BLOCKED;
            case UNKNOWN_PRINCIPAL -> AUTH_UNKNOWN;
        };
    }
}
