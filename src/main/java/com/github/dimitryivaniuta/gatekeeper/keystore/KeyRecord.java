package com.github.dimitryivaniuta.gatekeeper.keystore;

import com.github.dimitryivaniuta.gatekeeper.identity.PermissionLevel;
import com.github.dimitryivaniuta.gatekeeper.identity.TenantScope;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateWindows;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of a stored credential's metadata. Safe to cache; it never carries the key itself.
 *
 * @param expiresAt {@code null} when the credential never expires
 */
public record KeyRecord(
        UUID id,
        PermissionLevel permissionLevel,
        TenantScope tenantScope,
        ApiKeyStatus status,
        RateWindows rateWindows,
        Instant expiresAt
) {}
