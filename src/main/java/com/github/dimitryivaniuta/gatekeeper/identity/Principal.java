package com.github.dimitryivaniuta.gatekeeper.identity;

import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateWindows;

import java.util.Objects;

/**
 * Resolved caller identity, built fresh for every request and never cached.
 *
 * @param kind            which credential mechanism produced it
 * @param id              stable identifier; keys per-principal rate-limit counters as {@code key:<id>}
 * @param tenantScope     the single site it is confined to, or all sites
 * @param permissionLevel exactly one level
 * @param rateWindows     per-principal window limits, {@link RateWindows#none()} when nothing is enforced
 */
public record Principal(
        PrincipalKind kind,
        String id,
        TenantScope tenantScope,
        PermissionLevel permissionLevel,
        RateWindows rateWindows
) {
    public Principal {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tenantScope, "tenantScope");
        Objects.requireNonNull(permissionLevel, "permissionLevel");
        rateWindows = rateWindows == null ? RateWindows.none() : rateWindows;
    }

    public boolean isMaster() {
        return permissionLevel == PermissionLevel.MASTER;
    }
}
