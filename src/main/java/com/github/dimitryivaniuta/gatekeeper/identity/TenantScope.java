package com.github.dimitryivaniuta.gatekeeper.identity;

import java.util.UUID;

/**
 * Tenant (site) a principal is confined to. A {@code null} site id means all sites.
 */
public record TenantScope(UUID siteId) {

    private static final TenantScope ALL_SITES = new TenantScope(null);

    public static TenantScope allSites() {
        return ALL_SITES;
    }

    public static TenantScope site(UUID siteId) {
        return siteId == null ? ALL_SITES : new TenantScope(siteId);
    }

    public boolean isAllSites() {
        return siteId == null;
    }

    /** A missing requested site is never covered, not even by an all-sites scope. */
    public boolean covers(UUID requestedSite) {
        if (requestedSite == null) return false;
        return isAllSites() || siteId.equals(requestedSite);
    }

    @Override
    public String toString() {
        return isAllSites() ? "*" : siteId.toString();
    }
}
