package com.github.dimitryivaniuta.gatekeeper.gate;

import com.github.dimitryivaniuta.gatekeeper.identity.Principal;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateLimitHeaders;

import java.util.Optional;
import java.util.UUID;

/**
 * What an admitted request hands to its handler. Read-only.
 */
public record GateContext(Principal principal, UUID requestedSite, RateLimitHeaders rateLimitHeaders,
                          boolean rateLimitDegraded) {

    public static final String REQUEST_ATTRIBUTE = GateContext.class.getName();

    public Optional<RateLimitHeaders> headers() {
        return Optional.ofNullable(rateLimitHeaders);
    }
}
