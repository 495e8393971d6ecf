package com.github.dimitryivaniuta.gatekeeper.ratelimit;

/**
 * Counter namespace. The prefix is part of every rendered counter key.
 */
public enum RateLimitScope {
    IP("ip"),
    KEY("key");

    private final String prefix;

    RateLimitScope(String prefix) { this.prefix = prefix; }

    public String prefix() { return prefix; }
}
