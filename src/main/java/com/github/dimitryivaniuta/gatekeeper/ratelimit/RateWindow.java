package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import java.util.Objects;

/**
 * One enforced window. Only windows with a positive limit are ever constructed.
 */
public record RateWindow(Granularity granularity, long limit) {

    public RateWindow {
        Objects.requireNonNull(granularity, "granularity");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
    }
}
