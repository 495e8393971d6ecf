package com.github.dimitryivaniuta.gatekeeper.gate;

import com.github.dimitryivaniuta.gatekeeper.ratelimit.Granularity;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateLimitHeaders;

import java.util.Objects;

/**
 * A stage rejection. {@code rateLimitHeaders} and {@code violatedGranularity} are only set for
 * {@link GateErrorCode#RATE_LIMITED}.
 */
public record GateFailure(GateErrorCode code, String detail, RateLimitHeaders rateLimitHeaders,
                          Granularity violatedGranularity) {

    public GateFailure {
        Objects.requireNonNull(code, "code");
    }

    public static GateFailure of(GateErrorCode code, String detail) {
        return new GateFailure(code, detail, null, null);
    }

    public static GateFailure rateLimited(String detail, RateLimitHeaders headers, Granularity granularity) {
        return new GateFailure(GateErrorCode.RATE_LIMITED, detail, headers, granularity);
    }
}
