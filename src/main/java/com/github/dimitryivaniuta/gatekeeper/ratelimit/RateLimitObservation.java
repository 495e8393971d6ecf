package com.github.dimitryivaniuta.gatekeeper.ratelimit;

/**
 * One checked window: its limit, what is left after this request, and seconds until the bucket rolls.
 */
public record RateLimitObservation(RateLimitScope scope, Granularity granularity, long limit, long remaining,
                                   long resetSeconds) {

    public static RateLimitObservation of(RateLimitScope scope, RateWindow window, long count, long resetSeconds) {
        return new RateLimitObservation(scope, window.granularity(), window.limit(),
                Math.max(0, window.limit() - count), resetSeconds);
    }
}
