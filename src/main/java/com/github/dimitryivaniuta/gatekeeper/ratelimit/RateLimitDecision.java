package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import java.util.List;

/**
 * Result of the rate-limit stage.
 *
 * @param allowed      whether the request may proceed
 * @param violation    the window that was exceeded; {@code null} when allowed
 * @param observations every window that was actually checked and passed, in check order
 * @param degraded     the counter store failed and the decision was produced by failing open
 */
public record RateLimitDecision(boolean allowed, RateLimitObservation violation,
                                List<RateLimitObservation> observations, boolean degraded) {

    public RateLimitDecision {
        observations = observations == null ? List.of() : List.copyOf(observations);
    }

    public static RateLimitDecision allow(List<RateLimitObservation> observations) {
        return new RateLimitDecision(true, null, observations, false);
    }

    public static RateLimitDecision failOpen(List<RateLimitObservation> observations) {
        return new RateLimitDecision(true, null, observations, true);
    }

    public static RateLimitDecision deny(RateLimitObservation violation, List<RateLimitObservation> observations) {
        return new RateLimitDecision(false, violation, observations, false);
    }

    public Granularity violatedGranularity() {
        return violation == null ? null : violation.granularity();
    }
}
