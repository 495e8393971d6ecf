package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Chooses which window to advertise to the caller.
 */
@Component
public class RateLimitHeaderEmitter {

    /**
     * The most exhausted passing window, i.e. the smallest {@code remaining / limit}; ties go to the
     * smaller limit. Empty when nothing was checked.
     */
    public Optional<RateLimitHeaders> forAllowed(RateLimitDecision decision) {
        RateLimitObservation best = null;
        for (RateLimitObservation o : decision.observations()) {
            if (best == null || moreExhausted(o, best)) {
                best = o;
            }
        }
        if (best == null) return Optional.empty();
        return Optional.of(new RateLimitHeaders(best.limit(), best.remaining(), best.resetSeconds(), null));
    }

    public RateLimitHeaders forDenied(RateLimitDecision decision) {
        RateLimitObservation v = decision.violation();
        if (v == null) {
            throw new IllegalArgumentException("decision has no violated window");
        }
        return new RateLimitHeaders(v.limit(), 0, v.resetSeconds(), v.resetSeconds());
    }

    private static boolean moreExhausted(RateLimitObservation a, RateLimitObservation b) {
        // a.remaining / a.limit < b.remaining / b.limit, cross-multiplied
        int cmp = Long.compare(Math.multiplyExact(a.remaining(), b.limit()),
                Math.multiplyExact(b.remaining(), a.limit()));
        if (cmp != 0) return cmp < 0;
        return a.limit() < b.limit();
    }
}
