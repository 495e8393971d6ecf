package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import java.util.Objects;

/**
 * Identifies one fixed-window counter: {@code <prefix>:<scope>:<subject>:<suffix>:<bucket>}.
 *
 * <p>Scope and granularity suffix are fixed tokens, so {@code ip:1.2.3.4} and {@code key:1.2.3.4}
 * never collide even when the subjects are equal.
 */
public record CounterKey(RateLimitScope scope, String subject, Granularity granularity, long bucketId) {

    public CounterKey {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(granularity, "granularity");
    }

    public static CounterKey of(RateLimitScope scope, String subject, Granularity granularity, long epochSecond) {
        return new CounterKey(scope, subject, granularity, granularity.bucketId(epochSecond));
    }

    public String identifier() {
        return scope.prefix() + ":" + subject;
    }

    public String render(String prefix) {
        return prefix + ":" + identifier() + ":" + granularity.suffix() + ":" + bucketId;
    }
}
