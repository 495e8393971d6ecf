package com.github.dimitryivaniuta.gatekeeper.ratelimit;

/**
 * Outcome of one counter-store call as seen by the limiter. Transport failures become
 * {@link #unavailable(Throwable)} at the call site and are never rethrown.
 */
public record CounterResult(long value, Throwable failure) {

    public static CounterResult counted(long value) {
        return new CounterResult(value, null);
    }

    public static CounterResult unavailable(Throwable failure) {
        return new CounterResult(-1, failure);
    }

    public boolean isCounted() {
        return failure == null;
    }
}
