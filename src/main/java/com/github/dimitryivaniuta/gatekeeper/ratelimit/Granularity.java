package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import java.time.Duration;
import java.util.Locale;

/**
 * Fixed-window granularities. The suffix is part of the rendered counter key and must stay stable.
 */
public enum Granularity {
    SECOND("s", 1),
    MINUTE("m", 60),
    HOUR("h", 3_600),
    DAY("d", 86_400);

    private final String suffix;
    private final long seconds;

    Granularity(String suffix, long seconds) {
        this.suffix = suffix;
        this.seconds = seconds;
    }

    public String suffix() { return suffix; }

    public long seconds() { return seconds; }

    public Duration duration() { return Duration.ofSeconds(seconds); }

    /** floor(epochSecond / window) */
    public long bucketId(long epochSecond) {
        return Math.floorDiv(epochSecond, seconds);
    }

    /** Always in [1, seconds]. */
    public long secondsUntilRollover(long epochSecond) {
        return seconds - Math.floorMod(epochSecond, seconds);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
