package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import java.util.ArrayList;
import java.util.List;

/**
 * The four per-principal window limits. {@code null} or a non-positive value disables that granularity.
 */
public record RateWindows(Integer perSecond, Integer perMinute, Integer perHour, Integer perDay) {

    private static final RateWindows NONE = new RateWindows(null, null, null, null);

    public static RateWindows none() {
        return NONE;
    }

    /** Enforced windows, finest granularity first. */
    public List<RateWindow> enforced() {
        List<RateWindow> out = new ArrayList<>(4);
        add(out, Granularity.SECOND, perSecond);
        add(out, Granularity.MINUTE, perMinute);
        add(out, Granularity.HOUR, perHour);
        add(out, Granularity.DAY, perDay);
        return out;
    }

    private static void add(List<RateWindow> out, Granularity g, Integer limit) {
        if (limit != null && limit > 0) {
            out.add(new RateWindow(g, limit));
        }
    }
}
