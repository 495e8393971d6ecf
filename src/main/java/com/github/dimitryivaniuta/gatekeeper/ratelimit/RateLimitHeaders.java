package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rate-limit response headers. {@code retryAfterSeconds} is only set for a denied request.
 */
public record RateLimitHeaders(long limit, long remaining, long resetSeconds, Long retryAfterSeconds) {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";
    public static final String RETRY_AFTER = "Retry-After";

    public Map<String, String> asMap() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put(LIMIT, String.valueOf(limit));
        m.put(REMAINING, String.valueOf(remaining));
        m.put(RESET, String.valueOf(resetSeconds));
        if (retryAfterSeconds != null) {
            m.put(RETRY_AFTER, String.valueOf(retryAfterSeconds));
        }
        return Collections.unmodifiableMap(m);
    }
}
