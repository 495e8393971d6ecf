package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import java.time.Duration;
import java.util.concurrent.CompletionStage;

/**
 * Shared counter store. Implementations must make increment-and-read a single atomic operation and
 * set the expiry only when the increment created the counter.
 */
public interface CounterStore {

    /**
     * @return a stage completing with the post-increment value, or exceptionally on any transport or
     *         command failure
     */
    CompletionStage<Long> incrementAndExpire(String key, Duration ttlOnFirstWrite);
}
