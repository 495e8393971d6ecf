package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-process counter store. Each counter lives in a Caffeine entry whose expiry is fixed by the
 * write that created it; later increments do not extend it. There is no size bound: a counter only
 * leaves the map when its bucket expires, and the longest bucket is one day.
 */
public class InMemoryCounterStore implements CounterStore {

    private final Cache<String, Counter> counters;

    public InMemoryCounterStore() {
        this(Ticker.systemTicker());
    }

    public InMemoryCounterStore(Ticker ticker) {
        this.counters = Caffeine.newBuilder()
                .ticker(ticker)
                .expireAfter(new FirstWriteExpiry())
                .build();
    }

    @Override
    public CompletionStage<Long> incrementAndExpire(String key, Duration ttlOnFirstWrite) {
        Counter c = counters.get(key, k -> new Counter(ttlOnFirstWrite.toNanos()));
        return CompletableFuture.completedFuture(c.value.incrementAndGet());
    }

    long size() {
        counters.cleanUp();
        return counters.estimatedSize();
    }

    private static final class Counter {
        final AtomicLong value = new AtomicLong();
        final long ttlNanos;

        Counter(long ttlNanos) { this.ttlNanos = ttlNanos; }
    }

    private static final class FirstWriteExpiry implements Expiry<String, Counter> {
        @Override
        public long expireAfterCreate(String key, Counter value, long currentTime) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, Counter value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        @Override
        public long expireAfterRead(String key, Counter value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
