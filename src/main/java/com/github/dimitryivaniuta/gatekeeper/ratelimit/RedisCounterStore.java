package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Redis counter store. INCR and the first-write EXPIRE run in one Lua script so a crash between the
 * two can never leave a counter without a TTL.
 */
public class RedisCounterStore implements CounterStore {

    static final RedisScript<Long> INCREMENT_AND_EXPIRE = RedisScript.of("""
            local v = redis.call('INCR', KEYS[1])
            if v == 1 then
              redis.call('EXPIRE', KEYS[1], ARGV[1])
            end
            return v
            """, Long.class);

    private final ReactiveStringRedisTemplate redis;

    public RedisCounterStore(ReactiveStringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public CompletionStage<Long> incrementAndExpire(String key, Duration ttlOnFirstWrite) {
        long ttlSeconds = Math.max(1, ttlOnFirstWrite.toSeconds());
        return redis.execute(INCREMENT_AND_EXPIRE, List.of(key), List.of(String.valueOf(ttlSeconds)))
                .next()
                .switchIfEmpty(Mono.error(
                        new IllegalStateException("Counter script returned no value for " + key)))
                .toFuture();
    }
}
