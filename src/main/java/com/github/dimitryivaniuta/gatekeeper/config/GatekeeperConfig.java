package com.github.dimitryivaniuta.gatekeeper.config;

import com.github.dimitryivaniuta.gatekeeper.identity.JwksClient;
import com.github.dimitryivaniuta.gatekeeper.identity.JwksVerificationKeyProvider;
import com.github.dimitryivaniuta.gatekeeper.identity.VerificationKeyProvider;
import com.github.dimitryivaniuta.gatekeeper.metrics.GatekeeperMetrics;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.CounterStore;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.FixedWindowRateLimiter;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.InMemoryCounterStore;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RedisCounterStore;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide gate collaborators: the counter store, its time limiter, and the verification keys.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GatekeeperProperties.class)
public class GatekeeperConfig {

    // not a bean: a ScheduledExecutorService bean would replace the @Scheduled task scheduler
    private final ScheduledExecutorService counterStoreTimeoutScheduler = newTimeoutScheduler();

    @PreDestroy
    void shutdownTimeoutScheduler() {
        counterStoreTimeoutScheduler.shutdownNow();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "gatekeeper.counter-store", name = "type", havingValue = "redis", matchIfMissing = true)
    public CounterStore redisCounterStore(ReactiveStringRedisTemplate redis) {
        return new RedisCounterStore(redis);
    }

    @Bean
    @ConditionalOnProperty(prefix = "gatekeeper.counter-store", name = "type", havingValue = "in-memory")
    public CounterStore inMemoryCounterStore() {
        log.warn("Using in-memory counter store: rate limits are not shared across instances");
        return new InMemoryCounterStore();
    }

    @Bean
    public TimeLimiter counterStoreTimeLimiter(GatekeeperProperties properties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(properties.getCounterStore().getTimeout())
                // an increment already sent may still land; it only costs one extra count
                .cancelRunningFuture(false)
                .build();
        return TimeLimiter.of("counterStore", config);
    }

    @Bean
    public FixedWindowRateLimiter fixedWindowRateLimiter(CounterStore counterStore,
                                                         TimeLimiter counterStoreTimeLimiter,
                                                         GatekeeperProperties properties,
                                                         Clock clock,
                                                         GatekeeperMetrics metrics) {
        return new FixedWindowRateLimiter(
                counterStore,
                counterStoreTimeLimiter,
                counterStoreTimeoutScheduler,
                properties.getIpLimits().windows(),
                properties.getCounterStore().getKeyPrefix(),
                clock,
                metrics
        );
    }

    @Bean
    public VerificationKeyProvider verificationKeyProvider(GatekeeperProperties properties,
                                                           RestClient.Builder restClientBuilder,
                                                           Clock clock,
                                                           GatekeeperMetrics metrics) {
        String url = properties.getToken().getJwksUrl();
        if (url == null || url.isBlank()) {
            log.warn("gatekeeper.token.jwks-url is not set: bearer tokens will be rejected");
            return VerificationKeyProvider.none();
        }
        return new JwksVerificationKeyProvider(
                new JwksClient(JwksClient.boundedRestClient(restClientBuilder, properties.getToken().getFetchTimeout()), url),
                clock,
                properties.getToken().getRefreshCooldown(),
                metrics
        );
    }

    private static ScheduledExecutorService newTimeoutScheduler() {
        AtomicInteger n = new AtomicInteger();
        return Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "counter-store-timeout-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
