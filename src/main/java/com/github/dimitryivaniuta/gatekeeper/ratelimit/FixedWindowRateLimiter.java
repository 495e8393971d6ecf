package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import com.github.dimitryivaniuta.gatekeeper.identity.Principal;
import com.github.dimitryivaniuta.gatekeeper.metrics.GatekeeperMetrics;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Fixed-window limiter over a shared {@link CounterStore}.
 *
 * <p>Windows are checked one at a time: IP windows first (skipped for loopback callers), then the
 * principal's own windows, finest granularity first. The first exceeded window denies and stops the
 * sequence. Any store failure allows the request with whatever was observed up to that point.
 */
@Slf4j
public class FixedWindowRateLimiter {

    private final CounterStore store;
    private final TimeLimiter timeLimiter;
    private final ScheduledExecutorService scheduler;
    private final List<RateWindow> ipWindows;
    private final String keyPrefix;
    private final Clock clock;
    private final GatekeeperMetrics metrics;

    public FixedWindowRateLimiter(CounterStore store,
                                  TimeLimiter timeLimiter,
                                  ScheduledExecutorService scheduler,
                                  List<RateWindow> ipWindows,
                                  String keyPrefix,
                                  Clock clock,
                                  GatekeeperMetrics metrics) {
        this.store = store;
        this.timeLimiter = timeLimiter;
        this.scheduler = scheduler;
        this.ipWindows = List.copyOf(ipWindows);
        this.keyPrefix = keyPrefix;
        this.clock = clock;
        this.metrics = metrics;
    }

    public CompletableFuture<RateLimitDecision> check(String clientIp, Principal principal) {
        long now = clock.instant().getEpochSecond();

        List<Check> checks = new ArrayList<>();
        if (!LoopbackAddresses.isLoopback(clientIp)) {
            String ip = (clientIp == null || clientIp.isBlank()) ? "unknown" : clientIp.trim();
            for (RateWindow w : ipWindows) {
                checks.add(new Check(CounterKey.of(RateLimitScope.IP, ip, w.granularity(), now), w));
            }
        }
        for (RateWindow w : principal.rateWindows().enforced()) {
            checks.add(new Check(CounterKey.of(RateLimitScope.KEY, principal.id(), w.granularity(), now), w));
        }

        return step(checks, 0, now, new ArrayList<>());
    }

    private CompletableFuture<RateLimitDecision> step(List<Check> checks, int index, long now,
                                                      List<RateLimitObservation> seen) {
        if (index == checks.size()) {
            return CompletableFuture.completedFuture(RateLimitDecision.allow(seen));
        }
        Check check = checks.get(index);
        RateWindow window = check.window();
        Granularity g = window.granularity();

        return count(check.key()).thenCompose(result -> {
            if (!result.isCounted()) {
                log.warn("Counter store unavailable for {} {} window, allowing request: {}",
                        check.key().scope(), g.label(), describe(result.failure()));
                metrics.counterStoreUnavailable(check.key().scope().prefix());
                return CompletableFuture.completedFuture(RateLimitDecision.failOpen(seen));
            }

            RateLimitObservation observation =
                    RateLimitObservation.of(check.key().scope(), window, result.value(), g.secondsUntilRollover(now));
            if (result.value() > window.limit()) {
                return CompletableFuture.completedFuture(RateLimitDecision.deny(observation, seen));
            }
            seen.add(observation);
            return step(checks, index + 1, now, seen);
        });
    }

    private CompletableFuture<CounterResult> count(CounterKey key) {
        String rendered = key.render(keyPrefix);
        CompletionStage<Long> stage;
        try {
            stage = timeLimiter.executeCompletionStage(scheduler,
                    () -> store.incrementAndExpire(rendered, key.granularity().duration()));
        } catch (RuntimeException ex) {
            return CompletableFuture.completedFuture(CounterResult.unavailable(ex));
        }
        return stage.toCompletableFuture().handle((value, ex) -> {
            if (ex != null) return CounterResult.unavailable(unwrap(ex));
            if (value == null) return CounterResult.unavailable(new IllegalStateException("no counter value"));
            return CounterResult.counted(value);
        });
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable t = ex;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static String describe(Throwable t) {
        return t == null ? "unknown" : t.getClass().getSimpleName() + ": " + t.getMessage();
    }

    private record Check(CounterKey key, RateWindow window) {}
}
