package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimitHeaderEmitterTest {

    private final RateLimitHeaderEmitter emitter = new RateLimitHeaderEmitter();

    private static RateLimitObservation obs(Granularity g, long limit, long remaining, long reset) {
        return new RateLimitObservation(RateLimitScope.KEY, g, limit, remaining, reset);
    }

    @Test
    void shouldPickMostExhaustedWindow() {
        RateLimitDecision d = RateLimitDecision.allow(List.of(
                obs(Granularity.SECOND, 50, 40, 1),
                obs(Granularity.MINUTE, 500, 20, 33)));

        RateLimitHeaders h = emitter.forAllowed(d).orElseThrow();

        assertThat(h.limit()).isEqualTo(500);
        assertThat(h.remaining()).isEqualTo(20);
        assertThat(h.resetSeconds()).isEqualTo(33);
        assertThat(h.asMap()).containsOnlyKeys(RateLimitHeaders.LIMIT, RateLimitHeaders.REMAINING, RateLimitHeaders.RESET);
    }

    @Test
    void tieShouldGoToSmallerLimit() {
        RateLimitDecision d = RateLimitDecision.allow(List.of(
                obs(Granularity.HOUR, 1000, 500, 100),
                obs(Granularity.SECOND, 10, 5, 1)));

        assertThat(emitter.forAllowed(d).orElseThrow().limit()).isEqualTo(10);
    }

    @Test
    void shouldEmitNothingWithoutObservations() {
        assertThat(emitter.forAllowed(RateLimitDecision.allow(List.of()))).isEmpty();
        assertThat(emitter.forAllowed(RateLimitDecision.failOpen(List.of()))).isEmpty();
    }

    @Test
    void deniedShouldCarryViolatedWindowAndRetryAfter() {
        RateLimitObservation violation = new RateLimitObservation(RateLimitScope.IP, Granularity.MINUTE, 500, 0, 17);
        RateLimitDecision d = RateLimitDecision.deny(violation, List.of(obs(Granularity.SECOND, 50, 10, 1)));

        RateLimitHeaders h = emitter.forDenied(d);

        assertThat(h.asMap())
                .containsEntry(RateLimitHeaders.LIMIT, "500")
                .containsEntry(RateLimitHeaders.REMAINING, "0")
                .containsEntry(RateLimitHeaders.RESET, "17")
                .containsEntry(RateLimitHeaders.RETRY_AFTER, "17");
    }

    @Test
    void deniedWithoutViolationIsAProgrammingError() {
        assertThatThrownBy(() -> emitter.forDenied(RateLimitDecision.allow(List.of())))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
