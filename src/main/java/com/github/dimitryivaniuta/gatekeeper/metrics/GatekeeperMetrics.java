package com.github.dimitryivaniuta.gatekeeper.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class GatekeeperMetrics {

    private final MeterRegistry registry;

    public GatekeeperMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Decisions ----
    public void admitted(String principalKind) {
        Counter.builder("gatekeeper_admitted_total")
                .tag("kind", principalKind) // apiKey | session
                .register(registry)
                .increment();
    }

    public void rejected(String code) {
        Counter.builder("gatekeeper_rejected_total")
                .tag("code", code)
                .register(registry)
                .increment();
    }

    // ---- Counter store ----
    public void counterStoreUnavailable(String scope) {
        Counter.builder("gatekeeper_counter_store_unavailable_total")
                .tag("scope", scope) // ip | key
                .register(registry)
                .increment();
    }

    // ---- Verification keys ----
    public void verificationKeyRefreshFailed() {
        Counter.builder("gatekeeper_verification_key_refresh_failed_total")
                .register(registry)
                .increment();
    }

    // ---- Usage notifications ----
    public void usageNotificationDropped() {
        Counter.builder("gatekeeper_usage_notification_dropped_total")
                .register(registry)
                .increment();
    }

    // ---- Duration ----
    public void recordDecision(String outcome, long nanos) {
        Timer.builder("gatekeeper_decision_duration")
                .tag("outcome", outcome) // admitted | rejected
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}
