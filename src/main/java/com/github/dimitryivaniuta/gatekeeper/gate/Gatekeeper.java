package com.github.dimitryivaniuta.gatekeeper.gate;

import com.github.dimitryivaniuta.gatekeeper.identity.IdentityResult;
import com.github.dimitryivaniuta.gatekeeper.identity.IdentityResolver;
import com.github.dimitryivaniuta.gatekeeper.identity.Principal;
import com.github.dimitryivaniuta.gatekeeper.identity.PrincipalKind;
import com.github.dimitryivaniuta.gatekeeper.keystore.ApiKeyUsageRecorder;
import com.github.dimitryivaniuta.gatekeeper.metrics.GatekeeperMetrics;
import com.github.dimitryivaniuta.gatekeeper.permission.PermissionEvaluator;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.FixedWindowRateLimiter;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateLimitDecision;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateLimitHeaderEmitter;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateLimitHeaders;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateLimitObservation;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateLimitScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Runs identity, permission and rate limiting in that order. The first failing stage decides the
 * outcome and no later stage runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Gatekeeper {

    private final IdentityResolver identityResolver;
    private final PermissionEvaluator permissionEvaluator;
    private final FixedWindowRateLimiter rateLimiter;
    private final RateLimitHeaderEmitter headerEmitter;
    private final ApiKeyUsageRecorder usageRecorder;
    private final GatekeeperMetrics metrics;
    private final Clock clock;

    /**
     * @return the outcome; completes exceptionally only on infrastructure failures that cannot be
     *         decided, such as an unreachable key store
     */
    public CompletableFuture<GateOutcome> admit(GateRequest request) {
        long start = System.nanoTime();

        IdentityResult identity;
        try {
            identity = identityResolver.resolve(request.apiKeyHeader(), request.authorizationHeader());
        } catch (RuntimeException ex) {
            metrics.rejected(GateErrorCode.SERVICE_UNAVAILABLE.name());
            metrics.recordDecision("rejected", System.nanoTime() - start);
            return CompletableFuture.failedFuture(ex);
        }
        if (!identity.isResolved()) {
            return CompletableFuture.completedFuture(
                    reject(GateFailure.of(GateErrorCode.of(identity.failure()), identity.detail()), start));
        }
        Principal principal = identity.principal();
        notifyUsage(principal, request.clientIp());

        if (!permissionEvaluator.isAllowed(principal, request.requirement(), request.requestedSite())) {
            String detail = permissionEvaluator.denialDetail(principal, request.requirement(), request.requestedSite());
            return CompletableFuture.completedFuture(reject(GateFailure.of(GateErrorCode.FORBIDDEN, detail), start));
        }

        return rateLimiter.check(request.clientIp(), principal).thenApply(decision -> {
            if (!decision.allowed()) {
                RateLimitHeaders headers = headerEmitter.forDenied(decision);
                GateFailure failure = GateFailure.rateLimited(
                        rateLimitDetail(decision.violation()), headers, decision.violatedGranularity());
                return reject(failure, start);
            }
            RateLimitHeaders headers = headerEmitter.forAllowed(decision).orElse(null);
            metrics.admitted(principal.kind().tag());
            metrics.recordDecision("admitted", System.nanoTime() - start);
            return GateOutcome.admitted(
                    new GateContext(principal, request.requestedSite(), headers, decision.degraded()));
        });
    }

    private GateOutcome reject(GateFailure failure, long start) {
        log.debug("Request rejected: {} ({})", failure.code(), failure.detail());
        metrics.rejected(failure.code().name());
        metrics.recordDecision("rejected", System.nanoTime() - start);
        return GateOutcome.rejected(failure);
    }

    private void notifyUsage(Principal principal, String clientIp) {
        if (principal.kind() != PrincipalKind.API_CREDENTIAL) return;
        try {
            usageRecorder.recordUsage(UUID.fromString(principal.id()), clientIp, clock.instant());
        } catch (RuntimeException ex) {
            log.warn("Usage notification for api key {} not submitted: {}", principal.id(), ex.getMessage());
            metrics.usageNotificationDropped();
        }
    }

    static String rateLimitDetail(RateLimitObservation violation) {
        String subject = violation.scope() == RateLimitScope.IP ? "this client address" : "this credential";
        return "Rate limit exceeded: more than " + violation.limit() + " requests per "
                + violation.granularity().label() + " for " + subject;
    }
}
