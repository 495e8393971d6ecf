package com.github.dimitryivaniuta.gatekeeper.gate;

import com.github.dimitryivaniuta.gatekeeper.identity.IdentityResolver;
import com.github.dimitryivaniuta.gatekeeper.identity.PermissionLevel;
import com.github.dimitryivaniuta.gatekeeper.identity.SignedTokenVerifier;
import com.github.dimitryivaniuta.gatekeeper.identity.TenantScope;
import com.github.dimitryivaniuta.gatekeeper.identity.VerificationKeyProvider;
import com.github.dimitryivaniuta.gatekeeper.keystore.ApiKeyHashService;
import com.github.dimitryivaniuta.gatekeeper.keystore.ApiKeyStatus;
import com.github.dimitryivaniuta.gatekeeper.keystore.ApiKeyUsageRecorder;
import com.github.dimitryivaniuta.gatekeeper.keystore.KeyRecord;
import com.github.dimitryivaniuta.gatekeeper.keystore.KeyStore;
import com.github.dimitryivaniuta.gatekeeper.metrics.GatekeeperMetrics;
import com.github.dimitryivaniuta.gatekeeper.permission.PermissionEvaluator;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.FixedWindowRateLimiter;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.Granularity;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.InMemoryCounterStore;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateLimitHeaderEmitter;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateWindow;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateWindows;
import com.github.dimitryivaniuta.gatekeeper.sample.SiteContentController;
import com.github.dimitryivaniuta.gatekeeper.support.ManualClock;
import com.github.dimitryivaniuta.gatekeeper.web.ClientIpResolver;
import com.github.dimitryivaniuta.gatekeeper.web.GlobalExceptionHandler;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class GatekeeperEndToEndTest {

    private static final Instant BUCKET_START = Instant.parse("2026-05-01T12:00:00Z");
    private static final UUID SITE = UUID.fromString("0f8e2a34-6b7c-4d1e-9f00-aa11bb22cc33");
    private static final UUID OTHER_SITE = UUID.fromString("aaaaaaaa-0000-0000-0000-000000000001");

    private final ApiKeyHashService hashService = new ApiKeyHashService("");
    private final Map<String, KeyRecord> keysByHash = new HashMap<>();

    private ScheduledExecutorService scheduler;
    private ManualClock clock;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        clock = new ManualClock(BUCKET_START);
        GatekeeperMetrics metrics = new GatekeeperMetrics(new SimpleMeterRegistry());
        KeyStore keyStore = hash -> Optional.ofNullable(keysByHash.get(hash));

        SignedTokenVerifier tokens = new SignedTokenVerifier(VerificationKeyProvider.none(), clock,
                Duration.ofSeconds(30), "site_id", "role", RateWindows.none());
        IdentityResolver identity = new IdentityResolver(hashService, keyStore, tokens, clock);
        FixedWindowRateLimiter limiter = new FixedWindowRateLimiter(
                new InMemoryCounterStore(),
                TimeLimiter.of(TimeLimiterConfig.custom().timeoutDuration(Duration.ofSeconds(1)).build()),
                scheduler,
                List.of(new RateWindow(Granularity.SECOND, 50), new RateWindow(Granularity.MINUTE, 500)),
                "rl",
                clock,
                metrics);
        Gatekeeper gatekeeper = new Gatekeeper(identity, new PermissionEvaluator(), limiter,
                new RateLimitHeaderEmitter(), mock(ApiKeyUsageRecorder.class), metrics, clock);

        mvc = MockMvcBuilders.standaloneSetup(new SiteContentController())
                .setControllerAdvice(new GlobalExceptionHandler())
                .setCustomArgumentResolvers(new GateContextArgumentResolver())
                .addInterceptors(new GatekeeperInterceptor(gatekeeper, new ClientIpResolver(false)))
                .build();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private void key(String raw, PermissionLevel level, UUID site, ApiKeyStatus status, Instant expiresAt,
                     RateWindows windows) {
        keysByHash.put(hashService.hash(raw), new KeyRecord(UUID.randomUUID(), level,
                TenantScope.site(site), status, windows, expiresAt));
    }

    private static MockHttpServletRequestBuilder fromClient(MockHttpServletRequestBuilder b) {
        return b.with(r -> {
            r.setRemoteAddr("203.0.113.7");
            return r;
        });
    }

    @Test
    void sixthRequestInOneSecondShouldBeRateLimited() throws Exception {
        key("sk_five", PermissionLevel.READ, SITE, ApiKeyStatus.ACTIVE, null, new RateWindows(5, null, null, null));

        for (int i = 1; i <= 5; i++) {
            mvc.perform(fromClient(get("/api/sites/{siteId}/content", SITE)).header("X-API-Key", "sk_five"))
                    .andExpect(status().isOk())
                    .andExpect(header().string("X-RateLimit-Limit", "5"))
                    .andExpect(header().string("X-RateLimit-Remaining", String.valueOf(5 - i)))
                    .andExpect(header().string("X-RateLimit-Reset", "1"));
        }

        mvc.perform(fromClient(get("/api/sites/{siteId}/content", SITE)).header("X-API-Key", "sk_five"))
                .andExpect(status().isTooManyRequests())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
                .andExpect(header().string("Retry-After", "1"))
                .andExpect(header().string("X-RateLimit-Limit", "5"))
                .andExpect(header().string("X-RateLimit-Remaining", "0"))
                .andExpect(jsonPath("$.code").value("RATE_LIMITED"))
                .andExpect(jsonPath("$.status").value(429))
                .andExpect(jsonPath("$.violatedGranularity").value("SECOND"))
                .andExpect(jsonPath("$.retryAfterSeconds").value(1))
                .andExpect(jsonPath("$.detail", containsString("5 requests per second")));

        clock.advance(Duration.ofSeconds(1));
        mvc.perform(fromClient(get("/api/sites/{siteId}/content", SITE)).header("X-API-Key", "sk_five"))
                .andExpect(status().isOk());
    }

    @Test
    void missingCredentialShouldBe401AuthMissing() throws Exception {
        mvc.perform(fromClient(get("/api/sites/{siteId}/content", SITE)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH_MISSING"))
                .andExpect(jsonPath("$.type").value("/errors/auth_missing"))
                .andExpect(jsonPath("$.instance").value("/api/sites/" + SITE + "/content"));
    }

    @Test
    void unknownBlockedAndExpiredKeysShouldHaveDistinctCodes() throws Exception {
        key("sk_blocked", PermissionLevel.READ, SITE, ApiKeyStatus.BLOCKED, null, RateWindows.none());
        key("sk_old", PermissionLevel.READ, SITE, ApiKeyStatus.ACTIVE, BUCKET_START.minusSeconds(1), RateWindows.none());

        mvc.perform(fromClient(get("/api/sites/{siteId}/content", SITE)).header("X-API-Key", "nope"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH_UNKNOWN"));
        mvc.perform(fromClient(get("/api/sites/{siteId}/content", SITE)).header("X-API-Key", "sk_blocked"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH_BLOCKED"));
        for (int i = 0; i < 2; i++) {
            mvc.perform(fromClient(get("/api/sites/{siteId}/content", SITE)).header("X-API-Key", "sk_old"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("AUTH_EXPIRED"));
        }
    }

    @Test
    void bearerTokenWithoutKeysShouldBeMalformedAndBothHeadersRejected() throws Exception {
        key("sk_ok", PermissionLevel.READ, SITE, ApiKeyStatus.ACTIVE, null, RateWindows.none());

        mvc.perform(fromClient(get("/api/sites/{siteId}/content", SITE)).header("Authorization", "Bearer a.b.c"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH_MALFORMED"));
        mvc.perform(fromClient(get("/api/sites/{siteId}/content", SITE))
                        .header("X-API-Key", "sk_ok")
                        .header("Authorization", "Bearer a.b.c"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH_MALFORMED"));
    }

    @Test
    void insufficientLevelOrForeignSiteShouldBeForbidden() throws Exception {
        key("sk_reader", PermissionLevel.READ, SITE, ApiKeyStatus.ACTIVE, null, RateWindows.none());

        mvc.perform(fromClient(post("/api/sites/{siteId}/content", SITE))
                        .header("X-API-Key", "sk_reader")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Hello\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
        mvc.perform(fromClient(get("/api/sites/{siteId}/content", OTHER_SITE)).header("X-API-Key", "sk_reader"))
                .andExpect(status().isForbidden());
        mvc.perform(fromClient(get("/api/admin/sites")).header("X-API-Key", "sk_reader"))
                .andExpect(status().isForbidden());
    }

    @Test
    void writerShouldCreateContentOnOwnSite() throws Exception {
        key("sk_writer", PermissionLevel.WRITE, SITE, ApiKeyStatus.ACTIVE, null, RateWindows.none());

        mvc.perform(fromClient(post("/api/sites/{siteId}/content", SITE))
                        .header("X-API-Key", "sk_writer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Hello\",\"body\":\"World\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.siteId").value(SITE.toString()))
                .andExpect(jsonPath("$.title").value("Hello"));
    }

    @Test
    void masterShouldActAcrossSites() throws Exception {
        key("sk_master", PermissionLevel.MASTER, SITE, ApiKeyStatus.ACTIVE, null, RateWindows.none());

        mvc.perform(fromClient(get("/api/sites/{siteId}/content", OTHER_SITE)).header("X-API-Key", "sk_master"))
                .andExpect(status().isOk());
        mvc.perform(fromClient(get("/api/admin/sites")).header("X-API-Key", "sk_master"))
                .andExpect(status().isOk());
    }

    @Test
    void meShouldExposeGateContextAndLoopbackShouldEmitNoHeaders() throws Exception {
        key("sk_me", PermissionLevel.ADMIN, null, ApiKeyStatus.ACTIVE, null, RateWindows.none());

        mvc.perform(get("/api/me").header("X-API-Key", "sk_me").with(r -> {
                    r.setRemoteAddr("127.0.0.1");
                    return r;
                }))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-RateLimit-Limit"))
                .andExpect(jsonPath("$.kind").value("apiKey"))
                .andExpect(jsonPath("$.tenantScope").value("*"))
                .andExpect(jsonPath("$.permissionLevel").value("ADMIN"));
    }

    @Test
    void ipLimitShouldApplyAcrossKeysFromSameAddress() throws Exception {
        for (int i = 0; i < 51; i++) {
            key("sk_" + i, PermissionLevel.READ, SITE, ApiKeyStatus.ACTIVE, null, RateWindows.none());
        }
        for (int i = 0; i < 50; i++) {
            mvc.perform(fromClient(get("/api/sites/{siteId}/content", SITE)).header("X-API-Key", "sk_" + i))
                    .andExpect(status().isOk());
        }
        mvc.perform(fromClient(get("/api/sites/{siteId}/content", SITE)).header("X-API-Key", "sk_50"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("X-RateLimit-Limit", "50"))
                .andExpect(jsonPath("$.detail", containsString("client address")));
    }
}
