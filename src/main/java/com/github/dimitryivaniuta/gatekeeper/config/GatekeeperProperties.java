package com.github.dimitryivaniuta.gatekeeper.config;

import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateWindow;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateWindows;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "gatekeeper")
public class GatekeeperProperties {

    /** Master switch; when false the gate interceptor is not registered. */
    private boolean enabled = true;

    private List<String> protectedPaths = new ArrayList<>(List.of("/api/**"));

    /** Honour X-Forwarded-For / X-Real-IP. Only enable behind a trusted proxy. */
    private boolean trustForwardedHeaders = false;

    private IpLimits ipLimits = new IpLimits();
    private CounterStore counterStore = new CounterStore();
    private KeyStore keyStore = new KeyStore();
    private Token token = new Token();
    private Cors cors = new Cors();
    private UsageExecutor usageExecutor = new UsageExecutor();

    @Getter
    @Setter
    public static class IpLimits {
        private Integer perSecond = 50;
        private Integer perMinute = 500;

        public List<RateWindow> windows() {
            return new RateWindows(perSecond, perMinute, null, null).enforced();
        }
    }

    @Getter
    @Setter
    public static class CounterStore {
        /** redis | in-memory */
        private String type = "redis";
        private Duration timeout = Duration.ofMillis(250);
        private String keyPrefix = "rl";
    }

    @Getter
    @Setter
    public static class KeyStore {
        private String hashPepper = "";
        private Duration lookupCacheTtl = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Token {
        /** Empty disables bearer tokens: every one is rejected as malformed. */
        private String jwksUrl = "";
        /** Connect and read timeout of one JWKS fetch attempt. */
        private Duration fetchTimeout = Duration.ofSeconds(2);
        private Duration refreshInterval = Duration.ofMinutes(15);
        private Duration refreshCooldown = Duration.ofSeconds(30);
        private Duration clockSkew = Duration.ofSeconds(30);
        private String tenantClaim = "site_id";
        private String roleClaim = "role";
        private DefaultLimits defaultLimits = new DefaultLimits();
    }

    @Getter
    @Setter
    public static class DefaultLimits {
        private Integer perSecond = 10;
        private Integer perMinute = 100;
        private Integer perHour = 1_000;
        private Integer perDay = 10_000;

        public RateWindows toRateWindows() {
            return new RateWindows(perSecond, perMinute, perHour, perDay);
        }
    }

    @Getter
    @Setter
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }

    @Getter
    @Setter
    public static class UsageExecutor {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 1_000;
    }
}
