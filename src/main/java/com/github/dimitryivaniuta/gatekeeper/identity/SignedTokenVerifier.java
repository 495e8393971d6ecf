package com.github.dimitryivaniuta.gatekeeper.identity;

import com.github.dimitryivaniuta.gatekeeper.config.GatekeeperProperties;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateWindows;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.LocatorAdapter;
import io.jsonwebtoken.security.UnsupportedKeyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * Verifies signed session tokens and maps their claims onto a {@link Principal}.
 *
 * <p>The signing key is chosen by the JWS {@code kid} header. The tenant claim is optional (absent means
 * all sites); the role claim is optional (absent means {@link PermissionLevel#READ}) but must name a
 * known level when present.
 */
@Slf4j
@Component
public class SignedTokenVerifier {

    private final JwtParser parser;
    private final String tenantClaim;
    private final String roleClaim;
    private final RateWindows sessionWindows;

    @Autowired
    public SignedTokenVerifier(VerificationKeyProvider keyProvider, GatekeeperProperties properties, Clock clock) {
        this(keyProvider, clock,
                properties.getToken().getClockSkew(),
                properties.getToken().getTenantClaim(),
                properties.getToken().getRoleClaim(),
                properties.getToken().getDefaultLimits().toRateWindows());
    }

    public SignedTokenVerifier(VerificationKeyProvider keyProvider, Clock clock, Duration clockSkew,
                               String tenantClaim, String roleClaim, RateWindows sessionWindows) {
        this.tenantClaim = tenantClaim;
        this.roleClaim = roleClaim;
        this.sessionWindows = sessionWindows;
        this.parser = Jwts.parser()
                .keyLocator(new LocatorAdapter<Key>() {
                    @Override
                    protected Key locate(JwsHeader header) {
                        String kid = header.getKeyId();
                        return keyProvider.keyFor(kid)
                                .orElseThrow(() -> new UnsupportedKeyException("Unknown signing key id: " + kid));
                    }
                })
                .clockSkewSeconds(clockSkew.toSeconds())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public IdentityResult verify(String token) {
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException ex) {
            return IdentityResult.failed(AuthFailureKind.EXPIRED, "Session token has expired");
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Rejected session token: {}", ex.getMessage());
            return IdentityResult.failed(AuthFailureKind.MALFORMED);
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            return IdentityResult.failed(AuthFailureKind.MALFORMED, "Session token has no subject");
        }

        Optional<TenantScope> scope = tenantScope(claims.get(tenantClaim));
        if (scope.isEmpty()) {
            return IdentityResult.failed(AuthFailureKind.MALFORMED, "Session token has an invalid " + tenantClaim + " claim");
        }

        Object rawRole = claims.get(roleClaim);
        PermissionLevel level = PermissionLevel.READ;
        if (rawRole != null) {
            Optional<PermissionLevel> parsed = PermissionLevel.parse(String.valueOf(rawRole));
            if (parsed.isEmpty()) {
                return IdentityResult.failed(AuthFailureKind.MALFORMED, "Session token has an unknown role");
            }
            level = parsed.get();
        }

        return IdentityResult.resolved(new Principal(
                PrincipalKind.SESSION_TOKEN,
                sessionId(subject),
                scope.get(),
                level,
                sessionWindows
        ));
    }

    /** Deterministic name-based UUID so counters for one subject stay stable across tokens. */
    static String sessionId(String subject) {
        return UUID.nameUUIDFromBytes(("session:" + subject).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static Optional<TenantScope> tenantScope(Object raw) {
        if (raw == null) return Optional.of(TenantScope.allSites());
        try {
            return Optional.of(TenantScope.site(UUID.fromString(String.valueOf(raw).trim())));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
