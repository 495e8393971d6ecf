package com.github.dimitryivaniuta.gatekeeper.identity;

import com.github.dimitryivaniuta.gatekeeper.keystore.ApiKeyHashService;
import com.github.dimitryivaniuta.gatekeeper.keystore.KeyRecord;
import com.github.dimitryivaniuta.gatekeeper.keystore.KeyStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Turns the credential headers into a {@link Principal} or a specific {@link AuthFailureKind}.
 *
 * <p>Static keys are checked in this order: existence, stored status, then expiry against the clock.
 * The expiry check runs even for keys whose stored status is still {@code ACTIVE}.
 */
@Component
@RequiredArgsConstructor
public class IdentityResolver {

    private final ApiKeyHashService hashService;
    private final KeyStore keyStore;
    private final SignedTokenVerifier tokenVerifier;
    private final Clock clock;

    /**
     * @throws com.github.dimitryivaniuta.gatekeeper.keystore.KeyStoreUnavailableException when the key
     *         store cannot be reached
     */
    public IdentityResult resolve(String apiKeyHeader, String authorizationHeader) {
        PresentedCredential.Extraction extraction = PresentedCredential.extract(apiKeyHeader, authorizationHeader);
        if (!extraction.isPresent()) {
            return IdentityResult.failed(extraction.failure(), extraction.detail());
        }
        PresentedCredential credential = extraction.credential();
        return switch (credential.kind()) {
            case API_KEY -> resolveApiKey(credential.secret());
            case BEARER_TOKEN -> tokenVerifier.verify(credential.secret());
        };
    }

    private IdentityResult resolveApiKey(String rawKey) {
        Optional<KeyRecord> found = keyStore.lookupByHash(hashService.hash(rawKey));
        if (found.isEmpty()) {
            return IdentityResult.failed(AuthFailureKind.UNKNOWN_PRINCIPAL, "API key is not recognised");
        }
        KeyRecord key = found.get();

        switch (key.status()) {
            case BLOCKED:
                return IdentityResult.failed(AuthFailureKind.BLOCKED, "API key has been blocked");
            case REVOKED:
                return IdentityResult.failed(AuthFailureKind.BLOCKED, "API key has been revoked");
            case EXPIRED:
                return IdentityResult.failed(AuthFailureKind.EXPIRED, "API key has expired");
            case ACTIVE:
            default:
                break;
        }

        Instant now = clock.instant();
        if (key.expiresAt() != null && !key.expiresAt().isAfter(now)) {
            return IdentityResult.failed(AuthFailureKind.EXPIRED, "API key has expired");
        }

        return IdentityResult.resolved(new Principal(
                PrincipalKind.API_CREDENTIAL,
                key.id().toString(),
                key.tenantScope(),
                key.permissionLevel(),
                key.rateWindows()
        ));
    }
}
