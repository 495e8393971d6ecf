package com.github.dimitryivaniuta.gatekeeper.keystore;

import com.github.dimitryivaniuta.gatekeeper.identity.PermissionLevel;
import com.github.dimitryivaniuta.gatekeeper.identity.TenantScope;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateWindows;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "api_key")
public class ApiKey {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    /**
     * Lowercase hex SHA-256 of the raw key. The raw key is never stored.
     */
    @Column(name = "key_hash", nullable = false, unique = true, length = 64)
    private String keyHash;

    /** {@code null} means the key may act on every site. */
    @Column(name = "site_id")
    private UUID siteId;

    @Enumerated(EnumType.STRING)
    @Column(name = "permission", nullable = false, length = 16)
    private PermissionLevel permission;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    @Builder.Default
    private ApiKeyStatus status = ApiKeyStatus.ACTIVE;

    @Column(name = "rate_limit_per_second")
    private Integer rateLimitPerSecond;

    @Column(name = "rate_limit_per_minute")
    private Integer rateLimitPerMinute;

    @Column(name = "rate_limit_per_hour")
    private Integer rateLimitPerHour;

    @Column(name = "rate_limit_per_day")
    private Integer rateLimitPerDay;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "total_requests", nullable = false)
    @Builder.Default
    private long totalRequests = 0;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    @Column(name = "last_used_ip", length = 64)
    private String lastUsedIp;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }

    public KeyRecord toRecord() {
        return new KeyRecord(
                id,
                permission,
                TenantScope.site(siteId),
                status,
                new RateWindows(rateLimitPerSecond, rateLimitPerMinute, rateLimitPerHour, rateLimitPerDay),
                expiresAt
        );
    }
}
