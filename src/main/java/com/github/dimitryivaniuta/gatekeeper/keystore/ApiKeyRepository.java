package com.github.dimitryivaniuta.gatekeeper.keystore;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface ApiKeyRepository extends JpaRepository<ApiKey, UUID> {

    Optional<ApiKey> findByKeyHash(String keyHash);

    @Modifying
    @Query("""
        update ApiKey k
           set k.totalRequests = k.totalRequests + 1,
               k.lastUsedAt = :usedAt,
               k.lastUsedIp = :ip
         where k.id = :id
        """)
    int recordUsage(@Param("id") UUID id, @Param("usedAt") Instant usedAt, @Param("ip") String ip);
}
