package com.github.dimitryivaniuta.gatekeeper.keystore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Fire-and-forget usage bookkeeping for API credentials. Runs on the bounded usage executor; callers
 * never wait for it and a failure only costs one usage increment.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyUsageRecorder {

    private final ApiKeyRepository repo;

    @Async("usageExecutor")
    @Transactional
    public void recordUsage(UUID keyId, String clientIp, Instant usedAt) {
        try {
            int updated = repo.recordUsage(keyId, usedAt, clientIp);
            if (updated == 0) {
                log.debug("Usage not recorded: api key {} no longer exists", keyId);
            }
        } catch (DataAccessException ex) {
            log.warn("Failed to record usage for api key {}: {}", keyId, ex.getMessage());
        }
    }
}
