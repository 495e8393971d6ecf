package com.github.dimitryivaniuta.gatekeeper.sample.dto;

public record CallerResponse(
        String kind,
        String id,
        String tenantScope,
        String permissionLevel,
        boolean rateLimitDegraded
) {}
