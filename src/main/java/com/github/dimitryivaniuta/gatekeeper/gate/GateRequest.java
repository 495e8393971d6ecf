package com.github.dimitryivaniuta.gatekeeper.gate;

import com.github.dimitryivaniuta.gatekeeper.permission.PermissionRequirement;

import java.util.UUID;

/**
 * Everything the gate needs from an inbound request.
 *
 * @param requestedSite {@code null} when absent or unparsable
 */
public record GateRequest(
        String apiKeyHeader,
        String authorizationHeader,
        String clientIp,
        PermissionRequirement requirement,
        UUID requestedSite
) {}
