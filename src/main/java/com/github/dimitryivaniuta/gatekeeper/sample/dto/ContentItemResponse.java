package com.github.dimitryivaniuta.gatekeeper.sample.dto;

import java.util.UUID;

public record ContentItemResponse(UUID id, UUID siteId, String title, String actedBy) {}
