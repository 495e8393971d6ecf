package com.github.dimitryivaniuta.gatekeeper.sample.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ContentDraftRequest(
        @NotBlank @Size(max = 200) String title,
        @Size(max = 10_000) String body
) {}
