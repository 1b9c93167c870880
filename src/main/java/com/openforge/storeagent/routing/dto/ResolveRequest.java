package com.openforge.storeagent.routing.dto;

import jakarta.validation.constraints.NotBlank;

public record ResolveRequest(
        @NotBlank String utterance,
        String domain
) {}
