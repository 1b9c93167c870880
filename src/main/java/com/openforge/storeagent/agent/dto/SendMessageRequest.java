package com.openforge.storeagent.agent.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record SendMessageRequest(
        @NotNull Long requesterId,
        @NotBlank @Size(max = 8000) String text
) {}
