package com.openforge.storeagent.agent.dto;

import jakarta.validation.constraints.NotNull;

public record CreateSessionRequest(
        @NotNull Long ownerId,
        String title
) {}
