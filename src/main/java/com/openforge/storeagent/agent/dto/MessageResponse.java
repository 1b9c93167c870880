package com.openforge.storeagent.agent.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDateTime;

public record MessageResponse(
        Long          id,
        Long          sessionId,
        String        role,
        JsonNode      content,
        JsonNode      apiInteraction,
        LocalDateTime createdAt
) {}
