package com.openforge.storeagent.action.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.storeagent.action.ActionQueueService;
import com.openforge.storeagent.domain.PendingAction;

import java.time.Instant;
import java.util.UUID;

public record PendingActionResponse(
        UUID     id,
        Long     sessionId,
        Long     messageId,
        Long     requesterId,
        String   toolName,
        JsonNode toolInput,
        String   status,
        String   externalRef,
        JsonNode result,
        String   errorMessage,
        String   approvedBy,
        String   rejectedBy,
        Instant  createdAt,
        Instant  resolvedAt,
        Instant  expiresAt
) {

    public static PendingActionResponse from(PendingAction a, ActionQueueService queue) {
        return new PendingActionResponse(
                a.getId(),
                a.getSessionId(),
                a.getMessageId(),
                a.getRequesterId(),
                a.getToolName(),
                queue.readInput(a),
                a.getStatus().name().toLowerCase(),
                a.getExternalRef(),
                queue.readResult(a),
                a.getErrorMessage(),
                a.getApprovedBy(),
                a.getRejectedBy(),
                a.getCreatedAt(),
                a.getResolvedAt(),
                a.getExpiresAt()
        );
    }
}
