package com.openforge.storeagent.approval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.storeagent.domain.AgentTool;
import com.openforge.storeagent.domain.PendingAction;
import com.openforge.storeagent.domain.PendingAction.ActionStatus;
import com.openforge.storeagent.repository.AgentToolRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns a PendingAction into an {@link ApprovalCard}.
 */
@Component
@RequiredArgsConstructor
public class ApprovalCardRenderer {

    static final int MAX_PARAMETER_CHARS = 2000;

    private final AgentToolRepository toolRepository;
    private final ObjectMapper        objectMapper;

    public ApprovalCard render(PendingAction action) {
        String domain = toolRepository.findByToolName(action.getToolName())
                .map(AgentTool::getDomain)
                .orElse("general");
        return new ApprovalCard(
                action.getId(),
                action.getToolName(),
                domain,
                truncate(pretty(action.getToolInput())),
                action.getRequesterId(),
                action.getStatus(),
                actorOf(action),
                detailOf(action),
                action.getExpiresAt());
    }

    private static String actorOf(PendingAction action) {
        if (action.getStatus() == ActionStatus.REJECTED) {
            return action.getRejectedBy();
        }
        return action.getApprovedBy();
    }

    private String detailOf(PendingAction action) {
        return switch (action.getStatus()) {
            case EXECUTED -> action.getResult() == null ? null : truncate(pretty(action.getResult()));
            case FAILED   -> action.getErrorMessage();
            case EXPIRED  -> "This action request has expired and was not executed.";
            default       -> null;
        };
    }

    private String pretty(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return json;
        }
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_PARAMETER_CHARS) {
            return text;
        }
        return text.substring(0, MAX_PARAMETER_CHARS) + "...\n(truncated)";
    }
}
