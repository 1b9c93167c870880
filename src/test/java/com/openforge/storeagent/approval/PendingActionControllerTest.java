package com.openforge.storeagent.approval;

import com.openforge.storeagent.action.ActionExpiredException;
import com.openforge.storeagent.action.ActionNotFoundException;
import com.openforge.storeagent.action.ActionQueueService;
import com.openforge.storeagent.action.InvalidTransitionException;
import com.openforge.storeagent.domain.PendingAction;
import com.openforge.storeagent.domain.PendingAction.ActionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PendingActionController.class)
class PendingActionControllerTest {

    private static final UUID    ID  = UUID.fromString("0c6f8a52-7d1e-4c43-9c1a-000000000042");
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ActionQueueService actionQueue;

    @MockitoBean
    private ApprovalGateway gateway;

    private static PendingAction action(ActionStatus status) {
        return PendingAction.builder()
                .id(ID)
                .sessionId(11L)
                .requesterId(7L)
                .toolName("issue_refund")
                .toolInput("{}")
                .status(status)
                .createdAt(NOW)
                .expiresAt(NOW.plusSeconds(3600))
                .build();
    }

    @Test
    @DisplayName("approving returns the updated action")
    void approve() throws Exception {
        when(gateway.decide(ID, Decision.APPROVE, "admin-7")).thenReturn(action(ActionStatus.APPROVED));

        mockMvc.perform(post("/api/actions/{id}/approve", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"admin-7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("approved"));
    }

    @Test
    @DisplayName("deciding a resolved action answers 409")
    void conflict() throws Exception {
        when(gateway.decide(ID, Decision.REJECT, "admin-7"))
                .thenThrow(new InvalidTransitionException(ID, ActionStatus.EXECUTED, ActionStatus.REJECTED));

        mockMvc.perform(post("/api/actions/{id}/reject", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"admin-7\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"));
    }

    @Test
    @DisplayName("deciding after the TTL answers 410")
    void gone() throws Exception {
        when(gateway.decide(ID, Decision.APPROVE, "admin-7")).thenThrow(new ActionExpiredException(ID, NOW));

        mockMvc.perform(post("/api/actions/{id}/approve", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"admin-7\"}"))
                .andExpect(status().isGone())
                .andExpect(jsonPath("$.code").value("EXPIRED"));
    }

    @Test
    @DisplayName("a decision without an actor is rejected before reaching the gateway")
    void missingActor() throws Exception {
        mockMvc.perform(post("/api/actions/{id}/approve", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verify(gateway, never()).decide(any(), any(), any());
    }

    @Test
    @DisplayName("an unknown action answers 404")
    void notFound() throws Exception {
        when(actionQueue.get(ID)).thenThrow(new ActionNotFoundException(ID));

        mockMvc.perform(get("/api/actions/{id}", ID)).andExpect(status().isNotFound());
    }
}
