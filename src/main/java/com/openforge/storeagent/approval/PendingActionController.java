package com.openforge.storeagent.approval;

import com.openforge.storeagent.action.ActionQueueService;
import com.openforge.storeagent.action.dto.DecisionRequest;
import com.openforge.storeagent.action.dto.PendingActionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Pending actions as seen by the admin UI.
 *
 *   GET  /api/actions/{id}
 *   GET  /api/chat/sessions/{sessionId}/actions
 *   POST /api/actions/{id}/approve   {"actor": "..."}
 *   POST /api/actions/{id}/reject    {"actor": "..."}
 *
 * Deciding an action that is already resolved answers 409, one past its
 * TTL answers 410.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PendingActionController {

    private final ActionQueueService actionQueue;
    private final ApprovalGateway    gateway;

    @GetMapping("/actions/{id}")
    public ResponseEntity<PendingActionResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(PendingActionResponse.from(actionQueue.get(id), actionQueue));
    }

    @GetMapping("/chat/sessions/{sessionId}/actions")
    public ResponseEntity<List<PendingActionResponse>> listForSession(@PathVariable Long sessionId) {
        return ResponseEntity.ok(actionQueue.findForSession(sessionId).stream()
                .map(a -> PendingActionResponse.from(a, actionQueue))
                .toList());
    }

    @PostMapping("/actions/{id}/approve")
    public ResponseEntity<PendingActionResponse> approve(@PathVariable UUID id,
                                                         @Valid @RequestBody DecisionRequest request) {
        return ResponseEntity.ok(PendingActionResponse.from(
                gateway.decide(id, Decision.APPROVE, request.actor()), actionQueue));
    }

    @PostMapping("/actions/{id}/reject")
    public ResponseEntity<PendingActionResponse> reject(@PathVariable UUID id,
                                                        @Valid @RequestBody DecisionRequest request) {
        return ResponseEntity.ok(PendingActionResponse.from(
                gateway.decide(id, Decision.REJECT, request.actor()), actionQueue));
    }
}
