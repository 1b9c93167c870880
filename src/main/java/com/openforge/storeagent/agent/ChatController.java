package com.openforge.storeagent.agent;

import com.openforge.storeagent.agent.dto.CreateSessionRequest;
import com.openforge.storeagent.agent.dto.MessageResponse;
import com.openforge.storeagent.agent.dto.MetricsResponse;
import com.openforge.storeagent.agent.dto.SendMessageRequest;
import com.openforge.storeagent.agent.dto.SessionResponse;
import com.openforge.storeagent.websocket.ChatEventPublisher;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for chat sessions.
 *
 * Endpoints:
 *   POST   /api/chat/sessions                 create a session
 *   GET    /api/chat/sessions?ownerId=        list sessions, most recent first
 *   GET    /api/chat/sessions/{id}            one session
 *   DELETE /api/chat/sessions/{id}            delete with messages, metrics and actions
 *   GET    /api/chat/sessions/{id}/messages   full conversation log
 *   GET    /api/chat/sessions/{id}/metrics    usage counters
 *   POST   /api/chat/sessions/{id}/messages   start a turn (202 Accepted)
 *
 * Turns run on the chat turn executor; the client follows them on
 * /topic/chat/{id}.
 */
@Slf4j
@RestController
@RequestMapping("/api/chat/sessions")
@RequiredArgsConstructor
public class ChatController {

    private final ChatSessionService    sessionService;
    private final ChatHistoryService    history;
    private final SessionMetricsService metrics;
    private final ChatOrchestrator      orchestrator;

    @PostMapping
    public ResponseEntity<SessionResponse> create(@Valid @RequestBody CreateSessionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(SessionResponse.from(sessionService.create(request.ownerId(), request.title())));
    }

    @GetMapping
    public ResponseEntity<List<SessionResponse>> list(@RequestParam Long ownerId) {
        return ResponseEntity.ok(sessionService.listForOwner(ownerId).stream().map(SessionResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<SessionResponse> get(@PathVariable Long id) {
        return ResponseEntity.ok(SessionResponse.from(sessionService.get(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        sessionService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/messages")
    public ResponseEntity<List<MessageResponse>> messages(@PathVariable Long id) {
        sessionService.get(id);
        return ResponseEntity.ok(history.load(id).stream().map(history::toResponse).toList());
    }

    @GetMapping("/{id}/metrics")
    public ResponseEntity<MetricsResponse> metrics(@PathVariable Long id) {
        sessionService.get(id);
        return ResponseEntity.ok(metrics.find(id).map(MetricsResponse::from).orElse(MetricsResponse.empty(id)));
    }

    @PostMapping("/{id}/messages")
    public ResponseEntity<Map<String, Object>> send(@PathVariable Long id,
                                                    @Valid @RequestBody SendMessageRequest request) {
        orchestrator.submitMessage(id, request.requesterId(), request.text());
        log.info("[Chat:{}] Turn accepted for user {}", id, request.requesterId());
        return ResponseEntity.accepted().body(Map.of(
                "session_id", id,
                "ws_subscribe_path", ChatEventPublisher.TOPIC_PREFIX + id));
    }
}
