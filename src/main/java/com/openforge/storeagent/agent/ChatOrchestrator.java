package com.openforge.storeagent.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.storeagent.action.ActionQueueService;
import com.openforge.storeagent.action.ActionResolvedEvent;
import com.openforge.storeagent.agent.event.ChatEvent;
import com.openforge.storeagent.approval.ApprovalGateway;
import com.openforge.storeagent.common.StorageException;
import com.openforge.storeagent.domain.ChatMessage;
import com.openforge.storeagent.domain.PendingAction;
import com.openforge.storeagent.domain.PendingAction.ActionStatus;
import com.openforge.storeagent.embedding.EmbeddingClient;
import com.openforge.storeagent.llm.CompletionService;
import com.openforge.storeagent.llm.LlmClient;
import com.openforge.storeagent.llm.LlmProperties;
import com.openforge.storeagent.llm.model.ChatRequest;
import com.openforge.storeagent.llm.model.ChatResponse;
import com.openforge.storeagent.llm.model.Message;
import com.openforge.storeagent.llm.model.Tool;
import com.openforge.storeagent.llm.model.ToolCall;
import com.openforge.storeagent.routing.DomainClassifier;
import com.openforge.storeagent.routing.RouteDecision;
import com.openforge.storeagent.routing.ToolRouter;
import com.openforge.storeagent.websocket.ChatEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives chat turns: completion calls, tool interception, approval
 * suspension and resumption.
 *
 * Turn shape:
 *   1. ROUTE     classify the message into domains (optional), embed it and
 *                pick the tool subset to offer
 *   2. COMPLETE  send history + tools to the completion API
 *   3. DECIDE    text → append, done; tool calls → 4 for each call
 *   4. ACT       read tool   → execute now, append result, back to 2
 *                write tool  → enqueue, post approval card, append an
 *                              awaiting_approval placeholder, suspend
 *   5. GUARD     more than max-tool-iterations rounds → ToolLoopExceeded
 *
 * Suspension is not a parked thread. A suspended turn simply ends; when the
 * action is approved, rejected or expired an {@link ActionResolvedEvent}
 * arrives and {@link #resumeAfterDecision} picks the conversation back up
 * from persisted state alone. An approved action is run at most once: its
 * execution is claimed before the tool is called, and a resume that finds
 * the claim taken but no outcome marks the action FAILED instead of running
 * it again. The outcome message is stored before any bookkeeping.
 *
 * Both entry points run under {@link SessionTurnLock}, so one session never
 * has two turns appending messages at the same time. Every completion call
 * is counted in the session metrics, whether it succeeded or not.
 */
@Slf4j
@Service
public class ChatOrchestrator {

    private final ChatSessionService    sessionService;
    private final ChatHistoryService    history;
    private final SessionMetricsService metrics;
    private final ToolRouter            router;
    private final DomainClassifier      domainClassifier;
    private final ToolCatalog           catalog;
    private final ToolClassifier        classifier;
    private final ToolExecutor          toolExecutor;
    private final ActionQueueService    actionQueue;
    private final ApprovalGateway       gateway;
    private final CompletionService     completionService;
    private final LlmProperties         llmProperties;
    private final ChatProperties        properties;
    private final ChatEventPublisher    publisher;
    private final SessionTurnLock       turnLock;
    private final ObjectMapper          objectMapper;
    private final TaskExecutor          chatTurnExecutor;

    public ChatOrchestrator(ChatSessionService sessionService,
                            ChatHistoryService history,
                            SessionMetricsService metrics,
                            ToolRouter router,
                            DomainClassifier domainClassifier,
                            ToolCatalog catalog,
                            ToolClassifier classifier,
                            ToolExecutor toolExecutor,
                            ActionQueueService actionQueue,
                            ApprovalGateway gateway,
                            CompletionService completionService,
                            LlmProperties llmProperties,
                            ChatProperties properties,
                            ChatEventPublisher publisher,
                            SessionTurnLock turnLock,
                            ObjectMapper objectMapper,
                            @Qualifier("chatTurnExecutor") TaskExecutor chatTurnExecutor) {
        this.sessionService    = sessionService;
        this.history           = history;
        this.metrics           = metrics;
        this.router            = router;
        this.domainClassifier  = domainClassifier;
        this.catalog           = catalog;
        this.classifier        = classifier;
        this.toolExecutor      = toolExecutor;
        this.actionQueue       = actionQueue;
        this.gateway           = gateway;
        this.completionService = completionService;
        this.llmProperties     = llmProperties;
        this.properties        = properties;
        this.publisher         = publisher;
        this.turnLock          = turnLock;
        this.objectMapper      = objectMapper;
        this.chatTurnExecutor  = chatTurnExecutor;
    }

    // ── Entry point 1: a new admin message ───────────────────────────────────

    /**
     * Runs one turn synchronously.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public TurnResult sendMessage(Long sessionId, Long requesterId, String text) {
        sessionService.get(sessionId);
        return turnLock.withLock(sessionId, () -> {
            log.info("[Chat:{}] Turn started by user {}", sessionId, requesterId);
            history.appendUser(sessionId, text);
            sessionService.applyTitleIfAbsent(sessionId, text);

            RouteDecision decision = route(sessionId, text);
            List<Tool> tools = decision instanceof RouteDecision.NoMatch
                    ? catalog.allDefinitions()
                    : catalog.routedDefinitions(decision.toolNames());
            if (tools.isEmpty()) {
                tools = catalog.allDefinitions();
            }
            return runTurn(new TurnContext(sessionId, requesterId, text, decision, tools));
        });
    }

    /** Queues a turn on the turn executor; progress and result arrive as ChatEvents. */
    public void submitMessage(Long sessionId, Long requesterId, String text) {
        sessionService.get(sessionId);
        chatTurnExecutor.execute(() -> {
            try {
                sendMessage(sessionId, requesterId, text);
            } catch (RuntimeException e) {
                log.error("[Chat:{}] Turn crashed: {}", sessionId, e.getMessage(), e);
                publisher.publish(ChatEvent.error(sessionId, "The turn could not be processed: " + e.getMessage()));
            }
        });
    }

    // ── Entry point 2: an approval decision or expiry ────────────────────────

    /**
     * Schedules the resume on the turn executor. When the executor refuses
     * the task the decision stands; an approved action is picked up again by
     * the expiry job once its grace period has passed.
     */
    @EventListener
    public void onActionResolved(ActionResolvedEvent event) {
        try {
            chatTurnExecutor.execute(() -> {
                try {
                    resumeAfterDecision(event.actionId());
                } catch (RuntimeException e) {
                    log.error("[ActionQueue:{}] Resume of session {} failed: {}",
                            event.actionId(), event.sessionId(), e.getMessage(), e);
                    publisher.publish(ChatEvent.error(event.sessionId(), "Could not continue after the decision: " + e.getMessage()));
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("[ActionQueue:{}] Resume of session {} after {} not scheduled: {}",
                    event.actionId(), event.sessionId(), event.status(), e.getMessage());
        }
    }

    /**
     * Continues the session of a resolved action: runs an approved write,
     * records the outcome as a tool result and lets the model respond.
     * A resume for an action that is still pending, or whose outcome is
     * already in the conversation, does nothing.
     */
    public TurnResult resumeAfterDecision(UUID actionId) {
        Long sessionId = actionQueue.get(actionId).getSessionId();
        return turnLock.withLock(sessionId, () -> {
            PendingAction action = actionQueue.get(actionId);
            if (action.getStatus() == ActionStatus.PENDING) {
                log.debug("[ActionQueue:{}] Nothing to resume, still pending", actionId);
                return TurnResult.noOp(sessionId);
            }
            if (alreadyReported(action)) {
                log.debug("[ActionQueue:{}] Outcome already in the conversation", actionId);
                return TurnResult.noOp(sessionId);
            }

            Invocation invocation = invocationOf(action);
            PendingAction finished = switch (action.getStatus()) {
                case APPROVED -> runApproved(action, invocation);
                case EXECUTED, FAILED -> reportStoredOutcome(action, invocation);
                case REJECTED -> reportNotExecuted(action, invocation, objectMapper.createObjectNode()
                        .put("status", "rejected")
                        .put("rejected_by", action.getRejectedBy())
                        .put("message", "The admin rejected this action. It was not executed."));
                case EXPIRED -> reportNotExecuted(action, invocation, objectMapper.createObjectNode()
                        .put("status", "expired")
                        .put("message", "No decision arrived within the approval window. The action was not executed."));
                case PENDING -> throw new IllegalStateException("Unexpected status " + action.getStatus());
            };
            publisher.publish(ChatEvent.actionResolved(sessionId, actionId, action.getToolName(),
                    finished.getStatus().name().toLowerCase()));

            log.info("[Chat:{}] Resuming after {} of {}", sessionId, finished.getStatus(), action.getToolName());
            return runTurn(new TurnContext(sessionId, action.getRequesterId(), null,
                    new RouteDecision.NoMatch(), catalog.allDefinitions()));
        });
    }

    // ── The loop ─────────────────────────────────────────────────────────────

    private TurnResult runTurn(TurnContext ctx) {
        Long sessionId = ctx.sessionId();
        try {
            for (int round = 0; ; round++) {
                if (round >= properties.maxToolIterations()) {
                    throw new ToolLoopExceededException(properties.maxToolIterations());
                }
                state(sessionId, TurnState.AWAITING_COMPLETION);
                Completion completion = complete(sessionId, history.toLlmMessages(sessionId), ctx.tools());
                Message reply = completion.response().firstMessage();

                if (!completion.response().hasToolCalls()) {
                    state(sessionId, TurnState.EMITTING_TEXT);
                    String text = reply.content() == null ? "" : reply.content();
                    history.appendAssistant(sessionId, text, completion.interaction());
                    log.info("[Chat:{}] Turn completed after {} tool round(s)", sessionId, round);
                    return TurnResult.completed(sessionId, text);
                }

                state(sessionId, TurnState.REQUESTING_TOOL);
                ObjectNode interaction = completion.interaction();
                if (reply.content() != null && !reply.content().isBlank()) {
                    history.appendAssistant(sessionId, reply.content(), interaction);
                    interaction = null;
                }
                List<UUID> queued = handleToolCalls(ctx, reply.toolCalls(), interaction);
                if (!queued.isEmpty()) {
                    state(sessionId, TurnState.QUEUED_FOR_APPROVAL);
                    log.info("[Chat:{}] Turn suspended, {} action(s) awaiting approval", sessionId, queued.size());
                    return TurnResult.awaitingApproval(sessionId, queued);
                }
            }
        } catch (LlmClient.LlmException e) {
            log.warn("[Chat:{}] Completion failed: {}", sessionId, e.getMessage());
            return failTurn(sessionId, "The assistant could not respond: " + e.getMessage());
        } catch (ToolLoopExceededException e) {
            log.warn("[Chat:{}] {}", sessionId, e.getMessage());
            return failTurn(sessionId, e.getMessage());
        } catch (WriteNotQueuedException e) {
            log.warn("[Chat:{}] {}", sessionId, e.getMessage());
            return failTurn(sessionId, e.getMessage());
        }
    }

    private List<UUID> handleToolCalls(TurnContext ctx, List<ToolCall> calls, @Nullable ObjectNode interaction) {
        List<UUID> queued = new ArrayList<>();
        int executed = 0;
        try {
            for (ToolCall call : calls) {
                String toolName = call.function().name();
                JsonNode input  = parseArguments(call.function().arguments());
                boolean write   = classifier.isMutating(toolName);
                ObjectNode route = routeInfo(ctx, toolName);

                ChatMessage invocation = history.appendToolInvocation(
                        ctx.sessionId(), call, input, write, route, interaction);
                interaction = null;

                if (input == null) {
                    history.appendToolResult(ctx.sessionId(), call.id(), toolName,
                            error("Arguments were not valid JSON: " + call.function().arguments()), true, null, false);
                } else if (write) {
                    queued.add(queueForApproval(ctx, call, input, invocation));
                } else {
                    executeRead(ctx, call, input, route);
                    executed++;
                }
            }
        } finally {
            recordToolCalls(ctx.sessionId(), executed);
        }
        return queued;
    }

    private void executeRead(TurnContext ctx, ToolCall call, JsonNode input, @Nullable ObjectNode route) {
        state(ctx.sessionId(), TurnState.EXECUTING_READ);
        String toolName = call.function().name();
        try {
            JsonNode result = toolExecutor.execute(toolName, input);
            history.appendToolResult(ctx.sessionId(), call.id(), toolName,
                    result == null ? objectMapper.nullNode() : result, false, null, false);
            confirmRoute(route);
        } catch (ToolExecutionException e) {
            log.info("[Chat:{}] Read tool {} failed: {}", ctx.sessionId(), toolName, e.getMessage());
            history.appendToolResult(ctx.sessionId(), call.id(), toolName, error(e.getMessage()), true, null, false);
        }
    }

    /**
     * Enqueues the write and posts its approval card. If either step fails the
     * write is withdrawn and the turn ends; a write must never be silently lost.
     */
    private UUID queueForApproval(TurnContext ctx, ToolCall call, JsonNode input, ChatMessage invocation) {
        String toolName = call.function().name();
        PendingAction action = null;
        try {
            action = actionQueue.enqueue(ctx.sessionId(), invocation.getId(), ctx.requesterId(), toolName, input);
            String ref = gateway.requestApproval(action);
            actionQueue.attachExternalRef(action.getId(), ref);
        } catch (RuntimeException e) {
            UUID actionId = action == null ? null : action.getId();
            if (actionId != null) {
                withdraw(actionId);
            }
            history.appendToolResult(ctx.sessionId(), call.id(), toolName,
                    error("Not queued for approval: " + e.getMessage()), true, actionId, false);
            throw new WriteNotQueuedException(toolName, e);
        }

        ObjectNode placeholder = objectMapper.createObjectNode()
                .put("status", "awaiting_approval")
                .put("pending_action_id", action.getId().toString())
                .put("expires_at", action.getExpiresAt().toString())
                .put("message", "Queued for human approval. The outcome will follow as an update.");
        history.appendToolResult(ctx.sessionId(), call.id(), toolName, placeholder, false, action.getId(), true);
        publisher.publish(ChatEvent.approvalRequested(ctx.sessionId(), action.getId(), toolName));
        return action.getId();
    }

    private void withdraw(UUID actionId) {
        try {
            actionQueue.reject(actionId, "system");
        } catch (RuntimeException e) {
            log.warn("[ActionQueue:{}] Could not withdraw unannounced action: {}", actionId, e.getMessage());
        }
    }

    // ── Resume helpers ───────────────────────────────────────────────────────

    private PendingAction runApproved(PendingAction action, Invocation invocation) {
        JsonNode input = actionQueue.readInput(action);
        if (!actionQueue.claimExecution(action.getId())) {
            return reportInterrupted(action, invocation);
        }

        PendingAction finished;
        JsonNode content;
        boolean failed;
        try {
            JsonNode result = toolExecutor.execute(action.getToolName(), input);
            result   = result == null ? objectMapper.nullNode() : result;
            finished = actionQueue.markExecuted(action.getId(), result);
            content  = result;
            failed   = false;
        } catch (ToolExecutionException e) {
            log.warn("[ActionQueue:{}] Approved {} failed: {}", action.getId(), action.getToolName(), e.getMessage());
            finished = actionQueue.markFailed(action.getId(), e.getMessage());
            content  = error(e.getMessage());
            failed   = true;
        }
        history.appendToolResult(action.getSessionId(), invocation.callId(), action.getToolName(),
                content, failed, action.getId(), false);

        recordToolCalls(action.getSessionId(), 1);
        gateway.notifyOutcome(finished);
        if (!failed) {
            confirmRoute(invocation.route());
        }
        return finished;
    }

    /**
     * An earlier run claimed the execution but never recorded an outcome,
     * so whether the tool took effect is unknown. The action is failed
     * rather than run a second time.
     */
    private PendingAction reportInterrupted(PendingAction action, Invocation invocation) {
        String message = "The approved " + action.getToolName() + " call was interrupted before its outcome "
                + "was recorded. It was not run again; check the store before retrying.";
        log.warn("[ActionQueue:{}] Execution claimed earlier without an outcome, marking failed", action.getId());
        PendingAction failed = actionQueue.markFailed(action.getId(), message);
        history.appendToolResult(action.getSessionId(), invocation.callId(), action.getToolName(),
                error(message), true, action.getId(), false);
        gateway.notifyOutcome(failed);
        return failed;
    }

    /** The action finished but its outcome never reached the conversation. */
    private PendingAction reportStoredOutcome(PendingAction action, Invocation invocation) {
        boolean failed = action.getStatus() == ActionStatus.FAILED;
        JsonNode result = actionQueue.readResult(action);
        JsonNode content = failed
                ? error(action.getErrorMessage())
                : result == null ? objectMapper.nullNode() : result;
        history.appendToolResult(action.getSessionId(), invocation.callId(), action.getToolName(),
                content, failed, action.getId(), false);
        return action;
    }

    private PendingAction reportNotExecuted(PendingAction action, Invocation invocation, ObjectNode notice) {
        history.appendToolResult(action.getSessionId(), invocation.callId(), action.getToolName(),
                notice, false, action.getId(), false);
        return action;
    }

    /** True when a non-placeholder result for this action is already stored. */
    private boolean alreadyReported(PendingAction action) {
        String id = action.getId().toString();
        for (ChatMessage message : history.load(action.getSessionId())) {
            if (message.getRole() != ChatMessage.Role.TOOL_RESULT) continue;
            JsonNode content = history.content(message);
            if (id.equals(content.path("pending_action_id").asText(null))
                    && !content.path("awaiting_approval").asBoolean(false)) {
                return true;
            }
        }
        return false;
    }

    private Invocation invocationOf(PendingAction action) {
        return history.find(action.getMessageId())
                .map(history::content)
                .map(c -> new Invocation(c.path("id").asText("action-" + action.getId()),
                        c.path("route").isObject() ? (ObjectNode) c.path("route") : null))
                .orElseGet(() -> {
                    log.warn("[ActionQueue:{}] Invocation message {} not found", action.getId(), action.getMessageId());
                    return new Invocation("action-" + action.getId(), null);
                });
    }

    // ── Routing ──────────────────────────────────────────────────────────────

    private RouteDecision route(Long sessionId, String text) {
        Set<String> domains = classifyDomains(sessionId, text);
        try {
            return router.resolveWithin(text, domains);
        } catch (EmbeddingClient.EmbeddingException | StorageException e) {
            log.warn("[Chat:{}] Routing unavailable, offering every tool: {}", sessionId, e.getMessage());
            return new RouteDecision.NoMatch();
        }
    }

    /** Domains to search; empty when classification is off or failed. */
    private Set<String> classifyDomains(Long sessionId, String text) {
        if (!domainClassifier.isEnabled()) {
            return Set.of();
        }
        AtomicInteger attempts = new AtomicInteger();
        long start = System.currentTimeMillis();
        DomainClassifier.Classification classification = null;
        try {
            classification = domainClassifier.classify(text, attempts::incrementAndGet);
            return classification.domains();
        } catch (LlmClient.LlmException | StorageException e) {
            log.warn("[Chat:{}] Domain classification failed, searching every domain: {}", sessionId, e.getMessage());
            return Set.of();
        } finally {
            if (attempts.get() > 0) {
                recordCompletion(sessionId, attempts.get(),
                        classification == null ? 0 : classification.inputTokens(),
                        classification == null ? 0 : classification.outputTokens(),
                        System.currentTimeMillis() - start);
            }
        }
    }

    @Nullable
    private ObjectNode routeInfo(TurnContext ctx, String toolName) {
        if (ctx.utterance() == null) return null;
        return ctx.decision().matchFor(toolName)
                .map(example -> objectMapper.createObjectNode()
                        .put("utterance", ctx.utterance())
                        .put("example_id", example.getId())
                        .put("kind", ctx.decision() instanceof RouteDecision.Confident ? "confident" : "ambiguous"))
                .orElse(null);
    }

    /** Feeds a successful routed call back into the router; learning is best effort. */
    private void confirmRoute(@Nullable ObjectNode route) {
        if (route == null || !route.hasNonNull("example_id")) return;
        try {
            router.confirm(route.path("utterance").asText(), route.path("example_id").asLong());
        } catch (EmbeddingClient.EmbeddingException | StorageException | IllegalArgumentException e) {
            log.warn("[Router] Learning skipped for example {}: {}", route.path("example_id").asLong(), e.getMessage());
        }
    }

    // ── Completion ───────────────────────────────────────────────────────────

    private Completion complete(Long sessionId, List<Message> messages, List<Tool> tools) {
        LlmProperties.ProviderConfig provider = llmProperties.provider();
        ChatRequest request = ChatRequest.withTools(completionService.modelName(), messages, tools,
                provider.temperature(), provider.maxTokens());

        AtomicInteger attempts = new AtomicInteger();
        long start = System.currentTimeMillis();
        ChatResponse response = null;
        try {
            response = completionService.complete(request, attempts::incrementAndGet);
            long latency = System.currentTimeMillis() - start;
            log.debug("[Chat:{}] Completion in {}ms, tokens {}/{}", sessionId, latency,
                    response.inputTokens(), response.outputTokens());
            return new Completion(response, interaction(request, response, latency));
        } finally {
            // a call refused by the open circuit still counts once
            recordCompletion(sessionId, Math.max(1, attempts.get()),
                    response == null ? 0 : response.inputTokens(),
                    response == null ? 0 : response.outputTokens(),
                    System.currentTimeMillis() - start);
        }
    }

    private ObjectNode interaction(ChatRequest request, ChatResponse response, long latencyMs) {
        ObjectNode node = objectMapper.createObjectNode()
                .put("model", response.model() == null ? request.model() : response.model())
                .put("input_tokens", response.inputTokens())
                .put("output_tokens", response.outputTokens())
                .put("latency_ms", latencyMs);
        if (properties.captureRawInteractions()) {
            node.set("raw_request", objectMapper.valueToTree(request));
            node.set("raw_response", objectMapper.valueToTree(response));
        }
        return node;
    }

    // ── Metrics, best effort ─────────────────────────────────────────────────

    private void recordCompletion(Long sessionId, int apiCalls, long inputTokens, long outputTokens, long durationMs) {
        try {
            metrics.recordCompletion(sessionId, apiCalls, inputTokens, outputTokens, durationMs);
        } catch (StorageException e) {
            log.warn("[Chat:{}] Metrics not recorded: {}", sessionId, e.getMessage());
        }
    }

    private void recordToolCalls(Long sessionId, int count) {
        try {
            metrics.recordToolCalls(sessionId, count);
        } catch (StorageException e) {
            log.warn("[Chat:{}] Tool call metrics not recorded: {}", sessionId, e.getMessage());
        }
    }

    // ── Misc helpers ─────────────────────────────────────────────────────────

    private TurnResult failTurn(Long sessionId, String message) {
        history.appendAssistantError(sessionId, message);
        state(sessionId, TurnState.FAILED);
        publisher.publish(ChatEvent.error(sessionId, message));
        return TurnResult.failed(sessionId, message);
    }

    private void state(Long sessionId, TurnState state) {
        publisher.publish(ChatEvent.turnState(sessionId, state));
    }

    @Nullable
    private JsonNode parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(arguments);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private ObjectNode error(String message) {
        return objectMapper.createObjectNode().put("error", message);
    }

    // ── Internal types ───────────────────────────────────────────────────────

    /** @param utterance admin text that started the turn; null for resumed turns */
    private record TurnContext(Long sessionId, Long requesterId, @Nullable String utterance,
                               RouteDecision decision, List<Tool> tools) {}

    private record Completion(ChatResponse response, ObjectNode interaction) {}

    private record Invocation(String callId, @Nullable ObjectNode route) {}

    private static final class WriteNotQueuedException extends RuntimeException {
        private WriteNotQueuedException(String toolName, Throwable cause) {
            super("The " + toolName + " request was not queued for approval: " + cause.getMessage(), cause);
        }
    }
}
