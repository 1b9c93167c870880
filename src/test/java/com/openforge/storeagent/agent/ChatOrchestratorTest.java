package com.openforge.storeagent.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.storeagent.action.ActionQueueProperties;
import com.openforge.storeagent.action.ActionQueueService;
import com.openforge.storeagent.action.ActionResolvedEvent;
import com.openforge.storeagent.action.PendingActionExpiryJob;
import com.openforge.storeagent.agent.event.ChatEventType;
import com.openforge.storeagent.approval.ApprovalCardRenderer;
import com.openforge.storeagent.approval.ApprovalGateway;
import com.openforge.storeagent.approval.Decision;
import com.openforge.storeagent.approval.DecisionOutcome;
import com.openforge.storeagent.approval.NotificationChannel;
import com.openforge.storeagent.approval.NotificationException;
import com.openforge.storeagent.common.StorageException;
import com.openforge.storeagent.config.AppConfig;
import com.openforge.storeagent.config.JpaConfig;
import com.openforge.storeagent.domain.AgentTool;
import com.openforge.storeagent.domain.ChatMessage;
import com.openforge.storeagent.domain.ChatMessage.Role;
import com.openforge.storeagent.domain.ChatSessionMetrics;
import com.openforge.storeagent.domain.PendingAction;
import com.openforge.storeagent.domain.PendingAction.ActionStatus;
import com.openforge.storeagent.domain.ToolExample;
import com.openforge.storeagent.embedding.EmbeddingClient;
import com.openforge.storeagent.embedding.EmbeddingProperties;
import com.openforge.storeagent.embedding.InMemoryVectorSearch;
import com.openforge.storeagent.embedding.ToolExampleStore;
import com.openforge.storeagent.llm.CompletionService;
import com.openforge.storeagent.llm.LlmClient;
import com.openforge.storeagent.llm.LlmProperties;
import com.openforge.storeagent.llm.model.ChatRequest;
import com.openforge.storeagent.llm.model.ChatResponse;
import com.openforge.storeagent.llm.model.Message;
import com.openforge.storeagent.llm.model.ToolCall;
import com.openforge.storeagent.repository.AgentToolRepository;
import com.openforge.storeagent.repository.ChatMessageRepository;
import com.openforge.storeagent.repository.ChatSessionMetricsRepository;
import com.openforge.storeagent.repository.ChatSessionRepository;
import com.openforge.storeagent.repository.PendingActionRepository;
import com.openforge.storeagent.repository.ToolExampleRepository;
import com.openforge.storeagent.routing.DomainClassifier;
import com.openforge.storeagent.routing.DomainClassifierProperties;
import com.openforge.storeagent.routing.RouterProperties;
import com.openforge.storeagent.routing.ToolRouter;
import com.openforge.storeagent.support.MutableClock;
import com.openforge.storeagent.websocket.ChatEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Full turns against the real persistence layer; only the completion API,
 * the embedding API, the notification channel and the WebSocket fan-out
 * are mocked.
 */
@DataJpaTest
@Import(JpaConfig.class)
class ChatOrchestratorTest {

    private static final Instant START   = Instant.parse("2026-03-01T10:00:00Z");
    private static final String  REFUND  = "{\"order_id\":\"1001\",\"amount\":25.00}";
    private static final String  ASK     = "Please refund 25 dollars on order 1001";

    @Autowired private AgentToolRepository          toolRepository;
    @Autowired private ToolExampleRepository        exampleRepository;
    @Autowired private PendingActionRepository      actionRepository;
    @Autowired private ChatSessionRepository        sessionRepository;
    @Autowired private ChatMessageRepository        messageRepository;
    @Autowired private ChatSessionMetricsRepository metricsRepository;
    @Autowired private PlatformTransactionManager   transactionManager;

    private final ObjectMapper   objectMapper = new AppConfig().objectMapper();
    private final MutableClock   clock        = new MutableClock(START);
    private final List<Object>   events       = new ArrayList<>();
    private final List<JsonNode> refundCalls  = new ArrayList<>();
    private final ActionQueueProperties actionProperties =
            new ActionQueueProperties(Duration.ofHours(1), Duration.ofMinutes(1), Duration.ofMinutes(5));

    private boolean executorDown;

    private CompletionService     completion;
    private EmbeddingClient       embedding;
    private NotificationChannel   channel;
    private ChatEventPublisher    publisher;
    private ToolExampleStore      store;
    private ActionQueueService    actionQueue;
    private ApprovalGateway       gateway;
    private ChatHistoryService    history;
    private SessionMetricsService metrics;
    private ChatOrchestrator      orchestrator;
    private ToolRouter            router;
    private ChatSessionService    sessions;
    private ToolCatalog           catalog;
    private Map<String, ToolHandler> handlers;
    private ChatProperties        properties;
    private SessionTurnLock       turnLock;
    private LlmProperties         llmProperties;
    private ToolExample           refundExample;
    private Long                  sessionId;

    @BeforeEach
    void setUp() {
        tool("issue_refund", "orders", "issueRefund");
        tool("get_order", "orders", "getOrder");
        tool("get_customer", "customers", "getCustomer");

        store = new ToolExampleStore(exampleRepository, new InMemoryVectorSearch(exampleRepository),
                new EmbeddingProperties("http://localhost:9", "sk-test", "test-embed", 4, 5), clock);
        refundExample = store.upsertExample("issue_refund", "orders", "refund order 1001", new float[]{1, 0, 0, 0});
        store.upsertExample("get_order", "orders", "show order 1001", new float[]{0, 1, 0, 0});
        store.upsertExample("get_customer", "customers", "who is customer 7", new float[]{0, 0, 1, 0});

        embedding = mock(EmbeddingClient.class);
        when(embedding.embed(anyString())).thenReturn(new float[]{1, 0, 0, 0});
        router = new ToolRouter(embedding, store,
                new RouterProperties(0.80, 0.05, 5, true, false, "classpath:tool-catalog.yml"));

        actionQueue = new ActionQueueService(actionRepository, actionProperties, objectMapper, clock);
        channel = mock(NotificationChannel.class);
        when(channel.postCard(any())).thenReturn("ext-42");
        when(channel.name()).thenReturn("test");
        gateway = new ApprovalGateway(actionQueue, channel,
                new ApprovalCardRenderer(toolRepository, objectMapper), events::add, clock);

        publisher = mock(ChatEventPublisher.class);
        properties = new ChatProperties(10, 60, false, 50, "You are a test assistant.");
        turnLock = new SessionTurnLock();
        history = new ChatHistoryService(messageRepository, sessionRepository, publisher, objectMapper, properties, clock);
        metrics = spy(new SessionMetricsService(metricsRepository, clock));
        sessions = new ChatSessionService(sessionRepository, messageRepository,
                metricsRepository, actionQueue, turnLock, properties, new TransactionTemplate(transactionManager));

        catalog = new ToolCatalog(toolRepository, objectMapper);
        handlers = Map.of(
                "issueRefund", input -> {
                    refundCalls.add(input);
                    return objectMapper.createObjectNode()
                            .put("refund_id", "rf_1")
                            .put("amount", input.path("amount").asDouble());
                },
                "getOrder", input -> objectMapper.createObjectNode()
                        .put("order_id", input.path("order_id").asText())
                        .put("status", "shipped"),
                "getCustomer", input -> {
                    throw new IllegalStateException("CRM unavailable");
                });

        completion = mock(CompletionService.class);
        when(completion.modelName()).thenReturn("test-model");
        llmProperties = new LlmProperties(
                new LlmProperties.ProviderConfig("test", "http://localhost:9", "sk-test", "test-model", 5, 512, 0.2),
                new LlmProperties.RetrySettings(2, Duration.ofMillis(10), 2.0));

        orchestrator = orchestrator(false);

        sessionId = sessions.create(42L, null).getId();
    }

    private ChatOrchestrator orchestrator(boolean classifyDomains) {
        DomainClassifier domainClassifier = new DomainClassifier(completion, toolRepository,
                new DomainClassifierProperties(classifyDomains, "", 3, 100,
                        Map.of("orders", "Orders and refunds", "customers", "Customer profiles")));
        return new ChatOrchestrator(sessions, history, metrics, router, domainClassifier, catalog,
                new ToolClassifier(new ToolPolicyProperties(Set.of("issue_refund"))),
                new ToolExecutor(catalog, handlers), actionQueue, gateway, completion, llmProperties,
                properties, publisher, turnLock, objectMapper, task -> {
                    if (executorDown) {
                        throw new TaskRejectedException("turn executor saturated");
                    }
                    task.run();
                });
    }

    // ── Fixtures ─────────────────────────────────────────────────────────────

    private void tool(String name, String domain, String entryPoint) {
        toolRepository.save(AgentTool.builder()
                .toolName(name)
                .domain(domain)
                .toolDescription("Test tool " + name)
                .inputSchema("{\"type\":\"object\"}")
                .entryPoint(entryPoint)
                .build());
    }

    private static ChatResponse toolCall(String id, String name, String arguments) {
        Message message = Message.assistant(null, List.of(ToolCall.function(id, name, arguments)));
        return new ChatResponse("r-" + id, "chat.completion", 0L, "test-model",
                List.of(new ChatResponse.Choice(0, message, "tool_calls")),
                new ChatResponse.Usage(100, 10, 110));
    }

    private static ChatResponse text(String content) {
        return new ChatResponse("r-text", "chat.completion", 0L, "test-model",
                List.of(new ChatResponse.Choice(0, Message.assistantText(content), "stop")),
                new ChatResponse.Usage(120, 8, 128));
    }

    private List<Role> roles() {
        return history.load(sessionId).stream().map(ChatMessage::getRole).toList();
    }

    private JsonNode lastContent() {
        List<ChatMessage> all = history.load(sessionId);
        return history.content(all.get(all.size() - 1));
    }

    private JsonNode lastToolResult() {
        List<ChatMessage> all = history.load(sessionId);
        for (int i = all.size() - 1; i >= 0; i--) {
            if (all.get(i).getRole() == Role.TOOL_RESULT) {
                return history.content(all.get(i));
            }
        }
        throw new AssertionError("no tool result in session " + sessionId);
    }

    private ChatSessionMetrics sessionMetrics() {
        return metrics.find(sessionId).orElseThrow();
    }

    // ── Write path ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("an approved refund runs once and the model answers with its outcome")
    void approvedWrite() {
        when(completion.complete(any(), any())).thenReturn(
                toolCall("call_1", "issue_refund", REFUND),
                text("Refund of 25.00 issued for order 1001."));

        TurnResult first = orchestrator.sendMessage(sessionId, 7L, ASK);

        assertThat(first.outcome()).isEqualTo(TurnResult.Outcome.AWAITING_APPROVAL);
        assertThat(first.pendingActionIds()).hasSize(1);
        UUID actionId = first.pendingActionIds().get(0);
        PendingAction pending = actionQueue.get(actionId);
        assertThat(pending.getStatus()).isEqualTo(ActionStatus.PENDING);
        assertThat(pending.getExternalRef()).isEqualTo("ext-42");
        assertThat(pending.getRequesterId()).isEqualTo(7L);
        assertThat(actionQueue.readInput(pending).path("order_id").asText()).isEqualTo("1001");
        assertThat(actionQueue.readInput(pending).path("amount").asDouble()).isEqualTo(25.00);
        assertThat(refundCalls).isEmpty();
        assertThat(roles()).containsExactly(Role.USER, Role.TOOL_INVOCATION, Role.TOOL_RESULT);
        assertThat(history.load(sessionId).get(1).getId()).isEqualTo(pending.getMessageId());
        assertThat(lastToolResult().path("awaiting_approval").asBoolean()).isTrue();
        verify(publisher, atLeastOnce()).publish(argThat(e -> e.type() == ChatEventType.APPROVAL_REQUESTED));

        assertThat(gateway.onDecision("ext-42", Decision.APPROVE, "admin-7")).isEqualTo(DecisionOutcome.APPLIED);
        assertThat(events).containsExactly(new ActionResolvedEvent(actionId, sessionId, ActionStatus.APPROVED));

        TurnResult resumed = orchestrator.resumeAfterDecision(actionId);

        assertThat(resumed.outcome()).isEqualTo(TurnResult.Outcome.COMPLETED);
        assertThat(resumed.reply()).isEqualTo("Refund of 25.00 issued for order 1001.");
        assertThat(refundCalls).hasSize(1);
        assertThat(refundCalls.get(0).path("order_id").asText()).isEqualTo("1001");

        PendingAction executed = actionQueue.get(actionId);
        assertThat(executed.getStatus()).isEqualTo(ActionStatus.EXECUTED);
        assertThat(executed.getApprovedBy()).isEqualTo("admin-7");
        assertThat(actionQueue.readResult(executed).path("refund_id").asText()).isEqualTo("rf_1");

        assertThat(roles()).containsExactly(
                Role.USER, Role.TOOL_INVOCATION, Role.TOOL_RESULT, Role.TOOL_RESULT, Role.ASSISTANT);
        JsonNode outcome = lastToolResult();
        assertThat(outcome.path("pending_action_id").asText()).isEqualTo(actionId.toString());
        assertThat(outcome.path("awaiting_approval").asBoolean(false)).isFalse();
        assertThat(outcome.path("is_error").asBoolean()).isFalse();

        ArgumentCaptor<ChatRequest> requests = ArgumentCaptor.forClass(ChatRequest.class);
        verify(completion, times(2)).complete(requests.capture(), any());
        assertThat(requests.getAllValues().get(0).tools())
                .extracting(t -> t.function().name())
                .containsExactly("issue_refund", "get_order");
        List<Message> resumedMessages = requests.getAllValues().get(1).messages();
        assertThat(resumedMessages.get(resumedMessages.size() - 1).content())
                .startsWith("Update on the earlier issue_refund call (call_1)")
                .contains("rf_1");

        ChatSessionMetrics totals = sessionMetrics();
        assertThat(totals.getTotalApiCalls()).isEqualTo(2);
        assertThat(totals.getTotalToolCalls()).isEqualTo(1);
        assertThat(totals.getTotalInputTokens()).isEqualTo(220L);
        assertThat(totals.getTotalOutputTokens()).isEqualTo(18L);

        verify(channel).updateCard(eq("ext-42"), argThat(card -> card.status() == ActionStatus.EXECUTED));
        assertThat(store.findById(refundExample.getId())).get().extracting(ToolExample::getUsageCount).isEqualTo(1);
        assertThat(store.findExample("issue_refund", ASK)).get().extracting(ToolExample::getIsLearned).isEqualTo(true);
    }

    @Test
    @DisplayName("a repeated approval neither re-runs the refund nor resumes the session twice")
    void duplicateApproval() {
        when(completion.complete(any(), any())).thenReturn(toolCall("call_1", "issue_refund", REFUND), text("Done."));
        UUID actionId = orchestrator.sendMessage(sessionId, 7L, ASK).pendingActionIds().get(0);
        gateway.onDecision("ext-42", Decision.APPROVE, "admin-7");
        orchestrator.resumeAfterDecision(actionId);

        assertThat(gateway.onDecision("ext-42", Decision.APPROVE, "admin-7")).isEqualTo(DecisionOutcome.IGNORED);
        assertThat(orchestrator.resumeAfterDecision(actionId).outcome()).isEqualTo(TurnResult.Outcome.NO_OP);

        assertThat(refundCalls).hasSize(1);
        verify(completion, times(2)).complete(any(), any());
    }

    @Test
    @DisplayName("an expired request is never executed and a late approval is ignored")
    void expiredWrite() {
        when(completion.complete(any(), any())).thenReturn(
                toolCall("call_1", "issue_refund", REFUND),
                text("The refund request expired, nothing was changed."));
        UUID actionId = orchestrator.sendMessage(sessionId, 7L, ASK).pendingActionIds().get(0);

        clock.advance(Duration.ofMinutes(61));
        assertThat(actionQueue.expireStale(clock.instant()))
                .extracting(PendingAction::getId)
                .containsExactly(actionId);
        assertThat(actionQueue.sweepExpired(clock.instant())).isZero();

        assertThat(gateway.onDecision("ext-42", Decision.APPROVE, "admin-7")).isEqualTo(DecisionOutcome.IGNORED);

        TurnResult resumed = orchestrator.resumeAfterDecision(actionId);

        assertThat(resumed.outcome()).isEqualTo(TurnResult.Outcome.COMPLETED);
        assertThat(refundCalls).isEmpty();
        assertThat(actionQueue.get(actionId).getStatus()).isEqualTo(ActionStatus.EXPIRED);
        assertThat(lastToolResult().path("content").path("status").asText()).isEqualTo("expired");
    }

    @Test
    @DisplayName("an approval that arrives after the TTL but before the sweep expires the action")
    void lateApprovalBeforeSweep() {
        when(completion.complete(any(), any())).thenReturn(toolCall("call_1", "issue_refund", REFUND), text("Expired."));
        UUID actionId = orchestrator.sendMessage(sessionId, 7L, ASK).pendingActionIds().get(0);
        clock.advance(Duration.ofMinutes(61));

        assertThat(gateway.onDecision("ext-42", Decision.APPROVE, "admin-7")).isEqualTo(DecisionOutcome.EXPIRED);
        assertThat(events).containsExactly(new ActionResolvedEvent(actionId, sessionId, ActionStatus.EXPIRED));
        assertThat(actionQueue.get(actionId).getStatus()).isEqualTo(ActionStatus.EXPIRED);
        assertThat(actionQueue.get(actionId).getApprovedBy()).isNull();
    }

    @Test
    @DisplayName("a rejection is reported to the model without running the tool")
    void rejectedWrite() {
        when(completion.complete(any(), any())).thenReturn(
                toolCall("call_1", "issue_refund", REFUND),
                text("Understood, the refund was rejected."));
        UUID actionId = orchestrator.sendMessage(sessionId, 7L, ASK).pendingActionIds().get(0);

        assertThat(gateway.onDecision("ext-42", Decision.REJECT, "admin-7")).isEqualTo(DecisionOutcome.APPLIED);
        TurnResult resumed = orchestrator.resumeAfterDecision(actionId);

        assertThat(resumed.outcome()).isEqualTo(TurnResult.Outcome.COMPLETED);
        assertThat(refundCalls).isEmpty();
        JsonNode notice = lastToolResult().path("content");
        assertThat(notice.path("status").asText()).isEqualTo("rejected");
        assertThat(notice.path("rejected_by").asText()).isEqualTo("admin-7");
    }

    @Test
    @DisplayName("a write whose card cannot be posted is withdrawn and the turn fails")
    void notificationFailure() {
        when(channel.postCard(any())).thenThrow(new NotificationException("channel down"));
        when(completion.complete(any(), any())).thenReturn(toolCall("call_1", "issue_refund", REFUND));

        TurnResult result = orchestrator.sendMessage(sessionId, 7L, ASK);

        assertThat(result.outcome()).isEqualTo(TurnResult.Outcome.FAILED);
        List<PendingAction> actions = actionQueue.findForSession(sessionId);
        assertThat(actions).hasSize(1);
        assertThat(actions.get(0).getStatus()).isEqualTo(ActionStatus.REJECTED);
        assertThat(actions.get(0).getRejectedBy()).isEqualTo("system");
        assertThat(lastToolResult().path("is_error").asBoolean()).isTrue();
        assertThat(lastContent().path("error").asBoolean()).isTrue();
        assertThat(refundCalls).isEmpty();
    }

    // ── Read path ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("a read tool runs inline and the turn completes")
    void readTool() {
        when(completion.complete(any(), any())).thenReturn(
                toolCall("call_1", "get_order", "{\"order_id\":\"1001\"}"),
                text("Order 1001 has shipped."));

        TurnResult result = orchestrator.sendMessage(sessionId, 7L, "Where is order 1001?");

        assertThat(result.outcome()).isEqualTo(TurnResult.Outcome.COMPLETED);
        assertThat(result.reply()).isEqualTo("Order 1001 has shipped.");
        assertThat(roles()).containsExactly(Role.USER, Role.TOOL_INVOCATION, Role.TOOL_RESULT, Role.ASSISTANT);
        assertThat(lastToolResult().path("content").path("status").asText()).isEqualTo("shipped");
        assertThat(actionQueue.findForSession(sessionId)).isEmpty();
        assertThat(sessionMetrics().getTotalToolCalls()).isEqualTo(1);
        assertThat(sessionMetrics().getTotalApiCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("a failing read tool hands the error to the model instead of ending the turn")
    void readToolFailure() {
        when(completion.complete(any(), any())).thenReturn(
                toolCall("call_1", "get_customer", "{\"customer_id\":7}"),
                text("The customer system is unavailable right now."));

        TurnResult result = orchestrator.sendMessage(sessionId, 7L, "Who is customer 7?");

        assertThat(result.outcome()).isEqualTo(TurnResult.Outcome.COMPLETED);
        JsonNode toolResult = lastToolResult();
        assertThat(toolResult.path("is_error").asBoolean()).isTrue();
        assertThat(toolResult.path("content").path("error").asText()).contains("CRM unavailable");
    }

    @Test
    @DisplayName("malformed tool arguments become an error result")
    void malformedArguments() {
        when(completion.complete(any(), any())).thenReturn(
                toolCall("call_1", "get_order", "{order_id: 1001"),
                text("Sorry, let me try that differently."));

        TurnResult result = orchestrator.sendMessage(sessionId, 7L, "Where is order 1001?");

        assertThat(result.outcome()).isEqualTo(TurnResult.Outcome.COMPLETED);
        assertThat(lastToolResult().path("is_error").asBoolean()).isTrue();
    }

    // ── Guards ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("a model that keeps calling tools is stopped after ten rounds")
    void toolLoopGuard() {
        when(completion.complete(any(), any())).thenReturn(toolCall("call_1", "get_order", "{\"order_id\":\"1001\"}"));

        TurnResult result = orchestrator.sendMessage(sessionId, 7L, "Where is order 1001?");

        assertThat(result.outcome()).isEqualTo(TurnResult.Outcome.FAILED);
        verify(completion, times(10)).complete(any(), any());
        assertThat(sessionMetrics().getTotalApiCalls()).isEqualTo(10);
        assertThat(lastContent().path("error").asBoolean()).isTrue();
    }

    @Test
    @DisplayName("a failed completion ends the turn with an error message and is still counted")
    void completionFailure() {
        when(completion.complete(any(), any())).thenThrow(new LlmClient.LlmTransientException("HTTP 503"));

        TurnResult result = orchestrator.sendMessage(sessionId, 7L, "Where is order 1001?");

        assertThat(result.outcome()).isEqualTo(TurnResult.Outcome.FAILED);
        assertThat(roles()).containsExactly(Role.USER, Role.ASSISTANT);
        assertThat(lastContent().path("error").asBoolean()).isTrue();
        assertThat(sessionMetrics().getTotalApiCalls()).isEqualTo(1);
        verify(publisher, atLeastOnce()).publish(argThat(e -> e.type() == ChatEventType.ERROR));
    }

    @Test
    @DisplayName("when routing is unavailable every active tool is offered")
    void routingUnavailable() {
        when(embedding.embed(anyString())).thenThrow(new EmbeddingClient.EmbeddingException("embedding API down"));
        when(completion.complete(any(), any())).thenReturn(text("Hello."));

        orchestrator.sendMessage(sessionId, 7L, "hi");

        ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
        verify(completion).complete(request.capture(), any());
        assertThat(request.getValue().tools())
                .extracting(t -> t.function().name())
                .containsExactlyInAnyOrder("get_customer", "get_order", "issue_refund");
        verify(channel, never()).postCard(any());
    }

    // ── Recovery ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("an approval whose resume is refused by the executor is run by a later expiry sweep")
    void refusedResumeIsRedriven() {
        when(completion.complete(any(), any())).thenReturn(
                toolCall("call_1", "issue_refund", REFUND),
                text("Refund of 25.00 issued for order 1001."));
        UUID actionId = orchestrator.sendMessage(sessionId, 7L, ASK).pendingActionIds().get(0);
        gateway.onDecision("ext-42", Decision.APPROVE, "admin-7");

        executorDown = true;
        orchestrator.onActionResolved(new ActionResolvedEvent(actionId, sessionId, ActionStatus.APPROVED));
        assertThat(actionQueue.get(actionId).getStatus()).isEqualTo(ActionStatus.APPROVED);
        assertThat(refundCalls).isEmpty();

        List<Object> redriven = new ArrayList<>();
        PendingActionExpiryJob job = new PendingActionExpiryJob(actionQueue, actionProperties, redriven::add, clock);
        job.sweep();
        assertThat(redriven).as("still inside the grace period").isEmpty();

        executorDown = false;
        clock.advance(Duration.ofMinutes(6));
        job.sweep();
        assertThat(redriven).containsExactly(new ActionResolvedEvent(actionId, sessionId, ActionStatus.APPROVED));

        orchestrator.onActionResolved((ActionResolvedEvent) redriven.get(0));

        assertThat(actionQueue.get(actionId).getStatus()).isEqualTo(ActionStatus.EXECUTED);
        assertThat(refundCalls).hasSize(1);
        assertThat(roles()).containsExactly(
                Role.USER, Role.TOOL_INVOCATION, Role.TOOL_RESULT, Role.TOOL_RESULT, Role.ASSISTANT);

        redriven.clear();
        job.sweep();
        assertThat(redriven).isEmpty();
    }

    @Test
    @DisplayName("an approved call that started but never recorded an outcome is failed, not run again")
    void interruptedExecutionIsNotRepeated() {
        when(completion.complete(any(), any())).thenReturn(
                toolCall("call_1", "issue_refund", REFUND),
                text("The refund may not have gone through, please check the store."));
        UUID actionId = orchestrator.sendMessage(sessionId, 7L, ASK).pendingActionIds().get(0);
        gateway.onDecision("ext-42", Decision.APPROVE, "admin-7");
        assertThat(actionQueue.claimExecution(actionId)).isTrue();

        TurnResult resumed = orchestrator.resumeAfterDecision(actionId);

        assertThat(resumed.outcome()).isEqualTo(TurnResult.Outcome.COMPLETED);
        assertThat(refundCalls).isEmpty();
        PendingAction failed = actionQueue.get(actionId);
        assertThat(failed.getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(failed.getErrorMessage()).contains("interrupted");
        JsonNode outcome = lastToolResult();
        assertThat(outcome.path("is_error").asBoolean()).isTrue();
        assertThat(outcome.path("pending_action_id").asText()).isEqualTo(actionId.toString());
        verify(channel).updateCard(eq("ext-42"), argThat(card -> card.status() == ActionStatus.FAILED));
    }

    @Test
    @DisplayName("a metrics outage after an approved refund still reports the outcome to the model")
    void metricsOutageAfterApprovedWrite() {
        doThrow(new StorageException("metrics table locked", new RuntimeException()))
                .when(metrics).recordToolCalls(anyLong(), anyInt());
        when(completion.complete(any(), any())).thenReturn(
                toolCall("call_1", "issue_refund", REFUND),
                text("Refund of 25.00 issued for order 1001."));
        UUID actionId = orchestrator.sendMessage(sessionId, 7L, ASK).pendingActionIds().get(0);
        gateway.onDecision("ext-42", Decision.APPROVE, "admin-7");

        TurnResult resumed = orchestrator.resumeAfterDecision(actionId);

        assertThat(resumed.outcome()).isEqualTo(TurnResult.Outcome.COMPLETED);
        assertThat(actionQueue.get(actionId).getStatus()).isEqualTo(ActionStatus.EXECUTED);
        assertThat(roles()).containsExactly(
                Role.USER, Role.TOOL_INVOCATION, Role.TOOL_RESULT, Role.TOOL_RESULT, Role.ASSISTANT);
        assertThat(lastToolResult().path("content").path("refund_id").asText()).isEqualTo("rf_1");
        assertThat(orchestrator.resumeAfterDecision(actionId).outcome()).isEqualTo(TurnResult.Outcome.NO_OP);
        assertThat(refundCalls).hasSize(1);
    }

    @Test
    @DisplayName("an executed action whose outcome never reached the conversation is reported without re-running")
    void storedOutcomeIsReported() {
        when(completion.complete(any(), any())).thenReturn(
                toolCall("call_1", "issue_refund", REFUND),
                text("Refund rf_9 was issued."));
        UUID actionId = orchestrator.sendMessage(sessionId, 7L, ASK).pendingActionIds().get(0);
        gateway.onDecision("ext-42", Decision.APPROVE, "admin-7");
        actionQueue.markExecuted(actionId, objectMapper.createObjectNode().put("refund_id", "rf_9"));

        TurnResult resumed = orchestrator.resumeAfterDecision(actionId);

        assertThat(resumed.outcome()).isEqualTo(TurnResult.Outcome.COMPLETED);
        assertThat(refundCalls).isEmpty();
        assertThat(lastToolResult().path("content").path("refund_id").asText()).isEqualTo("rf_9");
    }

    // ── Metrics ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("every attempt of a retried completion counts as an API call")
    void retriedCompletionCountsEachAttempt() {
        when(completion.complete(any(), any())).thenAnswer(invocation -> {
            Runnable onAttempt = invocation.getArgument(1);
            onAttempt.run();
            onAttempt.run();
            return text("Hello.");
        });

        orchestrator.sendMessage(sessionId, 7L, "hi");

        assertThat(sessionMetrics().getTotalApiCalls()).isEqualTo(2);
    }

    // ── Domain classification ────────────────────────────────────────────────

    @Test
    @DisplayName("classified domains limit the example search")
    void classifiedDomainsLimitSearch() {
        orchestrator = orchestrator(true);
        when(completion.complete(any(), any()))
                .thenAnswer(invocation -> {
                    ((Runnable) invocation.getArgument(1)).run();
                    return text("Customers");
                })
                .thenReturn(text("Hello."));

        orchestrator.sendMessage(sessionId, 7L, ASK);

        ArgumentCaptor<ChatRequest> requests = ArgumentCaptor.forClass(ChatRequest.class);
        verify(completion, times(2)).complete(requests.capture(), any());
        ChatRequest classification = requests.getAllValues().get(0);
        assertThat(classification.temperature()).isEqualTo(0.0);
        assertThat(classification.messages().get(0).content())
                .contains("- customers: Customer profiles")
                .contains("- orders: Orders and refunds");
        // the refund example lies outside "customers", so nothing matches and every tool is offered
        assertThat(requests.getAllValues().get(1).tools())
                .extracting(t -> t.function().name())
                .containsExactlyInAnyOrder("get_customer", "get_order", "issue_refund");
        assertThat(sessionMetrics().getTotalApiCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("a failed classification searches every domain")
    void classificationFailure() {
        orchestrator = orchestrator(true);
        when(completion.complete(any(), any()))
                .thenThrow(new LlmClient.LlmException("HTTP 400"))
                .thenReturn(text("Hello."));

        orchestrator.sendMessage(sessionId, 7L, ASK);

        ArgumentCaptor<ChatRequest> requests = ArgumentCaptor.forClass(ChatRequest.class);
        verify(completion, times(2)).complete(requests.capture(), any());
        assertThat(requests.getAllValues().get(1).tools())
                .extracting(t -> t.function().name())
                .containsExactly("issue_refund", "get_order");
    }
}
