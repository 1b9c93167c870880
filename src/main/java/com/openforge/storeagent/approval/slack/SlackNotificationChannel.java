package com.openforge.storeagent.approval.slack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.storeagent.approval.ApprovalCard;
import com.openforge.storeagent.approval.NotificationChannel;
import com.openforge.storeagent.approval.NotificationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Posts approval cards to a Slack channel through the Web API.
 *
 *   postCard   → chat.postMessage, returns "<channel>:<ts>"
 *   updateCard → chat.update on the same channel/ts
 *
 * Pending cards carry Approve/Reject buttons whose action_id is
 * "approve_<actionId>" / "reject_<actionId>"; clicks come back through
 * {@link SlackInteractionController}. Resolved cards are redrawn without
 * buttons.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "agent.slack", name = "enabled", havingValue = "true")
public class SlackNotificationChannel implements NotificationChannel {

    static final String APPROVE_PREFIX = "approve_";
    static final String REJECT_PREFIX  = "reject_";

    private static final Map<String, String> DOMAIN_EMOJI = Map.of(
            "orders",      "📦",
            "customers",   "👤",
            "products",    "🏷️",
            "inventory",   "📊",
            "discounts",   "🎟️",
            "fulfillment", "🚚",
            "finance",     "💰");

    private final HttpClient      httpClient;
    private final ObjectMapper    objectMapper;
    private final SlackProperties props;

    public SlackNotificationChannel(HttpClient httpClient,
                                    ObjectMapper objectMapper,
                                    SlackProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
    }

    // ── NotificationChannel ──────────────────────────────────────────────────

    @Override
    public String postCard(ApprovalCard card) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("channel", props.channel());
        body.put("text", card.summary());
        body.set("blocks", buildBlocks(card));

        JsonNode reply = call("chat.postMessage", body);
        String channel = reply.path("channel").asText(props.channel());
        String ts      = reply.path("ts").asText(null);
        if (ts == null || ts.isBlank()) {
            throw new NotificationException("chat.postMessage returned no ts for action " + card.actionId());
        }
        return channel + ":" + ts;
    }

    @Override
    public void updateCard(String externalRef, ApprovalCard card) {
        int sep = externalRef.indexOf(':');
        if (sep <= 0) {
            throw new NotificationException("Not a Slack message ref: " + externalRef);
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.put("channel", externalRef.substring(0, sep));
        body.put("ts", externalRef.substring(sep + 1));
        body.put("text", card.summary());
        body.set("blocks", buildBlocks(card));
        call("chat.update", body);
        log.debug("[Slack] Updated card {} → {}", externalRef, card.status());
    }

    @Override
    public String name() {
        return "slack";
    }

    // ── Block Kit ────────────────────────────────────────────────────────────

    ArrayNode buildBlocks(ApprovalCard card) {
        ArrayNode blocks = objectMapper.createArrayNode();

        String emoji = card.awaitingDecision() ? DOMAIN_EMOJI.getOrDefault(card.domain(), "🔧") + " " : "";
        ObjectNode header = blocks.addObject().put("type", "header");
        header.putObject("text").put("type", "plain_text").put("text", emoji + card.title());

        section(blocks, "*Tool:* `" + card.toolName() + "`");
        section(blocks, "*Parameters:*\n```\n" + card.parameters() + "\n```");

        String context = card.awaitingDecision()
                ? "Requested by *user " + card.requesterId() + "* • expires " + card.expiresAt()
                : statusLine(card);
        ObjectNode ctx = blocks.addObject().put("type", "context");
        ctx.putArray("elements").addObject().put("type", "mrkdwn").put("text", context);

        if (card.detail() != null) {
            String label = switch (card.status()) {
                case EXECUTED -> "*Result:*";
                case FAILED   -> "*Error:*";
                default       -> "*Note:*";
            };
            section(blocks, label + "\n```\n" + card.detail() + "\n```");
        }

        if (card.awaitingDecision()) {
            blocks.addObject().put("type", "divider");
            ArrayNode buttons = blocks.addObject().put("type", "actions").putArray("elements");
            button(buttons, "Approve", APPROVE_PREFIX + card.actionId(), card, "primary");
            button(buttons, "Reject", REJECT_PREFIX + card.actionId(), card, "danger");
        }
        return blocks;
    }

    private static String statusLine(ApprovalCard card) {
        return switch (card.status()) {
            case APPROVED, EXECUTED, FAILED -> "Approved by *" + card.actor() + "*";
            case REJECTED                   -> "Rejected by *" + card.actor() + "*";
            case EXPIRED                    -> "Expired without a decision";
            case PENDING                    -> "Waiting for a decision";
        };
    }

    private static void section(ArrayNode blocks, String markdown) {
        ObjectNode section = blocks.addObject().put("type", "section");
        section.putObject("text").put("type", "mrkdwn").put("text", markdown);
    }

    private static void button(ArrayNode elements, String label, String actionId, ApprovalCard card, String style) {
        ObjectNode button = elements.addObject().put("type", "button");
        button.putObject("text").put("type", "plain_text").put("text", label);
        button.put("action_id", actionId);
        button.put("value", card.actionId().toString());
        button.put("style", style);
    }

    // ── HTTP ─────────────────────────────────────────────────────────────────

    private JsonNode call(String method, ObjectNode body) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(props.baseUrl() + "/" + method))
                    .header("Content-Type", "application/json; charset=utf-8")
                    .header("Authorization", "Bearer " + props.botToken())
                    .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
        } catch (JsonProcessingException e) {
            throw new NotificationException("Failed to serialize Slack " + method + " body", e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted calling Slack " + method, e);
        } catch (IOException e) {
            throw new NotificationException("Network error calling Slack " + method, e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new NotificationException("Slack %s returned HTTP %d".formatted(method, response.statusCode()));
        }
        JsonNode reply;
        try {
            reply = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new NotificationException("Unparseable Slack " + method + " response", e);
        }
        if (!reply.path("ok").asBoolean(false)) {
            throw new NotificationException("Slack %s failed: %s".formatted(method, reply.path("error").asText("unknown")));
        }
        return reply;
    }
}
