package com.openforge.storeagent.approval.slack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.storeagent.approval.ApprovalGateway;
import com.openforge.storeagent.approval.Decision;
import com.openforge.storeagent.approval.DecisionOutcome;
import com.openforge.storeagent.approval.UnknownReferenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Receives Slack interactive payloads (button clicks on approval cards).
 *
 * Slack posts form-encoded {@code payload=<json>} and retries anything that
 * is not a 2xx, so every verified request is answered 200 whatever happened
 * to the decision; only a bad signature gets 401.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "agent.slack", name = "enabled", havingValue = "true")
public class SlackInteractionController {

    private final SlackSignatureVerifier verifier;
    private final ApprovalGateway        gateway;
    private final ObjectMapper           objectMapper;

    @PostMapping(path = "/api/slack/interactions", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<Void> interact(
            @RequestHeader(name = "X-Slack-Request-Timestamp", required = false) String timestamp,
            @RequestHeader(name = "X-Slack-Signature", required = false) String signature,
            @RequestBody String rawBody) {

        if (!verifier.verify(timestamp, rawBody, signature)) {
            log.warn("[Slack] Rejected interaction with invalid signature");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        Optional<SlackDecision> parsed = parse(rawBody);
        if (parsed.isEmpty()) {
            return ResponseEntity.ok().build();
        }
        SlackDecision d = parsed.get();
        try {
            DecisionOutcome outcome = gateway.onDecision(d.externalRef(), d.decision(), d.actor());
            log.info("[Slack] {} by {} on {} → {}", d.decision(), d.actor(), d.externalRef(), outcome);
        } catch (UnknownReferenceException e) {
            log.warn("[Slack] {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Slack] Decision on {} failed: {}", d.externalRef(), e.getMessage(), e);
        }
        return ResponseEntity.ok().build();
    }

    // ── Payload parsing ──────────────────────────────────────────────────────

    Optional<SlackDecision> parse(String rawBody) {
        String payload = null;
        for (String pair : rawBody.split("&")) {
            if (pair.startsWith("payload=")) {
                payload = URLDecoder.decode(pair.substring("payload=".length()), StandardCharsets.UTF_8);
            }
        }
        if (payload == null) {
            log.warn("[Slack] Interaction without payload field");
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("[Slack] Unparseable interaction payload: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (!"block_actions".equals(root.path("type").asText())) {
            log.debug("[Slack] Ignoring interaction type {}", root.path("type").asText());
            return Optional.empty();
        }

        String actionId = root.path("actions").path(0).path("action_id").asText("");
        Decision decision;
        if (actionId.startsWith(SlackNotificationChannel.APPROVE_PREFIX)) {
            decision = Decision.APPROVE;
        } else if (actionId.startsWith(SlackNotificationChannel.REJECT_PREFIX)) {
            decision = Decision.REJECT;
        } else {
            log.debug("[Slack] Ignoring unrelated action {}", actionId);
            return Optional.empty();
        }

        String channel = firstText(root.path("container").path("channel_id"), root.path("channel").path("id"));
        String ts      = firstText(root.path("container").path("message_ts"), root.path("message").path("ts"));
        if (channel == null || ts == null) {
            log.warn("[Slack] Interaction {} carries no message reference", actionId);
            return Optional.empty();
        }

        JsonNode user = root.path("user");
        String actor = firstText(user.path("username"), user.path("name"), user.path("id"));
        return Optional.of(new SlackDecision(channel + ":" + ts, decision, actor == null ? "slack-user" : actor));
    }

    private static String firstText(JsonNode... candidates) {
        for (JsonNode node : candidates) {
            if (node.isTextual() && !node.asText().isBlank()) {
                return node.asText();
            }
        }
        return null;
    }

    record SlackDecision(String externalRef, Decision decision, String actor) {}
}
