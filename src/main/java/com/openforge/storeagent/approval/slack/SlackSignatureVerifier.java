package com.openforge.storeagent.approval.slack;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Checks Slack's request signature:
 *
 *   X-Slack-Signature = "v0=" + hex(HMAC-SHA256(signing_secret, "v0:" + timestamp + ":" + raw_body))
 *
 * Requests whose X-Slack-Request-Timestamp is further than the configured
 * tolerance from now are refused to block replays.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "agent.slack", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
public class SlackSignatureVerifier {

    private static final String VERSION   = "v0";
    private static final String ALGORITHM = "HmacSHA256";

    private final SlackProperties properties;
    private final Clock           clock;

    public boolean verify(String timestamp, String rawBody, String signature) {
        if (properties.signingSecret() == null || properties.signingSecret().isBlank()) {
            log.warn("[Slack] No signing secret configured, refusing interaction");
            return false;
        }
        if (timestamp == null || signature == null || rawBody == null) {
            return false;
        }
        long epochSeconds;
        try {
            epochSeconds = Long.parseLong(timestamp.trim());
        } catch (NumberFormatException e) {
            log.warn("[Slack] Malformed request timestamp '{}'", timestamp);
            return false;
        }
        Duration skew = Duration.between(Instant.ofEpochSecond(epochSeconds), clock.instant()).abs();
        if (skew.compareTo(properties.signatureTolerance()) > 0) {
            log.warn("[Slack] Request timestamp outside tolerance (skew {}s)", skew.toSeconds());
            return false;
        }
        String expected = sign(timestamp.trim(), rawBody);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signature.trim().getBytes(StandardCharsets.UTF_8));
    }

    String sign(String timestamp, String rawBody) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(properties.signingSecret().getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] digest = mac.doFinal((VERSION + ":" + timestamp + ":" + rawBody).getBytes(StandardCharsets.UTF_8));
            return VERSION + "=" + HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
