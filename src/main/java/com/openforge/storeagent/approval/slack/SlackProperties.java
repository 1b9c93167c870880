package com.openforge.storeagent.approval.slack;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * agent:
 *   slack:
 *     enabled: true
 *     base-url: https://slack.com/api
 *     bot-token: ${SLACK_BOT_TOKEN}
 *     signing-secret: ${SLACK_SIGNING_SECRET}
 *     channel: C0123ABCD
 *     timeout-seconds: 10
 *     signature-tolerance: PT5M
 */
@ConfigurationProperties(prefix = "agent.slack")
public record SlackProperties(
        @DefaultValue("false")                 boolean  enabled,
        @DefaultValue("https://slack.com/api") String   baseUrl,
        String   botToken,
        String   signingSecret,
        String   channel,
        @DefaultValue("10")                    int      timeoutSeconds,
        @DefaultValue("PT5M")                  Duration signatureTolerance
) {}
