package com.openforge.storeagent.approval;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Channel used when Slack is switched off: cards go to the log and
 * decisions are made through the direct action API.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "agent.slack", name = "enabled", havingValue = "false", matchIfMissing = true)
public class LogOnlyNotificationChannel implements NotificationChannel {

    @Override
    public String postCard(ApprovalCard card) {
        String ref = "log:" + UUID.randomUUID();
        log.info("[Approval] {} ref={} requester={} expires={}\n{}",
                card.summary(), ref, card.requesterId(), card.expiresAt(), card.parameters());
        return ref;
    }

    @Override
    public void updateCard(String externalRef, ApprovalCard card) {
        log.info("[Approval] {} ref={}{}", card.summary(), externalRef,
                card.actor() == null ? "" : " by " + card.actor());
    }

    @Override
    public String name() {
        return "log";
    }
}
