package com.openforge.storeagent.action;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * agent:
 *   actions:
 *     ttl: PT1H              # how long a pending action waits for a decision
 *     sweep-interval: PT1M   # how often stale pending actions are expired
 *     approved-grace: PT5M   # approved actions without an outcome after this are re-driven
 */
@ConfigurationProperties(prefix = "agent.actions")
public record ActionQueueProperties(
        @DefaultValue("PT1H") Duration ttl,
        @DefaultValue("PT1M") Duration sweepInterval,
        @DefaultValue("PT5M") Duration approvedGrace
) {}
