package com.openforge.storeagent.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Set;

/**
 * agent:
 *   tools:
 *     mutating: [issue_refund, cancel_order, ...]
 */
@ConfigurationProperties(prefix = "agent.tools")
public record ToolPolicyProperties(@DefaultValue Set<String> mutating) {}
