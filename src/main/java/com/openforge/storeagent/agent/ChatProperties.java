package com.openforge.storeagent.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * agent:
 *   chat:
 *     max-tool-iterations: 10          # tool rounds per turn before giving up
 *     max-history-messages: 60         # stored messages replayed to the model
 *     capture-raw-interactions: false  # keep raw request/response bodies on messages
 *     title-max-length: 50
 *     system-prompt: ...
 */
@ConfigurationProperties(prefix = "agent.chat")
public record ChatProperties(
        @DefaultValue("10")    int     maxToolIterations,
        @DefaultValue("60")    int     maxHistoryMessages,
        @DefaultValue("false") boolean captureRawInteractions,
        @DefaultValue("50")    int     titleMaxLength,
        @DefaultValue("You are the store's admin assistant. Use the provided tools to look up or change store data. "
                + "Write operations are queued for human approval; tell the admin when that happens.")
        String systemPrompt
) {}
