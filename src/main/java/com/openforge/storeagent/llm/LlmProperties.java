package com.openforge.storeagent.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Chat-completion provider configuration.
 *
 * agent:
 *   llm:
 *     provider:
 *       name: openai
 *       base-url: https://api.openai.com/v1
 *       api-key: sk-...
 *       model: gpt-4o
 *       timeout-seconds: 120
 *     retry:
 *       max-attempts: 2        # first call + one retry
 *       wait-duration: 1s
 *       backoff-multiplier: 2.0
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        ProviderConfig provider,
        @DefaultValue RetrySettings retry
) {

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("120")  int    timeoutSeconds,
            @DefaultValue("4096") int    maxTokens,
            @DefaultValue("0.2")  double temperature
    ) {}

    public record RetrySettings(
            @DefaultValue("2")   int      maxAttempts,
            @DefaultValue("1s")  Duration waitDuration,
            @DefaultValue("2.0") double   backoffMultiplier
    ) {}
}
