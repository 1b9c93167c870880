package com.openforge.storeagent.routing;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * agent:
 *   router:
 *     confidence-threshold: 0.80   # τ, minimum top score for any routed answer
 *     margin: 0.05                 # δ, required lead over the best other tool
 *     top-k: 5
 *     learning-enabled: true
 *     seed-on-startup: true
 *     seed-resource: classpath:tool-catalog.yml
 */
@ConfigurationProperties(prefix = "agent.router")
public record RouterProperties(
        @DefaultValue("0.80") double  confidenceThreshold,
        @DefaultValue("0.05") double  margin,
        @DefaultValue("5")    int     topK,
        @DefaultValue("true") boolean learningEnabled,
        @DefaultValue("true") boolean seedOnStartup,
        @DefaultValue("classpath:tool-catalog.yml") String seedResource
) {}
