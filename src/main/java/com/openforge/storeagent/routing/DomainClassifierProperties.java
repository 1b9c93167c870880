package com.openforge.storeagent.routing;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Map;

/**
 * agent:
 *   router:
 *     classifier:
 *       enabled: true
 *       model: ""                # blank = the completion provider's model
 *       max-domains: 3
 *       max-tokens: 100
 *       descriptions:            # prompt text per domain; domains come from the active tools
 *         orders: Order management, viewing, searching, cancelling, refunding orders
 */
@ConfigurationProperties(prefix = "agent.router.classifier")
public record DomainClassifierProperties(
        @DefaultValue("false") boolean             enabled,
        @DefaultValue("")      String              model,
        @DefaultValue("3")     int                 maxDomains,
        @DefaultValue("100")   int                 maxTokens,
        @DefaultValue          Map<String, String> descriptions
) {}
