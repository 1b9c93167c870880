package com.openforge.storeagent.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Optional Milvus candidate index for tool examples.
 *
 * agent:
 *   milvus:
 *     enabled: false
 *     host: localhost
 *     port: 19530
 *     collection-name: tool_examples
 *     vector-dimensions: 1536
 */
@ConfigurationProperties(prefix = "agent.milvus")
public record MilvusProperties(
        @DefaultValue("false")         boolean enabled,
        @DefaultValue("localhost")     String  host,
        @DefaultValue("19530")         int     port,
        @DefaultValue("tool_examples") String  collectionName,
        @DefaultValue("1536")          int     vectorDimensions
) {}
