package com.openforge.storeagent.llm.model;

/**
 * The "function" sub-object inside a ToolCall returned by the LLM.
 *
 * "arguments" is a raw JSON string, e.g. {"order_id":"1001","amount":25.0};
 * the turn loop parses it before execution or enqueueing.
 */
public record FunctionCallResult(
        String name,
        String arguments
) {}
