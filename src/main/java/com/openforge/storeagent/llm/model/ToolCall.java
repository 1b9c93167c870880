package com.openforge.storeagent.llm.model;

/**
 * A single tool invocation request produced by the LLM.
 */
public record ToolCall(
        String id,
        String type,
        FunctionCallResult function
) {
    public static ToolCall function(String id, String name, String arguments) {
        return new ToolCall(id, "function", new FunctionCallResult(name, arguments));
    }
}
