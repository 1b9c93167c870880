package com.openforge.storeagent.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * A single entry in the conversation sent to the completion API.
 *
 * role variants:
 *   "system"    instructions, and update notes for approvals resolved later
 *   "user"      admin turn
 *   "assistant" model reply; may carry tool_calls
 *   "tool"      result of one tool call, matched by tool_call_id
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,

        /** Null for assistant messages that only contain tool_calls. */
        String content,

        List<ToolCall> toolCalls,

        /** Present only in tool-result messages. */
        String toolCallId
) {

    public static Message system(String content) {
        return Message.builder().role("system").content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role("user").content(content).build();
    }

    public static Message assistantText(String content) {
        return Message.builder().role("assistant").content(content).build();
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return Message.builder().role("assistant").content(content).toolCalls(toolCalls).build();
    }

    public static Message toolResult(String toolCallId, String result) {
        return Message.builder().role("tool").toolCallId(toolCallId).content(result).build();
    }
}
