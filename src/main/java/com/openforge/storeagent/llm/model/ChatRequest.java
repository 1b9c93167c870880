package com.openforge.storeagent.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Request body for an OpenAI-compatible /chat/completions endpoint.
 *
 * toolChoice is "auto" whenever tools are attached; the model decides
 * between answering in text and calling a tool.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        List<Tool> tools,
        String toolChoice,
        Double temperature,
        Integer maxTokens
) {

    public static ChatRequest withTools(String model, List<Message> messages, List<Tool> tools,
                                        double temperature, int maxTokens) {
        boolean hasTools = tools != null && !tools.isEmpty();
        return ChatRequest.builder()
                .model(model)
                .messages(messages)
                .tools(hasTools ? tools : null)
                .toolChoice(hasTools ? "auto" : null)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
    }

    public ChatRequest withModel(String modelName) {
        return toBuilder().model(modelName).build();
    }
}
