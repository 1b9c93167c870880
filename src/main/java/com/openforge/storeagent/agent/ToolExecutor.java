package com.openforge.storeagent.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.storeagent.domain.AgentTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Dispatches a tool call to the {@link ToolHandler} bean named by the
 * tool's entry_point. Every failure, including an unknown tool or a missing
 * handler, comes back as {@link ToolExecutionException} so the caller can
 * hand the error to the model.
 */
@Slf4j
@Component
public class ToolExecutor {

    private final ToolCatalog              catalog;
    private final Map<String, ToolHandler> handlers;

    public ToolExecutor(ToolCatalog catalog, Map<String, ToolHandler> handlers) {
        this.catalog  = catalog;
        this.handlers = Map.copyOf(handlers);
    }

    public JsonNode execute(String toolName, JsonNode input) {
        AgentTool tool = catalog.find(toolName)
                .orElseThrow(() -> new ToolExecutionException("Unknown or inactive tool: " + toolName));
        String entryPoint = tool.getEntryPoint() == null || tool.getEntryPoint().isBlank()
                ? toolName
                : tool.getEntryPoint();
        ToolHandler handler = handlers.get(entryPoint);
        if (handler == null) {
            throw new ToolExecutionException("No handler registered for " + toolName + " (" + entryPoint + ")");
        }

        long start = System.currentTimeMillis();
        try {
            JsonNode result = handler.execute(input);
            log.debug("[Tool] {} finished in {}ms", toolName, System.currentTimeMillis() - start);
            return result;
        } catch (ToolExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ToolExecutionException(toolName + " failed: " + e.getMessage(), e);
        }
    }
}
