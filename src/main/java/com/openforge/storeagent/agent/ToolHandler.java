package com.openforge.storeagent.agent;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Runs one catalog tool against the commerce back end. Implementations are
 * Spring beans whose bean name matches the tool's entry_point.
 */
@FunctionalInterface
public interface ToolHandler {

    /**
     * @param input arguments chosen by the model, already parsed
     * @return the result fed back to the model
     * @throws ToolExecutionException when the operation failed
     */
    JsonNode execute(JsonNode input);
}
