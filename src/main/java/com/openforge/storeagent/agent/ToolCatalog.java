package com.openforge.storeagent.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.storeagent.domain.AgentTool;
import com.openforge.storeagent.llm.model.Tool;
import com.openforge.storeagent.llm.model.ToolFunction;
import com.openforge.storeagent.repository.AgentToolRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the "tools" array of completion requests from the active rows of
 * agent_tools.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolCatalog {

    private final AgentToolRepository toolRepository;
    private final ObjectMapper        objectMapper;

    public List<AgentTool> activeTools() {
        return toolRepository.findByIsActiveTrueOrderByToolNameAsc();
    }

    public Optional<AgentTool> find(String toolName) {
        return toolRepository.findByToolName(toolName).filter(t -> Boolean.TRUE.equals(t.getIsActive()));
    }

    /** Every active tool. */
    public List<Tool> allDefinitions() {
        return activeTools().stream().map(this::toDefinition).toList();
    }

    /**
     * The routed tools first, followed by the remaining active tools of the
     * same domains.
     */
    public List<Tool> routedDefinitions(Collection<String> routedToolNames) {
        List<AgentTool> active = activeTools();
        Set<String> domains = new LinkedHashSet<>();
        List<AgentTool> ordered = new ArrayList<>();
        for (String name : routedToolNames) {
            active.stream().filter(t -> t.getToolName().equals(name)).findFirst().ifPresent(t -> {
                ordered.add(t);
                domains.add(t.getDomain());
            });
        }
        for (AgentTool tool : active) {
            if (domains.contains(tool.getDomain()) && !ordered.contains(tool)) {
                ordered.add(tool);
            }
        }
        return ordered.stream().map(this::toDefinition).toList();
    }

    private Tool toDefinition(AgentTool tool) {
        try {
            return Tool.ofFunction(new ToolFunction(
                    tool.getToolName(),
                    tool.getToolDescription(),
                    objectMapper.readTree(tool.getInputSchema())));
        } catch (JsonProcessingException e) {
            log.warn("[Catalog] Tool {} has an unparseable input_schema, offering it without parameters",
                    tool.getToolName());
            return Tool.ofFunction(new ToolFunction(tool.getToolName(), tool.getToolDescription(),
                    objectMapper.createObjectNode().put("type", "object")));
        }
    }
}
