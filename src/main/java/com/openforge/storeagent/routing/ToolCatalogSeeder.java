package com.openforge.storeagent.routing;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.openforge.storeagent.domain.AgentTool;
import com.openforge.storeagent.embedding.EmbeddingClient;
import com.openforge.storeagent.embedding.ToolExampleStore;
import com.openforge.storeagent.repository.AgentToolRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the curated tool catalog into the database.
 *
 * Seed file layout (YAML, keyed by tool name):
 *
 *   issue_refund:
 *     domain: orders
 *     description: Refund part or all of an order
 *     entry_point: issueRefundHandler
 *     input_schema: { type: object, properties: { ... } }
 *     examples:
 *       - refund order 1001
 *       - give the customer their money back for order 2002
 *
 * Each tool missing from agent_tools is created; each example is embedded
 * and stored as a curated ToolExample. At startup this only happens when
 * the example store is empty, so restarts never duplicate the seed.
 */
@Slf4j
@Component
public class ToolCatalogSeeder implements ApplicationRunner {

    private final AgentToolRepository toolRepository;
    private final ToolExampleStore    exampleStore;
    private final EmbeddingClient     embeddingClient;
    private final RouterProperties    properties;
    private final ResourceLoader      resourceLoader;
    private final ObjectMapper        objectMapper;
    private final YAMLMapper          yamlMapper;

    public ToolCatalogSeeder(AgentToolRepository toolRepository,
                             ToolExampleStore exampleStore,
                             EmbeddingClient embeddingClient,
                             RouterProperties properties,
                             ResourceLoader resourceLoader,
                             ObjectMapper objectMapper) {
        this.toolRepository  = toolRepository;
        this.exampleStore    = exampleStore;
        this.embeddingClient = embeddingClient;
        this.properties      = properties;
        this.resourceLoader  = resourceLoader;
        this.objectMapper    = objectMapper;
        this.yamlMapper      = YAMLMapper.builder()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.seedOnStartup()) {
            log.info("[Seeder] Startup seeding disabled");
            return;
        }
        if (exampleStore.count() > 0) {
            log.info("[Seeder] Example store already holds {} rows, skipping seed", exampleStore.count());
            return;
        }
        try {
            SeedResult result = seed(false);
            log.info("[Seeder] Startup seed done: {}", result);
        } catch (EmbeddingClient.EmbeddingException e) {
            // Routing falls back to NoMatch until someone re-runs the seed endpoint.
            log.warn("[Seeder] Startup seed aborted, embedding endpoint unavailable: {}", e.getMessage());
        }
    }

    /**
     * Seeds from the configured resource.
     *
     * @param clearCurated delete curated examples first (learned ones are kept)
     */
    public SeedResult seed(boolean clearCurated) {
        Map<String, CatalogEntry> catalog = loadCatalog();
        int deleted = clearCurated ? exampleStore.deleteCurated() : 0;

        int toolsCreated = 0;
        int examplesInserted = 0;
        for (Map.Entry<String, CatalogEntry> e : catalog.entrySet()) {
            String toolName = e.getKey();
            CatalogEntry entry = e.getValue();
            if (ensureTool(toolName, entry)) {
                toolsCreated++;
            }
            for (String example : entry.examples()) {
                if (example == null || example.isBlank()) continue;
                exampleStore.upsertExample(toolName, entry.domain(), example.strip(), embeddingClient.embed(example.strip()));
                examplesInserted++;
            }
            log.debug("[Seeder] {} seeded with {} examples", toolName, entry.examples().size());
        }
        return new SeedResult(catalog.size(), toolsCreated, examplesInserted, deleted);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    Map<String, CatalogEntry> loadCatalog() {
        Resource resource = resourceLoader.getResource(properties.seedResource());
        try (InputStream in = resource.getInputStream()) {
            Map<String, CatalogEntry> parsed = yamlMapper.readValue(in, new TypeReference<LinkedHashMap<String, CatalogEntry>>() {});
            return parsed == null ? Map.of() : parsed;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read tool catalog " + properties.seedResource(), e);
        }
    }

    private boolean ensureTool(String toolName, CatalogEntry entry) {
        if (toolRepository.findByToolName(toolName).isPresent()) {
            return false;
        }
        String schema;
        try {
            schema = objectMapper.writeValueAsString(entry.inputSchema() == null
                    ? objectMapper.createObjectNode().put("type", "object")
                    : entry.inputSchema());
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid input_schema for " + toolName, e);
        }
        toolRepository.save(AgentTool.builder()
                .toolName(toolName)
                .domain(entry.domain())
                .toolDescription(entry.description())
                .inputSchema(schema)
                .entryPoint(entry.entryPoint())
                .build());
        log.info("[Seeder] Created tool {} ({})", toolName, entry.domain());
        return true;
    }

    record CatalogEntry(String domain,
                        String description,
                        String entryPoint,
                        JsonNode inputSchema,
                        List<String> examples) {

        CatalogEntry {
            examples = examples == null ? List.of() : examples;
        }
    }

    public record SeedResult(int tools, int toolsCreated, int examplesInserted, int curatedDeleted) {}
}
