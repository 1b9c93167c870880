package com.openforge.storeagent.embedding;

import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Milvus client for the tool-example candidate index.
 *
 * Collection schema (tool_examples):
 * ┌──────────────┬───────────────┬──────────────────────────────────────┐
 * │ Field        │ Type          │ Notes                                │
 * ├──────────────┼───────────────┼──────────────────────────────────────┤
 * │ example_id   │ INT64 PK      │ = tool_example_queries.id, no autoID │
 * │ tool_name    │ VARCHAR(128)  │                                      │
 * │ domain       │ VARCHAR(64)   │ filter field                         │
 * │ embedding    │ FLOAT_VECTOR  │ dim = vectorDimensions (1536)        │
 * └──────────────┴───────────────┴──────────────────────────────────────┘
 *
 * Index: HNSW on embedding, metric = COSINE. Hits are only candidates;
 * final scores are recomputed exactly from the relational rows.
 *
 * A connection failure leaves the client null and search falls back to a
 * plain table scan.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "agent.milvus.enabled", havingValue = "true")
public class MilvusConfig {

    @Bean(destroyMethod = "close")
    @Nullable
    public MilvusClientV2 milvusClient(MilvusProperties props) {
        log.info("[Milvus] Connecting to {}:{}...", props.host(), props.port());
        try {
            MilvusClientV2 client = new MilvusClientV2(
                    ConnectConfig.builder()
                            .uri("http://%s:%d".formatted(props.host(), props.port()))
                            .connectTimeoutMs(15_000)
                            .build()
            );
            log.info("[Milvus] Connected successfully.");
            ensureCollectionExists(client, props);
            return client;
        } catch (Exception e) {
            log.warn("[Milvus] Connection failed, tool search falls back to table scans. Cause: {}. "
                    + "Set agent.milvus.enabled=false to silence this warning.", e.getMessage());
            return null;
        }
    }

    // ── Collection bootstrap ─────────────────────────────────────────────────

    private void ensureCollectionExists(MilvusClientV2 client, MilvusProperties props) {
        String name = props.collectionName();
        boolean exists = client.hasCollection(HasCollectionReq.builder().collectionName(name).build());
        if (exists) {
            log.info("[Milvus] Collection '{}' already exists, skipping creation.", name);
            return;
        }

        log.info("[Milvus] Creating collection '{}' (dim={})...", name, props.vectorDimensions());

        CreateCollectionReq.CollectionSchema schema =
                CreateCollectionReq.CollectionSchema.builder().build();
        schema.addField(AddFieldReq.builder().fieldName("example_id")
                .dataType(DataType.Int64).isPrimaryKey(true).autoID(false).build());
        schema.addField(AddFieldReq.builder().fieldName("tool_name")
                .dataType(DataType.VarChar).maxLength(128).build());
        schema.addField(AddFieldReq.builder().fieldName("domain")
                .dataType(DataType.VarChar).maxLength(64).build());
        schema.addField(AddFieldReq.builder().fieldName("embedding")
                .dataType(DataType.FloatVector).dimension(props.vectorDimensions()).build());

        IndexParam vectorIndex = IndexParam.builder()
                .fieldName("embedding")
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.COSINE)
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();
        IndexParam domainIndex = IndexParam.builder()
                .fieldName("domain")
                .indexType(IndexParam.IndexType.TRIE)
                .build();

        client.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(List.of(vectorIndex, domainIndex))
                .build());

        log.info("[Milvus] Collection '{}' created successfully.", name);
    }
}
