package com.openforge.storeagent.embedding;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.openforge.storeagent.common.StorageException;
import com.openforge.storeagent.domain.ToolExample;
import com.openforge.storeagent.repository.ToolExampleRepository;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.SearchResp;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Milvus-backed candidate selection.
 *
 *   1. ANN search returns up to topK * OVERSAMPLE example ids (domain-filtered)
 *   2. the rows are loaded from the relational table
 *   3. exact cosine + RANKING decide the final order
 *
 * Step 3 keeps tie-breaking identical to the in-memory backend. The index
 * is back-filled from the table on first use and whenever an insert could
 * not be mirrored; it only counts as filled once a back-fill has completed.
 * Milvus failures during a search surface as {@link StorageException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "agent.milvus.enabled", havingValue = "true")
public class MilvusVectorSearch implements VectorSearchBackend {

    private static final int OVERSAMPLE     = 4;
    private static final int MAX_CANDIDATES = 200;
    private static final int BACKFILL_BATCH = 500;

    @Nullable
    private final MilvusClientV2        milvusClient;
    private final MilvusProperties      properties;
    private final ToolExampleRepository repository;

    private final AtomicBoolean indexed = new AtomicBoolean(false);

    @Override
    public List<ScoredExample> search(float[] query, int topK, Set<String> domains) {
        if (milvusClient == null) {
            return rank(repository.findAll(), query, topK, domains);
        }

        SearchResp resp;
        try {
            ensureIndexed();
            resp = milvusClient.search(SearchReq.builder()
                    .collectionName(properties.collectionName())
                    .data(List.of(new FloatVec(toList(query))))
                    .annsField("embedding")
                    .topK(Math.min(topK * OVERSAMPLE, MAX_CANDIDATES))
                    .filter(filter(domains))
                    .outputFields(List.of("example_id"))
                    .build());
        } catch (RuntimeException e) {
            throw new StorageException("Milvus search in '%s' failed: %s"
                    .formatted(properties.collectionName(), e.getMessage()), e);
        }

        Set<Long> ids = new LinkedHashSet<>();
        if (resp != null && resp.getSearchResults() != null) {
            for (List<SearchResp.SearchResult> row : resp.getSearchResults()) {
                for (SearchResp.SearchResult hit : row) {
                    Object id = hit.getEntity() != null ? hit.getEntity().get("example_id") : hit.getId();
                    if (id instanceof Number n) ids.add(n.longValue());
                }
            }
        }
        log.debug("[VectorSearch] Milvus returned {} candidates (domains={})", ids.size(), domains);
        return rank(repository.findAllById(ids), query, topK, domains);
    }

    @Override
    public void onInsert(ToolExample example) {
        if (milvusClient == null) return;
        try {
            upsert(List.of(example));
        } catch (RuntimeException e) {
            // the table is authoritative; the next search re-indexes
            indexed.set(false);
            log.warn("[VectorSearch] Could not mirror example {} into Milvus: {}", example.getId(), e.getMessage());
        }
    }

    @Override
    public void onUsage(Long exampleId) {
        // usage_count is read from the table at ranking time
    }

    @Override
    public void onDelete() {
        // stale ids are dropped when candidates are loaded from the table
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private void ensureIndexed() {
        if (indexed.get()) return;
        synchronized (this) {
            if (indexed.get()) return;
            List<ToolExample> all = repository.findAll();
            for (int from = 0; from < all.size(); from += BACKFILL_BATCH) {
                upsert(all.subList(from, Math.min(all.size(), from + BACKFILL_BATCH)));
            }
            indexed.set(true);
            log.info("[VectorSearch] Indexed {} examples into '{}'", all.size(), properties.collectionName());
        }
    }

    static String filter(Set<String> domains) {
        if (domains.isEmpty()) return "";
        return domains.stream()
                .map(d -> "\"" + d.replace("\\", "\\\\").replace("\"", "\\\"") + "\"")
                .collect(Collectors.joining(", ", "domain in [", "]"));
    }

    private void upsert(List<ToolExample> examples) {
        List<JsonObject> rows = new ArrayList<>(examples.size());
        for (ToolExample example : examples) {
            JsonObject row = new JsonObject();
            row.addProperty("example_id", example.getId());
            row.addProperty("tool_name", example.getToolName());
            row.addProperty("domain", example.getDomain());
            JsonArray vector = new JsonArray();
            for (float f : example.getEmbedding()) vector.add(f);
            row.add("embedding", vector);
            rows.add(row);
        }
        milvusClient.upsert(UpsertReq.builder()
                .collectionName(properties.collectionName())
                .data(rows)
                .build());
    }

    private static List<Float> toList(float[] vector) {
        List<Float> values = new ArrayList<>(vector.length);
        for (float f : vector) values.add(f);
        return values;
    }

    private static List<ScoredExample> rank(Collection<ToolExample> examples, float[] query,
                                            int topK, Set<String> domains) {
        return examples.stream()
                .filter(e -> domains.isEmpty() || domains.contains(e.getDomain()))
                .map(e -> new ScoredExample(e, VectorMath.cosine(query, e.getEmbedding())))
                .sorted(ScoredExample.RANKING)
                .limit(topK)
                .toList();
    }
}
