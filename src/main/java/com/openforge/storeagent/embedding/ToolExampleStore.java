package com.openforge.storeagent.embedding;

import com.openforge.storeagent.common.StorageException;
import com.openforge.storeagent.domain.ToolExample;
import com.openforge.storeagent.repository.ToolExampleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable nearest-neighbour lookup over tool examples.
 *
 * The table is append-only reference data shared by every session. Writes
 * go straight to the repository (each call commits on its own) and then
 * notify the search backend, so a search started after an insert returns
 * sees it.
 *
 * Persistence failures surface as {@link StorageException}; an empty
 * store is not a failure and yields an empty result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolExampleStore {

    private final ToolExampleRepository repository;
    private final VectorSearchBackend   searchBackend;
    private final EmbeddingProperties   embeddingProperties;
    private final Clock                 clock;

    // ── Writes ───────────────────────────────────────────────────────────────

    /** Inserts a curated example. Duplicate query texts are allowed. */
    public ToolExample upsertExample(String toolName, String domain, String queryText, float[] embedding) {
        return insert(toolName, domain, queryText, embedding, false);
    }

    /** Inserts an example learned from a confirmed resolution. */
    public ToolExample addLearnedExample(String toolName, String domain, String queryText, float[] embedding) {
        return insert(toolName, domain, queryText, embedding, true);
    }

    /**
     * Adds exactly one to the example's usage_count, as a single atomic update.
     *
     * @throws IllegalArgumentException if no example has this id
     */
    public void recordUsage(Long exampleId) {
        int updated;
        try {
            updated = repository.incrementUsage(exampleId, LocalDateTime.now(clock));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to record usage for example " + exampleId, e);
        }
        if (updated == 0) {
            throw new IllegalArgumentException("No tool example with id " + exampleId);
        }
        searchBackend.onUsage(exampleId);
    }

    /** Removes curated rows ahead of a re-seed. Learned rows survive. */
    public int deleteCurated() {
        try {
            int deleted = repository.deleteCurated();
            searchBackend.onDelete();
            log.info("[ExampleStore] Deleted {} curated examples", deleted);
            return deleted;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to delete curated examples", e);
        }
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    /**
     * The {@code topK} examples most similar to {@code queryEmbedding}, best
     * first, optionally restricted to one domain. Each call computes a fresh
     * list.
     */
    public List<ScoredExample> search(float[] queryEmbedding, int topK, @Nullable String domainFilter) {
        return searchWithin(queryEmbedding, topK,
                domainFilter == null || domainFilter.isBlank() ? Set.of() : Set.of(domainFilter));
    }

    /** Like {@link #search}, restricted to any of {@code domains}; an empty collection means all. */
    public List<ScoredExample> searchWithin(float[] queryEmbedding, int topK, Collection<String> domains) {
        checkDimensions(queryEmbedding);
        if (topK <= 0) return List.of();
        Set<String> filter = new LinkedHashSet<>();
        for (String domain : domains) {
            if (domain != null && !domain.isBlank()) filter.add(domain);
        }
        try {
            List<ScoredExample> hits = searchBackend.search(queryEmbedding, topK, filter);
            if (log.isDebugEnabled() && !hits.isEmpty()) {
                ScoredExample top = hits.get(0);
                log.debug("[ExampleStore] {} hits in {}, top={} ({}) score={}",
                        hits.size(), filter.isEmpty() ? "all domains" : filter,
                        top.toolName(), top.example().getId(), "%.4f".formatted(top.score()));
            }
            return hits;
        } catch (DataAccessException e) {
            throw new StorageException("Tool example search failed", e);
        }
    }

    public Optional<ToolExample> findById(Long exampleId) {
        try {
            return repository.findById(exampleId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load example " + exampleId, e);
        }
    }

    public Optional<ToolExample> findExample(String toolName, String queryText) {
        try {
            return repository.findFirstByToolNameAndExampleQueryOrderByIdAsc(toolName, queryText);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to look up example for " + toolName, e);
        }
    }

    public long count() {
        try {
            return repository.count();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to count tool examples", e);
        }
    }

    public long countLearned() {
        try {
            return repository.countByIsLearnedTrue();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to count learned examples", e);
        }
    }

    /** Example count per domain, ordered by domain name. */
    public Map<String, Long> countPerDomain() {
        try {
            Map<String, Long> counts = new LinkedHashMap<>();
            for (Object[] row : repository.countPerDomain()) {
                counts.put((String) row[0], ((Number) row[1]).longValue());
            }
            return counts;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to count examples per domain", e);
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private ToolExample insert(String toolName, String domain, String queryText,
                               float[] embedding, boolean learned) {
        checkDimensions(embedding);
        ToolExample saved;
        try {
            saved = repository.save(ToolExample.builder()
                    .toolName(toolName)
                    .domain(domain)
                    .exampleQuery(queryText)
                    .embedding(embedding)
                    .isLearned(learned)
                    .usageCount(learned ? 1 : 0)
                    .build());
        } catch (DataAccessException e) {
            throw new StorageException("Failed to insert example for " + toolName, e);
        }
        searchBackend.onInsert(saved);
        log.debug("[ExampleStore] Inserted {} example {} for tool {}",
                learned ? "learned" : "curated", saved.getId(), toolName);
        return saved;
    }

    private void checkDimensions(float[] vector) {
        if (vector == null || vector.length != embeddingProperties.dimensions()) {
            throw new IllegalArgumentException("Expected a %d-dim embedding, got %s".formatted(
                    embeddingProperties.dimensions(), vector == null ? "null" : vector.length));
        }
    }
}
