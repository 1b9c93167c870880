package com.openforge.storeagent.embedding;

import com.openforge.storeagent.domain.ToolExample;
import com.openforge.storeagent.repository.ToolExampleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Exact scan over a read-through snapshot of the example table.
 *
 * Inserts and usage changes bump a generation counter; the next search
 * reloads the table. Readers never wait for a reload done by someone else,
 * they either use the current snapshot or load their own.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "agent.milvus.enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryVectorSearch implements VectorSearchBackend {

    private final ToolExampleRepository repository;

    private final AtomicLong generation = new AtomicLong();
    private volatile Snapshot snapshot;

    @Override
    public List<ScoredExample> search(float[] query, int topK, Set<String> domains) {
        return examples().stream()
                .filter(e -> domains.isEmpty() || domains.contains(e.getDomain()))
                .map(e -> new ScoredExample(e, VectorMath.cosine(query, e.getEmbedding())))
                .sorted(ScoredExample.RANKING)
                .limit(topK)
                .toList();
    }

    @Override
    public void onInsert(ToolExample example) {
        generation.incrementAndGet();
    }

    @Override
    public void onUsage(Long exampleId) {
        generation.incrementAndGet();
    }

    @Override
    public void onDelete() {
        generation.incrementAndGet();
    }

    private List<ToolExample> examples() {
        long wanted = generation.get();
        Snapshot current = snapshot;
        if (current != null && current.generation() == wanted) {
            return current.examples();
        }
        List<ToolExample> loaded = List.copyOf(repository.findAll());
        log.debug("[VectorSearch] Loaded {} examples (generation {})", loaded.size(), wanted);
        synchronized (this) {
            if (generation.get() == wanted) {
                snapshot = new Snapshot(wanted, loaded);
            }
        }
        return loaded;
    }

    private record Snapshot(long generation, List<ToolExample> examples) {}
}
