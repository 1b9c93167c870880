package com.openforge.storeagent.embedding;

import com.openforge.storeagent.domain.ToolExample;

import java.util.List;
import java.util.Set;

/**
 * Nearest-neighbour lookup behind {@link ToolExampleStore}. Implementations
 * must score with exact cosine similarity and order with
 * {@link ScoredExample#RANKING}; they may use an approximate index to pick
 * the candidates that get scored.
 */
public interface VectorSearchBackend {

    /** An empty {@code domains} set searches every domain. */
    List<ScoredExample> search(float[] query, int topK, Set<String> domains);

    /** Called after a new example row has been committed. */
    void onInsert(ToolExample example);

    /** Called after an example's usage_count changed. */
    void onUsage(Long exampleId);

    /** Called after rows were removed by administrative cleanup. */
    void onDelete();
}
