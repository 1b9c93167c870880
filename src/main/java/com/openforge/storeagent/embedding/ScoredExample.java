package com.openforge.storeagent.embedding;

import com.openforge.storeagent.domain.ToolExample;

import java.util.Comparator;

/**
 * A search hit: the example and its cosine similarity to the query.
 */
public record ScoredExample(ToolExample example, double score) {

    /** Score descending, then usage_count descending, then id ascending. */
    public static final Comparator<ScoredExample> RANKING =
            Comparator.comparingDouble(ScoredExample::score).reversed()
                    .thenComparing(s -> s.example().getUsageCount(), Comparator.reverseOrder())
                    .thenComparing(s -> s.example().getId());

    public String toolName() {
        return example.getToolName();
    }
}
