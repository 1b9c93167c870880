package com.openforge.storeagent.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * A reference utterance for one tool, with its embedding.
 *
 * Curated rows come from the catalog seed file; learned rows are utterances
 * that resolved to this tool and were confirmed by a successful call.
 * Rows are append-only apart from {@code usage_count}, which only grows.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "tool_example_queries",
    indexes = {
        @Index(name = "idx_tool_example_domain", columnList = "domain"),
        @Index(name = "idx_tool_example_tool", columnList = "tool_name")
    }
)
public class ToolExample extends BaseEntity {

    @Column(name = "tool_name", nullable = false, length = 128)
    private String toolName;

    @Column(name = "domain", nullable = false, length = 64)
    private String domain;

    @Column(name = "example_query", nullable = false, columnDefinition = "TEXT")
    private String exampleQuery;

    @Convert(converter = FloatVectorConverter.class)
    @Column(name = "embedding", nullable = false, length = 16384)
    private float[] embedding;

    @Builder.Default
    @Column(name = "is_learned", nullable = false)
    private Boolean isLearned = false;

    @Builder.Default
    @Column(name = "usage_count", nullable = false)
    private Integer usageCount = 0;
}
