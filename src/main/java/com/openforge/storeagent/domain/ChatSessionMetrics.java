package com.openforge.storeagent.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * Running totals for one session. Counters are only ever incremented,
 * through atomic bulk updates in the repository.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "chat_session_metrics",
    uniqueConstraints = @UniqueConstraint(name = "uq_metrics_session", columnNames = "session_id")
)
public class ChatSessionMetrics extends BaseEntity {

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Builder.Default
    @Column(name = "total_input_tokens", nullable = false)
    private Long totalInputTokens = 0L;

    @Builder.Default
    @Column(name = "total_output_tokens", nullable = false)
    private Long totalOutputTokens = 0L;

    @Builder.Default
    @Column(name = "total_api_calls", nullable = false)
    private Integer totalApiCalls = 0;

    @Builder.Default
    @Column(name = "total_tool_calls", nullable = false)
    private Integer totalToolCalls = 0;

    @Builder.Default
    @Column(name = "total_duration_ms", nullable = false)
    private Long totalDurationMs = 0L;
}
