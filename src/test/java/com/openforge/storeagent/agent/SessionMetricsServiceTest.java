package com.openforge.storeagent.agent;

import com.openforge.storeagent.config.JpaConfig;
import com.openforge.storeagent.domain.ChatSessionMetrics;
import com.openforge.storeagent.repository.ChatSessionMetricsRepository;
import com.openforge.storeagent.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaConfig.class)
class SessionMetricsServiceTest {

    @Autowired
    private ChatSessionMetricsRepository repository;

    private SessionMetricsService metrics;

    @BeforeEach
    void setUp() {
        metrics = new SessionMetricsService(repository, new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
    }

    @Test
    @DisplayName("completions accumulate tokens, calls and duration")
    void accumulates() {
        metrics.recordCompletion(5L, 1, 100, 20, 800);
        metrics.recordCompletion(5L, 2, 150, 30, 1200);
        metrics.recordToolCalls(5L, 2);

        ChatSessionMetrics row = metrics.find(5L).orElseThrow();
        assertThat(row.getTotalInputTokens()).isEqualTo(250L);
        assertThat(row.getTotalOutputTokens()).isEqualTo(50L);
        assertThat(row.getTotalApiCalls()).isEqualTo(3);
        assertThat(row.getTotalDurationMs()).isEqualTo(2000L);
        assertThat(row.getTotalToolCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("a failed completion still counts as an api call")
    void failedCompletionCounts() {
        metrics.recordCompletion(6L, 1, 0, 0, 30);

        assertThat(metrics.find(6L)).get().extracting(ChatSessionMetrics::getTotalApiCalls).isEqualTo(1);
    }

    @Test
    @DisplayName("zero tool calls leave no row behind")
    void zeroToolCalls() {
        metrics.recordToolCalls(7L, 0);

        assertThat(metrics.find(7L)).isEmpty();
    }
}
