package com.openforge.storeagent.agent.dto;

import com.openforge.storeagent.domain.ChatSessionMetrics;

public record MetricsResponse(
        Long sessionId,
        long totalInputTokens,
        long totalOutputTokens,
        int  totalApiCalls,
        int  totalToolCalls,
        long totalDurationMs
) {

    public static MetricsResponse from(ChatSessionMetrics m) {
        return new MetricsResponse(m.getSessionId(), m.getTotalInputTokens(), m.getTotalOutputTokens(),
                m.getTotalApiCalls(), m.getTotalToolCalls(), m.getTotalDurationMs());
    }

    public static MetricsResponse empty(Long sessionId) {
        return new MetricsResponse(sessionId, 0, 0, 0, 0, 0);
    }
}
