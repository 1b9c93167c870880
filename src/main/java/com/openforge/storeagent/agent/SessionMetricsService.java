package com.openforge.storeagent.agent;

import com.openforge.storeagent.common.StorageException;
import com.openforge.storeagent.domain.ChatSessionMetrics;
import com.openforge.storeagent.repository.ChatSessionMetricsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Per-session usage counters. The row is created on first use; every
 * increment afterwards is a single additive UPDATE, so concurrent turns
 * never lose counts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionMetricsService {

    private final ChatSessionMetricsRepository repository;
    private final Clock                        clock;

    /** @param apiCalls requests sent to the provider for this completion, retries included */
    public void recordCompletion(Long sessionId, int apiCalls, long inputTokens, long outputTokens, long durationMs) {
        ensureRow(sessionId);
        try {
            repository.addCompletion(sessionId, apiCalls, inputTokens, outputTokens, durationMs, LocalDateTime.now(clock));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to record completion metrics for session " + sessionId, e);
        }
    }

    public void recordToolCalls(Long sessionId, int count) {
        if (count <= 0) return;
        ensureRow(sessionId);
        try {
            repository.addToolCalls(sessionId, count, LocalDateTime.now(clock));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to record tool metrics for session " + sessionId, e);
        }
    }

    public Optional<ChatSessionMetrics> find(Long sessionId) {
        try {
            return repository.findBySessionId(sessionId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load metrics of session " + sessionId, e);
        }
    }

    private void ensureRow(Long sessionId) {
        try {
            if (repository.findBySessionId(sessionId).isPresent()) {
                return;
            }
            repository.saveAndFlush(ChatSessionMetrics.builder().sessionId(sessionId).build());
        } catch (DataIntegrityViolationException e) {
            // Another turn created the row first; the unique key on session_id kept it single.
            log.debug("[Chat:{}] Metrics row created concurrently", sessionId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to create metrics row for session " + sessionId, e);
        }
    }
}
