package com.openforge.storeagent.repository;

import com.openforge.storeagent.domain.ChatSessionMetrics;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface ChatSessionMetricsRepository extends JpaRepository<ChatSessionMetrics, Long> {

    Optional<ChatSessionMetrics> findBySessionId(Long sessionId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ChatSessionMetrics m
               set m.totalInputTokens  = m.totalInputTokens + :inputTokens,
                   m.totalOutputTokens = m.totalOutputTokens + :outputTokens,
                   m.totalApiCalls     = m.totalApiCalls + :apiCalls,
                   m.totalDurationMs   = m.totalDurationMs + :durationMs,
                   m.updateTime        = :now
             where m.sessionId = :sessionId
            """)
    int addCompletion(@Param("sessionId") Long sessionId,
                      @Param("apiCalls") int apiCalls,
                      @Param("inputTokens") long inputTokens,
                      @Param("outputTokens") long outputTokens,
                      @Param("durationMs") long durationMs,
                      @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ChatSessionMetrics m
               set m.totalToolCalls = m.totalToolCalls + :count,
                   m.updateTime     = :now
             where m.sessionId = :sessionId
            """)
    int addToolCalls(@Param("sessionId") Long sessionId,
                     @Param("count") int count,
                     @Param("now") LocalDateTime now);

    @Transactional
    void deleteBySessionId(Long sessionId);
}
