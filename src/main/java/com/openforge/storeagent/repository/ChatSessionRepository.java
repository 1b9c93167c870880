package com.openforge.storeagent.repository;

import com.openforge.storeagent.domain.ChatSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ChatSessionRepository extends JpaRepository<ChatSession, Long> {

    List<ChatSession> findByOwnerIdOrderByUpdateTimeDesc(Long ownerId);

    /** Bumps update_time when a message is appended, without a read-modify-write. */
    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("update ChatSession s set s.updateTime = :now where s.id = :id")
    int touch(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query("update ChatSession s set s.title = :title where s.id = :id and s.title is null")
    int setTitleIfAbsent(@Param("id") Long id, @Param("title") String title);
}
