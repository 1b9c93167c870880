package com.openforge.storeagent.repository;

import com.openforge.storeagent.domain.PendingAction;
import com.openforge.storeagent.domain.PendingAction.ActionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Every status change is one compare-and-set UPDATE guarded by the expected
 * current status. The returned row count tells the caller whether it won:
 * 1 means this call performed the transition, 0 means the row was not in the
 * expected state (or not there at all).
 */
@Repository
public interface PendingActionRepository extends JpaRepository<PendingAction, UUID> {

    Optional<PendingAction> findByExternalRef(String externalRef);

    List<PendingAction> findBySessionIdOrderByCreatedAtAsc(Long sessionId);

    List<PendingAction> findByRequesterIdAndStatusOrderByCreatedAtAsc(Long requesterId, ActionStatus status);

    /** Candidates for the sweep; each one is then expired with its own conditional update. */
    @Query("select a.id from PendingAction a where a.status = :pending and a.expiresAt < :now order by a.expiresAt")
    List<UUID> findExpiredIds(@Param("pending") ActionStatus pending, @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update PendingAction a
               set a.externalRef = :ref
             where a.id = :id
               and a.status = :pending
               and (a.externalRef is null or a.externalRef = :ref)
            """)
    int attachExternalRef(@Param("id") UUID id,
                          @Param("ref") String ref,
                          @Param("pending") ActionStatus pending);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update PendingAction a
               set a.status = :approved, a.approvedBy = :actor, a.resolvedAt = :now
             where a.id = :id
               and a.status = :pending
               and a.expiresAt > :now
            """)
    int approveIfPending(@Param("id") UUID id,
                         @Param("actor") String actor,
                         @Param("now") Instant now,
                         @Param("pending") ActionStatus pending,
                         @Param("approved") ActionStatus approved);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update PendingAction a
               set a.status = :rejected, a.rejectedBy = :actor, a.resolvedAt = :now
             where a.id = :id
               and a.status = :pending
               and a.expiresAt > :now
            """)
    int rejectIfPending(@Param("id") UUID id,
                        @Param("actor") String actor,
                        @Param("now") Instant now,
                        @Param("pending") ActionStatus pending,
                        @Param("rejected") ActionStatus rejected);

    /** Approved rows decided before the cutoff that have not reached an outcome yet. */
    List<PendingAction> findByStatusAndResolvedAtBeforeOrderByResolvedAtAsc(ActionStatus status, Instant cutoff);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update PendingAction a
               set a.executionStartedAt = :now
             where a.id = :id
               and a.status = :approved
               and a.executionStartedAt is null
            """)
    int claimExecution(@Param("id") UUID id,
                       @Param("now") Instant now,
                       @Param("approved") ActionStatus approved);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update PendingAction a
               set a.status = :executed, a.result = :result
             where a.id = :id
               and a.status = :approved
            """)
    int markExecutedIfApproved(@Param("id") UUID id,
                               @Param("result") String result,
                               @Param("approved") ActionStatus approved,
                               @Param("executed") ActionStatus executed);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update PendingAction a
               set a.status = :failed, a.errorMessage = :error
             where a.id = :id
               and a.status = :approved
            """)
    int markFailedIfApproved(@Param("id") UUID id,
                             @Param("error") String error,
                             @Param("approved") ActionStatus approved,
                             @Param("failed") ActionStatus failed);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update PendingAction a
               set a.status = :expired, a.resolvedAt = :now
             where a.id = :id
               and a.status = :pending
               and a.expiresAt < :now
            """)
    int expireIfPending(@Param("id") UUID id,
                        @Param("now") Instant now,
                        @Param("pending") ActionStatus pending,
                        @Param("expired") ActionStatus expired);

    @Transactional
    void deleteBySessionId(Long sessionId);
}
