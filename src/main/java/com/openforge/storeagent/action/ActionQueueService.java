package com.openforge.storeagent.action;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.storeagent.common.StorageException;
import com.openforge.storeagent.domain.PendingAction;
import com.openforge.storeagent.domain.PendingAction.ActionStatus;
import com.openforge.storeagent.repository.PendingActionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Durable state machine for mutating tool calls that wait on a human.
 *
 *   enqueue ──► PENDING ──approve──► APPROVED ──markExecuted──► EXECUTED
 *                  │                     └──────markFailed────► FAILED
 *                  ├──reject──────► REJECTED
 *                  └──sweep───────► EXPIRED
 *
 * Each transition is a single conditional UPDATE keyed on the expected
 * status, so two racing transitions on one action can never both succeed.
 * When an update touches no row the current row is read back to explain
 * why: missing row, past its TTL, or a status that does not allow the move.
 *
 * Expiry is a wall-clock comparison made inside the UPDATE itself:
 * approve/reject need {@code now < expires_at}, the sweep takes
 * {@code expires_at < now}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActionQueueService {

    private final PendingActionRepository repository;
    private final ActionQueueProperties   properties;
    private final ObjectMapper            objectMapper;
    private final Clock                   clock;

    // ── Creation ─────────────────────────────────────────────────────────────

    public PendingAction enqueue(Long sessionId, @Nullable Long messageId, Long requesterId,
                                 String toolName, JsonNode toolInput) {
        Instant now = clock.instant();
        PendingAction action = PendingAction.builder()
                .id(UUID.randomUUID())
                .sessionId(sessionId)
                .messageId(messageId)
                .requesterId(requesterId)
                .toolName(toolName)
                .toolInput(write(toolInput))
                .status(ActionStatus.PENDING)
                .createdAt(now)
                .expiresAt(now.plus(properties.ttl()))
                .build();
        PendingAction saved = storage("enqueue " + toolName, () -> repository.save(action));
        log.info("[ActionQueue:{}] Enqueued {} for session {} (expires {})",
                saved.getId(), toolName, sessionId, saved.getExpiresAt());
        return saved;
    }

    /**
     * Records where the approval card was posted. Repeating the call with the
     * same ref is a no-op.
     */
    public PendingAction attachExternalRef(UUID actionId, String ref) {
        int updated = storage("attach ref", () -> repository.attachExternalRef(actionId, ref, ActionStatus.PENDING));
        PendingAction current = get(actionId);
        if (updated == 0) {
            if (current.getStatus() != ActionStatus.PENDING) {
                throw new InvalidTransitionException(actionId, current.getStatus(), ActionStatus.PENDING);
            }
            throw new IllegalStateException("Action %s already carries ref %s".formatted(actionId, current.getExternalRef()));
        }
        log.debug("[ActionQueue:{}] External ref {}", actionId, ref);
        return current;
    }

    // ── Transitions ──────────────────────────────────────────────────────────

    /**
     * @throws ActionExpiredException      if the TTL has passed, swept or not
     * @throws InvalidTransitionException  if the action is no longer pending
     * @throws ActionNotFoundException     if there is no such action
     */
    public PendingAction approve(UUID actionId, String approver) {
        Instant now = clock.instant();
        int updated = storage("approve", () -> repository.approveIfPending(
                actionId, approver, now, ActionStatus.PENDING, ActionStatus.APPROVED));
        return afterTransition(actionId, updated, ActionStatus.APPROVED, now, approver);
    }

    /** Same failure modes as {@link #approve}. */
    public PendingAction reject(UUID actionId, String rejector) {
        Instant now = clock.instant();
        int updated = storage("reject", () -> repository.rejectIfPending(
                actionId, rejector, now, ActionStatus.PENDING, ActionStatus.REJECTED));
        return afterTransition(actionId, updated, ActionStatus.REJECTED, now, rejector);
    }

    public PendingAction markExecuted(UUID actionId, JsonNode result) {
        int updated = storage("mark executed", () -> repository.markExecutedIfApproved(
                actionId, write(result), ActionStatus.APPROVED, ActionStatus.EXECUTED));
        return afterTransition(actionId, updated, ActionStatus.EXECUTED, clock.instant(), null);
    }

    public PendingAction markFailed(UUID actionId, String errorMessage) {
        int updated = storage("mark failed", () -> repository.markFailedIfApproved(
                actionId, errorMessage, ActionStatus.APPROVED, ActionStatus.FAILED));
        return afterTransition(actionId, updated, ActionStatus.FAILED, clock.instant(), null);
    }

    /**
     * Marks the start of an approved action's execution. Only the first
     * caller gets {@code true}; anyone after it must not run the tool.
     */
    public boolean claimExecution(UUID actionId) {
        int updated = storage("claim execution", () -> repository.claimExecution(
                actionId, clock.instant(), ActionStatus.APPROVED));
        if (updated == 0) {
            log.warn("[ActionQueue:{}] Execution already claimed or action not approved", actionId);
            return false;
        }
        return true;
    }

    // ── Expiry ───────────────────────────────────────────────────────────────

    /** Number of actions this call moved to EXPIRED. Safe to run concurrently. */
    public int sweepExpired(Instant now) {
        return expireStale(now).size();
    }

    /**
     * Expires every pending action whose TTL ended before {@code now}, one
     * conditional update per row, and returns the rows this call expired.
     * Rows decided or expired by someone else in the meantime are skipped.
     */
    public List<PendingAction> expireStale(Instant now) {
        List<UUID> candidates = storage("find expired", () -> repository.findExpiredIds(ActionStatus.PENDING, now));
        List<PendingAction> expired = new ArrayList<>();
        for (UUID id : candidates) {
            expireIfDue(id, now).ifPresent(expired::add);
        }
        if (!expired.isEmpty()) {
            log.info("[ActionQueue] Expired {} of {} stale pending actions", expired.size(), candidates.size());
        }
        return expired;
    }

    /** Expires a single action if it is still pending and past its TTL. */
    public Optional<PendingAction> expireIfDue(UUID actionId, Instant now) {
        int updated = storage("expire", () -> repository.expireIfPending(
                actionId, now, ActionStatus.PENDING, ActionStatus.EXPIRED));
        if (updated == 0) {
            return Optional.empty();
        }
        log.info("[ActionQueue:{}] pending → EXPIRED", actionId);
        return Optional.of(get(actionId));
    }

    /**
     * Approved actions decided before {@code cutoff} that still have no
     * outcome. Their resume was lost or crashed and has to be driven again.
     */
    public List<PendingAction> findStalledApprovals(Instant cutoff) {
        return storage("find stalled approvals", () ->
                repository.findByStatusAndResolvedAtBeforeOrderByResolvedAtAsc(ActionStatus.APPROVED, cutoff));
    }

    // ── Queries ──────────────────────────────────────────────────────────────

    public Optional<PendingAction> find(UUID actionId) {
        return storage("load", () -> repository.findById(actionId));
    }

    public PendingAction get(UUID actionId) {
        return find(actionId).orElseThrow(() -> new ActionNotFoundException(actionId));
    }

    public Optional<PendingAction> findByExternalRef(String ref) {
        return storage("load by ref", () -> repository.findByExternalRef(ref));
    }

    public List<PendingAction> findForSession(Long sessionId) {
        return storage("list session actions", () -> repository.findBySessionIdOrderByCreatedAtAsc(sessionId));
    }

    public List<PendingAction> findPendingForRequester(Long requesterId) {
        return storage("list pending", () ->
                repository.findByRequesterIdAndStatusOrderByCreatedAtAsc(requesterId, ActionStatus.PENDING));
    }

    public void deleteForSession(Long sessionId) {
        storage("delete session actions", () -> {
            repository.deleteBySessionId(sessionId);
            return null;
        });
    }

    public JsonNode readInput(PendingAction action) {
        return read(action.getToolInput());
    }

    @Nullable
    public JsonNode readResult(PendingAction action) {
        return action.getResult() == null ? null : read(action.getResult());
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private PendingAction afterTransition(UUID actionId, int updated, ActionStatus target,
                                          Instant now, @Nullable String actor) {
        PendingAction current = get(actionId);
        if (updated == 1) {
            log.info("[ActionQueue:{}] → {}{}", actionId, target, actor == null ? "" : " by " + actor);
            return current;
        }
        boolean decision = target == ActionStatus.APPROVED || target == ActionStatus.REJECTED;
        if (decision && current.getStatus() == ActionStatus.PENDING && !now.isBefore(current.getExpiresAt())) {
            log.info("[ActionQueue:{}] {} refused, expired at {}", actionId, target, current.getExpiresAt());
            throw new ActionExpiredException(actionId, current.getExpiresAt());
        }
        log.info("[ActionQueue:{}] {} refused, status is {}", actionId, target, current.getStatus());
        throw new InvalidTransitionException(actionId, current.getStatus(), target);
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node == null ? objectMapper.nullNode() : node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable", e);
        }
    }

    private JsonNode read(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StorageException("Stored payload is not valid JSON", e);
        }
    }

    private <T> T storage(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new StorageException("Action queue " + operation + " failed", e);
        }
    }
}
