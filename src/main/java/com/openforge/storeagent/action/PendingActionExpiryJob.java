package com.openforge.storeagent.action;

import com.openforge.storeagent.common.StorageException;
import com.openforge.storeagent.domain.PendingAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Periodic upkeep of the action queue:
 *
 *   1. pending actions past their TTL are expired and announced
 *   2. approved actions that still have no outcome after the grace period
 *      are announced again, so their session resumes and drives them to
 *      EXECUTED or FAILED
 *
 * Step 2 covers resumes that never ran: a saturated turn executor, a
 * restart between the approval and the resume, or a resume that crashed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PendingActionExpiryJob {

    private final ActionQueueService        actionQueue;
    private final ActionQueueProperties     properties;
    private final ApplicationEventPublisher events;
    private final Clock                     clock;

    @Scheduled(fixedDelayString = "${agent.actions.sweep-interval:PT1M}",
               initialDelayString = "${agent.actions.sweep-interval:PT1M}")
    public void sweep() {
        Instant now = clock.instant();
        expirePending(now);
        redriveStalledApprovals(now);
    }

    private void expirePending(Instant now) {
        List<PendingAction> expired;
        try {
            expired = actionQueue.expireStale(now);
        } catch (StorageException e) {
            log.error("[ActionQueue] Expiry sweep failed, retrying next interval: {}", e.getMessage(), e);
            return;
        }
        for (PendingAction action : expired) {
            announce(action);
        }
    }

    private void redriveStalledApprovals(Instant now) {
        List<PendingAction> stalled;
        try {
            stalled = actionQueue.findStalledApprovals(now.minus(properties.approvedGrace()));
        } catch (StorageException e) {
            log.error("[ActionQueue] Stalled approval scan failed, retrying next interval: {}", e.getMessage(), e);
            return;
        }
        for (PendingAction action : stalled) {
            log.warn("[ActionQueue:{}] Approved at {} but no outcome yet, resuming session {} again",
                    action.getId(), action.getResolvedAt(), action.getSessionId());
            announce(action);
        }
    }

    private void announce(PendingAction action) {
        events.publishEvent(new ActionResolvedEvent(action.getId(), action.getSessionId(), action.getStatus()));
    }
}
