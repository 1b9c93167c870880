package com.openforge.storeagent.approval;

import com.openforge.storeagent.action.ActionExpiredException;
import com.openforge.storeagent.action.ActionQueueService;
import com.openforge.storeagent.action.ActionResolvedEvent;
import com.openforge.storeagent.action.InvalidTransitionException;
import com.openforge.storeagent.domain.PendingAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridge between the action queue and the human approval channel.
 *
 * Outbound: {@link #requestApproval} renders and posts a card; the caller
 * stores the returned ref on the action.
 *
 * Inbound: {@link #onDecision} correlates a channel ref back to its action
 * and applies the decision. Channels deliver at least once, so a repeated
 * or late decision on an already resolved action is reported as IGNORED
 * rather than an error.
 *
 * Every applied decision is published as an {@link ActionResolvedEvent};
 * the same event (from here or from the expiry sweep) triggers the card
 * refresh below and the session resume in the chat orchestrator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovalGateway {

    private final ActionQueueService        actionQueue;
    private final NotificationChannel       channel;
    private final ApprovalCardRenderer      renderer;
    private final ApplicationEventPublisher events;
    private final Clock                     clock;

    // ── Outbound ─────────────────────────────────────────────────────────────

    /**
     * @throws NotificationException if the card could not be posted
     */
    public String requestApproval(PendingAction action) {
        String ref = channel.postCard(renderer.render(action));
        if (ref == null || ref.isBlank()) {
            throw new NotificationException(channel.name() + " returned no reference for action " + action.getId());
        }
        log.info("[ActionQueue:{}] Approval card posted via {} ref={}", action.getId(), channel.name(), ref);
        return ref;
    }

    /** Redraws the card for the action's current state; failures only cost a stale card. */
    public void notifyOutcome(PendingAction action) {
        if (action.getExternalRef() == null) {
            return;
        }
        try {
            channel.updateCard(action.getExternalRef(), renderer.render(action));
        } catch (NotificationException e) {
            log.warn("[ActionQueue:{}] Card update failed ({}): {}",
                    action.getId(), action.getStatus(), e.getMessage());
        }
    }

    // ── Inbound ──────────────────────────────────────────────────────────────

    /**
     * Applies a decision delivered by the channel.
     *
     * @throws UnknownReferenceException if no action carries {@code externalRef}
     */
    public DecisionOutcome onDecision(String externalRef, Decision decision, String actor) {
        PendingAction action = actionQueue.findByExternalRef(externalRef)
                .orElseThrow(() -> new UnknownReferenceException(externalRef));
        try {
            apply(action.getId(), decision, actor);
            return DecisionOutcome.APPLIED;
        } catch (InvalidTransitionException e) {
            log.info("[ActionQueue:{}] Ignoring {} from {}: already {}",
                    action.getId(), decision, actor, e.getCurrent());
            return DecisionOutcome.IGNORED;
        } catch (ActionExpiredException e) {
            log.info("[ActionQueue:{}] {} from {} arrived after expiry", action.getId(), decision, actor);
            expireNow(action.getId());
            return DecisionOutcome.EXPIRED;
        }
    }

    /**
     * Direct decision from the admin API. Unlike {@link #onDecision}, misuse
     * is surfaced to the caller.
     *
     * @throws InvalidTransitionException if the action is already resolved
     * @throws ActionExpiredException if the TTL has passed
     */
    public PendingAction decide(UUID actionId, Decision decision, String actor) {
        try {
            return apply(actionId, decision, actor);
        } catch (ActionExpiredException e) {
            expireNow(actionId);
            throw e;
        }
    }

    // ── Event handling ───────────────────────────────────────────────────────

    @EventListener
    public void onActionResolved(ActionResolvedEvent event) {
        actionQueue.find(event.actionId()).ifPresent(this::notifyOutcome);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private PendingAction apply(UUID actionId, Decision decision, String actor) {
        PendingAction updated = decision == Decision.APPROVE
                ? actionQueue.approve(actionId, actor)
                : actionQueue.reject(actionId, actor);
        events.publishEvent(new ActionResolvedEvent(updated.getId(), updated.getSessionId(), updated.getStatus()));
        return updated;
    }

    /** Expires the row right away instead of waiting for the next sweep. */
    private void expireNow(UUID actionId) {
        Optional<PendingAction> expired = actionQueue.expireIfDue(actionId, clock.instant());
        expired.ifPresent(a -> events.publishEvent(new ActionResolvedEvent(a.getId(), a.getSessionId(), a.getStatus())));
    }
}
