package com.openforge.storeagent.action;

import com.openforge.storeagent.domain.PendingAction.ActionStatus;

import java.util.UUID;

/**
 * Published after a pending action leaves PENDING (approved, rejected or
 * expired). Listeners refresh the approval card and resume the session.
 */
public record ActionResolvedEvent(UUID actionId, Long sessionId, ActionStatus status) {}
