package com.openforge.storeagent.approval;

/**
 * External place where humans see approval cards and click a decision.
 * Decisions come back through {@link ApprovalGateway#onDecision}.
 */
public interface NotificationChannel {

    /**
     * Posts a new card.
     *
     * @return an identifier unique to this post, never reused
     * @throws NotificationException if the channel rejected or never received the post
     */
    String postCard(ApprovalCard card);

    /** Replaces the card previously posted under {@code externalRef}. */
    void updateCard(String externalRef, ApprovalCard card);

    String name();
}
