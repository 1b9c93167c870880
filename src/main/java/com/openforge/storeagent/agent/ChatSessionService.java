package com.openforge.storeagent.agent;

import com.openforge.storeagent.action.ActionQueueService;
import com.openforge.storeagent.common.StorageException;
import com.openforge.storeagent.domain.ChatSession;
import com.openforge.storeagent.repository.ChatMessageRepository;
import com.openforge.storeagent.repository.ChatSessionMetricsRepository;
import com.openforge.storeagent.repository.ChatSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChatSessionService {

    private final ChatSessionRepository        sessionRepository;
    private final ChatMessageRepository        messageRepository;
    private final ChatSessionMetricsRepository metricsRepository;
    private final ActionQueueService           actionQueue;
    private final SessionTurnLock              turnLock;
    private final ChatProperties               properties;
    private final TransactionTemplate          transactionTemplate;

    public ChatSession create(Long ownerId, @Nullable String title) {
        try {
            ChatSession session = sessionRepository.save(ChatSession.builder()
                    .ownerId(ownerId)
                    .title(title == null || title.isBlank() ? null : shorten(title))
                    .build());
            log.info("[Chat:{}] Session created for owner {}", session.getId(), ownerId);
            return session;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to create chat session", e);
        }
    }

    public ChatSession get(Long sessionId) {
        try {
            return sessionRepository.findById(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load chat session " + sessionId, e);
        }
    }

    public List<ChatSession> listForOwner(Long ownerId) {
        try {
            return sessionRepository.findByOwnerIdOrderByUpdateTimeDesc(ownerId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list chat sessions", e);
        }
    }

    /** Derives the title from the first user message; later messages leave it alone. */
    public void applyTitleIfAbsent(Long sessionId, String firstMessage) {
        if (firstMessage == null || firstMessage.isBlank()) return;
        try {
            sessionRepository.setTitleIfAbsent(sessionId, shorten(firstMessage));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to set title of session " + sessionId, e);
        }
    }

    /**
     * Removes the session with its messages, metrics and pending actions.
     * Runs under the session's turn lock, so it waits for a running turn or
     * resume to finish. The lock entry itself stays: a caller already
     * waiting on it must keep excluding later turns.
     */
    public void delete(Long sessionId) {
        turnLock.withLock(sessionId, () -> transactionTemplate.execute(status -> {
            ChatSession session = get(sessionId);
            try {
                actionQueue.deleteForSession(sessionId);
                messageRepository.deleteBySessionId(sessionId);
                metricsRepository.deleteBySessionId(sessionId);
                sessionRepository.delete(session);
            } catch (DataAccessException e) {
                throw new StorageException("Failed to delete chat session " + sessionId, e);
            }
            return session;
        }));
        log.info("[Chat:{}] Session deleted", sessionId);
    }

    String shorten(String text) {
        String flat = text.strip().replaceAll("\\s+", " ");
        int max = properties.titleMaxLength();
        return flat.length() <= max ? flat : flat.substring(0, max - 3).stripTrailing() + "...";
    }
}
