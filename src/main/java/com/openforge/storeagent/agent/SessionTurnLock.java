package com.openforge.storeagent.agent;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per chat session so turns of the same session (new user
 * messages and approval resumes) run one at a time. Sessions never share a
 * lock. Entries are never removed, since a thread may still be queued on
 * the lock of a deleted session. Single-node only.
 */
@Component
public class SessionTurnLock {

    private final ConcurrentMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Long sessionId, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(sessionId, id -> new ReentrantLock(true));
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
