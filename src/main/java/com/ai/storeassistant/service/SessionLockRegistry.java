package com.ai.storeassistant.service;

import com.ai.storeassistant.exception.TurnAbortedException;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per session id. Turns of the same session run one at a time in arrival
 * order; different sessions never wait on each other. Entries disappear once nobody holds
 * or waits for them.
 */
@Component
public class SessionLockRegistry {

    private final ConcurrentHashMap<String, SessionLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String sessionId, Supplier<T> work) {
        SessionLock sessionLock = locks.compute(sessionId, (key, existing) -> {
            SessionLock l = existing != null ? existing : new SessionLock();
            l.holders++;
            return l;
        });
        try {
            sessionLock.lock.lockInterruptibly();
        } catch (InterruptedException e) {
            release(sessionId);
            Thread.currentThread().interrupt();
            throw new TurnAbortedException(sessionId);
        }
        try {
            return work.get();
        } finally {
            sessionLock.lock.unlock();
            release(sessionId);
        }
    }

    int size() {
        return locks.size();
    }

    private void release(String sessionId) {
        locks.computeIfPresent(sessionId, (key, l) -> --l.holders == 0 ? null : l);
    }

    private static final class SessionLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        // guarded by the map's per-key compute
        private int holders;
    }
}
