package com.tokengate.service;

import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-key mutual exclusion. Locks are created on first use and dropped once no thread holds or
 * waits for them, so the map only ever contains keys that are in use.
 *
 * Lock keys: {@code user:<groupId>:<userId>} for member state (sessions, user records, invites),
 * {@code group:<groupId>} for group state (whitelist, pending request, strikes, configuration).
 */
@Service
public class KeyLockService {

    private final ConcurrentHashMap<String, RefCountedLock> locks = new ConcurrentHashMap<>();

    public static String groupKey(String groupId) {
        return "group:" + groupId;
    }

    public <T> T withLock(String key, Supplier<T> action) {
        RefCountedLock entry = locks.compute(key, (k, existing) -> {
            RefCountedLock lock = existing != null ? existing : new RefCountedLock();
            lock.holders++;
            return lock;
        });

        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, lock) -> --lock.holders == 0 ? null : lock);
        }
    }

    public void runWithLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread(String key) {
        RefCountedLock entry = locks.get(key);
        return entry != null && entry.lock.isHeldByCurrentThread();
    }

    int trackedKeys() {
        return locks.size();
    }

    private static final class RefCountedLock {
        private final ReentrantLock lock = new ReentrantLock();
        // Guarded by the map's per-key compute
        private int holders;
    }
}
