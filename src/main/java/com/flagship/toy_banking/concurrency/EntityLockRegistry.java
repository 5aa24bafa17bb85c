package com.flagship.toy_banking.concurrency;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-entity mutual exclusion inside this process.
 *
 * Keys are namespaced ("coordinator:" + transferId, "participant:" + transferId) so the
 * origin and destination roles of one transfer never wait on each other when both roles
 * live in the same instance. An entry is dropped when its last user leaves, so the map
 * only holds keys that are currently in use.
 */
@Component
public class EntityLockRegistry {

    private final ConcurrentMap<String, Entry> locks = new ConcurrentHashMap<>();

    /**
     * Runs the action while holding the lock for the given key.
     */
    public <T> T withLock(String key, Supplier<T> action) {
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.compute(key, (k, existing) -> {
                existing.users--;
                return existing.users == 0 ? null : existing;
            });
        }
    }

    public static String coordinatorKey(Object transferId) {
        return "coordinator:" + transferId;
    }

    public static String participantKey(Object transferId) {
        return "participant:" + transferId;
    }

    int size() {
        return locks.size();
    }

    // users is only touched inside compute(), which runs atomically per key
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
