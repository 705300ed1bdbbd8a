package com.warden.core.engine;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-update-id mutual exclusion within this process. Compare-and-set on the
 * stored state covers other processes.
 * <p>
 * An entry lives only while some thread holds or waits for its lock.
 */
class UpdateLocks {

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        int users;
    }

    private final ConcurrentHashMap<Long, Entry> locks = new ConcurrentHashMap<>();

    <T> T withLock(long updateId, Supplier<T> work) {
        Entry entry = locks.compute(updateId, (id, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return work.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(updateId, (id, e) -> --e.users == 0 ? null : e);
        }
    }

    int size() {
        return locks.size();
    }
}
