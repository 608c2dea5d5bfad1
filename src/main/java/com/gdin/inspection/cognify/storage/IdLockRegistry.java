package com.gdin.inspection.cognify.storage;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 按数据点 id 加锁。锁带引用计数，无人持有时即从表中移除。
 * 多个 id 一起加锁时按字典序获取，避免死锁。
 */
@Component
public class IdLockRegistry {

    private static final class RefCountedLock {
        final ReentrantLock lock = new ReentrantLock();
        int refs;
    }

    private final Map<String, RefCountedLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String id, Supplier<T> action) {
        RefCountedLock l = acquire(id);
        try {
            return action.get();
        } finally {
            release(id, l);
        }
    }

    public <T> T withLocks(Collection<String> ids, Supplier<T> action) {
        List<String> ordered = new ArrayList<>(new TreeSet<>(ids));
        List<RefCountedLock> held = new ArrayList<>(ordered.size());
        try {
            for (String id : ordered) {
                held.add(acquire(id));
            }
            return action.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                release(ordered.get(i), held.get(i));
            }
        }
    }

    public int activeLocks() {
        return locks.size();
    }

    private RefCountedLock acquire(String id) {
        RefCountedLock l = locks.compute(id, (k, v) -> {
            RefCountedLock lock = v == null ? new RefCountedLock() : v;
            lock.refs++;
            return lock;
        });
        l.lock.lock();
        return l;
    }

    private void release(String id, RefCountedLock l) {
        l.lock.unlock();
        locks.compute(id, (k, v) -> {
            if (v == null) return null;
            v.refs--;
            return v.refs == 0 ? null : v;
        });
    }
}
