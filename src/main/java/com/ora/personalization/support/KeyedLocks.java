package com.ora.personalization.support;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-local mutual exclusion per string key. Locks are weakly held and disappear
 * once no thread references them.
 */
@Component
public class KeyedLocks {
    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.get(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    public boolean isLocked(String key) {
        ReentrantLock lock = locks.getIfPresent(key);
        return lock != null && lock.isLocked();
    }
}
