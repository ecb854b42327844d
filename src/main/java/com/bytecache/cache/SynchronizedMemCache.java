package com.bytecache.cache;

import com.bytecache.history.BandUsage;

import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe view of a {@link MemCache}.
 *
 * A rotation touches several generations at once, so the whole cache is
 * guarded by one lock instead of locking per key.
 */
public class SynchronizedMemCache<K, V> {
    private final MemCache<K, V> delegate;
    private final ReentrantLock lock = new ReentrantLock();

    public SynchronizedMemCache(MemCache<K, V> delegate) {
        this.delegate = delegate;
    }

    public StoreResult set(K key, V value) {
        lock.lock();
        try {
            return delegate.set(key, value);
        } finally {
            lock.unlock();
        }
    }

    public V get(K key) {
        lock.lock();
        try {
            return delegate.get(key);
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(K key) {
        lock.lock();
        try {
            return delegate.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(K key) {
        lock.lock();
        try {
            return delegate.contains(key);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return delegate.size();
        } finally {
            lock.unlock();
        }
    }

    public long usage() {
        lock.lock();
        try {
            return delegate.usage();
        } finally {
            lock.unlock();
        }
    }

    public long limit() {
        return delegate.limit();
    }

    public List<BandUsage> detailedUsage() {
        lock.lock();
        try {
            return delegate.detailedUsage();
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Object> getStats() {
        lock.lock();
        try {
            return delegate.getStats();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            delegate.clear();
        } finally {
            lock.unlock();
        }
    }
}
