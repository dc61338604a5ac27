package io.github.cyfko.contactql.core.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Thread-safe, size-bounded LRU cache.
 * <p>
 * Backed by an access-ordered {@link LinkedHashMap}; every access reorders entries, so all
 * operations take the same lock.
 * </p>
 *
 * @param <K> key type
 * @param <V> value type
 * @since 1.0.0
 */
public class QueryCache<K, V> {

    private final int maxSize;
    private final Map<K, V> entries;
    private final Lock lock = new ReentrantLock();

    public QueryCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > QueryCache.this.maxSize;
            }
        };
    }

    public V get(K key) {
        lock.lock();
        try {
            return entries.get(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached value for the key, computing and caching it on a miss.
     * <p>
     * The computation runs outside the lock; if it throws, nothing is cached and the exception
     * propagates. Two threads missing on the same key may both compute it.
     * </p>
     *
     * @param key             the key
     * @param mappingFunction computes the value on a miss
     * @return the cached or computed value
     */
    public V computeIfAbsent(K key, Function<K, V> mappingFunction) {
        V cached = get(key);
        if (cached != null) {
            return cached;
        }

        V computed = mappingFunction.apply(key);
        if (computed != null) {
            lock.lock();
            try {
                entries.putIfAbsent(key, computed);
            } finally {
                lock.unlock();
            }
        }
        return computed;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }
}
