package io.herdguard.core.store;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe Least Recently Used (LRU) implementation of {@link BoundedStore}.
 *
 * <p>When the store grows past its maximum size, the least recently read or
 * written entry is evicted. Entries never expire on their own.</p>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Fixed maximum size with automatic eviction</li>
 *   <li>Thread-safe using ReadWriteLock</li>
 *   <li>O(1) access and eviction using LinkedHashMap</li>
 *   <li>{@link #has(Object)} does not promote the entry</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * LruStore<String, CacheEntry<Quote>> store = new LruStore<>(1000);
 * store.set("quote:AAPL", entry);
 * CacheEntry<Quote> cached = store.get("quote:AAPL");
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <E> the type of stored entries
 *
 * @since 1.0.0
 */
public class LruStore<K, E> implements BoundedStore<K, E> {

    private final Map<K, E> entries;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final int maxSize;
    private final LongAdder evictions = new LongAdder();

    /**
     * Creates a store holding at most {@code maxSize} entries.
     *
     * @param maxSize the capacity bound
     * @throws IllegalArgumentException if maxSize is not positive
     */
    @SuppressWarnings("serial")
    public LruStore(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Max size must be positive");
        }
        this.maxSize = maxSize;

        // LinkedHashMap with access-order for LRU behavior
        this.entries = new LinkedHashMap<>(Math.min(maxSize, 256), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, E> eldest) {
                boolean shouldRemove = size() > LruStore.this.maxSize;
                if (shouldRemove) {
                    evictions.increment();
                }
                return shouldRemove;
            }
        };
    }

    @Override
    public E get(K key) {
        // get() relinks the entry in an access-ordered map: structural change
        lock.writeLock().lock();
        try {
            return entries.get(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void set(K key, E entry) {
        lock.writeLock().lock();
        try {
            entries.put(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean has(K key) {
        lock.readLock().lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean delete(K key) {
        lock.writeLock().lock();
        try {
            if (!entries.containsKey(key)) {
                return false;
            }
            entries.remove(key);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int maxSize() {
        return maxSize;
    }

    /**
     * Returns a snapshot of all keys, least recently used first.
     *
     * @return a copy of the key set
     */
    @Override
    public Set<K> keys() {
        lock.readLock().lock();
        try {
            return new LinkedHashSet<>(entries.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the number of entries evicted to honor the capacity bound.
     * @return eviction count
     */
    public long evictionCount() {
        return evictions.sum();
    }
}
