package org.calista.streetsense.ai.cache;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Objects;

/**
 * Bounded cache with insertion-order eviction: a hash index plus an insertion-order queue.
 *
 * <p>Reads do not refresh an entry (this is not LRU). Re-putting an existing key replaces the value
 * in place and keeps its original queue position. When the cache is full the oldest key goes first.
 *
 * Not thread-safe.
 */
public final class FifoCache<K, V> {

    private final int capacity;
    private final HashMap<K, V> index;
    private final ArrayDeque<K> order;

    private long hits;
    private long misses;
    private long evictions;

    public FifoCache(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        this.capacity = capacity;
        this.index = new HashMap<>(Math.min(capacity, 1024) * 2);
        this.order = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /** @return cached value or null */
    public V get(K key) {
        Objects.requireNonNull(key, "key");
        V v = index.get(key);
        if (v == null) misses++;
        else hits++;
        return v;
    }

    public boolean containsKey(K key) {
        return key != null && index.containsKey(key);
    }

    public void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        if (index.containsKey(key)) {
            index.put(key, value);
            return;
        }

        while (index.size() >= capacity) {
            K oldest = order.pollFirst();
            if (oldest == null) break;
            index.remove(oldest);
            evictions++;
        }

        index.put(key, value);
        order.addLast(key);
    }

    public void clear() {
        index.clear();
        order.clear();
    }

    public int size() {
        return index.size();
    }

    public int capacity() {
        return capacity;
    }

    public long hits() {
        return hits;
    }

    public long misses() {
        return misses;
    }

    public long evictions() {
        return evictions;
    }

    @Override
    public String toString() {
        return "FifoCache{size=" + index.size() + "/" + capacity + ", hits=" + hits
                + ", misses=" + misses + ", evictions=" + evictions + '}';
    }
}
