package com.bytecache.history;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Bucket is a size-tracked set of keys.
 *
 * Every key carries a cost (usually its size in bytes) and the bucket keeps
 * the running sum of all costs. Replacing a key adjusts the sum by the delta,
 * so the aggregate never has to be recomputed.
 *
 * The bucket has no eviction policy of its own; {@link History} decides where
 * keys live.
 *
 * @param <K> key type
 */
public class Bucket<K> implements Iterable<Map.Entry<K, Long>> {

    private final Map<K, Long> entries;
    private long usage;

    public Bucket() {
        this.entries = new HashMap<>();
        this.usage = 0;
    }

    public boolean contains(K key) {
        return entries.containsKey(key);
    }

    /**
     * @return the cost stored for the key, or null if the key is absent
     */
    public Long get(K key) {
        return entries.get(key);
    }

    /**
     * Insert the key or replace its cost.
     *
     * @param key  The key
     * @param cost Non-negative cost of the key
     * @return true if the key was not present before
     */
    public boolean insert(K key, long cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("Cost must not be negative, got: " + cost);
        }

        Long previous = entries.put(key, cost);
        if (previous != null) {
            usage -= previous;
        }
        usage += cost;

        return previous == null;
    }

    /**
     * Remove the key. Removing an absent key does nothing.
     *
     * @return true if the key was present
     */
    public boolean remove(K key) {
        Long cost = entries.remove(key);
        if (cost == null) {
            return false;
        }
        usage -= cost;
        return true;
    }

    /**
     * Drop all entries. The backing map keeps its capacity so the bucket can be reused.
     */
    public void clear() {
        entries.clear();
        usage = 0;
    }

    /**
     * Bulk upsert, same as calling {@link #insert} for every pair.
     */
    public void extend(Map<? extends K, Long> pairs) {
        for (Map.Entry<? extends K, Long> pair : pairs.entrySet()) {
            insert(pair.getKey(), pair.getValue());
        }
    }

    /**
     * Bulk upsert of every entry of another bucket. The other bucket is left untouched.
     */
    public void extend(Bucket<? extends K> other) {
        extend(other.entries);
    }

    public void forEach(BiConsumer<? super K, ? super Long> action) {
        entries.forEach(action);
    }

    /**
     * Read-only view over (key, cost) pairs, in no particular order.
     */
    @Override
    public Iterator<Map.Entry<K, Long>> iterator() {
        return Collections.unmodifiableMap(entries).entrySet().iterator();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @return sum of the costs of all entries
     */
    public long usage() {
        return usage;
    }

    @Override
    public String toString() {
        return "Bucket{" +
                "entries=" + entries.size() +
                ", usage=" + usage +
                '}';
    }
}
