package com.bytecache.cache;

import com.bytecache.config.CacheConfig;
import com.bytecache.history.BandUsage;
import com.bytecache.history.History;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory cache bounded by a byte budget.
 *
 * Values live in a plain map; recency is delegated to a {@link History}. When an
 * insert does not fit, the keys that aged out of the history are evicted until
 * the value fits or nothing is left to reclaim. Reads refresh recency exactly
 * like writes.
 *
 * Not thread-safe, see {@link SynchronizedMemCache}.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class MemCache<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(MemCache.class);

    private final long limit;
    private final SizeOf<? super V> sizeOf;
    private final Map<K, V> values;
    private final History<K> history;

    private long evictionCount = 0;
    private long outOfMemoryCount = 0;

    /**
     * Cache with default generation sizing for the limit.
     *
     * @param limit  Byte budget
     * @param sizeOf Size of a value in bytes
     */
    public MemCache(long limit, SizeOf<? super V> sizeOf) {
        this(CacheConfig.withLimit(limit), sizeOf);
    }

    public MemCache(CacheConfig config, SizeOf<? super V> sizeOf) {
        this.limit = config.getLimit();
        this.sizeOf = Objects.requireNonNull(sizeOf, "sizeOf");
        this.values = new HashMap<>();
        this.history = new History<>(config.getGenerationThreshold(), config.getGenerationCount());

        logger.info("MemCache initialized with limit: {} bytes ({} generations of {} bytes)",
                limit, config.getGenerationCount(), config.getGenerationThreshold());
    }

    /**
     * Cache of byte arrays with default generation sizing.
     */
    public static <K> MemCache<K, byte[]> forBytes(long limit) {
        return new MemCache<>(limit, SizeOf.byteArray());
    }

    /**
     * Store the value under the key.
     *
     * If the key already holds a value, only the growth has to be made room
     * for. If the value cannot be admitted, an existing value for the key is
     * dropped as well.
     *
     * @return STORED, or OUT_OF_MEMORY if the value did not fit
     */
    public StoreResult set(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        long newCost = sizeOf(value);
        V existing = values.get(key);
        long existingCost = existing != null ? sizeOf(existing) : 0;

        if (newCost > limit || !freeMemory(key, newCost, existingCost)) {
            if (existing != null) {
                values.remove(key);
                history.remove(key);
            }
            outOfMemoryCount++;
            logger.warn("Out of memory: key={}, size={}, usage={}, limit={}",
                    key, newCost, history.usage(), limit);
            return StoreResult.OUT_OF_MEMORY;
        }

        values.put(key, value);
        history.hit(key, newCost);
        logger.debug("SET: key={}, size={}, usage={}", key, newCost, history.usage());
        return StoreResult.STORED;
    }

    /**
     * Get a value and mark it as recently used.
     *
     * @return the value, or null if not found
     */
    public V get(K key) {
        V value = values.get(key);
        if (value != null) {
            history.hit(key, sizeOf(value));
            logger.debug("GET: key={}, found={}", key, true);
            return value;
        }
        logger.debug("GET: key={}, found={}", key, false);
        return null;
    }

    /**
     * Delete a key from the cache.
     *
     * @return true if the key was present
     */
    public boolean remove(K key) {
        boolean removed = values.remove(key) != null;
        if (removed) {
            history.remove(key);
        }
        logger.debug("REMOVE: key={}, found={}", key, removed);
        return removed;
    }

    public boolean contains(K key) {
        return values.containsKey(key);
    }

    /**
     * @return true if the amount fits in the remaining budget without evicting anything
     */
    public boolean canStoreBytes(long amount) {
        // usage never exceeds limit, so the difference cannot overflow
        return amount >= 0 && amount <= limit - history.usage();
    }

    /**
     * @return number of stored values
     */
    public int size() {
        return values.size();
    }

    /**
     * @return bytes held by all stored values
     */
    public long usage() {
        return history.usage();
    }

    public long limit() {
        return limit;
    }

    /**
     * Usage per age band, oldest first.
     */
    public List<BandUsage> detailedUsage() {
        return history.detailedUsage();
    }

    public List<Long> simpleUsage() {
        return history.simpleUsage();
    }

    public void clear() {
        values.clear();
        history.clear();
        logger.info("Cache cleared");
    }

    /**
     * Get cache statistics including eviction info.
     */
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("entries", values.size());
        stats.put("usage", history.usage());
        stats.put("limit", limit);
        stats.put("evictionCount", evictionCount);
        stats.put("outOfMemoryCount", outOfMemoryCount);
        stats.put("bands", history.simpleUsage());
        return stats;
    }

    /**
     * Reclaim aged-out keys until the new value fits.
     *
     * The existing value of the key offsets the required space only while the
     * key is still stored; if it gets reclaimed on the way, the full size is needed.
     *
     * @return true if enough space is available
     */
    private boolean freeMemory(K key, long newCost, long existingCost) {
        List<K> spilled = new ArrayList<>();
        while (true) {
            long offset = values.containsKey(key) ? existingCost : 0;
            long required = Math.max(0, newCost - offset);
            if (canStoreBytes(required)) {
                return true;
            }

            spilled.clear();
            if (history.spill((spilledKey, cost) -> spilled.add(spilledKey)) == 0) {
                return false;
            }

            for (K spilledKey : spilled) {
                values.remove(spilledKey);
            }
            evictionCount += spilled.size();
            logger.debug("Evicted {} aged-out keys, usage now: {}", spilled.size(), history.usage());
        }
    }

    private long sizeOf(V value) {
        long size = sizeOf.sizeOf(value);
        if (size < 0) {
            throw new IllegalArgumentException("Value size must not be negative, got: " + size);
        }
        return size;
    }
}
