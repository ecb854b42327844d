package com.bytecache.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * History tracks approximately how recently each key was used.
 *
 * Keys are kept in generations instead of a strictly ordered list:
 * <pre>
 *   old  |  ring[0] (oldest sealed) ... ring[n-1] (newest sealed)  |  next
 * </pre>
 * - next receives every fresh or refreshed key
 * - once next reaches the generation threshold it is sealed and appended to the ring
 * - when the ring already holds generationCount buckets, the oldest one is drained into old
 * - old holds keys that aged out and are due for reclamation, see {@link #spill}
 *
 * A key lives in at most one band at a time. A hit on a key found in the ring or
 * in old moves it back to next (dig-out).
 *
 * Rotation happens after insertion: when next reaches the threshold it is sealed,
 * so a generation may exceed the threshold by one oversized key.
 *
 * Not thread-safe. Callers that share an instance must serialize access.
 *
 * @param <K> key type
 */
public class History<K> {
    private static final Logger logger = LoggerFactory.getLogger(History.class);

    private final long maxGenerationUsage;
    private final int generationCount;

    // Sealed generations, oldest first
    private final Deque<Bucket<K>> ring;

    private Bucket<K> next;
    private final Bucket<K> old;

    /**
     * @param maxGenerationUsage Usage at which the open generation is sealed (at least 1)
     * @param generationCount    Number of sealed generations kept before keys fall to old (at least 1)
     */
    public History(long maxGenerationUsage, int generationCount) {
        if (maxGenerationUsage < 1) {
            throw new IllegalArgumentException(
                    "Generation threshold must be at least 1, got: " + maxGenerationUsage);
        }
        if (generationCount < 1) {
            throw new IllegalArgumentException(
                    "Generation count must be at least 1, got: " + generationCount);
        }

        this.maxGenerationUsage = maxGenerationUsage;
        this.generationCount = generationCount;
        this.ring = new ArrayDeque<>(generationCount);
        this.next = new Bucket<>();
        this.old = new Bucket<>();

        logger.debug("History created: generation threshold={}, generation count={}",
                maxGenerationUsage, generationCount);
    }

    /**
     * Mark the key as recently used, inserting it if it is not tracked yet.
     *
     * @param key  The key
     * @param cost Non-negative cost of the key
     */
    public void hit(K key, long cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("Cost must not be negative, got: " + cost);
        }

        Long current = next.get(key);
        if (current != null) {
            if (current == cost) {
                return;
            }
            // Size change does not reset recency
            next.insert(key, cost);
        } else {
            if (!old.remove(key)) {
                digOut(key);
            }
            next.insert(key, cost);
        }

        if (next.usage() >= maxGenerationUsage) {
            rotate();
        }
    }

    /**
     * Stop tracking the key.
     *
     * @return true if the key was tracked
     */
    public boolean remove(K key) {
        if (next.remove(key)) {
            return true;
        }
        if (digOut(key)) {
            return true;
        }
        return old.remove(key);
    }

    /**
     * Hand every key of the reclamation band to the sink and empty the band.
     *
     * @param sink Receives (key, cost) for each aged-out key
     * @return number of keys spilled
     */
    public int spill(BiConsumer<? super K, ? super Long> sink) {
        int count = old.size();
        if (count == 0) {
            return 0;
        }

        old.forEach(sink);
        logger.debug("Spilled {} keys ({} bytes) from reclamation band", count, old.usage());
        old.clear();
        return count;
    }

    public boolean contains(K key) {
        if (next.contains(key) || old.contains(key)) {
            return true;
        }
        for (Bucket<K> bucket : ring) {
            if (bucket.contains(key)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Forget every key in every band.
     */
    public void clear() {
        next.clear();
        old.clear();
        ring.clear();
    }

    /**
     * @return total cost of all tracked keys
     */
    public long usage() {
        long total = old.usage();
        for (Bucket<K> bucket : ring) {
            total += bucket.usage();
        }
        total += next.usage();
        return total;
    }

    /**
     * @return number of tracked keys
     */
    public int size() {
        int total = old.size();
        for (Bucket<K> bucket : ring) {
            total += bucket.size();
        }
        total += next.size();
        return total;
    }

    /**
     * Usage per band, oldest first: old, each sealed generation, next.
     */
    public List<BandUsage> detailedUsage() {
        List<BandUsage> bands = new ArrayList<>(ring.size() + 2);
        bands.add(BandUsage.uncapped(old.usage()));
        for (Bucket<K> bucket : ring) {
            bands.add(BandUsage.capped(bucket.usage(), maxGenerationUsage));
        }
        bands.add(BandUsage.capped(next.usage(), maxGenerationUsage));
        return bands;
    }

    /**
     * Same as {@link #detailedUsage()} without capacities.
     */
    public List<Long> simpleUsage() {
        List<Long> bands = new ArrayList<>(ring.size() + 2);
        bands.add(old.usage());
        for (Bucket<K> bucket : ring) {
            bands.add(bucket.usage());
        }
        bands.add(next.usage());
        return bands;
    }

    public long getMaxGenerationUsage() {
        return maxGenerationUsage;
    }

    public int getGenerationCount() {
        return generationCount;
    }

    /**
     * Find the key in the sealed generations and remove it from there.
     */
    private boolean digOut(K key) {
        for (Bucket<K> bucket : ring) {
            if (bucket.remove(key)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Seal next into the ring. If the ring is full its oldest generation is
     * drained into old and its storage becomes the new next.
     */
    private void rotate() {
        Bucket<K> empty;
        if (ring.size() >= generationCount) {
            Bucket<K> oldest = ring.pollFirst();
            old.extend(oldest);
            logger.debug("Generation of {} keys ({} bytes) fell into reclamation band",
                    oldest.size(), oldest.usage());
            oldest.clear();
            empty = oldest;
        } else {
            empty = new Bucket<>();
        }

        Bucket<K> sealed = next;
        next = empty;
        ring.addLast(sealed);
    }

    @Override
    public String toString() {
        return "History{" +
                "generationThreshold=" + maxGenerationUsage +
                ", generationCount=" + generationCount +
                ", bands=" + simpleUsage() +
                '}';
    }
}
