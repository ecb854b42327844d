package com.bytecache.history;

import java.util.Objects;

/**
 * Usage of one age band of a {@link History}.
 *
 * The reclamation band has no capacity; generation bands are capped at the
 * generation threshold. A capped band may report usage above its capacity
 * when a single oversized key was admitted into it.
 */
public final class BandUsage {
    private final long usage;
    private final Long capacity;

    /**
     * @param usage    Total cost held by the band
     * @param capacity Generation threshold, or null for the uncapped reclamation band
     */
    public BandUsage(long usage, Long capacity) {
        this.usage = usage;
        this.capacity = capacity;
    }

    public static BandUsage uncapped(long usage) {
        return new BandUsage(usage, null);
    }

    public static BandUsage capped(long usage, long capacity) {
        return new BandUsage(usage, capacity);
    }

    public long getUsage() {
        return usage;
    }

    /**
     * @return the band capacity, or null if the band is uncapped
     */
    public Long getCapacity() {
        return capacity;
    }

    public boolean isCapped() {
        return capacity != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BandUsage that = (BandUsage) o;
        return usage == that.usage && Objects.equals(capacity, that.capacity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(usage, capacity);
    }

    @Override
    public String toString() {
        return capacity == null ? usage + "/-" : usage + "/" + capacity;
    }
}
