package com.bytecache.cache;

/**
 * Outcome of {@link MemCache#set}.
 */
public enum StoreResult {
    STORED,
    /** Value did not fit even after reclaiming every aged-out key. */
    OUT_OF_MEMORY
}
