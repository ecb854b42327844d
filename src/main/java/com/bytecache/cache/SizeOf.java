package com.bytecache.cache;

import java.nio.charset.StandardCharsets;

/**
 * Computes how many bytes a cached value occupies.
 *
 * The result counts against the cache limit and must be non-negative and
 * stable for a given value.
 *
 * @param <V> value type
 */
@FunctionalInterface
public interface SizeOf<V> {

    long sizeOf(V value);

    /**
     * Length of a byte array.
     */
    static SizeOf<byte[]> byteArray() {
        return value -> value.length;
    }

    /**
     * Length of the UTF-8 encoding of a string.
     */
    static SizeOf<String> utf8() {
        return value -> value.getBytes(StandardCharsets.UTF_8).length;
    }
}
