package com.bytecache.cache;

import com.bytecache.config.CacheConfig;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MemCache
 */
class MemCacheTest {

    @Test
    void testStoreAndGet() {
        MemCache<String, byte[]> cache = MemCache.forBytes(1000);
        assertEquals(StoreResult.STORED, cache.set("test", new byte[]{2, 3, 4}));
        assertArrayEquals(new byte[]{2, 3, 4}, cache.get("test"));
        assertEquals(3, cache.usage());
        assertEquals(1000, cache.limit());
    }

    @Test
    void testGetNonExistent() {
        MemCache<Integer, byte[]> cache = MemCache.forBytes(1000);
        assertNull(cache.get(1));
    }

    @Test
    void testDoesNotStoreNotFitting() {
        MemCache<String, byte[]> cache = MemCache.forBytes(2);
        assertEquals(StoreResult.OUT_OF_MEMORY, cache.set("test", new byte[]{2, 3, 4}));
        assertNull(cache.get("test"));
        assertEquals(0, cache.usage());
    }

    @Test
    void testStoresExactlyFitting() {
        MemCache<String, byte[]> cache = MemCache.forBytes(3);
        assertEquals(StoreResult.STORED, cache.set("test", new byte[]{2, 3, 4}));
        assertArrayEquals(new byte[]{2, 3, 4}, cache.get("test"));
    }

    @Test
    void testKeepsRecentValueWhenNewDoesNotFit() {
        MemCache<String, byte[]> cache = MemCache.forBytes(3);
        assertEquals(StoreResult.STORED, cache.set("test", new byte[]{2, 3}));

        // The first value has not aged out yet, so nothing can be reclaimed
        assertEquals(StoreResult.OUT_OF_MEMORY, cache.set("test2", new byte[]{3, 4, 5}));

        assertArrayEquals(new byte[]{2, 3}, cache.get("test"));
        assertNull(cache.get("test2"));
    }

    @Test
    void testKeepsOldIfNewIsLargerThanLimit() {
        MemCache<String, byte[]> cache = MemCache.forBytes(2);
        cache.set("test", new byte[]{2, 3});

        assertEquals(StoreResult.OUT_OF_MEMORY, cache.set("test2", new byte[]{3, 4, 5}));

        assertNull(cache.get("test2"));
        assertArrayEquals(new byte[]{2, 3}, cache.get("test"));
    }

    @Test
    void testEvictsAgedOutKeys() {
        // Generations of 2 bytes, 2 sealed generations
        MemCache<String, byte[]> cache = MemCache.forBytes(10);
        for (int i = 1; i <= 5; i++) {
            assertEquals(StoreResult.STORED, cache.set("k" + i, new byte[2]));
        }
        assertEquals(10, cache.usage());
        assertEquals(List.of(6L, 2L, 2L, 0L), cache.simpleUsage());

        assertEquals(StoreResult.STORED, cache.set("k6", new byte[2]));

        assertFalse(cache.contains("k1"));
        assertFalse(cache.contains("k2"));
        assertFalse(cache.contains("k3"));
        assertTrue(cache.contains("k4"));
        assertTrue(cache.contains("k5"));
        assertTrue(cache.contains("k6"));
        assertEquals(6, cache.usage());
        assertEquals(3L, cache.getStats().get("evictionCount"));
    }

    @Test
    void testReadExtendsLifetime() {
        // Generations of 2 bytes, values of 1 byte
        MemCache<String, byte[]> cache = MemCache.forBytes(12);
        cache.set("a", new byte[1]);
        cache.set("b", new byte[1]);

        // a moves back to the open generation, b stays behind
        assertNotNull(cache.get("a"));

        cache.set("c", new byte[1]);
        cache.set("d", new byte[1]);
        cache.set("e", new byte[1]);

        assertEquals(StoreResult.STORED, cache.set("big", new byte[8]));

        assertTrue(cache.contains("a"));
        assertFalse(cache.contains("b"));
        assertEquals(12, cache.usage());
    }

    @Test
    void testReplacingWithSmallerValueNeedsNoSpace() {
        MemCache<String, byte[]> cache = MemCache.forBytes(3);
        cache.set("x", new byte[3]);

        assertEquals(StoreResult.STORED, cache.set("x", new byte[2]));

        assertEquals(2, cache.get("x").length);
        assertEquals(2, cache.usage());
        assertEquals(1, cache.size());
    }

    @Test
    void testFailedReplacementRemovesExistingKey() {
        MemCache<String, byte[]> cache = MemCache.forBytes(5);
        cache.set("y", new byte[2]);
        cache.set("x", new byte[2]);

        assertEquals(StoreResult.OUT_OF_MEMORY, cache.set("x", new byte[4]));

        assertFalse(cache.contains("x"));
        assertTrue(cache.contains("y"));
        assertEquals(2, cache.usage());
    }

    @Test
    void testOversizedReplacementRemovesExistingKey() {
        MemCache<String, byte[]> cache = MemCache.forBytes(5);
        cache.set("x", new byte[2]);

        assertEquals(StoreResult.OUT_OF_MEMORY, cache.set("x", new byte[6]));

        assertNull(cache.get("x"));
        assertEquals(0, cache.usage());
    }

    @Test
    void testReplacedKeyReclaimedWhileMakingRoomNeedsFullSize() {
        MemCache<String, byte[]> cache = MemCache.forBytes(10);
        cache.set("a", new byte[2]);
        cache.set("b", new byte[2]);
        cache.set("c", new byte[2]);
        cache.set("d", new byte[2]);

        // a and b are reclaimable; once a is gone its old size no longer offsets the new one
        assertEquals(StoreResult.OUT_OF_MEMORY, cache.set("a", new byte[7]));

        assertFalse(cache.contains("a"));
        assertFalse(cache.contains("b"));
        assertTrue(cache.contains("c"));
        assertTrue(cache.contains("d"));
        assertEquals(4, cache.usage());
        assertTrue(cache.usage() <= cache.limit());
    }

    @Test
    void testRemove() {
        MemCache<String, String> cache = new MemCache<>(100, SizeOf.utf8());
        cache.set("key1", "value1");

        assertTrue(cache.remove("key1"));
        assertFalse(cache.remove("key1"));
        assertNull(cache.get("key1"));
        assertEquals(0, cache.usage());
    }

    @Test
    void testClear() {
        MemCache<String, String> cache = new MemCache<>(100, SizeOf.utf8());
        cache.set("key1", "value1");
        cache.set("key2", "value2");

        cache.clear();

        assertEquals(0, cache.size());
        assertEquals(0, cache.usage());
        assertNull(cache.get("key1"));
    }

    @Test
    void testCanStoreBytes() {
        MemCache<String, byte[]> cache = MemCache.forBytes(10);
        cache.set("a", new byte[4]);

        assertTrue(cache.canStoreBytes(6));
        assertFalse(cache.canStoreBytes(7));
    }

    @Test
    void testCanStoreBytesRejectsHugeAndNegativeAmounts() {
        MemCache<String, byte[]> cache = MemCache.forBytes(10);
        cache.set("a", new byte[1]);

        assertFalse(cache.canStoreBytes(Long.MAX_VALUE));
        assertFalse(cache.canStoreBytes(-1));
        assertTrue(cache.canStoreBytes(9));
    }

    @Test
    void testUsesConfiguredGenerations() {
        MemCache<String, byte[]> cache = new MemCache<>(new CacheConfig(100, 10L, 3), SizeOf.byteArray());
        for (int i = 0; i < 3; i++) {
            cache.set("k" + i, new byte[10]);
        }

        assertEquals(5, cache.detailedUsage().size());
        assertEquals(Long.valueOf(10), cache.detailedUsage().get(1).getCapacity());
    }

    @Test
    void testUtf8SizeCountsEncodedBytes() {
        MemCache<String, String> cache = new MemCache<>(100, SizeOf.utf8());
        cache.set("k", "été");
        assertEquals(5, cache.usage());
    }

    @Test
    void testRejectsNegativeSize() {
        MemCache<String, String> cache = new MemCache<>(100, value -> -1);
        assertThrows(IllegalArgumentException.class, () -> cache.set("k", "v"));
        assertEquals(0, cache.size());
    }

    @Test
    void testOutOfMemoryIsCounted() {
        MemCache<String, byte[]> cache = MemCache.forBytes(2);
        cache.set("a", new byte[3]);

        Map<String, Object> stats = cache.getStats();
        assertEquals(1L, stats.get("outOfMemoryCount"));
        assertEquals(0, stats.get("entries"));
        assertEquals(2L, stats.get("limit"));
    }

    @Test
    void testRandomOperationsStayWithinLimit() {
        MemCache<String, byte[]> cache = MemCache.forBytes(50);
        Map<String, Integer> sizes = new HashMap<>();
        Random random = new Random(7);

        for (int i = 0; i < 5000; i++) {
            String key = "k" + random.nextInt(40);
            int op = random.nextInt(10);
            if (op < 6) {
                int size = random.nextInt(13);
                if (cache.set(key, new byte[size]) == StoreResult.STORED) {
                    sizes.put(key, size);
                    assertTrue(cache.usage() <= cache.limit());
                } else {
                    assertFalse(cache.contains(key));
                }
            } else if (op < 9) {
                byte[] value = cache.get(key);
                if (value != null) {
                    assertEquals(sizes.get(key), value.length);
                }
            } else {
                cache.remove(key);
            }

            long expected = 0;
            for (Map.Entry<String, Integer> entry : sizes.entrySet()) {
                if (cache.contains(entry.getKey())) {
                    expected += entry.getValue();
                }
            }
            assertEquals(expected, cache.usage());
        }
    }
}
