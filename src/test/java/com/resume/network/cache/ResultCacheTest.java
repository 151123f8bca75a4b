package com.resume.network.cache;

import com.resume.network.core.model.SearchOperation;
import com.resume.network.fixture.TestCandidates;
import com.resume.network.pool.CandidatePool;
import com.resume.network.query.StructuredQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultCacheTest {

    private static CacheKey key(long version, Object... inputs) {
        return CacheKey.of(SearchOperation.SIMILAR_CANDIDATES, version, inputs);
    }

    @Nested
    @DisplayName("NoOpResultCache")
    class NoOpTests {

        @Test
        @DisplayName("Should always return empty on get")
        void testGetAlwaysEmpty() {
            NoOpResultCache cache = new NoOpResultCache();
            cache.put(key(1, "a", 10), "result");
            assertTrue(cache.get(key(1, "a", 10), String.class).isEmpty());
        }

        @Test
        @DisplayName("Should return empty stats")
        void testEmptyStats() {
            CacheStats stats = new NoOpResultCache().getStats();
            assertEquals(0, stats.hitCount());
            assertEquals(0, stats.missCount());
            assertEquals(0, stats.size());
            assertEquals(0.0, stats.hitRate());
        }
    }

    @Nested
    @DisplayName("CaffeineResultCache")
    class CaffeineTests {

        private final CaffeineResultCache cache = new CaffeineResultCache(new CacheConfig(100, 60, true));

        @Test
        @DisplayName("Should return a cached result for an equal key")
        void testPutAndGet() {
            cache.put(key(1, "a", 10), "result");

            assertEquals("result", cache.get(key(1, "a", 10), String.class).orElseThrow());
            assertTrue(cache.get(key(1, "a", 11), String.class).isEmpty());
            assertTrue(cache.get(key(2, "a", 10), String.class).isEmpty());
        }

        @Test
        @DisplayName("Should treat equal queries as equal inputs")
        void testQueryInputs() {
            StructuredQuery first = StructuredQuery.builder().organization("Acme").skill("java").build();
            StructuredQuery second = StructuredQuery.builder().organization("Acme").skill("java").build();
            cache.put(CacheKey.of(SearchOperation.STRUCTURED_SEARCH, 3, first, 0, 20), List.of("a"));

            assertTrue(cache.get(CacheKey.of(SearchOperation.STRUCTURED_SEARCH, 3, second, 0, 20), List.class)
                    .isPresent());
            assertTrue(cache.get(CacheKey.of(SearchOperation.SIMILAR_CANDIDATES, 3, second, 0, 20), List.class)
                    .isEmpty());
        }

        @Test
        @DisplayName("Should drop an entry of the wrong type")
        void testTypeMismatch() {
            cache.put(key(1, "a"), "result");

            assertTrue(cache.get(key(1, "a"), Integer.class).isEmpty());
            assertTrue(cache.get(key(1, "a"), String.class).isEmpty());
        }

        @Test
        @DisplayName("Should ignore null results")
        void testNullResult() {
            cache.put(key(1, "a"), null);

            assertTrue(cache.get(key(1, "a"), Object.class).isEmpty());
        }

        @Test
        @DisplayName("Should invalidate entries of superseded snapshots on publish")
        void testSnapshotInvalidation() {
            cache.put(key(1, "a"), "old");
            cache.put(key(2, "a"), "current");

            CandidatePool published = CandidatePool.of(2, List.of(TestCandidates.candidateA()));
            cache.onSnapshotPublished(published);

            assertTrue(cache.get(key(1, "a"), String.class).isEmpty());
            assertEquals("current", cache.get(key(2, "a"), String.class).orElseThrow());
        }

        @Test
        @DisplayName("Should invalidate everything")
        void testInvalidateAll() {
            cache.put(key(1, "a"), "one");
            cache.put(key(2, "b"), "two");

            cache.invalidateAll();

            assertTrue(cache.get(key(1, "a"), String.class).isEmpty());
            assertTrue(cache.get(key(2, "b"), String.class).isEmpty());
        }

        @Test
        @DisplayName("Should track hits and misses")
        void testStats() {
            cache.put(key(1, "a"), "result");
            cache.get(key(1, "a"), String.class);
            cache.get(key(1, "a"), String.class);
            cache.get(key(1, "b"), String.class);

            CacheStats stats = cache.getStats();
            assertEquals(2, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);
        }
    }

    @Nested
    @DisplayName("CacheKey and CacheConfig")
    class KeyAndConfigTests {

        @Test
        @DisplayName("Should allow null inputs")
        void testNullInputs() {
            assertEquals(key(1, "a", null), key(1, "a", null));
            assertNotEquals(key(1, "a", null), key(1, "a", 5));
        }

        @Test
        @DisplayName("Should copy inputs")
        void testInputsImmutable() {
            CacheKey key = key(1, "a");
            assertThrows(UnsupportedOperationException.class, () -> key.inputs().add("b"));
        }

        @Test
        @DisplayName("Should reject invalid config")
        void testInvalidConfig() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
            assertTrue(CacheConfig.defaults().enabled());
            assertFalse(CacheConfig.disabled().enabled());
        }
    }
}
