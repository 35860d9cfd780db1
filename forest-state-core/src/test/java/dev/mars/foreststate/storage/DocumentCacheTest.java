/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.foreststate.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static dev.mars.foreststate.storage.AtomicFileStoreTest.json;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DocumentCache}: private copies, counters and the invalidation epoch.
 */
class DocumentCacheTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final DocumentCache cache = new DocumentCache(Clock.fixed(NOW, ZoneOffset.UTC));
    private final StorageKey key = StorageKey.of("p1", "config.json");

    @Test
    void testPopulateThenGet() {
        assertTrue(cache.populate(key, json("{\"v\":1}"), cache.epoch()));

        assertEquals(json("{\"v\":1}"), cache.get(key).orElseThrow());
        assertEquals(NOW, cache.peek(key).orElseThrow().insertedAt());
    }

    @Test
    void testValuesAreCopiedInAndOut() {
        ObjectNode original = (ObjectNode) json("{\"v\":1}");
        cache.populate(key, original, cache.epoch());
        original.put("v", 99);

        ObjectNode fromCache = (ObjectNode) cache.get(key).orElseThrow();
        fromCache.put("v", 42);

        assertEquals(json("{\"v\":1}"), cache.get(key).orElseThrow());
    }

    @Test
    void testInvalidationDuringRead_PreventsStalePopulate() {
        // Reader captures the epoch, then a writer commits and invalidates
        long observed = cache.epoch();
        cache.invalidate(key);

        assertFalse(cache.populate(key, json("{\"v\":\"stale\"}"), observed));
        assertTrue(cache.peek(key).isEmpty());
    }

    @Test
    void testInvalidate_RemovesEntry() {
        cache.populate(key, json("{}"), cache.epoch());

        cache.invalidate(key);

        assertTrue(cache.get(key).isEmpty());
    }

    @Test
    void testInvalidateProject_OnlyThatProject() {
        StorageKey other = StorageKey.of("p2", "config.json");
        cache.populate(key, json("{}"), cache.epoch());
        cache.populate(StorageKey.pathScoped("p1", "general", "hta.json"), json("{}"), cache.epoch());
        cache.populate(other, json("{}"), cache.epoch());

        assertEquals(2, cache.invalidateProject("p1"));

        assertTrue(cache.peek(key).isEmpty());
        assertTrue(cache.peek(other).isPresent());
    }

    @Test
    void testStats() {
        cache.get(key);
        cache.populate(key, json("{}"), cache.epoch());
        cache.get(key);
        cache.get(key);

        CacheStats stats = cache.stats();
        assertEquals(1, stats.size());
        assertEquals(2, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);

        cache.clear();
        assertEquals(0, cache.stats().size());
        assertEquals(0, cache.stats().hits());
    }

    @Test
    void testHitRate_NoLookups() {
        assertEquals(0.0, cache.stats().hitRate());
    }

    @Test
    void testEpochAdvancesOnEveryInvalidation() {
        long start = cache.epoch();
        cache.invalidate(key);
        cache.invalidateProject("p1");
        cache.clear();

        assertEquals(start + 3, cache.epoch());
        JsonNode fresh = json("{\"v\":2}");
        assertTrue(cache.populate(key, fresh, cache.epoch()));
    }
}
