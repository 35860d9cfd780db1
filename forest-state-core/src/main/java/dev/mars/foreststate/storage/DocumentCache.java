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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory view of committed documents.
 * <p>
 * <b>Invariant:</b> an entry is present only if it equals the last committed
 * value of its key. Entries are only ever inserted whole or removed; values are
 * deep-copied on the way in and out so nobody can mutate a cached tree.
 * <p>
 * <b>Invalidation epoch:</b> every invalidation bumps a counter <i>before</i>
 * removing entries. A reader captures the counter before its durable read and
 * passes it to {@link #populate}; if any invalidation happened in between, the
 * inserted entry is withdrawn again. Together with the invalidate-before and
 * invalidate-after steps of {@link AtomicFileStore#write} this guarantees that a
 * slow reader never leaves a value older than the latest completed write behind.
 * <p>
 * The cache is the only shared structure touched outside the per-project lock;
 * it needs no lock of its own.
 */
public final class DocumentCache {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentCache.class);

    private final ConcurrentHashMap<StorageKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong epoch = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final Clock clock;

    public DocumentCache() {
        this(Clock.systemUTC());
    }

    public DocumentCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * A cached document.
     *
     * @param value      private copy of the committed document
     * @param insertedAt time the entry was populated
     */
    public record CacheEntry(JsonNode value, Instant insertedAt) {
    }

    /**
     * Looks up a key, counting the hit or miss.
     *
     * @return a private copy of the cached document, or empty
     */
    public Optional<JsonNode> get(StorageKey key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.value().deepCopy());
    }

    /** Returns the raw entry without touching the counters. */
    public Optional<CacheEntry> peek(StorageKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    /** Current invalidation epoch; capture it before reading the durable value. */
    public long epoch() {
        return epoch.get();
    }

    /**
     * Inserts a value read from disk, unless an invalidation happened since
     * {@code observedEpoch}.
     *
     * @return true if the entry is still cached when this method returns
     */
    public boolean populate(StorageKey key, JsonNode committed, long observedEpoch) {
        if (epoch.get() != observedEpoch) {
            LOG.trace("Skipping cache population of {}: invalidated during read", key);
            return false;
        }
        CacheEntry entry = new CacheEntry(committed.deepCopy(), clock.instant());
        entries.put(key, entry);
        if (epoch.get() != observedEpoch) {
            // An invalidation raced with the insert; the value may be stale.
            entries.remove(key, entry);
            LOG.trace("Withdrew cache entry for {}: invalidated during insert", key);
            return false;
        }
        return true;
    }

    /** Removes the entry for one key. */
    public void invalidate(StorageKey key) {
        epoch.incrementAndGet();
        entries.remove(key);
    }

    /** Removes every entry of a project. */
    public int invalidateProject(String projectId) {
        epoch.incrementAndGet();
        int before = entries.size();
        entries.keySet().removeIf(k -> k.projectId().equals(projectId));
        int removed = Math.max(0, before - entries.size());
        if (removed > 0) {
            LOG.debug("Cache invalidated for project {}: {} entries", projectId, removed);
        }
        return removed;
    }

    /** Removes everything and resets the counters. */
    public void clear() {
        epoch.incrementAndGet();
        entries.clear();
        hits.set(0);
        misses.set(0);
        LOG.debug("Cache cleared");
    }

    public CacheStats stats() {
        return new CacheStats(entries.size(), hits.get(), misses.get());
    }
}
