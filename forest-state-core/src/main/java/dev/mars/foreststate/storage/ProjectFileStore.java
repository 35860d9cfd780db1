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

import java.io.Closeable;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Durable document storage keyed by (projectId, relativePath).
 * <p>
 * <b>Critical Contract:</b> the committed value of a key is always a complete,
 * previously written document. A write is visible to readers either not at all
 * or completely, and its future completes only after the value is durable.
 * <p>
 * Writers to the same project must be serialized by the caller (see
 * {@link dev.mars.foreststate.serial.ProjectOperationSerializer}); readers may
 * run concurrently with anything.
 *
 * @see AtomicFileStore
 */
public interface ProjectFileStore extends Closeable {

    /**
     * Opens the store. Idempotent.
     *
     * @return a future that completes when the store is ready
     */
    CompletableFuture<Void> open();

    /**
     * Reads a document, serving it from the cache when possible.
     *
     * @return the committed document, or empty if the key has never been written
     *         (or was deleted)
     */
    CompletableFuture<Optional<JsonNode>> read(StorageKey key);

    /**
     * Reads the committed document straight from disk, bypassing and not
     * populating the cache.
     */
    CompletableFuture<Optional<JsonNode>> readDurable(StorageKey key);

    /**
     * Atomically replaces the document at {@code key}.
     * <p>
     * The future fails with {@link ValidationException} when the document is
     * rejected before I/O, or {@link DurabilityException} when the write itself
     * fails; in both cases the previous value is still committed.
     */
    CompletableFuture<Void> write(StorageKey key, JsonNode document);

    /**
     * Removes a document.
     *
     * @return true if a document existed
     */
    CompletableFuture<Boolean> delete(StorageKey key);

    /**
     * Returns size and modification time of a committed document.
     */
    CompletableFuture<Optional<StoredFile>> describe(StorageKey key);

    /**
     * Lists the documents of a project as relative paths, sorted.
     * In-flight temp files are never listed.
     */
    CompletableFuture<List<String>> listProjectFiles(String projectId);

    /**
     * Removes a project directory and every cached document of the project.
     *
     * @return true if the project existed
     */
    CompletableFuture<Boolean> deleteProject(String projectId);

    /**
     * Closes the store, releasing all resources.
     * <p>
     * After close, no other methods should be called.
     */
    @Override
    void close();
}
