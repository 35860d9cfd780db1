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
package dev.mars.foreststate;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.foreststate.serial.ProjectOperationSerializer;
import dev.mars.foreststate.session.DialogueSession;
import dev.mars.foreststate.session.DialogueSessionStore;
import dev.mars.foreststate.session.DialogueSessionStores;
import dev.mars.foreststate.session.DialogueStats;
import dev.mars.foreststate.storage.AtomicFileStore;
import dev.mars.foreststate.storage.CacheStats;
import dev.mars.foreststate.storage.DocumentCodec;
import dev.mars.foreststate.storage.StorageException;
import dev.mars.foreststate.storage.StorageKey;
import dev.mars.foreststate.tx.TransactionCoordinator;
import dev.mars.foreststate.tx.TransactionOperation;
import dev.mars.foreststate.tx.TransactionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Entry point to the state layer: project documents, transactions and dialogue sessions.
 * <p>
 * Create one instance per process with {@link #open(ForestStateConfig)} and pass it to
 * the components that need it. A typical read-modify-write of a project:
 * <pre>
 * state.runSerialized("p1", () -&gt;
 *     state.readFile("p1", "config.json")
 *          .thenCompose(cfg -&gt; state.writeFile("p1", "config.json", update(cfg))));
 * </pre>
 * File and transaction methods do not take the project lock themselves. Callers that
 * need read-modify-write atomicity run them inside {@link #runSerialized}; because the
 * lock is not reentrant, an operation must not call {@code runSerialized} for its own
 * project and wait for the result.
 */
public final class ForestState implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ForestState.class);

    private final ForestStateConfig config;
    private final AtomicFileStore files;
    private final ProjectOperationSerializer serializer;
    private final TransactionCoordinator transactions;
    private final DialogueSessionStore sessions;

    ForestState(ForestStateConfig config, AtomicFileStore files, ProjectOperationSerializer serializer,
                DialogueSessionStore sessions) {
        this.config = Objects.requireNonNull(config, "config");
        this.files = Objects.requireNonNull(files, "files");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.transactions = new TransactionCoordinator(files);
    }

    /**
     * Opens the document store and the session database.
     *
     * @throws StorageException if the document store cannot be opened (for example
     *                          because another process holds the data directory)
     */
    public static ForestState open(ForestStateConfig config) {
        AtomicFileStore files = new AtomicFileStore(config);
        try {
            files.open().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            files.close();
            throw new StorageException("Interrupted while opening " + config.dataDir(), e);
        } catch (ExecutionException e) {
            files.close();
            Throwable cause = e.getCause();
            if (cause instanceof StorageException) {
                throw (StorageException) cause;
            }
            throw new StorageException("Cannot open " + config.dataDir(), cause);
        }
        DialogueSessionStore sessions = DialogueSessionStores.open(config);
        ForestState state = new ForestState(config, files, new ProjectOperationSerializer(), sessions);
        LOG.info("Forest state opened: {} (sessions {})", config.dataDir(),
                sessions.durable() ? "durable" : "in memory only");
        return state;
    }

    /** Opens with configuration resolved from properties, environment and defaults. */
    public static ForestState open() {
        return open(ForestStateConfig.load());
    }

    public ForestStateConfig config() {
        return config;
    }

    public DocumentCodec codec() {
        return files.codec();
    }

    // ========================================================================
    // Serialization
    // ========================================================================

    /**
     * Runs {@code operation} after every earlier operation of the same project has finished.
     */
    public <T> CompletableFuture<T> runSerialized(String projectId, Supplier<? extends CompletionStage<T>> operation) {
        return serializer.run(projectId, operation);
    }

    // ========================================================================
    // Project files
    // ========================================================================

    public CompletableFuture<Optional<JsonNode>> readFile(String projectId, String relativePath) {
        return readFile(StorageKey.of(projectId, relativePath));
    }

    public CompletableFuture<Optional<JsonNode>> readFile(StorageKey key) {
        return files.read(key);
    }

    /**
     * Atomically replaces a document; the future completes once the new value is durable.
     */
    public CompletableFuture<Void> writeFile(String projectId, String relativePath, JsonNode value) {
        return writeFile(StorageKey.of(projectId, relativePath), value);
    }

    public CompletableFuture<Void> writeFile(StorageKey key, JsonNode value) {
        return files.write(key, value);
    }

    public CompletableFuture<Boolean> deleteFile(String projectId, String relativePath) {
        return files.delete(StorageKey.of(projectId, relativePath));
    }

    public CompletableFuture<Boolean> deleteProject(String projectId) {
        return files.deleteProject(projectId);
    }

    public CompletableFuture<List<String>> listProjectFiles(String projectId) {
        return files.listProjectFiles(projectId);
    }

    /**
     * Applies all operations or none of them.
     *
     * @return the committed result, or a future failed with
     *         {@link dev.mars.foreststate.tx.TransactionAbortedException}
     */
    public CompletableFuture<TransactionResult> transact(String projectId, List<TransactionOperation> operations) {
        return transactions.transact(projectId, operations);
    }

    public CacheStats cacheStats() {
        return files.cache().stats();
    }

    // ========================================================================
    // Dialogue sessions
    // ========================================================================

    public CompletableFuture<Void> saveSession(DialogueSession session) {
        return sessions.save(session);
    }

    public CompletableFuture<Optional<DialogueSession>> loadSession(String sessionId) {
        return sessions.load(sessionId);
    }

    public CompletableFuture<List<DialogueSession>> listActiveSessions(Optional<String> projectId) {
        return sessions.listActive(projectId);
    }

    public CompletableFuture<Optional<DialogueSession>> findLatestActiveSession(String projectId) {
        return sessions.findLatestActive(projectId);
    }

    /**
     * @return {@code false} if no session has that id
     */
    public CompletableFuture<Boolean> completeSession(String sessionId, String refinedGoal, double finalConfidence) {
        return sessions.complete(sessionId, refinedGoal, finalConfidence);
    }

    public CompletableFuture<List<DialogueSession>> listProjectSessions(String projectId) {
        return sessions.listByProject(projectId);
    }

    public CompletableFuture<Boolean> deleteSession(String sessionId) {
        return sessions.delete(sessionId);
    }

    public CompletableFuture<DialogueStats> sessionStats(Optional<String> projectId) {
        return sessions.stats(projectId);
    }

    /** Whether saved sessions currently survive a restart. */
    public boolean sessionsDurable() {
        return sessions.durable();
    }

    /**
     * Closes the serializer, then the document store, then the session database.
     */
    @Override
    public void close() {
        LOG.info("Closing forest state: {}", config.dataDir());
        try {
            serializer.close();
        } finally {
            try {
                files.close();
            } finally {
                sessions.close();
            }
        }
    }
}
