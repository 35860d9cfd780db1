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
package dev.mars.foreststate.tx;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.foreststate.storage.Identifiers;
import dev.mars.foreststate.storage.ProjectFileStore;
import dev.mars.foreststate.storage.StorageKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * All-or-nothing application of several writes to one project.
 * <p>
 * <b>Protocol:</b>
 * <ol>
 *   <li>Snapshot every target key from disk (value or "absent") before the first write.</li>
 *   <li>Apply the operations in order through {@link ProjectFileStore}; stop at the first failure.</li>
 *   <li>On failure, restore every touched key in reverse application order: write the
 *       snapshot back, or delete the key if it was absent. Each restore is read back and
 *       compared with the snapshot.</li>
 *   <li>On success, drop the snapshots.</li>
 * </ol>
 * Rollback problems become {@link IntegrityWarning}s. They are logged and reported in the
 * {@link TransactionResult} but never thrown, so the caller always sees the primary failure.
 * <p>
 * Concurrent transactions on one project must be excluded by the caller, normally by
 * running inside {@link dev.mars.foreststate.serial.ProjectOperationSerializer#run}.
 * Transactions on different projects are independent.
 */
public final class TransactionCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionCoordinator.class);

    private final ProjectFileStore store;
    private final AtomicLong sequence = new AtomicLong();

    public TransactionCoordinator(ProjectFileStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Applies the operations atomically.
     *
     * @return a future completed with the committed count, or failed with
     *         {@link TransactionAbortedException} after the rollback
     */
    public CompletableFuture<TransactionResult> transact(String projectId, List<TransactionOperation> operations) {
        Identifiers.requireProjectId(projectId);
        List<TransactionOperation> ops = List.copyOf(operations);
        if (ops.isEmpty()) {
            return CompletableFuture.completedFuture(TransactionResult.committed(0));
        }

        String txId = "tx-" + projectId + "-" + sequence.incrementAndGet();
        List<StorageKey> keys = new ArrayList<>(ops.size());
        for (TransactionOperation op : ops) {
            keys.add(op.keyIn(projectId));
        }
        LOG.debug("Transaction {} started: {} operation(s)", txId, ops.size());

        Map<StorageKey, Optional<JsonNode>> backups = Collections.synchronizedMap(new LinkedHashMap<>());
        return captureBackups(new ArrayList<>(new LinkedHashSet<>(keys)), 0, backups)
                .handle((ignored, failure) -> {
                    if (failure != null) {
                        Throwable cause = unwrap(failure);
                        LOG.warn("Transaction {} aborted before any write: could not snapshot: {}",
                                txId, cause.getMessage());
                        return CompletableFuture.<TransactionResult>failedFuture(new TransactionAbortedException(
                                "Transaction " + txId + " aborted: snapshot failed", cause,
                                TransactionResult.aborted(0, List.of(), List.of())));
                    }
                    return apply(ops, keys, 0)
                            .thenApply(count -> {
                                LOG.info("Transaction {} committed: {} operation(s)", txId, count);
                                return TransactionResult.committed(count);
                            })
                            .exceptionallyCompose(applyFailure -> {
                                Throwable cause = unwrap(applyFailure);
                                FailedStep step = cause instanceof FailedStep
                                        ? (FailedStep) cause
                                        : new FailedStep(0, cause);
                                return rollback(txId, keys, step, backups);
                            });
                })
                .thenCompose(f -> f);
    }

    // ========================================================================
    // Snapshot / Apply
    // ========================================================================

    private CompletableFuture<Void> captureBackups(List<StorageKey> distinctKeys, int index,
                                                   Map<StorageKey, Optional<JsonNode>> backups) {
        if (index == distinctKeys.size()) {
            return CompletableFuture.completedFuture(null);
        }
        StorageKey key = distinctKeys.get(index);
        return store.readDurable(key).thenCompose(previous -> {
            backups.put(key, previous);
            LOG.trace("Snapshot {}: {}", key, previous.isPresent() ? "present" : "absent");
            return captureBackups(distinctKeys, index + 1, backups);
        });
    }

    /**
     * Applies operations from {@code index} on. Fails with {@link FailedStep}.
     */
    private CompletableFuture<Integer> apply(List<TransactionOperation> ops, List<StorageKey> keys, int index) {
        if (index == ops.size()) {
            return CompletableFuture.completedFuture(index);
        }
        TransactionOperation op = ops.get(index);
        StorageKey key = keys.get(index);
        CompletableFuture<?> step;
        try {
            step = op.kind() == TransactionOperation.Kind.WRITE
                    ? store.write(key, op.value())
                    : store.delete(key);
        } catch (RuntimeException e) {
            step = CompletableFuture.failedFuture(e);
        }
        return step.handle((ignored, failure) -> {
            if (failure != null) {
                throw new FailedStep(index, unwrap(failure));
            }
            return index;
        }).thenCompose(done -> apply(ops, keys, index + 1));
    }

    // ========================================================================
    // Rollback
    // ========================================================================

    private CompletableFuture<TransactionResult> rollback(String txId, List<StorageKey> keys, FailedStep failed,
                                                          Map<StorageKey, Optional<JsonNode>> backups) {
        int attempted = failed.index + 1;
        LOG.warn("Transaction {} failed at operation {} ({}): {}. Rolling back.",
                txId, failed.index, keys.get(failed.index), failed.getCause().getMessage());

        // The failed operation may have committed after its rename, so its key is restored too
        Set<StorageKey> touched = new LinkedHashSet<>();
        for (int i = failed.index; i >= 0; i--) {
            touched.add(keys.get(i));
        }

        List<StorageKey> restored = Collections.synchronizedList(new ArrayList<>());
        List<IntegrityWarning> warnings = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (StorageKey key : touched) {
            Optional<JsonNode> snapshot = backups.get(key);
            chain = chain.thenCompose(ignored -> restore(txId, key, snapshot, restored, warnings));
        }

        return chain.thenCompose(ignored -> {
            TransactionResult result = TransactionResult.aborted(attempted, restored, warnings);
            if (result.clean()) {
                LOG.info("Transaction {} rolled back: {} key(s) restored", txId, restored.size());
            } else {
                LOG.error("Transaction {} rolled back with {} integrity warning(s): {}",
                        txId, warnings.size(), warnings);
            }
            return CompletableFuture.failedFuture(new TransactionAbortedException(
                    "Transaction " + txId + " aborted at operation " + failed.index + " (" +
                            keys.get(failed.index) + ")", failed.getCause(), result));
        });
    }

    /**
     * Restores one key and verifies it. Never fails; problems become warnings.
     */
    private CompletableFuture<Void> restore(String txId, StorageKey key, Optional<JsonNode> snapshot,
                                            List<StorageKey> restored, List<IntegrityWarning> warnings) {
        IntegrityWarning.Step step = snapshot.isPresent() ? IntegrityWarning.Step.RESTORE : IntegrityWarning.Step.REMOVE;
        CompletableFuture<?> undo;
        try {
            undo = snapshot.isPresent() ? store.write(key, snapshot.get()) : store.delete(key);
        } catch (RuntimeException e) {
            undo = CompletableFuture.failedFuture(e);
        }

        return undo.handle((ignored, failure) -> failure)
                .thenCompose(failure -> {
                    if (failure != null) {
                        warn(warnings, new IntegrityWarning(txId, key, step, unwrap(failure).getMessage()));
                        return CompletableFuture.completedFuture(null);
                    }
                    return store.readDurable(key).handle((current, readFailure) -> {
                        if (readFailure != null) {
                            warn(warnings, new IntegrityWarning(txId, key, IntegrityWarning.Step.VERIFY,
                                    "read-back failed: " + unwrap(readFailure).getMessage()));
                        } else if (!current.equals(snapshot)) {
                            warn(warnings, new IntegrityWarning(txId, key, IntegrityWarning.Step.VERIFY,
                                    "restored value differs from snapshot"));
                        } else {
                            restored.add(key);
                            LOG.debug("Transaction {} restored {}", txId, key);
                        }
                        return null;
                    });
                });
    }

    private static void warn(List<IntegrityWarning> warnings, IntegrityWarning warning) {
        LOG.error("Integrity warning: {}", warning);
        warnings.add(warning);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable t = failure;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Carries the index of the failed operation through the future chain.
     */
    private static final class FailedStep extends RuntimeException {
        private final int index;

        FailedStep(int index, Throwable cause) {
            super(cause.getMessage(), cause, false, false);
            this.index = index;
        }
    }
}
