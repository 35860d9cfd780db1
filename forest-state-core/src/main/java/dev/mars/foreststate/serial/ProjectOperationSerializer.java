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
package dev.mars.foreststate.serial;

import dev.mars.foreststate.storage.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs at most one logical operation per project at a time.
 * <p>
 * Operations submitted for the same project start strictly in submission order;
 * operation N+1 starts only after the future of operation N has completed,
 * successfully or not. Operations of different projects never wait for each other.
 * <p>
 * <b>Lock table:</b> one entry per contested project holding the tail of its queue
 * and the number of pending operations. The entry is created on first use and
 * removed as soon as its last pending operation finishes, so the table only ever
 * holds projects with work in flight. There is no global lock.
 * <p>
 * <b>Failure isolation:</b> a failing operation (a failed stage, a synchronous throw
 * or a {@code null} stage) fails only its own future; the queue always advances.
 * <p>
 * Operations are not cancellable and the serializer imposes no timeouts. The lock is
 * not reentrant: an operation must not submit and wait for another operation of its
 * own project.
 */
public final class ProjectOperationSerializer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectOperationSerializer.class);

    private final ConcurrentHashMap<String, LockEntry> lockTable = new ConcurrentHashMap<>();
    private final ExecutorService dispatcher;
    private final boolean ownsDispatcher;
    private volatile boolean closed = false;

    /**
     * Creates a serializer with its own pool of daemon dispatch threads.
     */
    public ProjectOperationSerializer() {
        this(newDispatcher(), true);
    }

    /**
     * Creates a serializer that starts operations on the given executor.
     * The executor is not shut down by {@link #close()}.
     */
    public ProjectOperationSerializer(ExecutorService dispatcher) {
        this(dispatcher, false);
    }

    private ProjectOperationSerializer(ExecutorService dispatcher, boolean ownsDispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.ownsDispatcher = ownsDispatcher;
    }

    private static ExecutorService newDispatcher() {
        AtomicInteger threadCount = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "forest-serial-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queue state of one project. Mutated only inside {@code lockTable.compute*}.
     */
    private static final class LockEntry {
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);
        private volatile int pending;
    }

    /**
     * Submits an operation for a project.
     *
     * @param projectId the project whose state the operation touches
     * @param operation started once every earlier operation of the project has finished
     * @return a future completed with the operation's result or failure
     * @throws dev.mars.foreststate.storage.ValidationException if the project id is malformed
     */
    public <T> CompletableFuture<T> run(String projectId, Supplier<? extends CompletionStage<T>> operation) {
        Identifiers.requireProjectId(projectId);
        Objects.requireNonNull(operation, "operation");
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Serializer is closed"));
        }

        CompletableFuture<Void> done = new CompletableFuture<>();
        AtomicReference<CompletableFuture<Void>> previous = new AtomicReference<>();
        lockTable.compute(projectId, (id, entry) -> {
            LockEntry e = entry != null ? entry : new LockEntry();
            previous.set(e.tail);
            e.tail = done;
            e.pending++;
            return e;
        });

        CompletableFuture<T> result = new CompletableFuture<>();
        previous.get().whenCompleteAsync(
                (ignored, ignoredFailure) -> execute(projectId, operation, result, done),
                this::dispatch);
        return result;
    }

    private <T> void execute(String projectId, Supplier<? extends CompletionStage<T>> operation,
                             CompletableFuture<T> result, CompletableFuture<Void> done) {
        LOG.trace("Starting operation for project {}", projectId);
        CompletionStage<T> stage;
        try {
            stage = operation.get();
            if (stage == null) {
                throw new NullPointerException("Operation for project " + projectId + " returned null");
            }
        } catch (RuntimeException | Error e) {
            LOG.debug("Operation for project {} failed synchronously: {}", projectId, e.toString());
            result.completeExceptionally(e);
            finish(projectId, done);
            return;
        }

        stage.whenComplete((value, failure) -> {
            // Settle the caller's future before the next operation may start
            if (failure != null) {
                Throwable cause = unwrap(failure);
                LOG.debug("Operation for project {} failed: {}", projectId, cause.toString());
                result.completeExceptionally(cause);
            } else {
                result.complete(value);
            }
            finish(projectId, done);
        });
    }

    private void finish(String projectId, CompletableFuture<Void> done) {
        lockTable.computeIfPresent(projectId, (id, entry) -> --entry.pending == 0 ? null : entry);
        done.complete(null);
    }

    private void dispatch(Runnable task) {
        try {
            dispatcher.execute(task);
        } catch (RejectedExecutionException e) {
            // Closed while operations were queued: drain them on the completing thread
            LOG.debug("Dispatcher rejected task, running inline");
            task.run();
        }
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    /** Projects that currently have queued or running operations. */
    public Set<String> activeProjects() {
        return Set.copyOf(lockTable.keySet());
    }

    /** Number of queued or running operations of a project. */
    public int pendingOperations(String projectId) {
        LockEntry entry = lockTable.get(projectId);
        return entry == null ? 0 : entry.pending;
    }

    /**
     * Stops accepting operations. Already queued operations still run.
     */
    @Override
    public void close() {
        closed = true;
        if (ownsDispatcher) {
            dispatcher.shutdown();
        }
        LOG.info("Operation serializer closed ({} project(s) still draining)", lockTable.size());
    }
}
