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
package dev.mars.foreststate.session;

import dev.mars.foreststate.storage.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Keeps dialogue sessions available when the database fails at runtime.
 * <p>
 * Every call goes to the durable store first. If it fails, the failure is logged at
 * WARN and the call is answered by an in-memory store instead. Sessions saved during
 * such a failure live only in memory and are lost on restart; reads merge both stores,
 * preferring the in-memory copy because it is the more recent one.
 */
public final class FailoverDialogueSessionStore implements DialogueSessionStore {

    private static final Logger LOG = LoggerFactory.getLogger(FailoverDialogueSessionStore.class);

    private final DialogueSessionStore primary;
    private final DialogueSessionStore fallback;
    private final AtomicBoolean degraded = new AtomicBoolean();

    public FailoverDialogueSessionStore(DialogueSessionStore primary, DialogueSessionStore fallback) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    @Override
    public CompletableFuture<Void> save(DialogueSession session) {
        // A durable save supersedes any copy kept in memory during an earlier failure
        return withFallback("save " + session.id(),
                () -> primary.save(session).thenCompose(saved -> fallback.delete(session.id()))
                        .thenApply(removed -> (Void) null),
                () -> fallback.save(session));
    }

    @Override
    public CompletableFuture<Optional<DialogueSession>> load(String sessionId) {
        return fallback.load(sessionId).thenCompose(memory -> {
            if (memory.isPresent()) {
                return CompletableFuture.completedFuture(memory);
            }
            return withFallback("load " + sessionId, () -> primary.load(sessionId),
                    () -> CompletableFuture.completedFuture(Optional.<DialogueSession>empty()));
        });
    }

    @Override
    public CompletableFuture<List<DialogueSession>> listActive(Optional<String> projectId) {
        return merged("list active sessions", () -> primary.listActive(projectId), fallback.listActive(projectId));
    }

    @Override
    public CompletableFuture<List<DialogueSession>> listByProject(String projectId) {
        return merged("list sessions of " + projectId,
                () -> primary.listByProject(projectId), fallback.listByProject(projectId));
    }

    @Override
    public CompletableFuture<Boolean> complete(String sessionId, String refinedGoal, double finalConfidence) {
        try {
            DialogueSession.requireConfidence(finalConfidence);
        } catch (ValidationException e) {
            return CompletableFuture.failedFuture(e);
        }
        return fallback.complete(sessionId, refinedGoal, finalConfidence)
                .thenCompose(inMemory -> changeBoth("complete " + sessionId,
                        () -> primary.complete(sessionId, refinedGoal, finalConfidence), inMemory));
    }

    @Override
    public CompletableFuture<Boolean> delete(String sessionId) {
        return fallback.delete(sessionId)
                .thenCompose(inMemory -> changeBoth("delete " + sessionId, () -> primary.delete(sessionId), inMemory));
    }

    /**
     * Counts from the durable store, or from memory while the durable store is failing.
     */
    @Override
    public CompletableFuture<DialogueStats> stats(Optional<String> projectId) {
        return withFallback("session stats", () -> primary.stats(projectId), () -> fallback.stats(projectId));
    }

    /**
     * False once any durable call has failed: some sessions may then exist only in memory.
     */
    @Override
    public boolean durable() {
        return primary.durable() && !degraded.get();
    }

    @Override
    public void close() {
        try {
            primary.close();
        } finally {
            fallback.close();
        }
    }

    /**
     * Applies a change to the durable store after it was applied in memory. A durable
     * failure is answered from memory only when memory held the session; otherwise the
     * {@link SessionStoreException} is returned.
     */
    private CompletableFuture<Boolean> changeBoth(String what, Supplier<CompletableFuture<Boolean>> durableCall,
                                                  boolean inMemory) {
        return withFailureHandler(what, () -> durableCall.get().thenApply(onDisk -> onDisk || inMemory),
                failure -> inMemory
                        ? CompletableFuture.completedFuture(true)
                        : CompletableFuture.<Boolean>failedFuture(failure));
    }

    private <T> CompletableFuture<T> withFallback(String what, Supplier<CompletableFuture<T>> durableCall,
                                                  Supplier<CompletableFuture<T>> memoryCall) {
        return withFailureHandler(what, durableCall, failure -> memoryCall.get());
    }

    private <T> CompletableFuture<T> withFailureHandler(String what, Supplier<CompletableFuture<T>> durableCall,
                                                        Function<SessionStoreException, CompletableFuture<T>> memoryCall) {
        CompletableFuture<T> attempt;
        try {
            attempt = durableCall.get();
        } catch (SessionStoreException e) {
            attempt = CompletableFuture.failedFuture(e);
        }
        return attempt.exceptionallyCompose(failure -> {
            Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                    ? failure.getCause() : failure;
            if (!(cause instanceof SessionStoreException)) {
                return CompletableFuture.failedFuture(cause);
            }
            if (degraded.compareAndSet(false, true)) {
                LOG.warn("Session database failed ({}); continuing in memory, new sessions will not survive a restart",
                        cause.getMessage());
            } else {
                LOG.warn("Session database failed on {}: {}", what, cause.getMessage());
            }
            return memoryCall.apply((SessionStoreException) cause);
        });
    }

    private CompletableFuture<List<DialogueSession>> merged(String what,
                                                           Supplier<CompletableFuture<List<DialogueSession>>> durableCall,
                                                           CompletableFuture<List<DialogueSession>> memory) {
        CompletableFuture<List<DialogueSession>> durable = withFallback(what, durableCall,
                () -> CompletableFuture.completedFuture(List.<DialogueSession>of()));
        return durable.thenCombine(memory, (fromDisk, fromMemory) -> {
            if (fromMemory.isEmpty()) {
                return fromDisk;
            }
            Map<String, DialogueSession> byId = new LinkedHashMap<>();
            fromDisk.forEach(s -> byId.put(s.id(), s));
            fromMemory.forEach(s -> byId.put(s.id(), s));
            List<DialogueSession> result = new ArrayList<>(byId.values());
            result.sort(DialogueSession.NEWEST_FIRST);
            return result;
        });
    }
}
