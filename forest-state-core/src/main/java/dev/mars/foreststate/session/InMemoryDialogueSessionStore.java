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

import dev.mars.foreststate.storage.Identifiers;
import dev.mars.foreststate.storage.ValidationException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Non-durable session store. Used when the database cannot be opened and as the
 * failover target of {@link FailoverDialogueSessionStore}; contents are lost on restart.
 */
public final class InMemoryDialogueSessionStore implements DialogueSessionStore {

    private final Map<String, DialogueSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDialogueSessionStore() {
        this(Clock.systemUTC());
    }

    public InMemoryDialogueSessionStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public CompletableFuture<Void> save(DialogueSession session) {
        Objects.requireNonNull(session, "session");
        sessions.put(session.id(), session);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Optional<DialogueSession>> load(String sessionId) {
        Identifiers.requireSessionId(sessionId);
        return CompletableFuture.completedFuture(Optional.ofNullable(sessions.get(sessionId)));
    }

    @Override
    public CompletableFuture<List<DialogueSession>> listActive(Optional<String> projectId) {
        projectId.ifPresent(Identifiers::requireProjectId);
        return CompletableFuture.completedFuture(select(s -> s.isActive()
                && projectId.map(s.projectId()::equals).orElse(true)));
    }

    @Override
    public CompletableFuture<List<DialogueSession>> listByProject(String projectId) {
        Identifiers.requireProjectId(projectId);
        return CompletableFuture.completedFuture(select(s -> s.projectId().equals(projectId)));
    }

    @Override
    public CompletableFuture<Boolean> complete(String sessionId, String refinedGoal, double finalConfidence) {
        Identifiers.requireSessionId(sessionId);
        Objects.requireNonNull(refinedGoal, "refinedGoal");
        try {
            DialogueSession.requireConfidence(finalConfidence);
        } catch (ValidationException e) {
            return CompletableFuture.failedFuture(e);
        }
        DialogueSession updated = sessions.computeIfPresent(sessionId,
                (id, s) -> s.completed(refinedGoal, finalConfidence, clock.instant()));
        return CompletableFuture.completedFuture(updated != null);
    }

    @Override
    public CompletableFuture<Boolean> delete(String sessionId) {
        Identifiers.requireSessionId(sessionId);
        return CompletableFuture.completedFuture(sessions.remove(sessionId) != null);
    }

    @Override
    public CompletableFuture<DialogueStats> stats(Optional<String> projectId) {
        projectId.ifPresent(Identifiers::requireProjectId);
        List<DialogueSession> matching = select(s -> projectId.map(s.projectId()::equals).orElse(true));
        int active = (int) matching.stream().filter(DialogueSession::isActive).count();
        OptionalDouble average = matching.stream()
                .filter(s -> !s.isActive() && s.finalConfidence() != null)
                .mapToDouble(DialogueSession::finalConfidence)
                .average();
        return CompletableFuture.completedFuture(
                new DialogueStats(matching.size(), active, matching.size() - active, average));
    }

    @Override
    public boolean durable() {
        return false;
    }

    @Override
    public void close() {
        sessions.clear();
    }

    private List<DialogueSession> select(Predicate<DialogueSession> filter) {
        return sessions.values().stream()
                .filter(filter)
                .sorted(DialogueSession.NEWEST_FIRST)
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
