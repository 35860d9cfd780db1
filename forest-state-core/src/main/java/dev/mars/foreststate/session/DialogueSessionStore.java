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

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Persistence for dialogue sessions.
 * <p>
 * <b>Contract:</b> every method returns a future that completes after the change is
 * visible to subsequent calls; durable implementations also persist it before
 * completing. Failures surface as {@link SessionStoreException}. An unknown id is
 * reported as {@link Optional#empty()} or {@code false}, never as an error.
 */
public interface DialogueSessionStore extends AutoCloseable {

    /**
     * Inserts or replaces a session. Saving an unchanged session again is a no-op.
     */
    CompletableFuture<Void> save(DialogueSession session);

    CompletableFuture<Optional<DialogueSession>> load(String sessionId);

    /**
     * Active sessions, most recently started first.
     *
     * @param projectId restricts the result to one project when present
     */
    CompletableFuture<List<DialogueSession>> listActive(Optional<String> projectId);

    /** All sessions of a project regardless of status, most recently started first. */
    CompletableFuture<List<DialogueSession>> listByProject(String projectId);

    /**
     * Marks a session completed.
     *
     * @return {@code false} if no session has that id
     */
    CompletableFuture<Boolean> complete(String sessionId, String refinedGoal, double finalConfidence);

    /**
     * @return {@code false} if no session has that id
     */
    CompletableFuture<Boolean> delete(String sessionId);

    CompletableFuture<DialogueStats> stats(Optional<String> projectId);

    /**
     * The most recently started active session of a project, for callers that lost
     * track of their session id across a restart.
     */
    default CompletableFuture<Optional<DialogueSession>> findLatestActive(String projectId) {
        return listActive(Optional.of(projectId))
                .thenApply(sessions -> sessions.isEmpty() ? Optional.<DialogueSession>empty() : Optional.of(sessions.get(0)));
    }

    /** Whether saved sessions survive a process restart. */
    boolean durable();

    @Override
    void close();
}
