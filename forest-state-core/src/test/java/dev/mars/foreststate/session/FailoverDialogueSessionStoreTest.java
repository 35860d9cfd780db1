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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.mars.foreststate.ForestStateConfig;
import dev.mars.foreststate.storage.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FailoverDialogueSessionStore} and {@link DialogueSessionStores}.
 */
class FailoverDialogueSessionStoreTest {

    private static final Instant T0 = Instant.parse("2026-05-01T09:00:00Z");

    @TempDir
    Path tempDir;

    private final BreakableStore primary = new BreakableStore();
    private final FailoverDialogueSessionStore store =
            new FailoverDialogueSessionStore(primary, new InMemoryDialogueSessionStore());

    private static DialogueSession session(String id, String projectId, Instant startedAt) {
        return DialogueSession.start(id, projectId, "learn chess", JsonNodeFactory.instance.objectNode(), startedAt);
    }

    @Test
    void testHealthyPrimary_ServesEverything() throws Exception {
        DialogueSession s = session("d1", "p1", T0);

        store.save(s).get(5, TimeUnit.SECONDS);

        assertEquals(Optional.of(s), primary.delegate.load("d1").get(5, TimeUnit.SECONDS));
        assertEquals(Optional.of(s), store.load("d1").get(5, TimeUnit.SECONDS));
        assertTrue(store.durable());
    }

    @Test
    void testPrimaryFailure_FallsBackToMemory() throws Exception {
        DialogueSession before = session("d1", "p1", T0);
        store.save(before).get(5, TimeUnit.SECONDS);

        primary.broken = true;
        DialogueSession during = session("d2", "p1", T0.plusSeconds(60));
        store.save(during).get(5, TimeUnit.SECONDS);

        assertFalse(store.durable());
        assertEquals(Optional.of(during), store.load("d2").get(5, TimeUnit.SECONDS));
        assertEquals(List.of(during), store.listActive(Optional.of("p1")).get(5, TimeUnit.SECONDS));
        assertEquals(1, store.stats(Optional.empty()).get(5, TimeUnit.SECONDS).total());
        assertTrue(store.complete("d2", "play openings", 0.9).get(5, TimeUnit.SECONDS));
    }

    @Test
    void testRecoveredPrimary_MergesBothStores() throws Exception {
        DialogueSession durable = session("d1", "p1", T0);
        store.save(durable).get(5, TimeUnit.SECONDS);
        primary.broken = true;
        DialogueSession inMemory = session("d2", "p1", T0.plusSeconds(60));
        store.save(inMemory).get(5, TimeUnit.SECONDS);

        primary.broken = false;

        assertEquals(List.of(inMemory, durable), store.listByProject("p1").get(5, TimeUnit.SECONDS));
        assertEquals(Optional.of(inMemory), store.findLatestActive("p1").get(5, TimeUnit.SECONDS));
    }

    @Test
    void testDurableSave_ReplacesMemoryCopy() throws Exception {
        primary.broken = true;
        DialogueSession first = session("d1", "p1", T0);
        store.save(first).get(5, TimeUnit.SECONDS);

        primary.broken = false;
        DialogueSession next = first.withResponse(JsonNodeFactory.instance.textNode("daily"), null, T0.plusSeconds(5));
        store.save(next).get(5, TimeUnit.SECONDS);

        assertEquals(Optional.of(next), store.load("d1").get(5, TimeUnit.SECONDS));
        assertEquals(Optional.of(next), primary.delegate.load("d1").get(5, TimeUnit.SECONDS));
    }

    @Test
    void testDelete_RemovesFromBoth() throws Exception {
        store.save(session("d1", "p1", T0)).get(5, TimeUnit.SECONDS);

        assertTrue(store.delete("d1").get(5, TimeUnit.SECONDS));
        assertFalse(store.delete("d1").get(5, TimeUnit.SECONDS));
    }

    @Test
    void testCompleteDuringFailure_SessionOnlyOnDisk_ReportsFailure() throws Exception {
        store.save(session("d1", "p1", T0)).get(5, TimeUnit.SECONDS);
        primary.broken = true;

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> store.complete("d1", "play openings", 0.9).get(5, TimeUnit.SECONDS));
        assertInstanceOf(SessionStoreException.class, e.getCause());

        primary.broken = false;
        assertTrue(store.load("d1").get(5, TimeUnit.SECONDS).orElseThrow().isActive());
    }

    @Test
    void testDeleteDuringFailure_SessionOnlyOnDisk_ReportsFailure() throws Exception {
        store.save(session("d1", "p1", T0)).get(5, TimeUnit.SECONDS);
        primary.broken = true;

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> store.delete("d1").get(5, TimeUnit.SECONDS));
        assertInstanceOf(SessionStoreException.class, e.getCause());
    }

    @Test
    void testCompleteDuringFailure_UnknownEverywhere_ReportsFailure() {
        primary.broken = true;

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> store.complete("ghost", "goal", 0.5).get(5, TimeUnit.SECONDS));
        assertInstanceOf(SessionStoreException.class, e.getCause());
    }

    @Test
    void testComplete_OutOfRangeConfidence_Rejected() throws Exception {
        DialogueSession s = session("d1", "p1", T0);
        store.save(s).get(5, TimeUnit.SECONDS);

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> store.complete("d1", "goal", 2.0).get(5, TimeUnit.SECONDS));
        assertInstanceOf(ValidationException.class, e.getCause());
        assertEquals(Optional.of(s), store.load("d1").get(5, TimeUnit.SECONDS));
    }

    @Test
    void testFactory_OpensDurableStore() throws Exception {
        ForestStateConfig config = ForestStateConfig.builder().dataDir(tempDir).build();

        try (DialogueSessionStore opened = DialogueSessionStores.open(config)) {
            assertTrue(opened.durable());
            opened.save(session("d1", "p1", T0)).get(5, TimeUnit.SECONDS);
        }
        assertTrue(Files.exists(tempDir.resolve("dialogues.db")));
    }

    @Test
    void testFactory_FallsBackToMemoryWhenDatabaseUnavailable() throws Exception {
        Path blocker = tempDir.resolve("blocked");
        Files.writeString(blocker, "not a directory");
        ForestStateConfig config = ForestStateConfig.builder().dataDir(blocker).build();

        try (DialogueSessionStore opened = DialogueSessionStores.open(config)) {
            assertFalse(opened.durable());
            assertInstanceOf(InMemoryDialogueSessionStore.class, opened);
            opened.save(session("d1", "p1", T0)).get(5, TimeUnit.SECONDS);
            assertTrue(opened.load("d1").get(5, TimeUnit.SECONDS).isPresent());
        }
    }

    /**
     * Durable-looking store whose calls fail while {@link #broken} is set.
     */
    private static final class BreakableStore implements DialogueSessionStore {
        final InMemoryDialogueSessionStore delegate = new InMemoryDialogueSessionStore();
        volatile boolean broken;

        private <T> CompletableFuture<T> guard(Supplier<CompletableFuture<T>> call) {
            if (broken) {
                return CompletableFuture.failedFuture(new SessionStoreException("database is locked"));
            }
            return call.get();
        }

        @Override
        public CompletableFuture<Void> save(DialogueSession session) {
            return guard(() -> delegate.save(session));
        }

        @Override
        public CompletableFuture<Optional<DialogueSession>> load(String sessionId) {
            return guard(() -> delegate.load(sessionId));
        }

        @Override
        public CompletableFuture<List<DialogueSession>> listActive(Optional<String> projectId) {
            return guard(() -> delegate.listActive(projectId));
        }

        @Override
        public CompletableFuture<List<DialogueSession>> listByProject(String projectId) {
            return guard(() -> delegate.listByProject(projectId));
        }

        @Override
        public CompletableFuture<Boolean> complete(String sessionId, String refinedGoal, double finalConfidence) {
            return guard(() -> delegate.complete(sessionId, refinedGoal, finalConfidence));
        }

        @Override
        public CompletableFuture<Boolean> delete(String sessionId) {
            return guard(() -> delegate.delete(sessionId));
        }

        @Override
        public CompletableFuture<DialogueStats> stats(Optional<String> projectId) {
            return guard(() -> delegate.stats(projectId));
        }

        @Override
        public boolean durable() {
            return true;
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
