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
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.foreststate.session.DialogueSession;
import dev.mars.foreststate.session.DialogueStats;
import dev.mars.foreststate.storage.ProjectFiles;
import dev.mars.foreststate.storage.StorageException;
import dev.mars.foreststate.storage.StorageKey;
import dev.mars.foreststate.tx.TransactionAbortedException;
import dev.mars.foreststate.tx.TransactionOperation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests through {@link ForestState}.
 */
class ForestStateTest {

    @TempDir
    Path tempDir;

    private ForestState state;

    private ForestStateConfig config() {
        return ForestStateConfig.builder().dataDir(tempDir).minFreeSpaceMb(0).build();
    }

    @BeforeEach
    void setUp() {
        state = ForestState.open(config());
    }

    @AfterEach
    void tearDown() {
        if (state != null) {
            state.close();
        }
    }

    private ObjectNode object() {
        return state.codec().mapper().createObjectNode();
    }

    @Test
    void testOpen_SessionsAreDurable() {
        assertTrue(state.sessionsDurable());
    }

    @Test
    void testSecondInstanceOnSameDirectory_Fails() {
        assertThrows(StorageException.class, () -> ForestState.open(config()));
    }

    @Test
    void testSerializedIncrements_NoLostUpdates() throws Exception {
        state.writeFile("p1", ProjectFiles.METADATA, object().put("count", 0)).get(5, TimeUnit.SECONDS);

        List<CompletableFuture<Void>> updates = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            updates.add(state.runSerialized("p1", () ->
                    state.readFile("p1", ProjectFiles.METADATA).thenCompose(current -> {
                        int count = current.orElseThrow().get("count").asInt();
                        return state.writeFile("p1", ProjectFiles.METADATA, object().put("count", count + 1));
                    })));
        }
        CompletableFuture.allOf(updates.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        JsonNode metadata = state.readFile("p1", ProjectFiles.METADATA).get(5, TimeUnit.SECONDS).orElseThrow();
        assertEquals(25, metadata.get("count").asInt());
    }

    @Test
    void testFailedTransaction_LeavesProjectUnchanged() throws Exception {
        state.writeFile("p1", ProjectFiles.CONFIG, object().put("goal", "learn X")).get(5, TimeUnit.SECONDS);

        CompletableFuture<?> tx = state.runSerialized("p1", () -> state.transact("p1", List.of(
                TransactionOperation.write(ProjectFiles.CONFIG, object().put("goal", "learn Y")),
                TransactionOperation.write(ProjectFiles.HTA, state.codec().mapper().getNodeFactory().textNode("INVALID"))
        )));

        ExecutionException e = assertThrows(ExecutionException.class, () -> tx.get(5, TimeUnit.SECONDS));
        TransactionAbortedException aborted = assertInstanceOf(TransactionAbortedException.class, e.getCause());
        assertEquals(0, aborted.result().committed());

        assertEquals("learn X", state.readFile("p1", ProjectFiles.CONFIG).get(5, TimeUnit.SECONDS)
                .orElseThrow().get("goal").asText());
        assertTrue(state.readFile("p1", ProjectFiles.HTA).get(5, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void testProjectFiles() throws Exception {
        state.writeFile("p1", ProjectFiles.CONFIG, object()).get(5, TimeUnit.SECONDS);
        state.writeFile(StorageKey.pathScoped("p1", ProjectFiles.DEFAULT_PATH, ProjectFiles.HTA), object())
                .get(5, TimeUnit.SECONDS);

        assertEquals(List.of("config.json", "paths/general/hta.json"),
                state.listProjectFiles("p1").get(5, TimeUnit.SECONDS));
        assertTrue(state.deleteFile("p1", ProjectFiles.CONFIG).get(5, TimeUnit.SECONDS));
        assertTrue(state.deleteProject("p1").get(5, TimeUnit.SECONDS));
        assertEquals(List.of(), state.listProjectFiles("p1").get(5, TimeUnit.SECONDS));
    }

    @Test
    void testCacheStats() throws Exception {
        state.writeFile("p1", ProjectFiles.CONFIG, object()).get(5, TimeUnit.SECONDS);
        state.readFile("p1", ProjectFiles.CONFIG).get(5, TimeUnit.SECONDS);
        state.readFile("p1", ProjectFiles.CONFIG).get(5, TimeUnit.SECONDS);

        assertEquals(1, state.cacheStats().hits());
        assertEquals(1, state.cacheStats().size());
    }

    @Test
    void testDialogueResumesAfterRestart() throws Exception {
        Instant t0 = Instant.parse("2026-06-01T12:00:00Z");
        DialogueSession session = DialogueSession.start("dlg-1", "p1", "get fit", object(), t0)
                .withResponse(object().put("answer", "three times a week"), "indoor or outdoor?", t0.plusSeconds(30));
        state.saveSession(session).get(5, TimeUnit.SECONDS);
        state.writeFile("p1", ProjectFiles.CONFIG, object().put("goal", "get fit")).get(5, TimeUnit.SECONDS);

        state.close();
        state = ForestState.open(config());

        DialogueSession resumed = state.findLatestActiveSession("p1").get(5, TimeUnit.SECONDS).orElseThrow();
        assertEquals(session, resumed);
        assertEquals("indoor or outdoor?", resumed.lastQuestion());
        assertEquals(List.of(resumed), state.listActiveSessions(Optional.empty()).get(5, TimeUnit.SECONDS));
        assertTrue(state.readFile("p1", ProjectFiles.CONFIG).get(5, TimeUnit.SECONDS).isPresent());

        assertTrue(state.completeSession("dlg-1", "run a 5k", 0.9).get(5, TimeUnit.SECONDS));
        assertFalse(state.completeSession("unknown", "x", 0.1).get(5, TimeUnit.SECONDS));
        assertTrue(state.listActiveSessions(Optional.of("p1")).get(5, TimeUnit.SECONDS).isEmpty());
        assertEquals("run a 5k", state.loadSession("dlg-1").get(5, TimeUnit.SECONDS).orElseThrow().refinedGoal());

        DialogueStats stats = state.sessionStats(Optional.of("p1")).get(5, TimeUnit.SECONDS);
        assertEquals(1, stats.completed());
        assertEquals(List.of("dlg-1"), state.listProjectSessions("p1").get(5, TimeUnit.SECONDS)
                .stream().map(DialogueSession::id).collect(Collectors.toList()));
        assertTrue(state.deleteSession("dlg-1").get(5, TimeUnit.SECONDS));
    }
}
