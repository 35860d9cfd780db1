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
package dev.mars.foreststate.demo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.foreststate.ForestState;
import dev.mars.foreststate.ForestStateConfig;
import dev.mars.foreststate.session.DialogueSession;
import dev.mars.foreststate.session.DialogueStats;
import dev.mars.foreststate.storage.CacheStats;
import dev.mars.foreststate.storage.ProjectFiles;
import dev.mars.foreststate.storage.StorageKey;
import dev.mars.foreststate.tx.IntegrityWarning;
import dev.mars.foreststate.tx.TransactionAbortedException;
import dev.mars.foreststate.tx.TransactionOperation;
import dev.mars.foreststate.tx.TransactionResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Demo entry point for the Forest state layer.
 * <p>
 * This demonstrates:
 * <ul>
 *   <li>Opening the state layer</li>
 *   <li>Serialized read-modify-write of a project document</li>
 *   <li>A committed and a rolled-back transaction</li>
 *   <li>Resuming a dialogue session after a restart</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link ForestStateConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (data directory only)</li>
 *   <li>System properties: {@code -Dforest.dataDir=/path -Dforest.syncEnabled=true ...}</li>
 *   <li>Environment variables: {@code FOREST_DATA_DIR, FOREST_SYNC_ENABLED, ...}</li>
 *   <li>Properties file: {@code forest-state.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl forest-state-demo -am
 *
 * # Run with default configuration
 * java -jar forest-state-demo/target/forest-state-demo-1.0-SNAPSHOT.jar
 *
 * # Run with CLI data directory override
 * java -jar forest-state-demo/target/forest-state-demo-1.0-SNAPSHOT.jar /path/to/data
 * </pre>
 * Run it twice: the second run finds the counter and the open dialogue left by the first.
 *
 * @see ForestStateConfig
 */
public class ForestStateDemo {

    private static final String PROJECT = "demo-project";
    private static final String DIALOGUE = "demo-dialogue";

    public static void main(String[] args) {
        System.out.println("+---------------------------------------+");
        System.out.println("|         Forest State Demo             |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        ForestStateConfig config = args.length > 0 && !args[0].isBlank()
                ? ForestStateConfig.builder().dataDir(args[0]).build()
                : ForestStateConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        try (ForestState state = ForestState.open(config)) {
            ObjectMapper mapper = state.codec().mapper();
            System.out.println("[OK] State opened at: " + config.dataDir().toAbsolutePath() +
                    " (sessions " + (state.sessionsDurable() ? "durable" : "in memory only") + ")");

            // Ten concurrent increments, serialized per project
            List<CompletableFuture<Integer>> increments = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                increments.add(state.runSerialized(PROJECT, () ->
                        state.readFile(PROJECT, ProjectFiles.METADATA).thenCompose(current -> {
                            int runs = current.map(m -> m.path("increments").asInt()).orElse(0) + 1;
                            ObjectNode next = mapper.createObjectNode().put("increments", runs);
                            return state.writeFile(PROJECT, ProjectFiles.METADATA, next).thenApply(v -> runs);
                        })));
            }
            CompletableFuture.allOf(increments.toArray(new CompletableFuture[0])).join();
            System.out.println("[OK] Counter after 10 serialized increments: " +
                    increments.get(increments.size() - 1).join());

            // Committed transaction
            ObjectNode hta = mapper.createObjectNode();
            hta.putArray("frontierNodes").addObject().put("title", "first steps");
            String htaPath = StorageKey.pathScoped(PROJECT, ProjectFiles.DEFAULT_PATH, ProjectFiles.HTA).relativePath();
            TransactionResult committed = state.runSerialized(PROJECT, () -> state.transact(PROJECT, List.of(
                    TransactionOperation.write(ProjectFiles.CONFIG,
                            mapper.createObjectNode().put("goal", "learn X")),
                    TransactionOperation.write(htaPath, hta)
            ))).join();
            System.out.println("[OK] Transaction committed " + committed.committed() + " operation(s)");

            // Rolled-back transaction: the second write is rejected
            try {
                state.runSerialized(PROJECT, () -> state.transact(PROJECT, List.of(
                        TransactionOperation.write(ProjectFiles.CONFIG,
                                mapper.createObjectNode().put("goal", "learn Y")),
                        TransactionOperation.write(ProjectFiles.HTA, mapper.getNodeFactory().textNode("INVALID"))
                ))).join();
                System.out.println("[!!] Invalid transaction was committed");
            } catch (CompletionException e) {
                if (!(e.getCause() instanceof TransactionAbortedException)) {
                    throw e;
                }
                TransactionResult result = ((TransactionAbortedException) e.getCause()).result();
                System.out.println("[OK] Transaction rolled back: " + result.rolledBack().size() +
                        " key(s) restored, " + result.integrityWarnings().size() + " warning(s)");
                for (IntegrityWarning warning : result.integrityWarnings()) {
                    System.out.println("     " + warning);
                }
            }
            JsonNode projectConfig = state.readFile(PROJECT, ProjectFiles.CONFIG).join().orElseThrow();
            System.out.println("[OK] config.json after rollback: " + projectConfig);
            System.out.println("[OK] Project files: " + state.listProjectFiles(PROJECT).join());

            // Dialogue session: start on the first run, resume afterwards
            Optional<DialogueSession> existing = state.loadSession(DIALOGUE).join();
            if (existing.isPresent() && existing.get().isActive()) {
                DialogueSession resumed = existing.get();
                System.out.println("\n[OK] Resumed dialogue at round " + resumed.currentRound() +
                        ", pending question: " + resumed.lastQuestion());
                state.completeSession(DIALOGUE, "practice scales daily for 20 minutes", 0.85).join();
                System.out.println("[OK] Dialogue completed");
            } else {
                Instant now = Instant.now();
                DialogueSession started = DialogueSession.start(DIALOGUE, PROJECT, "learn piano",
                                mapper.createObjectNode().put("experience", "none"), now)
                        .withResponse(mapper.createObjectNode().put("answer", "20 minutes a day"),
                                "classical or pop?", now);
                state.saveSession(started).join();
                System.out.println("\n[OK] Started dialogue '" + DIALOGUE + "'; run again to resume it");
            }

            DialogueStats stats = state.sessionStats(Optional.of(PROJECT)).join();
            System.out.println("[OK] Sessions: " + stats.total() + " total, " + stats.active() + " active, " +
                    stats.completed() + " completed");
            CacheStats cache = state.cacheStats();
            System.out.printf("[OK] Cache: %d entries, hit rate %.0f%%%n", cache.size(), cache.hitRate() * 100);

            System.out.println("\n+---------------------------------------+");
            System.out.println("|  Forest state demo complete!          |");
            System.out.println("|  Run again to see state resumed.      |");
            System.out.println("+---------------------------------------+");
        }
    }
}
