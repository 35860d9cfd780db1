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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.foreststate.storage.Identifiers;
import dev.mars.foreststate.storage.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Dialogue sessions in an embedded SQLite database.
 * <p>
 * <b>Threading:</b> one JDBC connection, used only from a single dedicated thread.
 * Every public method hands its work to that thread and returns immediately, so
 * calls are applied in the order they were made.
 * <p>
 * <b>Schema:</b> table {@code dialogue_sessions}, one row per session, JSON members
 * stored as text and timestamps as fixed-width ISO-8601 UTC strings (so that text
 * order equals time order). Databases written by older versions are upgraded in
 * place by adding the missing columns.
 */
public final class SqliteDialogueSessionStore implements DialogueSessionStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteDialogueSessionStore.class);

    static final String TABLE = "dialogue_sessions";

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'").withZone(ZoneOffset.UTC);

    /** Columns added after the first schema, with their declarations. */
    private static final Map<String, String> LATER_COLUMNS = new LinkedHashMap<>();

    static {
        LATER_COLUMNS.put("current_round", "INTEGER NOT NULL DEFAULT 0");
        LATER_COLUMNS.put("uncertainty_map", "TEXT");
        LATER_COLUMNS.put("confidence_levels", "TEXT");
        LATER_COLUMNS.put("final_confidence", "REAL");
        LATER_COLUMNS.put("last_question", "TEXT");
        LATER_COLUMNS.put("last_updated", "TEXT");
    }

    private static final String CREATE_TABLE =
            "CREATE TABLE IF NOT EXISTS " + TABLE + " (" +
                    "id TEXT PRIMARY KEY, " +
                    "project_id TEXT NOT NULL, " +
                    "original_goal TEXT NOT NULL, " +
                    "context TEXT, " +
                    "status TEXT NOT NULL DEFAULT 'active', " +
                    "started_at TEXT NOT NULL, " +
                    "completed_at TEXT, " +
                    "current_round INTEGER NOT NULL DEFAULT 0, " +
                    "responses TEXT, " +
                    "uncertainty_map TEXT, " +
                    "confidence_levels TEXT, " +
                    "refined_goal TEXT, " +
                    "final_confidence REAL, " +
                    "goal_evolution TEXT, " +
                    "last_question TEXT, " +
                    "last_updated TEXT)";

    private static final String UPSERT =
            "INSERT OR REPLACE INTO " + TABLE + " (" +
                    "id, project_id, original_goal, context, status, started_at, completed_at, current_round, " +
                    "responses, uncertainty_map, confidence_levels, refined_goal, final_confidence, " +
                    "goal_evolution, last_question, last_updated) " +
                    "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String ORDER = " ORDER BY started_at DESC, id ASC";

    private final Path dbFile;
    private final Connection connection;
    private final ExecutorService executor;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock;
    private volatile boolean closed;

    private SqliteDialogueSessionStore(Path dbFile, Connection connection, Clock clock) {
        this.dbFile = dbFile;
        this.connection = connection;
        this.clock = clock;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "forest-sessions");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Opens (creating or upgrading as needed) the database at {@code dbFile}.
     *
     * @throws SessionStoreException if the database cannot be opened or initialized
     */
    public static SqliteDialogueSessionStore open(Path dbFile) {
        return open(dbFile, Clock.systemUTC());
    }

    public static SqliteDialogueSessionStore open(Path dbFile, Clock clock) {
        Objects.requireNonNull(dbFile, "dbFile");
        Objects.requireNonNull(clock, "clock");
        Path absolute = dbFile.toAbsolutePath();
        Connection connection = null;
        try {
            Path parent = absolute.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            connection = DriverManager.getConnection("jdbc:sqlite:" + absolute);
            initialize(connection);
            LOG.info("Opened session database {}", absolute);
            return new SqliteDialogueSessionStore(absolute, connection, clock);
        } catch (IOException | SQLException e) {
            closeQuietly(connection);
            throw new SessionStoreException("Cannot open session database " + absolute, e);
        }
    }

    // ========================================================================
    // Schema
    // ========================================================================

    private static void initialize(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=FULL");
            st.execute(CREATE_TABLE);
        }
        migrate(connection);
        try (Statement st = connection.createStatement()) {
            st.execute("CREATE INDEX IF NOT EXISTS idx_dialogue_sessions_project ON " + TABLE + "(project_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_dialogue_sessions_status ON " + TABLE + "(status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_dialogue_sessions_project_status ON " +
                    TABLE + "(project_id, status)");
        }
    }

    private static void migrate(Connection connection) throws SQLException {
        Set<String> columns = tableColumns(connection);
        try (Statement st = connection.createStatement()) {
            for (Map.Entry<String, String> column : LATER_COLUMNS.entrySet()) {
                if (!columns.contains(column.getKey())) {
                    LOG.info("Upgrading {}: adding column {}", TABLE, column.getKey());
                    st.execute("ALTER TABLE " + TABLE + " ADD COLUMN " + column.getKey() + " " + column.getValue());
                }
            }
            // First schema kept the final confidence in a column named "confidence"
            if (columns.contains("confidence") && !columns.contains("final_confidence")) {
                int copied = st.executeUpdate("UPDATE " + TABLE +
                        " SET final_confidence = confidence WHERE final_confidence IS NULL");
                LOG.info("Upgrading {}: copied {} legacy confidence value(s)", TABLE, copied);
            }
        }
    }

    private static Set<String> tableColumns(Connection connection) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + TABLE + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name"));
            }
        }
        return columns;
    }

    // ========================================================================
    // Operations
    // ========================================================================

    @Override
    public CompletableFuture<Void> save(DialogueSession session) {
        Objects.requireNonNull(session, "session");
        return call("save " + session.id(), () -> {
            try (PreparedStatement ps = connection.prepareStatement(UPSERT)) {
                bind(ps, session);
                ps.executeUpdate();
            }
            LOG.debug("Saved session {} (project {}, round {}, {})",
                    session.id(), session.projectId(), session.currentRound(), session.status());
            return null;
        });
    }

    @Override
    public CompletableFuture<Optional<DialogueSession>> load(String sessionId) {
        Identifiers.requireSessionId(sessionId);
        return call("load " + sessionId, () -> {
            try (PreparedStatement ps = connection.prepareStatement("SELECT * FROM " + TABLE + " WHERE id = ?")) {
                ps.setString(1, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(toSession(rs)) : Optional.<DialogueSession>empty();
                }
            }
        });
    }

    @Override
    public CompletableFuture<List<DialogueSession>> listActive(Optional<String> projectId) {
        projectId.ifPresent(Identifiers::requireProjectId);
        String sql = "SELECT * FROM " + TABLE + " WHERE status = ?" +
                (projectId.isPresent() ? " AND project_id = ?" : "") + ORDER;
        return call("list active sessions", () -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                ps.setString(1, DialogueStatus.ACTIVE.columnValue());
                if (projectId.isPresent()) {
                    ps.setString(2, projectId.get());
                }
                return readAll(ps);
            }
        });
    }

    @Override
    public CompletableFuture<List<DialogueSession>> listByProject(String projectId) {
        Identifiers.requireProjectId(projectId);
        return call("list sessions of " + projectId, () -> {
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT * FROM " + TABLE + " WHERE project_id = ?" + ORDER)) {
                ps.setString(1, projectId);
                return readAll(ps);
            }
        });
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
        return call("complete " + sessionId, () -> {
            String now = format(clock.instant());
            try (PreparedStatement ps = connection.prepareStatement(
                    "UPDATE " + TABLE + " SET status = ?, completed_at = ?, refined_goal = ?, " +
                            "final_confidence = ?, last_question = NULL, last_updated = ? WHERE id = ?")) {
                ps.setString(1, DialogueStatus.COMPLETED.columnValue());
                ps.setString(2, now);
                ps.setString(3, refinedGoal);
                ps.setDouble(4, finalConfidence);
                ps.setString(5, now);
                ps.setString(6, sessionId);
                boolean found = ps.executeUpdate() > 0;
                if (found) {
                    LOG.info("Completed session {} (confidence {})", sessionId, finalConfidence);
                }
                return found;
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> delete(String sessionId) {
        Identifiers.requireSessionId(sessionId);
        return call("delete " + sessionId, () -> {
            try (PreparedStatement ps = connection.prepareStatement("DELETE FROM " + TABLE + " WHERE id = ?")) {
                ps.setString(1, sessionId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public CompletableFuture<DialogueStats> stats(Optional<String> projectId) {
        projectId.ifPresent(Identifiers::requireProjectId);
        String sql = "SELECT status, COUNT(*) AS n, AVG(final_confidence) AS avg_confidence, " +
                "COUNT(final_confidence) AS n_confidence FROM " + TABLE +
                (projectId.isPresent() ? " WHERE project_id = ?" : "") + " GROUP BY status";
        return call("session stats", () -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                if (projectId.isPresent()) {
                    ps.setString(1, projectId.get());
                }
                int active = 0;
                int completed = 0;
                OptionalDouble average = OptionalDouble.empty();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        DialogueStatus status = DialogueStatus.fromColumn(rs.getString("status"));
                        int n = rs.getInt("n");
                        if (status == DialogueStatus.ACTIVE) {
                            active += n;
                        } else {
                            completed += n;
                            if (rs.getInt("n_confidence") > 0) {
                                average = OptionalDouble.of(rs.getDouble("avg_confidence"));
                            }
                        }
                    }
                }
                return new DialogueStats(active + completed, active, completed, average);
            }
        });
    }

    @Override
    public boolean durable() {
        return true;
    }

    Path dbFile() {
        return dbFile;
    }

    /**
     * Waits for queued calls, then closes the connection.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Session calls still running after 5s; closing {} anyway", dbFile);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        closeQuietly(connection);
        LOG.info("Closed session database {}", dbFile);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    @FunctionalInterface
    private interface SqlWork<T> {
        T run() throws SQLException;
    }

    private <T> CompletableFuture<T> call(String what, SqlWork<T> work) {
        if (closed) {
            return CompletableFuture.failedFuture(new SessionStoreException("Session store is closed"));
        }
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return work.run();
                } catch (SQLException e) {
                    throw new SessionStoreException("Session store: " + what + " failed", e);
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new SessionStoreException("Session store is closed", e));
        }
    }

    private List<DialogueSession> readAll(PreparedStatement ps) throws SQLException {
        List<DialogueSession> sessions = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                try {
                    sessions.add(toSession(rs));
                } catch (RuntimeException e) {
                    LOG.warn("Skipping unreadable session row {}: {}", rs.getString("id"), e.getMessage());
                }
            }
        }
        return sessions;
    }

    private void bind(PreparedStatement ps, DialogueSession s) throws SQLException {
        ps.setString(1, s.id());
        ps.setString(2, s.projectId());
        ps.setString(3, s.originalGoal());
        ps.setString(4, json(s.context()));
        ps.setString(5, s.status().columnValue());
        ps.setString(6, format(s.startedAt()));
        ps.setString(7, s.completedAt() == null ? null : format(s.completedAt()));
        ps.setInt(8, s.currentRound());
        ps.setString(9, json(mapper.valueToTree(s.responses())));
        ps.setString(10, json(s.uncertaintyMap()));
        ps.setString(11, json(s.confidenceLevels()));
        ps.setString(12, s.refinedGoal());
        if (s.finalConfidence() == null) {
            ps.setNull(13, Types.REAL);
        } else {
            ps.setDouble(13, s.finalConfidence());
        }
        ps.setString(14, json(s.goalEvolution()));
        ps.setString(15, s.lastQuestion());
        ps.setString(16, format(s.lastUpdated()));
    }

    private DialogueSession toSession(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        Instant startedAt = parse(rs.getString("started_at"));
        Instant completedAt = parse(rs.getString("completed_at"));
        Instant lastUpdated = parse(rs.getString("last_updated"));
        if (startedAt == null) {
            throw new SessionStoreException("Session " + id + " has no start time");
        }
        if (lastUpdated == null) {
            lastUpdated = completedAt != null ? completedAt : startedAt;
        }
        double confidence = rs.getDouble("final_confidence");
        Double finalConfidence = rs.wasNull() ? null : confidence;

        List<JsonNode> responses = new ArrayList<>();
        JsonNode storedResponses = tree(rs.getString("responses"));
        if (storedResponses != null && storedResponses.isArray()) {
            storedResponses.forEach(responses::add);
        }

        return new DialogueSession(
                id,
                rs.getString("project_id"),
                Objects.requireNonNullElse(rs.getString("original_goal"), ""),
                tree(rs.getString("context")),
                DialogueStatus.fromColumn(rs.getString("status")),
                startedAt,
                completedAt,
                rs.getInt("current_round"),
                responses,
                tree(rs.getString("uncertainty_map")),
                tree(rs.getString("confidence_levels")),
                rs.getString("refined_goal"),
                finalConfidence,
                tree(rs.getString("goal_evolution")),
                rs.getString("last_question"),
                lastUpdated);
    }

    private String json(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Cannot encode session member", e);
        }
    }

    private JsonNode tree(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Stored JSON is not readable: " + e.getOriginalMessage(), e);
        }
    }

    static String format(Instant instant) {
        return TIMESTAMP.format(instant);
    }

    private static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new SessionStoreException("Unreadable timestamp: " + text, e);
        }
    }

    private static void closeQuietly(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            LOG.warn("Error closing session database connection: {}", e.getMessage());
        }
    }
}
