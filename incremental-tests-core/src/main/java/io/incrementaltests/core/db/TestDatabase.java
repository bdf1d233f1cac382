package io.incrementaltests.core.db;

import io.incrementaltests.core.model.Fingerprint;
import io.incrementaltests.core.model.FingerprintEntry;
import io.incrementaltests.core.model.NodeId;
import io.incrementaltests.core.model.Outcome;
import io.incrementaltests.core.model.TestNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * SQLite-backed store for test nodes, their fingerprints, file checksums and
 * engine attributes. Every row is scoped by the environment the handle was
 * opened with.
 *
 * <p>Writes run in {@code BEGIN IMMEDIATE} transactions with a busy timeout, so
 * several processes sharing one file serialize their commits. A handle holds a
 * single connection; reads after a write on the same handle see that write.
 */
public final class TestDatabase implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TestDatabase.class);

    static final int SCHEMA_VERSION = 1;
    static final int BUSY_TIMEOUT_MILLIS = 30_000;

    private static final List<String> TABLES = List.of("node_file", "node", "file", "attribute");

    private static final List<String> CREATE_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS file (
                environment TEXT NOT NULL,
                path        TEXT NOT NULL,
                checksum    TEXT NOT NULL,
                PRIMARY KEY (environment, path)
            )""",
            """
            CREATE TABLE IF NOT EXISTS node (
                environment TEXT NOT NULL,
                node_id     TEXT NOT NULL,
                outcome     TEXT NOT NULL,
                duration_ms INTEGER NOT NULL,
                PRIMARY KEY (environment, node_id)
            )""",
            """
            CREATE TABLE IF NOT EXISTS node_file (
                environment TEXT NOT NULL,
                node_id     TEXT NOT NULL,
                path        TEXT NOT NULL,
                checksum    TEXT NOT NULL,
                PRIMARY KEY (environment, node_id, path)
            )""",
            """
            CREATE TABLE IF NOT EXISTS attribute (
                environment TEXT NOT NULL,
                key         TEXT NOT NULL,
                value       TEXT NOT NULL,
                PRIMARY KEY (environment, key)
            )""");

    private static final String UPSERT_NODE_SQL = """
            INSERT INTO node (environment, node_id, outcome, duration_ms)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (environment, node_id)
            DO UPDATE SET outcome = excluded.outcome,
                          duration_ms = excluded.duration_ms
            """;

    private static final String UPSERT_FILE_SQL = """
            INSERT INTO file (environment, path, checksum)
            VALUES (?, ?, ?)
            ON CONFLICT (environment, path)
            DO UPDATE SET checksum = excluded.checksum
            """;

    private static final String UPSERT_ATTRIBUTE_SQL = """
            INSERT INTO attribute (environment, key, value)
            VALUES (?, ?, ?)
            ON CONFLICT (environment, key)
            DO UPDATE SET value = excluded.value
            """;

    private static final String DELETE_UNUSED_FILES_SQL = """
            DELETE FROM file
            WHERE environment = ?
              AND path NOT IN (SELECT path FROM node_file WHERE environment = ?)
            """;

    private final Path file;
    private final String environment;
    private final Connection connection;

    private TestDatabase(Path file, String environment, Connection connection) {
        this.file = file;
        this.environment = environment;
        this.connection = connection;
    }

    /**
     * Opens (creating if needed) the database at {@code file}, scoped to {@code environment}.
     *
     * @throws IllegalStateException if the file cannot be opened as a database
     */
    public static TestDatabase open(Path file, String environment) {
        Connection connection = null;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            SQLiteConfig sqlite = new SQLiteConfig();
            sqlite.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
            sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
            sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
            connection = DriverManager.getConnection(
                    "jdbc:sqlite:" + file.toAbsolutePath(), sqlite.toProperties());

            TestDatabase database = new TestDatabase(file, environment, connection);
            database.migrate();
            log.debug("Opened test database {} (environment '{}')", file, environment);
            return database;
        } catch (SQLException | IOException | DatabaseException e) {
            closeQuietly(connection, e);
            throw new IllegalStateException(
                    "Incremental Tests: unable to open database '" + file + "'. "
                    + "Delete the file to start from an empty database.", e);
        }
    }

    public Path file() {
        return file;
    }

    public String environment() {
        return environment;
    }

    // ── Schema ──────────────────────────────────────────────────────────

    private void migrate() {
        inTransaction(c -> {
            try (Statement st = c.createStatement()) {
                st.executeUpdate("CREATE TABLE IF NOT EXISTS metadata (key TEXT PRIMARY KEY, value TEXT NOT NULL)");
            }
            Optional<String> version = Optional.empty();
            try (PreparedStatement ps = c.prepareStatement("SELECT value FROM metadata WHERE key = 'schema_version'");
                 ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    version = Optional.of(rs.getString(1));
                }
            }
            String expected = Integer.toString(SCHEMA_VERSION);
            if (version.isPresent() && !version.get().equals(expected)) {
                log.warn("Test database schema changed ({} -> {}); discarding recorded data.",
                        version.get(), expected);
                try (Statement st = c.createStatement()) {
                    for (String table : TABLES) {
                        st.executeUpdate("DROP TABLE IF EXISTS " + table);
                    }
                }
            }
            try (Statement st = c.createStatement()) {
                for (String sql : CREATE_SQL) {
                    st.executeUpdate(sql);
                }
                st.executeUpdate("CREATE INDEX IF NOT EXISTS node_file_path ON node_file (environment, path)");
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT OR REPLACE INTO metadata (key, value) VALUES ('schema_version', ?)")) {
                ps.setString(1, expected);
                ps.executeUpdate();
            }
            return null;
        });
    }

    // ── Reads ───────────────────────────────────────────────────────────

    /**
     * Returns the persisted checksum of every recorded file.
     */
    public Map<String, String> fileChecksums() {
        Map<String, String> checksums = new LinkedHashMap<>();
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT path, checksum FROM file WHERE environment = ? ORDER BY rowid")) {
            ps.setString(1, environment);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    checksums.put(rs.getString(1), rs.getString(2));
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read file checksums", e);
        }
        return checksums;
    }

    /**
     * Returns every recorded test node with its fingerprint, in first-recorded order.
     *
     * @throws IllegalStateException if a stored node id or outcome cannot be parsed
     */
    public List<TestNode> allNodes() {
        Map<String, List<FingerprintEntry>> fingerprints = new LinkedHashMap<>();
        List<TestNode> nodes = new ArrayList<>();
        try {
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT node_id, path, checksum FROM node_file WHERE environment = ? ORDER BY rowid")) {
                ps.setString(1, environment);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        fingerprints.computeIfAbsent(rs.getString(1), k -> new ArrayList<>())
                                .add(new FingerprintEntry(rs.getString(2), rs.getString(3)));
                    }
                }
            }
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT node_id, outcome, duration_ms FROM node WHERE environment = ? ORDER BY rowid")) {
                ps.setString(1, environment);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String nodeId = rs.getString(1);
                        nodes.add(new TestNode(
                                NodeId.parse(nodeId),
                                Fingerprint.of(fingerprints.getOrDefault(nodeId, List.of())),
                                Outcome.valueOf(rs.getString(2)),
                                Duration.ofMillis(rs.getLong(3))));
                    }
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read test nodes", e);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(
                    "Incremental Tests: database '" + file + "' holds unreadable node data", e);
        }
        return nodes;
    }

    public Optional<String> attribute(String key) {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT value FROM attribute WHERE environment = ? AND key = ?")) {
            ps.setString(1, environment);
            ps.setString(2, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read attribute '" + key + "'", e);
        }
    }

    // ── Writes ──────────────────────────────────────────────────────────

    /**
     * Replaces the stored record of a node: outcome, duration and the complete
     * fingerprint, and refreshes the checksum of every file it references.
     * Either all of it is committed or none of it.
     *
     * @throws DatabaseException if the transaction fails; nothing is written in that case
     */
    public void upsertNode(TestNode node) {
        String nodeId = node.id().serialize();
        inTransaction(c -> {
            try (PreparedStatement ps = c.prepareStatement(UPSERT_NODE_SQL)) {
                ps.setString(1, environment);
                ps.setString(2, nodeId);
                ps.setString(3, node.outcome().name());
                ps.setLong(4, node.duration().toMillis());
                ps.executeUpdate();
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "DELETE FROM node_file WHERE environment = ? AND node_id = ?")) {
                ps.setString(1, environment);
                ps.setString(2, nodeId);
                ps.executeUpdate();
            }
            try (PreparedStatement fp = c.prepareStatement(
                         "INSERT INTO node_file (environment, node_id, path, checksum) VALUES (?, ?, ?, ?)");
                 PreparedStatement files = c.prepareStatement(UPSERT_FILE_SQL)) {
                for (FingerprintEntry entry : node.fingerprint().entries()) {
                    fp.setString(1, environment);
                    fp.setString(2, nodeId);
                    fp.setString(3, entry.file());
                    fp.setString(4, entry.checksum());
                    fp.executeUpdate();

                    files.setString(1, environment);
                    files.setString(2, entry.file());
                    files.setString(3, entry.checksum());
                    files.executeUpdate();
                }
            }
            return null;
        });
        log.debug("Recorded {} ({}, {} ms, {} files)",
                nodeId, node.outcome(), node.duration().toMillis(), node.fingerprint().size());
    }

    /**
     * Deletes every node (and its fingerprint) whose id is not in {@code retained}.
     *
     * @return number of deleted nodes
     */
    public int deleteNodesNotIn(Set<NodeId> retained) {
        return inTransaction(c -> {
            List<String> stale = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("SELECT node_id FROM node WHERE environment = ?")) {
                ps.setString(1, environment);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String nodeId = rs.getString(1);
                        if (!retained.contains(NodeId.parse(nodeId))) {
                            stale.add(nodeId);
                        }
                    }
                }
            }
            try (PreparedStatement nodes = c.prepareStatement(
                         "DELETE FROM node WHERE environment = ? AND node_id = ?");
                 PreparedStatement files = c.prepareStatement(
                         "DELETE FROM node_file WHERE environment = ? AND node_id = ?")) {
                for (String nodeId : stale) {
                    nodes.setString(1, environment);
                    nodes.setString(2, nodeId);
                    nodes.addBatch();
                    files.setString(1, environment);
                    files.setString(2, nodeId);
                    files.addBatch();
                }
                nodes.executeBatch();
                files.executeBatch();
            }
            stale.forEach(id -> log.debug("  Removed stale node: {}", id));
            return stale.size();
        });
    }

    /**
     * Deletes checksum entries that no node's fingerprint references any more.
     *
     * @return number of deleted file entries
     */
    public int removeUnusedFiles() {
        return inTransaction(c -> {
            try (PreparedStatement ps = c.prepareStatement(DELETE_UNUSED_FILES_SQL)) {
                ps.setString(1, environment);
                ps.setString(2, environment);
                return ps.executeUpdate();
            }
        });
    }

    public void writeAttribute(String key, String value) {
        inTransaction(c -> {
            try (PreparedStatement ps = c.prepareStatement(UPSERT_ATTRIBUTE_SQL)) {
                ps.setString(1, environment);
                ps.setString(2, key);
                ps.setString(3, value);
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close test database {}: {}", file, e.getMessage());
        }
    }

    // ── Internal helpers ────────────────────────────────────────────────

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    private synchronized <T> T inTransaction(SqlWork<T> work) {
        try {
            connection.setAutoCommit(false);
            try {
                T result = work.run(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new DatabaseException("Transaction on " + file + " failed: " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(Connection connection, Exception cause) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
