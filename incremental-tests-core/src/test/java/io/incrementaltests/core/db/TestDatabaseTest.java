package io.incrementaltests.core.db;

import io.incrementaltests.core.model.Fingerprint;
import io.incrementaltests.core.model.FingerprintEntry;
import io.incrementaltests.core.model.NodeId;
import io.incrementaltests.core.model.Outcome;
import io.incrementaltests.core.model.TestNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class TestDatabaseTest {

    @TempDir
    Path tempDir;

    private static final NodeId NODE_A = NodeId.of("src/test/java/ATest.java", "ATest", "one()");
    private static final NodeId NODE_B = NodeId.of("src/test/java/BTest.java", "BTest", "two()");

    private static TestNode node(NodeId id, Outcome outcome, long millis, FingerprintEntry... entries) {
        return new TestNode(id, Fingerprint.of(entries), outcome, Duration.ofMillis(millis));
    }

    private Path dbFile() {
        return tempDir.resolve(".incrementaltests.db");
    }

    @Test
    void upsertedNodeIsReadBack() {
        try (TestDatabase db = TestDatabase.open(dbFile(), "")) {
            db.upsertNode(node(NODE_A, Outcome.PASSED, 42,
                    new FingerprintEntry("src/main/java/A.java", "h1"),
                    new FingerprintEntry("src/test/java/ATest.java", "t1")));

            List<TestNode> nodes = db.allNodes();
            assertEquals(1, nodes.size());
            TestNode read = nodes.get(0);
            assertEquals(NODE_A, read.id());
            assertEquals(Outcome.PASSED, read.outcome());
            assertEquals(Duration.ofMillis(42), read.duration());
            assertEquals("h1", read.fingerprint().checksumOf("src/main/java/A.java").orElseThrow());
            assertEquals(Map.of("src/main/java/A.java", "h1", "src/test/java/ATest.java", "t1"),
                    db.fileChecksums());
        }
    }

    @Test
    void fingerprintIsReplacedNotMerged() {
        try (TestDatabase db = TestDatabase.open(dbFile(), "")) {
            db.upsertNode(node(NODE_A, Outcome.PASSED, 10,
                    new FingerprintEntry("src/main/java/Old.java", "h1"),
                    new FingerprintEntry("src/main/java/Kept.java", "h2")));
            db.upsertNode(node(NODE_A, Outcome.FAILED, 20,
                    new FingerprintEntry("src/main/java/Kept.java", "h3")));

            TestNode read = db.allNodes().get(0);
            assertEquals(Set.of("src/main/java/Kept.java"), read.fingerprint().files());
            assertEquals("h3", read.fingerprint().checksumOf("src/main/java/Kept.java").orElseThrow());
            assertEquals(Outcome.FAILED, read.outcome());
            assertEquals("h3", db.fileChecksums().get("src/main/java/Kept.java"));
        }
    }

    @Test
    void emptyFingerprintIsStored() {
        try (TestDatabase db = TestDatabase.open(dbFile(), "")) {
            db.upsertNode(node(NODE_A, Outcome.PASSED, 1));

            assertTrue(db.allNodes().get(0).fingerprint().isEmpty());
        }
    }

    @Test
    void failedCommitLeavesEarlierCommitIntactAndWritesNothing() {
        try (TestDatabase db = TestDatabase.open(dbFile(), "")) {
            db.upsertNode(node(NODE_A, Outcome.PASSED, 5, new FingerprintEntry("a.java", "h1")));

            // The null checksum violates a NOT NULL constraint after the node row was written.
            TestNode broken = node(NODE_B, Outcome.PASSED, 7,
                    new FingerprintEntry("b.java", "h2"),
                    new FingerprintEntry("c.java", null));
            assertThrows(DatabaseException.class, () -> db.upsertNode(broken));

            List<TestNode> nodes = db.allNodes();
            assertEquals(List.of(NODE_A), nodes.stream().map(TestNode::id).toList());
            assertFalse(db.fileChecksums().containsKey("b.java"));
        }

        try (TestDatabase reopened = TestDatabase.open(dbFile(), "")) {
            assertEquals(1, reopened.allNodes().size());
            assertEquals("h1", reopened.allNodes().get(0).fingerprint().checksumOf("a.java").orElseThrow());
        }
    }

    @Test
    void deletesNodesNotRetained() {
        try (TestDatabase db = TestDatabase.open(dbFile(), "")) {
            db.upsertNode(node(NODE_A, Outcome.PASSED, 1, new FingerprintEntry("a.java", "h1")));
            db.upsertNode(node(NODE_B, Outcome.PASSED, 1, new FingerprintEntry("b.java", "h2")));

            assertEquals(1, db.deleteNodesNotIn(Set.of(NODE_A)));
            assertEquals(List.of(NODE_A), db.allNodes().stream().map(TestNode::id).toList());

            assertEquals(1, db.removeUnusedFiles());
            assertEquals(Set.of("a.java"), db.fileChecksums().keySet());
        }
    }

    @Test
    void environmentsAreIsolated() {
        Path file = dbFile();
        try (TestDatabase postgres = TestDatabase.open(file, "postgres");
             TestDatabase mysql = TestDatabase.open(file, "mysql")) {
            postgres.upsertNode(node(NODE_A, Outcome.PASSED, 1, new FingerprintEntry("a.java", "h1")));
            mysql.upsertNode(node(NODE_B, Outcome.FAILED, 1, new FingerprintEntry("a.java", "h9")));
            postgres.writeAttribute("libraries", "x.jar");

            assertEquals(List.of(NODE_A), postgres.allNodes().stream().map(TestNode::id).toList());
            assertEquals(List.of(NODE_B), mysql.allNodes().stream().map(TestNode::id).toList());
            assertEquals("h1", postgres.fileChecksums().get("a.java"));
            assertEquals("h9", mysql.fileChecksums().get("a.java"));
            assertTrue(mysql.attribute("libraries").isEmpty());

            assertEquals(0, mysql.deleteNodesNotIn(Set.of(NODE_B)));
            assertEquals(1, postgres.allNodes().size());
        }
    }

    @Test
    void attributesAreLastWriteWins() {
        try (TestDatabase db = TestDatabase.open(dbFile(), "")) {
            assertTrue(db.attribute("last_run_date").isEmpty());

            db.writeAttribute("last_run_date", "2026-01-01");
            db.writeAttribute("last_run_date", "2026-01-02");

            assertEquals("2026-01-02", db.attribute("last_run_date").orElseThrow());
        }
    }

    @Test
    void concurrentWritersDoNotCorruptEachOther() throws Exception {
        Path file = dbFile();
        TestDatabase.open(file, "").close();

        int perWriter = 25;
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (String worker : List.of("gw0", "gw1")) {
                futures.add(pool.submit(() -> {
                    try (TestDatabase db = TestDatabase.open(file, "")) {
                        start.await();
                        for (int i = 0; i < perWriter; i++) {
                            db.upsertNode(node(NodeId.of("src/test/java/" + worker + ".java", "t" + i + "()"),
                                    Outcome.PASSED, i, new FingerprintEntry("shared.java", "h1")));
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        try (TestDatabase db = TestDatabase.open(file, "")) {
            assertEquals(2 * perWriter, db.allNodes().size());
        }
    }

    @Test
    void schemaVersionChangeDiscardsOldData() throws Exception {
        Path file = dbFile();
        try (TestDatabase db = TestDatabase.open(file, "")) {
            db.upsertNode(node(NODE_A, Outcome.PASSED, 1));
        }
        try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + file);
             Statement st = c.createStatement()) {
            st.executeUpdate("UPDATE metadata SET value = '0' WHERE key = 'schema_version'");
        }

        try (TestDatabase db = TestDatabase.open(file, "")) {
            assertTrue(db.allNodes().isEmpty());
        }
    }

    @Test
    void failsLoudlyOnFileThatIsNotADatabase() throws Exception {
        Path file = dbFile();
        Files.writeString(file, "not an sqlite database ".repeat(100));

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> TestDatabase.open(file, ""));
        assertTrue(ex.getMessage().contains(file.toString()));
    }

    @Test
    void failsLoudlyOnUnreadableNodeData() throws Exception {
        Path file = dbFile();
        TestDatabase.open(file, "").close();
        try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + file);
             Statement st = c.createStatement()) {
            st.executeUpdate("INSERT INTO node (environment, node_id, outcome, duration_ms) "
                    + "VALUES ('', 'not-a-node-id', 'PASSED', 1)");
        }

        try (TestDatabase db = TestDatabase.open(file, "")) {
            assertThrows(IllegalStateException.class, db::allNodes);
        }
    }
}
