package io.incrementaltests.core.stability;

import io.incrementaltests.core.model.Fingerprint;
import io.incrementaltests.core.model.FingerprintEntry;
import io.incrementaltests.core.model.NodeId;
import io.incrementaltests.core.model.Outcome;
import io.incrementaltests.core.model.TestNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StabilityEngineTest {

    @TempDir
    Path tempDir;

    private static final NodeId NODE_A = NodeId.of("src/test/java/ATest.java", "ATest", "a()");
    private static final NodeId NODE_B = NodeId.of("src/test/java/BTest.java", "BTest", "b()");

    private String h1;

    @BeforeEach
    void writeSources() throws Exception {
        Files.createDirectories(tempDir.resolve("src/main/java"));
        Files.writeString(tempDir.resolve("src/main/java/File1.java"), "class File1 {}");
        h1 = ChecksumCalculator.checksumOf("class File1 {}".getBytes());
    }

    private StabilityEngine engine() {
        return new StabilityEngine(new ChecksumCalculator(tempDir, "libs"));
    }

    private static TestNode node(NodeId id, FingerprintEntry... entries) {
        return new TestNode(id, Fingerprint.of(entries), Outcome.PASSED, Duration.ofMillis(3));
    }

    @Test
    void unchangedFileKeepsNodeStable() {
        TestNode a = node(NODE_A, new FingerprintEntry("src/main/java/File1.java", h1));

        StabilityResult result = engine().determineStable(List.of(a), Map.of("src/main/java/File1.java", h1));

        assertEquals(Set.of("src/main/java/File1.java"), result.stableFiles());
        assertTrue(result.unstableFiles().isEmpty());
        assertEquals(Set.of(NODE_A), result.stableNodes());
        assertFalse(result.librariesMiss());
    }

    @Test
    void changedFileMakesNodeUnstable() throws Exception {
        TestNode a = node(NODE_A, new FingerprintEntry("src/main/java/File1.java", h1));
        Files.writeString(tempDir.resolve("src/main/java/File1.java"), "class File1 { int changed; }");

        StabilityResult result = engine().determineStable(List.of(a), Map.of("src/main/java/File1.java", h1));

        assertEquals(Set.of("src/main/java/File1.java"), result.unstableFiles());
        assertEquals(Set.of(NODE_A), result.unstableNodes());
        assertTrue(result.stableNodes().isEmpty());
    }

    @Test
    void deletedFileMakesNodeUnstable() throws Exception {
        TestNode a = node(NODE_A, new FingerprintEntry("src/main/java/File1.java", h1));
        Files.delete(tempDir.resolve("src/main/java/File1.java"));

        StabilityResult result = engine().determineStable(List.of(a), Map.of("src/main/java/File1.java", h1));

        assertTrue(result.unstableNodes().contains(NODE_A));
    }

    @Test
    void fileNeverRecordedMakesNodeUnstable() {
        TestNode a = node(NODE_A, new FingerprintEntry("src/main/java/File1.java", h1));

        StabilityResult result = engine().determineStable(List.of(a), Map.of());

        assertEquals(Set.of(NODE_A), result.unstableNodes());
    }

    @Test
    void emptyFingerprintIsStable() {
        StabilityResult result = engine().determineStable(List.of(node(NODE_A)), Map.of());

        assertEquals(Set.of(NODE_A), result.stableNodes());
    }

    @Test
    void nodeHoldingOlderChecksumThanTheStoreIsUnstable() {
        // B re-recorded File1 at its current content after A saw an older version.
        TestNode a = node(NODE_A, new FingerprintEntry("src/main/java/File1.java", "0000older"));
        TestNode b = node(NODE_B, new FingerprintEntry("src/main/java/File1.java", h1));

        StabilityResult result = engine().determineStable(List.of(a, b),
                Map.of("src/main/java/File1.java", h1));

        assertTrue(result.isStable("src/main/java/File1.java"));
        assertEquals(Set.of(NODE_A), result.unstableNodes());
        assertEquals(Set.of(NODE_B), result.stableNodes());
    }

    @Test
    void libraryChangeIsReportedAndInvalidatesDependents() {
        ChecksumCalculator recordedWith = new ChecksumCalculator(tempDir, "old-libs");
        TestNode a = node(NODE_A,
                new FingerprintEntry("src/main/java/File1.java", h1),
                new FingerprintEntry(ChecksumCalculator.LIBRARIES, recordedWith.librariesChecksum()));
        Map<String, String> store = new LinkedHashMap<>();
        store.put("src/main/java/File1.java", h1);
        store.put(ChecksumCalculator.LIBRARIES, recordedWith.librariesChecksum());

        StabilityResult result = engine().determineStable(List.of(a), store);

        assertTrue(result.librariesMiss());
        assertEquals(Set.of(NODE_A), result.unstableNodes());
        assertTrue(result.isStable("src/main/java/File1.java"));
    }

    @Test
    void repeatedComputationIsDeterministic() throws Exception {
        Files.writeString(tempDir.resolve("src/main/java/File2.java"), "class File2 {}");
        List<TestNode> nodes = List.of(
                node(NODE_A, new FingerprintEntry("src/main/java/File1.java", h1)),
                node(NODE_B, new FingerprintEntry("src/main/java/File2.java", "stale")));
        Map<String, String> store = Map.of(
                "src/main/java/File1.java", h1,
                "src/main/java/File2.java", "stale");

        StabilityResult first = engine().determineStable(nodes, store);
        StabilityResult second = engine().determineStable(nodes, store);

        assertEquals(first, second);
        assertEquals(List.copyOf(first.stableNodes()), List.copyOf(second.stableNodes()));
    }
}
