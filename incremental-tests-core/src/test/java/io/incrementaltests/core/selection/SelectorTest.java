package io.incrementaltests.core.selection;

import io.incrementaltests.core.model.Fingerprint;
import io.incrementaltests.core.model.NodeId;
import io.incrementaltests.core.model.Outcome;
import io.incrementaltests.core.model.TestNode;
import io.incrementaltests.core.stability.StabilityResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SelectorTest {

    private static final String MODULE_1 = "src/test/java/OneTest.java";
    private static final String MODULE_2 = "src/test/java/TwoTest.java";

    private static final NodeId A = NodeId.of(MODULE_1, "OneTest", "a()");
    private static final NodeId B = NodeId.of(MODULE_1, "OneTest", "b()");
    private static final NodeId C = NodeId.of(MODULE_2, "TwoTest", "c()");
    private static final NodeId NEW = NodeId.of(MODULE_2, "TwoTest", "added()");

    private final Selector selector = new Selector();

    private static Map<NodeId, TestNode> known(TestNode... nodes) {
        Map<NodeId, TestNode> map = new LinkedHashMap<>();
        for (TestNode node : nodes) {
            map.put(node.id(), node);
        }
        return map;
    }

    private static TestNode passed(NodeId id) {
        return new TestNode(id, Fingerprint.empty(), Outcome.PASSED, Duration.ofMillis(1));
    }

    private static TestNode failed(NodeId id) {
        return new TestNode(id, Fingerprint.empty(), Outcome.FAILED, Duration.ofMillis(1));
    }

    private static StabilityResult stable(Set<String> files, Set<NodeId> nodes, Set<NodeId> unstable) {
        return new StabilityResult(files, Set.of(), nodes, unstable, false);
    }

    @Test
    void stablePassingTestIsDeselected() {
        SelectionResult result = selector.select(List.of(A), known(passed(A)),
                stable(Set.of(MODULE_1), Set.of(A), Set.of()), SelectionMode.NORMAL);

        assertEquals(List.of(A), result.deselected());
        assertTrue(result.selected().isEmpty());
        assertTrue(result.nothingToRun());
    }

    @Test
    void unstableTestIsSelected() {
        SelectionResult result = selector.select(List.of(A), known(passed(A)),
                stable(Set.of(), Set.of(), Set.of(A)), SelectionMode.NORMAL);

        assertEquals(List.of(A), result.selected());
        assertTrue(result.deselected().isEmpty());
    }

    @Test
    void unknownTestIsAlwaysSelected() {
        SelectionResult result = selector.select(List.of(A, NEW), known(passed(A)),
                stable(Set.of(MODULE_1), Set.of(A), Set.of()), SelectionMode.NORMAL);

        assertEquals(List.of(NEW), result.selected());
        assertEquals(List.of(A), result.deselected());
    }

    @Test
    void previouslyFailingTestIsSelectedDespiteStability() {
        SelectionResult result = selector.select(List.of(A, C), known(passed(A), failed(C)),
                stable(Set.of(MODULE_1, MODULE_2), Set.of(A, C), Set.of()), SelectionMode.NORMAL);

        assertEquals(List.of(C), result.selected());
        assertFalse(result.deselected().contains(C));
    }

    @Test
    void noSelectRunsEverything() {
        SelectionResult result = selector.select(List.of(A, B), known(passed(A), passed(B)),
                stable(Set.of(MODULE_1), Set.of(A, B), Set.of()), SelectionMode.NO_SELECT);

        assertEquals(List.of(A, B), result.selected());
        assertTrue(result.deselected().isEmpty());
        assertTrue(result.skippableFiles().isEmpty());
    }

    @Test
    void noSelectReportsWhatNormalModeWouldHaveSkipped() {
        SelectionResult result = selector.select(List.of(A, B, NEW), known(passed(A), failed(B)),
                stable(Set.of(MODULE_1), Set.of(A, B), Set.of()), SelectionMode.NO_SELECT);

        assertEquals(List.of(A, B, NEW), result.selected());
        assertEquals(List.of(A), result.unaffected());
        assertEquals(List.of(B, NEW), result.mustRun());
    }

    @Test
    void normalModeHasNoUnaffectedSelections() {
        SelectionResult result = selector.select(List.of(A, NEW), known(passed(A)),
                stable(Set.of(MODULE_1), Set.of(A), Set.of()), SelectionMode.NORMAL);

        assertTrue(result.unaffected().isEmpty());
        assertEquals(result.selected(), result.mustRun());
    }

    @Test
    void forceSelectDeselectsLikeNormal() {
        SelectionResult result = selector.select(List.of(A), known(passed(A)),
                stable(Set.of(MODULE_1), Set.of(A), Set.of()), SelectionMode.FORCE_SELECT);

        assertEquals(List.of(A), result.deselected());
        assertEquals(SelectionMode.FORCE_SELECT, result.mode());
    }

    @Test
    void selectedAndDeselectedPartitionTheDiscoveredSet() {
        List<NodeId> discovered = List.of(C, A, NEW, B);
        SelectionResult result = selector.select(discovered, known(passed(A), failed(B), passed(C)),
                stable(Set.of(MODULE_1, MODULE_2), Set.of(A, B), Set.of(C)), SelectionMode.NORMAL);

        Set<NodeId> union = new HashSet<>(result.selected());
        union.addAll(result.deselected());
        Set<NodeId> overlap = new HashSet<>(result.selected());
        overlap.retainAll(result.deselected());

        assertEquals(Set.copyOf(discovered), union);
        assertTrue(overlap.isEmpty());
        assertEquals(List.of(C, NEW, B), result.selected(), "discovery order is preserved");
    }

    @Test
    void duplicateDiscoveriesAreCountedOnce() {
        SelectionResult result = selector.select(List.of(A, A), known(),
                StabilityResult.empty(), SelectionMode.NORMAL);

        assertEquals(List.of(A), result.selected());
    }

    @Test
    void skippableFilesExcludeFilesWithFailuresOrSelectedTests() {
        NodeId other = NodeId.of("src/test/java/ThreeTest.java", "ThreeTest", "d()");
        Map<NodeId, TestNode> known = known(passed(A), passed(B), failed(C), passed(other));
        Set<String> stableFiles = Set.of(MODULE_1, MODULE_2, "src/test/java/ThreeTest.java");

        SelectionResult result = selector.select(List.of(A, B, C, other), known,
                stable(stableFiles, Set.of(A, B, C), Set.of(other)), SelectionMode.NORMAL);

        assertEquals(Set.of(MODULE_1), result.skippableFiles());
    }
}
