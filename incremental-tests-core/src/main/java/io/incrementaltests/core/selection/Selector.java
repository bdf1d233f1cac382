package io.incrementaltests.core.selection;

import io.incrementaltests.core.model.NodeId;
import io.incrementaltests.core.model.TestNode;
import io.incrementaltests.core.stability.StabilityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits discovered tests into "must run" and "can skip".
 *
 * <p>A test is skipped only when it is known, stable, and did not fail last
 * time. Unknown tests and failing tests always run, whatever their fingerprint
 * says. Every discovered test ends up in exactly one of the two lists.
 *
 * <p>When the mode keeps everything, the tests that would have been skipped are
 * still reported as {@link SelectionResult#unaffected()} so they can run last.
 */
public final class Selector {

    private static final Logger log = LoggerFactory.getLogger(Selector.class);

    /**
     * @param discovered  tests the host collected this run, in collection order
     * @param knownNodes  recorded nodes keyed by id
     * @param stability   this run's stability result
     * @param mode        selection mode
     */
    public SelectionResult select(List<NodeId> discovered,
                                  Map<NodeId, TestNode> knownNodes,
                                  StabilityResult stability,
                                  SelectionMode mode) {
        List<NodeId> selected = new ArrayList<>();
        List<NodeId> deselected = new ArrayList<>();
        List<NodeId> unaffected = new ArrayList<>();
        Set<NodeId> seen = new HashSet<>();

        for (NodeId id : discovered) {
            if (!seen.add(id)) {
                continue;
            }
            boolean skippable = canSkip(id, knownNodes, stability);
            if (skippable && mode.deselects()) {
                deselected.add(id);
            } else {
                selected.add(id);
                if (skippable) {
                    unaffected.add(id);
                }
            }
        }

        Set<String> skippableFiles = mode.deselects()
                ? skippableFiles(knownNodes.values(), stability, selected)
                : Set.of();

        log.info("Selection ({}): {} to run, {} deselected", mode, selected.size(), deselected.size());
        return new SelectionResult(
                Collections.unmodifiableList(selected),
                Collections.unmodifiableList(deselected),
                skippableFiles,
                mode,
                Collections.unmodifiableList(unaffected));
    }

    private static boolean canSkip(NodeId id, Map<NodeId, TestNode> knownNodes, StabilityResult stability) {
        TestNode known = knownNodes.get(id);
        return known != null && !known.failed() && stability.isStable(id);
    }

    /**
     * Stable home files of known tests where no known test failed and nothing is selected.
     */
    private static Set<String> skippableFiles(Collection<TestNode> knownNodes,
                                              StabilityResult stability,
                                              List<NodeId> selected) {
        Set<String> blocked = new HashSet<>();
        for (TestNode node : knownNodes) {
            if (node.failed()) {
                blocked.add(node.id().moduleKey());
            }
        }
        for (NodeId id : selected) {
            blocked.add(id.moduleKey());
        }

        Set<String> files = new LinkedHashSet<>();
        for (TestNode node : knownNodes) {
            String home = node.id().moduleKey();
            if (stability.isStable(home) && !blocked.contains(home)) {
                files.add(home);
            }
        }
        return Collections.unmodifiableSet(files);
    }
}
