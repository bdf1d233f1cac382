package io.incrementaltests.core.selection;

import io.incrementaltests.core.model.NodeId;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Partition of the discovered tests into those that run and those that are skipped.
 *
 * @param selected        tests to execute, in discovery order
 * @param deselected      tests skipped because nothing they depend on changed
 * @param skippableFiles  home files with nothing to run; hosts may skip collecting them
 * @param mode            the mode the partition was computed with
 * @param unaffected      selected tests that {@link SelectionMode#NORMAL} would have
 *                        skipped; only non-empty when the mode keeps everything
 */
public record SelectionResult(
        List<NodeId> selected,
        List<NodeId> deselected,
        Set<String> skippableFiles,
        SelectionMode mode,
        List<NodeId> unaffected
) {

    public SelectionResult(List<NodeId> selected, List<NodeId> deselected,
                           Set<String> skippableFiles, SelectionMode mode) {
        this(selected, deselected, skippableFiles, mode, List.of());
    }

    public boolean nothingToRun() {
        return selected.isEmpty();
    }

    /** Selected tests that are affected by a change, failed last time, or are new. */
    public List<NodeId> mustRun() {
        if (unaffected.isEmpty()) {
            return selected;
        }
        Set<NodeId> skip = Set.copyOf(unaffected);
        return selected.stream().filter(id -> !skip.contains(id)).collect(Collectors.toList());
    }
}
