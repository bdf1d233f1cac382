package io.incrementaltests.core.stability;

import io.incrementaltests.core.model.NodeId;

import java.util.Set;

/**
 * Outcome of a stability computation. Derived for one run and never persisted.
 *
 * @param stableFiles    recorded files whose current checksum equals the recorded one
 * @param unstableFiles  recorded files that changed or disappeared
 * @param stableNodes    known tests whose every fingerprint entry still matches
 * @param unstableNodes  known tests with at least one changed or unknown file
 * @param librariesMiss  whether the library signature was recorded and has changed
 */
public record StabilityResult(
        Set<String> stableFiles,
        Set<String> unstableFiles,
        Set<NodeId> stableNodes,
        Set<NodeId> unstableNodes,
        boolean librariesMiss
) {

    public static StabilityResult empty() {
        return new StabilityResult(Set.of(), Set.of(), Set.of(), Set.of(), false);
    }

    public boolean isStable(NodeId id) {
        return stableNodes.contains(id);
    }

    public boolean isStable(String file) {
        return stableFiles.contains(file);
    }
}
