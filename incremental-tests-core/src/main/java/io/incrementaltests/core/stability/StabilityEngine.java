package io.incrementaltests.core.stability;

import io.incrementaltests.core.model.FingerprintEntry;
import io.incrementaltests.core.model.TestNode;
import io.incrementaltests.core.model.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which recorded files and tests are unchanged since they were recorded.
 *
 * <p>A file is stable when its current checksum equals the persisted one. A test
 * is stable when every file in its fingerprint has a persisted checksum and the
 * file's current checksum equals the checksum the test saw. A file the checksum
 * store never heard of makes the test unstable; an empty fingerprint is stable.
 */
public final class StabilityEngine {

    private static final Logger log = LoggerFactory.getLogger(StabilityEngine.class);

    private final ChecksumCalculator checksums;

    public StabilityEngine(ChecksumCalculator checksums) {
        this.checksums = checksums;
    }

    /**
     * Computes the stable and unstable partitions of files and nodes.
     *
     * @param nodes          every recorded test node
     * @param fileChecksums  persisted checksum store (path to checksum)
     */
    public StabilityResult determineStable(Collection<TestNode> nodes, Map<String, String> fileChecksums) {
        Set<String> stableFiles = new LinkedHashSet<>();
        Set<String> unstableFiles = new LinkedHashSet<>();
        for (Map.Entry<String, String> recorded : fileChecksums.entrySet()) {
            Optional<String> current = checksums.checksum(recorded.getKey());
            if (current.isPresent() && current.get().equals(recorded.getValue())) {
                stableFiles.add(recorded.getKey());
            } else {
                unstableFiles.add(recorded.getKey());
                log.debug("  Changed: {}", recorded.getKey());
            }
        }

        Set<NodeId> stableNodes = new LinkedHashSet<>();
        Set<NodeId> unstableNodes = new LinkedHashSet<>();
        for (TestNode node : nodes) {
            if (isStable(node, fileChecksums)) {
                stableNodes.add(node.id());
            } else {
                unstableNodes.add(node.id());
            }
        }

        boolean librariesMiss = unstableFiles.contains(ChecksumCalculator.LIBRARIES);
        log.info("Stability: {} of {} files changed, {} of {} tests affected{}",
                unstableFiles.size(), fileChecksums.size(),
                unstableNodes.size(), stableNodes.size() + unstableNodes.size(),
                librariesMiss ? " (libraries changed)" : "");

        return new StabilityResult(
                Collections.unmodifiableSet(stableFiles),
                Collections.unmodifiableSet(unstableFiles),
                Collections.unmodifiableSet(stableNodes),
                Collections.unmodifiableSet(unstableNodes),
                librariesMiss);
    }

    private boolean isStable(TestNode node, Map<String, String> fileChecksums) {
        for (FingerprintEntry entry : node.fingerprint().entries()) {
            if (!fileChecksums.containsKey(entry.file())) {
                return false;
            }
            Optional<String> current = checksums.checksum(entry.file());
            if (current.isEmpty() || !Objects.equals(current.get(), entry.checksum())) {
                return false;
            }
        }
        return true;
    }
}
