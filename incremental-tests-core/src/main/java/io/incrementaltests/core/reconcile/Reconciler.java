package io.incrementaltests.core.reconcile;

import io.incrementaltests.core.db.TestDatabase;
import io.incrementaltests.core.model.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Keeps the persisted test set in line with the tests that actually exist.
 *
 * <p>Pruning is a heuristic: it trusts the collected set only when the run
 * collected everything. A filtered run, or a rerun after earlier failures,
 * collects a subset, and pruning against it would drop the records of tests that
 * still exist. Such runs skip pruning and may leave stale records behind.
 */
public final class Reconciler {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final TestDatabase database;

    public Reconciler(TestDatabase database) {
        this.database = database;
    }

    /**
     * Deletes records of tests that were not collected this run. Call once,
     * before any test executes.
     *
     * @param retained       every test the host collected
     * @param priorFailures  failures already reported earlier in this invocation
     * @param filtered       whether the host narrowed collection by name or path
     * @return number of removed records
     */
    public int sync(Set<NodeId> retained, int priorFailures, boolean filtered) {
        return sync(retained, priorFailures, filtered, false);
    }

    /**
     * As {@link #sync(Set, int, boolean)}, for a process that may be one of several
     * workers sharing the database. A worker only collects its own share of the
     * suite, so it never prunes.
     */
    public int sync(Set<NodeId> retained, int priorFailures, boolean filtered, boolean worker) {
        if (worker) {
            log.info("Skipping test reconciliation: worker process.");
            return 0;
        }
        if (priorFailures > 0) {
            log.info("Skipping test reconciliation: {} failures earlier in this invocation.", priorFailures);
            return 0;
        }
        if (filtered) {
            log.info("Skipping test reconciliation: collection was filtered.");
            return 0;
        }
        int removed = database.deleteNodesNotIn(retained);
        if (removed > 0) {
            log.info("Removed {} records of tests that no longer exist.", removed);
        }
        return removed;
    }

    /**
     * Garbage-collects checksum entries no fingerprint references. Only the
     * coordinating process does this; workers may still be recording fingerprints
     * that reference those entries.
     *
     * @return number of removed entries
     */
    public int removeUnusedFingerprints(boolean worker) {
        if (worker) {
            log.debug("Worker process: leaving checksum cleanup to the coordinator.");
            return 0;
        }
        int removed = database.removeUnusedFiles();
        log.debug("Removed {} unused checksum entries.", removed);
        return removed;
    }
}
