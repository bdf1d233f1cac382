package io.incrementaltests.core.model;

import java.util.Collection;

/**
 * Last recorded result of a test.
 */
public enum Outcome {
    PASSED,
    FAILED,
    SKIPPED;

    /**
     * Aggregates the outcomes of a test's lifecycle phases: failed if any phase
     * failed, skipped if any phase was skipped, passed otherwise.
     */
    public static Outcome aggregate(Collection<Outcome> phases) {
        if (phases.contains(FAILED)) {
            return FAILED;
        }
        if (phases.contains(SKIPPED)) {
            return SKIPPED;
        }
        return PASSED;
    }

    public boolean failed() {
        return this == FAILED;
    }
}
