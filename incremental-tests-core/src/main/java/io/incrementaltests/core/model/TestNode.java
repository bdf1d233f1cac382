package io.incrementaltests.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Persisted record of a single test: what it touched, how it ended and how long it took.
 */
public record TestNode(NodeId id, Fingerprint fingerprint, Outcome outcome, Duration duration) {

    public TestNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(duration, "duration");
    }

    public boolean failed() {
        return outcome.failed();
    }
}
