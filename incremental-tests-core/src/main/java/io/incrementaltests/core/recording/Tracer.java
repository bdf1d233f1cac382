package io.incrementaltests.core.recording;

import io.incrementaltests.core.model.Fingerprint;
import io.incrementaltests.core.model.NodeId;

/**
 * Captures the fingerprint of one test execution.
 */
public interface Tracer extends AutoCloseable {

    TraceHandle begin(NodeId node);

    /**
     * Ends the trace and returns the fingerprint of everything executed since
     * {@link #begin(NodeId)}.
     */
    Fingerprint end(TraceHandle handle);

    /** Ends the trace without producing a fingerprint. */
    void discard(TraceHandle handle);

    @Override
    default void close() {
    }

    /** Opaque token tying {@link #end(TraceHandle)} to its {@link #begin(NodeId)}. */
    record TraceHandle(NodeId node, long startedNanos) {
    }
}
