package io.incrementaltests.core.recording;

import io.incrementaltests.core.db.DatabaseException;
import io.incrementaltests.core.db.TestDatabase;
import io.incrementaltests.core.model.Fingerprint;
import io.incrementaltests.core.model.NodeId;
import io.incrementaltests.core.model.Outcome;
import io.incrementaltests.core.model.TestNode;
import io.incrementaltests.core.recording.Tracer.TraceHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Collects the fingerprint, outcome and duration of each test and commits them
 * in one transaction when the test's lifecycle is over.
 *
 * <p>A test whose trace or commit fails is not recorded. It stays unknown (or
 * keeps its previous record) and is therefore selected again next run. Such
 * failures are logged and never abort the suite.
 */
public final class Recorder implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Recorder.class);

    private final TestDatabase database;
    private final Tracer tracer;
    private final Map<NodeId, InFlight> inFlight = new HashMap<>();
    private int committed;
    private int dropped;

    /**
     * @param database  store to commit to
     * @param tracer    fingerprint source; {@code null} disables recording
     */
    public Recorder(TestDatabase database, Tracer tracer) {
        this.database = database;
        this.tracer = tracer;
    }

    /** A recorder that observes nothing and writes nothing. */
    public static Recorder disabled() {
        return new Recorder(null, null);
    }

    public boolean enabled() {
        return tracer != null;
    }

    public void testStarted(NodeId id) {
        if (!enabled()) {
            return;
        }
        TraceHandle handle = null;
        try {
            handle = tracer.begin(id);
        } catch (RuntimeException e) {
            log.warn("Unable to start tracing {}: {}", id, e.getMessage());
        }
        inFlight.put(id, new InFlight(handle));
    }

    public void phaseFinished(NodeId id, Phase phase, Outcome outcome, Duration duration) {
        if (!enabled()) {
            return;
        }
        InFlight state = inFlight.get(id);
        if (state == null) {
            log.debug("Ignoring {} phase of {}: test was never started", phase, id);
            return;
        }
        state.phases.merge(phase, outcome, (previous, next) -> previous.failed() ? previous : next);
        state.duration = state.duration.plus(duration);
    }

    /**
     * Ends the trace of a finished test and commits its record.
     *
     * @return whether the record was committed
     */
    public boolean testFinished(NodeId id) {
        if (!enabled()) {
            return false;
        }
        InFlight state = inFlight.remove(id);
        if (state == null) {
            log.debug("Ignoring finish of {}: test was never started", id);
            return false;
        }
        if (state.handle == null) {
            dropped++;
            return false;
        }

        Fingerprint fingerprint;
        try {
            fingerprint = tracer.end(state.handle);
        } catch (RuntimeException e) {
            log.warn("Fingerprint collection failed for {}; it will run again next time: {}",
                    id, e.getMessage());
            dropped++;
            return false;
        }

        TestNode node = new TestNode(id, fingerprint, Outcome.aggregate(state.phases.values()), state.duration);
        try {
            database.upsertNode(node);
        } catch (DatabaseException e) {
            log.warn("Could not record {}; it will run again next time: {}", id, e.getMessage());
            dropped++;
            return false;
        }
        committed++;
        return true;
    }

    /**
     * Drops the in-flight trace of a test interrupted before it finished; nothing is committed.
     */
    public void abort(NodeId id) {
        InFlight state = inFlight.remove(id);
        if (state != null && state.handle != null) {
            tracer.discard(state.handle);
            dropped++;
        }
    }

    public int committed() {
        return committed;
    }

    public int dropped() {
        return dropped;
    }

    @Override
    public void close() {
        inFlight.keySet().stream().toList().forEach(this::abort);
        if (tracer != null) {
            tracer.close();
        }
    }

    private static final class InFlight {
        private final TraceHandle handle;
        private final Map<Phase, Outcome> phases = new EnumMap<>(Phase.class);
        private Duration duration = Duration.ZERO;

        private InFlight(TraceHandle handle) {
            this.handle = handle;
        }
    }
}
