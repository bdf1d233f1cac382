package io.incrementaltests.junit;

import io.incrementaltests.core.model.NodeId;
import io.incrementaltests.core.model.Outcome;
import io.incrementaltests.core.recording.Phase;
import io.incrementaltests.core.recording.Recorder;
import org.junit.platform.engine.TestExecutionResult;
import org.junit.platform.launcher.TestExecutionListener;
import org.junit.platform.launcher.TestIdentifier;
import org.junit.platform.launcher.TestPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Feeds JUnit Platform execution events into the {@link Recorder}.
 *
 * <p>JUnit reports one result per test, so each node gets a single
 * {@link Phase#CALL} phase. A failing invocation below a recorded method marks
 * that method failed.
 */
final class RecordingListener implements TestExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(RecordingListener.class);

    private final Recorder recorder;
    private final NodeIds nodeIds;

    private final Map<String, NodeId> active = new HashMap<>();
    private final Map<String, Long> startedNanos = new HashMap<>();
    private final Set<String> failedDescendants = new HashSet<>();
    private TestPlan testPlan;
    private int testsExecuted;
    private int failures;

    RecordingListener(Recorder recorder, NodeIds nodeIds) {
        this.recorder = recorder;
        this.nodeIds = nodeIds;
    }

    @Override
    public void testPlanExecutionStarted(TestPlan testPlan) {
        this.testPlan = testPlan;
    }

    @Override
    public void executionStarted(TestIdentifier identifier) {
        nodeIds.recordable(testPlan, identifier).ifPresent(node -> {
            active.put(identifier.getUniqueId(), node);
            startedNanos.put(identifier.getUniqueId(), System.nanoTime());
            recorder.testStarted(node);
        });
    }

    @Override
    public void executionFinished(TestIdentifier identifier, TestExecutionResult result) {
        boolean failed = result.getStatus() == TestExecutionResult.Status.FAILED;
        if (identifier.isTest()) {
            testsExecuted++;
        }
        if (failed) {
            failures++;
        }

        String uniqueId = identifier.getUniqueId();
        NodeId node = active.remove(uniqueId);
        if (node == null) {
            if (failed) {
                recordedAncestor(identifier).ifPresent(failedDescendants::add);
            }
            return;
        }

        Outcome outcome = failedDescendants.remove(uniqueId) ? Outcome.FAILED : outcomeOf(result);
        Duration duration = Duration.ofNanos(System.nanoTime() - startedNanos.remove(uniqueId));
        recorder.phaseFinished(node, Phase.CALL, outcome, duration);
        recorder.testFinished(node);
        log.debug("{} finished {} in {} ms", node, outcome, duration.toMillis());
    }

    int testsExecuted() {
        return testsExecuted;
    }

    int failures() {
        return failures;
    }

    private Optional<String> recordedAncestor(TestIdentifier identifier) {
        Optional<TestIdentifier> parent = testPlan.getParent(identifier);
        while (parent.isPresent()) {
            String parentId = parent.get().getUniqueId();
            if (active.containsKey(parentId)) {
                return Optional.of(parentId);
            }
            parent = testPlan.getParent(parent.get());
        }
        return Optional.empty();
    }

    private static Outcome outcomeOf(TestExecutionResult result) {
        switch (result.getStatus()) {
            case SUCCESSFUL:
                return Outcome.PASSED;
            case ABORTED:
                return Outcome.SKIPPED;
            default:
                return Outcome.FAILED;
        }
    }
}
