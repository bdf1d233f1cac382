package io.incrementaltests.core;

import io.incrementaltests.core.config.EnvironmentExpression;
import io.incrementaltests.core.config.IncrementalTestsConfig;
import io.incrementaltests.core.db.TestDatabase;
import io.incrementaltests.core.model.ExitStatus;
import io.incrementaltests.core.model.NodeId;
import io.incrementaltests.core.model.TestNode;
import io.incrementaltests.core.ordering.DurationStatistics;
import io.incrementaltests.core.ordering.TestOrderer;
import io.incrementaltests.core.recording.CoverageCollector;
import io.incrementaltests.core.recording.FingerprintTracer;
import io.incrementaltests.core.recording.Recorder;
import io.incrementaltests.core.reconcile.Reconciler;
import io.incrementaltests.core.report.RunSummary;
import io.incrementaltests.core.selection.SelectionResult;
import io.incrementaltests.core.selection.Selector;
import io.incrementaltests.core.stability.ChecksumCalculator;
import io.incrementaltests.core.stability.LibrarySignature;
import io.incrementaltests.core.stability.StabilityEngine;
import io.incrementaltests.core.stability.StabilityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.*;

/**
 * Main orchestrator: opens the test database, works out what changed, selects and
 * orders the tests to run, and hands out the recorder and reconciler the host
 * runner drives during execution.
 *
 * <p>Usage:
 * <pre>{@code
 * IncrementalTestsConfig config = IncrementalTestsConfig.builder().build();
 * try (IncrementalTestsEngine engine = new IncrementalTestsEngine(config, projectDir)) {
 *     engine.start();
 *     SelectionResult selection = engine.select(discoveredIds, false);
 *     List<NodeId> toRun = engine.order(selection);
 *     // run toRun, feeding engine.recorder(collector)
 * }
 * }</pre>
 */
public final class IncrementalTestsEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IncrementalTestsEngine.class);

    static final String LAST_RUN_ATTRIBUTE = "last_run_date";
    static final String LIBRARIES_ATTRIBUTE = "libraries";

    private final IncrementalTestsConfig config;
    private final Path projectDir;
    private final String librarySignature;

    private TestDatabase database;
    private ChecksumCalculator checksums;
    private String environment = "";
    private Map<NodeId, TestNode> knownNodes = Map.of();
    private StabilityResult stability = StabilityResult.empty();
    private DurationStatistics statistics = DurationStatistics.empty();
    private Optional<String> lastRun = Optional.empty();

    public IncrementalTestsEngine(IncrementalTestsConfig config, Path projectDir) {
        this(config, projectDir, LibrarySignature.fromClassPath());
    }

    public IncrementalTestsEngine(IncrementalTestsConfig config, Path projectDir, String librarySignature) {
        this.config = config;
        this.projectDir = projectDir.toAbsolutePath().normalize();
        this.librarySignature = librarySignature;
    }

    /**
     * Opens the database and computes this run's stability view.
     *
     * @throws IllegalStateException    if the database cannot be opened or read
     * @throws IllegalArgumentException if the configuration is unusable
     */
    public StabilityResult start() {
        if (database != null) {
            throw new IllegalStateException("Engine already started");
        }
        environment = new EnvironmentExpression().evaluate(config.environmentExpression());
        Path databasePath = config.databasePath(projectDir);

        log.info("=== Incremental Tests ===");
        log.info("Project dir: {}", projectDir);
        log.info("Database: {}", databasePath);
        log.info("Environment: '{}'", environment);
        log.info("Select: {}, collect: {}, worker: {}", config.select(), config.collect(), config.worker());

        database = TestDatabase.open(databasePath, environment);
        checksums = new ChecksumCalculator(projectDir, librarySignature);

        List<TestNode> nodes;
        Map<String, String> fileChecksums;
        try {
            nodes = database.allNodes();
            fileChecksums = database.fileChecksums();
        } catch (RuntimeException e) {
            throw new IllegalStateException(
                    "Incremental Tests: unable to read recorded data from '" + databasePath + "'.", e);
        }

        Map<NodeId, TestNode> byId = new LinkedHashMap<>();
        nodes.forEach(node -> byId.put(node.id(), node));
        knownNodes = Collections.unmodifiableMap(byId);
        statistics = DurationStatistics.from(nodes);
        stability = new StabilityEngine(checksums).determineStable(nodes, fileChecksums);

        lastRun = database.attribute(LAST_RUN_ATTRIBUTE);
        Optional<String> lastLibraries = database.attribute(LIBRARIES_ATTRIBUTE);
        log.info("Last recorded run: {}", lastRun.orElse("never"));
        if (lastLibraries.isPresent() && !lastLibraries.get().equals(librarySignature)) {
            log.info("Libraries changed since the last recorded run");
            log.debug("Previous libraries: {}", lastLibraries.get());
        }

        if (config.collect()) {
            database.writeAttribute(LAST_RUN_ATTRIBUTE, LocalDate.now().toString());
            database.writeAttribute(LIBRARIES_ATTRIBUTE, librarySignature);
        }
        return stability;
    }

    /**
     * Partitions the tests the host discovered into selected and deselected.
     *
     * @param discovered              discovered tests, in collection order
     * @param externalFiltersPresent  whether the host narrowed the run by name
     */
    public SelectionResult select(List<NodeId> discovered, boolean externalFiltersPresent) {
        requireStarted();
        return new Selector().select(discovered, knownNodes, stability,
                config.selectionMode(externalFiltersPresent));
    }

    /** Orders tests fast-modules, fast-classes, fast-tests first. */
    public List<NodeId> order(Collection<NodeId> tests) {
        return new TestOrderer(statistics).order(tests);
    }

    /**
     * Orders the selected tests: tests that must run come first, then those that
     * are only running because the mode keeps everything. Each part is ordered
     * by {@link #order(Collection)}.
     */
    public List<NodeId> order(SelectionResult selection) {
        TestOrderer orderer = new TestOrderer(statistics);
        List<NodeId> ordered = new ArrayList<>(orderer.order(selection.mustRun()));
        ordered.addAll(orderer.order(selection.unaffected()));
        return ordered;
    }

    /**
     * Returns a recorder fed by the given collector, or a disabled recorder when
     * collection is switched off.
     */
    public Recorder recorder(CoverageCollector collector) {
        requireStarted();
        if (!config.collect() || collector == null) {
            return Recorder.disabled();
        }
        return new Recorder(database, new FingerprintTracer(collector, checksums));
    }

    public Reconciler reconciler() {
        requireStarted();
        return new Reconciler(database);
    }

    /**
     * Pruning of vanished tests at the start of the run; a no-op when collection
     * is off and in worker processes.
     */
    public int reconcile(Set<NodeId> retained, int priorFailures, boolean filtered) {
        if (!config.collect()) {
            return 0;
        }
        return reconciler().sync(retained, priorFailures, filtered, config.worker());
    }

    /**
     * End-of-run cleanup of unreferenced checksums; skipped for workers and when
     * collection is off.
     */
    public int finish() {
        if (!config.collect()) {
            return 0;
        }
        return reconciler().removeUnusedFingerprints(config.worker());
    }

    public String summary(SelectionResult selection) {
        return RunSummary.format(stability, selection, environment);
    }

    /**
     * Deselecting every test is not a failure: "no tests found" becomes success
     * when the selector skipped anything.
     */
    public static ExitStatus normalizeExitStatus(ExitStatus status, SelectionResult selection) {
        if (status == ExitStatus.NO_TESTS_FOUND && selection != null && !selection.deselected().isEmpty()) {
            return ExitStatus.SUCCESS;
        }
        return status;
    }

    public IncrementalTestsConfig config() { return config; }
    public Path projectDir() { return projectDir; }
    public String environment() { return environment; }
    public StabilityResult stability() { return stability; }
    public DurationStatistics statistics() { return statistics; }
    public Map<NodeId, TestNode> knownNodes() { return knownNodes; }
    /** Date of the previous collecting run in this environment, as read by {@link #start()}. */
    public Optional<String> lastRun() { return lastRun; }

    public Optional<String> attribute(String key) {
        requireStarted();
        return database.attribute(key);
    }

    @Override
    public void close() {
        if (database != null) {
            database.close();
        }
    }

    private void requireStarted() {
        if (database == null) {
            throw new IllegalStateException("Engine not started");
        }
    }
}
