package io.incrementaltests.junit;

import io.incrementaltests.core.IncrementalTestsEngine;
import io.incrementaltests.core.config.IncrementalTestsConfig;
import io.incrementaltests.core.model.ExitStatus;
import io.incrementaltests.core.model.NodeId;
import io.incrementaltests.core.recording.CoverageCollector;
import io.incrementaltests.core.recording.Recorder;
import io.incrementaltests.core.selection.SelectionResult;
import org.junit.platform.engine.DiscoverySelector;
import org.junit.platform.engine.Filter;
import org.junit.platform.engine.UniqueId;
import org.junit.platform.engine.discovery.ClasspathRootSelector;
import org.junit.platform.engine.discovery.DiscoverySelectors;
import org.junit.platform.engine.discovery.IterationSelector;
import org.junit.platform.engine.discovery.MethodSelector;
import org.junit.platform.engine.discovery.ModuleSelector;
import org.junit.platform.engine.discovery.NestedMethodSelector;
import org.junit.platform.engine.discovery.PackageSelector;
import org.junit.platform.engine.discovery.UniqueIdSelector;
import org.junit.platform.launcher.EngineDiscoveryResult;
import org.junit.platform.launcher.Launcher;
import org.junit.platform.launcher.LauncherDiscoveryListener;
import org.junit.platform.launcher.LauncherDiscoveryRequest;
import org.junit.platform.launcher.TestIdentifier;
import org.junit.platform.launcher.TestPlan;
import org.junit.platform.launcher.core.LauncherDiscoveryRequestBuilder;
import org.junit.platform.launcher.core.LauncherFactory;
import org.junit.platform.launcher.listeners.SummaryGeneratingListener;
import org.junit.platform.launcher.listeners.TestExecutionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs a JUnit Platform test suite incrementally.
 *
 * <p>The flow:
 * <ol>
 *   <li>Discover the requested tests</li>
 *   <li>Prune recorded tests that no longer exist (full-suite runs only)</li>
 *   <li>Deselect known, stable, non-failing tests</li>
 *   <li>Execute the rest one class at a time, fastest first, recording fresh fingerprints</li>
 *   <li>Drop unreferenced checksums and report an exit status</li>
 * </ol>
 */
public final class IncrementalTestsRunner {

    private static final Logger log = LoggerFactory.getLogger(IncrementalTestsRunner.class);

    static final String PARALLEL_ENABLED = "junit.jupiter.execution.parallel.enabled";
    static final String DEFAULT_METHOD_ORDER = "junit.jupiter.testmethod.order.default";
    static final String DEFAULT_DISCOVERY_LISTENER = "junit.platform.discovery.listener.default";

    /** Creates the coverage collector once the engine has started. */
    @FunctionalInterface
    public interface CollectorFactory {
        CoverageCollector create(IncrementalTestsConfig config, Path projectDir);
    }

    private final Path projectDir;
    private final Map<String, String> configurationParameters;
    private final Launcher launcher;
    private final CollectorFactory collectorFactory;

    public IncrementalTestsRunner(Path projectDir, Map<String, String> configurationParameters) {
        this(projectDir, configurationParameters, LauncherFactory.create(),
                (config, dir) -> JacocoCoverageCollector.attach(dir, config.sourceDirs(), config.testDirs()));
    }

    public IncrementalTestsRunner(Path projectDir, Map<String, String> configurationParameters,
                                  Launcher launcher, CollectorFactory collectorFactory) {
        this.projectDir = projectDir.toAbsolutePath().normalize();
        this.configurationParameters = Map.copyOf(configurationParameters);
        this.launcher = launcher;
        this.collectorFactory = collectorFactory;
    }

    /**
     * Runs the tests matched by the selectors and filters.
     *
     * @return the run's exit status; {@link ExitStatus#ABORTED} when the
     *         configuration or the database is unusable
     */
    public ExitStatus run(List<? extends DiscoverySelector> selectors, List<? extends Filter<?>> filters) {
        IncrementalTestsOptions options = IncrementalTestsOptions.from(configurationParameters);
        IncrementalTestsConfig config;
        try {
            config = options.config();
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            return ExitStatus.ABORTED;
        }

        if (!options.enabled() || !config.active()) {
            log.info("Incremental Tests disabled: running every requested test");
            return runPlain(selectors, filters);
        }

        try (IncrementalTestsEngine engine = new IncrementalTestsEngine(config, projectDir)) {
            try {
                engine.start();
            } catch (IllegalStateException | IllegalArgumentException e) {
                log.error("{}", e.getMessage(), e);
                return ExitStatus.ABORTED;
            }
            return runIncremental(engine, selectors, filters);
        }
    }

    private ExitStatus runIncremental(IncrementalTestsEngine engine,
                                      List<? extends DiscoverySelector> selectors,
                                      List<? extends Filter<?>> filters) {
        IncrementalTestsConfig config = engine.config();

        // ── Discovery ────────────────────────────────────────────────────
        DiscoveryFailures discoveryFailures = new DiscoveryFailures();
        TestPlan plan = launcher.discover(request(selectors, filters, configurationParameters, discoveryFailures));
        NodeIds nodeIds = new NodeIds(projectDir, config.testDirs());
        Map<NodeId, TestIdentifier> discovered = recordableTests(plan, nodeIds);
        log.info("Discovered {} tests", discovered.size());

        boolean nameFiltered = narrowsByName(selectors, filters);
        boolean partial = nameFiltered || !coversWholeSuite(selectors);

        // ── Reconciliation and selection ─────────────────────────────────
        engine.reconcile(discovered.keySet(), discoveryFailures.count, partial);
        SelectionResult selection = engine.select(new ArrayList<>(discovered.keySet()), nameFiltered);
        List<NodeId> ordered = engine.order(selection);
        log.info("{}", engine.summary(selection));
        if (!selection.skippableFiles().isEmpty()) {
            log.debug("Test files with nothing to run: {}", selection.skippableFiles());
        }

        // ── Execution ────────────────────────────────────────────────────
        CoverageCollector collector = null;
        if (config.collect() && !ordered.isEmpty()) {
            try {
                collector = collectorFactory.create(config, projectDir);
            } catch (IllegalStateException e) {
                log.error("{}", e.getMessage(), e);
                return ExitStatus.ABORTED;
            }
        }

        RecordingListener listener;
        try (Recorder recorder = engine.recorder(collector)) {
            listener = new RecordingListener(recorder, nodeIds);
            for (List<TestIdentifier> group : groupByClass(plan, ordered, discovered)) {
                launcher.execute(request(unique(group), filters, groupParameters(group), new DiscoveryFailures()),
                        listener);
            }
            if (recorder.dropped() > 0) {
                log.warn("{} test results were not recorded and will run again next time", recorder.dropped());
            }
        }

        engine.finish();

        ExitStatus status;
        if (listener.failures() > 0 || discoveryFailures.count > 0) {
            status = ExitStatus.TESTS_FAILED;
        } else if (listener.testsExecuted() == 0) {
            status = ExitStatus.NO_TESTS_FOUND;
        } else {
            status = ExitStatus.SUCCESS;
        }
        ExitStatus normalized = IncrementalTestsEngine.normalizeExitStatus(status, selection);
        log.info("Ran {} tests, {} failures, exit status {}", listener.testsExecuted(), listener.failures(), normalized);
        return normalized;
    }

    private ExitStatus runPlain(List<? extends DiscoverySelector> selectors, List<? extends Filter<?>> filters) {
        SummaryGeneratingListener summaryListener = new SummaryGeneratingListener();
        launcher.execute(request(selectors, filters, configurationParameters, new DiscoveryFailures()), summaryListener);
        TestExecutionSummary summary = summaryListener.getSummary();
        if (summary.getTotalFailureCount() > 0) {
            return ExitStatus.TESTS_FAILED;
        }
        return summary.getTestsFoundCount() == 0 ? ExitStatus.NO_TESTS_FOUND : ExitStatus.SUCCESS;
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private static Map<NodeId, TestIdentifier> recordableTests(TestPlan plan, NodeIds nodeIds) {
        Map<NodeId, TestIdentifier> tests = new LinkedHashMap<>();
        for (TestIdentifier root : plan.getRoots()) {
            collect(plan, root, nodeIds, tests);
        }
        return tests;
    }

    private static void collect(TestPlan plan, TestIdentifier identifier, NodeIds nodeIds,
                                Map<NodeId, TestIdentifier> tests) {
        nodeIds.recordable(plan, identifier).ifPresent(node -> tests.putIfAbsent(node, identifier));
        for (TestIdentifier child : plan.getChildren(identifier)) {
            collect(plan, child, nodeIds, tests);
        }
    }

    /**
     * Tests grouped by parent class. Groups follow the position of their first
     * test in the computed order; members keep their relative order.
     */
    private static List<List<TestIdentifier>> groupByClass(TestPlan plan, List<NodeId> ordered,
                                                           Map<NodeId, TestIdentifier> discovered) {
        Map<String, List<TestIdentifier>> groups = new LinkedHashMap<>();
        for (NodeId node : ordered) {
            TestIdentifier identifier = discovered.get(node);
            String parent = plan.getParent(identifier).map(TestIdentifier::getUniqueId).orElse("");
            groups.computeIfAbsent(parent, key -> new ArrayList<>()).add(identifier);
        }
        return new ArrayList<>(groups.values());
    }

    private static List<DiscoverySelector> unique(List<TestIdentifier> group) {
        return group.stream()
                .map(identifier -> DiscoverySelectors.selectUniqueId(UniqueId.parse(identifier.getUniqueId())))
                .collect(Collectors.toList());
    }

    private Map<String, String> groupParameters(List<TestIdentifier> group) {
        List<String> methodOrder = group.stream()
                .map(NodeIds::methodSource)
                .flatMap(java.util.Optional::stream)
                .map(source -> NodeIds.methodKey(source.getMethodName(),
                        source.getMethodParameterTypes() == null ? "" : source.getMethodParameterTypes()))
                .collect(Collectors.toList());

        Map<String, String> parameters = new HashMap<>(configurationParameters);
        // Coverage is collected per JVM, so tests must not overlap.
        parameters.put(PARALLEL_ENABLED, "false");
        parameters.put(DEFAULT_METHOD_ORDER, DurationMethodOrderer.class.getName());
        parameters.put(DurationMethodOrderer.ORDER_PARAMETER, DurationMethodOrderer.encode(methodOrder));
        return parameters;
    }

    private static LauncherDiscoveryRequest request(List<? extends DiscoverySelector> selectors,
                                                    List<? extends Filter<?>> filters,
                                                    Map<String, String> parameters,
                                                    LauncherDiscoveryListener discoveryListener) {
        Map<String, String> withListener = new HashMap<>(parameters);
        withListener.putIfAbsent(DEFAULT_DISCOVERY_LISTENER, "logging");
        return LauncherDiscoveryRequestBuilder.request()
                .selectors(selectors)
                .filters(filters.toArray(new Filter<?>[0]))
                .configurationParameters(withListener)
                .listeners(discoveryListener)
                .build();
    }

    static boolean narrowsByName(List<? extends DiscoverySelector> selectors, List<? extends Filter<?>> filters) {
        return !filters.isEmpty() || selectors.stream().anyMatch(selector ->
                selector instanceof MethodSelector
                        || selector instanceof NestedMethodSelector
                        || selector instanceof UniqueIdSelector
                        || selector instanceof IterationSelector);
    }

    static boolean coversWholeSuite(List<? extends DiscoverySelector> selectors) {
        return !selectors.isEmpty() && selectors.stream().allMatch(selector ->
                selector instanceof PackageSelector
                        || selector instanceof ClasspathRootSelector
                        || selector instanceof ModuleSelector);
    }

    private static final class DiscoveryFailures implements LauncherDiscoveryListener {
        private int count;

        @Override
        public void engineDiscoveryFinished(UniqueId engineId, EngineDiscoveryResult result) {
            if (result.getStatus() == EngineDiscoveryResult.Status.FAILED) {
                count++;
                log.warn("Test discovery failed for engine {}", engineId,
                        result.getThrowable().orElse(null));
            }
        }
    }

    /**
     * Runs the given packages with options from system properties, using the
     * working directory as the project directory.
     */
    public static void main(String... packages) {
        if (packages.length == 0) {
            log.error("Usage: IncrementalTestsRunner <package> [<package>...]");
            System.exit(ExitStatus.ABORTED.code());
        }
        List<DiscoverySelector> selectors = Arrays.stream(packages)
                .map(DiscoverySelectors::selectPackage)
                .collect(Collectors.toList());
        ExitStatus status = new IncrementalTestsRunner(Paths.get("").toAbsolutePath(), Map.of())
                .run(selectors, List.of());
        System.exit(status.code());
    }
}
