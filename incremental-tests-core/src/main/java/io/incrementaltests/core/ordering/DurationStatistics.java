package io.incrementaltests.core.ordering;

import io.incrementaltests.core.model.NodeId;
import io.incrementaltests.core.model.TestNode;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Average historical durations in milliseconds, per test, per class and per module.
 * Keys without history average to zero, so new tests sort first.
 */
public final class DurationStatistics {

    private static final DurationStatistics EMPTY = new DurationStatistics(Map.of(), Map.of(), Map.of());

    private final Map<NodeId, Double> nodes;
    private final Map<String, Double> classes;
    private final Map<String, Double> modules;

    private DurationStatistics(Map<NodeId, Double> nodes, Map<String, Double> classes, Map<String, Double> modules) {
        this.nodes = nodes;
        this.classes = classes;
        this.modules = modules;
    }

    public static DurationStatistics empty() {
        return EMPTY;
    }

    public static DurationStatistics from(Collection<TestNode> recorded) {
        Map<NodeId, Double> nodes = new HashMap<>();
        Map<String, double[]> classTotals = new HashMap<>();
        Map<String, double[]> moduleTotals = new HashMap<>();

        for (TestNode node : recorded) {
            double millis = node.duration().toMillis();
            nodes.put(node.id(), millis);
            node.id().classKey().ifPresent(key -> accumulate(classTotals, key, millis));
            accumulate(moduleTotals, node.id().moduleKey(), millis);
        }
        return new DurationStatistics(Map.copyOf(nodes), averages(classTotals), averages(moduleTotals));
    }

    public double nodeAverage(NodeId id) {
        return nodes.getOrDefault(id, 0.0);
    }

    /** Class average, or the module average when the test has no class. */
    public double classAverage(NodeId id) {
        return id.classKey()
                .map(key -> classes.getOrDefault(key, 0.0))
                .orElseGet(() -> moduleAverage(id));
    }

    public double moduleAverage(NodeId id) {
        return modules.getOrDefault(id.moduleKey(), 0.0);
    }

    private static void accumulate(Map<String, double[]> totals, String key, double millis) {
        double[] sumAndCount = totals.computeIfAbsent(key, k -> new double[2]);
        sumAndCount[0] += millis;
        sumAndCount[1] += 1;
    }

    private static Map<String, Double> averages(Map<String, double[]> totals) {
        Map<String, Double> averages = new HashMap<>();
        totals.forEach((key, sumAndCount) -> averages.put(key, sumAndCount[0] / sumAndCount[1]));
        return Map.copyOf(averages);
    }
}
