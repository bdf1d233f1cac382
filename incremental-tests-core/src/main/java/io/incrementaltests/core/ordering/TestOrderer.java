package io.incrementaltests.core.ordering;

import io.incrementaltests.core.model.NodeId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders tests so that fast modules run first, then fast classes within a module,
 * then fast tests within a class. Ties keep the input order, so identical inputs
 * always produce the identical sequence.
 *
 * <p>Modules and classes with equal averages are kept apart by the position of
 * their first test, so the tests of one class always stay contiguous.
 */
public final class TestOrderer {

    private final DurationStatistics statistics;

    public TestOrderer(DurationStatistics statistics) {
        this.statistics = statistics;
    }

    public List<NodeId> order(Collection<NodeId> tests) {
        List<NodeId> ordered = new ArrayList<>(tests);
        ordered.sort(comparator(ordered));
        return ordered;
    }

    /**
     * Composite key (module average, module position, class average, class
     * position, test average); {@link List#sort} is stable.
     */
    private Comparator<NodeId> comparator(List<NodeId> input) {
        Map<String, Integer> modulePosition = new HashMap<>();
        Map<String, Integer> classPosition = new HashMap<>();
        for (int i = 0; i < input.size(); i++) {
            NodeId id = input.get(i);
            modulePosition.putIfAbsent(id.moduleKey(), i);
            classPosition.putIfAbsent(classKey(id), i);
        }
        return Comparator.<NodeId>comparingDouble(statistics::moduleAverage)
                .thenComparingInt(id -> modulePosition.get(id.moduleKey()))
                .thenComparingDouble(statistics::classAverage)
                .thenComparingInt(id -> classPosition.get(classKey(id)))
                .thenComparingDouble(statistics::nodeAverage);
    }

    private static String classKey(NodeId id) {
        return id.classKey().orElse(id.moduleKey());
    }
}
