package io.incrementaltests.core.report;

import io.incrementaltests.core.selection.SelectionResult;
import io.incrementaltests.core.stability.ChecksumCalculator;
import io.incrementaltests.core.stability.StabilityResult;

import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the one-line, human-readable summary printed at the start of a run.
 */
public final class RunSummary {

    private static final int MAX_FILE_LIST_LENGTH = 100;

    private RunSummary() {
        // utility class
    }

    public static String format(StabilityResult stability, SelectionResult selection, String environment) {
        StringBuilder message = new StringBuilder("incremental-tests: ");
        Set<String> changed = new TreeSet<>(stability.unstableFiles());
        changed.remove(ChecksumCalculator.LIBRARIES);
        Set<String> unchanged = new TreeSet<>(stability.stableFiles());
        unchanged.remove(ChecksumCalculator.LIBRARIES);

        if (changed.isEmpty() && unchanged.isEmpty() && !stability.librariesMiss()) {
            message.append("new database");
        } else {
            String changedList = String.join(", ", changed);
            if (changedList.isEmpty() || changedList.length() > MAX_FILE_LIST_LENGTH) {
                changedList = Integer.toString(changed.size());
            }
            if (stability.librariesMiss()) {
                message.append("libraries changed, ");
            }
            message.append("changed files: ").append(changedList)
                    .append(", unchanged files: ").append(unchanged.size());
        }
        if (selection != null) {
            message.append(", ").append(selection.mode().deselects() ? "skipping " : "not skipping ")
                    .append(selection.deselected().size()).append(" of ")
                    .append(selection.selected().size() + selection.deselected().size()).append(" tests");
        }
        if (!environment.isEmpty()) {
            message.append(", environment: ").append(environment);
        }
        return message.toString();
    }
}
