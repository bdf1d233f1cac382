package io.incrementaltests.core.config;

import io.incrementaltests.core.selection.SelectionMode;

import java.nio.file.Path;
import java.util.List;

/**
 * Configuration for incremental test selection.
 * Immutable value object; build one with the {@link Builder}.
 */
public final class IncrementalTestsConfig {

    private final boolean select;
    private final boolean collect;
    private final boolean forceSelect;
    private final boolean noSelect;
    private final String environmentExpression;
    private final String databaseFile;
    private final boolean worker;
    private final List<String> sourceDirs;
    private final List<String> testDirs;

    private IncrementalTestsConfig(Builder builder) {
        this.select = builder.select;
        this.collect = builder.collect;
        this.forceSelect = builder.forceSelect;
        this.noSelect = builder.noSelect;
        this.environmentExpression = builder.environmentExpression;
        this.databaseFile = builder.databaseFile;
        this.worker = builder.worker;
        this.sourceDirs = List.copyOf(builder.sourceDirs);
        this.testDirs = List.copyOf(builder.testDirs);
    }

    public boolean select() { return select; }
    public boolean collect() { return collect; }
    public boolean forceSelect() { return forceSelect; }
    public boolean noSelect() { return noSelect; }
    public String environmentExpression() { return environmentExpression; }
    public String databaseFile() { return databaseFile; }
    public boolean worker() { return worker; }
    public List<String> sourceDirs() { return sourceDirs; }
    public List<String> testDirs() { return testDirs; }

    /** Whether the engine has anything to do at all this run. */
    public boolean active() {
        return select || collect;
    }

    /**
     * Resolves the selection mode for a run. External name filters (the host
     * runner's own selectors) turn selection off unless {@code forceSelect} asks
     * for both to apply conjunctively.
     *
     * @param externalFiltersPresent whether the host narrowed the run by name
     */
    public SelectionMode selectionMode(boolean externalFiltersPresent) {
        if (!select || noSelect) {
            return SelectionMode.NO_SELECT;
        }
        if (forceSelect) {
            return SelectionMode.FORCE_SELECT;
        }
        return externalFiltersPresent ? SelectionMode.NO_SELECT : SelectionMode.NORMAL;
    }

    /** Resolves the database location under the given project directory. */
    public Path databasePath(Path projectDir) {
        Path resolved = projectDir.resolve(databaseFile).normalize();
        if (!resolved.startsWith(projectDir.normalize())) {
            throw new IllegalArgumentException(
                    "databaseFile '" + databaseFile + "' resolves outside the project directory");
        }
        return resolved;
    }

    /** Creates a builder with sensible defaults. */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean select = true;
        private boolean collect = true;
        private boolean forceSelect = false;
        private boolean noSelect = false;
        private String environmentExpression = "";
        private String databaseFile = ".incrementaltests.db";
        private boolean worker = false;
        private List<String> sourceDirs = List.of("src/main/java");
        private List<String> testDirs = List.of("src/test/java");

        public Builder select(boolean v) { this.select = v; return this; }
        public Builder collect(boolean v) { this.collect = v; return this; }
        public Builder forceSelect(boolean v) { this.forceSelect = v; return this; }
        public Builder noSelect(boolean v) { this.noSelect = v; return this; }
        public Builder worker(boolean v) { this.worker = v; return this; }
        public Builder sourceDirs(List<String> v) { this.sourceDirs = v; return this; }
        public Builder testDirs(List<String> v) { this.testDirs = v; return this; }

        public Builder environmentExpression(String v) {
            this.environmentExpression = v == null ? "" : v;
            return this;
        }

        public Builder databaseFile(String databaseFile) {
            if (databaseFile == null || databaseFile.isBlank()) {
                throw new IllegalArgumentException("databaseFile must not be null or blank");
            }
            String normalized = databaseFile.replace("\\", "/");
            if (normalized.startsWith("../") || normalized.contains("/../")) {
                throw new IllegalArgumentException("databaseFile contains suspicious path traversal: " + databaseFile);
            }
            this.databaseFile = databaseFile;
            return this;
        }

        public IncrementalTestsConfig build() {
            if (forceSelect && noSelect) {
                throw new IllegalArgumentException(
                        "forceSelect and noSelect are contradictory; enable at most one of them");
            }
            if (forceSelect && !select) {
                throw new IllegalArgumentException("forceSelect requires select to be enabled");
            }
            return new IncrementalTestsConfig(this);
        }
    }
}
