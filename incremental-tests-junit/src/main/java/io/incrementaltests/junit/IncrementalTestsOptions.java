package io.incrementaltests.junit;

import io.incrementaltests.core.config.IncrementalTestsConfig;
import org.junit.platform.engine.ConfigurationParameters;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reads the incremental-tests options from JUnit Platform configuration
 * parameters, falling back to system properties.
 *
 * <p>Unset keys keep the {@link IncrementalTestsConfig} defaults.
 */
public final class IncrementalTestsOptions {

    public static final String ENABLED = "incrementaltests.enabled";
    public static final String SELECT = "incrementaltests.select";
    public static final String FORCE_SELECT = "incrementaltests.forceSelect";
    public static final String NO_SELECT = "incrementaltests.noSelect";
    public static final String NO_COLLECT = "incrementaltests.noCollect";
    public static final String ENVIRONMENT = "incrementaltests.environment";
    public static final String DATABASE = "incrementaltests.database";
    public static final String WORKER = "incrementaltests.worker";
    public static final String TEST_DIRS = "incrementaltests.testDirs";
    public static final String SOURCE_DIRS = "incrementaltests.sourceDirs";

    private final Function<String, Optional<String>> lookup;

    private IncrementalTestsOptions(Function<String, Optional<String>> lookup) {
        this.lookup = lookup;
    }

    public static IncrementalTestsOptions from(Map<String, String> parameters) {
        Map<String, String> copy = Map.copyOf(parameters);
        return new IncrementalTestsOptions(key -> Optional.ofNullable(copy.get(key))
                .or(() -> Optional.ofNullable(System.getProperty(key))));
    }

    public static IncrementalTestsOptions from(ConfigurationParameters parameters) {
        return new IncrementalTestsOptions(parameters::get);
    }

    public static IncrementalTestsOptions fromSystemProperties() {
        return from(Map.of());
    }

    /** {@code false} turns the runner into a plain launcher. Defaults to {@code true}. */
    public boolean enabled() {
        return bool(ENABLED).orElse(true);
    }

    /**
     * Builds the engine configuration.
     *
     * @throws IllegalArgumentException if the options contradict each other
     */
    public IncrementalTestsConfig config() {
        IncrementalTestsConfig.Builder builder = IncrementalTestsConfig.builder();
        bool(SELECT).ifPresent(builder::select);
        bool(FORCE_SELECT).ifPresent(builder::forceSelect);
        bool(NO_SELECT).ifPresent(builder::noSelect);
        bool(NO_COLLECT).ifPresent(noCollect -> builder.collect(!noCollect));
        bool(WORKER).ifPresent(builder::worker);
        value(ENVIRONMENT).ifPresent(builder::environmentExpression);
        value(DATABASE).ifPresent(builder::databaseFile);
        list(TEST_DIRS).ifPresent(builder::testDirs);
        list(SOURCE_DIRS).ifPresent(builder::sourceDirs);
        return builder.build();
    }

    private Optional<String> value(String key) {
        return lookup.apply(key).map(String::trim);
    }

    private Optional<Boolean> bool(String key) {
        return value(key).filter(v -> !v.isEmpty()).map(Boolean::parseBoolean);
    }

    private Optional<List<String>> list(String key) {
        return value(key)
                .map(v -> Arrays.stream(v.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .collect(Collectors.toList()))
                .filter(dirs -> !dirs.isEmpty());
    }
}
