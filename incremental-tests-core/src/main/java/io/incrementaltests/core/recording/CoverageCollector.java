package io.incrementaltests.core.recording;

import java.util.Set;

/**
 * Observes which project files a running test executes. Implementations wrap a
 * concrete coverage technology; the engine only calls {@link #start()} and
 * {@link #stop()} around each test, one test at a time.
 */
public interface CoverageCollector extends AutoCloseable {

    /** Discards anything observed so far and starts observing. */
    void start();

    /**
     * Stops observing.
     *
     * @return project-relative paths of the files executed since {@link #start()}
     */
    Set<String> stop();

    @Override
    default void close() {
    }
}
