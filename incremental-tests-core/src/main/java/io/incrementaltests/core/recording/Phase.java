package io.incrementaltests.core.recording;

/**
 * Lifecycle phase of a single test as reported by the host runner.
 */
public enum Phase {
    SETUP,
    CALL,
    TEARDOWN
}
