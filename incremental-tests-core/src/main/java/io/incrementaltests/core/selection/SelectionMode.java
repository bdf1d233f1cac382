package io.incrementaltests.core.selection;

/**
 * How the selector treats stable tests.
 */
public enum SelectionMode {
    /** Run unstable and previously failing tests, skip the rest. */
    NORMAL,
    /** As {@link #NORMAL}, with the host's own name filters still applied. */
    FORCE_SELECT,
    /** Run everything, still ordered. */
    NO_SELECT;

    public boolean deselects() {
        return this != NO_SELECT;
    }
}
