package io.incrementaltests.core.model;

/**
 * Run-level exit status, using the same codes as the JUnit console launcher.
 */
public enum ExitStatus {
    SUCCESS(0),
    TESTS_FAILED(1),
    NO_TESTS_FOUND(2),
    ABORTED(3);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
