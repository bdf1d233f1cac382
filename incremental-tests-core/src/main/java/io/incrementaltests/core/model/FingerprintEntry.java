package io.incrementaltests.core.model;

import java.util.Objects;

/**
 * One file a test touched, with the content checksum it had at the time.
 */
public record FingerprintEntry(String file, String checksum) {

    public FingerprintEntry {
        Objects.requireNonNull(file, "file");
    }
}
