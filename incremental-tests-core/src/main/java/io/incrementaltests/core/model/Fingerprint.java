package io.incrementaltests.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The set of files a test depends on, each pinned to a checksum. At most one
 * entry per file; a later entry for the same file wins.
 *
 * <p>Fingerprints are replaced wholesale whenever a test executes, never merged.
 */
public final class Fingerprint {

    private static final Fingerprint EMPTY = new Fingerprint(Map.of());

    private final Map<String, FingerprintEntry> entries;

    private Fingerprint(Map<String, FingerprintEntry> entries) {
        this.entries = entries;
    }

    public static Fingerprint empty() {
        return EMPTY;
    }

    public static Fingerprint of(Collection<FingerprintEntry> entries) {
        if (entries.isEmpty()) {
            return EMPTY;
        }
        Map<String, FingerprintEntry> byFile = new LinkedHashMap<>();
        for (FingerprintEntry entry : entries) {
            byFile.put(entry.file(), entry);
        }
        return new Fingerprint(Collections.unmodifiableMap(byFile));
    }

    public static Fingerprint of(FingerprintEntry... entries) {
        return of(List.of(entries));
    }

    public Collection<FingerprintEntry> entries() {
        return entries.values();
    }

    public Set<String> files() {
        return entries.keySet();
    }

    public Optional<String> checksumOf(String file) {
        FingerprintEntry entry = entries.get(file);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.checksum());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Fingerprint other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Fingerprint" + entries.values();
    }
}
