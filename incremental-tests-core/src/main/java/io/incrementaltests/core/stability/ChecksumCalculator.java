package io.incrementaltests.core.stability;

import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectInserter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Computes content checksums of project files as git blob ids, so a checksum
 * matches what {@code git hash-object} prints for the same content.
 *
 * <p>Results are memoized for the lifetime of the instance, which is one run:
 * every reader within a run sees the same checksum for a file.
 */
public final class ChecksumCalculator {

    private static final Logger log = LoggerFactory.getLogger(ChecksumCalculator.class);

    /** Pseudo-file standing for the set of libraries on the class path. */
    public static final String LIBRARIES = "<libraries>";

    private final Path projectDir;
    private final String librariesChecksum;
    private final Map<String, Optional<String>> cache = new HashMap<>();

    public ChecksumCalculator(Path projectDir, String librarySignature) {
        this.projectDir = projectDir.toAbsolutePath().normalize();
        this.librariesChecksum = checksumOf(librarySignature.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns the current checksum of a project-relative file, or empty when the
     * file does not exist, cannot be read or lies outside the project.
     */
    public synchronized Optional<String> checksum(String file) {
        if (LIBRARIES.equals(file)) {
            return Optional.of(librariesChecksum);
        }
        return cache.computeIfAbsent(file, this::compute);
    }

    public String librariesChecksum() {
        return librariesChecksum;
    }

    /** Drops memoized checksums, e.g. after the sources were rewritten between runs. */
    public synchronized void invalidate() {
        cache.clear();
    }

    /** Git blob id of the given content. */
    public static String checksumOf(byte[] content) {
        try (ObjectInserter.Formatter formatter = new ObjectInserter.Formatter()) {
            return formatter.idFor(Constants.OBJ_BLOB, content).getName();
        }
    }

    private Optional<String> compute(String file) {
        Path path = projectDir.resolve(file).normalize();
        if (!path.startsWith(projectDir)) {
            log.warn("Ignoring '{}': resolves outside the project directory.", file);
            return Optional.empty();
        }
        try {
            return Optional.of(checksumOf(Files.readAllBytes(path)));
        } catch (NoSuchFileException e) {
            log.debug("  Missing: {}", file);
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Unable to read {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
