package io.incrementaltests.core.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;

/**
 * Finds source roots in single-module and multi-module Gradle/Maven projects.
 *
 * <p>Modules can be nested at any depth (e.g. {@code services/payment/src/test/java}).
 */
public final class SourceRoots {

    private static final Logger log = LoggerFactory.getLogger(SourceRoots.class);

    /** Directories that should never be descended into when searching for modules. */
    private static final Set<String> SKIP_DIRS = Set.of(
            ".git", ".gradle", ".idea", "build", "target", "out", "node_modules"
    );

    private SourceRoots() {
        // utility class
    }

    /**
     * Returns every existing source root for the given directory suffixes, root
     * module first, then sub-modules in walk order.
     *
     * @param projectDir the root project directory
     * @param relativeDirs directory suffixes (e.g. {@code ["src/test/java"]})
     */
    public static List<Path> find(Path projectDir, List<String> relativeDirs) {
        List<Path> roots = new ArrayList<>();
        for (String relativeDir : relativeDirs) {
            roots.addAll(findAllMatchingDirs(projectDir, relativeDir));
        }
        return roots;
    }

    /**
     * Recursively walks the project tree and returns every directory that
     * matches the given relative suffix (e.g. {@code "src/test/java"}).
     *
     * <p>Directories listed in {@link #SKIP_DIRS} are pruned during the walk
     * to avoid scanning build output, VCS metadata, and other irrelevant trees.
     */
    static List<Path> findAllMatchingDirs(Path projectDir, String relativeDir) {
        List<Path> matches = new ArrayList<>();

        Path rootMatch = projectDir.resolve(relativeDir);
        if (Files.isDirectory(rootMatch)) {
            matches.add(rootMatch);
        }
        if (!Files.isDirectory(projectDir)) {
            return matches;
        }

        try {
            Files.walkFileTree(projectDir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    String dirName = dir.getFileName() != null ? dir.getFileName().toString() : "";
                    if (SKIP_DIRS.contains(dirName)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    if (dir.equals(projectDir)) {
                        return FileVisitResult.CONTINUE;
                    }

                    // A matched source tree holds packages, not modules: don't descend into it.
                    Path candidate = dir.resolve(relativeDir);
                    if (Files.isDirectory(candidate)) {
                        matches.add(candidate);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.debug("Skipping unreadable {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Error searching for '{}' under {}: {}", relativeDir, projectDir, e.getMessage());
        }

        log.debug("Found {} directories matching '{}' under {}", matches.size(), relativeDir, projectDir);
        return matches;
    }
}
