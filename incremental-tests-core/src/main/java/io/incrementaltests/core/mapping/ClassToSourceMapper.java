package io.incrementaltests.core.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps class names to the project-relative path of the source file declaring them.
 * Accepts binary names ({@code com.example.Foo$Bar}) and VM names
 * ({@code com/example/Foo$Bar}); nested classes map to their top-level class's file.
 */
public final class ClassToSourceMapper {

    private static final Logger log = LoggerFactory.getLogger(ClassToSourceMapper.class);

    private final Path projectDir;
    private final List<String> sourceDirs;
    private final Map<String, Optional<String>> cache = new HashMap<>();
    private List<Path> roots;

    public ClassToSourceMapper(Path projectDir, List<String> sourceDirs) {
        this.projectDir = projectDir.toAbsolutePath().normalize();
        this.sourceDirs = List.copyOf(sourceDirs);
    }

    /**
     * Returns the project-relative source file of the class, or empty when no
     * configured source root contains it (library and JDK classes).
     */
    public synchronized Optional<String> sourceFileOf(String className) {
        String topLevel = topLevelClassName(className);
        return cache.computeIfAbsent(topLevel, this::locate);
    }

    /**
     * Source path relative to a source root, e.g. {@code com/example/Foo.java}
     * for {@code com.example.Foo$Bar}.
     */
    public static String relativeSourcePath(String className) {
        return topLevelClassName(className).replace('.', '/') + ".java";
    }

    /** {@code com.example.Foo} for {@code com/example/Foo$Bar$1}. */
    public static String topLevelClassName(String className) {
        String binary = className.replace('/', '.');
        int nested = binary.indexOf('$');
        return nested >= 0 ? binary.substring(0, nested) : binary;
    }

    /** Path string with forward slashes, relative to the project directory. */
    public String relativize(Path file) {
        return projectDir.relativize(file.toAbsolutePath().normalize()).toString()
                .replace(java.io.File.separatorChar, '/');
    }

    private Optional<String> locate(String topLevel) {
        if (roots == null) {
            roots = SourceRoots.find(projectDir, sourceDirs);
        }
        String relative = relativeSourcePath(topLevel);
        for (Path root : roots) {
            Path candidate = root.resolve(relative);
            if (Files.isRegularFile(candidate)) {
                String file = relativize(candidate);
                log.debug("Mapped class {} → {}", topLevel, file);
                return Optional.of(file);
            }
        }
        return Optional.empty();
    }
}
