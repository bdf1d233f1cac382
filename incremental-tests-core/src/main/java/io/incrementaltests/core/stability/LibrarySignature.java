package io.incrementaltests.core.stability;

import java.io.File;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Describes the installed dependency set as one string: the sorted file names of
 * every jar on the class path. Upgrading or adding a library changes it.
 */
public final class LibrarySignature {

    private LibrarySignature() {
        // utility class
    }

    public static String fromClassPath() {
        return of(System.getProperty("java.class.path", ""));
    }

    static String of(String classPath) {
        return Arrays.stream(classPath.split(File.pathSeparator))
                .filter(entry -> entry.endsWith(".jar"))
                .map(entry -> Path.of(entry).getFileName())
                .filter(Objects::nonNull)
                .map(Path::toString)
                .sorted()
                .distinct()
                .collect(Collectors.joining(", "));
    }
}
