package com.flowscribe.core.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * File helpers for locating diagram files.
 */
public final class DiagramFiles {

    private DiagramFiles() {
        // Utility class
    }

    /**
     * Finds files below a root directory matching a glob pattern, sorted by path.
     *
     * <p>A pattern starting with {@code **}{@code /} also matches files directly in the root,
     * so {@code **}{@code /*.graphml} finds {@code root/a.graphml} as well as
     * {@code root/sub/b.graphml}.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern evaluated against the path relative to the root
     * @return matching regular files in path order
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);
        PathMatcher rootMatcher = globPattern.startsWith("**/")
            ? FileSystems.getDefault().getPathMatcher("glob:" + globPattern.substring(3))
            : matcher;

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> {
                    Path relativePath = rootPath.relativize(path);
                    return matcher.matches(relativePath) || rootMatcher.matches(relativePath);
                })
                .sorted()
                .toList();
        }
    }

    /**
     * Gets the file extension in lower case.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
