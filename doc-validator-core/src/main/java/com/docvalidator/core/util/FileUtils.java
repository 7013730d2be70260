package com.docvalidator.core.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    /**
     * Glob matching every markdown file below a root.
     */
    public static final String MARKDOWN_GLOB = "**.md";

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern starting from a root directory.
     *
     * <p>Results are sorted by path so that corpus order does not depend on
     * file-system iteration order.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern, matched against the path relative to {@code rootPath}
     * @return sorted list of matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(rootPath.relativize(path)))
                .map(path -> path.toAbsolutePath().normalize())
                .sorted(Comparator.comparing(Path::toString))
                .toList();
        }
    }

    /**
     * Finds all markdown files below a directory.
     *
     * @param rootPath root directory
     * @return sorted markdown files
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findMarkdownFiles(Path rootPath) throws IOException {
        return findFiles(rootPath, MARKDOWN_GLOB);
    }

    /**
     * Returns the most likely documentation root below {@code start}.
     *
     * <p>The first existing directory among {@code candidates} wins; if none exists,
     * {@code start} itself is returned.
     *
     * @param start directory to start from
     * @param candidates directory names to try, in order
     * @return documentation root
     */
    public static Path resolveDocsRoot(Path start, List<String> candidates) {
        for (String candidate : candidates) {
            Path candidatePath = start.resolve(candidate);
            if (Files.isDirectory(candidatePath)) {
                return candidatePath;
            }
        }
        return start;
    }

    /**
     * Returns the file name without its extension.
     *
     * @param path file path
     * @return base name, e.g. {@code marker} for {@code docs/marker.md}
     */
    public static String getBaseName(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }
}
