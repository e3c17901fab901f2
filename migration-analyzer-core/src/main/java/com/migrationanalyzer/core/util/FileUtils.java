package com.migrationanalyzer.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private static final Logger log = LoggerFactory.getLogger(FileUtils.class);

    private static final Comparator<String> SHALLOWEST_FIRST = Comparator
        .comparingInt((String path) -> path.split("/").length)
        .thenComparing(Comparator.<String>naturalOrder());

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files whose file name matches any of the glob patterns.
     *
     * <p>Directories named in {@code excludedDirectories} and hidden directories (leading dot)
     * are not descended into. The result is ordered shallower first, then by relative path, so
     * repeated walks of the same tree yield the same list. Directories and files that cannot be
     * read are logged at WARN and left out.
     *
     * @param rootPath root directory to search from
     * @param fileNamePatterns file name glob patterns (e.g. {@code *.java}, {@code pom.xml})
     * @param excludedDirectories directory names to skip
     * @param maxDepth maximum directory depth below the root
     * @return list of matching paths
     * @throws IOException if the root cannot be walked
     */
    public static List<Path> findFiles(Path rootPath, Set<String> fileNamePatterns,
                                       Collection<String> excludedDirectories, int maxDepth) throws IOException {
        List<PathMatcher> matchers = fileNamePatterns.stream()
            .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
            .toList();
        Set<String> excluded = Set.copyOf(excludedDirectories);
        List<Path> found = new ArrayList<>();

        Files.walkFileTree(rootPath, EnumSet.noneOf(FileVisitOption.class), maxDepth, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(rootPath)) {
                    return FileVisitResult.CONTINUE;
                }
                String name = dir.getFileName().toString();
                if (name.startsWith(".") || excluded.contains(name)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    Path fileName = file.getFileName();
                    if (matchers.stream().anyMatch(matcher -> matcher.matches(fileName))) {
                        found.add(file);
                    }
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Skipping unreadable path {}: {}", relativePath(rootPath, file), exc.toString());
                return FileVisitResult.CONTINUE;
            }
        });

        found.sort(Comparator.comparing(path -> relativePath(rootPath, path), SHALLOWEST_FIRST));
        return List.copyOf(found);
    }

    /**
     * Returns the path of a file relative to a root, always with forward slashes.
     *
     * @param rootPath root directory
     * @param file file below the root
     * @return relative path string
     */
    public static String relativePath(Path rootPath, Path file) {
        return rootPath.relativize(file).toString().replace('\\', '/');
    }

    /**
     * Reads all lines from a file as strict UTF-8.
     *
     * <p>Malformed input raises {@link java.nio.charset.MalformedInputException}, which callers
     * treat as an unreadable file.
     *
     * @param path path to file
     * @return list of lines
     * @throws IOException if reading or decoding fails
     */
    public static List<String> readLines(Path path) throws IOException {
        return Files.readAllLines(path, StandardCharsets.UTF_8);
    }

    /**
     * Reads a file as a UTF-8 string.
     *
     * @param path path to file
     * @return file content as string
     * @throws IOException if reading fails
     */
    public static String readString(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }
}
