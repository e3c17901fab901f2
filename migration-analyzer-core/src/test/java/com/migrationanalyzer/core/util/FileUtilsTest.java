package com.migrationanalyzer.core.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void findFiles_ordersShallowerFilesFirstThenByPath() throws IOException {
        // Given
        write("b/pom.xml");
        write("pom.xml");
        write("a/z/pom.xml");
        write("a/pom.xml");

        // When
        List<Path> files = FileUtils.findFiles(tempDir, Set.of("pom.xml"), List.of(), 12);

        // Then
        assertThat(files).extracting(path -> FileUtils.relativePath(tempDir, path))
            .containsExactly("pom.xml", "a/pom.xml", "b/pom.xml", "a/z/pom.xml");
    }

    @Test
    void findFiles_skipsExcludedAndHiddenDirectories() throws IOException {
        write("src/Main.java");
        write("target/classes/Generated.java");
        write(".git/hooks/Hook.java");
        write(".hidden/Secret.java");

        List<Path> files = FileUtils.findFiles(tempDir, Set.of("*.java"), List.of("target"), 12);

        assertThat(files).extracting(path -> FileUtils.relativePath(tempDir, path))
            .containsExactly("src/Main.java");
    }

    @Test
    void findFiles_respectsMaxDepth() throws IOException {
        write("one/Shallow.java");
        write("one/two/three/Deep.java");

        List<Path> files = FileUtils.findFiles(tempDir, Set.of("*.java"), List.of(), 2);

        assertThat(files).extracting(path -> path.getFileName().toString())
            .containsExactly("Shallow.java");
    }

    @Test
    void findFiles_matchesAnyOfSeveralPatterns() throws IOException {
        write("build.gradle");
        write("sub/build.gradle.kts");
        write("settings.gradle");

        List<Path> files = FileUtils.findFiles(tempDir, Set.of("build.gradle", "build.gradle.kts"), List.of(), 12);

        assertThat(files).hasSize(2);
    }

    @Test
    void findFiles_withUnreadableDirectory_logsWarningAndContinues() throws IOException {
        // Given: a readable source and a directory without read permission
        assumeTrue(tempDir.getFileSystem().supportedFileAttributeViews().contains("posix"));
        write("src/Main.java");
        write("locked/Hidden.java");
        Path locked = tempDir.resolve("locked");
        Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));

        Logger logger = (Logger) org.slf4j.LoggerFactory.getLogger(FileUtils.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            // running as root ignores permissions
            assumeFalse(Files.isReadable(locked));

            // When
            List<Path> files = FileUtils.findFiles(tempDir, Set.of("*.java"), List.of(), 12);

            // Then: the walk finishes and the skipped directory is logged
            assertThat(files).extracting(path -> FileUtils.relativePath(tempDir, path))
                .containsExactly("src/Main.java");
            assertThat(appender.list)
                .anySatisfy(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.WARN);
                    assertThat(event.getFormattedMessage()).startsWith("Skipping unreadable path locked:");
                });
        } finally {
            logger.detachAppender(appender);
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    @Test
    void relativePath_usesForwardSlashes() {
        Path file = tempDir.resolve("src").resolve("main").resolve("App.java");

        assertThat(FileUtils.relativePath(tempDir, file)).isEqualTo("src/main/App.java");
    }

    @Test
    void readLines_invalidUtf8_throwsMalformedInput() throws IOException {
        Path file = tempDir.resolve("Latin1.java");
        Files.write(file, new byte[] {'c', 'l', 'a', 's', 's', ' ', (byte) 0xC3, (byte) 0x28});

        assertThatThrownBy(() -> FileUtils.readLines(file)).isInstanceOf(MalformedInputException.class);
    }

    private void write(String relativePath) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "x");
    }
}
