package com.docvalidator.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void findMarkdownFiles_recursesAndSortsByPath() throws Exception {
        Files.createDirectories(tempDir.resolve("guides"));
        Files.writeString(tempDir.resolve("marker.md"), "# Marker");
        Files.writeString(tempDir.resolve("guides/setup.md"), "# Setup");
        Files.writeString(tempDir.resolve("notes.txt"), "not markdown");

        List<Path> files = FileUtils.findMarkdownFiles(tempDir);

        assertThat(files).containsExactly(
            tempDir.resolve("guides/setup.md").toAbsolutePath().normalize(),
            tempDir.resolve("marker.md").toAbsolutePath().normalize());
    }

    @Test
    void resolveDocsRoot_prefersFirstExistingCandidate() throws Exception {
        Files.createDirectories(tempDir.resolve("demo-docs"));
        Files.createDirectories(tempDir.resolve("test-docs"));

        assertThat(FileUtils.resolveDocsRoot(tempDir, List.of("docs", "demo-docs", "test-docs")))
            .isEqualTo(tempDir.resolve("demo-docs"));
        assertThat(FileUtils.resolveDocsRoot(tempDir, List.of("docs"))).isEqualTo(tempDir);
    }

    @Test
    void getBaseName_stripsOnlyTheExtension() {
        assertThat(FileUtils.getBaseName(Path.of("docs/terminologie.md"))).isEqualTo("terminologie");
        assertThat(FileUtils.getBaseName(Path.of("docs/guide.v2.md"))).isEqualTo("guide.v2");
        assertThat(FileUtils.getBaseName(Path.of(".hidden"))).isEqualTo(".hidden");
        assertThat(FileUtils.getBaseName(Path.of("README"))).isEqualTo("README");
    }
}
