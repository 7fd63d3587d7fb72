package com.flowscribe.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DiagramFiles}.
 */
class DiagramFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void findFiles_recursivePattern_includesRootAndNestedFilesSorted() throws IOException {
        Files.createDirectories(tempDir.resolve("b/nested"));
        Files.writeString(tempDir.resolve("z.graphml"), "");
        Files.writeString(tempDir.resolve("b/nested/a.graphml"), "");
        Files.writeString(tempDir.resolve("b/notes.txt"), "");

        List<Path> files = DiagramFiles.findFiles(tempDir, "**/*.graphml");

        assertThat(files).containsExactly(
            tempDir.resolve("b/nested/a.graphml"),
            tempDir.resolve("z.graphml"));
    }

    @Test
    void findFiles_noMatches_returnsEmptyList() throws IOException {
        Files.writeString(tempDir.resolve("readme.md"), "");

        assertThat(DiagramFiles.findFiles(tempDir, "**/*.graphml")).isEmpty();
    }

    @Test
    void getExtension_returnsLowercaseExtension() {
        assertThat(DiagramFiles.getExtension(Path.of("Login.GraphML"))).isEqualTo("graphml");
        assertThat(DiagramFiles.getExtension(Path.of("Makefile"))).isEmpty();
    }
}
