package com.studyflow.core.renderer.impl;

import com.studyflow.core.renderer.OutputBundle;
import com.studyflow.core.renderer.OutputDocument;
import com.studyflow.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withMultipleDocuments_writesAllFiles() throws IOException {
        // Given
        OutputBundle bundle = OutputBundle.of(
            new OutputDocument("study-top.csv", "Visit,Day", "text/csv"),
            new OutputDocument("study-top.md", "| Visit |", "text/markdown"));

        // When
        renderer.render(bundle, new RenderContext(tempDir.toString(), Map.of()));

        // Then
        assertThat(Files.readString(tempDir.resolve("study-top.csv"))).isEqualTo("Visit,Day");
        assertThat(Files.readString(tempDir.resolve("study-top.md"))).isEqualTo("| Visit |");
    }

    @Test
    void render_withNestedPath_createsDirectoryStructure() throws IOException {
        OutputBundle bundle = OutputBundle.of(new OutputDocument("top/phase2/study.csv", "x", null));

        renderer.render(bundle, new RenderContext(tempDir.resolve("out").toString(), Map.of()));

        assertThat(tempDir.resolve("out/top/phase2/study.csv")).exists();
    }

    @Test
    void render_withOverwriteDisabled_keepsExistingFile() throws IOException {
        // Given
        Path existing = tempDir.resolve("study-top.csv");
        Files.writeString(existing, "original");
        OutputBundle bundle = OutputBundle.of(new OutputDocument("study-top.csv", "replacement", "text/csv"));

        // When
        renderer.render(bundle, new RenderContext(tempDir.toString(), Map.of("filesystem.overwrite", "false")));

        // Then
        assertThat(Files.readString(existing)).isEqualTo("original");
    }

    @Test
    void render_withEscapingPath_throws() {
        OutputBundle bundle = OutputBundle.of(new OutputDocument("../outside.csv", "x", null));
        RenderContext context = new RenderContext(tempDir.resolve("out").toString(), Map.of());

        assertThatThrownBy(() -> renderer.render(bundle, context))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("escapes output directory");
    }
}
