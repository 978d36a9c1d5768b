package com.studyflow.core.renderer.impl;

import com.studyflow.core.renderer.OutputBundle;
import com.studyflow.core.renderer.OutputDocument;
import com.studyflow.core.renderer.OutputRenderer;
import com.studyflow.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ByteArrayOutputStream buffer;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void render_withoutColors_printsHeadersAndContent() {
        OutputBundle bundle = OutputBundle.of(new OutputDocument("study-top.csv", "Visit,Day", "text/csv"));

        renderer.render(bundle, new RenderContext(".", Map.of("console.colors", "false")));

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertThat(output).contains("Exported 1 document(s)")
            .contains("Document 1/1: study-top.csv")
            .contains("Type: text/csv")
            .contains("Visit,Day")
            .doesNotContain("\u001B[");
    }

    @Test
    void render_withHeadersDisabled_printsOnlyContent() {
        OutputBundle bundle = OutputBundle.of(new OutputDocument("a.md", "body", null));

        renderer.render(bundle, new RenderContext(".",
            Map.of("console.colors", "false", "console.showHeaders", "false", "console.separator", "==")));

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertThat(output).doesNotContain("Document 1/1").contains("body").contains("=".repeat(80));
    }

    @Test
    void render_withColors_emitsAnsiCodes() {
        renderer.render(OutputBundle.of(new OutputDocument("a.md", "body", null)), new RenderContext(".", Map.of()));

        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("\u001B[");
    }

    @Test
    void serviceLoader_discoversBothRenderers() {
        List<String> ids = ServiceLoader.load(OutputRenderer.class).stream()
            .map(provider -> provider.get().getId())
            .toList();

        assertThat(ids).containsExactlyInAnyOrder("filesystem", "console");
    }
}
