package com.studyflow.core.export;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TopExporters}.
 */
class TopExportersTest {

    private final TopExporters exporters = TopExporters.discover();

    @Test
    void discover_findsEveryBundledExporter() {
        assertThat(exporters.ids()).containsExactlyInAnyOrder("csv", "markdown", "html", "json", "excel");
    }

    @Test
    void find_isCaseInsensitive() {
        assertThat(exporters.find(" CSV ")).isPresent();
        assertThat(exporters.find(null)).isEmpty();
    }

    @Test
    void require_unknownFormat_listsAvailableFormats() {
        assertThatThrownBy(() -> exporters.require("pdf"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unsupported export format: pdf")
            .hasMessageContaining("csv");
    }

    @Test
    void exporters_haveExtensionsAndDisplayNames() {
        assertThat(exporters.all()).allSatisfy(exporter -> {
            assertThat(exporter.getFileExtension()).isNotBlank().doesNotStartWith(".");
            assertThat(exporter.getDisplayName()).isNotBlank();
        });
    }
}
