package com.studyflow.core.procedure;

import com.studyflow.core.model.ProcedureCatalogEntry;
import com.studyflow.core.model.ProcedureCategory;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ProcedureCatalog}.
 */
class ProcedureCatalogTest {

    private final ProcedureCatalog catalog = ProcedureCatalog.loadDefault();

    @Test
    void loadDefault_bundledCatalog_isVersionedAndPopulated() {
        assertThat(catalog.version()).isEqualTo("2024.2");
        assertThat(catalog.size()).isGreaterThanOrEqualTo(80);
    }

    @Test
    void findById_knownId_returnsEntryWithSynonymsAndCode() {
        ProcedureCatalogEntry entry = catalog.findById("proc_hba1c").orElseThrow();

        assertThat(entry.name()).isEqualTo("HbA1c");
        assertThat(entry.category()).isEqualTo(ProcedureCategory.EFFICACY);
        assertThat(entry.synonyms()).contains("glycated hemoglobin");
        assertThat(entry.code()).isNotNull();
        assertThat(entry.endpointTypes()).contains("diabetes");
    }

    @Test
    void require_unknownId_throws() {
        assertThatThrownBy(() -> catalog.require("proc_missing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("proc_missing");
    }

    @Test
    void byCategory_returnsOnlyThatCategory() {
        List<ProcedureCatalogEntry> efficacy = catalog.byCategory(ProcedureCategory.EFFICACY);

        assertThat(efficacy).isNotEmpty().allMatch(e -> e.category() == ProcedureCategory.EFFICACY);
    }

    @Test
    void forEndpointType_diabetes_includesGlycemicMarkers() {
        assertThat(catalog.forEndpointType("diabetes")).extracting(ProcedureCatalogEntry::id)
            .contains("proc_hba1c", "proc_fasting_glucose");
    }

    @Test
    void search_matchesNamesAndSynonymsCaseInsensitively() {
        assertThat(catalog.search("GLYCO")).extracting(ProcedureCatalogEntry::id).contains("proc_hba1c");
        assertThat(catalog.search(" ")).isEmpty();
    }

    @Test
    void stats_countsEveryEntryOnce() {
        CatalogStats stats = catalog.stats();

        assertThat(stats.total()).isEqualTo(catalog.size());
        assertThat(stats.byCategory().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(stats.total());
        assertThat(stats.withStandardCodes()).isPositive();
    }

    @Test
    void fromYaml_duplicateIds_throws() {
        String yaml = """
            version: "test"
            entries:
              - id: proc_a
                name: "A"
                category: labs
              - id: proc_a
                name: "A again"
                category: labs
            """;

        assertThatThrownBy(() -> ProcedureCatalog.fromYaml(stream(yaml)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate catalog id");
    }

    @Test
    void fromYaml_minimalDocument_appliesDefaults() throws IOException {
        String yaml = """
            entries:
              - id: proc_a
                name: "A"
                category: vital_signs
            """;

        ProcedureCatalog parsed = ProcedureCatalog.fromYaml(stream(yaml));

        assertThat(parsed.version()).isEqualTo("unversioned");
        ProcedureCatalogEntry entry = parsed.require("proc_a");
        assertThat(entry.category()).isEqualTo(ProcedureCategory.VITAL_SIGNS);
        assertThat(entry.synonyms()).isEmpty();
        assertThat(entry.searchableNames()).containsExactly("A");
    }

    private static ByteArrayInputStream stream(String yaml) {
        return new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
    }
}
