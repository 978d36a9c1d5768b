package com.studyflow.core.procedure;

import com.studyflow.core.model.ProcedureMappingResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ProcedureMapper}.
 */
class ProcedureMapperTest {

    private static ProcedureCatalog catalog;

    private ProcedureMapper mapper;

    @BeforeAll
    static void loadCatalog() {
        catalog = ProcedureCatalog.loadDefault();
    }

    @BeforeEach
    void setUp() {
        mapper = new ProcedureMapper(catalog);
    }

    @ParameterizedTest
    @CsvSource({
        "HbA1c, proc_hba1c",
        "hba1c, proc_hba1c",
        "glycated hemoglobin, proc_hba1c",
        "Гликированный гемоглобин, proc_hba1c",
        "fasting blood sugar, proc_fasting_glucose",
        "ECG, proc_ecg_12lead"
    })
    void map_exactNameOrSynonym_returnsFullConfidence(String text, String expectedId) {
        ProcedureMappingResult result = mapper.map(text);

        assertThat(result.matched()).isTrue();
        assertThat(result.matchedProcedure().id()).isEqualTo(expectedId);
        assertThat(result.confidence()).isEqualTo(1.0);
        assertThat(result.lowConfidence()).isFalse();
        assertThat(result.alternatives()).isEmpty();
    }

    @Test
    void map_misspelledSynonym_matchesFuzzilyAboveLowConfidenceThreshold() {
        // When
        ProcedureMappingResult result = mapper.map("glycated hemglobin");

        // Then
        assertThat(result.matchedProcedure().id()).isEqualTo("proc_hba1c");
        assertThat(result.confidence()).isGreaterThanOrEqualTo(0.7).isLessThan(1.0);
        assertThat(result.lowConfidence()).isFalse();
        assertThat(result.originalText()).isEqualTo("glycated hemglobin");
    }

    @Test
    void map_typo_reportsRunnerUpAlternatives() {
        ProcedureMappingResult result = mapper.map("blood presure");

        assertThat(result.matchedProcedure().id()).isEqualTo("proc_blood_pressure");
        assertThat(result.alternatives()).isNotEmpty().hasSizeLessThanOrEqualTo(2);
        assertThat(result.alternatives().get(0).confidence()).isLessThanOrEqualTo(result.confidence());
    }

    @Test
    void map_weakMatch_isFlaggedLowConfidence() {
        ProcedureMappingResult result = mapper.map("Physical exam");

        assertThat(result.matchedProcedure().id()).isEqualTo("proc_physical_exam");
        assertThat(result.confidence()).isGreaterThan(0.5).isLessThan(0.7);
        assertThat(result.lowConfidence()).isTrue();
    }

    @Test
    void map_unknownText_returnsNoMatch() {
        ProcedureMappingResult result = mapper.map("xyzzy");

        assertThat(result.matched()).isFalse();
        assertThat(result.confidence()).isZero();
        assertThat(result.alternatives()).isEmpty();
    }

    @Test
    void map_blankText_returnsNoMatch() {
        assertThat(mapper.map("   ").matched()).isFalse();
        assertThat(mapper.map(null).matched()).isFalse();
    }

    @Test
    void extractFromText_protocolProse_returnsDistinctConfidentMatches() {
        // Given
        String text = "Blood pressure, ECG; HbA1c\nxy, glycated hemoglobin, unknown thing";

        // When
        List<ProcedureMappingResult> results = mapper.extractFromText(text);

        // Then
        assertThat(results).extracting(r -> r.matchedProcedure().id())
            .containsExactly("proc_blood_pressure", "proc_ecg_12lead", "proc_hba1c");
    }

    @Test
    void extractFromText_null_returnsEmpty() {
        assertThat(mapper.extractFromText(null)).isEmpty();
    }

    @Test
    void validate_lowConfidenceMatch_isInvalidWithWarning() {
        MappingValidation validation = mapper.validate(mapper.map("Physical exam"));

        assertThat(validation.valid()).isFalse();
        assertThat(validation.warnings()).anyMatch(w -> w.startsWith("Low confidence match"));
    }

    @Test
    void validate_noMatch_isInvalid() {
        MappingValidation validation = mapper.validate(mapper.map("xyzzy"));

        assertThat(validation.valid()).isFalse();
        assertThat(validation.warnings()).containsExactly("No match found for \"xyzzy\"");
    }

    @Test
    void validate_exactMatch_isValidWithoutWarnings() {
        MappingValidation validation = mapper.validate(mapper.map("HbA1c"));

        assertThat(validation.valid()).isTrue();
        assertThat(validation.warnings()).isEmpty();
    }

    @Test
    void stats_bucketsByConfidence() {
        List<ProcedureMappingResult> results = mapper.mapAll(
            List.of("HbA1c", "glycated hemglobin", "Physical exam", "xyzzy"));

        MappingStats stats = ProcedureMapper.stats(results);

        assertThat(stats.total()).isEqualTo(4);
        assertThat(stats.matched()).isEqualTo(3);
        assertThat(stats.highConfidence()).isEqualTo(1);
        assertThat(stats.mediumConfidence()).isEqualTo(2);
        assertThat(stats.lowConfidence()).isZero();
        assertThat(stats.unmatched()).isEqualTo(1);
    }
}
