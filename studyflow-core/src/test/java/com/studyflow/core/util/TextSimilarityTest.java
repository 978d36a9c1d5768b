package com.studyflow.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TextSimilarity}.
 */
class TextSimilarityTest {

    @Test
    void normalize_stripsPunctuationAndCollapsesSpaces() {
        assertThat(TextSimilarity.normalize("  Blood-Pressure,  (sitting) ")).isEqualTo("blood pressure sitting");
        assertThat(TextSimilarity.normalize("Артериальное ДАВЛЕНИЕ")).isEqualTo("артериальное давление");
        assertThat(TextSimilarity.normalize(null)).isEmpty();
    }

    @Test
    void tokens_dropsStopWords() {
        assertThat(TextSimilarity.tokens("Change from baseline in the HbA1c"))
            .containsExactlyInAnyOrder("change", "baseline", "hba1c");
    }

    @Test
    void jaccard_partialOverlap_isShareOfUnion() {
        assertThat(TextSimilarity.jaccard("blood pressure", "blood glucose")).isEqualTo(1.0 / 3);
        assertThat(TextSimilarity.jaccard("", "")).isEqualTo(1.0);
    }

    @Test
    void cosine_identicalAndDisjointTexts() {
        assertThat(TextSimilarity.cosine("ecg", "ECG")).isCloseTo(1.0, within(1e-9));
        assertThat(TextSimilarity.cosine("ab", "cd")).isZero();
        assertThat(TextSimilarity.cosine("ab", "")).isZero();
    }

    @Test
    void levenshtein_classicExamples() {
        assertThat(TextSimilarity.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(TextSimilarity.levenshtein("", "abc")).isEqualTo(3);
        assertThat(TextSimilarity.levenshteinSimilarity("hemoglobin", "hemglobin")).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void combined_weightsEachMetric() {
        double score = TextSimilarity.combined("blood pressure", "blood pressure", 0.3, 0.4, 0.3);

        assertThat(score).isCloseTo(1.0, within(1e-9));
        assertThat(TextSimilarity.combined("blood pressure", "blood glucose", 1.0, 0.0, 0.0)).isEqualTo(1.0 / 3);
    }
}
