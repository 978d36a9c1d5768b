package com.studyflow.core.visit;

import com.studyflow.core.model.CheckResult;
import com.studyflow.core.model.TreatmentCycle;
import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CycleBuilder}.
 */
class CycleBuilderTest {

    private CycleBuilder builder;
    private List<Visit> visits;

    @BeforeEach
    void setUp() {
        builder = new CycleBuilder();
        visits = List.of(
            Visit.of("visit_baseline", "Baseline", 0, VisitType.BASELINE),
            Visit.of("visit_day_28", "Day 28", 28, VisitType.TREATMENT),
            Visit.of("visit_day_56", "Day 56", 56, VisitType.TREATMENT));
    }

    @Test
    void inferCycleLength_consistentIntervals_returns28() {
        assertThat(builder.inferCycleLength(visits)).hasValue(28);
    }

    @Test
    void inferCycleLength_singleTreatmentVisit_returnsEmpty() {
        List<Visit> single = List.of(Visit.of("t", "Day 28", 28, VisitType.TREATMENT));

        assertThat(builder.inferCycleLength(single)).isEmpty();
    }

    @Test
    void inferCycleLength_irregularIntervals_returnsEmpty() {
        List<Visit> irregular = List.of(
            Visit.of("a", "Day 7", 7, VisitType.TREATMENT),
            Visit.of("b", "Day 21", 21, VisitType.TREATMENT),
            Visit.of("c", "Day 50", 50, VisitType.TREATMENT));

        OptionalInt length = builder.inferCycleLength(irregular);

        assertThat(length).isEmpty();
    }

    @Test
    void buildCycles_inferredLength_coversTreatmentDaysWithoutGaps() {
        // Given
        int length = builder.inferCycleLength(visits).orElseThrow();

        // When
        List<TreatmentCycle> cycles = builder.buildCycles(visits, length);

        // Then
        assertThat(cycles).hasSize(2);
        assertThat(cycles.get(0)).isEqualTo(new TreatmentCycle("cycle_1", 1, 28, 55, 28, List.of("visit_day_28")));
        assertThat(cycles.get(1)).isEqualTo(new TreatmentCycle("cycle_2", 2, 56, 83, 28, List.of("visit_day_56")));
        assertThat(builder.validateCycles(cycles).valid()).isTrue();
    }

    @Test
    void buildCycles_nonPositiveLength_throws() {
        assertThatThrownBy(() -> builder.buildCycles(visits, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("positive");
    }

    @Test
    void buildCycles_noTreatmentVisits_returnsEmpty() {
        assertThat(builder.buildCycles(List.of(visits.get(0)), 28)).isEmpty();
    }

    @Test
    void assignVisitsToCycles_setsCycleNumbersOnCoveredVisits() {
        List<TreatmentCycle> cycles = builder.buildCycles(visits, 28);

        List<Visit> assigned = builder.assignVisitsToCycles(visits, cycles);

        assertThat(assigned).extracting(Visit::cycle).containsExactly(null, 1, 2);
    }

    @Test
    void validateCycles_gapOverlapAndEmptyCycle_reportErrors() {
        List<TreatmentCycle> cycles = List.of(
            new TreatmentCycle("cycle_1", 1, 0, 27, 28, List.of("a")),
            new TreatmentCycle("cycle_2", 2, 35, 62, 28, List.of("b")),
            new TreatmentCycle("cycle_3", 3, 60, 87, 28, List.of()));

        CheckResult result = builder.validateCycles(cycles);

        assertThat(result.errors()).contains(
            "Gap between Cycle 1 and Cycle 2",
            "Overlap between Cycle 2 and Cycle 3",
            "Cycle 3 has no visits");
    }

    @Test
    void summarize_reportsDurationAndVisitsPerCycle() {
        CycleSummary summary = builder.summarize(builder.buildCycles(visits, 28));

        assertThat(summary.totalCycles()).isEqualTo(2);
        assertThat(summary.averageCycleLength()).isEqualTo(28.0);
        assertThat(summary.totalDuration()).isEqualTo(56);
        assertThat(summary.visitsPerCycle()).containsExactly(1, 1);
    }
}
