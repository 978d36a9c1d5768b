package com.studyflow.core.alignment;

import com.studyflow.core.model.CheckResult;
import com.studyflow.core.model.EndpointProcedureMap;
import com.studyflow.core.model.EndpointTiming;
import com.studyflow.core.model.EndpointType;
import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitEndpointAlignment;
import com.studyflow.core.model.VisitType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link VisitEndpointAlignmentChecker}.
 */
class VisitEndpointAlignmentCheckerTest {

    private VisitEndpointAlignmentChecker checker;
    private EndpointProcedureMap primary;
    private List<Visit> visits;

    @BeforeEach
    void setUp() {
        checker = new VisitEndpointAlignmentChecker();
        primary = new EndpointProcedureMap("ep_1", "HbA1c change", EndpointType.PRIMARY,
            List.of("proc_hba1c"), List.of(), EndpointTiming.all());
        visits = List.of(
            Visit.of("visit_screening", "Screening", -14, VisitType.SCREENING),
            Visit.of("visit_baseline", "Baseline", 0, VisitType.BASELINE).withProcedures(List.of("proc_hba1c")),
            Visit.of("visit_week_12", "Week 12", 84, VisitType.TREATMENT),
            Visit.of("visit_eot", "End of Treatment", 168, VisitType.END_OF_TREATMENT)
                .withProcedures(List.of("proc_hba1c")));
    }

    @Test
    void check_visitWithRequiredProcedure_isAligned() {
        VisitEndpointAlignment alignment = checker.check(visits.get(1), primary);

        assertThat(alignment.aligned()).isTrue();
        assertThat(alignment.missingProcedures()).isEmpty();
    }

    @Test
    void check_treatmentVisitWithoutProcedure_reportsMissing() {
        VisitEndpointAlignment alignment = checker.check(visits.get(2), primary);

        assertThat(alignment.aligned()).isFalse();
        assertThat(alignment.missingProcedures()).containsExactly("proc_hba1c");
        assertThat(alignment.timingCorrect()).isTrue();
    }

    @Test
    void check_screeningVisit_hasIncorrectTiming() {
        VisitEndpointAlignment alignment = checker.check(visits.get(0), primary);

        assertThat(alignment.hasProcedures()).isTrue();
        assertThat(alignment.timingCorrect()).isFalse();
    }

    @Test
    void summarize_countsPairs() {
        List<VisitEndpointAlignment> alignments = checker.checkAll(visits, List.of(primary));

        AlignmentSummary summary = checker.summarize(alignments);

        assertThat(summary.total()).isEqualTo(4);
        assertThat(summary.aligned()).isEqualTo(2);
        assertThat(summary.misaligned()).isEqualTo(2);
        assertThat(summary.alignmentPercentage()).isEqualTo(50.0);
        assertThat(summary.missingProceduresCount()).isEqualTo(1);
        assertThat(summary.timingIssuesCount()).isEqualTo(1);
    }

    @Test
    void byVisitAndByEndpoint_breakDownAlignment() {
        List<VisitEndpointAlignment> alignments = checker.checkAll(visits, List.of(primary));

        assertThat(checker.byVisit(alignments, visits)).extracting(AlignmentBreakdown::aligned)
            .containsExactly(0, 1, 0, 1);
        AlignmentBreakdown endpoint = checker.byEndpoint(alignments, List.of(primary)).get(0);
        assertThat(endpoint.total()).isEqualTo(4);
        assertThat(endpoint.alignmentPercentage()).isEqualTo(50.0);
    }

    @Test
    void suggestProceduresToAdd_listsMissingProceduresPerVisit() {
        List<VisitEndpointAlignment> alignments = checker.checkAll(visits, List.of(primary));

        List<ProcedureAddition> suggestions = checker.suggestProceduresToAdd(alignments, visits, List.of(primary));

        assertThat(suggestions).singleElement().satisfies(s -> {
            assertThat(s.visitId()).isEqualTo("visit_week_12");
            assertThat(s.procedureIds()).containsExactly("proc_hba1c");
            assertThat(s.reason()).isEqualTo("Required for primary endpoint \"HbA1c change\"");
        });
    }

    @Test
    void autoFixAlignment_addsMissingProceduresAndRealigns() {
        // Given
        List<VisitEndpointAlignment> alignments = checker.checkAll(visits, List.of(primary));

        // When
        AlignmentFixResult result = checker.autoFixAlignment(visits, alignments, List.of(primary));

        // Then
        assertThat(result.changesApplied()).isEqualTo(1);
        assertThat(result.updatedVisits().get(2).procedures()).containsExactly("proc_hba1c");
        List<VisitEndpointAlignment> after = checker.checkAll(result.updatedVisits(), List.of(primary));
        assertThat(checker.summarize(after).missingProceduresCount()).isZero();
    }

    @Test
    void validatePrimaryEndpointCoverage_noTreatmentAssessment_reportsError() {
        CheckResult result = checker.validatePrimaryEndpointCoverage(visits, List.of(primary));

        assertThat(result.errors())
            .containsExactly("No treatment visit has procedures for primary endpoint \"HbA1c change\"");
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void validatePrimaryEndpointCoverage_missingBaseline_reportsError() {
        List<Visit> withoutBaseline = List.of(visits.get(2));

        CheckResult result = checker.validatePrimaryEndpointCoverage(withoutBaseline, List.of(primary));

        assertThat(result.errors()).contains("No baseline visit found for primary endpoint \"HbA1c change\"");
        assertThat(result.warnings()).containsExactly("No follow-up visit found for primary endpoint \"HbA1c change\"");
    }
}
