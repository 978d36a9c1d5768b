package com.studyflow.core.validation;

import com.studyflow.core.model.AssessmentSchedule;
import com.studyflow.core.model.EndpointProcedureMap;
import com.studyflow.core.model.EndpointTiming;
import com.studyflow.core.model.EndpointType;
import com.studyflow.core.model.FlowIssue;
import com.studyflow.core.model.IcfDocument;
import com.studyflow.core.model.IssueSeverity;
import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.ProcedureCatalogEntry;
import com.studyflow.core.model.RuleId;
import com.studyflow.core.model.SapDocument;
import com.studyflow.core.model.StudyFlow;
import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitType;
import com.studyflow.core.model.VisitWindow;
import com.studyflow.core.procedure.ProcedureCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FlowValidationEngine} and the rules it runs.
 */
class FlowValidationEngineTest {

    private static final ProcedureCatalog catalog = ProcedureCatalog.loadDefault();

    private FlowValidationEngine engine;
    private Procedure hba1c;
    private List<EndpointProcedureMap> maps;

    @BeforeEach
    void setUp() {
        engine = new FlowValidationEngine(catalog);
        hba1c = catalog.require("proc_hba1c").instantiate(true, List.of("ep_1"));
        maps = List.of(new EndpointProcedureMap("ep_1", "HbA1c change", EndpointType.PRIMARY,
            List.of("proc_hba1c"), List.of(), EndpointTiming.all()));
    }

    private static List<Visit> standardVisits() {
        return new ArrayList<>(List.of(
            Visit.of("visit_screening", "Screening", -14, VisitType.SCREENING).withWindow(VisitWindow.symmetric(3)),
            Visit.of("visit_baseline", "Baseline", 0, VisitType.BASELINE).withWindow(VisitWindow.zero())
                .withProcedures(List.of("proc_hba1c")),
            Visit.of("visit_week_4", "Week 4", 28, VisitType.TREATMENT).withWindow(VisitWindow.symmetric(3)),
            Visit.of("visit_end_of_treatment", "End of Treatment", 84, VisitType.END_OF_TREATMENT)
                .withWindow(VisitWindow.symmetric(3)).withProcedures(List.of("proc_hba1c"))));
    }

    private static StudyFlow flow(List<Visit> visits, List<Procedure> procedures) {
        return new StudyFlow("DIAB-001", visits, procedures, List.of(), null, 84, Map.of());
    }

    @Test
    void validate_completeFlow_reportsNothing() {
        // Given
        StudyFlow flow = flow(standardVisits(), List.of(hba1c));

        // When
        FlowValidationResult result = engine.validate(flow, maps);

        // Then
        assertThat(result.valid()).isTrue();
        assertThat(result.issues()).isEmpty();
        assertThat(result.summary().total()).isZero();
        assertThat(result.byCategory()).isEmpty();
    }

    @Test
    void validate_missingBaseline_reportsCriticalAutoFixableIssue() {
        // Given
        List<Visit> visits = standardVisits();
        visits.removeIf(v -> v.type() == VisitType.BASELINE);
        StudyFlow flow = flow(visits, List.of(hba1c));

        // When
        FlowValidationResult result = engine.validate(flow, maps);

        // Then
        assertThat(result.valid()).isFalse();
        FlowIssue missing = result.issuesForRule(RuleId.MISSING_MANDATORY_VISITS).get(0);
        assertThat(missing.id()).isEqualTo(GlobalRules.MISSING_BASELINE);
        assertThat(missing.severity()).isEqualTo(IssueSeverity.CRITICAL);
        assertThat(missing.autoFixable()).isTrue();
        assertThat(result.issuesForRule(RuleId.INCORRECT_SCHEDULE_FOR_PRIMARY))
            .extracting(FlowIssue::id)
            .containsExactly("NO_BASELINE_ep_1");
        assertThat(result.autoFixableIssueIds()).containsExactly("NO_BASELINE_ep_1", "MISSING_BASELINE");
        assertThat(result.summary().critical()).isEqualTo(2);
    }

    @Test
    void validate_missingEndOfTreatment_suggestsLastTreatmentDay() {
        // Given
        List<Visit> visits = standardVisits();
        visits.removeIf(v -> v.type() == VisitType.END_OF_TREATMENT);
        StudyFlow flow = flow(visits, List.of(hba1c));

        // When
        FlowValidationResult result = engine.validate(flow, maps);

        // Then
        FlowIssue missing = result.issuesForRule(RuleId.MISSING_MANDATORY_VISITS).get(0);
        assertThat(missing.id()).isEqualTo(GlobalRules.MISSING_EOT);
        assertThat(missing.severity()).isEqualTo(IssueSeverity.ERROR);
        assertThat(missing.suggestions().get(0).changes().get(0).visit().day()).isEqualTo(28);
    }

    @Test
    void validate_sameFlowTwice_yieldsIdenticalIssues() {
        // Given
        List<Visit> visits = standardVisits();
        visits.removeIf(v -> v.type() == VisitType.BASELINE);
        StudyFlow flow = flow(visits, List.of());
        SapDocument sap = new SapDocument(6, List.of(28), List.of());

        // When
        FlowValidationResult first = engine.validate(flow, maps, null, sap);
        FlowValidationResult second = engine.validate(flow, maps, null, sap);

        // Then
        assertThat(second).isEqualTo(first);
        assertThat(first.issues()).extracting(FlowIssue::code).isSortedAccordingTo(Comparator.naturalOrder());
    }

    @Test
    void validate_missingPrimaryProcedure_reportsMissingAssessment() {
        StudyFlow flow = flow(standardVisits(), List.of());

        FlowValidationResult result = engine.validate(flow, maps);

        FlowIssue issue = result.issuesForRule(RuleId.MISSING_ASSESSMENT_FOR_ENDPOINT).get(0);
        assertThat(issue.id()).isEqualTo("MISSING_ASSESSMENT_ep_1");
        assertThat(issue.severity()).isEqualTo(IssueSeverity.CRITICAL);
        assertThat(issue.affectedProcedures()).containsExactly("proc_hba1c");
        assertThat(issue.autoFixable()).isTrue();
    }

    @Test
    void validate_largeWindow_reportsUnsupportedTiming() {
        // Given
        List<Visit> visits = standardVisits();
        visits.set(2, visits.get(2).withWindow(VisitWindow.symmetric(10)));
        StudyFlow flow = flow(visits, List.of(hba1c));

        // When
        FlowValidationResult result = engine.validate(flow, maps);

        // Then
        assertThat(result.valid()).isTrue();
        FlowIssue issue = result.issuesForRule(RuleId.UNSUPPORTED_VISIT_TIMING).get(0);
        assertThat(issue.id()).isEqualTo("UNSUPPORTED_VISIT_TIMING_visit_week_4");
        assertThat(issue.severity()).isEqualTo(IssueSeverity.WARNING);
        assertThat(issue.details()).contains("±10/10 days", "71% of the visit day");
        assertThat(issue.suggestions().get(0).changes().get(0).window()).isEqualTo(VisitWindow.symmetric(3));
    }

    @Test
    void validate_visitsTwoDaysApart_reportsInfo() {
        List<Visit> visits = standardVisits();
        visits.add(Visit.of("visit_day_2", "Day 2", 2, VisitType.TREATMENT));
        StudyFlow flow = flow(visits, List.of(hba1c));

        FlowValidationResult result = engine.validate(flow, maps);

        assertThat(result.issuesBySeverity(IssueSeverity.INFO))
            .extracting(FlowIssue::id)
            .containsExactly("VISITS_TOO_CLOSE_visit_baseline_visit_day_2");
    }

    @Test
    void validate_unscheduledVisitCloseToOthers_isIgnored() {
        List<Visit> visits = standardVisits();
        visits.add(Visit.of("visit_unscheduled", "Unscheduled", 1, VisitType.UNSCHEDULED).withRequired(false));
        StudyFlow flow = flow(visits, List.of(hba1c));

        FlowValidationResult result = engine.validate(flow, maps);

        assertThat(result.issues()).isEmpty();
    }

    @Test
    void validate_icfWithoutInvasiveProcedure_reportsDisclosureAndRisks() {
        // Given
        Procedure biopsy = catalog.require("proc_liver_biopsy").instantiate(false, List.of());
        StudyFlow flow = flow(standardVisits(), List.of(hba1c, biopsy));
        IcfDocument icf = new IcfDocument(List.of("Blood sampling for HbA1c"), List.of(),
            List.of("screening", "baseline", "week 4", "end of treatment"));

        // When
        FlowValidationResult result = engine.validate(flow, maps, icf, null);

        // Then
        assertThat(result.issues())
            .extracting(FlowIssue::id)
            .containsExactly("PROCEDURE_NOT_IN_ICF_proc_liver_biopsy", "RISKS_NOT_DESCRIBED");
        assertThat(result.issuesForRule(RuleId.RISKS_NOT_DESCRIBED).get(0).severity())
            .isEqualTo(IssueSeverity.CRITICAL);
        assertThat(result.byCategory()).containsOnlyKeys("procedure");
    }

    @Test
    void validate_icfMentioningProcedureAndRisks_isClean() {
        Procedure biopsy = catalog.require("proc_liver_biopsy").instantiate(false, List.of());
        StudyFlow flow = flow(standardVisits(), List.of(hba1c, biopsy));
        IcfDocument icf = new IcfDocument(List.of("A liver biopsy will be taken at baseline"),
            List.of("Bleeding after biopsy"), List.of("v1", "v2", "v3"));

        FlowValidationResult result = engine.validate(flow, maps, icf, null);

        assertThat(result.issues()).isEmpty();
    }

    @Test
    void validate_icfWithoutVisitSchedule_warns() {
        StudyFlow flow = flow(standardVisits(), List.of(hba1c));
        IcfDocument icf = new IcfDocument(List.of(), List.of(), List.of());

        FlowValidationResult result = engine.validate(flow, maps, icf, null);

        assertThat(result.issues()).extracting(FlowIssue::id).containsExactly("VISIT_MISSING_IN_ICF");
        assertThat(result.issues().get(0).details()).contains("4 visits");
    }

    @Test
    void validate_sapDisagreement_reportsTimingDriftIntegrityAndCycles() {
        // Given
        StudyFlow flow = flow(standardVisits(), List.of(hba1c));
        SapDocument sap = new SapDocument(6, List.of(28), List.of());

        // When
        FlowValidationResult result = engine.validate(flow, maps, null, sap);

        // Then
        assertThat(result.issues())
            .extracting(FlowIssue::id)
            .containsExactly("ENDPOINT_TIMING_DRIFT_ep_1", "FLOW_INTEGRITY_DRIFT_PROTOCOL_SAP",
                "CYCLES_INCONSISTENT_COUNT");
        FlowIssue drift = result.issues().get(0);
        assertThat(drift.severity()).isEqualTo(IssueSeverity.CRITICAL);
        assertThat(drift.suggestions().get(0).changes().get(0).schedule().visitIds())
            .containsExactly("visit_baseline", "visit_week_4");
    }

    @Test
    void validate_sapWithSchedule_isClean() {
        StudyFlow flow = flow(standardVisits(), List.of(hba1c));
        SapDocument sap = new SapDocument(4, List.of(),
            List.of(new AssessmentSchedule("ep_1", List.of("visit_baseline", "visit_end_of_treatment"))));

        FlowValidationResult result = engine.validate(flow, maps, null, sap);

        assertThat(result.issues()).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(value = RuleId.class, names = {"PROCEDURE_NOT_IN_ICF", "RISKS_NOT_DESCRIBED",
        "VISIT_MISSING_IN_ICF", "ENDPOINT_TIMING_DRIFT", "CYCLES_INCONSISTENT"})
    void ruleFor_documentRuleWithoutDocuments_reportsNothing(RuleId rule) {
        Procedure biopsy = catalog.require("proc_liver_biopsy").instantiate(false, List.of());
        ValidationContext context = new ValidationContext(flow(standardVisits(), List.of(biopsy)), maps,
            null, null, catalog.entries().stream().map(ProcedureCatalogEntry::id).collect(Collectors.toSet()),
            null);

        assertThat(FlowValidationEngine.ruleFor(rule).evaluate(context)).isEmpty();
    }

    @Test
    void severity_isBlocking_onlyForCriticalAndError() {
        assertThat(IssueSeverity.CRITICAL.isBlocking()).isTrue();
        assertThat(IssueSeverity.ERROR.isBlocking()).isTrue();
        assertThat(IssueSeverity.WARNING.isBlocking()).isFalse();
        assertThat(IssueSeverity.INFO.isBlocking()).isFalse();
    }
}
