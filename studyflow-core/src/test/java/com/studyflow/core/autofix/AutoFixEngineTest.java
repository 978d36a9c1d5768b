package com.studyflow.core.autofix;

import com.studyflow.core.model.ChangeType;
import com.studyflow.core.model.EndpointProcedureMap;
import com.studyflow.core.model.EndpointTiming;
import com.studyflow.core.model.EndpointType;
import com.studyflow.core.model.FixStrategy;
import com.studyflow.core.model.FlowChange;
import com.studyflow.core.model.FlowIssue;
import com.studyflow.core.model.FlowSuggestion;
import com.studyflow.core.model.IssueCategory;
import com.studyflow.core.model.IssueSeverity;
import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.RuleId;
import com.studyflow.core.model.SapDocument;
import com.studyflow.core.model.StudyFlow;
import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitType;
import com.studyflow.core.model.VisitWindow;
import com.studyflow.core.procedure.ProcedureCatalog;
import com.studyflow.core.validation.FlowValidationEngine;
import com.studyflow.core.validation.FlowValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AutoFixEngine}.
 */
class AutoFixEngineTest {

    private static final ProcedureCatalog catalog = ProcedureCatalog.loadDefault();

    private AutoFixEngine engine;
    private FlowValidationEngine validator;
    private Procedure hba1c;
    private List<EndpointProcedureMap> maps;

    @BeforeEach
    void setUp() {
        engine = new AutoFixEngine(catalog);
        validator = new FlowValidationEngine(catalog);
        hba1c = catalog.require("proc_hba1c").instantiate(true, List.of("ep_1"));
        maps = List.of(new EndpointProcedureMap("ep_1", "HbA1c change", EndpointType.PRIMARY,
            List.of("proc_hba1c"), List.of(), EndpointTiming.all()));
    }

    private static List<Visit> visitsWithoutBaseline() {
        return new ArrayList<>(List.of(
            Visit.of("visit_screening", "Screening", -14, VisitType.SCREENING).withWindow(VisitWindow.symmetric(3)),
            Visit.of("visit_week_4", "Week 4", 28, VisitType.TREATMENT).withWindow(VisitWindow.symmetric(3)),
            Visit.of("visit_end_of_treatment", "End of Treatment", 84, VisitType.END_OF_TREATMENT)
                .withWindow(VisitWindow.symmetric(3))));
    }

    private static StudyFlow flow(List<Visit> visits, List<Procedure> procedures) {
        return new StudyFlow("DIAB-001", visits, procedures, List.of(), null, 84, Map.of());
    }

    @Test
    void applyAutoFixes_missingBaseline_addsSingleDayZeroVisit() {
        // Given
        StudyFlow flow = flow(visitsWithoutBaseline(), List.of(hba1c));
        FlowValidationResult before = validator.validate(flow, maps);

        // When
        AutoFixResult result = engine.applyAutoFixes(flow, before.issues(), maps,
            AutoFixRequest.conservative(before.autoFixableIssueIds()));

        // Then
        List<Visit> baselines = result.updatedFlow().visits().stream()
            .filter(v -> v.type() == VisitType.BASELINE)
            .toList();
        assertThat(baselines).hasSize(1);
        assertThat(baselines.get(0).day()).isZero();
        assertThat(baselines.get(0).window()).isEqualTo(VisitWindow.zero());
        assertThat(baselines.get(0).metadata()).containsEntry("source", "autofix");
        assertThat(result.appliedChanges()).extracting(FlowChange::type).containsExactly(ChangeType.ADD_VISIT);
        assertThat(result.rejectedChanges()).isEmpty();
        assertThat(result.warnings()).containsExactly("High-impact change: add_visit for protocol");
        assertThat(result.updatedFlow().topMatrix()).isNotNull();
        assertThat(flow.hasVisitOfType(VisitType.BASELINE)).isFalse();
    }

    @Test
    void applyAutoFixes_missingBaseline_revalidationIsClean() {
        // Given
        StudyFlow flow = flow(visitsWithoutBaseline(), List.of(hba1c));
        FlowValidationResult before = validator.validate(flow, maps);

        // When
        AutoFixResult result = engine.applyAutoFixes(flow, before.issues(), maps,
            AutoFixRequest.conservative(before.autoFixableIssueIds()));
        FlowValidationResult after = validator.validate(result.updatedFlow(), maps);

        // Then
        assertThat(before.valid()).isFalse();
        assertThat(after.valid()).isTrue();
        assertThat(after.issuesForRule(RuleId.MISSING_MANDATORY_VISITS)).isEmpty();
        assertThat(after.issuesForRule(RuleId.INCORRECT_SCHEDULE_FOR_PRIMARY)).isEmpty();
    }

    @Test
    void applyAutoFixes_missingEndOfTreatment_addsVisitAtLastTreatmentDay() {
        List<Visit> visits = visitsWithoutBaseline();
        visits.removeIf(v -> v.type() == VisitType.END_OF_TREATMENT);
        visits.add(Visit.of("visit_baseline", "Baseline", 0, VisitType.BASELINE));
        StudyFlow flow = flow(visits, List.of(hba1c));
        List<FlowIssue> issues = validator.validate(flow, maps).issues();

        AutoFixResult result = engine.applyAutoFixes(flow, issues, AutoFixRequest.conservative(List.of("MISSING_EOT")));

        Visit added = result.updatedFlow().visits().stream()
            .filter(v -> v.type() == VisitType.END_OF_TREATMENT)
            .findFirst()
            .orElseThrow();
        assertThat(added.day()).isEqualTo(28);
        assertThat(added.window()).isEqualTo(VisitWindow.symmetric(3));
        assertThat(result.summary().issuesFixed()).isEqualTo(1);
    }

    @Test
    void applyAutoFixes_missingAssessment_addsProcedureToAssessmentVisits() {
        // Given
        List<Visit> visits = visitsWithoutBaseline();
        visits.add(Visit.of("visit_baseline", "Baseline", 0, VisitType.BASELINE));
        StudyFlow flow = flow(visits, List.of());
        List<FlowIssue> issues = validator.validate(flow, maps).issues();

        // When
        AutoFixResult result = engine.applyAutoFixes(flow, issues, maps,
            AutoFixRequest.conservative(List.of("MISSING_ASSESSMENT_ep_1")));

        // Then
        StudyFlow updated = result.updatedFlow();
        assertThat(updated.findProcedure("proc_hba1c")).get()
            .extracting(Procedure::required)
            .isEqualTo(true);
        assertThat(updated.visits())
            .filteredOn(v -> v.hasProcedure("proc_hba1c"))
            .extracting(Visit::id)
            .containsExactly("visit_baseline", "visit_week_4", "visit_end_of_treatment");
        assertThat(result.appliedChanges()).hasSize(4);
        assertThat(validator.validate(updated, maps).issues()).isEmpty();
    }

    @Test
    void applyAutoFixes_largeWindow_shrinksToTenPercent() {
        List<Visit> visits = visitsWithoutBaseline();
        visits.add(Visit.of("visit_baseline", "Baseline", 0, VisitType.BASELINE));
        visits.set(1, visits.get(1).withWindow(VisitWindow.symmetric(10)));
        StudyFlow flow = flow(visits, List.of(hba1c));
        List<FlowIssue> issues = validator.validate(flow, maps).issues();

        AutoFixResult result = engine.applyAutoFixes(flow, issues,
            AutoFixRequest.conservative(List.of("UNSUPPORTED_VISIT_TIMING_visit_week_4")));

        assertThat(result.updatedFlow().findVisit("visit_week_4")).get()
            .extracting(Visit::window)
            .isEqualTo(VisitWindow.symmetric(3));
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void applyAutoFixes_endpointTimingDrift_producesSapChangeOnly() {
        // Given
        List<Visit> visits = visitsWithoutBaseline();
        visits.add(Visit.of("visit_baseline", "Baseline", 0, VisitType.BASELINE));
        StudyFlow flow = flow(visits, List.of(hba1c));
        SapDocument sap = new SapDocument(null, List.of(), List.of());
        List<FlowIssue> issues = validator.validate(flow, maps, null, sap).issues();

        // When
        AutoFixResult result = engine.applyAutoFixes(flow, issues,
            AutoFixRequest.conservative(List.of("ENDPOINT_TIMING_DRIFT_ep_1")));
        SapDocument updatedSap = sap.withChanges(result.appliedChanges());

        // Then
        assertThat(result.updatedFlow().visits()).isEqualTo(flow.visits());
        assertThat(updatedSap.hasScheduleFor("ep_1")).isTrue();
        assertThat(updatedSap.assessmentSchedules().get(0).visitIds())
            .containsExactly("visit_baseline", "visit_week_4");
        assertThat(validator.validate(result.updatedFlow(), maps, null, updatedSap).issues()).isEmpty();
    }

    @Test
    void applyAutoFixes_unknownAndManualIssues_areReportedAsWarnings() {
        List<Visit> visits = visitsWithoutBaseline();
        visits.add(Visit.of("visit_baseline", "Baseline", 0, VisitType.BASELINE));
        StudyFlow flow = flow(visits, List.of(hba1c));
        List<FlowIssue> issues = validator.validate(flow, maps, null, new SapDocument(9, List.of(), List.of()))
            .issues();

        AutoFixResult result = engine.applyAutoFixes(flow, issues,
            new AutoFixRequest(List.of("NOPE", "FLOW_INTEGRITY_DRIFT_PROTOCOL_SAP"), FixStrategy.AGGRESSIVE));

        assertThat(result.warnings()).containsExactly(
            "Issue NOPE not found",
            "Issue FLOW_INTEGRITY_DRIFT_PROTOCOL_SAP requires a manual fix");
        assertThat(result.appliedChanges()).isEmpty();
        assertThat(result.summary().issuesRemaining()).isEqualTo(issues.size());
    }

    @ParameterizedTest
    @CsvSource({
        "DRIFT, ENDPOINT_TIMING_DRIFT",
        "ENDPOINT_TIMING_DRIFT_, ENDPOINT_TIMING_DRIFT",
        "MISSING, MISSING_ASSESSMENT_FOR_ENDPOINT",
        "ENDPOINT_TIMING_DRIFT_ep_1, MISSING_ASSESSMENT_FOR_ENDPOINT"
    })
    void applyAutoFixes_issueIdWithoutEndpoint_isSkipped(String issueId, RuleId code) {
        // Given
        List<Visit> visits = visitsWithoutBaseline();
        visits.add(Visit.of("visit_baseline", "Baseline", 0, VisitType.BASELINE));
        StudyFlow flow = flow(visits, List.of(hba1c));
        FlowIssue issue = new FlowIssue(issueId, code, IssueSeverity.ERROR, IssueCategory.ALIGNMENT,
            "Imported issue", null, List.of(), List.of("proc_hba1c"),
            List.of(FlowSuggestion.autoFix("fix", "Fix it", List.of())));

        // When
        AutoFixResult result = engine.applyAutoFixes(flow, List.of(issue), maps,
            AutoFixRequest.conservative(List.of(issueId)));

        // Then
        assertThat(result.appliedChanges()).isEmpty();
        assertThat(result.updatedFlow()).isEqualTo(flow);
        assertThat(result.remainingIssues()).containsExactly(issue);
    }

    @Test
    void validateAutoFixChanges_duplicateVisitAndUnknownTarget_areErrors() {
        // Given
        StudyFlow flow = flow(visitsWithoutBaseline(), List.of());
        FlowChange duplicate = FlowChange.addVisit(
            Visit.of("visit_week_4_2", "Week 4", 28, VisitType.TREATMENT), "test");
        FlowChange unknownTarget = FlowChange.adjustWindow("visit_missing", null, VisitWindow.symmetric(2), "test");

        // When
        ChangeValidation validation = engine.validateAutoFixChanges(flow, List.of(duplicate, unknownTarget));

        // Then
        assertThat(validation.valid()).isFalse();
        assertThat(validation.errors()).containsExactly(
            "Cannot add visit \"Week 4\" - similar visit already exists at Day 28",
            "Cannot modify visit visit_missing - not found");
        assertThat(validation.warnings()).hasSize(1);
    }

    @Test
    void applyChangesToFlow_descriptiveChange_leavesFlowUnchanged() {
        StudyFlow flow = flow(visitsWithoutBaseline(), List.of(hba1c));
        FlowChange descriptive = FlowChange.describe(ChangeType.MODIFY_VISIT, FlowChange.ICF, "visit_count",
            "2", "3", "ICF should match");

        StudyFlow updated = engine.applyChangesToFlow(flow, List.of(descriptive));

        assertThat(updated.visits()).isEqualTo(flow.visits());
        assertThat(updated.procedures()).isEqualTo(flow.procedures());
    }

    @Test
    void generateAutoFixSuggestions_distinguishesFixableAndManual() {
        StudyFlow flow = flow(visitsWithoutBaseline(), List.of(hba1c));
        List<FlowIssue> issues = validator.validate(flow, maps, null, new SapDocument(9, List.of(), List.of()))
            .issues();

        List<AutoFixSuggestion> suggestions = AutoFixEngine.generateAutoFixSuggestions(issues);

        assertThat(suggestions).filteredOn(AutoFixSuggestion::fixable)
            .extracting(AutoFixSuggestion::issueId)
            .contains("MISSING_BASELINE", "ENDPOINT_TIMING_DRIFT_ep_1");
        assertThat(suggestions).filteredOn(s -> !s.fixable())
            .extracting(AutoFixSuggestion::suggestion)
            .containsOnly("Manual fix required");
    }

    @Test
    void estimateAutoFixImpact_classifiesRisk() {
        FlowChange addVisit = FlowChange.addVisit(Visit.of("v", "V", 0, VisitType.BASELINE), "test");
        FlowChange addProcedure = FlowChange.addProcedure(hba1c, "test");

        assertThat(AutoFixEngine.estimateAutoFixImpact(List.of()).riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(AutoFixEngine.estimateAutoFixImpact(List.of(addVisit)).riskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(AutoFixEngine.estimateAutoFixImpact(Collections.nCopies(3, addVisit)).riskLevel())
            .isEqualTo(RiskLevel.HIGH);

        AutoFixImpact procedures = AutoFixEngine.estimateAutoFixImpact(Collections.nCopies(6, addProcedure));
        assertThat(procedures.proceduresAdded()).isEqualTo(6);
        assertThat(procedures.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
    }
}
