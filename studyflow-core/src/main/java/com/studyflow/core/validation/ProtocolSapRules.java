package com.studyflow.core.validation;

import com.studyflow.core.model.ChangeType;
import com.studyflow.core.model.EndpointProcedureMap;
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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rules comparing endpoint requirements against the protocol flow and the SAP.
 *
 * <p>Only {@link #endpointTimingDrift(ValidationContext)} needs a SAP; the other two
 * rules check the protocol flow against the endpoint maps.</p>
 */
public final class ProtocolSapRules {

    public static final String NO_BASELINE_PREFIX = "NO_BASELINE_";
    public static final String NO_EOT_PREFIX = "NO_EOT_";

    private ProtocolSapRules() {
        // Utility class
    }

    /**
     * Every endpoint needs an assessment schedule in the SAP.
     */
    public static List<FlowIssue> endpointTimingDrift(ValidationContext context) {
        Optional<SapDocument> sap = context.sapDocument();
        if (sap.isEmpty()) {
            return List.of();
        }

        List<FlowIssue> issues = new ArrayList<>();
        for (EndpointProcedureMap map : context.endpointMaps()) {
            if (sap.get().hasScheduleFor(map.endpointId())) {
                continue;
            }
            FlowChange change = FlowChange.sapAssessmentSchedule(map.endpointId(),
                assessmentVisitIds(context.flow()), "SAP must specify when each endpoint will be assessed");
            issues.add(new FlowIssue(
                "ENDPOINT_TIMING_DRIFT_" + map.endpointId(),
                RuleId.ENDPOINT_TIMING_DRIFT,
                map.isPrimary() ? IssueSeverity.CRITICAL : IssueSeverity.ERROR,
                IssueCategory.TIMING,
                "Endpoint \"" + map.endpointName() + "\" timing not defined in SAP",
                "The " + map.endpointType().wireName() + " endpoint \"" + map.endpointName()
                    + "\" is defined in the Protocol but its assessment schedule is not specified in the SAP.",
                List.of(),
                List.of(),
                List.of(FlowSuggestion.autoFix("fix_timing_" + map.endpointId(),
                    "Add assessment schedule to SAP", List.of(change)))));
        }
        return issues;
    }

    /**
     * Every required procedure of a primary endpoint must be part of the protocol.
     */
    public static List<FlowIssue> missingAssessmentForEndpoint(ValidationContext context) {
        Set<String> protocolProcedures = context.flow().procedures().stream()
            .map(Procedure::id)
            .collect(Collectors.toSet());

        List<FlowIssue> issues = new ArrayList<>();
        for (EndpointProcedureMap map : context.primaryEndpointMaps()) {
            List<String> missing = map.requiredProcedures().stream()
                .filter(id -> !protocolProcedures.contains(id))
                .toList();
            if (missing.isEmpty()) {
                continue;
            }
            String reason = "Required for primary endpoint \"" + map.endpointName() + "\"";
            List<FlowChange> changes = missing.stream()
                .map(id -> FlowChange.describe(ChangeType.ADD_PROCEDURE, FlowChange.PROTOCOL, null, null, id, reason))
                .toList();
            issues.add(new FlowIssue(
                "MISSING_ASSESSMENT_" + map.endpointId(),
                RuleId.MISSING_ASSESSMENT_FOR_ENDPOINT,
                IssueSeverity.CRITICAL,
                IssueCategory.PROCEDURE,
                "Missing assessment procedures for primary endpoint \"" + map.endpointName() + "\"",
                "The primary endpoint \"" + map.endpointName() + "\" requires " + missing.size()
                    + " procedures that are not included in the Protocol.",
                List.of(),
                missing,
                List.of(FlowSuggestion.autoFix("add_procs_" + map.endpointId(),
                    "Add " + missing.size() + " required procedures to Protocol", changes))));
        }
        return issues;
    }

    /**
     * Primary endpoints assessed at baseline or follow-up need those visits in the protocol.
     */
    public static List<FlowIssue> incorrectScheduleForPrimary(ValidationContext context) {
        StudyFlow flow = context.flow();
        boolean hasBaseline = flow.hasVisitOfType(VisitType.BASELINE);
        boolean hasEndOfTreatment = flow.hasVisitOfType(VisitType.END_OF_TREATMENT)
            || flow.hasVisitOfType(VisitType.FOLLOW_UP);

        List<FlowIssue> issues = new ArrayList<>();
        for (EndpointProcedureMap map : context.primaryEndpointMaps()) {
            String name = map.endpointName();
            if (map.timing().baseline() && !hasBaseline) {
                FlowChange change = FlowChange.describe(ChangeType.ADD_VISIT, FlowChange.PROTOCOL, null, null,
                    "Baseline (Day 0)", "Baseline required for primary endpoint assessment");
                issues.add(new FlowIssue(
                    NO_BASELINE_PREFIX + map.endpointId(),
                    RuleId.INCORRECT_SCHEDULE_FOR_PRIMARY,
                    IssueSeverity.CRITICAL,
                    IssueCategory.VISIT,
                    "No baseline visit for primary endpoint \"" + name + "\"",
                    "Primary endpoint \"" + name + "\" requires baseline assessment, but no baseline visit is"
                        + " defined in the Protocol.",
                    List.of(),
                    List.of(),
                    List.of(FlowSuggestion.autoFix("add_baseline", "Add baseline visit to Protocol",
                        List.of(change)))));
            }
            if (map.timing().followUp() && !hasEndOfTreatment) {
                FlowChange change = FlowChange.describe(ChangeType.ADD_VISIT, FlowChange.PROTOCOL, null, null,
                    "End of Treatment", "EOT required for primary endpoint assessment");
                issues.add(new FlowIssue(
                    NO_EOT_PREFIX + map.endpointId(),
                    RuleId.INCORRECT_SCHEDULE_FOR_PRIMARY,
                    IssueSeverity.ERROR,
                    IssueCategory.VISIT,
                    "No end-of-treatment visit for primary endpoint \"" + name + "\"",
                    "Primary endpoint \"" + name + "\" requires end-of-treatment assessment, but no EOT or"
                        + " follow-up visit is defined.",
                    List.of(),
                    List.of(),
                    List.of(FlowSuggestion.autoFix("add_eot", "Add end-of-treatment visit to Protocol",
                        List.of(change)))));
            }
        }
        return issues;
    }

    /**
     * Returns the visits an SAP assessment schedule should list for the flow.
     *
     * @param flow study flow
     * @return ids of the baseline and treatment visits, in day order
     */
    public static List<String> assessmentVisitIds(StudyFlow flow) {
        return flow.visits().stream()
            .filter(v -> v.type() == VisitType.BASELINE || v.type() == VisitType.TREATMENT)
            .map(Visit::id)
            .toList();
    }
}
