package com.studyflow.core.validation;

import com.studyflow.core.model.ChangeType;
import com.studyflow.core.model.FlowChange;
import com.studyflow.core.model.FlowIssue;
import com.studyflow.core.model.FlowSuggestion;
import com.studyflow.core.model.IcfDocument;
import com.studyflow.core.model.IssueCategory;
import com.studyflow.core.model.IssueSeverity;
import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.ProcedureCategory;
import com.studyflow.core.model.RuleId;
import com.studyflow.core.model.Visit;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Rules comparing the protocol's flow against the informed-consent form.
 *
 * <p>Every rule returns no issues when the context carries no ICF.</p>
 */
public final class ProtocolIcfRules {

    private ProtocolIcfRules() {
        // Utility class
    }

    /**
     * Invasive, imaging and device procedures must be mentioned in the ICF.
     */
    public static List<FlowIssue> procedureNotInIcf(ValidationContext context) {
        Optional<IcfDocument> icf = context.icfDocument();
        if (icf.isEmpty()) {
            return List.of();
        }

        List<FlowIssue> issues = new ArrayList<>();
        for (Procedure procedure : context.flow().procedures()) {
            if (!requiresDisclosure(context, procedure) || mentioned(icf.get(), procedure)) {
                continue;
            }
            FlowChange change = FlowChange.describe(ChangeType.ADD_PROCEDURE, FlowChange.ICF, null, null,
                procedure.name(), "Regulatory requirement: all procedures must be disclosed in ICF");
            issues.add(new FlowIssue(
                "PROCEDURE_NOT_IN_ICF_" + procedure.id(),
                RuleId.PROCEDURE_NOT_IN_ICF,
                IssueSeverity.ERROR,
                IssueCategory.PROCEDURE,
                "Procedure \"" + procedure.name() + "\" not described in ICF",
                "The protocol includes procedure \"" + procedure.name() + "\" which is not mentioned in the"
                    + " Informed Consent Form. All study procedures, especially invasive ones, must be described"
                    + " in the ICF.",
                List.of(),
                List.of(procedure.id()),
                List.of(FlowSuggestion.manual("fix_" + procedure.id(),
                    "Add \"" + procedure.name() + "\" description to ICF", change))));
        }
        return issues;
    }

    /**
     * The ICF must carry risk descriptions when the protocol has high-risk procedures.
     */
    public static List<FlowIssue> risksNotDescribed(ValidationContext context) {
        Optional<IcfDocument> icf = context.icfDocument();
        if (icf.isEmpty() || !icf.get().riskDescriptions().isEmpty()) {
            return List.of();
        }

        List<Procedure> highRisk = context.flow().procedures().stream()
            .filter(p -> isHighRisk(context, p))
            .toList();
        if (highRisk.isEmpty()) {
            return List.of();
        }

        FlowChange change = FlowChange.describe(ChangeType.MODIFY_PROCEDURE, FlowChange.ICF, "risks", null,
            String.join(", ", highRisk.stream().map(Procedure::name).toList()),
            "Critical regulatory requirement for informed consent");
        return List.of(new FlowIssue(
            "RISKS_NOT_DESCRIBED",
            RuleId.RISKS_NOT_DESCRIBED,
            IssueSeverity.CRITICAL,
            IssueCategory.PROCEDURE,
            "ICF missing risk descriptions for invasive procedures",
            "The protocol includes " + highRisk.size() + " invasive or high-risk procedures, but the ICF does"
                + " not contain adequate risk descriptions. This is a critical regulatory requirement.",
            List.of(),
            highRisk.stream().map(Procedure::id).toList(),
            List.of(FlowSuggestion.manual("add_risks", "Add risk descriptions to ICF", change))));
    }

    /**
     * The ICF must describe the visit schedule, with a visit count close to the protocol's.
     */
    public static List<FlowIssue> visitMissingInIcf(ValidationContext context) {
        Optional<IcfDocument> icf = context.icfDocument();
        if (icf.isEmpty()) {
            return List.of();
        }

        List<Visit> visits = context.flow().visits();
        List<String> visitIds = visits.stream().map(Visit::id).toList();

        if (icf.get().visitCount() == 0) {
            int lastDay = visits.stream().mapToInt(Visit::day).max().orElse(0);
            FlowChange change = FlowChange.describe(ChangeType.ADD_VISIT, FlowChange.ICF, null, null,
                visits.size() + " visits over " + lastDay + " days",
                "Participants should be informed about study duration and visit frequency");
            return List.of(new FlowIssue(
                "VISIT_MISSING_IN_ICF",
                RuleId.VISIT_MISSING_IN_ICF,
                IssueSeverity.WARNING,
                IssueCategory.VISIT,
                "Visit schedule not described in ICF",
                "The protocol defines " + visits.size() + " visits, but the ICF does not describe the visit"
                    + " schedule. Participants should be informed about the number and timing of study visits.",
                visitIds,
                List.of(),
                List.of(FlowSuggestion.manual("add_visit_schedule", "Add visit schedule to ICF", change))));
        }

        int mentioned = icf.get().visitCount();
        int actual = context.scheduledVisits().size();
        if (Math.abs(mentioned - actual) <= context.settings().icfVisitTolerance()) {
            return List.of();
        }

        FlowChange change = FlowChange.describe(ChangeType.MODIFY_VISIT, FlowChange.ICF, "visit_count",
            String.valueOf(mentioned), String.valueOf(actual),
            "ICF should accurately reflect protocol visit schedule");
        return List.of(new FlowIssue(
            "VISIT_COUNT_MISMATCH",
            RuleId.VISIT_MISSING_IN_ICF,
            IssueSeverity.WARNING,
            IssueCategory.VISIT,
            "Visit count mismatch between Protocol and ICF",
            "Protocol defines " + actual + " visits, but ICF mentions " + mentioned + " visits. This"
                + " discrepancy should be resolved.",
            visitIds,
            List.of(),
            List.of(FlowSuggestion.manual("align_visit_count", "Align visit count in ICF with Protocol", change))));
    }

    private static boolean requiresDisclosure(ValidationContext context, Procedure procedure) {
        return context.isInvasive(procedure)
            || procedure.category() == ProcedureCategory.IMAGING
            || procedure.category() == ProcedureCategory.DEVICE;
    }

    private static boolean isHighRisk(ValidationContext context, Procedure procedure) {
        return requiresDisclosure(context, procedure)
            || (procedure.category() == ProcedureCategory.LABS
                && procedure.name().toLowerCase(Locale.ROOT).contains("biopsy"));
    }

    private static boolean mentioned(IcfDocument icf, Procedure procedure) {
        String name = procedure.name().toLowerCase(Locale.ROOT);
        return icf.procedureMentions().stream()
            .anyMatch(text -> text.toLowerCase(Locale.ROOT).contains(name));
    }
}
