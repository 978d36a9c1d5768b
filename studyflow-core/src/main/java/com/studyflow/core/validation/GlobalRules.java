package com.studyflow.core.validation;

import com.studyflow.core.model.ChangeType;
import com.studyflow.core.model.FlowChange;
import com.studyflow.core.model.FlowIssue;
import com.studyflow.core.model.FlowSuggestion;
import com.studyflow.core.model.IcfDocument;
import com.studyflow.core.model.IssueCategory;
import com.studyflow.core.model.IssueSeverity;
import com.studyflow.core.model.RuleId;
import com.studyflow.core.model.SapDocument;
import com.studyflow.core.model.TreatmentCycle;
import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitType;
import com.studyflow.core.model.VisitWindow;
import com.studyflow.core.visit.VisitInference;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Cross-document integrity rules and structural checks of the visit schedule.
 */
public final class GlobalRules {

    public static final String MISSING_BASELINE = "MISSING_BASELINE";
    public static final String MISSING_EOT = "MISSING_EOT";
    public static final String UNSUPPORTED_VISIT_TIMING_PREFIX = "UNSUPPORTED_VISIT_TIMING_";

    private static final double SUGGESTED_WINDOW_SHARE = 0.1;

    private GlobalRules() {
        // Utility class
    }

    // ===== Cross-document =====

    /**
     * Visit counts must agree between the protocol and the SAP, and roughly with the ICF.
     */
    public static List<FlowIssue> flowIntegrityDrift(ValidationContext context) {
        List<FlowIssue> issues = new ArrayList<>();
        int protocolCount = context.scheduledVisits().size();
        List<String> visitIds = context.flow().visits().stream().map(Visit::id).toList();

        Optional<Integer> sapCount = context.sapDocument().map(SapDocument::visitCount);
        if (sapCount.isPresent()
            && Math.abs(protocolCount - sapCount.get()) > context.settings().sapVisitTolerance()) {
            FlowChange change = FlowChange.describe(ChangeType.MODIFY_VISIT, FlowChange.SAP, "visit_count",
                String.valueOf(sapCount.get()), String.valueOf(protocolCount),
                "SAP must match Protocol visit schedule");
            issues.add(new FlowIssue(
                "FLOW_INTEGRITY_DRIFT_PROTOCOL_SAP",
                RuleId.FLOW_INTEGRITY_DRIFT,
                IssueSeverity.ERROR,
                IssueCategory.GLOBAL,
                "Visit count mismatch between Protocol and SAP",
                "Protocol defines " + protocolCount + " visits, but SAP specifies " + sapCount.get()
                    + " visits. This inconsistency must be resolved.",
                visitIds,
                List.of(),
                List.of(FlowSuggestion.manual("align_visits", "Align visit schedules between Protocol and SAP",
                    change))));
        }

        int icfCount = context.icfDocument().map(IcfDocument::visitCount).orElse(0);
        if (icfCount > 0 && Math.abs(protocolCount - icfCount) > context.settings().icfVisitTolerance()) {
            FlowChange change = FlowChange.describe(ChangeType.MODIFY_VISIT, FlowChange.ICF, "visit_count",
                String.valueOf(icfCount), String.valueOf(protocolCount),
                "ICF should accurately reflect Protocol visit schedule");
            issues.add(new FlowIssue(
                "FLOW_INTEGRITY_DRIFT_PROTOCOL_ICF",
                RuleId.FLOW_INTEGRITY_DRIFT,
                IssueSeverity.WARNING,
                IssueCategory.GLOBAL,
                "Visit count mismatch between Protocol and ICF",
                "Protocol defines " + protocolCount + " visits, but ICF mentions " + icfCount + " visits.",
                visitIds,
                List.of(),
                List.of(FlowSuggestion.manual("align_icf_visits", "Update ICF visit count to match Protocol",
                    change))));
        }
        return issues;
    }

    /**
     * Treatment cycles must agree in count and length between the protocol and the SAP.
     */
    public static List<FlowIssue> cyclesInconsistent(ValidationContext context) {
        Optional<SapDocument> sap = context.sapDocument();
        if (sap.isEmpty()) {
            return List.of();
        }
        List<TreatmentCycle> protocolCycles = context.flow().cycles();
        List<Integer> sapLengths = sap.get().cycleLengths();
        if (protocolCycles.isEmpty() && sapLengths.isEmpty()) {
            return List.of();
        }

        if (protocolCycles.size() != sapLengths.size()) {
            FlowChange change = FlowChange.describe(ChangeType.MODIFY_VISIT, FlowChange.SAP, "cycles",
                String.valueOf(sapLengths.size()), String.valueOf(protocolCycles.size()),
                "SAP must match Protocol cycle structure");
            return List.of(new FlowIssue(
                "CYCLES_INCONSISTENT_COUNT",
                RuleId.CYCLES_INCONSISTENT,
                IssueSeverity.ERROR,
                IssueCategory.CYCLE,
                "Cycle count mismatch between Protocol and SAP",
                "Protocol defines " + protocolCycles.size() + " treatment cycles, but SAP specifies "
                    + sapLengths.size() + " cycles.",
                List.of(),
                List.of(),
                List.of(FlowSuggestion.manual("align_cycles", "Align cycle definitions between Protocol and SAP",
                    change))));
        }

        List<FlowIssue> issues = new ArrayList<>();
        for (int i = 0; i < protocolCycles.size(); i++) {
            int number = i + 1;
            int protocolLength = protocolCycles.get(i).lengthDays();
            int sapLength = sapLengths.get(i);
            if (protocolLength == sapLength) {
                continue;
            }
            FlowChange change = FlowChange.describe(ChangeType.MODIFY_VISIT, FlowChange.SAP, "cycle_length",
                String.valueOf(sapLength), String.valueOf(protocolLength), "SAP cycle length must match Protocol");
            issues.add(new FlowIssue(
                "CYCLES_INCONSISTENT_LENGTH_" + number,
                RuleId.CYCLES_INCONSISTENT,
                IssueSeverity.ERROR,
                IssueCategory.CYCLE,
                "Cycle " + number + " length mismatch",
                "Protocol defines Cycle " + number + " as " + protocolLength + " days, but SAP specifies "
                    + sapLength + " days.",
                protocolCycles.get(i).visitIds(),
                List.of(),
                List.of(FlowSuggestion.manual("fix_cycle_" + number,
                    "Update SAP Cycle " + number + " length to " + protocolLength + " days", change))));
        }
        return issues;
    }

    // ===== Visit schedule =====

    /**
     * Visit windows must stay within a share of the visit day, and scheduled visits
     * should not fall within a few days of each other.
     */
    public static List<FlowIssue> unsupportedVisitTiming(ValidationContext context) {
        List<Visit> visits = context.flow().visits();
        List<FlowIssue> issues = new ArrayList<>();

        for (int i = 0; i < visits.size(); i++) {
            Visit visit = visits.get(i);
            windowIssue(visit, context.settings().maxWindowRatio()).ifPresent(issues::add);

            if (visit.type() == VisitType.UNSCHEDULED) {
                continue;
            }
            for (int j = i + 1; j < visits.size(); j++) {
                Visit other = visits.get(j);
                int dayDiff = Math.abs(visit.day() - other.day());
                if (other.type() == VisitType.UNSCHEDULED
                    || dayDiff == 0 || dayDiff >= context.settings().closeVisitDays()) {
                    continue;
                }
                issues.add(new FlowIssue(
                    "VISITS_TOO_CLOSE_" + visit.id() + "_" + other.id(),
                    RuleId.UNSUPPORTED_VISIT_TIMING,
                    IssueSeverity.INFO,
                    IssueCategory.TIMING,
                    "Visits \"" + visit.name() + "\" and \"" + other.name() + "\" are very close",
                    "Visits \"" + visit.name() + "\" (Day " + visit.day() + ") and \"" + other.name() + "\" (Day "
                        + other.day() + ") are only " + dayDiff
                        + " days apart. Consider combining or spacing them further.",
                    List.of(visit.id(), other.id()),
                    List.of(),
                    List.of(FlowSuggestion.manual("combine_visits_" + visit.id() + "_" + other.id(),
                        "Consider combining these visits"))));
            }
        }
        return issues;
    }

    /**
     * Every flow needs a baseline and an end-of-treatment visit.
     */
    public static List<FlowIssue> missingMandatoryVisits(ValidationContext context) {
        List<FlowIssue> issues = new ArrayList<>();

        if (!context.flow().hasVisitOfType(VisitType.BASELINE)) {
            Visit baseline = Visit.of("visit_baseline", "Baseline", 0, VisitType.BASELINE)
                .withWindow(VisitWindow.zero());
            issues.add(new FlowIssue(
                MISSING_BASELINE,
                RuleId.MISSING_MANDATORY_VISITS,
                IssueSeverity.CRITICAL,
                IssueCategory.VISIT,
                "No baseline visit defined",
                "A baseline visit (Day 0) is mandatory for all clinical trials to establish baseline measurements.",
                List.of(),
                List.of(),
                List.of(FlowSuggestion.autoFix("add_baseline", "Add baseline visit",
                    List.of(FlowChange.addVisit(baseline, "Baseline visit is mandatory"))))));
        }

        if (!context.flow().hasVisitOfType(VisitType.END_OF_TREATMENT)) {
            int day = context.flow().visits().stream()
                .filter(v -> v.type() == VisitType.TREATMENT)
                .mapToInt(Visit::day)
                .max()
                .orElse(VisitInference.DEFAULT_END_OF_TREATMENT_DAY);
            Visit endOfTreatment = Visit.of("visit_end_of_treatment", "End of Treatment", day,
                VisitType.END_OF_TREATMENT);
            issues.add(new FlowIssue(
                MISSING_EOT,
                RuleId.MISSING_MANDATORY_VISITS,
                IssueSeverity.ERROR,
                IssueCategory.VISIT,
                "No end-of-treatment visit defined",
                "An end-of-treatment visit is required to assess final outcomes and safety.",
                List.of(),
                List.of(),
                List.of(FlowSuggestion.autoFix("add_eot", "Add end-of-treatment visit",
                    List.of(FlowChange.addVisit(endOfTreatment, "EOT visit is required"))))));
        }
        return issues;
    }

    private static Optional<FlowIssue> windowIssue(Visit visit, double maxWindowRatio) {
        VisitWindow window = visit.window();
        if (window == null || visit.day() <= 0 || window.total() <= visit.day() * maxWindowRatio) {
            return Optional.empty();
        }
        double share = (double) window.total() / visit.day() * 100;
        VisitWindow suggested = VisitWindow.symmetric((int) Math.ceil(visit.day() * SUGGESTED_WINDOW_SHARE));
        return Optional.of(new FlowIssue(
            UNSUPPORTED_VISIT_TIMING_PREFIX + visit.id(),
            RuleId.UNSUPPORTED_VISIT_TIMING,
            IssueSeverity.WARNING,
            IssueCategory.TIMING,
            "Visit \"" + visit.name() + "\" has unrealistic window",
            "Visit \"" + visit.name() + "\" (Day " + visit.day() + ") has a window of " + window.format()
                + ", which is " + String.format(Locale.ROOT, "%.0f", share)
                + "% of the visit day. This may be too flexible.",
            List.of(visit.id()),
            List.of(),
            List.of(FlowSuggestion.autoFix("fix_window_" + visit.id(), "Reduce visit window to ±10-20%",
                List.of(FlowChange.adjustWindow(visit.id(), window, suggested,
                    "Visit windows should typically be ±10-20% of visit day"))))));
    }
}
