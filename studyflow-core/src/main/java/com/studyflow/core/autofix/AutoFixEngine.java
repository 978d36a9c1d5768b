package com.studyflow.core.autofix;

import com.studyflow.core.alignment.EndpointProcedureMapper;
import com.studyflow.core.config.StudyFlowConfig.AutoFixSettings;
import com.studyflow.core.model.ChangeType;
import com.studyflow.core.model.EndpointProcedureMap;
import com.studyflow.core.model.FixStrategy;
import com.studyflow.core.model.FlowChange;
import com.studyflow.core.model.FlowIssue;
import com.studyflow.core.model.FlowSuggestion;
import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.ProcedureCatalogEntry;
import com.studyflow.core.model.StudyFlow;
import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitType;
import com.studyflow.core.model.VisitWindow;
import com.studyflow.core.procedure.ProcedureCatalog;
import com.studyflow.core.top.TopMatrixBuilder;
import com.studyflow.core.util.Identifiers;
import com.studyflow.core.validation.GlobalRules;
import com.studyflow.core.validation.ProtocolSapRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies deterministic, additive repairs for validation issues.
 *
 * <p>Each selected issue is dispatched by its rule to a fixer that proposes changes
 * against the current flow. Changes are checked with
 * {@link #validateAutoFixChanges(StudyFlow, List)} one at a time: a rejected change does
 * not block the independent changes of the same batch. Accepted changes are folded into a
 * new {@link StudyFlow}; the input flow is never modified.</p>
 *
 * <p>Changes targeting the SAP are reported in {@link AutoFixResult#appliedChanges()}
 * for the caller to fold into its {@code SapDocument}; they do not alter the flow.</p>
 */
public class AutoFixEngine {

    private static final Logger log = LoggerFactory.getLogger(AutoFixEngine.class);

    private static final String ENDPOINT_TIMING_DRIFT_PREFIX = "ENDPOINT_TIMING_DRIFT_";
    private static final String MISSING_ASSESSMENT_PREFIX = "MISSING_ASSESSMENT_";

    private final ProcedureCatalog catalog;
    private final AutoFixSettings settings;
    private final TopMatrixBuilder topBuilder = new TopMatrixBuilder();

    public AutoFixEngine(ProcedureCatalog catalog) {
        this(catalog, AutoFixSettings.defaults());
    }

    public AutoFixEngine(ProcedureCatalog catalog, AutoFixSettings settings) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public AutoFixResult applyAutoFixes(StudyFlow flow, List<FlowIssue> issues, AutoFixRequest request) {
        return applyAutoFixes(flow, issues, List.of(), request);
    }

    /**
     * Applies fixes for the selected issues.
     *
     * @param flow flow to repair
     * @param issues issues of the last validation pass
     * @param endpointMaps endpoint maps, used to place added assessment procedures on visits
     * @param request selected issue ids and strategy
     * @return applied and rejected changes with the updated flow
     */
    public AutoFixResult applyAutoFixes(StudyFlow flow, List<FlowIssue> issues,
                                        List<EndpointProcedureMap> endpointMaps, AutoFixRequest request) {
        Objects.requireNonNull(flow, "flow must not be null");
        Objects.requireNonNull(request, "request must not be null");
        if (request.strategy() != FixStrategy.CONSERVATIVE) {
            log.debug("Strategy {} applies conservative fixes only", request.strategy().wireName());
        }

        Map<String, FlowIssue> issuesById = new LinkedHashMap<>();
        issues.forEach(issue -> issuesById.putIfAbsent(issue.id(), issue));

        StudyFlow current = flow;
        List<FlowChange> applied = new ArrayList<>();
        List<RejectedChange> rejected = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<String> fixedIssueIds = new HashSet<>();

        for (String issueId : request.issueIds()) {
            FlowIssue issue = issuesById.get(issueId);
            if (issue == null) {
                warnings.add("Issue " + issueId + " not found");
                continue;
            }
            if (!issue.autoFixable()) {
                warnings.add("Issue " + issueId + " requires a manual fix");
                continue;
            }

            List<FlowChange> changes = fixFor(current, issue, endpointMaps);
            if (changes.isEmpty()) {
                log.debug("No changes needed for issue {}", issueId);
                continue;
            }

            List<FlowChange> accepted = new ArrayList<>();
            for (FlowChange change : changes) {
                ChangeValidation validation = validateAutoFixChanges(current, List.of(change));
                warnings.addAll(validation.warnings());
                if (validation.valid()) {
                    accepted.add(change);
                } else {
                    validation.errors().forEach(error -> {
                        log.warn("Rejected change for {}: {}", issueId, error);
                        rejected.add(new RejectedChange(issueId, change, error));
                    });
                }
            }
            if (!accepted.isEmpty()) {
                current = applyChangesToFlow(current, accepted);
                applied.addAll(accepted);
                fixedIssueIds.add(issueId);
                log.debug("Applied {} change(s) for issue {}", accepted.size(), issueId);
            }
        }

        List<FlowIssue> remaining = issues.stream()
            .filter(issue -> !fixedIssueIds.contains(issue.id()))
            .toList();
        AutoFixResult.Summary summary = new AutoFixResult.Summary(
            applied.size(), rejected.size(), fixedIssueIds.size(), remaining.size());
        log.info("Auto-fix applied {} change(s), rejected {}, {} issue(s) remaining",
            applied.size(), rejected.size(), remaining.size());
        return new AutoFixResult(applied, rejected, warnings, current, remaining, summary);
    }

    // ===== Fixers =====

    private List<FlowChange> fixFor(StudyFlow flow, FlowIssue issue, List<EndpointProcedureMap> endpointMaps) {
        String id = issue.id();
        return switch (issue.code()) {
            case MISSING_MANDATORY_VISITS -> GlobalRules.MISSING_BASELINE.equals(id)
                ? fixMissingBaseline(flow)
                : fixMissingEndOfTreatment(flow);
            case INCORRECT_SCHEDULE_FOR_PRIMARY -> id.startsWith(ProtocolSapRules.NO_BASELINE_PREFIX)
                ? fixMissingBaseline(flow)
                : fixMissingEndOfTreatment(flow);
            case UNSUPPORTED_VISIT_TIMING -> id.startsWith(GlobalRules.UNSUPPORTED_VISIT_TIMING_PREFIX)
                ? fixVisitWindow(flow, id.substring(GlobalRules.UNSUPPORTED_VISIT_TIMING_PREFIX.length()))
                : List.of();
            case ENDPOINT_TIMING_DRIFT -> endpointIdFrom(id, ENDPOINT_TIMING_DRIFT_PREFIX)
                .map(endpointId -> fixEndpointTimingDrift(flow, endpointId))
                .orElseGet(List::of);
            case MISSING_ASSESSMENT_FOR_ENDPOINT -> endpointIdFrom(id, MISSING_ASSESSMENT_PREFIX)
                .map(endpointId -> fixMissingAssessment(flow, issue, endpointId, endpointMaps))
                .orElseGet(List::of);
            case PROCEDURE_NOT_IN_ICF, RISKS_NOT_DESCRIBED, VISIT_MISSING_IN_ICF,
                FLOW_INTEGRITY_DRIFT, CYCLES_INCONSISTENT -> List.of();
        };
    }

    private static Optional<String> endpointIdFrom(String issueId, String prefix) {
        if (!issueId.startsWith(prefix) || issueId.length() == prefix.length()) {
            log.warn("Cannot derive endpoint id from issue {}, expected prefix {}", issueId, prefix);
            return Optional.empty();
        }
        return Optional.of(issueId.substring(prefix.length()));
    }

    private List<FlowChange> fixMissingBaseline(StudyFlow flow) {
        if (flow.hasVisitOfType(VisitType.BASELINE)) {
            return List.of();
        }
        Visit baseline = new Visit(uniqueVisitId(flow, "visit_baseline"), "Baseline", 0, null,
            VisitType.BASELINE, VisitWindow.zero(), List.of(), true,
            Map.of("source", "autofix", "notes", "Automatically added baseline visit"));
        return List.of(FlowChange.addVisit(baseline, "Baseline visit is mandatory for all clinical trials"));
    }

    private List<FlowChange> fixMissingEndOfTreatment(StudyFlow flow) {
        if (flow.hasVisitOfType(VisitType.END_OF_TREATMENT)) {
            return List.of();
        }
        int day = flow.visits().stream()
            .filter(v -> v.type() == VisitType.TREATMENT)
            .mapToInt(Visit::day)
            .max()
            .orElse(settings.defaultEotDay());
        Visit endOfTreatment = new Visit(uniqueVisitId(flow, "visit_end_of_treatment"), "End of Treatment", day,
            null, VisitType.END_OF_TREATMENT, VisitWindow.symmetric(settings.eotWindowDays()), List.of(), true,
            Map.of("source", "autofix", "notes", "Automatically added EOT visit"));
        return List.of(FlowChange.addVisit(endOfTreatment,
            "End-of-treatment visit is required to assess final outcomes"));
    }

    private List<FlowChange> fixVisitWindow(StudyFlow flow, String visitId) {
        Optional<Visit> visit = flow.findVisit(visitId);
        if (visit.isEmpty() || visit.get().window() == null || visit.get().day() <= 0) {
            return List.of();
        }
        int days = (int) Math.ceil(visit.get().day() * settings.windowPercentage());
        return List.of(FlowChange.adjustWindow(visitId, visit.get().window(), VisitWindow.symmetric(days),
            "Adjust visit window to standard ±10%"));
    }

    private List<FlowChange> fixEndpointTimingDrift(StudyFlow flow, String endpointId) {
        return List.of(FlowChange.sapAssessmentSchedule(endpointId, ProtocolSapRules.assessmentVisitIds(flow),
            "Align SAP assessment schedule with Protocol visits"));
    }

    private List<FlowChange> fixMissingAssessment(StudyFlow flow, FlowIssue issue, String endpointId,
                                                  List<EndpointProcedureMap> endpointMaps) {
        Optional<EndpointProcedureMap> map = endpointMaps.stream()
            .filter(m -> m.endpointId().equals(endpointId))
            .findFirst();
        String reason = "Required for endpoint " + map.map(EndpointProcedureMap::endpointName).orElse(endpointId);

        List<FlowChange> changes = new ArrayList<>();
        for (String procedureId : issue.affectedProcedures()) {
            if (flow.findProcedure(procedureId).isPresent()) {
                continue;
            }
            Optional<ProcedureCatalogEntry> entry = catalog.findById(procedureId);
            if (entry.isEmpty()) {
                log.warn("Cannot add procedure {}: not in catalog", procedureId);
                continue;
            }
            Procedure procedure = entry.get().instantiate(true, List.of(endpointId));
            changes.add(FlowChange.addProcedure(procedure, reason));
            map.ifPresent(m -> flow.visits().stream()
                .filter(v -> EndpointProcedureMapper.appliesAt(m.timing(), v.type()))
                .forEach(v -> changes.add(FlowChange.addProcedureToVisit(v.id(), procedure, reason))));
        }
        return changes;
    }

    private static String uniqueVisitId(StudyFlow flow, String baseId) {
        Set<String> used = flow.visits().stream().map(Visit::id).collect(Collectors.toCollection(HashSet::new));
        return Identifiers.uniqueId(baseId, used);
    }

    // ===== Change handling =====

    /**
     * Checks changes against a flow.
     *
     * <p>Adding a visit that duplicates an existing visit's day and type, or targeting a
     * visit id the flow does not have, is an error. Visit additions and removals are
     * reported as warnings.</p>
     *
     * @param flow flow the changes would apply to
     * @param changes changes to check
     * @return errors and warnings
     */
    public ChangeValidation validateAutoFixChanges(StudyFlow flow, List<FlowChange> changes) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (FlowChange change : changes) {
            if (change.type() == ChangeType.ADD_VISIT && change.visit() != null) {
                Visit added = change.visit();
                boolean duplicate = flow.visits().stream()
                    .anyMatch(v -> v.day() == added.day() && v.type() == added.type());
                if (duplicate) {
                    errors.add("Cannot add visit \"" + added.name() + "\" - similar visit already exists at Day "
                        + added.day());
                }
            }
            if (change.targetsVisit() && flow.findVisit(change.targetId()).isEmpty()) {
                errors.add("Cannot modify visit " + change.targetId() + " - not found");
            }
            if (change.type() == ChangeType.ADD_VISIT || change.type() == ChangeType.REMOVE_VISIT) {
                warnings.add("High-impact change: " + change.type().wireName() + " for " + change.targetId());
            }
        }
        return new ChangeValidation(errors, warnings);
    }

    /**
     * Folds changes into a new flow and rebuilds its Table of Procedures.
     *
     * <p>Descriptive changes and changes targeting the ICF or SAP leave the flow as is.</p>
     *
     * @param flow source flow, not modified
     * @param changes changes to apply
     * @return new flow
     */
    public StudyFlow applyChangesToFlow(StudyFlow flow, List<FlowChange> changes) {
        List<Visit> visits = new ArrayList<>(flow.visits());
        List<Procedure> procedures = new ArrayList<>(flow.procedures());

        for (FlowChange change : changes) {
            if (change.visit() != null && change.type() == ChangeType.ADD_VISIT) {
                visits.add(change.visit());
            } else if (change.procedure() != null && change.type() == ChangeType.ADD_PROCEDURE) {
                Procedure procedure = change.procedure();
                if (procedures.stream().noneMatch(p -> p.id().equals(procedure.id()))) {
                    procedures.add(procedure);
                }
                if (change.targetsVisit()) {
                    visits.replaceAll(v -> v.id().equals(change.targetId()) ? v.withProcedure(procedure.id()) : v);
                }
            } else if (change.window() != null && change.targetsVisit()) {
                visits.replaceAll(v -> v.id().equals(change.targetId()) ? v.withWindow(change.window()) : v);
            }
        }

        return new StudyFlow(flow.id(), visits, procedures, flow.cycles(), topBuilder.build(visits, procedures),
            flow.totalDuration(), flow.metadata());
    }

    // ===== Reporting =====

    /**
     * Describes how each issue with suggestions could be fixed.
     *
     * @param issues validation issues
     * @return one entry per issue that has suggestions
     */
    public static List<AutoFixSuggestion> generateAutoFixSuggestions(List<FlowIssue> issues) {
        return issues.stream()
            .filter(issue -> !issue.suggestions().isEmpty())
            .map(issue -> issue.suggestions().stream()
                .filter(FlowSuggestion::autoFixable)
                .findFirst()
                .map(s -> new AutoFixSuggestion(issue.id(), issue.code(), true, s.label(), s.changes()))
                .orElseGet(() -> new AutoFixSuggestion(issue.id(), issue.code(), false,
                    "Manual fix required", List.of())))
            .toList();
    }

    /**
     * Estimates the impact of a batch of changes.
     *
     * <p>Risk is high when more than 2 visits are added or more than 3 modified; medium
     * when any visit is added, more than 1 modified or more than 5 procedures added.</p>
     *
     * @param changes changes to assess
     * @return impact estimate
     */
    public static AutoFixImpact estimateAutoFixImpact(List<FlowChange> changes) {
        int visitsAdded = count(changes, ChangeType.ADD_VISIT);
        int visitsModified = (int) changes.stream()
            .filter(c -> c.type() == ChangeType.MODIFY_VISIT && !"window".equals(c.field()))
            .count();
        int proceduresAdded = count(changes, ChangeType.ADD_PROCEDURE);
        int proceduresModified = count(changes, ChangeType.MODIFY_PROCEDURE);

        RiskLevel risk = RiskLevel.LOW;
        if (visitsAdded > 2 || visitsModified > 3) {
            risk = RiskLevel.HIGH;
        } else if (visitsAdded > 0 || visitsModified > 1 || proceduresAdded > 5) {
            risk = RiskLevel.MEDIUM;
        }
        return new AutoFixImpact(visitsAdded, visitsModified, proceduresAdded, proceduresModified, risk);
    }

    private static int count(List<FlowChange> changes, ChangeType type) {
        return (int) changes.stream().filter(c -> c.type() == type).count();
    }
}
