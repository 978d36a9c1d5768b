package com.studyflow.core.alignment;

import com.studyflow.core.model.CheckResult;
import com.studyflow.core.model.EndpointProcedureMap;
import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitEndpointAlignment;
import com.studyflow.core.model.VisitType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Checks that visits carry the procedures each endpoint requires at their phase.
 *
 * <p>All aggregate views are reductions over the alignment list; nothing is cached.
 */
public class VisitEndpointAlignmentChecker {

    private static final Logger log = LoggerFactory.getLogger(VisitEndpointAlignmentChecker.class);

    /**
     * Checks one visit against one endpoint.
     *
     * @param visit visit to check
     * @param map endpoint requirements
     * @return alignment fact
     */
    public VisitEndpointAlignment check(Visit visit, EndpointProcedureMap map) {
        List<String> required = EndpointProcedureMapper.proceduresAtVisit(map, visit.type());
        List<String> missing = required.stream().filter(p -> !visit.hasProcedure(p)).toList();
        return new VisitEndpointAlignment(visit.id(), map.endpointId(), missing.isEmpty(), missing,
            timingCorrect(visit.type(), map));
    }

    /**
     * Timing rule per visit type. Unscheduled visits are always acceptable; screening
     * never assesses endpoints.
     */
    static boolean timingCorrect(VisitType type, EndpointProcedureMap map) {
        return switch (type) {
            case UNSCHEDULED -> true;
            case SCREENING -> false;
            default -> EndpointProcedureMapper.appliesAt(map.timing(), type);
        };
    }

    public List<VisitEndpointAlignment> checkAll(List<Visit> visits, List<EndpointProcedureMap> maps) {
        List<VisitEndpointAlignment> alignments = new ArrayList<>();
        for (Visit visit : visits) {
            for (EndpointProcedureMap map : maps) {
                alignments.add(check(visit, map));
            }
        }
        log.debug("Checked {} visit/endpoint pairs", alignments.size());
        return alignments;
    }

    public List<VisitEndpointAlignment> misaligned(List<VisitEndpointAlignment> alignments) {
        return alignments.stream().filter(a -> !a.aligned()).toList();
    }

    public AlignmentSummary summarize(List<VisitEndpointAlignment> alignments) {
        int total = alignments.size();
        int aligned = (int) alignments.stream().filter(VisitEndpointAlignment::aligned).count();
        return new AlignmentSummary(
            total,
            aligned,
            total - aligned,
            total > 0 ? aligned * 100.0 / total : 0,
            (int) alignments.stream().filter(a -> !a.hasProcedures()).count(),
            (int) alignments.stream().filter(a -> !a.timingCorrect()).count());
    }

    public List<AlignmentBreakdown> byVisit(List<VisitEndpointAlignment> alignments, List<Visit> visits) {
        return visits.stream()
            .map(v -> breakdown(v.id(), v.name(),
                alignments.stream().filter(a -> a.visitId().equals(v.id())).toList()))
            .toList();
    }

    public List<AlignmentBreakdown> byEndpoint(List<VisitEndpointAlignment> alignments,
                                               List<EndpointProcedureMap> maps) {
        return maps.stream()
            .map(m -> breakdown(m.endpointId(), m.endpointName(),
                alignments.stream().filter(a -> a.endpointId().equals(m.endpointId())).toList()))
            .toList();
    }

    /**
     * Lists the procedures each misaligned pair is missing.
     *
     * @param alignments alignment facts
     * @param visits visits of the flow
     * @param maps endpoint maps
     * @return one suggestion per misaligned pair with missing procedures
     */
    public List<ProcedureAddition> suggestProceduresToAdd(List<VisitEndpointAlignment> alignments,
                                                          List<Visit> visits,
                                                          List<EndpointProcedureMap> maps) {
        Map<String, Visit> visitsById = visits.stream()
            .collect(Collectors.toMap(Visit::id, Function.identity(), (a, b) -> a));
        List<ProcedureAddition> suggestions = new ArrayList<>();
        for (VisitEndpointAlignment alignment : misaligned(alignments)) {
            if (alignment.missingProcedures().isEmpty()) {
                continue;
            }
            Visit visit = visitsById.get(alignment.visitId());
            Optional<EndpointProcedureMap> map = findMap(maps, alignment.endpointId());
            if (visit != null && map.isPresent()) {
                suggestions.add(new ProcedureAddition(visit.id(), visit.name(), alignment.endpointId(),
                    alignment.missingProcedures(), "Required for " + describe(map.get())));
            }
        }
        return suggestions;
    }

    /**
     * Adds missing required procedures to the visits that need them.
     *
     * @param visits visits to repair
     * @param alignments alignment facts for these visits
     * @param maps endpoint maps
     * @return new visit list and what was added
     */
    public AlignmentFixResult autoFixAlignment(List<Visit> visits, List<VisitEndpointAlignment> alignments,
                                               List<EndpointProcedureMap> maps) {
        Map<String, Visit> updated = new LinkedHashMap<>();
        visits.forEach(v -> updated.put(v.id(), v));
        List<ProcedureAddition> additions = new ArrayList<>();
        int changes = 0;

        for (VisitEndpointAlignment alignment : misaligned(alignments)) {
            Visit visit = updated.get(alignment.visitId());
            Optional<EndpointProcedureMap> map = findMap(maps, alignment.endpointId());
            if (visit == null || map.isEmpty() || alignment.missingProcedures().isEmpty()) {
                continue;
            }
            List<String> added = new ArrayList<>();
            for (String procedureId : alignment.missingProcedures()) {
                if (!visit.hasProcedure(procedureId)) {
                    visit = visit.withProcedure(procedureId);
                    added.add(procedureId);
                }
            }
            if (!added.isEmpty()) {
                updated.put(visit.id(), visit);
                changes += added.size();
                additions.add(new ProcedureAddition(visit.id(), visit.name(), alignment.endpointId(), added,
                    "Added procedures for " + describe(map.get())));
            }
        }

        if (changes > 0) {
            log.info("Added {} procedure assignment(s) to align visits with endpoints", changes);
        }
        return new AlignmentFixResult(new ArrayList<>(updated.values()), changes, additions);
    }

    /**
     * Checks that every primary endpoint is assessed at baseline, at least one
     * treatment visit and follow-up, as its timing requires.
     *
     * @param visits visits of the flow
     * @param maps endpoint maps
     * @return errors for missing or incomplete assessments, warnings for absent phases
     */
    public CheckResult validatePrimaryEndpointCoverage(List<Visit> visits, List<EndpointProcedureMap> maps) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (EndpointProcedureMap map : maps) {
            if (!map.isPrimary()) {
                continue;
            }
            String name = map.endpointName();

            if (map.timing().baseline()) {
                Optional<Visit> baseline = visits.stream().filter(v -> v.type() == VisitType.BASELINE).findFirst();
                if (baseline.isEmpty()) {
                    errors.add("No baseline visit found for primary endpoint \"" + name + "\"");
                } else if (!check(baseline.get(), map).aligned()) {
                    errors.add("Baseline visit missing procedures for primary endpoint \"" + name + "\"");
                }
            }

            if (map.timing().treatment()) {
                List<Visit> treatment = visits.stream().filter(v -> v.type() == VisitType.TREATMENT).toList();
                if (treatment.isEmpty()) {
                    warnings.add("No treatment visits found for primary endpoint \"" + name + "\"");
                } else if (treatment.stream().noneMatch(v -> check(v, map).aligned())) {
                    errors.add("No treatment visit has procedures for primary endpoint \"" + name + "\"");
                }
            }

            if (map.timing().followUp()) {
                boolean hasFollowUp = visits.stream()
                    .anyMatch(v -> v.type() == VisitType.FOLLOW_UP || v.type() == VisitType.END_OF_TREATMENT);
                if (!hasFollowUp) {
                    warnings.add("No follow-up visit found for primary endpoint \"" + name + "\"");
                }
            }
        }
        return new CheckResult(errors, warnings);
    }

    private static AlignmentBreakdown breakdown(String id, String name, List<VisitEndpointAlignment> alignments) {
        int total = alignments.size();
        int aligned = (int) alignments.stream().filter(VisitEndpointAlignment::aligned).count();
        return new AlignmentBreakdown(id, name, total, aligned, total - aligned,
            total > 0 ? aligned * 100.0 / total : 0);
    }

    private static Optional<EndpointProcedureMap> findMap(List<EndpointProcedureMap> maps, String endpointId) {
        return maps.stream().filter(m -> m.endpointId().equals(endpointId)).findFirst();
    }

    private static String describe(EndpointProcedureMap map) {
        return map.endpointType().wireName() + " endpoint \"" + map.endpointName() + "\"";
    }
}
