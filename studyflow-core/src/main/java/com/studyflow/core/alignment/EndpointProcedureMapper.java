package com.studyflow.core.alignment;

import com.studyflow.core.model.CheckResult;
import com.studyflow.core.model.Endpoint;
import com.studyflow.core.model.EndpointProcedureMap;
import com.studyflow.core.model.EndpointTiming;
import com.studyflow.core.model.EndpointType;
import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.VisitType;
import com.studyflow.core.procedure.ProcedureInferenceEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds per-endpoint procedure requirements from inferred procedures and endpoint
 * timing.
 */
public class EndpointProcedureMapper {

    private static final Logger log = LoggerFactory.getLogger(EndpointProcedureMapper.class);

    private final ProcedureInferenceEngine inferenceEngine;

    public EndpointProcedureMapper(ProcedureInferenceEngine inferenceEngine) {
        this.inferenceEngine = inferenceEngine;
    }

    /**
     * Creates the map for one endpoint. Inferred procedures marked required become
     * required procedures, the rest recommended.
     *
     * @param endpoint endpoint to map
     * @return endpoint procedure map
     */
    public EndpointProcedureMap createMap(Endpoint endpoint) {
        List<Procedure> procedures = inferenceEngine.inferForEndpoint(endpoint);
        List<String> required = procedures.stream().filter(Procedure::required).map(Procedure::id).toList();
        List<String> recommended = procedures.stream().filter(p -> !p.required()).map(Procedure::id).toList();
        EndpointTiming timing = determineTiming(endpoint.name(), endpoint.type());
        log.debug("Endpoint '{}': {} required, {} recommended, timing {}",
            endpoint.id(), required.size(), recommended.size(), timing);
        return new EndpointProcedureMap(endpoint.id(), endpoint.name(), endpoint.type(), required, recommended, timing);
    }

    public List<EndpointProcedureMap> createMaps(List<Endpoint> endpoints) {
        return endpoints.stream().map(this::createMap).toList();
    }

    /**
     * Derives the assessment phases of an endpoint.
     *
     * <p>Primary endpoints and safety, adverse event or tolerability endpoints are
     * assessed at every phase; PK endpoints only during treatment; quality-of-life
     * endpoints at baseline and follow-up; anything else at baseline and treatment.
     *
     * @param endpointName endpoint name
     * @param type endpoint type
     * @return timing triple
     */
    public static EndpointTiming determineTiming(String endpointName, EndpointType type) {
        String lower = endpointName.toLowerCase(Locale.ROOT);
        if (type == EndpointType.PRIMARY) {
            return EndpointTiming.all();
        }
        if (lower.contains("safety") || lower.contains("adverse") || lower.contains("tolerability")) {
            return EndpointTiming.all();
        }
        if (lower.contains("pk") || lower.contains("pharmacokinetic")) {
            return new EndpointTiming(false, true, false);
        }
        if (lower.contains("quality of life") || lower.contains("qol")) {
            return new EndpointTiming(true, false, true);
        }
        return new EndpointTiming(true, true, false);
    }

    public static MergedEndpointMaps merge(List<EndpointProcedureMap> maps) {
        Set<String> required = new LinkedHashSet<>();
        Set<String> recommended = new LinkedHashSet<>();
        for (EndpointProcedureMap map : maps) {
            required.addAll(map.requiredProcedures());
            recommended.addAll(map.recommendedProcedures());
        }
        return new MergedEndpointMaps(new ArrayList<>(required), new ArrayList<>(recommended), maps);
    }

    /**
     * Required procedures of an endpoint at a visit of the given type. Baseline,
     * treatment and follow-up (including end of treatment) follow the timing triple;
     * other visit types require nothing.
     *
     * @param map endpoint map
     * @param visitType type of the visit
     * @return required procedure ids, possibly empty
     */
    public static List<String> proceduresAtVisit(EndpointProcedureMap map, VisitType visitType) {
        return appliesAt(map.timing(), visitType) ? map.requiredProcedures() : List.of();
    }

    /**
     * Whether the timing triple calls for an assessment at a visit type.
     */
    public static boolean appliesAt(EndpointTiming timing, VisitType visitType) {
        return switch (visitType) {
            case BASELINE -> timing.baseline();
            case TREATMENT -> timing.treatment();
            case FOLLOW_UP, END_OF_TREATMENT -> timing.followUp();
            case SCREENING, UNSCHEDULED -> false;
        };
    }

    public static CheckResult validate(EndpointProcedureMap map, List<Procedure> availableProcedures) {
        Set<String> available = availableProcedures.stream().map(Procedure::id).collect(Collectors.toSet());
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (String procedureId : map.requiredProcedures()) {
            if (!available.contains(procedureId)) {
                errors.add("Required procedure " + procedureId + " not found in available procedures");
            }
        }
        for (String procedureId : map.recommendedProcedures()) {
            if (!available.contains(procedureId)) {
                warnings.add("Recommended procedure " + procedureId + " not found in available procedures");
            }
        }
        if (map.requiredProcedures().isEmpty() && map.recommendedProcedures().isEmpty()) {
            warnings.add("Endpoint \"" + map.endpointName() + "\" has no associated procedures");
        }
        if (!map.timing().any()) {
            errors.add("Endpoint \"" + map.endpointName() + "\" has no timing requirements");
        }
        return new CheckResult(errors, warnings);
    }

    public static EndpointMapSummary summarize(List<EndpointProcedureMap> maps) {
        int total = maps.size();
        MergedEndpointMaps merged = merge(maps);
        int requiredCount = maps.stream().mapToInt(m -> m.requiredProcedures().size()).sum();
        int recommendedCount = maps.stream().mapToInt(m -> m.recommendedProcedures().size()).sum();
        return new EndpointMapSummary(
            total,
            countType(maps, EndpointType.PRIMARY),
            countType(maps, EndpointType.SECONDARY),
            countType(maps, EndpointType.EXPLORATORY),
            merged.allRequiredProcedures().size(),
            merged.allRecommendedProcedures().size(),
            total > 0 ? (double) requiredCount / total : 0,
            total > 0 ? (double) recommendedCount / total : 0,
            (int) maps.stream().filter(m -> m.timing().baseline()).count(),
            (int) maps.stream().filter(m -> m.timing().treatment()).count(),
            (int) maps.stream().filter(m -> m.timing().followUp()).count());
    }

    public static MissingProcedures findMissing(EndpointProcedureMap map, List<String> actualProcedures) {
        return new MissingProcedures(
            map.requiredProcedures().stream().filter(p -> !actualProcedures.contains(p)).toList(),
            map.recommendedProcedures().stream().filter(p -> !actualProcedures.contains(p)).toList());
    }

    /**
     * Coverage of every endpoint by the procedures actually in the flow.
     *
     * @param maps endpoint maps
     * @param actualProcedures procedure ids performed by the flow
     * @return one entry per map, same order
     */
    public static List<EndpointCoverage> coverage(List<EndpointProcedureMap> maps, List<String> actualProcedures) {
        return maps.stream().map(map -> {
            MissingProcedures missing = findMissing(map, actualProcedures);
            return new EndpointCoverage(
                map.endpointId(),
                map.endpointName(),
                percentCovered(map.requiredProcedures().size(), missing.missingRequired().size()),
                percentCovered(map.recommendedProcedures().size(), missing.missingRecommended().size()),
                missing.missingRequired().size(),
                missing.missingRecommended().size());
        }).toList();
    }

    private static double percentCovered(int total, int missing) {
        return total > 0 ? (total - missing) * 100.0 / total : 100.0;
    }

    private static int countType(List<EndpointProcedureMap> maps, EndpointType type) {
        return (int) maps.stream().filter(m -> m.endpointType() == type).count();
    }
}
