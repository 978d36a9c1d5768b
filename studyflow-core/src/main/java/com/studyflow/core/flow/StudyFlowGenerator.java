package com.studyflow.core.flow;

import com.studyflow.core.alignment.EndpointProcedureMapper;
import com.studyflow.core.config.StudyFlowConfig;
import com.studyflow.core.model.Endpoint;
import com.studyflow.core.model.EndpointProcedureMap;
import com.studyflow.core.model.EndpointType;
import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.StudyFlow;
import com.studyflow.core.model.TopMatrix;
import com.studyflow.core.model.TreatmentCycle;
import com.studyflow.core.model.Visit;
import com.studyflow.core.procedure.InferenceRules;
import com.studyflow.core.procedure.ProcedureCatalog;
import com.studyflow.core.procedure.ProcedureInferenceEngine;
import com.studyflow.core.top.TopMatrixBuilder;
import com.studyflow.core.util.Identifiers;
import com.studyflow.core.visit.CycleBuilder;
import com.studyflow.core.visit.VisitInference;
import com.studyflow.core.visit.VisitNormalizer;
import com.studyflow.core.visit.VisitWindowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Builds a complete study flow from endpoints and a visit schedule.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Normalize the visit labels, or derive a schedule from the study duration</li>
 *   <li>Resolve placeholder days and infer missing mandatory visits</li>
 *   <li>Infer endpoint procedures and add standard procedures per visit type</li>
 *   <li>Assign required endpoint procedures to the visits their timing covers</li>
 *   <li>Calculate visit windows and treatment cycles</li>
 *   <li>Build the Table of Procedures</li>
 * </ol>
 */
public class StudyFlowGenerator {

    private static final Logger log = LoggerFactory.getLogger(StudyFlowGenerator.class);

    static final int MAX_ENDPOINTS = 10;
    static final List<String> DEFAULT_ENDPOINT_NAMES = List.of(
        "Primary efficacy endpoint",
        "Safety assessment",
        "Vital signs",
        "Laboratory parameters");

    private final ProcedureInferenceEngine inferenceEngine;
    private final EndpointProcedureMapper endpointMapper;
    private final VisitNormalizer normalizer = new VisitNormalizer();
    private final VisitInference visitInference;
    private final VisitWindowEngine windowEngine = new VisitWindowEngine();
    private final CycleBuilder cycleBuilder;
    private final TopMatrixBuilder topBuilder = new TopMatrixBuilder();

    public StudyFlowGenerator(ProcedureCatalog catalog, InferenceRules rules) {
        this(catalog, rules, StudyFlowConfig.defaults());
    }

    public StudyFlowGenerator(ProcedureCatalog catalog, InferenceRules rules, StudyFlowConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.inferenceEngine = new ProcedureInferenceEngine(catalog, rules);
        this.endpointMapper = new EndpointProcedureMapper(inferenceEngine);
        this.visitInference = new VisitInference(config.autofix().defaultEotDay());
        this.cycleBuilder = new CycleBuilder(config.cycles());
    }

    /**
     * Generates a study flow.
     *
     * @param request endpoints, visit labels and duration
     * @return generated flow with its endpoints and endpoint maps
     */
    public GeneratedStudy generate(StudyFlowRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        List<Endpoint> endpoints = endpointsFor(request);

        boolean fromLabels = !request.visitLabels().isEmpty();
        List<String> labels = fromLabels ? request.visitLabels() : buildVisitSchedule(request.durationWeeks());
        List<Visit> visits = normalizer.toVisits(labels);
        visits = visitInference.resolveSentinelDays(visits);
        visits = visitInference.inferMissingVisits(visits);

        List<EndpointProcedureMap> endpointMaps = endpointMapper.createMaps(endpoints);
        Map<String, Procedure> procedures = new LinkedHashMap<>();
        for (Procedure procedure : inferenceEngine.inferForEndpoints(endpoints)) {
            procedures.put(procedure.id(), procedure);
        }

        List<Visit> assigned = new ArrayList<>();
        for (Visit visit : visits) {
            Visit updated = visit;
            for (EndpointProcedureMap map : endpointMaps) {
                if (EndpointProcedureMapper.appliesAt(map.timing(), visit.type())) {
                    for (String procedureId : map.requiredProcedures()) {
                        updated = updated.withProcedure(procedureId);
                    }
                }
            }
            for (Procedure standard : inferenceEngine.standardProcedures(visit.type())) {
                procedures.putIfAbsent(standard.id(), standard);
                updated = updated.withProcedure(standard.id());
            }
            assigned.add(updated);
        }

        List<Procedure> procedureList = List.copyOf(procedures.values());
        visits = windowEngine.applyWindowsToVisits(assigned, procedureList);

        List<TreatmentCycle> cycles = List.of();
        OptionalInt cycleLength = request.cycleLengthDays() != null
            ? OptionalInt.of(request.cycleLengthDays())
            : cycleBuilder.inferCycleLength(visits);
        if (cycleLength.isPresent()) {
            cycles = cycleBuilder.buildCycles(visits, cycleLength.getAsInt());
            visits = cycleBuilder.assignVisitsToCycles(visits, cycles);
        }

        TopMatrix top = topBuilder.build(visits, procedureList);
        int lastDay = visits.stream().mapToInt(Visit::day).max().orElse(0);
        int totalDuration = Math.max(lastDay, request.durationWeeks() * 7);

        Map<String, String> metadata = Map.of(
            "source", "auto-generated",
            "visitSource", fromLabels ? "labels" : "duration",
            "studyId", request.studyId());
        StudyFlow flow = new StudyFlow("flow_" + Identifiers.slug(request.studyId()), visits, procedureList,
            cycles, top, totalDuration, metadata);

        log.info("Generated study flow {}: {} visits, {} procedures, {} cycles",
            flow.id(), flow.visits().size(), flow.procedures().size(), cycles.size());
        return new GeneratedStudy(flow, endpoints, endpointMaps);
    }

    /**
     * Derives visit labels from the treatment duration.
     *
     * <p>Up to 4 weeks: weeks 2 and 4. Up to 12: weeks 4, 8 and 12. Longer studies get a
     * visit every 4 weeks through week 24 or the last week, whichever is later. Screening,
     * baseline, end-of-treatment and follow-up visits frame the treatment visits.
     *
     * @param durationWeeks treatment duration in weeks
     * @return visit labels
     */
    public static List<String> buildVisitSchedule(int durationWeeks) {
        List<String> labels = new ArrayList<>(List.of("Screening", "Baseline"));
        if (durationWeeks <= 4) {
            labels.addAll(List.of("Week 2", "Week 4"));
        } else if (durationWeeks <= 12) {
            labels.addAll(List.of("Week 4", "Week 8", "Week 12"));
        } else {
            int lastWeek = Math.max(durationWeeks, 24);
            for (int week = 4; week <= lastWeek; week += 4) {
                labels.add("Week " + week);
            }
        }
        labels.add("End of Treatment");
        labels.add("Follow-up");
        return labels;
    }

    private static List<Endpoint> endpointsFor(StudyFlowRequest request) {
        if (!request.endpoints().isEmpty()) {
            return request.endpoints().stream().limit(MAX_ENDPOINTS).toList();
        }
        List<Endpoint> defaults = new ArrayList<>();
        for (int i = 0; i < DEFAULT_ENDPOINT_NAMES.size(); i++) {
            EndpointType type = i == 0 ? EndpointType.PRIMARY : EndpointType.SECONDARY;
            defaults.add(new Endpoint("ep_" + i, DEFAULT_ENDPOINT_NAMES.get(i), type, null));
        }
        log.debug("No endpoints given, using {} default endpoints", defaults.size());
        return defaults;
    }
}
