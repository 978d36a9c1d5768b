package com.studyflow.core.procedure;

import com.studyflow.core.model.Endpoint;
import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.ProcedureCatalogEntry;
import com.studyflow.core.model.ProcedureCategory;
import com.studyflow.core.model.VisitType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Derives the procedures an endpoint requires from its name.
 *
 * <p>An endpoint name is matched against keyword rules to obtain domain categories
 * (diabetes, cardiovascular, ...). Every endpoint also receives the always-on
 * categories ({@code safety}). Each category contributes a fixed list of catalog
 * procedures; the deduplicated union is the endpoint's inferred procedure set.
 *
 * <p>Procedures are required only when inferred for a primary endpoint. When several
 * endpoints share a procedure, {@code required} is OR-ed and never downgraded.
 */
public class ProcedureInferenceEngine {

    private static final Logger log = LoggerFactory.getLogger(ProcedureInferenceEngine.class);

    private final ProcedureCatalog catalog;
    private final InferenceRules rules;

    public ProcedureInferenceEngine(ProcedureCatalog catalog, InferenceRules rules) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
    }

    /**
     * Detects domain categories from an endpoint name.
     *
     * @param endpointName free-text endpoint name
     * @return categories in rule order, deduplicated, always-on categories last
     */
    public List<String> detectCategories(String endpointName) {
        String lower = endpointName == null ? "" : endpointName.toLowerCase(Locale.ROOT);
        Set<String> categories = new LinkedHashSet<>();
        for (InferenceRules.KeywordRule rule : rules.keywordRules()) {
            if (rule.matches(lower)) {
                categories.addAll(rule.categories());
            }
        }
        categories.addAll(rules.alwaysCategories());
        return List.copyOf(categories);
    }

    /**
     * Infers the procedures one endpoint requires.
     *
     * @param endpoint endpoint to analyze
     * @return procedures linked to the endpoint, required when the endpoint is primary
     */
    public List<Procedure> inferForEndpoint(Endpoint endpoint) {
        Set<String> procedureIds = new LinkedHashSet<>();
        for (String category : detectCategories(endpoint.name())) {
            procedureIds.addAll(rules.proceduresFor(category));
        }

        List<Procedure> procedures = new ArrayList<>();
        for (String procedureId : procedureIds) {
            Optional<ProcedureCatalogEntry> entry = catalog.findById(procedureId);
            if (entry.isEmpty()) {
                log.warn("Inference rule references unknown procedure: {}", procedureId);
                continue;
            }
            procedures.add(entry.get().instantiate(endpoint.isPrimary(), List.of(endpoint.id())));
        }
        log.debug("Inferred {} procedures for endpoint {}", procedures.size(), endpoint.id());
        return procedures;
    }

    /**
     * Infers and merges procedures for several endpoints.
     *
     * <p>Procedures keep the order in which they were first inferred. Linked endpoints are
     * unioned and {@code required} becomes true if any linking endpoint is primary.
     *
     * @param endpoints study endpoints
     * @return merged procedure list
     */
    public List<Procedure> inferForEndpoints(List<Endpoint> endpoints) {
        Map<String, Procedure> merged = new LinkedHashMap<>();
        for (Endpoint endpoint : endpoints) {
            for (Procedure procedure : inferForEndpoint(endpoint)) {
                merged.merge(procedure.id(), procedure, Procedure::mergedWith);
            }
        }
        log.info("Inferred {} procedures from {} endpoints", merged.size(), endpoints.size());
        return List.copyOf(merged.values());
    }

    /**
     * Returns the standard procedures scheduled at every visit of a type.
     *
     * <p>Standard procedures are protocol housekeeping, not endpoint requirements, so they
     * are instantiated as not required and without linked endpoints.
     *
     * @param type visit type
     * @return standard procedures, empty for unscheduled visits
     */
    public List<Procedure> standardProcedures(VisitType type) {
        List<Procedure> procedures = new ArrayList<>();
        for (String procedureId : rules.standardProceduresFor(type)) {
            catalog.findById(procedureId)
                .ifPresentOrElse(
                    entry -> procedures.add(entry.instantiate(false, List.of())),
                    () -> log.warn("Standard procedure list references unknown procedure: {}", procedureId));
        }
        return procedures;
    }

    /**
     * Summarizes an inferred procedure set.
     */
    public static InferenceSummary summarize(List<Procedure> procedures) {
        Map<ProcedureCategory, Integer> byCategory = new EnumMap<>(ProcedureCategory.class);
        Map<String, Integer> byEndpoint = new LinkedHashMap<>();
        int required = 0;
        int linked = 0;
        for (Procedure procedure : procedures) {
            byCategory.merge(procedure.category(), 1, Integer::sum);
            if (procedure.required()) {
                required++;
            }
            if (!procedure.linkedEndpoints().isEmpty()) {
                linked++;
            }
            for (String endpointId : procedure.linkedEndpoints()) {
                byEndpoint.merge(endpointId, 1, Integer::sum);
            }
        }
        return new InferenceSummary(procedures.size(), required, procedures.size() - required,
            byCategory, byEndpoint, linked);
    }
}
