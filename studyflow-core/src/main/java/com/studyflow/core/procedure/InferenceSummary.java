package com.studyflow.core.procedure;

import com.studyflow.core.model.ProcedureCategory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts over an inferred procedure set.
 *
 * @param total procedures
 * @param required required procedures
 * @param optional procedures not required
 * @param byCategory procedures per category
 * @param byEndpoint procedures per linked endpoint id
 * @param linkedToEndpoints procedures linked to at least one endpoint
 */
public record InferenceSummary(
    int total,
    int required,
    int optional,
    Map<ProcedureCategory, Integer> byCategory,
    Map<String, Integer> byEndpoint,
    int linkedToEndpoints
) {
    public InferenceSummary {
        byCategory = Map.copyOf(byCategory);
        byEndpoint = Collections.unmodifiableMap(new LinkedHashMap<>(byEndpoint));
    }
}
