package com.studyflow.core.procedure;

import com.studyflow.core.model.ProcedureCategory;

import java.util.Map;

/**
 * Procedure catalog statistics.
 *
 * @param total number of entries
 * @param byCategory entries per category
 * @param withStandardCodes entries carrying a LOINC/SNOMED/MedDRA code
 * @param withEndpointLinks entries tagged with at least one endpoint type
 * @param invasive entries flagged invasive
 */
public record CatalogStats(
    int total,
    Map<ProcedureCategory, Integer> byCategory,
    int withStandardCodes,
    int withEndpointLinks,
    int invasive
) {
    public CatalogStats {
        byCategory = Map.copyOf(byCategory);
    }
}
