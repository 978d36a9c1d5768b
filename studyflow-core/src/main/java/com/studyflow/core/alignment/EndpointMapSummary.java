package com.studyflow.core.alignment;

/**
 * Aggregate view over a set of endpoint procedure maps. Procedure totals count
 * distinct ids; averages count per-endpoint list sizes.
 */
public record EndpointMapSummary(
    int totalEndpoints,
    int primaryEndpoints,
    int secondaryEndpoints,
    int exploratoryEndpoints,
    int totalRequiredProcedures,
    int totalRecommendedProcedures,
    double averageRequiredPerEndpoint,
    double averageRecommendedPerEndpoint,
    int endpointsWithBaseline,
    int endpointsWithTreatment,
    int endpointsWithFollowUp
) {
}
