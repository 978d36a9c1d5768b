package com.studyflow.core.alignment;

/**
 * Percentage of an endpoint's procedures that the flow performs. An endpoint with no
 * procedures of a kind has 100% coverage for that kind.
 */
public record EndpointCoverage(
    String endpointId,
    String endpointName,
    double requiredCoverage,
    double recommendedCoverage,
    int missingRequired,
    int missingRecommended
) {
}
