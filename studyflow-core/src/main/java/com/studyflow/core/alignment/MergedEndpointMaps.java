package com.studyflow.core.alignment;

import com.studyflow.core.model.EndpointProcedureMap;

import java.util.List;

/**
 * Union of the procedure requirements of several endpoints, in first-seen order.
 *
 * @param allRequiredProcedures required procedure ids of any endpoint
 * @param allRecommendedProcedures recommended procedure ids of any endpoint
 * @param byEndpoint the source maps
 */
public record MergedEndpointMaps(
    List<String> allRequiredProcedures,
    List<String> allRecommendedProcedures,
    List<EndpointProcedureMap> byEndpoint
) {
    public MergedEndpointMaps {
        allRequiredProcedures = List.copyOf(allRequiredProcedures);
        allRecommendedProcedures = List.copyOf(allRecommendedProcedures);
        byEndpoint = List.copyOf(byEndpoint);
    }
}
