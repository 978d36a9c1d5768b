package com.studyflow.core.flow;

import com.studyflow.core.model.Endpoint;
import com.studyflow.core.model.EndpointProcedureMap;
import com.studyflow.core.model.StudyFlow;

import java.util.List;
import java.util.Objects;

/**
 * A generated flow together with the endpoints it was built for.
 *
 * <p>This is the unit the CLI persists, so later validation and auto-fix runs see the
 * same endpoint maps as generation did.
 *
 * @param flow generated study flow
 * @param endpoints study endpoints
 * @param endpointMaps endpoint procedure maps
 */
public record GeneratedStudy(StudyFlow flow, List<Endpoint> endpoints, List<EndpointProcedureMap> endpointMaps) {
    public GeneratedStudy {
        Objects.requireNonNull(flow, "flow must not be null");
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        endpointMaps = endpointMaps == null ? List.of() : List.copyOf(endpointMaps);
    }

    public GeneratedStudy withFlow(StudyFlow newFlow) {
        return new GeneratedStudy(newFlow, endpoints, endpointMaps);
    }
}
