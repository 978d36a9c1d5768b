package com.studyflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * Procedures an endpoint needs and the phases at which it needs them.
 *
 * @param endpointId endpoint identifier
 * @param endpointName endpoint name
 * @param endpointType endpoint hierarchy level
 * @param requiredProcedures ids of mandatory procedures
 * @param recommendedProcedures ids of supporting procedures
 * @param timing assessment phases
 */
public record EndpointProcedureMap(
    String endpointId,
    String endpointName,
    EndpointType endpointType,
    List<String> requiredProcedures,
    List<String> recommendedProcedures,
    EndpointTiming timing
) {
    public EndpointProcedureMap {
        Objects.requireNonNull(endpointId, "endpointId must not be null");
        Objects.requireNonNull(endpointType, "endpointType must not be null");
        Objects.requireNonNull(timing, "timing must not be null");
        requiredProcedures = requiredProcedures == null ? List.of() : List.copyOf(requiredProcedures);
        recommendedProcedures = recommendedProcedures == null ? List.of() : List.copyOf(recommendedProcedures);
    }

    @JsonIgnore
    public boolean isPrimary() {
        return endpointType == EndpointType.PRIMARY;
    }
}
