package com.studyflow.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Visits at which the SAP assesses an endpoint.
 *
 * @param endpointId endpoint identifier
 * @param visitIds assessment visits
 */
public record AssessmentSchedule(String endpointId, List<String> visitIds) {
    public AssessmentSchedule {
        Objects.requireNonNull(endpointId, "endpointId must not be null");
        visitIds = visitIds == null ? List.of() : List.copyOf(visitIds);
    }
}
