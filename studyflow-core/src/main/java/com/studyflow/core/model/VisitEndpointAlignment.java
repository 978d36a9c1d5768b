package com.studyflow.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Whether a visit carries what an endpoint requires at that phase.
 *
 * @param visitId visit identifier
 * @param endpointId endpoint identifier
 * @param hasProcedures whether every required procedure is present
 * @param missingProcedures required procedure ids absent from the visit
 * @param timingCorrect whether the visit phase is valid for assessing the endpoint
 */
public record VisitEndpointAlignment(
    String visitId,
    String endpointId,
    boolean hasProcedures,
    List<String> missingProcedures,
    boolean timingCorrect
) {
    public VisitEndpointAlignment {
        Objects.requireNonNull(visitId, "visitId must not be null");
        Objects.requireNonNull(endpointId, "endpointId must not be null");
        missingProcedures = missingProcedures == null ? List.of() : List.copyOf(missingProcedures);
    }

    public boolean aligned() {
        return hasProcedures && timingCorrect;
    }
}
