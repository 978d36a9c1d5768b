package com.studyflow.core.alignment;

import java.util.List;

/**
 * Procedures to add to a visit so it satisfies an endpoint.
 *
 * @param visitId target visit
 * @param visitName target visit name
 * @param endpointId endpoint that needs the procedures
 * @param procedureIds procedures to add
 * @param reason human-readable reason
 */
public record ProcedureAddition(
    String visitId,
    String visitName,
    String endpointId,
    List<String> procedureIds,
    String reason
) {
    public ProcedureAddition {
        procedureIds = List.copyOf(procedureIds);
    }
}
