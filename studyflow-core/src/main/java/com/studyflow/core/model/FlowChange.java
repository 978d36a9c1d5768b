package com.studyflow.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A typed structural edit to a study flow or one of its companion documents.
 *
 * <p>{@code targetId} is a visit id, or one of {@link #PROTOCOL}, {@link #SAP} and
 * {@link #ICF} for document-level edits. Exactly one of the payload fields
 * ({@code visit}, {@code procedure}, {@code window}, {@code schedule}) is set for
 * machine-applicable changes; descriptive changes carry only {@code oldValue}/{@code newValue}.
 *
 * @param type kind of edit
 * @param targetId visit id or document target
 * @param field modified field, or null
 * @param oldValue previous value as display text, or null
 * @param newValue new value as display text, or null
 * @param visit visit to add
 * @param procedure procedure to add
 * @param window window to set
 * @param schedule SAP assessment schedule to set
 * @param reason why the change is proposed
 */
public record FlowChange(
    ChangeType type,
    String targetId,
    String field,
    String oldValue,
    String newValue,
    Visit visit,
    Procedure procedure,
    VisitWindow window,
    AssessmentSchedule schedule,
    String reason
) {
    public static final String PROTOCOL = "protocol";
    public static final String SAP = "sap";
    public static final String ICF = "icf";

    public FlowChange {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    public static FlowChange addVisit(Visit visit, String reason) {
        return new FlowChange(ChangeType.ADD_VISIT, PROTOCOL, null, null,
            visit.name() + " (Day " + visit.day() + ")", visit, null, null, null, reason);
    }

    /**
     * Adds a procedure to the flow's procedure list.
     */
    public static FlowChange addProcedure(Procedure procedure, String reason) {
        return new FlowChange(ChangeType.ADD_PROCEDURE, PROTOCOL, null, null,
            procedure.id(), null, procedure, null, null, reason);
    }

    /**
     * Assigns a procedure to a visit, adding it to the flow when it is not there yet.
     */
    public static FlowChange addProcedureToVisit(String visitId, Procedure procedure, String reason) {
        return new FlowChange(ChangeType.ADD_PROCEDURE, visitId, "procedures", null,
            procedure.id(), null, procedure, null, null, reason);
    }

    public static FlowChange adjustWindow(String visitId, VisitWindow oldWindow, VisitWindow newWindow, String reason) {
        return new FlowChange(ChangeType.ADJUST_TIMING, visitId, "window",
            oldWindow == null ? null : oldWindow.format(), newWindow.format(),
            null, null, newWindow, null, reason);
    }

    public static FlowChange sapAssessmentSchedule(String endpointId, List<String> visitIds, String reason) {
        return new FlowChange(ChangeType.MODIFY_VISIT, SAP, "assessment_schedule", null,
            endpointId + ": " + String.join(", ", visitIds), null, null, null,
            new AssessmentSchedule(endpointId, visitIds), reason);
    }

    /**
     * Creates a change that only describes an edit for a human to make.
     */
    public static FlowChange describe(ChangeType type, String targetId, String field,
                                      String oldValue, String newValue, String reason) {
        return new FlowChange(type, targetId, field, oldValue, newValue, null, null, null, null, reason);
    }

    /**
     * Returns whether the change edits a visit in place.
     *
     * @return true when the target is a visit id rather than a document
     */
    public boolean targetsVisit() {
        return !PROTOCOL.equals(targetId) && !SAP.equals(targetId) && !ICF.equals(targetId);
    }
}
