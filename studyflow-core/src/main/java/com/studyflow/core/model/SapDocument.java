package com.studyflow.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Statistical analysis plan content relevant to study flow validation.
 *
 * @param visitCount number of analysis visits, or null when the SAP does not state it
 * @param cycleLengths treatment cycle lengths in days, in cycle order
 * @param assessmentSchedules per-endpoint assessment visits
 */
public record SapDocument(
    Integer visitCount,
    List<Integer> cycleLengths,
    List<AssessmentSchedule> assessmentSchedules
) {
    public SapDocument {
        cycleLengths = cycleLengths == null ? List.of() : List.copyOf(cycleLengths);
        assessmentSchedules = assessmentSchedules == null ? List.of() : List.copyOf(assessmentSchedules);
    }

    public boolean hasScheduleFor(String endpointId) {
        return assessmentSchedules.stream().anyMatch(s -> s.endpointId().equals(endpointId));
    }

    /**
     * Folds SAP assessment-schedule changes into a new document.
     *
     * <p>A change for an endpoint that already has a schedule replaces it. Changes
     * without a schedule payload or not targeting the SAP are ignored.
     *
     * @param changes changes produced by the auto-fix engine
     * @return updated SAP
     */
    public SapDocument withChanges(List<FlowChange> changes) {
        List<AssessmentSchedule> schedules = new ArrayList<>(assessmentSchedules);
        for (FlowChange change : changes) {
            if (!FlowChange.SAP.equals(change.targetId()) || change.schedule() == null) {
                continue;
            }
            schedules.removeIf(s -> s.endpointId().equals(change.schedule().endpointId()));
            schedules.add(change.schedule());
        }
        return new SapDocument(visitCount, cycleLengths, schedules);
    }
}
