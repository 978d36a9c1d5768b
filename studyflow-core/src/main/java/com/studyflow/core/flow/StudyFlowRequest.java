package com.studyflow.core.flow;

import com.studyflow.core.model.Endpoint;

import java.util.List;

/**
 * Input of study flow generation.
 *
 * @param studyId study identifier, used to derive the flow id
 * @param endpoints study endpoints; defaults are used when empty
 * @param visitLabels raw visit labels; a schedule is derived from the duration when empty
 * @param durationWeeks treatment duration in weeks
 * @param cycleLengthDays treatment cycle length, or null to infer it from the visits
 */
public record StudyFlowRequest(
    String studyId,
    List<Endpoint> endpoints,
    List<String> visitLabels,
    Integer durationWeeks,
    Integer cycleLengthDays
) {
    public static final String DEFAULT_STUDY_ID = "study";
    public static final int DEFAULT_DURATION_WEEKS = 24;

    public StudyFlowRequest {
        studyId = studyId == null || studyId.isBlank() ? DEFAULT_STUDY_ID : studyId;
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        visitLabels = visitLabels == null ? List.of() : List.copyOf(visitLabels);
        durationWeeks = durationWeeks == null || durationWeeks <= 0 ? DEFAULT_DURATION_WEEKS : durationWeeks;
        if (cycleLengthDays != null && cycleLengthDays <= 0) {
            throw new IllegalArgumentException("cycleLengthDays must be positive: " + cycleLengthDays);
        }
    }

    public static StudyFlowRequest forEndpoints(List<Endpoint> endpoints, int durationWeeks) {
        return new StudyFlowRequest(null, endpoints, List.of(), durationWeeks, null);
    }
}
