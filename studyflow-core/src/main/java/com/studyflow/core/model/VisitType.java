package com.studyflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Phase of a study visit.
 *
 * <p>Serialized with the lowercase wire names used by protocol documents
 * ({@code end_of_treatment}, {@code follow_up}).
 */
public enum VisitType {
    /**
     * Pre-randomization eligibility visit. May carry a negative day offset.
     */
    SCREENING("screening"),

    /**
     * Day 0 reference visit. Exactly one is expected per flow.
     */
    BASELINE("baseline"),

    /**
     * On-treatment visit.
     */
    TREATMENT("treatment"),

    /**
     * Post-treatment observation visit.
     */
    FOLLOW_UP("follow_up"),

    /**
     * Final on-treatment visit.
     */
    END_OF_TREATMENT("end_of_treatment"),

    /**
     * Ad-hoc visit outside the schedule. May carry a negative day offset.
     */
    UNSCHEDULED("unscheduled");

    private final String wireName;

    VisitType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Returns whether a visit of this type may be scheduled before Day 0.
     *
     * @return true for screening and unscheduled visits
     */
    public boolean allowsNegativeDay() {
        return this == SCREENING || this == UNSCHEDULED;
    }

    @JsonCreator
    public static VisitType fromWireName(String value) {
        for (VisitType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown visit type: " + value);
    }
}
