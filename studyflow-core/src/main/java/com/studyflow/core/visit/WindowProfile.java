package com.studyflow.core.visit;

import com.studyflow.core.model.ProcedureCategory;

import java.util.Set;

/**
 * Window sizing profiles, chosen from the categories of the procedures at a visit.
 */
public enum WindowProfile {
    /** PK or PD sampling: ±1 in the first week, ±2 to day 28, then ±3. */
    STRICT,
    /** Efficacy assessments: ±2, ±3, ±5 up to week 12, then ±7. */
    MODERATE,
    /** Safety monitoring: ±1 to day 14, ±2 to day 28, then ±3. */
    NARROW,
    /** Anything else: 10% of the day with a 3-day floor. */
    STANDARD;

    /**
     * Picks the profile for a set of categories. PK/PD wins over efficacy, efficacy over
     * safety.
     *
     * @param categories categories of the procedures at a visit
     * @return profile
     */
    public static WindowProfile forCategories(Set<ProcedureCategory> categories) {
        if (categories.contains(ProcedureCategory.PK) || categories.contains(ProcedureCategory.PD)) {
            return STRICT;
        }
        if (categories.contains(ProcedureCategory.EFFICACY)) {
            return MODERATE;
        }
        if (categories.contains(ProcedureCategory.SAFETY)) {
            return NARROW;
        }
        return STANDARD;
    }

    /**
     * Half-width of the window for a day under this profile.
     *
     * @param day visit day, non-zero
     * @return days allowed on each side
     */
    int halfWidth(int day) {
        return switch (this) {
            case STRICT -> day <= 7 ? 1 : day <= 28 ? 2 : 3;
            case MODERATE -> day <= 7 ? 2 : day <= 28 ? 3 : day <= 84 ? 5 : 7;
            case NARROW -> day <= 14 ? 1 : day <= 28 ? 2 : 3;
            case STANDARD -> Math.max((int) Math.ceil(day * 0.1), 3);
        };
    }
}
