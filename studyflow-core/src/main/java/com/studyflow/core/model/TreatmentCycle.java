package com.studyflow.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A repeating block of treatment visits.
 *
 * @param id cycle identifier ({@code cycle_<number>})
 * @param number 1-based cycle number
 * @param startDay first day of the cycle
 * @param endDay last day of the cycle (inclusive)
 * @param lengthDays cycle length in days
 * @param visitIds visits falling in the day range
 */
public record TreatmentCycle(
    String id,
    int number,
    int startDay,
    int endDay,
    int lengthDays,
    List<String> visitIds
) {
    public TreatmentCycle {
        Objects.requireNonNull(id, "id must not be null");
        visitIds = visitIds == null ? List.of() : List.copyOf(visitIds);
    }

    public boolean contains(int day) {
        return day >= startDay && day <= endDay;
    }
}
