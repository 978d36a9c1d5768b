package com.studyflow.core.visit;

/**
 * Window statistics over a schedule. Totals are {@code minus + plus}.
 *
 * @param averageWindow average total window of visits that have one
 * @param minWindow smallest total window
 * @param maxWindow largest total window
 * @param strictVisits visits with a total window of at most 4 days
 * @param moderateVisits visits with a total window of 5 to 10 days
 * @param flexibleVisits visits with a total window above 10 days
 */
public record WindowSummary(
    double averageWindow,
    int minWindow,
    int maxWindow,
    int strictVisits,
    int moderateVisits,
    int flexibleVisits
) {
    public static WindowSummary empty() {
        return new WindowSummary(0, 0, 0, 0, 0, 0);
    }
}
