package com.studyflow.core.visit;

import java.util.List;

/**
 * @param totalCycles number of cycles
 * @param averageCycleLength mean cycle length in days
 * @param totalDuration days from the first cycle start to the last cycle end
 * @param visitsPerCycle visit count of each cycle, in cycle order
 */
public record CycleSummary(int totalCycles, double averageCycleLength, int totalDuration, List<Integer> visitsPerCycle) {
    public CycleSummary {
        visitsPerCycle = visitsPerCycle == null ? List.of() : List.copyOf(visitsPerCycle);
    }
}
