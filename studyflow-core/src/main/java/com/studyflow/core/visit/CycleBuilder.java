package com.studyflow.core.visit;

import com.studyflow.core.config.StudyFlowConfig.CycleSettings;
import com.studyflow.core.model.CheckResult;
import com.studyflow.core.model.TreatmentCycle;
import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Groups treatment visits into fixed-length treatment cycles.
 */
public class CycleBuilder {

    private static final Logger log = LoggerFactory.getLogger(CycleBuilder.class);

    private final double minIntervalCoverage;

    public CycleBuilder() {
        this(CycleSettings.defaults());
    }

    public CycleBuilder(CycleSettings settings) {
        this.minIntervalCoverage = settings.minIntervalCoverage();
    }

    /**
     * Builds cycles covering the treatment visits.
     *
     * <p>A visit outside the current cycle opens a new one starting at the cycle
     * boundary below its day ({@code floor(day / length) * length}). Cycles are numbered
     * from 1 in day order.
     *
     * @param visits schedule, any order
     * @param cycleLengthDays cycle length, positive
     * @return cycles, empty when there are no treatment visits
     */
    public List<TreatmentCycle> buildCycles(List<Visit> visits, int cycleLengthDays) {
        if (cycleLengthDays <= 0) {
            throw new IllegalArgumentException("Cycle length must be positive: " + cycleLengthDays);
        }
        List<Visit> treatmentVisits = treatmentVisits(visits);
        if (treatmentVisits.isEmpty()) {
            return List.of();
        }

        Map<Integer, List<String>> visitsByStart = new LinkedHashMap<>();
        int currentStart = 0;
        for (Visit visit : treatmentVisits) {
            if (visit.day() < currentStart || visit.day() >= currentStart + cycleLengthDays) {
                currentStart = Math.floorDiv(visit.day(), cycleLengthDays) * cycleLengthDays;
            }
            visitsByStart.computeIfAbsent(currentStart, s -> new ArrayList<>()).add(visit.id());
        }

        List<TreatmentCycle> cycles = new ArrayList<>();
        visitsByStart.forEach((start, visitIds) -> {
            int number = cycles.size() + 1;
            cycles.add(new TreatmentCycle("cycle_" + number, number, start, start + cycleLengthDays - 1,
                cycleLengthDays, visitIds));
        });
        log.debug("Built {} cycle(s) of {} days", cycles.size(), cycleLengthDays);
        return cycles;
    }

    /**
     * Infers the cycle length from the spacing of treatment visits.
     *
     * <p>The most frequent interval between consecutive treatment visits is the cycle
     * length when it accounts for at least 60% of the intervals (ties go to the interval
     * seen first). Two treatment visits are enough.
     *
     * @param visits schedule
     * @return inferred length, or empty when no cycle is detected
     */
    public OptionalInt inferCycleLength(List<Visit> visits) {
        List<Visit> treatmentVisits = treatmentVisits(visits);
        if (treatmentVisits.size() < 2) {
            return OptionalInt.empty();
        }

        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (int i = 1; i < treatmentVisits.size(); i++) {
            int interval = treatmentVisits.get(i).day() - treatmentVisits.get(i - 1).day();
            counts.merge(interval, 1, Integer::sum);
        }
        int intervals = treatmentVisits.size() - 1;

        int mostCommon = 0;
        int maxCount = 0;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > maxCount) {
                mostCommon = entry.getKey();
                maxCount = entry.getValue();
            }
        }

        if (mostCommon > 0 && maxCount >= intervals * minIntervalCoverage) {
            log.debug("Inferred cycle length {} ({} of {} intervals)", mostCommon, maxCount, intervals);
            return OptionalInt.of(mostCommon);
        }
        log.debug("No dominant visit interval among {} intervals", intervals);
        return OptionalInt.empty();
    }

    /**
     * Sets the cycle number of every visit whose day falls in a cycle.
     *
     * @param visits schedule
     * @param cycles cycles to assign
     * @return visits with cycle numbers, same order
     */
    public List<Visit> assignVisitsToCycles(List<Visit> visits, List<TreatmentCycle> cycles) {
        return visits.stream()
            .map(visit -> cycles.stream()
                .filter(c -> c.contains(visit.day()))
                .findFirst()
                .map(c -> visit.withCycle(c.number()))
                .orElse(visit))
            .toList();
    }

    /**
     * Reports gaps between consecutive cycles, overlapping cycles and cycles without
     * visits. Findings are errors; nothing is repaired.
     *
     * @param cycles cycles in order
     * @return structural errors
     */
    public CheckResult validateCycles(List<TreatmentCycle> cycles) {
        List<String> errors = new ArrayList<>();

        for (int i = 1; i < cycles.size(); i++) {
            TreatmentCycle previous = cycles.get(i - 1);
            TreatmentCycle current = cycles.get(i);
            if (current.startDay() != previous.endDay() + 1) {
                errors.add("Gap between Cycle " + previous.number() + " and Cycle " + current.number());
            }
        }

        for (int i = 0; i < cycles.size(); i++) {
            for (int j = i + 1; j < cycles.size(); j++) {
                TreatmentCycle first = cycles.get(i);
                TreatmentCycle second = cycles.get(j);
                if (first.startDay() <= second.endDay() && first.endDay() >= second.startDay()) {
                    errors.add("Overlap between Cycle " + first.number() + " and Cycle " + second.number());
                }
            }
        }

        for (TreatmentCycle cycle : cycles) {
            if (cycle.visitIds().isEmpty()) {
                errors.add("Cycle " + cycle.number() + " has no visits");
            }
        }

        return new CheckResult(errors, List.of());
    }

    public CycleSummary summarize(List<TreatmentCycle> cycles) {
        if (cycles.isEmpty()) {
            return new CycleSummary(0, 0, 0, List.of());
        }
        int totalDuration = cycles.get(cycles.size() - 1).endDay() - cycles.get(0).startDay() + 1;
        double averageLength = cycles.stream().mapToInt(TreatmentCycle::lengthDays).average().orElse(0);
        List<Integer> visitsPerCycle = cycles.stream().map(c -> c.visitIds().size()).toList();
        return new CycleSummary(cycles.size(), averageLength, totalDuration, visitsPerCycle);
    }

    private static List<Visit> treatmentVisits(List<Visit> visits) {
        return visits.stream()
            .filter(v -> v.type() == VisitType.TREATMENT)
            .sorted(Comparator.comparingInt(Visit::day))
            .toList();
    }
}
