package com.studyflow.core.visit;

import com.studyflow.core.model.CheckResult;
import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitType;
import com.studyflow.core.model.VisitWindow;
import com.studyflow.core.util.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Completes a visit schedule with the mandatory visits it is missing.
 *
 * <p>Inferred visits are tagged {@code source=inferred} in their metadata so that
 * downstream reports can tell them apart from protocol visits.
 */
public class VisitInference {

    private static final Logger log = LoggerFactory.getLogger(VisitInference.class);

    public static final int DEFAULT_END_OF_TREATMENT_DAY = 84;
    public static final int FOLLOW_UP_OFFSET_DAYS = 30;

    private final int defaultEndOfTreatmentDay;

    public VisitInference() {
        this(DEFAULT_END_OF_TREATMENT_DAY);
    }

    public VisitInference(int defaultEndOfTreatmentDay) {
        this.defaultEndOfTreatmentDay = defaultEndOfTreatmentDay;
    }

    /**
     * Places end-of-treatment and follow-up visits that still carry the normalizer's
     * sentinel days.
     *
     * <p>An end-of-treatment visit moves to the last treatment day and replaces the
     * treatment visit scheduled there, taking over its procedures. A follow-up visit
     * moves to 30 days after end of treatment.
     *
     * @param visits normalized visits
     * @return visits sorted by day with real day offsets
     */
    public List<Visit> resolveSentinelDays(List<Visit> visits) {
        List<Visit> result = new ArrayList<>(visits);

        Visit endOfTreatment = findSentinel(result, VisitType.END_OF_TREATMENT, VisitNormalizer.END_OF_TREATMENT_DAY);
        if (endOfTreatment != null) {
            Visit lastTreatment = lastTreatmentVisit(result);
            int day = lastTreatment != null ? lastTreatment.day() : defaultEndOfTreatmentDay;
            List<String> procedures = new ArrayList<>();
            if (lastTreatment != null) {
                procedures.addAll(lastTreatment.procedures());
                result.remove(lastTreatment);
                log.debug("End of treatment replaces '{}' on day {}", lastTreatment.name(), day);
            }
            procedures.addAll(endOfTreatment.procedures());
            replace(result, endOfTreatment, endOfTreatment.withDay(day).withProcedures(procedures));
        }

        Visit followUp = findSentinel(result, VisitType.FOLLOW_UP, VisitNormalizer.FOLLOW_UP_DAY);
        if (followUp != null) {
            int day = endOfTreatmentDay(result) + FOLLOW_UP_OFFSET_DAYS;
            replace(result, followUp, followUp.withDay(day));
            log.debug("Follow-up placed on day {}", day);
        }

        result.sort(Comparator.comparingInt(Visit::day));
        return result;
    }

    /**
     * Adds screening, baseline, end-of-treatment and follow-up visits when absent.
     *
     * @param visits current schedule
     * @return schedule with mandatory visits, sorted by day
     */
    public List<Visit> inferMissingVisits(List<Visit> visits) {
        List<Visit> result = new ArrayList<>(visits);
        Set<String> usedIds = result.stream().map(Visit::id).collect(Collectors.toCollection(HashSet::new));

        if (!hasType(result, VisitType.SCREENING)) {
            result.add(inferred(Identifiers.uniqueId("visit_screening", usedIds), "Screening",
                VisitNormalizer.SCREENING_DAY, VisitType.SCREENING, VisitWindow.symmetric(7), true,
                "Screening visit inferred before baseline"));
        }
        if (!hasType(result, VisitType.BASELINE)) {
            result.add(inferred(Identifiers.uniqueId("visit_baseline", usedIds), "Baseline",
                0, VisitType.BASELINE, VisitWindow.zero(), true,
                "Baseline visit inferred at Day 0"));
        }
        if (!hasType(result, VisitType.END_OF_TREATMENT)) {
            Visit lastTreatment = lastTreatmentVisit(result);
            int day = lastTreatment != null ? lastTreatment.day() : defaultEndOfTreatmentDay;
            result.add(inferred(Identifiers.uniqueId("visit_end_of_treatment", usedIds), "End of Treatment",
                day, VisitType.END_OF_TREATMENT, VisitWindow.symmetric(3), true,
                "End of treatment visit inferred at last treatment day"));
        }
        if (!hasType(result, VisitType.FOLLOW_UP)) {
            int day = endOfTreatmentDay(result) + FOLLOW_UP_OFFSET_DAYS;
            result.add(inferred(Identifiers.uniqueId("visit_follow_up", usedIds), "Follow-up",
                day, VisitType.FOLLOW_UP, VisitWindow.symmetric(7), false,
                "Safety follow-up inferred 30 days after end of treatment"));
        }

        int added = result.size() - visits.size();
        if (added > 0) {
            log.info("Inferred {} missing visit(s)", added);
        }
        result.sort(Comparator.comparingInt(Visit::day));
        return result;
    }

    /**
     * Checks the structural rules of a schedule: a baseline visit must exist, negative
     * days are only legal for screening and unscheduled visits, and two scheduled
     * visits must not share a day.
     *
     * @param visits schedule to check
     * @return errors and warnings
     */
    public CheckResult validateVisitSequence(List<Visit> visits) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (!hasType(visits, VisitType.BASELINE)) {
            errors.add("Missing baseline visit (Day 0)");
        }

        for (Visit visit : visits) {
            if (visit.day() < 0 && !visit.type().allowsNegativeDay()) {
                errors.add("Visit \"" + visit.name() + "\" has negative day " + visit.day()
                    + " but type " + visit.type().wireName());
            }
        }

        Map<Integer, List<String>> byDay = new LinkedHashMap<>();
        visits.stream()
            .filter(v -> v.type() != VisitType.UNSCHEDULED)
            .forEach(v -> byDay.computeIfAbsent(v.day(), d -> new ArrayList<>()).add(v.name()));
        byDay.forEach((day, names) -> {
            if (names.size() > 1) {
                warnings.add("Multiple visits on Day " + day + ": " + String.join(", ", names));
            }
        });

        return new CheckResult(errors, warnings);
    }

    /**
     * Appends an optional unscheduled visit.
     *
     * @param visits current schedule
     * @param name visit name, "Unscheduled" when null
     * @return schedule including the unscheduled visit
     */
    public List<Visit> addUnscheduledVisit(List<Visit> visits, String name) {
        Set<String> usedIds = visits.stream().map(Visit::id).collect(Collectors.toCollection(HashSet::new));
        String visitName = name == null || name.isBlank() ? "Unscheduled" : name.trim();
        Visit unscheduled = new Visit(
            Identifiers.uniqueId("visit_unscheduled", usedIds), visitName, VisitNormalizer.UNSCHEDULED_DAY,
            null, VisitType.UNSCHEDULED, null, List.of(), false, Map.of("source", "unscheduled"));

        List<Visit> result = new ArrayList<>(visits);
        result.add(unscheduled);
        result.sort(Comparator.comparingInt(Visit::day));
        return result;
    }

    private static Visit inferred(String id, String name, int day, VisitType type, VisitWindow window,
                                  boolean required, String notes) {
        log.debug("Inferring {} visit on day {}", type.wireName(), day);
        return new Visit(id, name, day, null, type, window, List.of(), required,
            Map.of("source", "inferred", "notes", notes));
    }

    private static boolean hasType(List<Visit> visits, VisitType type) {
        return visits.stream().anyMatch(v -> v.type() == type);
    }

    private static Visit lastTreatmentVisit(List<Visit> visits) {
        return visits.stream()
            .filter(v -> v.type() == VisitType.TREATMENT)
            .max(Comparator.comparingInt(Visit::day))
            .orElse(null);
    }

    private int endOfTreatmentDay(List<Visit> visits) {
        return visits.stream()
            .filter(v -> v.type() == VisitType.END_OF_TREATMENT)
            .mapToInt(Visit::day)
            .max()
            .orElseGet(() -> {
                Visit lastTreatment = lastTreatmentVisit(visits);
                return lastTreatment != null ? lastTreatment.day() : defaultEndOfTreatmentDay;
            });
    }

    private static Visit findSentinel(List<Visit> visits, VisitType type, int sentinelDay) {
        return visits.stream()
            .filter(v -> v.type() == type && v.day() == sentinelDay)
            .findFirst()
            .orElse(null);
    }

    private static void replace(List<Visit> visits, Visit original, Visit replacement) {
        visits.set(visits.indexOf(original), replacement);
    }
}
