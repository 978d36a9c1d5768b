package com.studyflow.core.visit;

import com.studyflow.core.model.CheckResult;
import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.ProcedureCategory;
import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Calculates visit windows from the visit day and the categories of its procedures.
 *
 * @see WindowProfile
 */
public class VisitWindowEngine {

    private static final Logger log = LoggerFactory.getLogger(VisitWindowEngine.class);

    private static final double LARGE_WINDOW_RATIO = 0.3;

    /**
     * Calculates the window for a day. Day 0 always gets a zero window.
     *
     * @param day visit day
     * @param categories categories of the procedures performed at the visit
     * @return window
     */
    public VisitWindow calculateOptimalWindow(int day, Set<ProcedureCategory> categories) {
        if (day == 0) {
            return VisitWindow.zero();
        }
        WindowProfile profile = WindowProfile.forCategories(categories);
        VisitWindow window = VisitWindow.symmetric(profile.halfWidth(day));
        log.debug("Day {}: {} window {}", day, profile, window.format());
        return window;
    }

    /**
     * Calculates the window for a visit, keeping a window the visit already has.
     *
     * @param visit visit to size
     * @param procedures procedures of the flow, used to resolve categories
     * @return window
     */
    public VisitWindow calculateOptimalWindow(Visit visit, List<Procedure> procedures) {
        if (visit.window() != null) {
            return visit.window();
        }
        return calculateOptimalWindow(visit.day(), categoriesAt(visit, index(procedures)));
    }

    public List<Visit> applyWindowsToVisits(List<Visit> visits, List<Procedure> procedures) {
        Map<String, Procedure> byId = index(procedures);
        return visits.stream()
            .map(v -> v.window() != null ? v
                : v.withWindow(calculateOptimalWindow(v.day(), categoriesAt(v, byId))))
            .toList();
    }

    /**
     * Reports visits without a window, windows wider than 30% of the visit day and
     * pairs of visits whose windows overlap. Every finding is a warning.
     *
     * @param visits visits to check
     * @return warnings only
     */
    public CheckResult validateWindows(List<Visit> visits) {
        List<String> warnings = new ArrayList<>();

        for (Visit visit : visits) {
            VisitWindow window = visit.window();
            if (window == null) {
                warnings.add("Visit " + visit.name() + " has no window defined");
                continue;
            }
            if (visit.day() > 0 && window.total() > visit.day() * LARGE_WINDOW_RATIO) {
                warnings.add("Visit " + visit.name() + " has large window (±" + window.minus() + "/"
                    + window.plus() + " days for Day " + visit.day() + ")");
            }
        }

        for (int i = 0; i < visits.size(); i++) {
            for (int j = i + 1; j < visits.size(); j++) {
                Visit first = visits.get(i);
                Visit second = visits.get(j);
                if (overlaps(first, second)) {
                    warnings.add("Window overlap between " + first.name() + " and " + second.name());
                }
            }
        }

        return new CheckResult(List.of(), warnings);
    }

    public WindowSummary summarize(List<Visit> visits) {
        List<Integer> totals = visits.stream()
            .filter(v -> v.window() != null)
            .map(v -> v.window().total())
            .toList();
        if (totals.isEmpty()) {
            return WindowSummary.empty();
        }
        IntSummaryStatistics stats = totals.stream().mapToInt(Integer::intValue).summaryStatistics();
        int strict = (int) totals.stream().filter(t -> t <= 4).count();
        int moderate = (int) totals.stream().filter(t -> t > 4 && t <= 10).count();
        int flexible = (int) totals.stream().filter(t -> t > 10).count();
        return new WindowSummary(stats.getAverage(), stats.getMin(), stats.getMax(), strict, moderate, flexible);
    }

    private static boolean overlaps(Visit first, Visit second) {
        if (first.window() == null || second.window() == null) {
            return false;
        }
        int firstStart = first.day() - first.window().minus();
        int firstEnd = first.day() + first.window().plus();
        int secondStart = second.day() - second.window().minus();
        int secondEnd = second.day() + second.window().plus();
        return firstStart <= secondEnd && firstEnd >= secondStart;
    }

    private static Map<String, Procedure> index(List<Procedure> procedures) {
        return procedures.stream().collect(Collectors.toMap(Procedure::id, Function.identity(), (a, b) -> a));
    }

    private static Set<ProcedureCategory> categoriesAt(Visit visit, Map<String, Procedure> procedures) {
        Set<ProcedureCategory> categories = EnumSet.noneOf(ProcedureCategory.class);
        for (String procedureId : visit.procedures()) {
            Procedure procedure = procedures.get(procedureId);
            if (procedure != null) {
                categories.add(procedure.category());
            }
        }
        return categories;
    }
}
