package com.studyflow.core.top;

import com.studyflow.core.model.CheckResult;
import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.ProcedureCategory;
import com.studyflow.core.model.TopMatrix;
import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Read-only statistics and completeness checks over a Table of Procedures.
 */
public final class TopAnalyzer {

    private static final int TOP_LIST_SIZE = 10;

    private TopAnalyzer() {
        // Utility class
    }

    public static TopStats stats(TopMatrix top) {
        int visitCount = top.visits().size();
        int procedureCount = top.procedures().size();
        int totalCells = visitCount * procedureCount;
        int filled = top.filledCells();

        List<Integer> perVisit = IntStream.range(0, visitCount).mapToObj(v -> rowCount(top, v)).toList();
        List<Integer> perProcedure = IntStream.range(0, procedureCount).mapToObj(p -> columnCount(top, p)).toList();

        List<TopStats.ProcedureCount> mostCommon = IntStream.range(0, procedureCount)
            .mapToObj(p -> new TopStats.ProcedureCount(top.procedures().get(p), perProcedure.get(p)))
            .sorted(Comparator.comparingInt(TopStats.ProcedureCount::count).reversed())
            .limit(TOP_LIST_SIZE)
            .toList();
        List<TopStats.VisitCount> busiest = IntStream.range(0, visitCount)
            .mapToObj(v -> new TopStats.VisitCount(top.visits().get(v), perVisit.get(v)))
            .sorted(Comparator.comparingInt(TopStats.VisitCount::count).reversed())
            .limit(TOP_LIST_SIZE)
            .toList();

        return new TopStats(visitCount, procedureCount, totalCells, filled,
            totalCells > 0 ? filled * 100.0 / totalCells : 0,
            perVisit, perProcedure, mostCommon, busiest);
    }

    /**
     * Occurrence counts per procedure category, in order of first appearance.
     *
     * @param top matrix
     * @return one summary per category present
     */
    public static List<CategorySummary> summarizeByCategory(TopMatrix top) {
        Set<ProcedureCategory> categories = new LinkedHashSet<>();
        top.procedures().forEach(p -> categories.add(p.category()));

        List<CategorySummary> summaries = new ArrayList<>();
        for (ProcedureCategory category : categories) {
            int procedureCount = 0;
            int occurrences = 0;
            for (int p = 0; p < top.procedures().size(); p++) {
                if (top.procedures().get(p).category() == category) {
                    procedureCount++;
                    occurrences += columnCount(top, p);
                }
            }
            int visitCount = top.visits().size();
            summaries.add(new CategorySummary(category, procedureCount, occurrences,
                visitCount > 0 ? (double) occurrences / visitCount : 0));
        }
        return summaries;
    }

    /**
     * Flags visits without procedures, procedures used nowhere, required procedures
     * missing from every visit (errors), and a baseline visit lacking vital signs,
     * physical exam or laboratory tests.
     *
     * @param top matrix to check
     * @return errors and warnings
     */
    public static CheckResult validateCompleteness(TopMatrix top) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (int v = 0; v < top.visits().size(); v++) {
            if (rowCount(top, v) == 0) {
                warnings.add("Visit \"" + top.visits().get(v).name() + "\" has no procedures");
            }
        }

        for (int p = 0; p < top.procedures().size(); p++) {
            Procedure procedure = top.procedures().get(p);
            if (columnCount(top, p) == 0) {
                warnings.add("Procedure \"" + procedure.name() + "\" is not used in any visit");
                if (procedure.required()) {
                    errors.add("Required procedure \"" + procedure.name() + "\" is missing from all visits");
                }
            }
        }

        for (int v = 0; v < top.visits().size(); v++) {
            Visit visit = top.visits().get(v);
            if (visit.type() != VisitType.BASELINE) {
                continue;
            }
            Set<ProcedureCategory> present = EnumSet.noneOf(ProcedureCategory.class);
            for (int p = 0; p < top.procedures().size(); p++) {
                if (top.cell(v, p)) {
                    present.add(top.procedures().get(p).category());
                }
            }
            if (!present.contains(ProcedureCategory.VITAL_SIGNS)) {
                warnings.add("Baseline visit missing vital signs");
            }
            if (!present.contains(ProcedureCategory.PHYSICAL_EXAM)) {
                warnings.add("Baseline visit missing physical exam");
            }
            if (!present.contains(ProcedureCategory.LABS)) {
                warnings.add("Baseline visit missing laboratory tests");
            }
            break;
        }

        return new CheckResult(errors, warnings);
    }

    static int rowCount(TopMatrix top, int visitIndex) {
        int count = 0;
        for (int p = 0; p < top.procedures().size(); p++) {
            if (top.cell(visitIndex, p)) {
                count++;
            }
        }
        return count;
    }

    static int columnCount(TopMatrix top, int procedureIndex) {
        int count = 0;
        for (int v = 0; v < top.visits().size(); v++) {
            if (top.cell(v, procedureIndex)) {
                count++;
            }
        }
        return count;
    }
}
