package com.studyflow.core.top;

import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.Visit;

import java.util.List;

/**
 * Fill statistics of a Table of Procedures.
 *
 * @param totalVisits matrix rows
 * @param totalProcedures matrix columns
 * @param totalCells rows x columns
 * @param filledCells true cells
 * @param fillPercentage filled share in percent
 * @param proceduresPerVisit filled cells per row
 * @param visitsPerProcedure filled cells per column
 * @param mostCommonProcedures up to ten procedures with the most visits, descending
 * @param busiestVisits up to ten visits with the most procedures, descending
 */
public record TopStats(
    int totalVisits,
    int totalProcedures,
    int totalCells,
    int filledCells,
    double fillPercentage,
    List<Integer> proceduresPerVisit,
    List<Integer> visitsPerProcedure,
    List<ProcedureCount> mostCommonProcedures,
    List<VisitCount> busiestVisits
) {
    public TopStats {
        proceduresPerVisit = List.copyOf(proceduresPerVisit);
        visitsPerProcedure = List.copyOf(visitsPerProcedure);
        mostCommonProcedures = List.copyOf(mostCommonProcedures);
        busiestVisits = List.copyOf(busiestVisits);
    }

    public double averageProceduresPerVisit() {
        return totalVisits > 0 ? (double) filledCells / totalVisits : 0;
    }

    public record ProcedureCount(Procedure procedure, int count) {
    }

    public record VisitCount(Visit visit, int count) {
    }
}
