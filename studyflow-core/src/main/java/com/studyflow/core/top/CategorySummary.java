package com.studyflow.core.top;

import com.studyflow.core.model.ProcedureCategory;

/**
 * @param category procedure category
 * @param procedureCount procedures of the category in the matrix
 * @param totalOccurrences filled cells in the category's columns
 * @param averagePerVisit occurrences divided by the number of visits
 */
public record CategorySummary(
    ProcedureCategory category,
    int procedureCount,
    int totalOccurrences,
    double averagePerVisit
) {
}
