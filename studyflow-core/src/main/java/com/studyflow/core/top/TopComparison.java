package com.studyflow.core.top;

import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.Visit;

import java.util.List;

/**
 * Differences between two versions of a Table of Procedures.
 */
public record TopComparison(
    List<Visit> addedVisits,
    List<Visit> removedVisits,
    List<Procedure> addedProcedures,
    List<Procedure> removedProcedures,
    List<CellChange> changedCells
) {
    public TopComparison {
        addedVisits = List.copyOf(addedVisits);
        removedVisits = List.copyOf(removedVisits);
        addedProcedures = List.copyOf(addedProcedures);
        removedProcedures = List.copyOf(removedProcedures);
        changedCells = List.copyOf(changedCells);
    }

    public boolean identical() {
        return addedVisits.isEmpty() && removedVisits.isEmpty() && addedProcedures.isEmpty()
            && removedProcedures.isEmpty() && changedCells.isEmpty();
    }

    public record CellChange(String visitId, String procedureId, boolean oldValue, boolean newValue) {
    }
}
