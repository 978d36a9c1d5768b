package com.studyflow.core.alignment;

import com.studyflow.core.model.Visit;

import java.util.List;

/**
 * @param updatedVisits visits with the missing procedures added
 * @param changesApplied number of procedure assignments added
 * @param additions what was added where
 */
public record AlignmentFixResult(List<Visit> updatedVisits, int changesApplied, List<ProcedureAddition> additions) {
    public AlignmentFixResult {
        updatedVisits = List.copyOf(updatedVisits);
        additions = List.copyOf(additions);
    }
}
