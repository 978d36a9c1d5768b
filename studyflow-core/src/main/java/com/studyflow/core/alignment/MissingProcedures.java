package com.studyflow.core.alignment;

import java.util.List;

/**
 * @param missingRequired required procedure ids not performed anywhere in the flow
 * @param missingRecommended recommended procedure ids not performed anywhere in the flow
 */
public record MissingProcedures(List<String> missingRequired, List<String> missingRecommended) {
    public MissingProcedures {
        missingRequired = List.copyOf(missingRequired);
        missingRecommended = List.copyOf(missingRecommended);
    }

    public boolean isEmpty() {
        return missingRequired.isEmpty() && missingRecommended.isEmpty();
    }
}
