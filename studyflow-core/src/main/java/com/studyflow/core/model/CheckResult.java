package com.studyflow.core.model;

import java.util.List;

/**
 * Errors and warnings from a structural check (visit sequence, windows, cycles, maps).
 *
 * @param errors structural errors
 * @param warnings advisory findings
 */
public record CheckResult(List<String> errors, List<String> warnings) {
    public CheckResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean valid() {
        return errors.isEmpty();
    }
}
