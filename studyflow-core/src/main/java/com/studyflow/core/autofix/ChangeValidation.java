package com.studyflow.core.autofix;

import java.util.List;

/**
 * Result of checking a batch of changes against a flow before applying it.
 *
 * @param errors reasons that block changes
 * @param warnings high-impact changes worth reviewing
 */
public record ChangeValidation(List<String> errors, List<String> warnings) {
    public ChangeValidation {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean valid() {
        return errors.isEmpty();
    }
}
