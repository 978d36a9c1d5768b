package com.studyflow.core.procedure;

import java.util.List;

/**
 * Review outcome of a single procedure mapping.
 *
 * @param valid whether the mapping is confident enough to use unreviewed
 * @param warnings low-confidence and ambiguity warnings
 */
public record MappingValidation(boolean valid, List<String> warnings) {
    public MappingValidation {
        warnings = List.copyOf(warnings);
    }
}
