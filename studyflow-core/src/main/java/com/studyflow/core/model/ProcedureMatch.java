package com.studyflow.core.model;

import java.util.Objects;

/**
 * A catalog entry scored against a procedure text.
 *
 * @param entry matched catalog entry
 * @param confidence similarity score in [0, 1]
 */
public record ProcedureMatch(ProcedureCatalogEntry entry, double confidence) {
    public ProcedureMatch {
        Objects.requireNonNull(entry, "entry must not be null");
    }
}
