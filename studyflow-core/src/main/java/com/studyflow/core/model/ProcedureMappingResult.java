package com.studyflow.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of mapping free text to the procedure catalog.
 *
 * <p>An unmatched text has no entry, zero confidence and no alternatives.
 *
 * @param originalText text as supplied
 * @param matchedProcedure best catalog entry, or null when nothing scored above the threshold
 * @param confidence best score
 * @param lowConfidence whether the best score is under the low-confidence threshold
 * @param alternatives runner-up matches, best first
 */
public record ProcedureMappingResult(
    String originalText,
    ProcedureCatalogEntry matchedProcedure,
    double confidence,
    boolean lowConfidence,
    List<ProcedureMatch> alternatives
) {
    public ProcedureMappingResult {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public static ProcedureMappingResult noMatch(String originalText) {
        return new ProcedureMappingResult(originalText, null, 0.0, false, List.of());
    }

    public boolean matched() {
        return matchedProcedure != null;
    }

    public Optional<ProcedureCatalogEntry> match() {
        return Optional.ofNullable(matchedProcedure);
    }
}
