package com.studyflow.core.model;

/**
 * Outcome of normalizing a free-text visit label.
 *
 * @param originalName label as supplied
 * @param normalizedName canonical name (e.g. "Week 4")
 * @param day day offset
 * @param type visit phase
 * @param confidence match confidence in [0, 1]
 */
public record VisitNormalizationResult(
    String originalName,
    String normalizedName,
    int day,
    VisitType type,
    double confidence
) {
}
