package com.studyflow.core.procedure;

/**
 * Confidence distribution of a batch of procedure mappings.
 *
 * @param total mappings in the batch
 * @param matched mappings with a catalog entry
 * @param highConfidence confidence of at least 0.8
 * @param mediumConfidence confidence in [0.6, 0.8)
 * @param lowConfidence confidence in (0, 0.6)
 * @param unmatched mappings without a catalog entry
 */
public record MappingStats(
    int total,
    int matched,
    int highConfidence,
    int mediumConfidence,
    int lowConfidence,
    int unmatched
) {
}
