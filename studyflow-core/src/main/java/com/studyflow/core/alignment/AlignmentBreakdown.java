package com.studyflow.core.alignment;

/**
 * Alignment counts for one visit (across endpoints) or one endpoint (across visits).
 *
 * @param id visit or endpoint id
 * @param name visit or endpoint name
 * @param total pairs involving the item
 * @param aligned aligned pairs
 * @param misaligned misaligned pairs
 * @param alignmentPercentage aligned share in percent
 */
public record AlignmentBreakdown(
    String id,
    String name,
    int total,
    int aligned,
    int misaligned,
    double alignmentPercentage
) {
}
