package com.studyflow.core.alignment;

/**
 * @param total visit/endpoint pairs checked
 * @param aligned pairs with all required procedures and correct timing
 * @param misaligned remaining pairs
 * @param alignmentPercentage aligned share in percent, 0 when nothing was checked
 * @param missingProceduresCount pairs missing at least one required procedure
 * @param timingIssuesCount pairs at a visit phase the endpoint is not assessed at
 */
public record AlignmentSummary(
    int total,
    int aligned,
    int misaligned,
    double alignmentPercentage,
    int missingProceduresCount,
    int timingIssuesCount
) {
}
