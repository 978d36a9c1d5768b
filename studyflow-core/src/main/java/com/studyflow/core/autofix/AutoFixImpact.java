package com.studyflow.core.autofix;

/**
 * Size and risk of a batch of changes.
 *
 * @param visitsAdded visits the changes add
 * @param visitsModified visit modifications other than window adjustments
 * @param proceduresAdded procedure additions
 * @param proceduresModified procedure modifications
 * @param riskLevel estimated risk
 */
public record AutoFixImpact(
    int visitsAdded,
    int visitsModified,
    int proceduresAdded,
    int proceduresModified,
    RiskLevel riskLevel
) {
}
