package com.studyflow.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A diagnostic produced by a validation rule.
 *
 * <p>Ids are deterministic (derived from the rule and the affected entity), so repeated
 * validation of the same flow yields identical issues.
 *
 * @param id issue identifier (e.g. {@code MISSING_BASELINE}, {@code ENDPOINT_TIMING_DRIFT_ep1})
 * @param code rule that produced the issue
 * @param severity issue severity
 * @param category affected area
 * @param message one-line summary
 * @param details longer explanation
 * @param affectedVisits visit ids involved
 * @param affectedProcedures procedure ids involved
 * @param suggestions proposed resolutions
 */
public record FlowIssue(
    String id,
    RuleId code,
    IssueSeverity severity,
    IssueCategory category,
    String message,
    String details,
    List<String> affectedVisits,
    List<String> affectedProcedures,
    List<FlowSuggestion> suggestions
) {
    public FlowIssue {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(message, "message must not be null");
        affectedVisits = affectedVisits == null ? List.of() : List.copyOf(affectedVisits);
        affectedProcedures = affectedProcedures == null ? List.of() : List.copyOf(affectedProcedures);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    /**
     * Returns whether any suggestion can be applied automatically.
     *
     * @return true when at least one suggestion is auto-fixable
     */
    public boolean autoFixable() {
        return suggestions.stream().anyMatch(FlowSuggestion::autoFixable);
    }
}
