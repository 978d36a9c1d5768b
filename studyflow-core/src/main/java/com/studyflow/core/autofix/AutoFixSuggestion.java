package com.studyflow.core.autofix;

import com.studyflow.core.model.FlowChange;
import com.studyflow.core.model.RuleId;

import java.util.List;

/**
 * Whether and how an issue can be fixed automatically.
 *
 * @param issueId issue identifier
 * @param rule rule that raised the issue
 * @param fixable whether an auto-fixable suggestion exists
 * @param suggestion label of the auto-fixable suggestion, or {@code "Manual fix required"}
 * @param changes changes of the auto-fixable suggestion, empty when not fixable
 */
public record AutoFixSuggestion(
    String issueId,
    RuleId rule,
    boolean fixable,
    String suggestion,
    List<FlowChange> changes
) {
    public AutoFixSuggestion {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }
}
