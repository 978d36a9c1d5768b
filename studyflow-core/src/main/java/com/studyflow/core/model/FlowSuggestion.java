package com.studyflow.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A proposed resolution for a {@link FlowIssue}.
 *
 * @param id suggestion identifier
 * @param label short description
 * @param autoFixable whether the auto-fix engine can apply the changes
 * @param changes structural edits, possibly empty
 */
public record FlowSuggestion(String id, String label, boolean autoFixable, List<FlowChange> changes) {
    public FlowSuggestion {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public static FlowSuggestion manual(String id, String label, FlowChange... changes) {
        return new FlowSuggestion(id, label, false, List.of(changes));
    }

    public static FlowSuggestion autoFix(String id, String label, List<FlowChange> changes) {
        return new FlowSuggestion(id, label, true, changes);
    }
}
