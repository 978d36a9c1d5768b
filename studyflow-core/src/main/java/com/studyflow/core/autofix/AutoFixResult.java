package com.studyflow.core.autofix;

import com.studyflow.core.model.FlowChange;
import com.studyflow.core.model.FlowIssue;
import com.studyflow.core.model.StudyFlow;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of an auto-fix pass.
 *
 * <p>Remaining issues are the input issues that were not selected, could not be fixed
 * automatically, or whose changes were all rejected. The engine does not re-validate:
 * run the validation engine on {@code updatedFlow} for the authoritative issue list.
 *
 * @param appliedChanges changes folded into the updated flow, in application order
 * @param rejectedChanges changes refused with their reasons
 * @param warnings high-impact changes and skipped selections
 * @param updatedFlow new flow value
 * @param remainingIssues issues left unresolved
 * @param summary counts
 */
public record AutoFixResult(
    List<FlowChange> appliedChanges,
    List<RejectedChange> rejectedChanges,
    List<String> warnings,
    StudyFlow updatedFlow,
    List<FlowIssue> remainingIssues,
    Summary summary
) {
    public AutoFixResult {
        Objects.requireNonNull(updatedFlow, "updatedFlow must not be null");
        appliedChanges = appliedChanges == null ? List.of() : List.copyOf(appliedChanges);
        rejectedChanges = rejectedChanges == null ? List.of() : List.copyOf(rejectedChanges);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        remainingIssues = remainingIssues == null ? List.of() : List.copyOf(remainingIssues);
    }

    /**
     * @param changesApplied applied change count
     * @param changesRejected rejected change count
     * @param issuesFixed issues with at least one applied change
     * @param issuesRemaining unresolved issue count
     */
    public record Summary(int changesApplied, int changesRejected, int issuesFixed, int issuesRemaining) {
    }
}
