package com.studyflow.core.autofix;

import com.studyflow.core.model.FlowChange;

/**
 * A change the auto-fix engine refused to apply.
 *
 * @param issueId issue the change was meant to fix
 * @param change rejected change
 * @param reason why it was rejected
 */
public record RejectedChange(String issueId, FlowChange change, String reason) {
}
