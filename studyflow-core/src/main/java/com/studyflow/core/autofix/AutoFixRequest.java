package com.studyflow.core.autofix;

import com.studyflow.core.model.FixStrategy;

import java.util.List;

/**
 * Issues selected for automatic repair.
 *
 * @param issueIds ids of the issues to fix, in application order
 * @param strategy repair strategy
 */
public record AutoFixRequest(List<String> issueIds, FixStrategy strategy) {
    public AutoFixRequest {
        issueIds = issueIds == null ? List.of() : List.copyOf(issueIds);
        strategy = strategy == null ? FixStrategy.CONSERVATIVE : strategy;
    }

    public static AutoFixRequest conservative(List<String> issueIds) {
        return new AutoFixRequest(issueIds, FixStrategy.CONSERVATIVE);
    }
}
