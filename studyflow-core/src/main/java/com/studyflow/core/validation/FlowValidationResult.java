package com.studyflow.core.validation;

import com.studyflow.core.model.FlowIssue;
import com.studyflow.core.model.IssueCategory;
import com.studyflow.core.model.IssueSeverity;
import com.studyflow.core.model.RuleId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a validation pass.
 *
 * <p>Issues keep rule evaluation order. The by-category index is keyed by category wire
 * name and only lists categories that have issues.
 *
 * @param valid true when no critical or error issue was found
 * @param issues issues in rule order
 * @param summary issue counts per severity
 * @param byCategory issues grouped by category
 */
public record FlowValidationResult(
    boolean valid,
    List<FlowIssue> issues,
    SeveritySummary summary,
    Map<String, List<FlowIssue>> byCategory
) {
    public FlowValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        byCategory = byCategory == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(byCategory));
    }

    /**
     * Builds a result from the issues of a validation pass.
     *
     * @param issues issues in rule order
     * @return result with derived validity, summary and index
     */
    public static FlowValidationResult of(List<FlowIssue> issues) {
        Map<String, List<FlowIssue>> byCategory = new LinkedHashMap<>();
        for (IssueCategory category : IssueCategory.values()) {
            List<FlowIssue> inCategory = issues.stream()
                .filter(i -> i.category() == category)
                .toList();
            if (!inCategory.isEmpty()) {
                byCategory.put(category.wireName(), inCategory);
            }
        }
        boolean valid = issues.stream().noneMatch(i -> i.severity().isBlocking());
        return new FlowValidationResult(valid, issues, SeveritySummary.of(issues), byCategory);
    }

    public List<FlowIssue> issuesBySeverity(IssueSeverity severity) {
        return issues.stream().filter(i -> i.severity() == severity).toList();
    }

    public List<FlowIssue> issuesForRule(RuleId rule) {
        return issues.stream().filter(i -> i.code() == rule).toList();
    }

    /**
     * Returns the ids of issues that carry an auto-fixable suggestion.
     *
     * @return issue ids in rule order
     */
    public List<String> autoFixableIssueIds() {
        List<String> ids = new ArrayList<>();
        for (FlowIssue issue : issues) {
            if (issue.autoFixable()) {
                ids.add(issue.id());
            }
        }
        return ids;
    }

    /**
     * Issue counts per severity.
     *
     * @param total all issues
     * @param critical critical issues
     * @param error error issues
     * @param warning warning issues
     * @param info info issues
     */
    public record SeveritySummary(int total, int critical, int error, int warning, int info) {

        static SeveritySummary of(List<FlowIssue> issues) {
            int[] counts = new int[IssueSeverity.values().length];
            for (FlowIssue issue : issues) {
                counts[issue.severity().ordinal()]++;
            }
            return new SeveritySummary(issues.size(),
                counts[IssueSeverity.CRITICAL.ordinal()],
                counts[IssueSeverity.ERROR.ordinal()],
                counts[IssueSeverity.WARNING.ordinal()],
                counts[IssueSeverity.INFO.ordinal()]);
        }
    }
}
