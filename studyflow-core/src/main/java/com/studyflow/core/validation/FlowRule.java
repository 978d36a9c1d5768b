package com.studyflow.core.validation;

import com.studyflow.core.model.FlowIssue;

import java.util.List;

/**
 * A single study flow validation rule.
 *
 * <p>Rules are pure: they read the {@link ValidationContext} and return the issues they
 * find, never modifying the flow and never depending on the output of other rules.</p>
 *
 * @see FlowValidationEngine
 */
@FunctionalInterface
public interface FlowRule {

    /**
     * Evaluates the rule.
     *
     * @param context flow and companion documents under validation
     * @return issues found, empty when the flow satisfies the rule
     */
    List<FlowIssue> evaluate(ValidationContext context);
}
