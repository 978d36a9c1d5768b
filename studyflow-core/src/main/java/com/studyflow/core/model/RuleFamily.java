package com.studyflow.core.model;

/**
 * Document pair a validation rule cross-checks.
 */
public enum RuleFamily {
    /**
     * Protocol against the informed-consent form.
     */
    PROTOCOL_ICF,

    /**
     * Protocol against the statistical analysis plan.
     */
    PROTOCOL_SAP,

    /**
     * Structural checks over the whole flow.
     */
    GLOBAL
}
