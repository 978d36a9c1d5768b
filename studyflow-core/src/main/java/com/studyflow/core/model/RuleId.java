package com.studyflow.core.model;

/**
 * Closed set of study flow validation rules, in evaluation order.
 */
public enum RuleId {
    PROCEDURE_NOT_IN_ICF(RuleFamily.PROTOCOL_ICF, "Invasive, imaging and device procedures are described in the ICF"),
    RISKS_NOT_DESCRIBED(RuleFamily.PROTOCOL_ICF, "The ICF describes the risks of high-risk procedures"),
    VISIT_MISSING_IN_ICF(RuleFamily.PROTOCOL_ICF, "The ICF describes the visit schedule"),
    ENDPOINT_TIMING_DRIFT(RuleFamily.PROTOCOL_SAP, "Every endpoint has an SAP assessment schedule"),
    MISSING_ASSESSMENT_FOR_ENDPOINT(RuleFamily.PROTOCOL_SAP, "Primary endpoint procedures exist in the protocol"),
    INCORRECT_SCHEDULE_FOR_PRIMARY(RuleFamily.PROTOCOL_SAP, "Primary endpoints have their baseline and end-of-treatment visits"),
    FLOW_INTEGRITY_DRIFT(RuleFamily.GLOBAL, "Visit counts agree across Protocol, SAP and ICF"),
    CYCLES_INCONSISTENT(RuleFamily.GLOBAL, "Treatment cycles agree between Protocol and SAP"),
    UNSUPPORTED_VISIT_TIMING(RuleFamily.GLOBAL, "Visit windows and spacing are realistic"),
    MISSING_MANDATORY_VISITS(RuleFamily.GLOBAL, "Baseline and end-of-treatment visits exist");

    private final RuleFamily family;
    private final String description;

    RuleId(RuleFamily family, String description) {
        this.family = family;
        this.description = description;
    }

    public RuleFamily family() {
        return family;
    }

    public String description() {
        return description;
    }
}
