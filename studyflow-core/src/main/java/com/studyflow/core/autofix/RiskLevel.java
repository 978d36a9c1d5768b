package com.studyflow.core.autofix;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Estimated risk of applying a batch of auto-fix changes.
 */
public enum RiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireName;

    RiskLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
