package com.studyflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a validation issue, ordered from most to least severe.
 */
public enum IssueSeverity {
    /**
     * Regulatory-blocking (e.g. missing baseline visit).
     */
    CRITICAL("critical"),

    /**
     * Must be fixed before finalization (e.g. missing required procedure).
     */
    ERROR("error"),

    /**
     * Should be reviewed (e.g. large visit window).
     */
    WARNING("warning"),

    /**
     * Advisory (e.g. visits close together).
     */
    INFO("info");

    private final String wireName;

    IssueSeverity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Returns whether issues of this severity block finalization.
     *
     * @return true for critical and error
     */
    public boolean isBlocking() {
        return this == CRITICAL || this == ERROR;
    }

    @JsonCreator
    public static IssueSeverity fromWireName(String value) {
        for (IssueSeverity severity : values()) {
            if (severity.wireName.equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
