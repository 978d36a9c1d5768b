package com.studyflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Area of the study flow an issue concerns.
 */
public enum IssueCategory {
    VISIT("visit"),
    PROCEDURE("procedure"),
    TIMING("timing"),
    ALIGNMENT("alignment"),
    CYCLE("cycle"),
    GLOBAL("global");

    private final String wireName;

    IssueCategory(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static IssueCategory fromWireName(String value) {
        for (IssueCategory category : values()) {
            if (category.wireName.equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown issue category: " + value);
    }
}
