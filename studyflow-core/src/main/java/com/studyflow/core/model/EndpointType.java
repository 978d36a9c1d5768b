package com.studyflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Hierarchy level of a study endpoint.
 */
public enum EndpointType {
    PRIMARY("primary"),
    SECONDARY("secondary"),
    EXPLORATORY("exploratory");

    private final String wireName;

    EndpointType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EndpointType fromWireName(String value) {
        for (EndpointType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown endpoint type: " + value);
    }
}
