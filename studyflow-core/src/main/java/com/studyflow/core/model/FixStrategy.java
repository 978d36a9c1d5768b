package com.studyflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How far an auto-fix pass may go.
 *
 * <p>Only additive fixes are implemented, so every strategy currently applies the
 * {@link #CONSERVATIVE} behavior.
 */
public enum FixStrategy {
    CONSERVATIVE("conservative"),
    BALANCED("balanced"),
    AGGRESSIVE("aggressive");

    private final String wireName;

    FixStrategy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static FixStrategy fromWireName(String value) {
        for (FixStrategy strategy : values()) {
            if (strategy.wireName.equalsIgnoreCase(value)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown fix strategy: " + value);
    }
}
