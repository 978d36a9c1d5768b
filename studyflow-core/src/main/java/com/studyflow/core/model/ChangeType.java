package com.studyflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of structural edit a {@link FlowChange} describes.
 */
public enum ChangeType {
    ADD_VISIT("add_visit"),
    REMOVE_VISIT("remove_visit"),
    MODIFY_VISIT("modify_visit"),
    ADD_PROCEDURE("add_procedure"),
    REMOVE_PROCEDURE("remove_procedure"),
    MODIFY_PROCEDURE("modify_procedure"),
    ADJUST_TIMING("adjust_timing");

    private final String wireName;

    ChangeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ChangeType fromWireName(String value) {
        for (ChangeType type : values()) {
            if (type.wireName.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown change type: " + value);
    }
}
