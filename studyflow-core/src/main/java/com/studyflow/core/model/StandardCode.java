package com.studyflow.core.model;

import java.util.Objects;

/**
 * A code in a standard terminology, e.g. LOINC {@code 4548-4}.
 *
 * @param system terminology
 * @param code code value
 */
public record StandardCode(CodeSystem system, String code) {
    public StandardCode {
        Objects.requireNonNull(system, "system must not be null");
        Objects.requireNonNull(code, "code must not be null");
    }

    @Override
    public String toString() {
        return system + " " + code;
    }
}
