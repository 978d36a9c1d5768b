package com.studyflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of clinical procedure categories.
 */
public enum ProcedureCategory {
    EFFICACY("efficacy", "Efficacy"),
    SAFETY("safety", "Safety"),
    LABS("labs", "Laboratory"),
    PK("pk", "Pharmacokinetics"),
    PD("pd", "Pharmacodynamics"),
    QUESTIONNAIRE("questionnaire", "Questionnaires"),
    VITAL_SIGNS("vital_signs", "Vital Signs"),
    PHYSICAL_EXAM("physical_exam", "Physical Examination"),
    IMAGING("imaging", "Imaging"),
    ECG("ecg", "ECG"),
    ADVERSE_EVENTS("adverse_events", "Adverse Events"),
    CONCOMITANT_MEDS("concomitant_meds", "Concomitant Medications"),
    DEVICE("device", "Device"),
    OTHER("other", "Other");

    private final String wireName;
    private final String displayName;

    ProcedureCategory(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }

    @JsonCreator
    public static ProcedureCategory fromWireName(String value) {
        for (ProcedureCategory category : values()) {
            if (category.wireName.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown procedure category: " + value);
    }
}
