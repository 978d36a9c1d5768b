package com.studyflow.core.model;

/**
 * Standard terminology a procedure code belongs to.
 */
public enum CodeSystem {
    /**
     * Logical Observation Identifiers Names and Codes (laboratory and clinical observations).
     */
    LOINC,

    /**
     * SNOMED Clinical Terms.
     */
    SNOMED,

    /**
     * Medical Dictionary for Regulatory Activities.
     */
    MEDDRA
}
