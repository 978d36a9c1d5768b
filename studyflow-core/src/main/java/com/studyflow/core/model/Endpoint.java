package com.studyflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * A pre-specified study measurement.
 *
 * @param id endpoint identifier
 * @param name free-text endpoint name (e.g. "Change from baseline in HbA1c at Week 24")
 * @param type primary, secondary or exploratory
 * @param timepoint optional timing hint (e.g. "Week 24")
 */
public record Endpoint(String id, String name, EndpointType type, String timepoint) {
    public Endpoint {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public static Endpoint primary(String id, String name) {
        return new Endpoint(id, name, EndpointType.PRIMARY, null);
    }

    public static Endpoint secondary(String id, String name) {
        return new Endpoint(id, name, EndpointType.SECONDARY, null);
    }

    @JsonIgnore
    public boolean isPrimary() {
        return type == EndpointType.PRIMARY;
    }
}
