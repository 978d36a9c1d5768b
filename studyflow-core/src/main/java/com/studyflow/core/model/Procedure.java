package com.studyflow.core.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A clinical procedure performed during the study.
 *
 * <p>Runtime procedures are instantiated from a {@link ProcedureCatalogEntry} and share
 * its id, so {@link Visit#procedures()} can refer to catalog ids directly.
 *
 * @param id procedure identifier (catalog id, e.g. {@code proc_hba1c})
 * @param name canonical name
 * @param category procedure category
 * @param linkedEndpoints ids of the endpoints that need this procedure
 * @param frequency optional frequency description
 * @param timing optional timing description
 * @param required whether the procedure is mandatory (true when any linked endpoint is primary)
 * @param code optional standard code
 */
public record Procedure(
    String id,
    String name,
    ProcedureCategory category,
    List<String> linkedEndpoints,
    String frequency,
    String timing,
    boolean required,
    StandardCode code
) {
    public Procedure {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(category, "category must not be null");
        linkedEndpoints = linkedEndpoints == null ? List.of() : List.copyOf(new LinkedHashSet<>(linkedEndpoints));
    }

    public Procedure withRequired(boolean newRequired) {
        return new Procedure(id, name, category, linkedEndpoints, frequency, timing, newRequired, code);
    }

    /**
     * Merges another instance of the same procedure into this one.
     *
     * <p>Linked endpoints are unioned in first-seen order and {@code required} only ever
     * goes from false to true.
     *
     * @param other procedure with the same id
     * @return merged procedure
     */
    public Procedure mergedWith(Procedure other) {
        if (!id.equals(other.id)) {
            throw new IllegalArgumentException("Cannot merge " + id + " with " + other.id);
        }
        Set<String> endpoints = new LinkedHashSet<>(linkedEndpoints);
        endpoints.addAll(other.linkedEndpoints);
        return new Procedure(id, name, category, List.copyOf(endpoints), frequency, timing,
            required || other.required, code);
    }
}
