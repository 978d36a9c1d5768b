package com.studyflow.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable reference definition of a clinical procedure.
 *
 * @param id catalog id (e.g. {@code proc_hba1c})
 * @param name canonical English name
 * @param localizedName Russian name, or null
 * @param category procedure category
 * @param synonyms alternative names and abbreviations
 * @param code optional standard code
 * @param invasive whether the procedure is invasive (blood draw, biopsy, injection)
 * @param endpointTypes endpoint-type tags (e.g. {@code diabetes}, {@code safety})
 * @param durationMinutes typical duration in minutes, or null
 * @param fastingRequired whether the subject must fast
 * @param notes free-form notes, or null
 */
public record ProcedureCatalogEntry(
    String id,
    String name,
    String localizedName,
    ProcedureCategory category,
    List<String> synonyms,
    StandardCode code,
    boolean invasive,
    List<String> endpointTypes,
    Integer durationMinutes,
    boolean fastingRequired,
    String notes
) {
    public ProcedureCatalogEntry {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(category, "category must not be null");
        synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
        endpointTypes = endpointTypes == null ? List.of() : List.copyOf(endpointTypes);
    }

    /**
     * Returns the name and every synonym a text may be matched against.
     *
     * @return candidate names in catalog order
     */
    public List<String> searchableNames() {
        List<String> names = new ArrayList<>();
        names.add(name);
        if (localizedName != null && !localizedName.isBlank()) {
            names.add(localizedName);
        }
        names.addAll(synonyms);
        return names;
    }

    /**
     * Instantiates a runtime procedure from this definition.
     *
     * @param required whether the procedure is mandatory
     * @param linkedEndpoints endpoints that need it
     * @return new procedure sharing this entry's id
     */
    public Procedure instantiate(boolean required, List<String> linkedEndpoints) {
        return new Procedure(id, name, category, linkedEndpoints, null, null, required, code);
    }
}
