package com.studyflow.core.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Aggregate root of the study flow engine.
 *
 * <p>Visits are kept sorted by day. The flow is replaced, never mutated: the auto-fix
 * engine produces a new instance for every batch of applied changes.
 *
 * @param id flow identifier
 * @param visits visits sorted by day
 * @param procedures procedures used by the flow
 * @param cycles treatment cycles, possibly empty
 * @param topMatrix Table of Procedures built from visits and procedures
 * @param totalDuration study duration in days
 * @param metadata provenance (source, version, generator)
 */
public record StudyFlow(
    String id,
    List<Visit> visits,
    List<Procedure> procedures,
    List<TreatmentCycle> cycles,
    TopMatrix topMatrix,
    int totalDuration,
    Map<String, String> metadata
) {
    public StudyFlow {
        Objects.requireNonNull(id, "id must not be null");
        visits = visits == null ? List.of() : visits.stream()
            .sorted(Comparator.comparingInt(Visit::day))
            .toList();
        procedures = procedures == null ? List.of() : List.copyOf(procedures);
        cycles = cycles == null ? List.of() : List.copyOf(cycles);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(metadata));
    }

    public Optional<Visit> findVisit(String visitId) {
        return visits.stream().filter(v -> v.id().equals(visitId)).findFirst();
    }

    public Optional<Procedure> findProcedure(String procedureId) {
        return procedures.stream().filter(p -> p.id().equals(procedureId)).findFirst();
    }

    public boolean hasVisitOfType(VisitType type) {
        return visits.stream().anyMatch(v -> v.type() == type);
    }
}
