package com.studyflow.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A scheduled study visit.
 *
 * <p>Visits are values: every change produces a new instance through one of the
 * {@code with*} methods. Procedure ids keep insertion order and are deduplicated.
 *
 * @param id stable visit identifier
 * @param name human-readable name (e.g. "Week 4")
 * @param day day offset relative to baseline (Day 0)
 * @param cycle treatment cycle number, or null when not assigned
 * @param type visit phase
 * @param window scheduling tolerance, or null when not yet calculated
 * @param procedures ordered procedure ids performed at this visit
 * @param required whether the visit is mandatory
 * @param metadata provenance (source, original label, confidence, notes)
 */
public record Visit(
    String id,
    String name,
    int day,
    Integer cycle,
    VisitType type,
    VisitWindow window,
    List<String> procedures,
    boolean required,
    Map<String, String> metadata
) {
    public Visit {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        procedures = procedures == null ? List.of() : List.copyOf(new LinkedHashSet<>(procedures));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(metadata));
    }

    /**
     * Creates a required visit with no window, procedures or metadata.
     */
    public static Visit of(String id, String name, int day, VisitType type) {
        return new Visit(id, name, day, null, type, null, List.of(), true, Map.of());
    }

    public Visit withDay(int newDay) {
        return new Visit(id, name, newDay, cycle, type, window, procedures, required, metadata);
    }

    public Visit withWindow(VisitWindow newWindow) {
        return new Visit(id, name, day, cycle, type, newWindow, procedures, required, metadata);
    }

    public Visit withCycle(Integer newCycle) {
        return new Visit(id, name, day, newCycle, type, window, procedures, required, metadata);
    }

    public Visit withProcedures(List<String> newProcedures) {
        return new Visit(id, name, day, cycle, type, window, newProcedures, required, metadata);
    }

    public Visit withRequired(boolean newRequired) {
        return new Visit(id, name, day, cycle, type, window, procedures, newRequired, metadata);
    }

    /**
     * Returns a copy with the procedure appended, or this visit if it already has it.
     */
    public Visit withProcedure(String procedureId) {
        if (procedures.contains(procedureId)) {
            return this;
        }
        List<String> updated = new ArrayList<>(procedures);
        updated.add(procedureId);
        return withProcedures(updated);
    }

    public Visit withoutProcedure(String procedureId) {
        if (!procedures.contains(procedureId)) {
            return this;
        }
        List<String> updated = new ArrayList<>(procedures);
        updated.remove(procedureId);
        return withProcedures(updated);
    }

    public boolean hasProcedure(String procedureId) {
        return procedures.contains(procedureId);
    }
}
