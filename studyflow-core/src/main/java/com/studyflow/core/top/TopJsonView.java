package com.studyflow.core.top;

import com.studyflow.core.model.ProcedureCategory;
import com.studyflow.core.model.VisitType;
import com.studyflow.core.model.VisitWindow;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Interactive JSON projection of a Table of Procedures: every visit and procedure is
 * annotated with its fill count and the ids on the other axis.
 */
public record TopJsonView(
    Metadata metadata,
    List<VisitEntry> visits,
    List<ProcedureEntry> procedures,
    boolean[][] matrix
) {
    public TopJsonView {
        visits = visits == null ? List.of() : List.copyOf(visits);
        procedures = procedures == null ? List.of() : List.copyOf(procedures);
        matrix = matrix == null ? new boolean[0][] : copy(matrix);
    }

    /**
     * Returns a copy of the cell matrix.
     */
    @Override
    public boolean[][] matrix() {
        return copy(matrix);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TopJsonView other)) {
            return false;
        }
        return Objects.equals(metadata, other.metadata)
            && visits.equals(other.visits)
            && procedures.equals(other.procedures)
            && Arrays.deepEquals(matrix, other.matrix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metadata, visits, procedures, Arrays.deepHashCode(matrix));
    }

    @Override
    public String toString() {
        return "TopJsonView[metadata=" + metadata + ", visits=" + visits.size()
            + ", procedures=" + procedures.size() + "]";
    }

    private static boolean[][] copy(boolean[][] source) {
        boolean[][] copy = new boolean[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i] == null ? new boolean[0] : source[i].clone();
        }
        return copy;
    }

    public record Metadata(String version, int totalVisits, int totalProcedures) {
    }

    public record VisitEntry(
        String id,
        String name,
        int day,
        VisitType type,
        VisitWindow window,
        List<String> procedures,
        int procedureCount
    ) {
        public VisitEntry {
            procedures = procedures == null ? List.of() : List.copyOf(procedures);
        }
    }

    public record ProcedureEntry(
        String id,
        String name,
        ProcedureCategory category,
        boolean required,
        int visitCount,
        List<String> visits
    ) {
        public ProcedureEntry {
            visits = visits == null ? List.of() : List.copyOf(visits);
        }
    }
}
