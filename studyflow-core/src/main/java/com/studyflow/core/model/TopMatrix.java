package com.studyflow.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Table of Procedures: a dense Visit x Procedure boolean matrix.
 *
 * <p>Rows follow {@link #visits()} (sorted by day), columns follow {@link #procedures()}.
 * The matrix is copied on the way in and out, so instances are safe to share.
 *
 * @param visits matrix rows, sorted by day
 * @param procedures matrix columns
 * @param matrix {@code matrix[visitIndex][procedureIndex]}
 * @param version version tag; projections append a suffix
 */
public record TopMatrix(
    List<Visit> visits,
    List<Procedure> procedures,
    boolean[][] matrix,
    String version
) {
    public static final String INITIAL_VERSION = "1.0";

    public TopMatrix {
        Objects.requireNonNull(visits, "visits must not be null");
        Objects.requireNonNull(procedures, "procedures must not be null");
        Objects.requireNonNull(matrix, "matrix must not be null");
        visits = List.copyOf(visits);
        procedures = List.copyOf(procedures);
        if (matrix.length != visits.size()) {
            throw new IllegalArgumentException(
                "Matrix has " + matrix.length + " rows for " + visits.size() + " visits");
        }
        for (boolean[] row : matrix) {
            if (row.length != procedures.size()) {
                throw new IllegalArgumentException(
                    "Matrix row has " + row.length + " cells for " + procedures.size() + " procedures");
            }
        }
        matrix = copy(matrix);
        version = version == null ? INITIAL_VERSION : version;
    }

    /**
     * Returns a copy of the cell matrix.
     */
    @Override
    public boolean[][] matrix() {
        return copy(matrix);
    }

    public boolean cell(int visitIndex, int procedureIndex) {
        return matrix[visitIndex][procedureIndex];
    }

    public int visitIndex(String visitId) {
        for (int i = 0; i < visits.size(); i++) {
            if (visits.get(i).id().equals(visitId)) {
                return i;
            }
        }
        return -1;
    }

    public int procedureIndex(String procedureId) {
        for (int i = 0; i < procedures.size(); i++) {
            if (procedures.get(i).id().equals(procedureId)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Counts the filled cells.
     *
     * @return number of true cells
     */
    public int filledCells() {
        int count = 0;
        for (boolean[] row : matrix) {
            for (boolean cell : row) {
                if (cell) {
                    count++;
                }
            }
        }
        return count;
    }

    public TopMatrix withVersion(String newVersion) {
        return new TopMatrix(visits, procedures, matrix, newVersion);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TopMatrix other)) {
            return false;
        }
        return visits.equals(other.visits)
            && procedures.equals(other.procedures)
            && Arrays.deepEquals(matrix, other.matrix)
            && version.equals(other.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(visits, procedures, Arrays.deepHashCode(matrix), version);
    }

    @Override
    public String toString() {
        return "TopMatrix[" + visits.size() + "x" + procedures.size() + ", version=" + version + "]";
    }

    static boolean[][] copy(boolean[][] source) {
        boolean[][] target = new boolean[source.length][];
        for (int i = 0; i < source.length; i++) {
            target[i] = source[i].clone();
        }
        return target;
    }
}
