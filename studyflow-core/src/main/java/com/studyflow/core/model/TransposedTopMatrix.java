package com.studyflow.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Procedure x Visit view of a {@link TopMatrix}.
 *
 * @param procedures matrix rows
 * @param visits matrix columns, sorted by day
 * @param matrix {@code matrix[procedureIndex][visitIndex]}
 * @param version source version with a {@code -transposed} suffix
 */
public record TransposedTopMatrix(
    List<Procedure> procedures,
    List<Visit> visits,
    boolean[][] matrix,
    String version
) {
    public TransposedTopMatrix {
        Objects.requireNonNull(procedures, "procedures must not be null");
        Objects.requireNonNull(visits, "visits must not be null");
        Objects.requireNonNull(matrix, "matrix must not be null");
        procedures = List.copyOf(procedures);
        visits = List.copyOf(visits);
        if (matrix.length != procedures.size()) {
            throw new IllegalArgumentException(
                "Matrix has " + matrix.length + " rows for " + procedures.size() + " procedures");
        }
        matrix = TopMatrix.copy(matrix);
    }

    @Override
    public boolean[][] matrix() {
        return TopMatrix.copy(matrix);
    }

    public boolean cell(int procedureIndex, int visitIndex) {
        return matrix[procedureIndex][visitIndex];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TransposedTopMatrix other)) {
            return false;
        }
        return procedures.equals(other.procedures)
            && visits.equals(other.visits)
            && Arrays.deepEquals(matrix, other.matrix)
            && Objects.equals(version, other.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(procedures, visits, Arrays.deepHashCode(matrix), version);
    }

    @Override
    public String toString() {
        return "TransposedTopMatrix[" + procedures.size() + "x" + visits.size() + ", version=" + version + "]";
    }
}
