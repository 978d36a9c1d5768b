package com.studyflow.core.top;

import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.ProcedureCategory;
import com.studyflow.core.model.TopMatrix;
import com.studyflow.core.model.TransposedTopMatrix;
import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Builds and edits Table of Procedures matrices.
 *
 * <p>Every operation returns a new matrix; the source is never modified. Edits keep
 * {@code visits.size() x procedures.size()} dimensions and keep each visit's procedure
 * list in step with its matrix row.
 */
public class TopMatrixBuilder {

    private static final Logger log = LoggerFactory.getLogger(TopMatrixBuilder.class);

    /**
     * Builds the matrix. Visits are sorted by day; a cell is set when the visit lists
     * the procedure id. Procedure ids a visit lists but the procedure list lacks are
     * ignored.
     *
     * @param visits visits, any order
     * @param procedures matrix columns
     * @return new matrix at version {@value TopMatrix#INITIAL_VERSION}
     */
    public TopMatrix build(List<Visit> visits, List<Procedure> procedures) {
        List<Visit> sorted = visits.stream().sorted(Comparator.comparingInt(Visit::day)).toList();
        boolean[][] matrix = new boolean[sorted.size()][procedures.size()];
        for (int v = 0; v < sorted.size(); v++) {
            matrix[v] = rowFor(sorted.get(v), procedures);
        }
        TopMatrix top = new TopMatrix(sorted, procedures, matrix, TopMatrix.INITIAL_VERSION);
        log.debug("Built ToP {} with {} filled cells", top, top.filledCells());
        return top;
    }

    /**
     * Marks a procedure as performed at a visit.
     *
     * @throws IllegalArgumentException if the visit or procedure is not in the matrix
     */
    public TopMatrix addProcedureToVisit(TopMatrix top, String visitId, String procedureId) {
        int v = requireVisit(top, visitId);
        int p = requireProcedure(top, procedureId);
        boolean[][] matrix = top.matrix();
        matrix[v][p] = true;
        List<Visit> visits = new ArrayList<>(top.visits());
        visits.set(v, visits.get(v).withProcedure(procedureId));
        return new TopMatrix(visits, top.procedures(), matrix, top.version());
    }

    /**
     * Clears a procedure from a visit.
     *
     * @throws IllegalArgumentException if the visit or procedure is not in the matrix
     */
    public TopMatrix removeProcedureFromVisit(TopMatrix top, String visitId, String procedureId) {
        int v = requireVisit(top, visitId);
        int p = requireProcedure(top, procedureId);
        boolean[][] matrix = top.matrix();
        matrix[v][p] = false;
        List<Visit> visits = new ArrayList<>(top.visits());
        visits.set(v, visits.get(v).withoutProcedure(procedureId));
        return new TopMatrix(visits, top.procedures(), matrix, top.version());
    }

    /**
     * Marks a procedure as performed at every visit.
     *
     * @throws IllegalArgumentException if the procedure is not in the matrix
     */
    public TopMatrix addProcedureToAllVisits(TopMatrix top, String procedureId) {
        int p = requireProcedure(top, procedureId);
        boolean[][] matrix = top.matrix();
        for (boolean[] row : matrix) {
            row[p] = true;
        }
        List<Visit> visits = top.visits().stream().map(v -> v.withProcedure(procedureId)).toList();
        return new TopMatrix(visits, top.procedures(), matrix, top.version());
    }

    /**
     * Inserts a row for a new visit at its day position, after visits on the same day.
     *
     * @throws IllegalArgumentException if a visit with the same id is already present
     */
    public TopMatrix addVisit(TopMatrix top, Visit visit) {
        if (top.visitIndex(visit.id()) >= 0) {
            throw new IllegalArgumentException("Visit already in matrix: " + visit.id());
        }
        List<Visit> visits = new ArrayList<>(top.visits());
        int position = 0;
        while (position < visits.size() && visits.get(position).day() <= visit.day()) {
            position++;
        }
        visits.add(position, visit);

        boolean[][] source = top.matrix();
        boolean[][] matrix = new boolean[source.length + 1][];
        for (int v = 0, s = 0; v < matrix.length; v++) {
            matrix[v] = v == position ? rowFor(visit, top.procedures()) : source[s++];
        }
        return new TopMatrix(visits, top.procedures(), matrix, top.version());
    }

    /**
     * Appends a column for a new procedure, filled from the visits that already list it.
     *
     * @throws IllegalArgumentException if a procedure with the same id is already present
     */
    public TopMatrix addProcedure(TopMatrix top, Procedure procedure) {
        if (top.procedureIndex(procedure.id()) >= 0) {
            throw new IllegalArgumentException("Procedure already in matrix: " + procedure.id());
        }
        List<Procedure> procedures = new ArrayList<>(top.procedures());
        procedures.add(procedure);
        boolean[][] source = top.matrix();
        boolean[][] matrix = new boolean[source.length][];
        for (int v = 0; v < source.length; v++) {
            matrix[v] = Arrays.copyOf(source[v], procedures.size());
            matrix[v][procedures.size() - 1] = top.visits().get(v).hasProcedure(procedure.id());
        }
        return new TopMatrix(top.visits(), procedures, matrix, top.version());
    }

    public TransposedTopMatrix transpose(TopMatrix top) {
        int visitCount = top.visits().size();
        int procedureCount = top.procedures().size();
        boolean[][] transposed = new boolean[procedureCount][visitCount];
        for (int v = 0; v < visitCount; v++) {
            for (int p = 0; p < procedureCount; p++) {
                transposed[p][v] = top.cell(v, p);
            }
        }
        return new TransposedTopMatrix(top.procedures(), top.visits(), transposed, top.version() + "-transposed");
    }

    /**
     * Keeps only the rows of visits of one type.
     */
    public TopMatrix filterByVisitType(TopMatrix top, VisitType type) {
        List<Visit> visits = new ArrayList<>();
        List<boolean[]> rows = new ArrayList<>();
        boolean[][] source = top.matrix();
        for (int v = 0; v < source.length; v++) {
            if (top.visits().get(v).type() == type) {
                visits.add(top.visits().get(v));
                rows.add(source[v]);
            }
        }
        return new TopMatrix(visits, top.procedures(), rows.toArray(new boolean[0][]),
            top.version() + "-filtered-" + type.wireName());
    }

    /**
     * Keeps only the columns of procedures in one category.
     */
    public TopMatrix filterByCategory(TopMatrix top, ProcedureCategory category) {
        List<Integer> columns = new ArrayList<>();
        for (int p = 0; p < top.procedures().size(); p++) {
            if (top.procedures().get(p).category() == category) {
                columns.add(p);
            }
        }
        List<Procedure> procedures = columns.stream().map(top.procedures()::get).toList();
        boolean[][] matrix = new boolean[top.visits().size()][columns.size()];
        for (int v = 0; v < matrix.length; v++) {
            for (int c = 0; c < columns.size(); c++) {
                matrix[v][c] = top.cell(v, columns.get(c));
            }
        }
        return new TopMatrix(top.visits(), procedures, matrix, top.version() + "-filtered-" + category.wireName());
    }

    /**
     * Returns an equal, independent copy.
     */
    public TopMatrix cloneMatrix(TopMatrix top) {
        return new TopMatrix(top.visits(), top.procedures(), top.matrix(), top.version());
    }

    public List<Procedure> proceduresForVisit(TopMatrix top, String visitId) {
        int v = top.visitIndex(visitId);
        if (v < 0) {
            return List.of();
        }
        List<Procedure> result = new ArrayList<>();
        for (int p = 0; p < top.procedures().size(); p++) {
            if (top.cell(v, p)) {
                result.add(top.procedures().get(p));
            }
        }
        return result;
    }

    public List<Visit> visitsForProcedure(TopMatrix top, String procedureId) {
        int p = top.procedureIndex(procedureId);
        if (p < 0) {
            return List.of();
        }
        List<Visit> result = new ArrayList<>();
        for (int v = 0; v < top.visits().size(); v++) {
            if (top.cell(v, p)) {
                result.add(top.visits().get(v));
            }
        }
        return result;
    }

    /**
     * Diffs two matrices by visit and procedure id. Changed cells are reported only
     * for visits and procedures present in both.
     *
     * @param before original matrix
     * @param after edited matrix
     * @return differences
     */
    public TopComparison compare(TopMatrix before, TopMatrix after) {
        List<Visit> addedVisits = after.visits().stream().filter(v -> before.visitIndex(v.id()) < 0).toList();
        List<Visit> removedVisits = before.visits().stream().filter(v -> after.visitIndex(v.id()) < 0).toList();
        List<Procedure> addedProcedures = after.procedures().stream()
            .filter(p -> before.procedureIndex(p.id()) < 0).toList();
        List<Procedure> removedProcedures = before.procedures().stream()
            .filter(p -> after.procedureIndex(p.id()) < 0).toList();

        List<TopComparison.CellChange> changedCells = new ArrayList<>();
        for (int v1 = 0; v1 < before.visits().size(); v1++) {
            String visitId = before.visits().get(v1).id();
            int v2 = after.visitIndex(visitId);
            if (v2 < 0) {
                continue;
            }
            for (int p1 = 0; p1 < before.procedures().size(); p1++) {
                String procedureId = before.procedures().get(p1).id();
                int p2 = after.procedureIndex(procedureId);
                if (p2 >= 0 && before.cell(v1, p1) != after.cell(v2, p2)) {
                    changedCells.add(new TopComparison.CellChange(visitId, procedureId,
                        before.cell(v1, p1), after.cell(v2, p2)));
                }
            }
        }
        return new TopComparison(addedVisits, removedVisits, addedProcedures, removedProcedures, changedCells);
    }

    private static boolean[] rowFor(Visit visit, List<Procedure> procedures) {
        boolean[] row = new boolean[procedures.size()];
        for (int p = 0; p < procedures.size(); p++) {
            row[p] = visit.hasProcedure(procedures.get(p).id());
        }
        return row;
    }

    private static int requireVisit(TopMatrix top, String visitId) {
        int index = top.visitIndex(visitId);
        if (index < 0) {
            throw new IllegalArgumentException("Visit not found in matrix: " + visitId);
        }
        return index;
    }

    private static int requireProcedure(TopMatrix top, String procedureId) {
        int index = top.procedureIndex(procedureId);
        if (index < 0) {
            throw new IllegalArgumentException("Procedure not found in matrix: " + procedureId);
        }
        return index;
    }
}
