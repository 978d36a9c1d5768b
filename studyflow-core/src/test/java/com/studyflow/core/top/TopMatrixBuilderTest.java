package com.studyflow.core.top;

import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.ProcedureCategory;
import com.studyflow.core.model.TopMatrix;
import com.studyflow.core.model.TransposedTopMatrix;
import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TopMatrixBuilder}.
 */
class TopMatrixBuilderTest {

    private TopMatrixBuilder builder;
    private TopMatrix top;

    @BeforeEach
    void setUp() {
        builder = new TopMatrixBuilder();
        List<Procedure> procedures = List.of(
            procedure("proc_hba1c", ProcedureCategory.EFFICACY),
            procedure("proc_vital_signs", ProcedureCategory.VITAL_SIGNS),
            procedure("proc_cbc", ProcedureCategory.LABS));
        List<Visit> visits = List.of(
            Visit.of("visit_week_4", "Week 4", 28, VisitType.TREATMENT).withProcedures(List.of("proc_vital_signs")),
            Visit.of("visit_baseline", "Baseline", 0, VisitType.BASELINE)
                .withProcedures(List.of("proc_hba1c", "proc_vital_signs", "proc_unknown")));
        top = builder.build(visits, procedures);
    }

    @Test
    void build_sortsVisitsAndFillsCellsFromProcedureLists() {
        assertThat(top.visits()).extracting(Visit::id).containsExactly("visit_baseline", "visit_week_4");
        assertThat(top.matrix()).isDeepEqualTo(new boolean[][] {
            {true, true, false},
            {false, true, false}
        });
        assertThat(top.version()).isEqualTo(TopMatrix.INITIAL_VERSION);
        assertThat(top.filledCells()).isEqualTo(3);
    }

    @Test
    void addProcedureToVisit_setsCellAndVisitProcedure() {
        TopMatrix updated = builder.addProcedureToVisit(top, "visit_week_4", "proc_hba1c");

        assertThat(updated.cell(1, 0)).isTrue();
        assertThat(updated.visits().get(1).procedures()).contains("proc_hba1c");
        assertThat(top.cell(1, 0)).isFalse();
    }

    @Test
    void removeProcedureFromVisit_clearsCellAndVisitProcedure() {
        TopMatrix updated = builder.removeProcedureFromVisit(top, "visit_baseline", "proc_vital_signs");

        assertThat(updated.cell(0, 1)).isFalse();
        assertThat(updated.visits().get(0).hasProcedure("proc_vital_signs")).isFalse();
    }

    @Test
    void addProcedureToVisit_unknownIds_throw() {
        assertThatThrownBy(() -> builder.addProcedureToVisit(top, "visit_missing", "proc_hba1c"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("visit_missing");
        assertThatThrownBy(() -> builder.addProcedureToVisit(top, "visit_baseline", "proc_missing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("proc_missing");
    }

    @Test
    void addProcedureToAllVisits_fillsWholeColumn() {
        TopMatrix updated = builder.addProcedureToAllVisits(top, "proc_cbc");

        assertThat(builder.visitsForProcedure(updated, "proc_cbc")).hasSize(2);
        assertThat(updated.visits()).allMatch(v -> v.hasProcedure("proc_cbc"));
    }

    @Test
    void addVisit_insertsRowAtDayPositionAfterSameDayVisits() {
        Visit week2 = Visit.of("visit_week_2", "Week 2", 14, VisitType.TREATMENT).withProcedures(List.of("proc_cbc"));
        Visit otherBaseline = Visit.of("visit_day_0", "Day 0", 0, VisitType.BASELINE);

        TopMatrix updated = builder.addVisit(builder.addVisit(top, week2), otherBaseline);

        assertThat(updated.visits()).extracting(Visit::id)
            .containsExactly("visit_baseline", "visit_day_0", "visit_week_2", "visit_week_4");
        assertThat(updated.matrix()[2]).containsExactly(false, false, true);
        assertThat(updated.matrix()).hasNumberOfRows(4);
    }

    @Test
    void addVisit_duplicateId_throws() {
        assertThatThrownBy(() -> builder.addVisit(top, top.visits().get(0)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void addProcedure_appendsColumnFilledFromVisitLists() {
        Procedure unknown = procedure("proc_unknown", ProcedureCategory.OTHER);

        TopMatrix updated = builder.addProcedure(top, unknown);

        assertThat(updated.procedures()).hasSize(4);
        assertThat(updated.cell(0, 3)).isTrue();
        assertThat(updated.cell(1, 3)).isFalse();
    }

    @Test
    void mutations_keepDimensionsInStepWithAxes() {
        TopMatrix updated = builder.addProcedure(top, procedure("proc_ecg", ProcedureCategory.ECG));
        updated = builder.addVisit(updated, Visit.of("visit_eot", "End of Treatment", 84, VisitType.END_OF_TREATMENT));
        updated = builder.addProcedureToAllVisits(updated, "proc_ecg");
        updated = builder.removeProcedureFromVisit(updated, "visit_baseline", "proc_hba1c");

        boolean[][] matrix = updated.matrix();
        assertThat(matrix).hasNumberOfRows(updated.visits().size());
        for (boolean[] row : matrix) {
            assertThat(row).hasSize(updated.procedures().size());
        }
    }

    @Test
    void transpose_swapsAxesAndTagsVersion() {
        TransposedTopMatrix transposed = builder.transpose(top);

        assertThat(transposed.procedures()).hasSize(3);
        assertThat(transposed.cell(0, 0)).isTrue();
        assertThat(transposed.cell(0, 1)).isFalse();
        assertThat(transposed.version()).isEqualTo("1.0-transposed");
    }

    @Test
    void filterByVisitType_keepsMatchingRows() {
        TopMatrix filtered = builder.filterByVisitType(top, VisitType.TREATMENT);

        assertThat(filtered.visits()).extracting(Visit::id).containsExactly("visit_week_4");
        assertThat(filtered.version()).isEqualTo("1.0-filtered-treatment");
    }

    @Test
    void filterByCategory_keepsMatchingColumns() {
        TopMatrix filtered = builder.filterByCategory(top, ProcedureCategory.VITAL_SIGNS);

        assertThat(filtered.procedures()).extracting(Procedure::id).containsExactly("proc_vital_signs");
        assertThat(filtered.matrix()).isDeepEqualTo(new boolean[][] {{true}, {true}});
    }

    @Test
    void cloneMatrix_isEqualButIndependent() {
        TopMatrix clone = builder.cloneMatrix(top);

        assertThat(clone).isEqualTo(top).isNotSameAs(top);
        boolean[][] cells = clone.matrix();
        cells[0][0] = false;
        assertThat(clone.cell(0, 0)).isTrue();
    }

    @Test
    void proceduresForVisit_returnsFilledColumns() {
        assertThat(builder.proceduresForVisit(top, "visit_baseline")).extracting(Procedure::id)
            .containsExactly("proc_hba1c", "proc_vital_signs");
        assertThat(builder.proceduresForVisit(top, "visit_missing")).isEmpty();
    }

    @Test
    void compare_reportsAddedVisitsAndChangedCells() {
        TopMatrix after = builder.addVisit(top, Visit.of("visit_eot", "End of Treatment", 84, VisitType.END_OF_TREATMENT));
        after = builder.addProcedureToVisit(after, "visit_week_4", "proc_cbc");

        TopComparison comparison = builder.compare(top, after);

        assertThat(comparison.identical()).isFalse();
        assertThat(comparison.addedVisits()).extracting(Visit::id).containsExactly("visit_eot");
        assertThat(comparison.changedCells()).containsExactly(
            new TopComparison.CellChange("visit_week_4", "proc_cbc", false, true));
        assertThat(builder.compare(top, builder.cloneMatrix(top)).identical()).isTrue();
    }

    private static Procedure procedure(String id, ProcedureCategory category) {
        return new Procedure(id, id.substring("proc_".length()), category, List.of(), null, null, false, null);
    }
}
