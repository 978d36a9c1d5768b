package com.studyflow.core.flow;

import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.ProcedureCategory;
import com.studyflow.core.model.StudyFlow;
import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link StudyFlowContextFormatter}.
 */
class StudyFlowContextFormatterTest {

    @Test
    void format_nullFlow_returnsEmpty() {
        assertThat(StudyFlowContextFormatter.format(null)).isEmpty();
    }

    @Test
    void format_flow_rendersScheduleProceduresAndDuration() {
        // Given
        Visit baseline = Visit.of("visit_baseline", "Baseline", 0, VisitType.BASELINE)
            .withProcedures(List.of("proc_hba1c", "proc_vital_signs", "proc_ecg_12lead", "proc_physical_exam"));
        Procedure hba1c = new Procedure("proc_hba1c", "HbA1c", ProcedureCategory.LABS, List.of(), null, null,
            true, null);
        StudyFlow flow = new StudyFlow("flow_diab", List.of(baseline), List.of(hba1c), List.of(), null, 84, Map.of());

        // When
        String text = StudyFlowContextFormatter.format(flow);

        // Then
        assertThat(text).startsWith("\n\n## STUDY FLOW DATA\n\n");
        assertThat(text).contains("| Baseline | 0 | baseline | hba1c, vital signs, ecg 12lead |");
        assertThat(text).doesNotContain("physical exam");
        assertThat(text).contains("- **HbA1c** (labs)");
        assertThat(text).contains("Total duration: 84 days (12 weeks)");
    }

    @Test
    void readableProcedureId_stripsPrefixAndUnderscores() {
        assertThat(StudyFlowContextFormatter.readableProcedureId("proc_blood_pressure")).isEqualTo("blood pressure");
        assertThat(StudyFlowContextFormatter.readableProcedureId("custom_test")).isEqualTo("custom test");
    }
}
