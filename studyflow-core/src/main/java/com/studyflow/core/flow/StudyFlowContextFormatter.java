package com.studyflow.core.flow;

import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.StudyFlow;
import com.studyflow.core.model.Visit;

import java.util.stream.Collectors;

/**
 * Renders a study flow as markdown context for document generation.
 */
public final class StudyFlowContextFormatter {

    static final int KEY_PROCEDURES_PER_VISIT = 3;

    private StudyFlowContextFormatter() {
        // Utility class
    }

    /**
     * Formats the visit schedule, the procedures and the study duration.
     *
     * @param flow study flow, may be null
     * @return markdown section, empty for a null flow
     */
    public static String format(StudyFlow flow) {
        if (flow == null) {
            return "";
        }
        StringBuilder text = new StringBuilder("\n\n## STUDY FLOW DATA\n\n");

        text.append("### Visit Schedule\n");
        text.append("| Visit | Day | Type | Key Procedures |\n");
        text.append("|-------|-----|------|----------------|\n");
        for (Visit visit : flow.visits()) {
            String keyProcedures = visit.procedures().stream()
                .limit(KEY_PROCEDURES_PER_VISIT)
                .map(StudyFlowContextFormatter::readableProcedureId)
                .collect(Collectors.joining(", "));
            text.append("| ").append(visit.name())
                .append(" | ").append(visit.day())
                .append(" | ").append(visit.type().wireName())
                .append(" | ").append(keyProcedures)
                .append(" |\n");
        }

        text.append("\n### Procedures Summary\n");
        for (Procedure procedure : flow.procedures()) {
            text.append("- **").append(procedure.name()).append("** (")
                .append(procedure.category().wireName()).append(")\n");
        }

        long weeks = Math.round(flow.totalDuration() / 7.0);
        text.append("\n### Study Duration\n");
        text.append("Total duration: ").append(flow.totalDuration()).append(" days (")
            .append(weeks).append(" weeks)\n");
        return text.toString();
    }

    static String readableProcedureId(String procedureId) {
        String name = procedureId.startsWith("proc_") ? procedureId.substring("proc_".length()) : procedureId;
        return name.replace('_', ' ');
    }
}
