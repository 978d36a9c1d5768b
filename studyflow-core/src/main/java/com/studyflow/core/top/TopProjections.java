package com.studyflow.core.top;

import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.TopMatrix;
import com.studyflow.core.model.Visit;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Text projections of a Table of Procedures: CSV, Markdown, HTML, Excel-style rows and
 * the interactive JSON view.
 *
 * <p>All projections are derived from the matrix cells, not from the visits' own
 * procedure lists.
 */
public final class TopProjections {

    static final String CHECK_MARK = "✓";

    private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder().setRecordSeparator('\n').build();
    private static final CSVFormat TSV_FORMAT = CSVFormat.TDF.builder().setRecordSeparator('\n').build();

    private TopProjections() {
        // Utility class
    }

    public static TopJsonView toJsonView(TopMatrix top) {
        List<TopJsonView.VisitEntry> visits = new ArrayList<>();
        for (int v = 0; v < top.visits().size(); v++) {
            Visit visit = top.visits().get(v);
            List<String> ids = new ArrayList<>();
            for (int p = 0; p < top.procedures().size(); p++) {
                if (top.cell(v, p)) {
                    ids.add(top.procedures().get(p).id());
                }
            }
            visits.add(new TopJsonView.VisitEntry(visit.id(), visit.name(), visit.day(), visit.type(),
                visit.window(), ids, ids.size()));
        }

        List<TopJsonView.ProcedureEntry> procedures = new ArrayList<>();
        for (int p = 0; p < top.procedures().size(); p++) {
            Procedure procedure = top.procedures().get(p);
            List<String> ids = new ArrayList<>();
            for (int v = 0; v < top.visits().size(); v++) {
                if (top.cell(v, p)) {
                    ids.add(top.visits().get(v).id());
                }
            }
            procedures.add(new TopJsonView.ProcedureEntry(procedure.id(), procedure.name(), procedure.category(),
                procedure.required(), ids.size(), ids));
        }

        TopJsonView.Metadata metadata = new TopJsonView.Metadata(top.version(), top.visits().size(),
            top.procedures().size());
        return new TopJsonView(metadata, visits, procedures, top.matrix());
    }

    /**
     * Rebuilds a matrix from its JSON view. Visits get the procedure ids of their row;
     * details the view does not carry (linked endpoints, codes, metadata) are lost.
     *
     * @param view JSON projection
     * @return reconstructed matrix
     * @throws IllegalArgumentException if the matrix does not match the entries
     */
    public static TopMatrix fromJsonView(TopJsonView view) {
        List<Visit> visits = view.visits().stream()
            .map(e -> new Visit(e.id(), e.name(), e.day(), null, e.type(), e.window(), e.procedures(), true, null))
            .toList();
        List<Procedure> procedures = view.procedures().stream()
            .map(e -> new Procedure(e.id(), e.name(), e.category(), null, null, null, e.required(), null))
            .toList();
        String version = view.metadata() != null ? view.metadata().version() : null;
        return new TopMatrix(visits, procedures, view.matrix(), version);
    }

    /**
     * CSV with a {@code Visit,Day,Type,<procedure names>} header and {@code X} for
     * filled cells, one record per line.
     */
    public static String toCsv(TopMatrix top) {
        List<List<Object>> rows = new ArrayList<>();
        List<Object> header = new ArrayList<>(List.of("Visit", "Day", "Type"));
        top.procedures().forEach(p -> header.add(p.name()));
        rows.add(header);

        for (int v = 0; v < top.visits().size(); v++) {
            Visit visit = top.visits().get(v);
            List<Object> row = new ArrayList<>(List.of(visit.name(), visit.day(), visit.type().wireName()));
            for (int p = 0; p < top.procedures().size(); p++) {
                row.add(top.cell(v, p) ? "X" : "");
            }
            rows.add(row);
        }
        return print(CSV_FORMAT, rows);
    }

    /**
     * Tab-separated form of {@link #toExcelRows(TopMatrix)}. Cells containing tabs,
     * quotes or line breaks are quoted so each visit stays on one record.
     */
    public static String toTsv(TopMatrix top) {
        return print(TSV_FORMAT, toExcelRows(top));
    }

    public static String toMarkdown(TopMatrix top) {
        List<String> header = new ArrayList<>(List.of("Visit", "Day"));
        top.procedures().forEach(p -> header.add(markdownCell(p.name())));

        List<String> lines = new ArrayList<>();
        lines.add("| " + String.join(" | ", header) + " |");
        lines.add("| " + header.stream().map(h -> "---").collect(Collectors.joining(" | ")) + " |");
        for (int v = 0; v < top.visits().size(); v++) {
            Visit visit = top.visits().get(v);
            List<String> row = new ArrayList<>(List.of(markdownCell(visit.name()), Integer.toString(visit.day())));
            for (int p = 0; p < top.procedures().size(); p++) {
                row.add(top.cell(v, p) ? CHECK_MARK : "");
            }
            lines.add("| " + String.join(" | ", row) + " |");
        }
        return String.join("\n", lines);
    }

    /**
     * Plain HTML table; filled cells carry class {@code has-proc}, empty ones
     * {@code no-proc}.
     */
    public static String toHtml(TopMatrix top) {
        StringBuilder html = new StringBuilder("<table class=\"top-matrix\">\n");
        html.append("  <thead>\n    <tr>\n");
        html.append("      <th>Visit</th>\n      <th>Day</th>\n      <th>Type</th>\n");
        for (Procedure procedure : top.procedures()) {
            html.append("      <th>").append(escapeHtml(procedure.name())).append("</th>\n");
        }
        html.append("    </tr>\n  </thead>\n  <tbody>\n");
        appendRows(html, top, false);
        html.append("  </tbody>\n</table>");
        return html.toString();
    }

    /**
     * Standalone HTML report: summary cards, the matrix with category-coloured
     * procedure headers, and a per-category summary table.
     *
     * @param top matrix
     * @param title study identifier shown in the title, or null
     * @return HTML document
     */
    public static String toReportHtml(TopMatrix top, String title) {
        TopStats stats = TopAnalyzer.stats(top);
        String studyId = title == null || title.isBlank() ? "Study" : escapeHtml(title);

        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n<html>\n<head>\n  <meta charset=\"UTF-8\">\n");
        html.append("  <title>Table of Procedures - ").append(studyId).append("</title>\n");
        html.append("  <style>\n").append(REPORT_STYLE).append("  </style>\n</head>\n<body>\n");
        html.append("  <h1>Table of Procedures</h1>\n");
        html.append("  <div class=\"metadata\">\n");
        html.append("    <strong>Study ID:</strong> ").append(studyId).append("<br>\n");
        html.append("    <strong>Version:</strong> ").append(escapeHtml(top.version())).append("\n");
        html.append("  </div>\n");

        html.append("  <div class=\"stats\">\n");
        appendCard(html, Integer.toString(stats.totalVisits()), "Total Visits");
        appendCard(html, Integer.toString(stats.totalProcedures()), "Total Procedures");
        appendCard(html, String.format(Locale.ROOT, "%.1f%%", stats.fillPercentage()), "Matrix Fill");
        appendCard(html, String.format(Locale.ROOT, "%.1f", stats.averageProceduresPerVisit()), "Avg Procedures/Visit");
        html.append("  </div>\n");

        html.append("  <h2>Table of Procedures Matrix</h2>\n  <table class=\"top-matrix\">\n    <thead>\n      <tr>\n");
        html.append("        <th>Visit</th>\n        <th>Day</th>\n        <th>Type</th>\n");
        for (Procedure procedure : top.procedures()) {
            html.append("        <th class=\"category-").append(procedure.category().wireName()).append("\">")
                .append(escapeHtml(procedure.name())).append("</th>\n");
        }
        html.append("      </tr>\n    </thead>\n    <tbody>\n");
        appendRows(html, top, true);
        html.append("    </tbody>\n  </table>\n");

        html.append("  <h2>Procedure Summary by Category</h2>\n  <table>\n    <thead>\n      <tr>\n");
        html.append("        <th>Category</th>\n        <th>Procedures</th>\n");
        html.append("        <th>Total Occurrences</th>\n        <th>Avg per Visit</th>\n");
        html.append("      </tr>\n    </thead>\n    <tbody>\n");
        for (CategorySummary summary : TopAnalyzer.summarizeByCategory(top)) {
            String category = summary.category().wireName();
            html.append("      <tr>\n");
            html.append("        <td class=\"category-").append(category).append("\">").append(category).append("</td>\n");
            html.append("        <td>").append(summary.procedureCount()).append("</td>\n");
            html.append("        <td>").append(summary.totalOccurrences()).append("</td>\n");
            html.append("        <td>").append(String.format(Locale.ROOT, "%.1f", summary.averagePerVisit()))
                .append("</td>\n");
            html.append("      </tr>\n");
        }
        html.append("    </tbody>\n  </table>\n</body>\n</html>\n");
        return html.toString();
    }

    /**
     * Spreadsheet rows: a header ({@code Visit, Day, Type, Window, <procedure names>})
     * followed by one row per visit. Day is an {@link Integer}; every other cell is a
     * string.
     */
    public static List<List<Object>> toExcelRows(TopMatrix top) {
        List<List<Object>> rows = new ArrayList<>();
        List<Object> header = new ArrayList<>(List.of("Visit", "Day", "Type", "Window"));
        top.procedures().forEach(p -> header.add(p.name()));
        rows.add(header);

        for (int v = 0; v < top.visits().size(); v++) {
            Visit visit = top.visits().get(v);
            List<Object> row = new ArrayList<>();
            row.add(visit.name());
            row.add(visit.day());
            row.add(visit.type().wireName());
            row.add(visit.window() != null ? visit.window().format() : "");
            for (int p = 0; p < top.procedures().size(); p++) {
                row.add(top.cell(v, p) ? "X" : "");
            }
            rows.add(row);
        }
        return rows;
    }

    public static String escapeHtml(String text) {
        return text
            .replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("'", "&#039;");
    }

    private static void appendRows(StringBuilder html, TopMatrix top, boolean report) {
        String indent = report ? "      " : "    ";
        for (int v = 0; v < top.visits().size(); v++) {
            Visit visit = top.visits().get(v);
            String name = escapeHtml(visit.name());
            html.append(indent).append("<tr>\n");
            html.append(indent).append("  <td>").append(report ? "<strong>" + name + "</strong>" : name).append("</td>\n");
            html.append(indent).append("  <td>").append(visit.day()).append("</td>\n");
            html.append(indent).append("  <td>").append(visit.type().wireName()).append("</td>\n");
            for (int p = 0; p < top.procedures().size(); p++) {
                boolean filled = top.cell(v, p);
                html.append(indent).append("  <td class=\"").append(filled ? "has-proc" : "no-proc").append("\">")
                    .append(filled ? CHECK_MARK : "").append("</td>\n");
            }
            html.append(indent).append("</tr>\n");
        }
    }

    private static void appendCard(StringBuilder html, String value, String label) {
        html.append("    <div class=\"stat-card\">\n");
        html.append("      <div class=\"stat-value\">").append(value).append("</div>\n");
        html.append("      <div class=\"stat-label\">").append(label).append("</div>\n");
        html.append("    </div>\n");
    }

    private static String print(CSVFormat format, List<? extends List<?>> rows) {
        StringBuilder out = new StringBuilder();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (List<?> row : rows) {
                printer.printRecord(row);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write delimited Table of Procedures", e);
        }
        return out.toString();
    }

    private static String markdownCell(String value) {
        return value.replace("|", "\\|");
    }

    private static final String REPORT_STYLE = """
            body { font-family: Arial, sans-serif; margin: 20px; color: #333; }
            h1 { color: #2c3e50; border-bottom: 2px solid #3498db; padding-bottom: 10px; }
            .metadata { background: #ecf0f1; padding: 15px; border-radius: 5px; margin: 20px 0; }
            .stats { display: grid; grid-template-columns: repeat(auto-fit, minmax(200px, 1fr)); gap: 15px; margin: 20px 0; }
            .stat-card { background: white; border: 1px solid #ddd; border-radius: 5px; padding: 15px; text-align: center; }
            .stat-value { font-size: 32px; font-weight: bold; color: #3498db; }
            .stat-label { font-size: 14px; color: #7f8c8d; margin-top: 5px; }
            table { width: 100%; border-collapse: collapse; margin: 20px 0; font-size: 12px; }
            th { background: #34495e; color: white; padding: 10px; text-align: left; position: sticky; top: 0; }
            td { border: 1px solid #ddd; padding: 8px; }
            tr:nth-child(even) { background: #f9f9f9; }
            .has-proc { background: #2ecc71; color: white; text-align: center; font-weight: bold; }
            .no-proc { background: #ecf0f1; }
            .category-efficacy { background: #3498db; color: white; }
            .category-safety { background: #e74c3c; color: white; }
            .category-labs { background: #9b59b6; color: white; }
            .category-pk { background: #f39c12; color: white; }
            .category-pd { background: #e67e22; color: white; }
            .category-questionnaire { background: #1abc9c; color: white; }
            .category-vital_signs { background: #16a085; color: white; }
            .category-physical_exam { background: #27ae60; color: white; }
            .category-ecg { background: #2980b9; color: white; }
            .category-imaging { background: #8e44ad; color: white; }
            .category-adverse_events { background: #c0392b; color: white; }
            .category-concomitant_meds { background: #d35400; color: white; }
            .category-device { background: #7f8c8d; color: white; }
            .category-other { background: #95a5a6; color: white; }
        """;
}
