package com.studyflow.core.export.impl;

import com.studyflow.core.export.ExportConfig;
import com.studyflow.core.export.ExportedDocument;
import com.studyflow.core.model.Procedure;
import com.studyflow.core.model.ProcedureCategory;
import com.studyflow.core.model.TopMatrix;
import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitType;
import com.studyflow.core.model.VisitWindow;
import com.studyflow.core.top.TopMatrixBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the bundled ToP exporters.
 */
class TopExporterImplTest {

    private TopMatrix top;
    private ExportConfig config;

    @BeforeEach
    void setUp() {
        List<Procedure> procedures = List.of(
            new Procedure("proc_hba1c", "HbA1c", ProcedureCategory.EFFICACY, List.of(), null, null, true, null));
        List<Visit> visits = List.of(
            Visit.of("visit_baseline", "Baseline", 0, VisitType.BASELINE)
                .withWindow(VisitWindow.zero())
                .withProcedures(List.of("proc_hba1c")));
        top = new TopMatrixBuilder().build(visits, procedures);
        config = ExportConfig.titled("DIAB-001");
    }

    @Test
    void csv_namesFileAfterTitle() {
        ExportedDocument document = new CsvTopExporter().export(top, config);

        assertThat(document.fileName()).isEqualTo("DIAB-001-top.csv");
        assertThat(document.contentType()).isEqualTo("text/csv");
        assertThat(document.content()).startsWith("Visit,Day,Type,HbA1c");
    }

    @Test
    void markdown_headingCanBeDisabled() {
        MarkdownTopExporter exporter = new MarkdownTopExporter();

        String withHeading = exporter.export(top, config).content();
        String withoutHeading = exporter.export(top,
            new ExportConfig("DIAB-001", Map.of("markdown.heading", false))).content();

        assertThat(withHeading).startsWith("# Table of Procedures - DIAB-001\n\n| Visit");
        assertThat(withoutHeading).startsWith("| Visit");
        assertThat(exporter.export(top, config).fileName()).isEqualTo("DIAB-001-top.md");
    }

    @Test
    void html_reportByDefaultAndBareTableOnRequest() {
        HtmlTopExporter exporter = new HtmlTopExporter();

        String report = exporter.export(top, config).content();
        String table = exporter.export(top, new ExportConfig("DIAB-001", Map.of("html.report", false))).content();

        assertThat(report).startsWith("<!DOCTYPE html>");
        assertThat(table).startsWith("<table class=\"top-matrix\">");
    }

    @Test
    void json_containsMatrixAndMetadata() {
        ExportedDocument document = new JsonTopExporter().export(top, config);

        assertThat(document.contentType()).isEqualTo("application/json");
        assertThat(document.content()).contains("\"totalVisits\" : 1").contains("\"matrix\"");
    }

    @Test
    void excel_writesTabSeparatedRowsWithWindow() {
        ExportedDocument document = new SpreadsheetTopExporter().export(top, config);

        assertThat(document.fileName()).isEqualTo("DIAB-001-top.tsv");
        assertThat(document.content().split("\n")).containsExactly(
            "Visit\tDay\tType\tWindow\tHbA1c",
            "Baseline\t0\tbaseline\t±0/0 days\tX");
    }

    @Test
    void exportConfig_blankTitle_fallsBackToDefault() {
        assertThat(new ExportConfig(" ", null).title()).isEqualTo(ExportConfig.DEFAULT_TITLE);
        assertThat(new CsvTopExporter().export(top, ExportConfig.defaults()).fileName()).isEqualTo("study-top.csv");
    }
}
