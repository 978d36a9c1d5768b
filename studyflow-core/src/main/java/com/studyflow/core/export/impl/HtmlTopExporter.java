package com.studyflow.core.export.impl;

import com.studyflow.core.export.ExportConfig;
import com.studyflow.core.export.ExportedDocument;
import com.studyflow.core.export.TopExporter;
import com.studyflow.core.model.TopMatrix;
import com.studyflow.core.top.TopProjections;

/**
 * HTML export. By default a standalone report with statistics and category colours;
 * with {@code html.report=false} only the bare table.
 */
public class HtmlTopExporter implements TopExporter {

    @Override
    public String getId() {
        return "html";
    }

    @Override
    public String getDisplayName() {
        return "HTML Table of Procedures Report";
    }

    @Override
    public String getFileExtension() {
        return "html";
    }

    @Override
    public ExportedDocument export(TopMatrix top, ExportConfig config) {
        boolean report = config.getSettingOrDefault("html.report", Boolean.TRUE);
        String content = report ? TopProjections.toReportHtml(top, config.title()) : TopProjections.toHtml(top);
        return new ExportedDocument(config.title() + "-top", content, getFileExtension(), "text/html");
    }
}
