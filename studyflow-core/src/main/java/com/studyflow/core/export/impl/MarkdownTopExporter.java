package com.studyflow.core.export.impl;

import com.studyflow.core.export.ExportConfig;
import com.studyflow.core.export.ExportedDocument;
import com.studyflow.core.export.TopExporter;
import com.studyflow.core.model.TopMatrix;
import com.studyflow.core.top.TopProjections;

/**
 * Markdown table with an optional heading.
 *
 * <p>Setting {@code markdown.heading} (Boolean, default true) prefixes a
 * {@code # Table of Procedures} heading with the study title.
 */
public class MarkdownTopExporter implements TopExporter {

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getDisplayName() {
        return "Markdown Table of Procedures";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public ExportedDocument export(TopMatrix top, ExportConfig config) {
        StringBuilder content = new StringBuilder();
        if (config.getSettingOrDefault("markdown.heading", Boolean.TRUE)) {
            content.append("# Table of Procedures - ").append(config.title()).append("\n\n");
        }
        content.append(TopProjections.toMarkdown(top)).append("\n");
        return new ExportedDocument(config.title() + "-top", content.toString(), getFileExtension(), "text/markdown");
    }
}
