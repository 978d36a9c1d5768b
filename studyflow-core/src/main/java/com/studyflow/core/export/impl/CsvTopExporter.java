package com.studyflow.core.export.impl;

import com.studyflow.core.export.ExportConfig;
import com.studyflow.core.export.ExportedDocument;
import com.studyflow.core.export.TopExporter;
import com.studyflow.core.model.TopMatrix;
import com.studyflow.core.top.TopProjections;

/**
 * Comma-separated ToP with {@code X} marks.
 */
public class CsvTopExporter implements TopExporter {

    @Override
    public String getId() {
        return "csv";
    }

    @Override
    public String getDisplayName() {
        return "CSV Table of Procedures";
    }

    @Override
    public String getFileExtension() {
        return "csv";
    }

    @Override
    public ExportedDocument export(TopMatrix top, ExportConfig config) {
        return new ExportedDocument(config.title() + "-top", TopProjections.toCsv(top), getFileExtension(), "text/csv");
    }
}
