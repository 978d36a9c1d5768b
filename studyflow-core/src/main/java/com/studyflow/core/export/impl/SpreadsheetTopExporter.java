package com.studyflow.core.export.impl;

import com.studyflow.core.export.ExportConfig;
import com.studyflow.core.export.ExportedDocument;
import com.studyflow.core.export.TopExporter;
import com.studyflow.core.model.TopMatrix;
import com.studyflow.core.top.TopProjections;

/**
 * Tab-separated spreadsheet rows including the visit window column, for pasting into
 * Excel.
 */
public class SpreadsheetTopExporter implements TopExporter {

    @Override
    public String getId() {
        return "excel";
    }

    @Override
    public String getDisplayName() {
        return "Spreadsheet (TSV) Table of Procedures";
    }

    @Override
    public String getFileExtension() {
        return "tsv";
    }

    @Override
    public ExportedDocument export(TopMatrix top, ExportConfig config) {
        return new ExportedDocument(config.title() + "-top", TopProjections.toTsv(top), getFileExtension(),
            "text/tab-separated-values");
    }
}
