package com.studyflow.core.export.impl;

import com.studyflow.core.export.ExportConfig;
import com.studyflow.core.export.ExportedDocument;
import com.studyflow.core.export.TopExporter;
import com.studyflow.core.flow.StudyFlowJson;
import com.studyflow.core.model.TopMatrix;
import com.studyflow.core.top.TopProjections;

/**
 * Interactive JSON view with per-visit and per-procedure fill counts.
 */
public class JsonTopExporter implements TopExporter {

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDisplayName() {
        return "Interactive JSON Table of Procedures";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public ExportedDocument export(TopMatrix top, ExportConfig config) {
        String json = StudyFlowJson.toJson(TopProjections.toJsonView(top));
        return new ExportedDocument(config.title() + "-top", json, getFileExtension(), "application/json");
    }
}
