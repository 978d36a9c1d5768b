package com.studyflow.core.export;

import com.studyflow.core.model.TopMatrix;

/**
 * Converts a Table of Procedures into a document format.
 *
 * <p>Exporters are discovered through {@link java.util.ServiceLoader}; see
 * {@link TopExporters}.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class CsvTopExporter implements TopExporter {
 *     @Override
 *     public String getId() {
 *         return "csv";
 *     }
 *
 *     @Override
 *     public ExportedDocument export(TopMatrix top, ExportConfig config) {
 *         return new ExportedDocument(config.title() + "-top", TopProjections.toCsv(top), "csv", "text/csv");
 *     }
 *     // ...
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.studyflow.core.export.TopExporter}
 */
public interface TopExporter {

    /**
     * Returns the lowercase format identifier (e.g. "csv", "markdown").
     *
     * @return exporter id
     */
    String getId();

    /**
     * Returns a human-readable name for listings.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the file extension without the leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Exports the matrix.
     *
     * @param top matrix to export
     * @param config export options
     * @return exported document
     */
    ExportedDocument export(TopMatrix top, ExportConfig config);
}
