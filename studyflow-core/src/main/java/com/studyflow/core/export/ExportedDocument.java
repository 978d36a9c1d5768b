package com.studyflow.core.export;

import com.studyflow.core.renderer.OutputDocument;

import java.util.Objects;

/**
 * @param name base file name without extension
 * @param content exported content
 * @param fileExtension extension without the leading dot
 * @param contentType MIME type
 */
public record ExportedDocument(
    String name,
    String content,
    String fileExtension,
    String contentType
) {
    public ExportedDocument {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    public String fileName() {
        return name + "." + fileExtension;
    }

    public OutputDocument toOutputDocument() {
        return new OutputDocument(fileName(), content, contentType);
    }
}
