package com.studyflow.core.renderer;

import java.util.Objects;

/**
 * A document ready to be written to an output destination.
 *
 * @param relativePath path relative to the output directory (e.g. "top/study-001.csv")
 * @param content document content
 * @param contentType MIME type, may be null
 */
public record OutputDocument(
    String relativePath,
    String content,
    String contentType
) {
    public OutputDocument {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
