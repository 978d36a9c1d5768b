package com.studyflow.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Documents rendered together in one pass.
 *
 * @param documents documents in output order
 */
public record OutputBundle(List<OutputDocument> documents) {
    public OutputBundle {
        Objects.requireNonNull(documents, "documents must not be null");
        documents = List.copyOf(documents);
    }

    public static OutputBundle of(OutputDocument... documents) {
        return new OutputBundle(List.of(documents));
    }
}
