package com.studyflow.core.flow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.studyflow.core.model.StudyFlow;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON persistence for study flows and other engine results.
 *
 * <p>The engine itself never touches storage; callers use this helper to keep flows
 * between runs.
 */
public final class StudyFlowJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private StudyFlowJson() {
        // Utility class
    }

    /**
     * Returns the shared mapper. It is configured once and must not be reconfigured.
     *
     * @return object mapper
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static StudyFlow fromJson(String json) {
        try {
            return MAPPER.readValue(json, StudyFlow.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid study flow JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static void write(StudyFlow flow, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, toJson(flow));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write study flow to " + file, e);
        }
    }

    public static StudyFlow read(Path file) {
        try {
            return fromJson(Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read study flow from " + file, e);
        }
    }

    public static void writeStudy(GeneratedStudy study, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, toJson(study));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write study to " + file, e);
        }
    }

    /**
     * Reads a study written by {@link #writeStudy(GeneratedStudy, Path)}.
     *
     * @param file JSON file
     * @return study
     * @throws UncheckedIOException if the file cannot be read
     * @throws IllegalArgumentException if the content is not a study
     */
    public static GeneratedStudy readStudy(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read study from " + file, e);
        }
        try {
            return MAPPER.readValue(json, GeneratedStudy.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid study JSON in " + file + ": " + e.getOriginalMessage(), e);
        }
    }
}
