package com.studyflow.cli;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.studyflow.core.config.ConfigLoader;
import com.studyflow.core.config.StudyFlowConfig;
import com.studyflow.core.model.FlowIssue;
import com.studyflow.core.model.IcfDocument;
import com.studyflow.core.model.SapDocument;
import com.studyflow.core.validation.FlowValidationResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Helpers shared by the StudyFlow commands: configuration, ICF/SAP documents and
 * issue printing.
 */
final class CommandSupport {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private CommandSupport() {
        // Utility class
    }

    static StudyFlowConfig loadConfig(Path configFile) {
        return configFile == null ? StudyFlowConfig.defaults() : ConfigLoader.load(configFile);
    }

    /**
     * Reads ICF facts from YAML ({@code procedureMentions}, {@code riskDescriptions},
     * {@code visitMentions}).
     *
     * @param file YAML file, or null
     * @return document, or null when no file was given
     * @throws IOException if the file cannot be read or parsed
     */
    static IcfDocument readIcf(Path file) throws IOException {
        return file == null ? null : readYaml(file, IcfDocument.class);
    }

    /**
     * Reads SAP facts from YAML ({@code visitCount}, {@code cycleLengths},
     * {@code assessmentSchedules}).
     *
     * @param file YAML file, or null
     * @return document, or null when no file was given
     * @throws IOException if the file cannot be read or parsed
     */
    static SapDocument readSap(Path file) throws IOException {
        return file == null ? null : readYaml(file, SapDocument.class);
    }

    static void writeSap(SapDocument sap, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        YAML_MAPPER.writeValue(file.toFile(), sap);
    }

    private static <T> T readYaml(Path file, Class<T> type) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("File not found: " + file);
        }
        T value = YAML_MAPPER.readValue(file.toFile(), type);
        if (value == null) {
            throw new IOException("Empty document: " + file);
        }
        return value;
    }

    static void printSummary(FlowValidationResult result) {
        FlowValidationResult.SeveritySummary summary = result.summary();
        System.out.printf("Issues: %d (critical: %d, error: %d, warning: %d, info: %d)%n",
            summary.total(), summary.critical(), summary.error(), summary.warning(), summary.info());
    }

    static void printIssues(List<FlowIssue> issues) {
        for (FlowIssue issue : issues) {
            System.out.printf("  [%s] %s%s%n",
                issue.severity().wireName().toUpperCase(Locale.ROOT),
                issue.id(),
                issue.autoFixable() ? " (auto-fixable)" : "");
            System.out.printf("    %s%n", issue.message());
            if (issue.details() != null && !issue.details().isBlank()) {
                System.out.printf("    %s%n", issue.details());
            }
        }
    }
}
