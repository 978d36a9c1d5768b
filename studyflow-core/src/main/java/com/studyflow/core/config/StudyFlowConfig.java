package com.studyflow.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tunable heuristics of the study flow engine.
 *
 * <p>Loaded from {@code studyflow.yaml}. Every value is an empirically chosen constant;
 * omitted sections and fields fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * mapping:
 *   jaccardWeight: 0.3
 *   cosineWeight: 0.4
 *   levenshteinWeight: 0.3
 *   matchThreshold: 0.5
 *   lowConfidenceThreshold: 0.7
 *
 * cycles:
 *   minIntervalCoverage: 0.6
 *
 * validation:
 *   sapVisitTolerance: 1
 *   icfVisitTolerance: 2
 *   closeVisitDays: 3
 *   maxWindowRatio: 0.5
 *
 * autofix:
 *   defaultEotDay: 84
 * }</pre>
 *
 * @param mapping procedure mapper settings
 * @param cycles cycle builder settings
 * @param validation validation rule settings
 * @param autofix auto-fix settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StudyFlowConfig(
    @JsonProperty("mapping") MappingSettings mapping,
    @JsonProperty("cycles") CycleSettings cycles,
    @JsonProperty("validation") ValidationSettings validation,
    @JsonProperty("autofix") AutoFixSettings autofix
) {
    public StudyFlowConfig {
        mapping = mapping == null ? MappingSettings.defaults() : mapping;
        cycles = cycles == null ? CycleSettings.defaults() : cycles;
        validation = validation == null ? ValidationSettings.defaults() : validation;
        autofix = autofix == null ? AutoFixSettings.defaults() : autofix;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static StudyFlowConfig defaults() {
        return new StudyFlowConfig(null, null, null, null);
    }

    /**
     * Procedure mapper settings.
     *
     * @param jaccardWeight weight of word-set similarity
     * @param cosineWeight weight of character-bigram cosine similarity
     * @param levenshteinWeight weight of edit-distance similarity
     * @param matchThreshold minimum score for a candidate match (exclusive)
     * @param lowConfidenceThreshold score under which a match is flagged
     * @param extractionThreshold minimum score to keep a procedure extracted from prose (exclusive)
     * @param maxAlternatives runner-up matches to report
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MappingSettings(
        @JsonProperty("jaccardWeight") Double jaccardWeight,
        @JsonProperty("cosineWeight") Double cosineWeight,
        @JsonProperty("levenshteinWeight") Double levenshteinWeight,
        @JsonProperty("matchThreshold") Double matchThreshold,
        @JsonProperty("lowConfidenceThreshold") Double lowConfidenceThreshold,
        @JsonProperty("extractionThreshold") Double extractionThreshold,
        @JsonProperty("maxAlternatives") Integer maxAlternatives
    ) {
        public MappingSettings {
            jaccardWeight = jaccardWeight == null ? 0.3 : jaccardWeight;
            cosineWeight = cosineWeight == null ? 0.4 : cosineWeight;
            levenshteinWeight = levenshteinWeight == null ? 0.3 : levenshteinWeight;
            matchThreshold = matchThreshold == null ? 0.5 : matchThreshold;
            lowConfidenceThreshold = lowConfidenceThreshold == null ? 0.7 : lowConfidenceThreshold;
            extractionThreshold = extractionThreshold == null ? 0.6 : extractionThreshold;
            maxAlternatives = maxAlternatives == null ? 2 : maxAlternatives;
            double total = jaccardWeight + cosineWeight + levenshteinWeight;
            if (Math.abs(total - 1.0) > 1e-6) {
                throw new IllegalArgumentException("Similarity weights must sum to 1.0, got " + total);
            }
        }

        public static MappingSettings defaults() {
            return new MappingSettings(null, null, null, null, null, null, null);
        }
    }

    /**
     * Cycle builder settings.
     *
     * @param minIntervalCoverage share of intervals the dominant interval must cover
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CycleSettings(
        @JsonProperty("minIntervalCoverage") Double minIntervalCoverage
    ) {
        public CycleSettings {
            minIntervalCoverage = minIntervalCoverage == null ? 0.6 : minIntervalCoverage;
        }

        public static CycleSettings defaults() {
            return new CycleSettings(null);
        }
    }

    /**
     * Validation rule settings.
     *
     * @param sapVisitTolerance allowed Protocol/SAP visit count difference
     * @param icfVisitTolerance allowed Protocol/ICF visit count difference
     * @param closeVisitDays visits closer than this many days are reported
     * @param maxWindowRatio window total above this share of the visit day is reported
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationSettings(
        @JsonProperty("sapVisitTolerance") Integer sapVisitTolerance,
        @JsonProperty("icfVisitTolerance") Integer icfVisitTolerance,
        @JsonProperty("closeVisitDays") Integer closeVisitDays,
        @JsonProperty("maxWindowRatio") Double maxWindowRatio
    ) {
        public ValidationSettings {
            sapVisitTolerance = sapVisitTolerance == null ? 1 : sapVisitTolerance;
            icfVisitTolerance = icfVisitTolerance == null ? 2 : icfVisitTolerance;
            closeVisitDays = closeVisitDays == null ? 3 : closeVisitDays;
            maxWindowRatio = maxWindowRatio == null ? 0.5 : maxWindowRatio;
        }

        public static ValidationSettings defaults() {
            return new ValidationSettings(null, null, null, null);
        }
    }

    /**
     * Auto-fix settings.
     *
     * @param defaultEotDay end-of-treatment day used when the flow has no treatment visits
     * @param eotWindowDays window of a synthesized end-of-treatment visit
     * @param windowPercentage share of the visit day used for a recomputed window
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AutoFixSettings(
        @JsonProperty("defaultEotDay") Integer defaultEotDay,
        @JsonProperty("eotWindowDays") Integer eotWindowDays,
        @JsonProperty("windowPercentage") Double windowPercentage
    ) {
        public AutoFixSettings {
            defaultEotDay = defaultEotDay == null ? 84 : defaultEotDay;
            eotWindowDays = eotWindowDays == null ? 3 : eotWindowDays;
            windowPercentage = windowPercentage == null ? 0.1 : windowPercentage;
        }

        public static AutoFixSettings defaults() {
            return new AutoFixSettings(null, null, null);
        }
    }
}
