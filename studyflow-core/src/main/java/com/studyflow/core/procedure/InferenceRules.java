package com.studyflow.core.procedure;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.studyflow.core.model.VisitType;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword and lookup tables driving procedure inference.
 *
 * <p>Loaded from {@code procedure-inference-rules.yaml}. Maps keep their YAML order so
 * inference output is deterministic.
 *
 * @param keywordRules endpoint-name keyword rules, in evaluation order
 * @param alwaysCategories categories every endpoint receives
 * @param categoryProcedures procedure ids per category
 * @param standardProcedures procedure ids per visit type wire name
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InferenceRules(
    @JsonProperty("keywordRules") List<KeywordRule> keywordRules,
    @JsonProperty("alwaysCategories") List<String> alwaysCategories,
    @JsonProperty("categoryProcedures") Map<String, List<String>> categoryProcedures,
    @JsonProperty("standardProcedures") Map<String, List<String>> standardProcedures
) {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Classpath location of the bundled rules.
     */
    public static final String DEFAULT_RESOURCE = "/procedure-inference-rules.yaml";

    public InferenceRules {
        keywordRules = keywordRules == null ? List.of() : List.copyOf(keywordRules);
        alwaysCategories = alwaysCategories == null ? List.of() : List.copyOf(alwaysCategories);
        categoryProcedures = copyOf(categoryProcedures);
        standardProcedures = copyOf(standardProcedures);
    }

    /**
     * Loads the rules bundled with the engine.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static InferenceRules loadDefault() {
        try (InputStream in = InferenceRules.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Inference rules resource not found: " + DEFAULT_RESOURCE);
            }
            return YAML_MAPPER.readValue(in, InferenceRules.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read inference rules: " + DEFAULT_RESOURCE, e);
        }
    }

    private static Map<String, List<String>> copyOf(Map<String, List<String>> source) {
        if (source == null) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((key, ids) -> copy.put(key, ids == null ? List.of() : List.copyOf(ids)));
        return Collections.unmodifiableMap(copy);
    }

    public List<String> proceduresFor(String category) {
        return categoryProcedures.getOrDefault(category, List.of());
    }

    public List<String> standardProceduresFor(VisitType type) {
        return standardProcedures.getOrDefault(type.wireName(), List.of());
    }

    /**
     * Maps endpoint-name keywords to inference categories.
     *
     * @param keywords lowercase substrings
     * @param categories categories granted on a match
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record KeywordRule(
        @JsonProperty("keywords") List<String> keywords,
        @JsonProperty("categories") List<String> categories
    ) {
        public KeywordRule {
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
            categories = categories == null ? List.of() : List.copyOf(categories);
        }

        public boolean matches(String lowerName) {
            return keywords.stream().anyMatch(lowerName::contains);
        }
    }
}
