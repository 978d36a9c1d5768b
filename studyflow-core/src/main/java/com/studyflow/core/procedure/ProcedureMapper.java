package com.studyflow.core.procedure;

import com.studyflow.core.config.StudyFlowConfig.MappingSettings;
import com.studyflow.core.model.ProcedureCatalogEntry;
import com.studyflow.core.model.ProcedureMappingResult;
import com.studyflow.core.model.ProcedureMatch;
import com.studyflow.core.util.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolves free-text procedure names to {@link ProcedureCatalog} entries.
 *
 * <p>Matching runs in two stages:
 * <ol>
 *   <li>Exact case-insensitive match on name, localized name or synonym: confidence 1.0</li>
 *   <li>Fuzzy match: weighted blend of word Jaccard, character-bigram cosine and
 *       Levenshtein similarity, maximized over the entry's names</li>
 * </ol>
 *
 * <p>Unmatched text is returned as {@link ProcedureMappingResult#noMatch(String)},
 * never as an exception.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProcedureMapper mapper = new ProcedureMapper(catalog, config.mapping());
 * ProcedureMappingResult result = mapper.map("glycated hemglobin");
 * if (result.lowConfidence()) {
 *     result.alternatives().forEach(alt -> log.info("Did you mean {}?", alt.entry().name()));
 * }
 * }</pre>
 */
public class ProcedureMapper {

    private static final Logger log = LoggerFactory.getLogger(ProcedureMapper.class);
    private static final Pattern FRAGMENT_DELIMITERS = Pattern.compile("[\\n,;]");
    private static final int MIN_FRAGMENT_LENGTH = 3;
    private static final double AMBIGUITY_MARGIN = 0.1;

    private final ProcedureCatalog catalog;
    private final MappingSettings settings;

    public ProcedureMapper(ProcedureCatalog catalog, MappingSettings settings) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public ProcedureMapper(ProcedureCatalog catalog) {
        this(catalog, MappingSettings.defaults());
    }

    /**
     * Maps one procedure text to the catalog.
     *
     * @param text free-text procedure name
     * @return best match with alternatives, or a no-match result
     */
    public ProcedureMappingResult map(String text) {
        if (text == null || text.isBlank()) {
            return ProcedureMappingResult.noMatch(text);
        }
        String cleaned = text.trim();

        ProcedureCatalogEntry exact = findExactMatch(cleaned);
        if (exact != null) {
            log.debug("Exact catalog match for '{}': {}", cleaned, exact.id());
            return new ProcedureMappingResult(text, exact, 1.0, false, List.of());
        }

        List<ProcedureMatch> candidates = findFuzzyMatches(cleaned);
        if (candidates.isEmpty()) {
            log.debug("No catalog match for '{}'", cleaned);
            return ProcedureMappingResult.noMatch(text);
        }

        ProcedureMatch best = candidates.get(0);
        boolean lowConfidence = best.confidence() < settings.lowConfidenceThreshold();
        List<ProcedureMatch> alternatives = candidates.subList(1, Math.min(candidates.size(), 1 + settings.maxAlternatives()));
        if (lowConfidence) {
            log.warn("Low confidence match for '{}': {} ({})", cleaned, best.entry().id(),
                String.format(Locale.ROOT, "%.2f", best.confidence()));
        }
        return new ProcedureMappingResult(text, best.entry(), best.confidence(), lowConfidence, alternatives);
    }

    public List<ProcedureMappingResult> mapAll(List<String> texts) {
        return texts.stream().map(this::map).toList();
    }

    /**
     * Extracts procedures from protocol prose.
     *
     * <p>The text is split on newlines, commas and semicolons. Fragments shorter than
     * three characters are skipped, and only matches above the extraction threshold are
     * kept. A procedure found in several fragments is reported once.
     *
     * @param text free-form protocol text
     * @return confident matches in order of first appearance
     */
    public List<ProcedureMappingResult> extractFromText(String text) {
        if (text == null) {
            return List.of();
        }
        List<ProcedureMappingResult> results = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String fragment : FRAGMENT_DELIMITERS.split(text)) {
            String trimmed = fragment.trim();
            if (trimmed.length() < MIN_FRAGMENT_LENGTH) {
                continue;
            }
            ProcedureMappingResult result = map(trimmed);
            if (result.matched() && result.confidence() > settings.extractionThreshold()
                && seen.add(result.matchedProcedure().id())) {
                results.add(result);
            }
        }
        log.debug("Extracted {} procedures from text", results.size());
        return results;
    }

    /**
     * Reviews a mapping result for low confidence and ambiguity.
     *
     * @param result mapping to review
     * @return validity and human-readable warnings
     */
    public MappingValidation validate(ProcedureMappingResult result) {
        List<String> warnings = new ArrayList<>();
        if (!result.matched()) {
            warnings.add("No match found for \"" + result.originalText() + "\"");
            return new MappingValidation(false, warnings);
        }
        String name = result.matchedProcedure().name();
        if (result.confidence() < settings.lowConfidenceThreshold()) {
            warnings.add(String.format(Locale.ROOT, "Low confidence match (%.0f%%) for \"%s\" -> \"%s\"",
                result.confidence() * 100, result.originalText(), name));
        }
        if (!result.alternatives().isEmpty()
            && result.alternatives().get(0).confidence() > result.confidence() - AMBIGUITY_MARGIN) {
            warnings.add("Ambiguous match: \"" + name + "\" vs \""
                + result.alternatives().get(0).entry().name() + "\"");
        }
        return new MappingValidation(result.confidence() >= settings.lowConfidenceThreshold(), warnings);
    }

    /**
     * Buckets mapping results by confidence.
     */
    public static MappingStats stats(List<ProcedureMappingResult> results) {
        int matched = 0;
        int high = 0;
        int medium = 0;
        int low = 0;
        for (ProcedureMappingResult result : results) {
            if (result.matched()) {
                matched++;
            }
            double confidence = result.confidence();
            if (confidence >= 0.8) {
                high++;
            } else if (confidence >= 0.6) {
                medium++;
            } else if (confidence > 0) {
                low++;
            }
        }
        return new MappingStats(results.size(), matched, high, medium, low, results.size() - matched);
    }

    /**
     * Scores a text against one catalog entry: the best blended similarity over its names.
     */
    double score(String text, ProcedureCatalogEntry entry) {
        double best = 0;
        for (String name : entry.searchableNames()) {
            double similarity = TextSimilarity.combined(text, name,
                settings.jaccardWeight(), settings.cosineWeight(), settings.levenshteinWeight());
            best = Math.max(best, similarity);
        }
        return Math.min(best, 1.0);
    }

    private ProcedureCatalogEntry findExactMatch(String text) {
        for (ProcedureCatalogEntry entry : catalog.entries()) {
            for (String name : entry.searchableNames()) {
                if (name.equalsIgnoreCase(text)) {
                    return entry;
                }
            }
        }
        return null;
    }

    private List<ProcedureMatch> findFuzzyMatches(String text) {
        List<ProcedureMatch> matches = new ArrayList<>();
        for (ProcedureCatalogEntry entry : catalog.entries()) {
            double confidence = score(text, entry);
            if (confidence > settings.matchThreshold()) {
                matches.add(new ProcedureMatch(entry, confidence));
            }
        }
        // Stable sort keeps catalog order between equal scores
        matches.sort(Comparator.comparingDouble(ProcedureMatch::confidence).reversed());
        return matches;
    }
}
