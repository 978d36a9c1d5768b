package com.studyflow.core.visit;

import com.studyflow.core.model.Visit;
import com.studyflow.core.model.VisitNormalizationResult;
import com.studyflow.core.model.VisitType;
import com.studyflow.core.model.VisitWindow;
import com.studyflow.core.util.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.IntUnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses free-text visit labels ("Day 14", "Week 4", "Скрининг") into canonical visits.
 *
 * <p>Patterns are tried in priority order, each in English and Russian:
 * <ol>
 *   <li>Day: {@code Day N}, {@code D N}, {@code День N} (confidence 0.95)</li>
 *   <li>Week: {@code Week N}, {@code W N}, {@code Неделя N}, day = N x 7 (0.95)</li>
 *   <li>Month: {@code Month N}, {@code M N}, {@code Месяц N}, day = N x 30 (0.9)</li>
 *   <li>Special visits by keyword: screening, baseline, end of treatment, follow-up, unscheduled</li>
 *   <li>Ordinal: {@code Visit N}, {@code V N}, day = (N - 1) x 7 (0.7)</li>
 * </ol>
 *
 * <p>Anything else degrades to day 0, type treatment, confidence 0.3. Normalization
 * never throws.
 *
 * <p>End of treatment and follow-up carry sentinel days ({@link #END_OF_TREATMENT_DAY},
 * {@link #FOLLOW_UP_DAY}) until {@link VisitInference#resolveSentinelDays(List)} places them.
 */
public class VisitNormalizer {

    private static final Logger log = LoggerFactory.getLogger(VisitNormalizer.class);

    public static final int SCREENING_DAY = -14;
    public static final int UNSCHEDULED_DAY = -1;
    public static final int END_OF_TREATMENT_DAY = 999;
    public static final int FOLLOW_UP_DAY = 1000;

    public static final double UNRECOGNIZED_CONFIDENCE = 0.3;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<NumberedPattern> NUMBERED_PATTERNS = List.of(
        new NumberedPattern(Pattern.compile("(?:day|d)\\s*(\\d+)", FLAGS), "Day", n -> n, 0.95),
        new NumberedPattern(Pattern.compile("(?:день|д)\\s*(\\d+)", FLAGS), "Day", n -> n, 0.95),
        new NumberedPattern(Pattern.compile("(?:week|w)\\s*(\\d+)", FLAGS), "Week", VisitNormalizer::weeksToDays, 0.95),
        new NumberedPattern(Pattern.compile("(?:неделя|нед)\\s*(\\d+)", FLAGS), "Week", VisitNormalizer::weeksToDays, 0.95),
        new NumberedPattern(Pattern.compile("(?:month|m)\\s*(\\d+)", FLAGS), "Month", VisitNormalizer::monthsToDays, 0.9),
        new NumberedPattern(Pattern.compile("(?:месяц|мес)\\s*(\\d+)", FLAGS), "Month", VisitNormalizer::monthsToDays, 0.9)
    );

    private static final List<NumberedPattern> ORDINAL_PATTERNS = List.of(
        new NumberedPattern(Pattern.compile("(?:visit|v)\\s*(\\d+)", FLAGS), "Visit", VisitNormalizer::ordinalDay, 0.7),
        new NumberedPattern(Pattern.compile("(?:визит|в)\\s*(\\d+)", FLAGS), "Visit", VisitNormalizer::ordinalDay, 0.7)
    );

    private static final List<SpecialVisit> SPECIAL_VISITS = List.of(
        new SpecialVisit(List.of("screening", "скрининг"), "Screening", SCREENING_DAY, VisitType.SCREENING, 0.98),
        new SpecialVisit(List.of("baseline", "базовый", "исходный"), "Baseline", 0, VisitType.BASELINE, 0.98),
        new SpecialVisit(List.of("end of treatment", "eot", "окончание лечения"), "End of Treatment",
            END_OF_TREATMENT_DAY, VisitType.END_OF_TREATMENT, 0.95),
        new SpecialVisit(List.of("follow", "последующий", "наблюдение"), "Follow-up",
            FOLLOW_UP_DAY, VisitType.FOLLOW_UP, 0.9),
        new SpecialVisit(List.of("unscheduled", "внеплановый"), "Unscheduled",
            UNSCHEDULED_DAY, VisitType.UNSCHEDULED, 0.95)
    );

    /**
     * Normalizes one visit label.
     *
     * @param label free-text label
     * @return normalization result, never null
     */
    public VisitNormalizationResult normalize(String label) {
        String cleaned = label == null ? "" : label.trim();

        VisitNormalizationResult result = matchNumbered(label, cleaned, NUMBERED_PATTERNS);
        if (result == null) {
            result = matchSpecial(label, cleaned);
        }
        if (result == null) {
            result = matchNumbered(label, cleaned, ORDINAL_PATTERNS);
        }
        if (result == null) {
            log.debug("Unrecognized visit label '{}', defaulting to Day 0 treatment", cleaned);
            return new VisitNormalizationResult(label, cleaned, 0, VisitType.TREATMENT, UNRECOGNIZED_CONFIDENCE);
        }
        log.debug("Normalized visit '{}' to {} (day {}, {})", cleaned, result.normalizedName(), result.day(), result.type());
        return result;
    }

    public List<VisitNormalizationResult> normalizeAll(List<String> labels) {
        return labels.stream().map(this::normalize).toList();
    }

    /**
     * Normalizes labels into visits sorted by day.
     *
     * <p>Ids are derived from the normalized name ({@code visit_week_4}); a repeated
     * name gets a numeric suffix. The original label and confidence are kept as
     * provenance metadata.
     *
     * @param labels free-text labels
     * @return visits sorted by day, without windows or procedures
     */
    public List<Visit> toVisits(List<String> labels) {
        List<Visit> visits = new ArrayList<>();
        Set<String> usedIds = new HashSet<>();
        for (VisitNormalizationResult result : normalizeAll(labels)) {
            String id = Identifiers.uniqueId(Identifiers.visitId(result.normalizedName()), usedIds);
            Map<String, String> metadata = Map.of(
                "source", "normalized",
                "originalName", String.valueOf(result.originalName()),
                "confidence", String.format(Locale.ROOT, "%.2f", result.confidence()));
            boolean required = result.type() != VisitType.UNSCHEDULED;
            visits.add(new Visit(id, result.normalizedName(), result.day(), null, result.type(),
                null, List.of(), required, metadata));
        }
        visits.sort(Comparator.comparingInt(Visit::day));
        return visits;
    }

    /**
     * Classifies a day offset: negative is screening, 0 baseline, below the
     * end-of-treatment sentinel treatment, the sentinel itself end of treatment, and
     * anything later follow-up.
     *
     * @param day day offset
     * @return visit type
     */
    public static VisitType determineVisitType(int day) {
        if (day < 0) {
            return VisitType.SCREENING;
        }
        if (day == 0) {
            return VisitType.BASELINE;
        }
        if (day < END_OF_TREATMENT_DAY) {
            return VisitType.TREATMENT;
        }
        if (day == END_OF_TREATMENT_DAY) {
            return VisitType.END_OF_TREATMENT;
        }
        return VisitType.FOLLOW_UP;
    }

    /**
     * Default window for a visit type, used when no procedure-based window applies.
     *
     * <p>Screening and follow-up get ±7, baseline 0, treatment 10% of the day with a
     * 3-day floor, everything else ±3. An existing window is kept.
     *
     * @param visit visit to size
     * @return window
     */
    public static VisitWindow calculateVisitWindow(Visit visit) {
        if (visit.window() != null) {
            return visit.window();
        }
        return switch (visit.type()) {
            case SCREENING, FOLLOW_UP -> VisitWindow.symmetric(7);
            case BASELINE -> VisitWindow.zero();
            case TREATMENT -> VisitWindow.symmetric(Math.max((int) Math.ceil(visit.day() * 0.1), 3));
            case END_OF_TREATMENT, UNSCHEDULED -> VisitWindow.symmetric(3);
        };
    }

    // Day converters throw ArithmeticException on int overflow; the label is then unmatched.

    private static int weeksToDays(int weeks) {
        return Math.multiplyExact(weeks, 7);
    }

    private static int monthsToDays(int months) {
        return Math.multiplyExact(months, 30);
    }

    private static int ordinalDay(int ordinal) {
        return ordinal <= 1 ? 0 : Math.multiplyExact(ordinal - 1, 7);
    }

    private static VisitNormalizationResult matchNumbered(String label, String cleaned, List<NumberedPattern> patterns) {
        for (NumberedPattern pattern : patterns) {
            Matcher matcher = pattern.regex().matcher(cleaned);
            if (!matcher.find()) {
                continue;
            }
            int number;
            try {
                number = Integer.parseInt(matcher.group(1));
            } catch (NumberFormatException e) {
                log.debug("Visit number out of range in '{}'", cleaned);
                continue;
            }
            int day;
            try {
                day = pattern.toDay().applyAsInt(number);
            } catch (ArithmeticException e) {
                log.debug("Visit day out of range in '{}'", cleaned);
                continue;
            }
            return new VisitNormalizationResult(label, pattern.prefix() + " " + number, day,
                determineVisitType(day), pattern.confidence());
        }
        return null;
    }

    private static VisitNormalizationResult matchSpecial(String label, String cleaned) {
        String lower = cleaned.toLowerCase(Locale.ROOT);
        for (SpecialVisit special : SPECIAL_VISITS) {
            if (special.keywords().stream().anyMatch(lower::contains)) {
                return new VisitNormalizationResult(label, special.name(), special.day(), special.type(),
                    special.confidence());
            }
        }
        return null;
    }

    private record NumberedPattern(Pattern regex, String prefix, IntUnaryOperator toDay, double confidence) {
    }

    private record SpecialVisit(List<String> keywords, String name, int day, VisitType type, double confidence) {
    }
}
