package com.studyflow.core.util;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * String similarity metrics used for fuzzy procedure matching.
 *
 * <p>All metrics operate on {@link #normalize(String) normalized} text and return a
 * score in [0, 1], where 1 means identical.
 */
public final class TextSimilarity {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> STOP_WORDS = Set.of(
        "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with",
        "by", "from", "as", "is", "was", "are", "were", "been", "be", "have", "has", "had",
        "do", "does", "did", "will", "would", "should", "could", "may", "might", "must",
        "can", "this", "that", "these", "those"
    );

    private TextSimilarity() {
        // Utility class
    }

    /**
     * Lowercases, replaces punctuation with spaces and collapses whitespace.
     *
     * <p>Letters of any script are kept, so Cyrillic names survive normalization.
     *
     * @param text raw text
     * @return normalized text, empty for null input
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String stripped = NON_WORD.matcher(lower).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * Splits normalized text into words, dropping English stop words.
     */
    public static Set<String> tokens(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(normalized.split(" "))
            .filter(word -> !STOP_WORDS.contains(word))
            .collect(Collectors.toCollection(HashSet::new));
    }

    /**
     * Jaccard similarity of the two word sets. Two empty sets are identical.
     */
    public static double jaccard(String a, String b) {
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    /**
     * Cosine similarity of character bigram frequency vectors.
     *
     * <p>Bigrams are taken over the normalized text including spaces. Texts shorter
     * than two characters are compared as single-character grams.
     */
    public static double cosine(String a, String b) {
        Map<String, Integer> left = bigrams(normalize(a));
        Map<String, Integer> right = bigrams(normalize(b));
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        double dot = 0;
        for (Map.Entry<String, Integer> entry : left.entrySet()) {
            Integer other = right.get(entry.getKey());
            if (other != null) {
                dot += (double) entry.getValue() * other;
            }
        }
        return dot / (magnitude(left) * magnitude(right));
    }

    /**
     * Edit-distance similarity: {@code 1 - distance / maxLength}.
     */
    public static double levenshteinSimilarity(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        int maxLength = Math.max(left.length(), right.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(left, right) / maxLength;
    }

    /**
     * Classic Levenshtein distance with a rolling row.
     */
    public static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * Weighted blend of {@link #jaccard}, {@link #cosine} and {@link #levenshteinSimilarity}.
     */
    public static double combined(String a, String b, double jaccardWeight, double cosineWeight, double levenshteinWeight) {
        return jaccardWeight * jaccard(a, b)
            + cosineWeight * cosine(a, b)
            + levenshteinWeight * levenshteinSimilarity(a, b);
    }

    private static Map<String, Integer> bigrams(String text) {
        Map<String, Integer> grams = new HashMap<>();
        if (text.isEmpty()) {
            return grams;
        }
        if (text.length() == 1) {
            grams.put(text, 1);
            return grams;
        }
        for (int i = 0; i < text.length() - 1; i++) {
            grams.merge(text.substring(i, i + 2), 1, Integer::sum);
        }
        return grams;
    }

    private static double magnitude(Map<String, Integer> vector) {
        double sum = 0;
        for (int value : vector.values()) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }
}
