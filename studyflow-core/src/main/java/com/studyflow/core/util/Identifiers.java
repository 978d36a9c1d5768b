package com.studyflow.core.util;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds deterministic identifiers for visits and normalized merge keys.
 *
 * <p>Identifiers never embed random values, so regenerating a flow from the same input
 * yields the same ids and validation issue ids stay stable across runs.
 */
public final class Identifiers {

    private static final Pattern NON_SLUG = Pattern.compile("[^\\p{L}\\p{N}]+");

    private Identifiers() {
        // Utility class
    }

    /**
     * Converts a name to a lowercase underscore slug, e.g. {@code "End of Treatment"} to
     * {@code "end_of_treatment"}.
     *
     * @param name display name
     * @return slug, or {@code "item"} when nothing usable remains
     */
    public static String slug(String name) {
        if (name == null) {
            return "item";
        }
        String slug = NON_SLUG.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("_");
        slug = slug.replaceAll("^_+|_+$", "");
        return slug.isEmpty() ? "item" : slug;
    }

    /**
     * Returns the visit id for a name, e.g. {@code visit_week_4}.
     */
    public static String visitId(String name) {
        return "visit_" + slug(name);
    }

    /**
     * Returns the key used to merge entries that differ only by case or surrounding spaces.
     */
    public static String mergeKey(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns {@code baseId}, or {@code baseId_2}, {@code baseId_3}, ... when taken, and
     * records the returned id in {@code usedIds}.
     *
     * @param baseId preferred id
     * @param usedIds ids already in use, updated in place
     * @return unused id
     */
    public static String uniqueId(String baseId, Set<String> usedIds) {
        String id = baseId;
        int suffix = 2;
        while (!usedIds.add(id)) {
            id = baseId + "_" + suffix++;
        }
        return id;
    }
}
