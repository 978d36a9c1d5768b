package com.studyflow.core.export;

import java.util.Map;

/**
 * Options for exporting a Table of Procedures.
 *
 * @param title study identifier used in titles and file names
 * @param customSettings exporter-specific settings (e.g. {@code html.report})
 */
public record ExportConfig(String title, Map<String, Object> customSettings) {

    public static final String DEFAULT_TITLE = "study";

    public ExportConfig {
        if (title == null || title.isBlank()) {
            title = DEFAULT_TITLE;
        }
        if (customSettings == null) {
            customSettings = Map.of();
        }
    }

    public static ExportConfig defaults() {
        return new ExportConfig(DEFAULT_TITLE, Map.of());
    }

    public static ExportConfig titled(String title) {
        return new ExportConfig(title, Map.of());
    }

    /**
     * Gets a custom setting with a default.
     *
     * @param key setting key
     * @param defaultValue value returned when the setting is absent
     * @param <T> expected type
     * @return setting value or default
     */
    @SuppressWarnings("unchecked")
    public <T> T getSettingOrDefault(String key, T defaultValue) {
        T value = (T) customSettings.get(key);
        return value != null ? value : defaultValue;
    }
}
