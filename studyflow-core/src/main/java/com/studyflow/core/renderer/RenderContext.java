package com.studyflow.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Destination and renderer settings for one rendering pass.
 *
 * @param outputDirectory target directory path
 * @param settings renderer-specific settings (e.g. {@code console.colors})
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public String getSetting(String key) {
        return settings.get(key);
    }

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }

    public boolean getBooleanSetting(String key, boolean defaultValue) {
        String value = settings.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }
}
