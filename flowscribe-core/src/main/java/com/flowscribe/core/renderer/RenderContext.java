package com.flowscribe.core.renderer;

import java.util.Map;

/**
 * Destination settings for an {@link OutputRenderer}.
 *
 * @param outputDirectory target directory (ignored by console rendering)
 * @param settings renderer-specific settings such as {@code console.colors}
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Gets a setting with a default.
     *
     * @param key setting key
     * @param defaultValue value used when the key is absent
     * @return setting value or default
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
