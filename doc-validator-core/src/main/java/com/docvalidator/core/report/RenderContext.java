package com.docvalidator.core.report;

import java.nio.file.Path;
import java.util.Map;

/**
 * Context provided to renderers.
 *
 * @param baseDirectory directory that displayed paths are made relative to, or {@code null}
 * @param settings renderer-specific settings
 */
public record RenderContext(
    Path baseDirectory,
    Map<String, String> settings
) {
    /** Enables ANSI colours in text output ({@code "true"}/{@code "false"}, default {@code "true"}). */
    public static final String COLORS = "text.colors";

    public RenderContext {
        baseDirectory = baseDirectory == null ? null : baseDirectory.toAbsolutePath().normalize();
        if (settings == null) {
            settings = Map.of();
        }
    }

    public static RenderContext plain() {
        return new RenderContext(null, Map.of(COLORS, "false"));
    }

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }

    public boolean useColors() {
        return Boolean.parseBoolean(getSettingOrDefault(COLORS, "true"));
    }

    /**
     * Returns the path relative to the base directory when it lies below it, otherwise unchanged.
     *
     * @param path absolute path as stored in findings and references
     * @return display path using forward slashes
     */
    public String displayPath(String path) {
        if (path == null || baseDirectory == null) {
            return path;
        }
        Path candidate = Path.of(path);
        if (!candidate.isAbsolute() || !candidate.startsWith(baseDirectory)) {
            return path;
        }
        return baseDirectory.relativize(candidate).toString().replace('\\', '/');
    }
}
