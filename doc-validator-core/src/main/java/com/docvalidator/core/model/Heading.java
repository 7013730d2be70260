package com.docvalidator.core.model;

import java.util.Objects;

/**
 * A markdown heading ({@code # Title} to {@code ###### Title}).
 *
 * @param level heading level, 1 to 6
 * @param text heading text without the leading hashes
 * @param slug anchor slug derived from the text
 * @param lineNumber 1-based line number
 */
public record Heading(
    int level,
    String text,
    String slug,
    int lineNumber
) {
    /**
     * Compact constructor with validation.
     */
    public Heading {
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("level must be between 1 and 6, got " + level);
        }
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(slug, "slug must not be null");
    }
}
