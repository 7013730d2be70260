package com.docvalidator.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared regex patterns for the markdown subset the validator understands.
 *
 * <p>Patterns are compiled once at class loading time. Only headings, inline links and
 * bold-term definitions are recognized; everything else is plain text.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Matcher heading = MarkdownPatterns.HEADING.matcher("## Marker Levels");
 * String slug = MarkdownPatterns.slugify("Marker Levels"); // "marker-levels"
 * }</pre>
 *
 * @since 1.0.0
 */
public final class MarkdownPatterns {

    /** {@code # Title} up to {@code ###### Title}, optional closing hashes. */
    public static final Pattern HEADING =
        Pattern.compile("^(#{1,6})\\s+(.+?)(?:\\s+#+)?\\s*$");

    /** {@code **TERM** · definition}, also with {@code -} or {@code :} as separator. */
    public static final Pattern BOLD_DEFINITION =
        Pattern.compile("^\\*\\*(?<term>[^*]+?)\\*\\*\\s*[·\\-:]\\s*(?<definition>.+)$");

    /** Term part of a definition: a name with an optional parenthesised full name. */
    public static final Pattern TERM_WITH_FULL_NAME =
        Pattern.compile("^(?<name>[^()]+?)\\s*(?:\\((?<full>[^)]+)\\))?$");

    /** Alias declaration inside definition text: {@code (aka X, Y)}. */
    public static final Pattern AKA =
        Pattern.compile("\\(\\s*aka\\s+(?<aliases>[^)]+)\\)", Pattern.CASE_INSENSITIVE);

    /** Opening or closing line of a fenced code block. */
    public static final Pattern CODE_FENCE =
        Pattern.compile("^\\s{0,3}(?<fence>`{3,}|~{3,})");

    /** Upper-case identifier such as {@code MEMA} or {@code SEM_TRUST_LOW}. */
    public static final Pattern UPPER_CASE_TOKEN =
        Pattern.compile("(?<![\\p{L}\\p{Nd}_])[A-Z][A-Z0-9]*(?:_[A-Z0-9]+)*(?![\\p{L}\\p{Nd}_])");

    /** Inline code span: {@code `me analyze`}. */
    public static final Pattern INLINE_CODE =
        Pattern.compile("`(?<code>[^`]+)`");

    private static final Pattern SLUG_PUNCTUATION =
        Pattern.compile("[^\\p{L}\\p{Nd}_\\s-]");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private MarkdownPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Derives the anchor slug of a heading: lower-cased, punctuation stripped, whitespace
     * runs replaced by hyphens.
     *
     * @param headingText heading text
     * @return anchor slug
     */
    public static String slugify(String headingText) {
        String lower = headingText.strip().toLowerCase(Locale.ROOT);
        String stripped = SLUG_PUNCTUATION.matcher(lower).replaceAll("");
        return WHITESPACE.matcher(stripped.strip()).replaceAll("-");
    }

    /**
     * Collapses whitespace runs to single spaces and trims.
     *
     * @param text text to normalize
     * @return normalized text
     */
    public static String normalizeWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    /**
     * Splits an alias list such as {@code "X, Y"} into trimmed, non-empty names.
     *
     * @param aliasList comma-separated aliases
     * @return alias names in order
     */
    public static List<String> splitAliases(String aliasList) {
        List<String> aliases = new ArrayList<>();
        for (String alias : aliasList.split(",")) {
            String trimmed = alias.strip();
            if (!trimmed.isEmpty()) {
                aliases.add(trimmed);
            }
        }
        return aliases;
    }

    /**
     * Returns the fence marker if the line opens or closes a fenced code block.
     *
     * @param line source line
     * @return fence string such as {@code ```}, or {@code null}
     */
    public static String fenceOf(String line) {
        Matcher matcher = CODE_FENCE.matcher(line);
        return matcher.find() ? matcher.group("fence") : null;
    }
}
