package com.docvalidator.core.model;

import java.util.Objects;

/**
 * An inline markdown link {@code [text](target)}.
 *
 * <p>The target is split into a file part and an optional {@code #section} anchor.
 * A target consisting only of an anchor has an empty file part and refers to the
 * file the link appears in.</p>
 *
 * @param text link text
 * @param target raw target as written
 * @param filePart target without the anchor (may be empty)
 * @param anchor anchor without the leading {@code #}, or {@code null}
 * @param lineNumber 1-based line number
 */
public record MarkdownLink(
    String text,
    String target,
    String filePart,
    String anchor,
    int lineNumber
) {
    /**
     * Compact constructor with validation.
     */
    public MarkdownLink {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(filePart, "filePart must not be null");
    }

    /**
     * Splits a raw target into file part and anchor.
     *
     * @param text link text
     * @param target raw target
     * @param lineNumber 1-based line number
     * @return parsed link
     */
    public static MarkdownLink of(String text, String target, int lineNumber) {
        String trimmed = target.trim();
        int hash = trimmed.indexOf('#');
        if (hash < 0) {
            return new MarkdownLink(text, trimmed, trimmed, null, lineNumber);
        }
        String anchor = trimmed.substring(hash + 1);
        return new MarkdownLink(text, trimmed, trimmed.substring(0, hash), anchor.isEmpty() ? null : anchor, lineNumber);
    }

    public boolean hasAnchor() {
        return anchor != null;
    }

    /**
     * Returns true if the link points into the same file ({@code [x](#section)}).
     *
     * @return true for anchor-only links
     */
    public boolean isSelfReference() {
        return filePart.isEmpty();
    }

    /**
     * Returns true if the link leaves the corpus (URL scheme or mail address).
     *
     * @return true for external links
     */
    public boolean isExternal() {
        return filePart.contains("://") || filePart.startsWith("mailto:") || filePart.startsWith("tel:");
    }
}
