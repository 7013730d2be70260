package com.docvalidator.core.model;

import java.util.Objects;

/**
 * One observed link, term usage or term definition.
 *
 * @param target referenced term or raw link target
 * @param sourceFile path of the file the reference appears in
 * @param lineNumber 1-based line number
 * @param context trimmed source line
 * @param kind reference kind
 * @param valid whether the reference resolved
 * @param resolvedTo canonical term or resolved file path, {@code null} when unresolved
 */
public record CrossReference(
    String target,
    String sourceFile,
    int lineNumber,
    String context,
    ReferenceKind kind,
    boolean valid,
    String resolvedTo
) {
    /**
     * Compact constructor with validation.
     */
    public CrossReference {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(sourceFile, "sourceFile must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be 1-based, got " + lineNumber);
        }
        if (context == null) {
            context = "";
        }
    }

    public static CrossReference link(String target, String sourceFile, int lineNumber, String context,
                                      boolean valid, String resolvedFile) {
        return new CrossReference(target, sourceFile, lineNumber, context, ReferenceKind.LINK, valid, resolvedFile);
    }

    public static CrossReference termUsage(String token, String sourceFile, int lineNumber, String context,
                                           String canonicalTerm) {
        return new CrossReference(token, sourceFile, lineNumber, context, ReferenceKind.TERM_USAGE,
            canonicalTerm != null, canonicalTerm);
    }

    public static CrossReference definition(String term, String sourceFile, int lineNumber, String context) {
        return new CrossReference(term, sourceFile, lineNumber, context, ReferenceKind.DEFINITION, true, term);
    }

    /**
     * Returns the context shortened to {@code maxLength} characters, cut on a word
     * boundary when one lies reasonably close to the limit.
     *
     * @param maxLength maximum number of characters before the ellipsis
     * @return preview text
     */
    public String contextPreview(int maxLength) {
        if (context.length() <= maxLength) {
            return context;
        }
        String truncated = context.substring(0, maxLength);
        int lastSpace = truncated.lastIndexOf(' ');
        if (lastSpace > maxLength * 0.7) {
            return truncated.substring(0, lastSpace) + "...";
        }
        return truncated + "...";
    }
}
