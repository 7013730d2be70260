package com.docvalidator.core.model;

import java.util.Objects;

/**
 * A link opening {@code [text](} whose parentheses never balance on the same line.
 *
 * @param lineNumber 1-based line number
 * @param context the offending line, trimmed
 */
public record MalformedLink(
    int lineNumber,
    String context
) {
    public MalformedLink {
        Objects.requireNonNull(context, "context must not be null");
    }
}
