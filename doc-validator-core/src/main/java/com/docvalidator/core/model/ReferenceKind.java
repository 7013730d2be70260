package com.docvalidator.core.model;

import java.util.Locale;

/**
 * Kind of an observed cross-reference.
 */
public enum ReferenceKind {
    /** Inline markdown link {@code [text](target)}. */
    LINK,
    /** Occurrence of a defined term (or alias) in running text. */
    TERM_USAGE,
    /** Bold-term definition line. */
    DEFINITION;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
