package com.docvalidator.core.model;

import java.util.Locale;

/**
 * Category assigned to a terminology entry.
 */
public enum TermCategory {
    /** One of the required marker levels (ATO, SEM, CLU, MEMA by default). */
    MARKER_LEVEL,
    /** A command of the command-line tool described by the corpus. */
    CLI_COMMAND,
    /** Any other defined term. */
    GENERAL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
