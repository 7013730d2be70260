package com.docvalidator.core.model;

import java.util.Locale;

/**
 * Validation state of a documentation file.
 */
public enum ValidationStatus {
    NOT_VALIDATED,
    VALID,
    INVALID;

    /**
     * Returns the lower-case name used in reports.
     *
     * @return report value, e.g. {@code "not_validated"}
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
