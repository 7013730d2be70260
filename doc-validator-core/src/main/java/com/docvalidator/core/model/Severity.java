package com.docvalidator.core.model;

import java.util.Locale;

/**
 * Severity level of a validation finding.
 *
 * <p>Only {@link #ERROR} fails a regular run. {@link #WARNING} fails a run in strict mode.
 * {@link #INFO} never affects the outcome.</p>
 *
 * @since 1.0.0
 */
public enum Severity {
    /**
     * Informational - no action required, just for awareness.
     */
    INFO,

    /**
     * Warning - potential issue that should be reviewed.
     */
    WARNING,

    /**
     * Error - the documentation is inconsistent.
     */
    ERROR;

    /**
     * Returns the lower-case name used in reports.
     *
     * @return report value, e.g. {@code "warning"}
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
