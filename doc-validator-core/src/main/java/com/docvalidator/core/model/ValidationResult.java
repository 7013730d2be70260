package com.docvalidator.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single validation finding.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * ValidationResult result = ValidationResult.warning(
 *     "docs/terminologie.md",
 *     "terminology_completeness",
 *     "Missing key marker terms: CLU, MEMA",
 *     null,
 *     "Add definitions for all marker levels (ATO, SEM, CLU, MEMA)"
 * );
 * }</pre>
 *
 * @param filePath path of the affected file
 * @param ruleName rule that produced the finding, e.g. {@code cross_reference}
 * @param severity finding severity
 * @param lineNumber 1-based line number, or {@code null} for file-level findings
 * @param message human-readable message (never blank)
 * @param suggestion suggested fix, or {@code null}
 * @param validatedAt creation time
 */
public record ValidationResult(
    String filePath,
    String ruleName,
    Severity severity,
    Integer lineNumber,
    String message,
    String suggestion,
    Instant validatedAt
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationResult {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(ruleName, "ruleName must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (message.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        if (suggestion != null && suggestion.isBlank()) {
            throw new IllegalArgumentException("suggestion must not be blank when present");
        }
        if (validatedAt == null) {
            validatedAt = Instant.now();
        }
    }

    public static ValidationResult of(Severity severity, String filePath, String ruleName, String message,
                                      Integer lineNumber, String suggestion) {
        return new ValidationResult(filePath, ruleName, severity, lineNumber, message, suggestion, Instant.now());
    }

    public static ValidationResult error(String filePath, String ruleName, String message,
                                         Integer lineNumber, String suggestion) {
        return of(Severity.ERROR, filePath, ruleName, message, lineNumber, suggestion);
    }

    public static ValidationResult warning(String filePath, String ruleName, String message,
                                           Integer lineNumber, String suggestion) {
        return of(Severity.WARNING, filePath, ruleName, message, lineNumber, suggestion);
    }

    public static ValidationResult info(String filePath, String ruleName, String message, Integer lineNumber) {
        return of(Severity.INFO, filePath, ruleName, message, lineNumber, null);
    }

    public boolean hasSuggestion() {
        return suggestion != null;
    }
}
