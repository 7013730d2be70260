package com.docvalidator.core.model;

import java.util.Collection;

/**
 * Finding counts per severity.
 *
 * @param errors number of ERROR findings
 * @param warnings number of WARNING findings
 * @param info number of INFO findings
 */
public record ValidationSummary(
    int errors,
    int warnings,
    int info
) {
    /**
     * Counts the findings of a result list.
     *
     * @param results findings
     * @return summary
     */
    public static ValidationSummary of(Collection<ValidationResult> results) {
        int errors = 0;
        int warnings = 0;
        int info = 0;
        for (ValidationResult result : results) {
            switch (result.severity()) {
                case ERROR -> errors++;
                case WARNING -> warnings++;
                case INFO -> info++;
            }
        }
        return new ValidationSummary(errors, warnings, info);
    }

    public int total() {
        return errors + warnings + info;
    }

    /**
     * Applies the run outcome policy: errors always fail, warnings fail in strict mode.
     *
     * @param strict whether strict mode is active
     * @return true if the run passes
     */
    public boolean isSuccess(boolean strict) {
        if (errors > 0) {
            return false;
        }
        return !strict || warnings == 0;
    }
}
