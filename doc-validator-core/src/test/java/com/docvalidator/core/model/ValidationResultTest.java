package com.docvalidator.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ValidationResult} and {@link ValidationSummary}.
 */
class ValidationResultTest {

    @Test
    void factories_setSeverityAndTimestamp() {
        ValidationResult error = ValidationResult.error("a.md", "cross_reference", "Broken link", 3, "Fix it");
        ValidationResult info = ValidationResult.info("a.md", "undefined_term", "Possibly undefined term FOO", 1);

        assertThat(error.severity()).isEqualTo(Severity.ERROR);
        assertThat(error.hasSuggestion()).isTrue();
        assertThat(error.validatedAt()).isNotNull();
        assertThat(info.severity()).isEqualTo(Severity.INFO);
        assertThat(info.hasSuggestion()).isFalse();
    }

    @Test
    void constructor_blankMessage_throws() {
        assertThatThrownBy(() -> ValidationResult.warning("a.md", "rule", "  ", null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("message");
    }

    @Test
    void constructor_blankSuggestion_throws() {
        assertThatThrownBy(() -> ValidationResult.warning("a.md", "rule", "message", null, ""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("suggestion");
    }

    @Test
    void constructor_missingTimestamp_defaultsToNow() {
        ValidationResult result = new ValidationResult("a.md", "rule", Severity.INFO, null, "note", null, null);

        assertThat(result.validatedAt()).isNotNull();
    }

    @Test
    void summary_countsPerSeverity() {
        ValidationSummary summary = ValidationSummary.of(List.of(
            ValidationResult.error("a.md", "r", "e", null, null),
            ValidationResult.warning("a.md", "r", "w", null, null),
            ValidationResult.warning("b.md", "r", "w", null, null),
            ValidationResult.info("b.md", "r", "i", null)
        ));

        assertThat(summary).isEqualTo(new ValidationSummary(1, 2, 1));
        assertThat(summary.total()).isEqualTo(4);
    }

    @Test
    void summary_successPolicy() {
        ValidationSummary warningsOnly = new ValidationSummary(0, 1, 5);
        ValidationSummary withError = new ValidationSummary(1, 0, 0);
        ValidationSummary infoOnly = new ValidationSummary(0, 0, 3);

        assertThat(warningsOnly.isSuccess(false)).isTrue();
        assertThat(warningsOnly.isSuccess(true)).isFalse();
        assertThat(withError.isSuccess(false)).isFalse();
        assertThat(infoOnly.isSuccess(true)).isTrue();
    }
}
