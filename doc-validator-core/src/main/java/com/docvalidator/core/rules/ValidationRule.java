package com.docvalidator.core.rules;

import com.docvalidator.core.model.DocumentationFile;
import com.docvalidator.core.model.ValidationResult;

import java.util.List;

/**
 * Corpus-level content rule applied to every parsed file.
 *
 * <p>Rules are discovered via Java Service Provider Interface (SPI) and run in priority
 * order (lower numbers first, ties broken by id). A rule never throws for content problems;
 * it reports them as {@link ValidationResult}s.</p>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.docvalidator.core.rules.ValidationRule}
 *
 * @see RuleContext
 * @see AbstractValidationRule
 */
public interface ValidationRule {

    /**
     * Returns the rule name written into findings, e.g. {@code content_completeness}.
     *
     * @return unique rule identifier
     */
    String getId();

    /**
     * Returns human-readable name used in logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns execution priority; lower values run first.
     *
     * @return priority value
     */
    int getPriority();

    /**
     * Checks whether this rule concerns the given file. Defaults to every file.
     *
     * @param file parsed file
     * @param context run context
     * @return true if {@link #check(DocumentationFile, RuleContext)} should run
     */
    default boolean appliesTo(DocumentationFile file, RuleContext context) {
        return true;
    }

    /**
     * Checks one file.
     *
     * @param file parsed file
     * @param context run context
     * @return findings, empty when the file passes
     */
    List<ValidationResult> check(DocumentationFile file, RuleContext context);
}
