package com.docvalidator.core.rules;

import com.docvalidator.core.model.DocumentationFile;
import com.docvalidator.core.model.Severity;
import com.docvalidator.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for rules with a per-class logger and strict-mode escalation.
 *
 * <p>Structural and completeness issues are WARNINGs that become ERRORs in strict mode;
 * {@link #escalated(RuleContext, DocumentationFile, String, Integer, String)} builds them.</p>
 */
public abstract class AbstractValidationRule implements ValidationRule {

    /**
     * Logger instance for this rule.
     */
    protected final Logger log;

    protected AbstractValidationRule() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Creates a finding under this rule's id, WARNING normally and ERROR in strict mode.
     */
    protected ValidationResult escalated(RuleContext context, DocumentationFile file, String message,
                                         Integer lineNumber, String suggestion) {
        return escalated(getId(), context, file, message, lineNumber, suggestion);
    }

    protected ValidationResult escalated(String ruleName, RuleContext context, DocumentationFile file,
                                         String message, Integer lineNumber, String suggestion) {
        Severity severity = context.strict() ? Severity.ERROR : Severity.WARNING;
        log.debug("{} in {}: {}", ruleName, file.fileName(), message);
        return ValidationResult.of(severity, file.path().toString(), ruleName, message, lineNumber, suggestion);
    }
}
