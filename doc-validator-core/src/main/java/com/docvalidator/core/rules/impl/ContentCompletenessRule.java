package com.docvalidator.core.rules.impl;

import com.docvalidator.core.model.DocumentationFile;
import com.docvalidator.core.model.ValidationResult;
import com.docvalidator.core.rules.AbstractValidationRule;
import com.docvalidator.core.rules.RuleContext;

import java.util.List;

/**
 * Flags documents whose trimmed content is shorter than {@code minContentLength} characters.
 */
public class ContentCompletenessRule extends AbstractValidationRule {

    public static final String RULE_NAME = "content_completeness";

    @Override
    public String getId() {
        return RULE_NAME;
    }

    @Override
    public String getDisplayName() {
        return "Content Completeness";
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    public List<ValidationResult> check(DocumentationFile file, RuleContext context) {
        int length = file.content().strip().length();
        int minimum = context.config().minContentLength();
        if (length >= minimum) {
            return List.of();
        }
        return List.of(escalated(context, file,
            "Document appears to be very short or empty (" + length
                + " characters, minimum length is " + minimum + ")",
            null,
            "Add meaningful content to the document"));
    }
}
