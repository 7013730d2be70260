package com.docvalidator.core.rules.impl;

import com.docvalidator.core.model.DocumentationFile;
import com.docvalidator.core.model.ValidationResult;
import com.docvalidator.core.rules.AbstractValidationRule;
import com.docvalidator.core.rules.RuleContext;

import java.util.List;
import java.util.Locale;

/**
 * Requires the pipeline specification file to mention the compliance keyword
 * ({@code LD-3.4} by default, matched case-insensitively).
 */
public class ComplianceKeywordRule extends AbstractValidationRule {

    public static final String RULE_NAME = "ld_compliance";

    @Override
    public String getId() {
        return RULE_NAME;
    }

    @Override
    public String getDisplayName() {
        return "Specification Compliance";
    }

    @Override
    public int getPriority() {
        return 40;
    }

    @Override
    public boolean appliesTo(DocumentationFile file, RuleContext context) {
        return context.config().isComplianceFile(file.name());
    }

    @Override
    public List<ValidationResult> check(DocumentationFile file, RuleContext context) {
        String keyword = context.config().complianceKeyword();
        if (file.content().toLowerCase(Locale.ROOT).contains(keyword.toLowerCase(Locale.ROOT))) {
            return List.of();
        }
        return List.of(escalated(context, file,
            "No mention of " + keyword + " specification found",
            null,
            "Reference the " + keyword + " specification for marker compliance"));
    }
}
