package com.docvalidator.core.rules.impl;

import com.docvalidator.core.model.DocumentationFile;
import com.docvalidator.core.model.ValidationResult;
import com.docvalidator.core.rules.AbstractValidationRule;
import com.docvalidator.core.rules.RuleContext;
import com.docvalidator.core.terminology.TermIndex;

import java.util.List;

/**
 * Requires the terminology files to define all configured required terms between them.
 *
 * <p>A term counts as defined when any terminology file names it canonically or through an
 * alias. Missing terms are reported once, on the first terminology file in corpus order.</p>
 */
public class TerminologyCompletenessRule extends AbstractValidationRule {

    public static final String RULE_NAME = "terminology_completeness";

    @Override
    public String getId() {
        return RULE_NAME;
    }

    @Override
    public String getDisplayName() {
        return "Terminology Completeness";
    }

    @Override
    public int getPriority() {
        return 30;
    }

    @Override
    public boolean appliesTo(DocumentationFile file, RuleContext context) {
        if (!context.config().isTerminologyFile(file.name())) {
            return false;
        }
        return context.corpus().stream()
            .filter(candidate -> context.config().isTerminologyFile(candidate.name()))
            .findFirst()
            .map(first -> first.path().equals(file.path()))
            .orElse(true);
    }

    @Override
    public List<ValidationResult> check(DocumentationFile file, RuleContext context) {
        TermIndex index = context.terminology().index();
        List<String> required = context.config().requiredTerms();
        List<String> missing = required.stream()
            .filter(term -> !index.contains(term))
            .toList();
        if (missing.isEmpty()) {
            return List.of();
        }

        return List.of(escalated(context, file,
            "Missing key marker terms: " + String.join(", ", missing),
            null,
            "Add definitions for all marker levels (" + String.join(", ", required) + ")"));
    }
}
