package com.docvalidator.core.rules.impl;

import com.docvalidator.core.model.DocumentationFile;
import com.docvalidator.core.model.MalformedLink;
import com.docvalidator.core.model.ValidationResult;
import com.docvalidator.core.rules.AbstractValidationRule;
import com.docvalidator.core.rules.RuleContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks document structure: a level-1 title must exist and every inline link must close
 * its parentheses. Unbalanced links are reported under {@value #SYNTAX_RULE}.
 */
public class MarkdownStructureRule extends AbstractValidationRule {

    public static final String RULE_NAME = "markdown_structure";
    public static final String SYNTAX_RULE = "markdown_syntax";

    @Override
    public String getId() {
        return RULE_NAME;
    }

    @Override
    public String getDisplayName() {
        return "Markdown Structure";
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public List<ValidationResult> check(DocumentationFile file, RuleContext context) {
        List<ValidationResult> results = new ArrayList<>();

        if (!file.hasTitle()) {
            results.add(escalated(context, file,
                "Document should start with a main title (# Title)",
                null,
                "Add a main title at the beginning of the document"));
        }

        for (MalformedLink link : file.malformedLinks()) {
            results.add(escalated(SYNTAX_RULE, context, file,
                "Unbalanced parentheses in link syntax: " + link.context(),
                link.lineNumber(),
                "Check that all markdown links are properly closed"));
        }
        return results;
    }
}
