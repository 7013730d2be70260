package com.docvalidator.core.rules;

import com.docvalidator.core.config.ValidationConfig;
import com.docvalidator.core.model.DocumentationFile;
import com.docvalidator.core.terminology.TerminologyExtraction;

import java.util.List;
import java.util.Objects;

/**
 * Context handed to every {@link ValidationRule} during one validation run.
 *
 * @param config active configuration
 * @param strict whether structural and completeness issues are escalated to ERROR
 * @param corpus all successfully parsed files, in corpus order
 * @param terminology result of the terminology pass
 */
public record RuleContext(
    ValidationConfig config,
    boolean strict,
    List<DocumentationFile> corpus,
    TerminologyExtraction terminology
) {
    public RuleContext {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(terminology, "terminology must not be null");
        corpus = corpus == null ? List.of() : List.copyOf(corpus);
    }
}
