package com.docvalidator.core.terminology;

import com.docvalidator.core.model.ValidationResult;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of the terminology pass.
 *
 * @param index resulting term index
 * @param findings notices raised while building the index (redefinitions)
 * @param termsByFile canonical terms defined per terminology file path, in definition order
 */
public record TerminologyExtraction(
    TermIndex index,
    List<ValidationResult> findings,
    Map<String, List<String>> termsByFile
) {
    public TerminologyExtraction {
        Objects.requireNonNull(index, "index must not be null");
        findings = findings == null ? List.of() : List.copyOf(findings);
        termsByFile = termsByFile == null ? Map.of() : Map.copyOf(termsByFile);
    }

    public List<String> termsDefinedIn(String filePath) {
        return termsByFile.getOrDefault(filePath, List.of());
    }
}
