package com.docvalidator.core.crossref;

import com.docvalidator.core.model.CrossReference;
import com.docvalidator.core.model.ReferenceKind;
import com.docvalidator.core.model.ValidationResult;

import java.util.List;
import java.util.Objects;

/**
 * Output of one cross-reference pass.
 *
 * @param references all references sorted by source file and line
 * @param findings broken-link and undefined-term findings
 * @param graph resolved file-to-file link graph
 */
public record CrossReferenceReport(
    List<CrossReference> references,
    List<ValidationResult> findings,
    DocumentGraph graph
) {
    public CrossReferenceReport {
        references = references == null ? List.of() : List.copyOf(references);
        findings = findings == null ? List.of() : List.copyOf(findings);
        Objects.requireNonNull(graph, "graph must not be null");
    }

    public List<CrossReference> brokenLinks() {
        return references.stream()
            .filter(reference -> reference.kind() == ReferenceKind.LINK && !reference.valid())
            .toList();
    }

    public long brokenReferenceCount() {
        return references.stream().filter(reference -> !reference.valid()).count();
    }
}
