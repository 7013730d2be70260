package com.docvalidator.core.engine;

import com.docvalidator.core.crossref.DocumentGraph;
import com.docvalidator.core.model.CrossReference;
import com.docvalidator.core.model.DocumentationFile;
import com.docvalidator.core.model.FileStatus;
import com.docvalidator.core.model.ReferenceKind;
import com.docvalidator.core.model.ValidationResult;
import com.docvalidator.core.model.ValidationSummary;
import com.docvalidator.core.terminology.TermIndex;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Complete outcome of one {@link ValidationEngine} run.
 *
 * @param success false if any ERROR exists, or if strict and any WARNING exists
 * @param strict whether the run was strict
 * @param fileStatuses per-file outcome of every reported file, parse failures included
 * @param documents parsed documents carrying their post-run status
 * @param issues findings sorted by file, line and rule
 * @param references all cross-references sorted by source file and line
 * @param termIndex term index built during the run
 * @param graph file-to-file link graph
 * @param summary counts per severity
 * @param completedAt end of the run
 */
public record ValidationReport(
    boolean success,
    boolean strict,
    List<FileStatus> fileStatuses,
    List<DocumentationFile> documents,
    List<ValidationResult> issues,
    List<CrossReference> references,
    TermIndex termIndex,
    DocumentGraph graph,
    ValidationSummary summary,
    Instant completedAt
) {
    public ValidationReport {
        fileStatuses = fileStatuses == null ? List.of() : List.copyOf(fileStatuses);
        documents = documents == null ? List.of() : List.copyOf(documents);
        issues = issues == null ? List.of() : List.copyOf(issues);
        references = references == null ? List.of() : List.copyOf(references);
        Objects.requireNonNull(termIndex, "termIndex must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(completedAt, "completedAt must not be null");
    }

    public int fileCount() {
        return fileStatuses.size();
    }

    public List<ValidationResult> issuesFor(String filePath) {
        return issues.stream().filter(issue -> issue.filePath().equals(filePath)).toList();
    }

    public List<CrossReference> brokenLinks() {
        return references.stream()
            .filter(reference -> reference.kind() == ReferenceKind.LINK && !reference.valid())
            .toList();
    }
}
