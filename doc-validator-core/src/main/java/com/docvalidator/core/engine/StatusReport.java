package com.docvalidator.core.engine;

import com.docvalidator.core.model.FileStatus;
import com.docvalidator.core.model.ValidationStatus;

import java.util.List;

/**
 * Per-file status projection of a {@link ValidationReport}, backing the {@code status} command.
 *
 * @param files status of each reported file
 * @param overallStatus {@code invalid} if any file is invalid, {@code not_validated} if none was
 *                      validated, otherwise {@code valid}
 * @param statistics corpus statistics
 */
public record StatusReport(
    List<FileStatus> files,
    ValidationStatus overallStatus,
    Statistics statistics
) {
    public StatusReport {
        files = files == null ? List.of() : List.copyOf(files);
    }

    /**
     * Corpus statistics of the last run.
     *
     * @param totalFiles number of reported files
     * @param totalTerms number of canonical terms in the index
     * @param totalReferences number of cross-references
     * @param brokenReferences number of invalid cross-references
     * @param linkEdges number of file-to-file link edges
     * @param orphanFiles files no other file links to
     * @param linkCycles number of link cycles
     */
    public record Statistics(
        int totalFiles,
        int totalTerms,
        int totalReferences,
        long brokenReferences,
        int linkEdges,
        List<String> orphanFiles,
        int linkCycles
    ) {
        public Statistics {
            orphanFiles = orphanFiles == null ? List.of() : List.copyOf(orphanFiles);
        }
    }

    public static StatusReport from(ValidationReport report) {
        List<FileStatus> files = report.fileStatuses();
        Statistics statistics = new Statistics(
            files.size(),
            report.termIndex().size(),
            report.references().size(),
            report.references().stream().filter(reference -> !reference.valid()).count(),
            report.graph().edgeCount(),
            report.graph().orphans(),
            report.graph().cycles().size()
        );
        return new StatusReport(files, overallStatus(files), statistics);
    }

    static ValidationStatus overallStatus(List<FileStatus> files) {
        if (files.stream().anyMatch(file -> file.status() == ValidationStatus.INVALID)) {
            return ValidationStatus.INVALID;
        }
        if (files.stream().allMatch(file -> file.status() == ValidationStatus.NOT_VALIDATED)) {
            return ValidationStatus.NOT_VALIDATED;
        }
        return ValidationStatus.VALID;
    }
}
