package com.docvalidator.core.report.impl;

import com.docvalidator.core.crossref.CrossReferenceQuery;
import com.docvalidator.core.engine.StatusReport;
import com.docvalidator.core.engine.ValidationReport;
import com.docvalidator.core.model.CrossReference;
import com.docvalidator.core.model.FileStatus;
import com.docvalidator.core.model.ReferenceKind;
import com.docvalidator.core.model.Severity;
import com.docvalidator.core.model.ValidationResult;
import com.docvalidator.core.model.ValidationStatus;
import com.docvalidator.core.model.ValidationSummary;
import com.docvalidator.core.report.RenderContext;
import com.docvalidator.core.report.ReportRenderer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Human-readable terminal output with optional ANSI colour.
 *
 * <p>Findings are grouped by file and prefixed with {@code ✗} (error), {@code ⚠} (warning) or
 * {@code ℹ} (info). Colours are disabled with the {@link RenderContext#COLORS} setting.</p>
 */
public class TextReportRenderer implements ReportRenderer {

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_CYAN = "\u001B[36m";

    private static final String SEPARATOR = "=".repeat(50);
    private static final int CONTEXT_PREVIEW_LENGTH = 50;

    @Override
    public String getId() {
        return "text";
    }

    @Override
    public String renderValidation(ValidationReport report, RenderContext context) {
        boolean colors = context.useColors();
        StringBuilder out = new StringBuilder();
        out.append(color(ANSI_BOLD, "Validation Results (" + report.fileCount() + " files)", colors)).append('\n');
        out.append(SEPARATOR).append('\n');

        if (report.issues().isEmpty()) {
            out.append('\n').append(color(ANSI_GREEN, "✓ No issues found", colors)).append('\n');
        }

        for (Map.Entry<String, List<ValidationResult>> entry : groupByFile(report.issues()).entrySet()) {
            out.append('\n').append(color(ANSI_BOLD + ANSI_CYAN, context.displayPath(entry.getKey()), colors)).append('\n');
            for (ValidationResult issue : entry.getValue()) {
                out.append("  ")
                    .append(color(severityColor(issue.severity()), symbol(issue.severity()), colors))
                    .append(" [").append(issue.ruleName()).append("] ");
                if (issue.lineNumber() != null) {
                    out.append("Line ").append(issue.lineNumber()).append(": ");
                }
                out.append(issue.message()).append('\n');
                if (issue.hasSuggestion()) {
                    out.append("    Suggestion: ").append(issue.suggestion()).append('\n');
                }
            }
        }

        ValidationSummary summary = report.summary();
        out.append('\n').append(color(ANSI_BOLD, "Validation Summary:", colors)).append('\n');
        out.append("  Files:    ").append(report.fileCount()).append('\n');
        out.append("  Errors:   ").append(summary.errors()).append('\n');
        out.append("  Warnings: ").append(summary.warnings()).append('\n');
        out.append("  Info:     ").append(summary.info()).append('\n');
        if (report.strict()) {
            out.append("  Mode:     strict").append('\n');
        }
        out.append('\n');
        out.append(report.success()
            ? color(ANSI_BOLD + ANSI_GREEN, "Status: PASS", colors)
            : color(ANSI_BOLD + ANSI_RED, "Status: FAIL", colors)).append('\n');
        return out.toString();
    }

    @Override
    public String renderCrossReferences(ValidationReport report, CrossReferenceQuery query, RenderContext context) {
        boolean colors = context.useColors();
        List<CrossReference> references = query.apply(report.references());
        StringBuilder out = new StringBuilder();
        out.append(color(ANSI_BOLD, "Cross-References", colors)).append('\n');
        out.append(SEPARATOR).append('\n');
        out.append("Terms defined: ").append(report.termIndex().size()).append('\n');
        out.append("References:    ").append(references.size()).append('\n');
        if (query.term() != null) {
            out.append("Term filter:   ").append(query.term()).append('\n');
        }
        if (query.file() != null) {
            out.append("File filter:   ").append(query.file()).append('\n');
        }

        if (references.isEmpty()) {
            out.append('\n').append("No references found").append('\n');
            return out.toString();
        }

        List<CrossReference> brokenLinks = new ArrayList<>();
        String currentFile = null;
        for (CrossReference reference : references) {
            if (!reference.sourceFile().equals(currentFile)) {
                currentFile = reference.sourceFile();
                out.append('\n').append(color(ANSI_BOLD + ANSI_CYAN, context.displayPath(currentFile), colors)).append('\n');
            }
            String mark = reference.valid()
                ? color(ANSI_GREEN, "✓", colors)
                : color(ANSI_RED, "✗", colors);
            out.append("  ").append(mark)
                .append(" Line ").append(reference.lineNumber())
                .append(" [").append(reference.kind().value()).append("] ")
                .append(reference.target());
            if (reference.valid() && reference.kind() != ReferenceKind.LINK
                && reference.resolvedTo() != null && !reference.resolvedTo().equals(reference.target())) {
                out.append(" -> ").append(reference.resolvedTo());
            }
            out.append('\n');
            out.append("      ").append(reference.contextPreview(CONTEXT_PREVIEW_LENGTH)).append('\n');
            if (reference.kind() == ReferenceKind.LINK && !reference.valid()) {
                brokenLinks.add(reference);
            }
        }

        if (!brokenLinks.isEmpty()) {
            out.append('\n').append(color(ANSI_BOLD + ANSI_RED, "Broken Links (" + brokenLinks.size() + "):", colors)).append('\n');
            for (CrossReference link : brokenLinks) {
                out.append("  ✗ ").append(context.displayPath(link.sourceFile()))
                    .append(':').append(link.lineNumber())
                    .append(" -> ").append(link.target()).append('\n');
            }
        }
        return out.toString();
    }

    @Override
    public String renderStatus(StatusReport status, RenderContext context) {
        boolean colors = context.useColors();
        StringBuilder out = new StringBuilder();
        out.append(color(ANSI_BOLD, "Documentation Status: ", colors))
            .append(color(statusColor(status.overallStatus()), status.overallStatus().value().toUpperCase(Locale.ROOT), colors))
            .append('\n');
        out.append(SEPARATOR).append('\n');

        for (FileStatus file : status.files()) {
            out.append("  ")
                .append(color(statusColor(file.status()), statusSymbol(file.status()), colors))
                .append(' ').append(context.displayPath(file.path()))
                .append("  ").append(file.status().value())
                .append(" (").append(file.errors()).append(" errors, ")
                .append(file.warnings()).append(" warnings)").append('\n');
            out.append("      Last modified: ").append(timestamp(file.lastModified()))
                .append("  Last validated: ").append(timestamp(file.lastValidated())).append('\n');
        }

        StatusReport.Statistics statistics = status.statistics();
        out.append('\n').append(color(ANSI_BOLD, "Statistics:", colors)).append('\n');
        out.append("  Files:             ").append(statistics.totalFiles()).append('\n');
        out.append("  Terms:             ").append(statistics.totalTerms()).append('\n');
        out.append("  References:        ").append(statistics.totalReferences()).append('\n');
        out.append("  Broken references: ").append(statistics.brokenReferences()).append('\n');
        out.append("  Link edges:        ").append(statistics.linkEdges()).append('\n');
        out.append("  Link cycles:       ").append(statistics.linkCycles()).append('\n');
        if (!statistics.orphanFiles().isEmpty()) {
            out.append("  Orphan files:").append('\n');
            statistics.orphanFiles().forEach(path -> out.append("    - ").append(context.displayPath(path)).append('\n'));
        }
        return out.toString();
    }

    private static Map<String, List<ValidationResult>> groupByFile(List<ValidationResult> issues) {
        Map<String, List<ValidationResult>> grouped = new LinkedHashMap<>();
        for (ValidationResult issue : issues) {
            grouped.computeIfAbsent(issue.filePath(), key -> new ArrayList<>()).add(issue);
        }
        return grouped;
    }

    private static String symbol(Severity severity) {
        return switch (severity) {
            case ERROR -> "✗";
            case WARNING -> "⚠";
            case INFO -> "ℹ";
        };
    }

    private static String severityColor(Severity severity) {
        return switch (severity) {
            case ERROR -> ANSI_RED;
            case WARNING -> ANSI_YELLOW;
            case INFO -> ANSI_CYAN;
        };
    }

    private static String statusSymbol(ValidationStatus status) {
        return switch (status) {
            case VALID -> "✓";
            case INVALID -> "✗";
            case NOT_VALIDATED -> "-";
        };
    }

    private static String statusColor(ValidationStatus status) {
        return switch (status) {
            case VALID -> ANSI_GREEN;
            case INVALID -> ANSI_RED;
            case NOT_VALIDATED -> ANSI_YELLOW;
        };
    }

    private static String timestamp(Instant instant) {
        return instant == null ? "never" : instant.toString();
    }

    private static String color(String ansi, String text, boolean enabled) {
        return enabled ? ansi + text + ANSI_RESET : text;
    }
}
