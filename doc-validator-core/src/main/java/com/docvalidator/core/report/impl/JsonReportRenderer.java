package com.docvalidator.core.report.impl;

import com.docvalidator.core.crossref.CrossReferenceQuery;
import com.docvalidator.core.engine.StatusReport;
import com.docvalidator.core.engine.ValidationReport;
import com.docvalidator.core.model.CrossReference;
import com.docvalidator.core.model.FileStatus;
import com.docvalidator.core.model.MarkdownLink;
import com.docvalidator.core.model.ReferenceKind;
import com.docvalidator.core.model.ValidationResult;
import com.docvalidator.core.model.ValidationSummary;
import com.docvalidator.core.report.RenderContext;
import com.docvalidator.core.report.ReportRenderer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.List;

/**
 * Renders reports as pretty-printed JSON with snake_case field names.
 *
 * <p>Validation output carries {@code success}, {@code file_count}, {@code issues[]} and
 * {@code summary}; timestamps are ISO-8601 strings and absent values are {@code null}.</p>
 */
public class JsonReportRenderer implements ReportRenderer {

    static final int CONTEXT_PREVIEW_LENGTH = 50;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String renderValidation(ValidationReport report, RenderContext context) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("success", report.success());
        root.put("strict", report.strict());
        root.put("file_count", report.fileCount());

        ArrayNode issues = root.putArray("issues");
        for (ValidationResult issue : report.issues()) {
            ObjectNode node = issues.addObject();
            node.put("file_path", context.displayPath(issue.filePath()));
            node.put("rule_name", issue.ruleName());
            node.put("severity", issue.severity().value());
            node.put("line_number", issue.lineNumber());
            node.put("message", issue.message());
            node.put("suggestion", issue.suggestion());
            node.put("validated_at", timestamp(issue.validatedAt()));
        }

        ValidationSummary summary = report.summary();
        ObjectNode summaryNode = root.putObject("summary");
        summaryNode.put("errors", summary.errors());
        summaryNode.put("warnings", summary.warnings());
        summaryNode.put("info", summary.info());
        return write(root);
    }

    @Override
    public String renderCrossReferences(ValidationReport report, CrossReferenceQuery query, RenderContext context) {
        List<CrossReference> references = query.apply(report.references());

        ObjectNode root = objectMapper.createObjectNode();
        root.put("term_count", report.termIndex().size());
        root.put("reference_count", references.size());

        ArrayNode referenceArray = root.putArray("references");
        ArrayNode brokenLinks = objectMapper.createArrayNode();
        for (CrossReference reference : references) {
            ObjectNode node = referenceArray.addObject();
            node.put("term", reference.target());
            node.put("file", context.displayPath(reference.sourceFile()));
            node.put("line", reference.lineNumber());
            node.put("context", reference.contextPreview(CONTEXT_PREVIEW_LENGTH));
            node.put("valid", reference.valid());
            node.put("reference_type", reference.kind().value());
            node.put("resolved_to", reference.kind() == ReferenceKind.LINK
                ? context.displayPath(reference.resolvedTo())
                : reference.resolvedTo());

            if (reference.kind() == ReferenceKind.LINK && !reference.valid()) {
                ObjectNode broken = brokenLinks.addObject();
                broken.put("file", context.displayPath(reference.sourceFile()));
                broken.put("line", reference.lineNumber());
                broken.put("link", reference.target());
                broken.put("target", MarkdownLink.of("", reference.target(), reference.lineNumber()).filePart());
            }
        }
        root.set("broken_links", brokenLinks);
        return write(root);
    }

    @Override
    public String renderStatus(StatusReport status, RenderContext context) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("overall_status", status.overallStatus().value());

        ArrayNode files = root.putArray("files");
        for (FileStatus file : status.files()) {
            ObjectNode node = files.addObject();
            node.put("path", context.displayPath(file.path()));
            node.put("name", file.name());
            node.put("status", file.status().value());
            node.put("last_modified", timestamp(file.lastModified()));
            node.put("last_validated", timestamp(file.lastValidated()));
            node.put("issue_count", file.errors() + file.warnings());
            node.put("errors", file.errors());
            node.put("warnings", file.warnings());
        }

        StatusReport.Statistics statistics = status.statistics();
        ObjectNode statisticsNode = root.putObject("statistics");
        statisticsNode.put("total_files", statistics.totalFiles());
        statisticsNode.put("total_terms", statistics.totalTerms());
        statisticsNode.put("total_references", statistics.totalReferences());
        statisticsNode.put("broken_references", statistics.brokenReferences());
        statisticsNode.put("link_edges", statistics.linkEdges());
        statisticsNode.put("link_cycles", statistics.linkCycles());
        ArrayNode orphans = statisticsNode.putArray("orphan_files");
        statistics.orphanFiles().forEach(path -> orphans.add(context.displayPath(path)));
        return write(root);
    }

    private static String timestamp(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report", e);
        }
    }
}
