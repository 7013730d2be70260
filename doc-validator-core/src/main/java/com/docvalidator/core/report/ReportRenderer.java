package com.docvalidator.core.report;

import com.docvalidator.core.crossref.CrossReferenceQuery;
import com.docvalidator.core.engine.StatusReport;
import com.docvalidator.core.engine.ValidationReport;

/**
 * Formats validation results for one output format.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI) and selected by
 * {@link #getId()}, e.g. {@code --format json}. They return the complete document as a string
 * and never write to the console themselves.</p>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.docvalidator.core.report.ReportRenderer}
 *
 * @see ReportRenderers
 */
public interface ReportRenderer {

    /**
     * Returns the format name, lowercase (e.g. "text", "json").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the findings of a validation run.
     *
     * @param report validation report
     * @param context render context
     * @return rendered document
     */
    String renderValidation(ValidationReport report, RenderContext context);

    /**
     * Renders the cross-references of a run, filtered by the query.
     *
     * @param report validation report
     * @param query term and file filter
     * @param context render context
     * @return rendered document
     */
    String renderCrossReferences(ValidationReport report, CrossReferenceQuery query, RenderContext context);

    /**
     * Renders per-file status.
     *
     * @param status status projection
     * @param context render context
     * @return rendered document
     */
    String renderStatus(StatusReport status, RenderContext context);
}
