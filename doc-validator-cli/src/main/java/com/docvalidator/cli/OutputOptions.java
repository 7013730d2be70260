package com.docvalidator.cli;

import com.docvalidator.core.report.RenderContext;
import com.docvalidator.core.report.ReportRenderer;
import com.docvalidator.core.report.ReportRenderers;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.Map;

/**
 * Output format options shared by all commands as a mixin.
 */
public class OutputOptions {

    @Option(
        names = {"-f", "--format"},
        description = "Output format: text or json (default: ${DEFAULT-VALUE})",
        defaultValue = "text"
    )
    private String format;

    @Option(names = {"--no-color"}, description = "Disable ANSI colors in text output")
    private boolean noColor;

    /**
     * @throws IllegalArgumentException for an unknown format
     */
    public ReportRenderer renderer() {
        return ReportRenderers.forFormat(format);
    }

    public RenderContext renderContext(Path baseDirectory) {
        return new RenderContext(baseDirectory, Map.of(RenderContext.COLORS, String.valueOf(!noColor)));
    }
}
