package com.docvalidator.cli;

import com.docvalidator.core.config.ValidationConfig;
import com.docvalidator.core.engine.CorpusUnavailableException;
import com.docvalidator.core.engine.StatusReport;
import com.docvalidator.core.engine.ValidationOptions;
import com.docvalidator.core.engine.ValidationReport;
import com.docvalidator.core.report.ReportRenderer;
import picocli.CommandLine.Command;

import java.nio.file.Path;
import java.util.List;

/**
 * Command to show the validation status of every documentation file.
 *
 * <p>No results are cached between invocations, so the status is recomputed by a fresh run.
 */
@Command(
    name = "status",
    description = "Show validation status per documentation file",
    mixinStandardHelpOptions = true
)
public class StatusCommand extends AbstractCorpusCommand {

    @Override
    protected int execute(ValidationConfig config, Path root, ReportRenderer renderer)
        throws CorpusUnavailableException {
        ValidationReport report = validate(root, List.of(), new ValidationOptions(false, List.of(), config));
        StatusReport status = StatusReport.from(report);

        out().print(renderer.renderStatus(status, output.renderContext(root)));
        out().flush();
        return ExitCodes.SUCCESS;
    }
}
