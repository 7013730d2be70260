package com.docvalidator.cli;

import com.docvalidator.core.config.ValidationConfig;
import com.docvalidator.core.engine.CorpusUnavailableException;
import com.docvalidator.core.engine.ValidationOptions;
import com.docvalidator.core.engine.ValidationReport;
import com.docvalidator.core.report.ReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command to validate documentation files.
 *
 * <p>All issues are printed regardless of the outcome; the exit code reflects only success.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Validate every markdown file of the documentation root
 * doc-validator validate
 *
 * # Validate two files, treating warnings as failures
 * doc-validator validate --strict docs/marker.md docs/terminologie.md
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Validate documentation structure, content, terminology and cross-references",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends AbstractCorpusCommand {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(
        arity = "0..*",
        paramLabel = "FILE",
        description = "Files or directories to report on (default: the whole documentation root)"
    )
    private List<Path> files = new ArrayList<>();

    @Option(names = {"--strict"}, description = "Treat warnings as errors")
    private boolean strict;

    @Override
    protected int execute(ValidationConfig config, Path root, ReportRenderer renderer)
        throws CorpusUnavailableException {
        log.info("Validating documentation in {} (strict: {})", root, strict);
        ValidationOptions options = new ValidationOptions(strict, List.of(), config);
        ValidationReport report = validate(root, files, options);

        out().print(renderer.renderValidation(report, output.renderContext(root)));
        out().flush();
        return report.success() ? ExitCodes.SUCCESS : ExitCodes.VALIDATION_FAILED;
    }
}
