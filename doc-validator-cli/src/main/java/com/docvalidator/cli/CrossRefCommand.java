package com.docvalidator.cli;

import com.docvalidator.core.config.ValidationConfig;
import com.docvalidator.core.crossref.CrossReferenceQuery;
import com.docvalidator.core.engine.CorpusUnavailableException;
import com.docvalidator.core.engine.ValidationOptions;
import com.docvalidator.core.engine.ValidationReport;
import com.docvalidator.core.report.ReportRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;

/**
 * Command to list resolved links and term usages, optionally filtered by term or file.
 *
 * <p>Read-only projection of a fresh cross-reference pass; always exits 0 once the corpus
 * could be read.
 */
@Command(
    name = "cross-ref",
    description = "Show cross-references between documentation files",
    mixinStandardHelpOptions = true
)
public class CrossRefCommand extends AbstractCorpusCommand {

    @Option(names = {"-t", "--term"}, description = "Only references to this term (case-insensitive substring)")
    private String term;

    @Option(names = {"--file"}, description = "Only references found in this file")
    private String file;

    @Override
    protected int execute(ValidationConfig config, Path root, ReportRenderer renderer)
        throws CorpusUnavailableException {
        ValidationReport report = validate(root, List.of(), new ValidationOptions(false, List.of(), config));
        CrossReferenceQuery query = new CrossReferenceQuery(term, file);

        out().print(renderer.renderCrossReferences(report, query, output.renderContext(root)));
        out().flush();
        return ExitCodes.SUCCESS;
    }
}
