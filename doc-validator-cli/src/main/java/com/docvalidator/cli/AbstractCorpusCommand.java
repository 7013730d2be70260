package com.docvalidator.cli;

import com.docvalidator.core.config.ValidationConfig;
import com.docvalidator.core.engine.CorpusUnavailableException;
import com.docvalidator.core.engine.ValidationEngine;
import com.docvalidator.core.engine.ValidationOptions;
import com.docvalidator.core.engine.ValidationReport;
import com.docvalidator.core.report.ReportRenderer;
import com.docvalidator.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Base class for commands that run the validation engine over a corpus.
 *
 * <p>Handles configuration loading, root resolution, renderer selection and the mapping of
 * failures to exit codes. Subclasses render the resulting {@link ValidationReport}.</p>
 */
public abstract class AbstractCorpusCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractCorpusCommand.class);

    @Spec
    protected CommandSpec spec;

    @Mixin
    protected CorpusOptions corpus;

    @Mixin
    protected OutputOptions output;

    @Override
    public Integer call() {
        try {
            ValidationConfig config = corpus.loadConfig();
            Path root = corpus.resolveRoot(config);
            ReportRenderer renderer = output.renderer();
            return execute(config, root, renderer);
        } catch (CorpusUnavailableException e) {
            log.error("Documentation corpus unavailable: {}", e.getMessage());
            err().println("✗ " + e.getMessage());
            return ExitCodes.INVOCATION_ERROR;
        } catch (IllegalArgumentException e) {
            log.error("Invalid invocation: {}", e.getMessage());
            err().println("✗ " + e.getMessage());
            return ExitCodes.INVOCATION_ERROR;
        }
    }

    /**
     * Runs the command.
     *
     * @param config loaded configuration
     * @param root documentation root
     * @param renderer renderer for the selected format
     * @return exit code
     * @throws CorpusUnavailableException if there is nothing to validate
     */
    protected abstract int execute(ValidationConfig config, Path root, ReportRenderer renderer)
        throws CorpusUnavailableException;

    /**
     * Validates the corpus below {@code root}. Explicit files are added to the corpus and
     * restrict reporting to themselves; directories among them expand to their markdown files.
     */
    protected ValidationReport validate(Path root, List<Path> files, ValidationOptions options)
        throws CorpusUnavailableException {
        ValidationEngine engine = createEngine();
        if (files == null || files.isEmpty()) {
            return engine.validateDirectory(root, options);
        }

        Set<Path> corpusFiles = new LinkedHashSet<>();
        if (Files.isDirectory(root)) {
            corpusFiles.addAll(listMarkdown(root));
        }
        List<Path> targets = new ArrayList<>();
        for (Path file : files) {
            Path resolved = corpus.resolve(file);
            if (Files.isDirectory(resolved)) {
                targets.addAll(listMarkdown(resolved));
            } else {
                targets.add(resolved);
            }
        }
        corpusFiles.addAll(targets);
        log.debug("Validating {} target file(s) within a corpus of {}", targets.size(), corpusFiles.size());
        return engine.validate(new ArrayList<>(corpusFiles), options.withTargetFiles(targets));
    }

    protected ValidationEngine createEngine() {
        return new ValidationEngine();
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    private static List<Path> listMarkdown(Path directory) throws CorpusUnavailableException {
        try {
            return FileUtils.findMarkdownFiles(directory);
        } catch (IOException e) {
            throw new CorpusUnavailableException(directory, "Cannot list " + directory + ": " + e.getMessage());
        }
    }
}
