package com.docvalidator.core.engine;

import com.docvalidator.core.config.ValidationConfig;
import com.docvalidator.core.crossref.CrossReferenceReport;
import com.docvalidator.core.crossref.CrossReferenceValidator;
import com.docvalidator.core.model.DocumentationFile;
import com.docvalidator.core.model.FileStatus;
import com.docvalidator.core.model.Severity;
import com.docvalidator.core.model.ValidationResult;
import com.docvalidator.core.model.ValidationStatus;
import com.docvalidator.core.model.ValidationSummary;
import com.docvalidator.core.parser.DocumentationParser;
import com.docvalidator.core.parser.ParseException;
import com.docvalidator.core.rules.RuleContext;
import com.docvalidator.core.rules.ValidationRule;
import com.docvalidator.core.terminology.TerminologyExtraction;
import com.docvalidator.core.terminology.TerminologyExtractor;
import com.docvalidator.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the validation pipeline over a corpus of markdown files.
 *
 * <p>Pipeline (fixed order):
 * <ol>
 *   <li>Parse every file, in parallel when configured; results are kept in corpus order</li>
 *   <li>Extract terminology from the terminology files</li>
 *   <li>Apply the {@link ValidationRule}s discovered via SPI to every parsed file</li>
 *   <li>Resolve cross-references over the full parsed set and term index</li>
 *   <li>Aggregate findings, update file statuses and compute success</li>
 * </ol>
 *
 * <p>A file that fails to parse contributes one ERROR {@value #PARSE_RULE} finding and is
 * still listed in the file statuses. Only an unusable corpus aborts a run, with
 * {@link CorpusUnavailableException}.</p>
 *
 * <p>Each call is independent; the engine holds no state between runs.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ValidationEngine engine = new ValidationEngine();
 * ValidationReport report = engine.validateDirectory(Path.of("docs"), ValidationOptions.defaults());
 * if (!report.success()) {
 *     report.issues().forEach(System.out::println);
 * }
 * }</pre>
 */
public class ValidationEngine {

    public static final String PARSE_RULE = "file_parsing";
    public static final String ENCODING_RULE = "encoding";
    public static final String GRAPH_RULE = "document_graph";

    private static final Logger log = LoggerFactory.getLogger(ValidationEngine.class);

    private final DocumentationParser parser;
    private final List<ValidationRule> rules;

    /**
     * Creates an engine with the rules registered under {@code META-INF/services}.
     */
    public ValidationEngine() {
        this(new DocumentationParser(), discoverRules());
    }

    public ValidationEngine(DocumentationParser parser, List<ValidationRule> rules) {
        this.parser = parser;
        this.rules = sortRules(rules);
    }

    public List<ValidationRule> getRules() {
        return rules;
    }

    /**
     * Validates every markdown file below a directory, sorted by path.
     *
     * @param root corpus root
     * @param options run options
     * @return validation report
     * @throws CorpusUnavailableException if the root is not a readable directory or holds no markdown file
     */
    public ValidationReport validateDirectory(Path root, ValidationOptions options) throws CorpusUnavailableException {
        Path normalized = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(normalized)) {
            throw new CorpusUnavailableException(normalized, "Documentation root does not exist: " + normalized);
        }
        List<Path> files;
        try {
            files = FileUtils.findMarkdownFiles(normalized);
        } catch (IOException e) {
            throw new CorpusUnavailableException(normalized,
                "Cannot list documentation root " + normalized + ": " + e.getMessage());
        }
        log.info("Discovered {} markdown files in {}", files.size(), normalized);
        return validate(files, options);
    }

    /**
     * Validates an explicit corpus.
     *
     * @param corpusPaths corpus files in declared order; duplicates are ignored
     * @param options run options
     * @return validation report
     * @throws CorpusUnavailableException if the list is empty or no file could be read
     */
    public ValidationReport validate(List<Path> corpusPaths, ValidationOptions options) throws CorpusUnavailableException {
        List<Path> corpus = new ArrayList<>(new LinkedHashSet<>(corpusPaths.stream()
            .map(path -> path.toAbsolutePath().normalize())
            .toList()));
        if (corpus.isEmpty()) {
            throw new CorpusUnavailableException(null, "No documentation files to validate");
        }

        ValidationConfig config = options.config();
        List<ValidationResult> findings = new ArrayList<>();

        // Step 1: parse
        List<ParseOutcome> outcomes = parseAll(corpus, config.effectiveParallelism());
        List<DocumentationFile> parsed = new ArrayList<>();
        for (ParseOutcome outcome : outcomes) {
            if (outcome.file() != null) {
                parsed.add(outcome.file());
                if (outcome.file().encodingNotice() != null) {
                    findings.add(ValidationResult.info(outcome.path().toString(), ENCODING_RULE,
                        outcome.file().encodingNotice(), null));
                }
            } else {
                findings.add(parseFailure(outcome.path(), outcome.error()));
            }
        }
        if (parsed.isEmpty()) {
            throw new CorpusUnavailableException(corpus.get(0),
                "None of the " + corpus.size() + " documentation files could be read");
        }
        log.info("Parsed {} of {} files", parsed.size(), corpus.size());

        // Step 2: terminology
        TerminologyExtraction terminology = new TerminologyExtractor(config).extract(parsed);
        findings.addAll(terminology.findings());

        // Step 3: content rules
        RuleContext context = new RuleContext(config, options.strict(), parsed, terminology);
        for (DocumentationFile file : parsed) {
            findings.addAll(applyRules(file, context));
        }

        // Step 4: cross-references
        CrossReferenceReport crossReferences = new CrossReferenceValidator(config).validate(parsed, terminology.index());
        findings.addAll(crossReferences.findings());
        if (config.reportOrphanFiles()) {
            findings.addAll(orphanFindings(crossReferences, parsed));
        }

        // Step 5: aggregate
        Set<String> reported = reportedPaths(corpus, options);
        List<ValidationResult> issues = new ArrayList<>(findings.stream()
            .filter(finding -> reported.contains(finding.filePath()))
            .toList());
        issues.sort(issueOrder(corpus));

        Instant completedAt = Instant.now();
        Map<String, DocumentationFile> documentsByPath = new HashMap<>();
        List<DocumentationFile> documents = new ArrayList<>();
        for (DocumentationFile file : parsed) {
            String path = file.path().toString();
            DocumentationFile updated = reported.contains(path)
                ? file.withValidation(statusOf(issuesOf(issues, path), options.strict()), completedAt)
                : file;
            documents.add(updated);
            documentsByPath.put(path, updated);
        }

        List<FileStatus> statuses = new ArrayList<>();
        for (Path path : corpus) {
            String key = path.toString();
            if (!reported.contains(key)) {
                continue;
            }
            statuses.add(fileStatus(path, documentsByPath.get(key), issuesOf(issues, key), completedAt));
        }

        ValidationSummary summary = ValidationSummary.of(issues);
        boolean success = summary.isSuccess(options.strict());
        log.info("Validation {}: {} errors, {} warnings, {} info",
            success ? "passed" : "failed", summary.errors(), summary.warnings(), summary.info());

        return new ValidationReport(
            success,
            options.strict(),
            statuses,
            documents,
            issues,
            crossReferences.references(),
            terminology.index(),
            crossReferences.graph(),
            summary,
            completedAt
        );
    }

    private List<ParseOutcome> parseAll(List<Path> corpus, int parallelism) {
        if (parallelism <= 1 || corpus.size() <= 1) {
            return corpus.stream().map(this::parseOne).toList();
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, corpus.size()));
        try {
            List<Future<ParseOutcome>> futures = new ArrayList<>();
            for (Path path : corpus) {
                futures.add(executor.submit(() -> parseOne(path)));
            }
            // Join barrier: slots are read back in corpus order
            List<ParseOutcome> outcomes = new ArrayList<>();
            for (Future<ParseOutcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while parsing documentation files", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Parse worker failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private ParseOutcome parseOne(Path path) {
        try {
            return new ParseOutcome(path, parser.parse(path), null);
        } catch (ParseException e) {
            log.warn("Failed to parse {}: {}", path, e.getMessage());
            return new ParseOutcome(path, null, e);
        }
    }

    private static ValidationResult parseFailure(Path path, ParseException error) {
        String suggestion = error.getKind() == ParseException.Kind.NOT_FOUND
            ? "Check that the file exists and the path is spelled correctly"
            : "Check that the file is readable";
        return ValidationResult.error(path.toString(), PARSE_RULE,
            "Failed to parse file: " + error.getMessage(), null, suggestion);
    }

    private List<ValidationResult> applyRules(DocumentationFile file, RuleContext context) {
        List<ValidationResult> results = new ArrayList<>();
        for (ValidationRule rule : rules) {
            if (!rule.appliesTo(file, context)) {
                continue;
            }
            try {
                results.addAll(rule.check(file, context));
            } catch (RuntimeException e) {
                log.error("Rule {} failed on {}", rule.getId(), file.fileName(), e);
                results.add(ValidationResult.error(file.path().toString(), rule.getId(),
                    "Rule " + rule.getDisplayName() + " failed: " + e.getMessage(), null, null));
            }
        }
        return results;
    }

    private static List<ValidationResult> orphanFindings(CrossReferenceReport crossReferences,
                                                         List<DocumentationFile> parsed) {
        if (parsed.size() < 2) {
            return List.of();
        }
        return crossReferences.graph().orphans().stream()
            .map(path -> ValidationResult.info(path, GRAPH_RULE, "No other document links to this file", null))
            .toList();
    }

    private static Set<String> reportedPaths(List<Path> corpus, ValidationOptions options) {
        Set<String> reported = new HashSet<>();
        Set<Path> targets = new HashSet<>(options.targetFiles());
        for (Path path : corpus) {
            if (!options.hasTargetFiles() || targets.contains(path)) {
                reported.add(path.toString());
            }
        }
        return reported;
    }

    private static Comparator<ValidationResult> issueOrder(List<Path> corpus) {
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < corpus.size(); i++) {
            position.put(corpus.get(i).toString(), i);
        }
        return Comparator
            .comparingInt((ValidationResult issue) -> position.getOrDefault(issue.filePath(), Integer.MAX_VALUE))
            .thenComparingInt(issue -> issue.lineNumber() == null ? 0 : issue.lineNumber())
            .thenComparing(ValidationResult::ruleName)
            .thenComparing(ValidationResult::message);
    }

    private static List<ValidationResult> issuesOf(List<ValidationResult> issues, String path) {
        return issues.stream().filter(issue -> issue.filePath().equals(path)).toList();
    }

    private static ValidationStatus statusOf(List<ValidationResult> fileIssues, boolean strict) {
        boolean failing = fileIssues.stream().anyMatch(issue -> issue.severity() == Severity.ERROR
            || (strict && issue.severity() == Severity.WARNING));
        return failing ? ValidationStatus.INVALID : ValidationStatus.VALID;
    }

    private static FileStatus fileStatus(Path path, DocumentationFile document, List<ValidationResult> fileIssues,
                                         Instant completedAt) {
        int errors = (int) fileIssues.stream().filter(issue -> issue.severity() == Severity.ERROR).count();
        int warnings = (int) fileIssues.stream().filter(issue -> issue.severity() == Severity.WARNING).count();
        if (document == null) {
            return new FileStatus(path.toString(), String.valueOf(path.getFileName()),
                ValidationStatus.INVALID, null, completedAt, errors, warnings);
        }
        return new FileStatus(path.toString(), document.fileName(), document.status(),
            document.fingerprint().lastModified(), document.lastValidated(), errors, warnings);
    }

    private static List<ValidationRule> discoverRules() {
        log.debug("Discovering validation rules via ServiceLoader");
        List<ValidationRule> discovered = new ArrayList<>();
        ServiceLoader.load(ValidationRule.class).forEach(discovered::add);
        log.debug("Discovered {} validation rules", discovered.size());
        return discovered;
    }

    private static List<ValidationRule> sortRules(List<ValidationRule> rules) {
        List<ValidationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(ValidationRule::getPriority).thenComparing(ValidationRule::getId));
        return List.copyOf(sorted);
    }

    private record ParseOutcome(Path path, DocumentationFile file, ParseException error) {
    }
}
