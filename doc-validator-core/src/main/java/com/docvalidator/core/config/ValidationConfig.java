package com.docvalidator.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * Tunable parameters of a validation run.
 *
 * <p>Loaded from {@code docvalidator.yaml}; every key is optional and falls back to the value
 * of {@link #defaults()}, so the tool works with zero configuration.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * minContentLength: 200
 * requiredTerms: [ATO, SEM, CLU, MEMA]
 * terminologyFileNames: [terminologie, glossary]
 * complianceFileNames: [marker]
 * complianceKeyword: "LD-3.4"
 * undefinedTermStoplist: [API, CLI, JSON]
 * reportOrphanFiles: true
 * }</pre>
 *
 * @param minContentLength minimum number of non-whitespace-trimmed characters per file
 * @param requiredTerms terms the terminology files must define between them
 * @param terminologyFileNames base names of terminology files (case-insensitive, exact)
 * @param complianceFileNames base names of specification files (case-insensitive, exact)
 * @param complianceKeyword keyword specification files must mention (case-insensitive)
 * @param undefinedTermStoplist tokens never reported as possibly undefined
 * @param minUndefinedTermLength minimum length of a token to be reported as possibly undefined
 * @param cliCommandPrefix prefix marking a term as a CLI command
 * @param parallelism number of parse workers, 0 picks a default
 * @param reportOrphanFiles whether files without incoming links are reported
 * @param docsDirectoryCandidates directory names searched for the documentation root
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidationConfig(
    @JsonProperty("minContentLength") Integer minContentLength,
    @JsonProperty("requiredTerms") List<String> requiredTerms,
    @JsonProperty("terminologyFileNames") List<String> terminologyFileNames,
    @JsonProperty("complianceFileNames") List<String> complianceFileNames,
    @JsonProperty("complianceKeyword") String complianceKeyword,
    @JsonProperty("undefinedTermStoplist") List<String> undefinedTermStoplist,
    @JsonProperty("minUndefinedTermLength") Integer minUndefinedTermLength,
    @JsonProperty("cliCommandPrefix") String cliCommandPrefix,
    @JsonProperty("parallelism") Integer parallelism,
    @JsonProperty("reportOrphanFiles") Boolean reportOrphanFiles,
    @JsonProperty("docsDirectoryCandidates") List<String> docsDirectoryCandidates
) {
    public static final int DEFAULT_MIN_CONTENT_LENGTH = 100;
    public static final List<String> DEFAULT_REQUIRED_TERMS = List.of("ATO", "SEM", "CLU", "MEMA");
    public static final List<String> DEFAULT_TERMINOLOGY_FILE_NAMES = List.of("terminologie", "terminology", "glossary");
    public static final List<String> DEFAULT_COMPLIANCE_FILE_NAMES = List.of("marker");
    public static final String DEFAULT_COMPLIANCE_KEYWORD = "LD-3.4";
    public static final List<String> DEFAULT_STOPLIST = List.of(
        "API", "CLI", "CSV", "DOCX", "FAQ", "GUI", "HTML", "HTTP", "HTTPS", "IDE", "JSON", "MVP",
        "NOTE", "PDF", "README", "REST", "SQL", "TBD", "TODO", "TXT", "UTF", "WARNING", "XML", "YAML"
    );
    public static final int DEFAULT_MIN_UNDEFINED_TERM_LENGTH = 3;
    public static final String DEFAULT_CLI_COMMAND_PREFIX = "me ";
    public static final List<String> DEFAULT_DOCS_DIRECTORY_CANDIDATES = List.of("docs", "demo-docs", "test-docs");

    /**
     * Compact constructor filling unset keys with defaults.
     */
    public ValidationConfig {
        if (minContentLength == null || minContentLength < 0) {
            minContentLength = DEFAULT_MIN_CONTENT_LENGTH;
        }
        requiredTerms = requiredTerms == null ? DEFAULT_REQUIRED_TERMS : List.copyOf(requiredTerms);
        terminologyFileNames = terminologyFileNames == null
            ? DEFAULT_TERMINOLOGY_FILE_NAMES : List.copyOf(terminologyFileNames);
        complianceFileNames = complianceFileNames == null
            ? DEFAULT_COMPLIANCE_FILE_NAMES : List.copyOf(complianceFileNames);
        if (complianceKeyword == null || complianceKeyword.isBlank()) {
            complianceKeyword = DEFAULT_COMPLIANCE_KEYWORD;
        }
        undefinedTermStoplist = undefinedTermStoplist == null ? DEFAULT_STOPLIST : List.copyOf(undefinedTermStoplist);
        if (minUndefinedTermLength == null || minUndefinedTermLength < 1) {
            minUndefinedTermLength = DEFAULT_MIN_UNDEFINED_TERM_LENGTH;
        }
        if (cliCommandPrefix == null) {
            cliCommandPrefix = DEFAULT_CLI_COMMAND_PREFIX;
        }
        if (parallelism == null || parallelism < 0) {
            parallelism = 0;
        }
        if (reportOrphanFiles == null) {
            reportOrphanFiles = Boolean.FALSE;
        }
        docsDirectoryCandidates = docsDirectoryCandidates == null
            ? DEFAULT_DOCS_DIRECTORY_CANDIDATES : List.copyOf(docsDirectoryCandidates);
    }

    /**
     * Creates the built-in configuration.
     *
     * @return default configuration
     */
    public static ValidationConfig defaults() {
        return new ValidationConfig(null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Returns a copy with a different required term set.
     *
     * @param terms required terms
     * @return updated copy
     */
    public ValidationConfig withRequiredTerms(List<String> terms) {
        return new ValidationConfig(minContentLength, terms, terminologyFileNames, complianceFileNames,
            complianceKeyword, undefinedTermStoplist, minUndefinedTermLength, cliCommandPrefix, parallelism,
            reportOrphanFiles, docsDirectoryCandidates);
    }

    /**
     * Returns a copy with orphan-file reporting switched on or off.
     *
     * @param report whether to report orphan files
     * @return updated copy
     */
    public ValidationConfig withReportOrphanFiles(boolean report) {
        return new ValidationConfig(minContentLength, requiredTerms, terminologyFileNames, complianceFileNames,
            complianceKeyword, undefinedTermStoplist, minUndefinedTermLength, cliCommandPrefix, parallelism,
            report, docsDirectoryCandidates);
    }

    public boolean isTerminologyFile(String baseName) {
        return matchesName(baseName, terminologyFileNames);
    }

    public boolean isComplianceFile(String baseName) {
        return matchesName(baseName, complianceFileNames);
    }

    /**
     * Returns the effective number of parse workers.
     *
     * @return configured parallelism, or {@code min(cpus, 4)} when unset
     */
    public int effectiveParallelism() {
        if (parallelism > 0) {
            return parallelism;
        }
        return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), 4));
    }

    private static boolean matchesName(String baseName, List<String> names) {
        String lower = baseName.toLowerCase(Locale.ROOT);
        return names.stream().anyMatch(name -> lower.equals(name.toLowerCase(Locale.ROOT)));
    }
}
