package com.docvalidator.core.terminology;

import com.docvalidator.core.config.ValidationConfig;
import com.docvalidator.core.model.DocumentationFile;
import com.docvalidator.core.model.TermCategory;
import com.docvalidator.core.model.TermDefinition;
import com.docvalidator.core.model.TerminologyEntry;
import com.docvalidator.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the term index from the bold-term definitions of the terminology files.
 *
 * <p>Files are processed in corpus order, definitions in line order. A term defined again
 * with a different definition is overwritten and an INFO {@value #RULE_NAME} finding is
 * recorded.</p>
 */
public class TerminologyExtractor {

    public static final String RULE_NAME = "terminology_consistency";

    private static final Logger log = LoggerFactory.getLogger(TerminologyExtractor.class);

    private final ValidationConfig config;

    public TerminologyExtractor(ValidationConfig config) {
        this.config = config;
    }

    /**
     * Extracts terminology from the terminology files of a parsed corpus.
     *
     * @param files parsed files in corpus order
     * @return index, redefinition notices and per-file term lists
     */
    public TerminologyExtraction extract(List<DocumentationFile> files) {
        TermIndex.Builder builder = TermIndex.builder();
        List<ValidationResult> findings = new ArrayList<>();
        Map<String, List<String>> termsByFile = new LinkedHashMap<>();

        for (DocumentationFile file : files) {
            if (!config.isTerminologyFile(file.name())) {
                continue;
            }
            String filePath = file.path().toString();
            List<String> definedHere = new ArrayList<>();
            log.debug("Extracting terminology from {}", file.fileName());

            for (TermDefinition definition : file.definitions()) {
                TerminologyEntry entry = new TerminologyEntry(
                    definition.term(),
                    definition.definition(),
                    definition.aliases(),
                    categorize(definition.term()),
                    filePath,
                    definition.lineNumber()
                );

                Optional<TerminologyEntry> previous = builder.put(entry);
                previous
                    .filter(old -> !old.definition().equals(entry.definition()))
                    .ifPresent(old -> findings.add(ValidationResult.info(
                        filePath,
                        RULE_NAME,
                        "redefinition of " + entry.term() + " (previous definition at "
                            + fileNameOf(old.sourceFile()) + ":" + old.lineNumber() + " is overwritten)",
                        definition.lineNumber()
                    )));

                if (!definedHere.contains(entry.term())) {
                    definedHere.add(entry.term());
                }
            }
            termsByFile.put(filePath, definedHere);
        }

        TermIndex index = builder.build();
        if (termsByFile.isEmpty()) {
            log.warn("No terminology file found in corpus (names: {})", config.terminologyFileNames());
        }
        log.info("Extracted {} terms from {} terminology file(s)", index.size(), termsByFile.size());
        return new TerminologyExtraction(index, findings, termsByFile);
    }

    TermCategory categorize(String term) {
        if (config.requiredTerms().contains(term)) {
            return TermCategory.MARKER_LEVEL;
        }
        String prefix = config.cliCommandPrefix();
        if (!prefix.isEmpty() && term.toLowerCase(Locale.ROOT).startsWith(prefix.toLowerCase(Locale.ROOT))) {
            return TermCategory.CLI_COMMAND;
        }
        return TermCategory.GENERAL;
    }

    private static String fileNameOf(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
