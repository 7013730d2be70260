package com.docvalidator.core;

import com.docvalidator.core.config.ValidationConfig;
import com.docvalidator.core.model.DocumentationFile;
import com.docvalidator.core.parser.DocumentationParser;
import com.docvalidator.core.parser.ParseException;
import com.docvalidator.core.rules.RuleContext;
import com.docvalidator.core.terminology.TerminologyExtractor;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for tests that work on a small documentation corpus.
 *
 * <p>Provides a temporary corpus directory, file creation helpers and a consistent,
 * finding-free pair of documents ({@link #TERMINOLOGY_COMPLETE}, {@link #MARKER_VALID})
 * that individual tests break in targeted ways.</p>
 */
public abstract class CorpusTestBase {

    /** Terminology file defining all four marker levels. */
    protected static final String TERMINOLOGY_COMPLETE = """
        # Terminologie

        This glossary defines the marker levels used throughout the analysis pipeline documentation.

        **ATO** · Atomic marker, the smallest detectable signal
        **SEM** · Semantic marker built from atomic markers
        **CLU** · Cluster marker grouping semantic markers
        **MEMA** · Meta marker describing long-term patterns
        """;

    /** Pipeline file that mentions the compliance keyword and links to the terminology. */
    protected static final String MARKER_VALID = """
        # Marker Pipeline

        The pipeline follows the LD-3.4 specification and processes markers in four stages.
        Each ATO feeds into a SEM, which is grouped into a CLU and summarised by MEMA.
        See the [terminology](terminologie.md) and the [levels](terminologie.md#terminologie).
        """;

    @TempDir
    protected Path tempDir;

    protected final DocumentationParser parser = new DocumentationParser();

    /**
     * Creates a file in the temp directory with the given content.
     *
     * @param relativePath path relative to tempDir (e.g., "marker.md" or "guides/setup.md")
     * @param content file content
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content);
        return filePath;
    }

    protected Path createValidCorpus() throws IOException {
        createFile("terminologie.md", TERMINOLOGY_COMPLETE);
        createFile("marker.md", MARKER_VALID);
        return tempDir;
    }

    /**
     * Parses files created with {@link #createFile(String, String)}, in the given order.
     */
    protected List<DocumentationFile> parseAll(Path... files) throws ParseException {
        List<DocumentationFile> parsed = new ArrayList<>();
        for (Path file : files) {
            parsed.add(parser.parse(file));
        }
        return parsed;
    }

    /**
     * Builds the context a rule sees for the given corpus under the default configuration.
     */
    protected RuleContext ruleContext(boolean strict, List<DocumentationFile> corpus) {
        ValidationConfig config = ValidationConfig.defaults();
        return new RuleContext(config, strict, corpus, new TerminologyExtractor(config).extract(corpus));
    }
}
