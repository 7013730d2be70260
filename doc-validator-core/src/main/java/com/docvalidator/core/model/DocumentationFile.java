package com.docvalidator.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A parsed markdown file with its structural skeleton and validation state.
 *
 * <p>Instances are immutable. The validation state changes only through
 * {@link #withValidation(ValidationStatus, Instant)}, which the engine calls once per run.</p>
 *
 * @param path absolute, normalized path (unique within a corpus)
 * @param name short identifier: the lower-cased file name without extension
 * @param fingerprint change-detection metadata
 * @param content decoded file content
 * @param lines content split into lines
 * @param title text of the first level-1 heading, or {@code null}
 * @param headings headings in document order
 * @param links inline links in document order
 * @param malformedLinks link openings whose parentheses never balance
 * @param definitions bold-term definitions in document order
 * @param codeBlockLines 1-based line numbers inside fenced code blocks (fences included)
 * @param encodingNotice description of a decoding recovery, or {@code null}
 * @param lastValidated end of the last validation run, or {@code null}
 * @param status validation status
 */
public record DocumentationFile(
    Path path,
    String name,
    FileFingerprint fingerprint,
    String content,
    List<String> lines,
    String title,
    List<Heading> headings,
    List<MarkdownLink> links,
    List<MalformedLink> malformedLinks,
    List<TermDefinition> definitions,
    Set<Integer> codeBlockLines,
    String encodingNotice,
    Instant lastValidated,
    ValidationStatus status
) {
    /**
     * Compact constructor with validation.
     */
    public DocumentationFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(content, "content must not be null");
        lines = lines == null ? List.of() : List.copyOf(lines);
        headings = headings == null ? List.of() : List.copyOf(headings);
        links = links == null ? List.of() : List.copyOf(links);
        malformedLinks = malformedLinks == null ? List.of() : List.copyOf(malformedLinks);
        definitions = definitions == null ? List.of() : List.copyOf(definitions);
        codeBlockLines = codeBlockLines == null ? Set.of() : Set.copyOf(codeBlockLines);
        if (status == null) {
            status = ValidationStatus.NOT_VALIDATED;
        }
    }

    /**
     * Returns the file name including extension, e.g. {@code marker.md}.
     *
     * @return file name
     */
    public String fileName() {
        return path.getFileName().toString();
    }

    public boolean hasTitle() {
        return title != null;
    }

    public boolean isInCodeBlock(int lineNumber) {
        return codeBlockLines.contains(lineNumber);
    }

    /**
     * Returns a copy carrying the outcome of a validation run.
     *
     * @param newStatus status after validation
     * @param validatedAt completion time of the run
     * @return updated copy
     */
    public DocumentationFile withValidation(ValidationStatus newStatus, Instant validatedAt) {
        return new DocumentationFile(
            path, name, fingerprint, content, lines, title, headings, links,
            malformedLinks, definitions, codeBlockLines, encodingNotice, validatedAt, newStatus
        );
    }
}
