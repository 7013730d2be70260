package com.docvalidator.core.parser;

import com.docvalidator.core.model.DocumentationFile;
import com.docvalidator.core.model.FileFingerprint;
import com.docvalidator.core.model.Heading;
import com.docvalidator.core.model.MalformedLink;
import com.docvalidator.core.model.MarkdownLink;
import com.docvalidator.core.model.TermDefinition;
import com.docvalidator.core.model.ValidationStatus;
import com.docvalidator.core.util.FileUtils;
import com.docvalidator.core.util.TextDecodingUtils;
import com.docvalidator.core.util.TextDecodingUtils.DecodedText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Reads a markdown file and extracts its structural skeleton.
 *
 * <p>Extraction is line-oriented:
 * <ul>
 *   <li>Headings: {@code ^#{1,6}\s+.+}; the first level-1 heading is the title</li>
 *   <li>Links: inline {@code [text](target)} spans with balanced parentheses</li>
 *   <li>Definitions: {@code **TERM** · definition}</li>
 * </ul>
 * Lines inside fenced code blocks are ignored. Parsing is idempotent: an unchanged file
 * always yields an equal {@link DocumentationFile}.
 *
 * <p>This class is stateless and safe to share between parse workers.
 *
 * @see MarkdownPatterns
 */
public class DocumentationParser {

    private static final Logger log = LoggerFactory.getLogger(DocumentationParser.class);

    private static final int HASH_PREFIX_LENGTH = 16;

    /**
     * Parses a documentation file.
     *
     * @param path file to parse
     * @return parsed file with status {@link ValidationStatus#NOT_VALIDATED}
     * @throws ParseException if the file does not exist or cannot be read
     */
    public DocumentationFile parse(Path path) throws ParseException {
        Path normalized = path.toAbsolutePath().normalize();
        if (!Files.isRegularFile(normalized)) {
            throw new ParseException(normalized, ParseException.Kind.NOT_FOUND,
                "Documentation file not found: " + normalized);
        }

        byte[] bytes;
        FileFingerprint fingerprint;
        try {
            bytes = Files.readAllBytes(normalized);
            fingerprint = new FileFingerprint(
                bytes.length,
                Files.getLastModifiedTime(normalized).toInstant(),
                contentHash(bytes)
            );
        } catch (IOException e) {
            throw new ParseException(normalized, ParseException.Kind.UNREADABLE,
                "Cannot read " + normalized + ": " + e.getMessage(), e);
        }

        DecodedText decoded = TextDecodingUtils.decodeBestEffort(bytes);
        String notice = decoded.buildNotice(normalized.getFileName().toString());
        if (notice != null) {
            log.warn("Recovered from encoding problem: {}", notice);
        }

        DocumentationFile file = parseContent(normalized, decoded.text(), fingerprint, notice);
        log.debug("Parsed {}: {} headings, {} links, {} definitions",
            normalized.getFileName(), file.headings().size(), file.links().size(), file.definitions().size());
        return file;
    }

    DocumentationFile parseContent(Path path, String content, FileFingerprint fingerprint, String encodingNotice) {
        List<String> lines = List.of(content.split("\r?\n", -1));

        String title = null;
        List<Heading> headings = new ArrayList<>();
        List<MarkdownLink> links = new ArrayList<>();
        List<MalformedLink> malformedLinks = new ArrayList<>();
        List<TermDefinition> definitions = new ArrayList<>();
        Set<Integer> codeBlockLines = new HashSet<>();

        String openFence = null;
        for (int i = 0; i < lines.size(); i++) {
            int lineNumber = i + 1;
            String line = lines.get(i);

            String fence = MarkdownPatterns.fenceOf(line);
            if (openFence != null) {
                codeBlockLines.add(lineNumber);
                if (fence != null && fence.charAt(0) == openFence.charAt(0) && fence.length() >= openFence.length()) {
                    openFence = null;
                }
                continue;
            }
            if (fence != null) {
                codeBlockLines.add(lineNumber);
                openFence = fence;
                continue;
            }

            Matcher heading = MarkdownPatterns.HEADING.matcher(line);
            if (heading.matches()) {
                int level = heading.group(1).length();
                String text = heading.group(2).strip();
                headings.add(new Heading(level, text, MarkdownPatterns.slugify(text), lineNumber));
                if (level == 1 && title == null) {
                    title = text;
                }
            }

            TermDefinition definition = parseDefinition(line, lineNumber);
            if (definition != null) {
                definitions.add(definition);
            }

            scanLinks(line, lineNumber, links, malformedLinks);
        }

        return new DocumentationFile(
            path,
            FileUtils.getBaseName(path).toLowerCase(Locale.ROOT),
            fingerprint,
            content,
            lines,
            title,
            headings,
            links,
            malformedLinks,
            definitions,
            codeBlockLines,
            encodingNotice,
            null,
            ValidationStatus.NOT_VALIDATED
        );
    }

    /**
     * Parses a bold-term definition line.
     *
     * <p>{@code **ATO_ (Atomic Marker)** · text (aka Atom)} yields term {@code ATO} with aliases
     * {@code Atomic Marker}, {@code ATO_} and {@code Atom}.
     *
     * @param line source line
     * @param lineNumber 1-based line number
     * @return definition, or {@code null} if the line is not a definition
     */
    TermDefinition parseDefinition(String line, int lineNumber) {
        Matcher matcher = MarkdownPatterns.BOLD_DEFINITION.matcher(line.strip());
        if (!matcher.matches()) {
            return null;
        }

        String termPart = matcher.group("term").strip();
        String definitionText = matcher.group("definition");
        List<String> aliases = new ArrayList<>();

        String term = termPart;
        Matcher nameMatcher = MarkdownPatterns.TERM_WITH_FULL_NAME.matcher(termPart);
        if (nameMatcher.matches()) {
            term = nameMatcher.group("name").strip();
            String fullName = nameMatcher.group("full");
            if (fullName != null && !fullName.isBlank()) {
                aliases.add(fullName.strip());
            }
        }
        if (term.length() > 1 && term.endsWith("_")) {
            String underscored = term;
            term = term.replaceAll("_+$", "");
            aliases.add(underscored);
        }
        if (term.isBlank()) {
            return null;
        }

        Matcher aka = MarkdownPatterns.AKA.matcher(definitionText);
        while (aka.find()) {
            aliases.addAll(MarkdownPatterns.splitAliases(aka.group("aliases")));
        }
        String definition = MarkdownPatterns.normalizeWhitespace(MarkdownPatterns.AKA.matcher(definitionText).replaceAll(""));

        String canonical = term;
        List<String> distinctAliases = aliases.stream()
            .distinct()
            .filter(alias -> !alias.equals(canonical))
            .toList();
        return new TermDefinition(canonical, definition, distinctAliases, lineNumber);
    }

    /**
     * Scans one line for inline links. Images are skipped; a link opening whose parentheses
     * never close on the line is recorded as malformed and ends the scan of that line.
     */
    void scanLinks(String line, int lineNumber, List<MarkdownLink> links, List<MalformedLink> malformedLinks) {
        int index = 0;
        while ((index = line.indexOf('[', index)) >= 0) {
            if (index > 0 && line.charAt(index - 1) == '\\') {
                index++;
                continue;
            }
            int close = findClosingBracket(line, index);
            if (close < 0) {
                index++;
                continue;
            }
            if (close + 1 >= line.length() || line.charAt(close + 1) != '(') {
                index++;
                continue;
            }

            int depth = 1;
            int cursor = close + 2;
            while (cursor < line.length() && depth > 0) {
                char c = line.charAt(cursor);
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                }
                cursor++;
            }
            if (depth > 0) {
                malformedLinks.add(new MalformedLink(lineNumber, line.strip()));
                return;
            }

            boolean image = index > 0 && line.charAt(index - 1) == '!';
            String text = line.substring(index + 1, close);
            String target = cleanTarget(line.substring(close + 2, cursor - 1));
            if (!image && !target.isEmpty()) {
                links.add(MarkdownLink.of(text, target, lineNumber));
            }
            index = cursor;
        }
    }

    private static int findClosingBracket(String line, int open) {
        int depth = 0;
        for (int i = open; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    // Drops an optional link title ("...") and angle brackets around the destination
    private static String cleanTarget(String rawTarget) {
        String target = rawTarget.strip();
        if (target.startsWith("<") && target.contains(">")) {
            return target.substring(1, target.indexOf('>')).strip();
        }
        int space = target.indexOf(' ');
        return space > 0 ? target.substring(0, space) : target;
    }

    private static String contentHash(byte[] bytes) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(bytes);
            return HexFormat.of().formatHex(digest).substring(0, HASH_PREFIX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
