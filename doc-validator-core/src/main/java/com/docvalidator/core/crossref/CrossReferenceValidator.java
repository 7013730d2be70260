package com.docvalidator.core.crossref;

import com.docvalidator.core.config.ValidationConfig;
import com.docvalidator.core.model.CrossReference;
import com.docvalidator.core.model.DocumentationFile;
import com.docvalidator.core.model.Heading;
import com.docvalidator.core.model.MarkdownLink;
import com.docvalidator.core.model.TermDefinition;
import com.docvalidator.core.model.TerminologyEntry;
import com.docvalidator.core.model.ValidationResult;
import com.docvalidator.core.parser.MarkdownPatterns;
import com.docvalidator.core.terminology.TermIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Resolves every link and term usage of a parsed corpus.
 *
 * <p><b>Links</b> are resolved by file name against the corpus (first file in corpus order
 * wins), so relative path prefixes do not matter. A link to an unknown file is an ERROR; a link
 * whose {@code #anchor} matches no heading slug of an existing file is a WARNING. External links
 * are not resolved.</p>
 *
 * <p><b>Term usages</b> are found by a case-sensitive whole-word scan for every canonical term
 * and alias, longest names first, outside definition lines and fenced code. Upper-case tokens
 * that resolve to nothing are reported once per file as INFO "possibly undefined term".</p>
 *
 * <p>References are returned sorted by source file and line number.</p>
 */
public class CrossReferenceValidator {

    public static final String RULE_NAME = "cross_reference";
    public static final String UNDEFINED_TERM_RULE = "undefined_term";

    private static final Logger log = LoggerFactory.getLogger(CrossReferenceValidator.class);

    private static final String WORD_BEFORE = "(?<![\\p{L}\\p{Nd}_])";
    private static final String WORD_AFTER = "(?![\\p{L}\\p{Nd}_])";

    private final ValidationConfig config;
    private final Set<String> stoplist;

    public CrossReferenceValidator(ValidationConfig config) {
        this.config = config;
        this.stoplist = new HashSet<>(config.undefinedTermStoplist());
    }

    /**
     * Validates all links and term usages of a corpus.
     *
     * @param files parsed files in corpus order
     * @param index term index of the run
     * @return sorted references, findings and the link graph
     */
    public CrossReferenceReport validate(List<DocumentationFile> files, TermIndex index) {
        DocumentGraph.Builder graph = DocumentGraph.builder();
        Map<String, DocumentationFile> byFileName = new LinkedHashMap<>();
        for (DocumentationFile file : files) {
            graph.addNode(file.path().toString());
            byFileName.putIfAbsent(file.fileName(), file);
        }

        Pattern termPattern = buildTermPattern(index);
        List<CrossReference> references = new ArrayList<>();
        List<ValidationResult> findings = new ArrayList<>();

        for (DocumentationFile file : files) {
            String sourceFile = file.path().toString();

            for (TermDefinition definition : file.definitions()) {
                references.add(CrossReference.definition(
                    definition.term(), sourceFile, definition.lineNumber(), contextOf(file, definition.lineNumber())));
            }

            for (MarkdownLink link : file.links()) {
                if (link.isExternal()) {
                    continue;
                }
                resolveLink(file, link, byFileName, references, findings, graph);
            }

            scanTermUsage(file, index, termPattern, references, findings);
        }

        references.sort(Comparator.comparing(CrossReference::sourceFile)
            .thenComparingInt(CrossReference::lineNumber));

        CrossReferenceReport report = new CrossReferenceReport(references, findings, graph.build());
        log.info("Resolved {} references across {} files ({} broken)",
            references.size(), files.size(), report.brokenReferenceCount());
        return report;
    }

    private void resolveLink(DocumentationFile source, MarkdownLink link, Map<String, DocumentationFile> byFileName,
                             List<CrossReference> references, List<ValidationResult> findings,
                             DocumentGraph.Builder graph) {
        String sourceFile = source.path().toString();
        String context = contextOf(source, link.lineNumber());
        DocumentationFile target = link.isSelfReference() ? source : byFileName.get(fileNameOf(link.filePart()));

        if (target == null) {
            log.debug("Broken link in {}:{} -> {}", source.fileName(), link.lineNumber(), link.target());
            references.add(CrossReference.link(link.target(), sourceFile, link.lineNumber(), context, false, null));
            findings.add(ValidationResult.error(
                sourceFile,
                RULE_NAME,
                "Broken link to " + link.filePart() + ": file not found in documentation set",
                link.lineNumber(),
                "Fix the link target or add " + fileNameOf(link.filePart()) + " to the documentation set"
            ));
            return;
        }

        String targetFile = target.path().toString();
        graph.addEdge(sourceFile, targetFile);

        if (link.hasAnchor() && !hasHeading(target, link.anchor())) {
            references.add(CrossReference.link(link.target(), sourceFile, link.lineNumber(), context, false, targetFile));
            findings.add(ValidationResult.warning(
                sourceFile,
                RULE_NAME,
                "Broken anchor in link to " + link.target() + ": no matching heading in " + target.fileName(),
                link.lineNumber(),
                "Link to an existing heading of " + target.fileName()
            ));
            return;
        }

        references.add(CrossReference.link(link.target(), sourceFile, link.lineNumber(), context, true, targetFile));
    }

    private void scanTermUsage(DocumentationFile file, TermIndex index, Pattern termPattern,
                               List<CrossReference> references, List<ValidationResult> findings) {
        String sourceFile = file.path().toString();
        Set<Integer> definitionLines = file.definitions().stream()
            .map(TermDefinition::lineNumber)
            .collect(Collectors.toSet());
        Map<String, UndefinedUsage> undefined = new LinkedHashMap<>();

        List<String> lines = file.lines();
        for (int i = 0; i < lines.size(); i++) {
            int lineNumber = i + 1;
            if (file.isInCodeBlock(lineNumber) || definitionLines.contains(lineNumber)) {
                continue;
            }
            String line = lines.get(i);
            String context = line.strip();
            List<int[]> knownSpans = new ArrayList<>();

            if (termPattern != null) {
                Matcher matcher = termPattern.matcher(line);
                while (matcher.find()) {
                    String token = matcher.group();
                    String canonical = index.lookup(token).map(TerminologyEntry::term).orElse(null);
                    references.add(CrossReference.termUsage(token, sourceFile, lineNumber, context, canonical));
                    knownSpans.add(new int[] {matcher.start(), matcher.end()});
                }
            }

            Matcher candidates = MarkdownPatterns.UPPER_CASE_TOKEN.matcher(line);
            while (candidates.find()) {
                String token = candidates.group();
                if (overlaps(knownSpans, candidates.start(), candidates.end()) || !isUndefinedCandidate(token, index)) {
                    continue;
                }
                references.add(CrossReference.termUsage(token, sourceFile, lineNumber, context, null));
                undefined.computeIfAbsent(token, key -> new UndefinedUsage(lineNumber)).count++;
            }

            Matcher code = MarkdownPatterns.INLINE_CODE.matcher(line);
            while (code.find()) {
                String command = MarkdownPatterns.normalizeWhitespace(code.group("code"));
                if (isCliCommand(command) && !index.contains(command)) {
                    references.add(CrossReference.termUsage(command, sourceFile, lineNumber, context, null));
                    undefined.computeIfAbsent(command, key -> new UndefinedUsage(lineNumber)).count++;
                }
            }
        }

        undefined.forEach((token, usage) -> findings.add(ValidationResult.info(
            sourceFile,
            UNDEFINED_TERM_RULE,
            "Possibly undefined term " + token + " (" + usage.count
                + (usage.count == 1 ? " occurrence)" : " occurrences)"),
            usage.firstLine
        )));
    }

    private boolean isUndefinedCandidate(String token, TermIndex index) {
        return token.length() >= config.minUndefinedTermLength()
            && !stoplist.contains(token)
            && !index.contains(token);
    }

    private boolean isCliCommand(String text) {
        String prefix = config.cliCommandPrefix();
        return !prefix.isEmpty() && text.toLowerCase(Locale.ROOT).startsWith(prefix.toLowerCase(Locale.ROOT))
            && text.length() > prefix.length();
    }

    /**
     * Matches an anchor against the target's headings: the slug, the lower-cased heading text,
     * or the slug of the anchor itself.
     */
    static boolean hasHeading(DocumentationFile target, String anchor) {
        String lower = anchor.toLowerCase(Locale.ROOT);
        String slug = MarkdownPatterns.slugify(anchor);
        for (Heading heading : target.headings()) {
            if (heading.slug().equals(lower) || heading.slug().equals(slug)
                || heading.text().toLowerCase(Locale.ROOT).equals(lower)) {
                return true;
            }
        }
        return false;
    }

    static Pattern buildTermPattern(TermIndex index) {
        if (index.isEmpty()) {
            return null;
        }
        String alternation = index.names().stream()
            .filter(name -> !name.isBlank())
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        return Pattern.compile(WORD_BEFORE + "(?:" + alternation + ")" + WORD_AFTER);
    }

    private static boolean overlaps(List<int[]> spans, int start, int end) {
        for (int[] span : spans) {
            if (start < span[1] && end > span[0]) {
                return true;
            }
        }
        return false;
    }

    private static String fileNameOf(String filePart) {
        String normalized = filePart.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    private static String contextOf(DocumentationFile file, int lineNumber) {
        List<String> lines = file.lines();
        return lineNumber <= lines.size() ? lines.get(lineNumber - 1).strip() : "";
    }

    private static final class UndefinedUsage {
        private final int firstLine;
        private int count;

        private UndefinedUsage(int firstLine) {
            this.firstLine = firstLine;
        }
    }
}
