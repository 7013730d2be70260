package com.docvalidator.core.crossref;

import com.docvalidator.core.CorpusTestBase;
import com.docvalidator.core.config.ValidationConfig;
import com.docvalidator.core.model.CrossReference;
import com.docvalidator.core.model.DocumentationFile;
import com.docvalidator.core.model.ReferenceKind;
import com.docvalidator.core.model.Severity;
import com.docvalidator.core.model.ValidationResult;
import com.docvalidator.core.parser.ParseException;
import com.docvalidator.core.terminology.TermIndex;
import com.docvalidator.core.terminology.TerminologyExtractor;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link CrossReferenceValidator}.
 */
class CrossReferenceValidatorTest extends CorpusTestBase {

    private final ValidationConfig config = ValidationConfig.defaults();
    private final CrossReferenceValidator validator = new CrossReferenceValidator(config);

    private CrossReferenceReport validate(Path... files) throws ParseException {
        List<DocumentationFile> parsed = parseAll(files);
        TermIndex index = new TerminologyExtractor(config).extract(parsed).index();
        return validator.validate(parsed, index);
    }

    private static List<CrossReference> ofKind(CrossReferenceReport report, ReferenceKind kind) {
        return report.references().stream().filter(reference -> reference.kind() == kind).toList();
    }

    @Test
    void validate_consistentCorpus_hasNoFindings() throws Exception {
        createValidCorpus();

        CrossReferenceReport report = validate(tempDir.resolve("terminologie.md"), tempDir.resolve("marker.md"));

        assertThat(report.findings()).isEmpty();
        assertThat(report.references()).allMatch(CrossReference::valid);
        assertThat(ofKind(report, ReferenceKind.LINK)).hasSize(2);
        assertThat(ofKind(report, ReferenceKind.DEFINITION)).hasSize(4);
        assertThat(ofKind(report, ReferenceKind.TERM_USAGE))
            .extracting(CrossReference::target)
            .containsExactly("ATO", "SEM", "CLU", "MEMA");
    }

    @Test
    void validate_linkToMissingFile_isErrorNamingTarget() throws Exception {
        Path terminology = createFile("terminologie.md", TERMINOLOGY_COMPLETE);
        Path marker = createFile("marker.md", "# Marker\n\nA [bad link](nonexistent.md) here.\n");

        CrossReferenceReport report = validate(terminology, marker);

        assertThat(report.findings()).hasSize(1);
        ValidationResult finding = report.findings().get(0);
        assertThat(finding.severity()).isEqualTo(Severity.ERROR);
        assertThat(finding.ruleName()).isEqualTo(CrossReferenceValidator.RULE_NAME);
        assertThat(finding.filePath()).isEqualTo(marker.toString());
        assertThat(finding.lineNumber()).isEqualTo(3);
        assertThat(finding.message()).contains("nonexistent.md");
        assertThat(finding.hasSuggestion()).isTrue();

        assertThat(report.brokenLinks()).singleElement()
            .satisfies(link -> {
                assertThat(link.target()).isEqualTo("nonexistent.md");
                assertThat(link.resolvedTo()).isNull();
            });
    }

    @Test
    void validate_linkWithUnknownAnchor_isWarning() throws Exception {
        Path terminology = createFile("terminologie.md", TERMINOLOGY_COMPLETE);
        Path marker = createFile("marker.md", "# Marker\n\nSee [levels](terminologie.md#no-such-heading).\n");

        CrossReferenceReport report = validate(terminology, marker);

        assertThat(report.findings()).singleElement()
            .satisfies(finding -> {
                assertThat(finding.severity()).isEqualTo(Severity.WARNING);
                assertThat(finding.message()).contains("terminologie.md#no-such-heading");
            });
        CrossReference link = ofKind(report, ReferenceKind.LINK).get(0);
        assertThat(link.valid()).isFalse();
        assertThat(link.resolvedTo()).isEqualTo(terminology.toString());
        assertThat(report.graph().outgoing(marker.toString())).containsExactly(terminology.toString());
    }

    @Test
    void validate_anchorMatchesSlugOrHeadingText() throws Exception {
        Path guide = createFile("guide.md", """
            # Guide
            ## Marker Levels
            ## LD-3.4 Compliance
            """);
        Path marker = createFile("marker.md", """
            # Marker
            [a](guide.md#marker-levels) [b](guide.md#Marker-Levels) [c](guide.md#ld-34-compliance)
            [d](#marker) [e](./guide.md#guide)
            """);

        CrossReferenceReport report = validate(guide, marker);

        assertThat(report.findings()).isEmpty();
        assertThat(ofKind(report, ReferenceKind.LINK)).hasSize(5).allMatch(CrossReference::valid);
    }

    @Test
    void validate_relativePathPrefix_resolvesByFileName() throws Exception {
        Path terminology = createFile("terminologie.md", TERMINOLOGY_COMPLETE);
        Path nested = createFile("guides/setup.md", "# Setup\n\nSee [terms](../terminologie.md).\n");

        CrossReferenceReport report = validate(terminology, nested);

        assertThat(report.findings()).isEmpty();
        assertThat(ofKind(report, ReferenceKind.LINK)).singleElement()
            .extracting(CrossReference::resolvedTo)
            .isEqualTo(terminology.toString());
    }

    @Test
    void validate_externalLinks_areNotResolved() throws Exception {
        Path marker = createFile("marker.md", """
            # Marker
            [site](https://example.org/missing.md) [mail](mailto:team@example.org)
            """);

        CrossReferenceReport report = validate(marker);

        assertThat(ofKind(report, ReferenceKind.LINK)).isEmpty();
        assertThat(report.findings()).isEmpty();
    }

    @Test
    void validate_linksWithoutAnchorToCorpusFiles_areAlwaysValid() throws Exception {
        Path a = createFile("a.md", "# A\n[b](b.md) [c](c.md)\n");
        Path b = createFile("b.md", "# B\n[a](a.md) [c](sub/c.md)\n");
        Path c = createFile("sub/c.md", "# C\n[a](../a.md)\n");

        CrossReferenceReport report = validate(a, b, c);

        assertThat(ofKind(report, ReferenceKind.LINK)).hasSize(5).allMatch(CrossReference::valid);
    }

    @Test
    void validate_aliasUsage_resolvesToCanonicalTerm() throws Exception {
        Path terminology = createFile("terminologie.md", """
            # Terminologie
            **ATO_ (Atomic Marker)** · smallest marker unit (aka Atom)
            """);
        Path marker = createFile("marker.md", """
            # Marker
            An ATO is an Atom, also written ATO_ or Atomic Marker.
            """);

        CrossReferenceReport report = validate(terminology, marker);

        assertThat(ofKind(report, ReferenceKind.TERM_USAGE))
            .extracting(CrossReference::target, CrossReference::resolvedTo)
            .containsExactly(
                tuple("ATO", "ATO"),
                tuple("Atom", "ATO"),
                tuple("ATO_", "ATO"),
                tuple("Atomic Marker", "ATO"));
        assertThat(report.findings()).isEmpty();
    }

    @Test
    void validate_termUsage_isCaseSensitiveWholeWord() throws Exception {
        Path terminology = createFile("terminologie.md", TERMINOLOGY_COMPLETE);
        Path marker = createFile("marker.md", "# Marker\n\nNo match in ATOs, sem or MEMA_X; one in (CLU).\n");

        CrossReferenceReport report = validate(terminology, marker);

        assertThat(ofKind(report, ReferenceKind.TERM_USAGE))
            .filteredOn(CrossReference::valid)
            .extracting(CrossReference::target)
            .containsExactly("CLU");
    }

    @Test
    void validate_codeBlocksAndDefinitionLines_areNotScannedForUsage() throws Exception {
        Path terminology = createFile("terminologie.md", TERMINOLOGY_COMPLETE);
        Path marker = createFile("marker.md", """
            # Marker
            ```
            ATO SEM CLU UNKNOWN_CODE
            ```
            **MEMA** · restated here
            """);

        CrossReferenceReport report = validate(terminology, marker);

        assertThat(ofKind(report, ReferenceKind.TERM_USAGE)).isEmpty();
        assertThat(ofKind(report, ReferenceKind.DEFINITION))
            .filteredOn(reference -> reference.sourceFile().equals(marker.toString()))
            .extracting(CrossReference::target, CrossReference::lineNumber)
            .containsExactly(tuple("MEMA", 5));
    }

    @Test
    void validate_undefinedUpperCaseToken_isReportedOncePerFileAsInfo() throws Exception {
        Path terminology = createFile("terminologie.md", TERMINOLOGY_COMPLETE);
        Path marker = createFile("marker.md", """
            # Marker
            Uses UNKNOWN_MARKER with JSON and LD.
            Again UNKNOWN_MARKER here.
            """);

        CrossReferenceReport report = validate(terminology, marker);

        assertThat(report.findings()).singleElement()
            .satisfies(finding -> {
                assertThat(finding.severity()).isEqualTo(Severity.INFO);
                assertThat(finding.ruleName()).isEqualTo(CrossReferenceValidator.UNDEFINED_TERM_RULE);
                assertThat(finding.message()).contains("UNKNOWN_MARKER").contains("2 occurrences");
                assertThat(finding.lineNumber()).isEqualTo(2);
            });
        assertThat(ofKind(report, ReferenceKind.TERM_USAGE))
            .extracting(CrossReference::target, CrossReference::valid)
            .containsExactly(
                tuple("UNKNOWN_MARKER", false),
                tuple("UNKNOWN_MARKER", false));
    }

    @Test
    void validate_cliCommands_resolveAgainstIndex() throws Exception {
        Path terminology = createFile("terminologie.md", """
            # Terminologie
            **me analyze** · runs the analysis
            """);
        Path marker = createFile("marker.md", "# Marker\nRun `me analyze` first, then `me export`.\n");

        CrossReferenceReport report = validate(terminology, marker);

        assertThat(ofKind(report, ReferenceKind.TERM_USAGE))
            .extracting(CrossReference::target, CrossReference::valid)
            .containsExactly(
                tuple("me analyze", true),
                tuple("me export", false));
        assertThat(report.findings()).singleElement()
            .extracting(ValidationResult::message)
            .asString()
            .contains("me export");
    }

    @Test
    void validate_referencesAreSortedByFileAndLine() throws Exception {
        Path terminology = createFile("terminologie.md", TERMINOLOGY_COMPLETE);
        Path marker = createFile("marker.md", MARKER_VALID);

        CrossReferenceReport report = validate(terminology, marker);

        List<CrossReference> references = report.references();
        for (int i = 1; i < references.size(); i++) {
            CrossReference previous = references.get(i - 1);
            CrossReference current = references.get(i);
            int byFile = previous.sourceFile().compareTo(current.sourceFile());
            assertThat(byFile < 0 || (byFile == 0 && previous.lineNumber() <= current.lineNumber()))
                .as("%s before %s", previous, current)
                .isTrue();
        }
    }

    @Test
    void validate_buildsDocumentGraph() throws Exception {
        Path a = createFile("a.md", "# A\n[b](b.md) [b again](b.md#b) [self](#a)\n");
        Path b = createFile("b.md", "# B\n[a](a.md)\n");
        Path c = createFile("c.md", "# C\n[b](b.md)\n");

        DocumentGraph graph = validate(a, b, c).graph();

        assertThat(graph.nodes()).containsExactly(a.toString(), b.toString(), c.toString());
        assertThat(graph.edgeCount()).isEqualTo(3);
        assertThat(graph.incoming(b.toString())).containsExactly(a.toString(), c.toString());
        assertThat(graph.orphans()).containsExactly(c.toString());
        assertThat(graph.cycles()).containsExactly(List.of(a.toString(), b.toString()));
    }
}
