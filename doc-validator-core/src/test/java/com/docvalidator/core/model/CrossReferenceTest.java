package com.docvalidator.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CrossReference} and {@link MarkdownLink}.
 */
class CrossReferenceTest {

    @Test
    void termUsage_validityFollowsResolution() {
        assertThat(CrossReference.termUsage("Atom", "a.md", 1, "", "ATO").valid()).isTrue();
        assertThat(CrossReference.termUsage("FOO_BAR", "a.md", 1, "", null).valid()).isFalse();
        assertThat(CrossReference.definition("ATO", "a.md", 1, "").valid()).isTrue();
    }

    @Test
    void constructor_rejectsZeroLineNumber() {
        assertThatThrownBy(() -> CrossReference.definition("ATO", "a.md", 0, ""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void contextPreview_cutsOnWordBoundary() {
        CrossReference reference = CrossReference.termUsage("SEM", "a.md", 1,
            "Each semantic marker combines several atomic markers into one meaningful unit of analysis", "SEM");

        String preview = reference.contextPreview(50);

        assertThat(preview).endsWith("...");
        assertThat(preview.length()).isLessThanOrEqualTo(53);
        assertThat(preview).isEqualTo("Each semantic marker combines several atomic...");
    }

    @Test
    void contextPreview_shortContext_isUnchanged() {
        CrossReference reference = CrossReference.termUsage("SEM", "a.md", 1, "A SEM", "SEM");

        assertThat(reference.contextPreview(50)).isEqualTo("A SEM");
    }

    @Test
    void markdownLink_splitsFileAndAnchor() {
        MarkdownLink link = MarkdownLink.of("levels", "terminologie.md#marker-levels", 4);
        MarkdownLink trailingHash = MarkdownLink.of("t", "terminologie.md#", 4);

        assertThat(link.filePart()).isEqualTo("terminologie.md");
        assertThat(link.anchor()).isEqualTo("marker-levels");
        assertThat(link.hasAnchor()).isTrue();
        assertThat(trailingHash.hasAnchor()).isFalse();
        assertThat(MarkdownLink.of("x", "http://example.org/a#b", 1).isExternal()).isTrue();
    }
}
