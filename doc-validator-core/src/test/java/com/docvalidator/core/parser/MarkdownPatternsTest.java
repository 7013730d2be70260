package com.docvalidator.core.parser;

import org.junit.jupiter.api.Test;

import java.util.regex.Matcher;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MarkdownPatterns}.
 */
class MarkdownPatternsTest {

    @Test
    void heading_matchesAtxHeadingsOnly() {
        Matcher matcher = MarkdownPatterns.HEADING.matcher("### Stage Three ###");

        assertThat(matcher.matches()).isTrue();
        assertThat(matcher.group(1)).isEqualTo("###");
        assertThat(matcher.group(2)).isEqualTo("Stage Three");
        assertThat(MarkdownPatterns.HEADING.matcher("#NoSpace").matches()).isFalse();
        assertThat(MarkdownPatterns.HEADING.matcher("####### Seven").matches()).isFalse();
    }

    @Test
    void slugify_lowercasesStripsPunctuationAndHyphenates() {
        assertThat(MarkdownPatterns.slugify("Marker Levels")).isEqualTo("marker-levels");
        assertThat(MarkdownPatterns.slugify("LD-3.4 Compliance!")).isEqualTo("ld-34-compliance");
        assertThat(MarkdownPatterns.slugify("  Übersicht   der Marker ")).isEqualTo("übersicht-der-marker");
    }

    @Test
    void upperCaseToken_matchesWholeIdentifiersOnly() {
        Matcher matcher = MarkdownPatterns.UPPER_CASE_TOKEN.matcher("SEM_TRUST_LOW and Mixed and ATO_ and X1");

        assertThat(matcher.find()).isTrue();
        assertThat(matcher.group()).isEqualTo("SEM_TRUST_LOW");
        assertThat(matcher.find()).isTrue();
        assertThat(matcher.group()).isEqualTo("X1");
        assertThat(matcher.find()).isFalse();
    }

    @Test
    void fenceOf_detectsBacktickAndTildeFences() {
        assertThat(MarkdownPatterns.fenceOf("```java")).isEqualTo("```");
        assertThat(MarkdownPatterns.fenceOf("~~~~")).isEqualTo("~~~~");
        assertThat(MarkdownPatterns.fenceOf("text ```")).isNull();
    }

    @Test
    void splitAliases_trimsAndDropsEmptyEntries() {
        assertThat(MarkdownPatterns.splitAliases(" Atom , ,Atomic ")).containsExactly("Atom", "Atomic");
    }
}
