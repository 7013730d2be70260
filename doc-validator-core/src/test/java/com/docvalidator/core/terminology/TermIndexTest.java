package com.docvalidator.core.terminology;

import com.docvalidator.core.model.TermCategory;
import com.docvalidator.core.model.TerminologyEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TermIndex}.
 */
class TermIndexTest {

    private static TerminologyEntry entry(String term, String definition, String... aliases) {
        return new TerminologyEntry(term, definition, List.of(aliases), TermCategory.GENERAL, "terminologie.md", 1);
    }

    @Test
    void lookup_canonicalTermWinsOverAlias() {
        TermIndex.Builder builder = TermIndex.builder();
        builder.put(entry("CLU", "cluster", "SEM"));
        builder.put(entry("SEM", "semantic"));

        TermIndex index = builder.build();

        assertThat(index.lookup("SEM").orElseThrow().definition()).isEqualTo("semantic");
    }

    @Test
    void put_replacement_keepsPositionAndDropsOldAliases() {
        TermIndex.Builder builder = TermIndex.builder();
        builder.put(entry("ATO", "old", "Atom"));
        builder.put(entry("SEM", "semantic"));

        assertThat(builder.put(entry("ATO", "new", "Atomic"))).isPresent();
        TermIndex index = builder.build();

        assertThat(index.entries()).extracting(TerminologyEntry::term).containsExactly("ATO", "SEM");
        assertThat(index.lookup("Atom")).isEmpty();
        assertThat(index.lookup("Atomic").orElseThrow().definition()).isEqualTo("new");
    }

    @Test
    void names_listsCanonicalTermsBeforeAliases() {
        TermIndex.Builder builder = TermIndex.builder();
        builder.put(entry("ATO", "atomic", "Atom"));
        builder.put(entry("SEM", "semantic"));

        assertThat(builder.build().names()).containsExactly("ATO", "SEM", "Atom");
    }

    @Test
    void empty_hasNoEntries() {
        assertThat(TermIndex.empty().isEmpty()).isTrue();
        assertThat(TermIndex.builder().build().size()).isZero();
        assertThat(TermIndex.empty().lookup("ATO")).isEmpty();
    }
}
