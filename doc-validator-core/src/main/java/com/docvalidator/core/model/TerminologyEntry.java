package com.docvalidator.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One defined term of the terminology index.
 *
 * @param term canonical term (case-sensitive, unique within an index)
 * @param definition definition text
 * @param aliases alternative names resolving to this entry
 * @param category term category
 * @param sourceFile path of the file holding the winning definition
 * @param lineNumber 1-based line of the winning definition
 */
public record TerminologyEntry(
    String term,
    String definition,
    List<String> aliases,
    TermCategory category,
    String sourceFile,
    int lineNumber
) {
    /**
     * Compact constructor with validation.
     */
    public TerminologyEntry {
        Objects.requireNonNull(term, "term must not be null");
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(category, "category must not be null");
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    /**
     * Returns true if the token names this entry, either canonically or through an alias.
     *
     * @param token case-sensitive token
     * @return true on a match
     */
    public boolean isNamedBy(String token) {
        return term.equals(token) || aliases.contains(token);
    }
}
