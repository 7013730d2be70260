package com.docvalidator.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A bold-term definition line as found in a file: {@code **TERM** · definition text}.
 *
 * @param term canonical term
 * @param definition definition text, alias declarations removed
 * @param aliases aliases declared on the line
 * @param lineNumber 1-based line number
 */
public record TermDefinition(
    String term,
    String definition,
    List<String> aliases,
    int lineNumber
) {
    /**
     * Compact constructor with validation.
     */
    public TermDefinition {
        Objects.requireNonNull(term, "term must not be null");
        Objects.requireNonNull(definition, "definition must not be null");
        if (term.isBlank()) {
            throw new IllegalArgumentException("term must not be blank");
        }
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
}
