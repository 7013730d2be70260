package com.docvalidator.core.terminology;

import com.docvalidator.core.model.TerminologyEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable index of defined terms: canonical term to {@link TerminologyEntry}, plus
 * alias lookup.
 *
 * <p>Iteration order is the order in which terms were first defined, which makes the
 * index deterministic for a fixed corpus. Canonical names take precedence over aliases
 * during {@link #lookup(String)}.</p>
 */
public final class TermIndex {

    private static final TermIndex EMPTY = new TermIndex(Map.of(), Map.of());

    private final Map<String, TerminologyEntry> entries;
    private final Map<String, String> aliasToTerm;

    private TermIndex(Map<String, TerminologyEntry> entries, Map<String, String> aliasToTerm) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        this.aliasToTerm = Collections.unmodifiableMap(new LinkedHashMap<>(aliasToTerm));
    }

    public static TermIndex empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves a token to its entry. Canonical terms win over aliases.
     *
     * @param token case-sensitive token
     * @return the entry the token names, if any
     */
    public Optional<TerminologyEntry> lookup(String token) {
        TerminologyEntry entry = entries.get(token);
        if (entry != null) {
            return Optional.of(entry);
        }
        String canonical = aliasToTerm.get(token);
        return canonical == null ? Optional.empty() : Optional.ofNullable(entries.get(canonical));
    }

    public Optional<TerminologyEntry> get(String canonicalTerm) {
        return Optional.ofNullable(entries.get(canonicalTerm));
    }

    public boolean contains(String token) {
        return lookup(token).isPresent();
    }

    /**
     * Returns every name the index resolves: canonical terms first, then aliases.
     *
     * @return resolvable names in index order
     */
    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>(entries.keySet());
        names.addAll(aliasToTerm.keySet());
        return names;
    }

    public List<TerminologyEntry> entries() {
        return new ArrayList<>(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Mutable builder used during the single extraction pass.
     */
    public static final class Builder {
        private final Map<String, TerminologyEntry> entries = new LinkedHashMap<>();
        private final Map<String, String> aliasToTerm = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds or replaces an entry. A replaced entry keeps its position; its old aliases
         * are dropped.
         *
         * @param entry entry to store
         * @return the entry that was replaced, if any
         */
        public Optional<TerminologyEntry> put(TerminologyEntry entry) {
            TerminologyEntry previous = entries.put(entry.term(), entry);
            if (previous != null) {
                previous.aliases().forEach(alias -> aliasToTerm.remove(alias, previous.term()));
            }
            for (String alias : entry.aliases()) {
                aliasToTerm.put(alias, entry.term());
            }
            return Optional.ofNullable(previous);
        }

        public Optional<TerminologyEntry> get(String term) {
            return Optional.ofNullable(entries.get(term));
        }

        public TermIndex build() {
            return entries.isEmpty() ? EMPTY : new TermIndex(entries, aliasToTerm);
        }
    }
}
