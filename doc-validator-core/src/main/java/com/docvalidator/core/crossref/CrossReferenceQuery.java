package com.docvalidator.core.crossref;

import com.docvalidator.core.model.CrossReference;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Read-only filter over a reference list, used by the {@code cross-ref} projection.
 *
 * <p>The term filter is a case-insensitive substring match on the reference target or the
 * term it resolved to. The file filter matches the source path or its file name.</p>
 *
 * @param term term filter, or {@code null}
 * @param file source file filter, or {@code null}
 */
public record CrossReferenceQuery(String term, String file) {

    public static CrossReferenceQuery all() {
        return new CrossReferenceQuery(null, null);
    }

    public List<CrossReference> apply(List<CrossReference> references) {
        return references.stream().filter(asPredicate()).toList();
    }

    public Predicate<CrossReference> asPredicate() {
        Predicate<CrossReference> predicate = reference -> true;
        if (term != null && !term.isBlank()) {
            String needle = term.toLowerCase(Locale.ROOT);
            predicate = predicate.and(reference -> containsIgnoreCase(reference.target(), needle)
                || containsIgnoreCase(reference.resolvedTo(), needle));
        }
        if (file != null && !file.isBlank()) {
            predicate = predicate.and(reference -> matchesFile(reference.sourceFile()));
        }
        return predicate;
    }

    private boolean matchesFile(String sourceFile) {
        if (sourceFile.equals(file) || sourceFile.endsWith(file)) {
            return true;
        }
        Path fileName = Path.of(sourceFile).getFileName();
        Path wanted = Path.of(file).getFileName();
        return fileName != null && wanted != null && fileName.toString().equals(wanted.toString());
    }

    private static boolean containsIgnoreCase(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
