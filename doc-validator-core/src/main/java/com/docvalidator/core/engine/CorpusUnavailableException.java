package com.docvalidator.core.engine;

import java.nio.file.Path;

/**
 * Thrown when no validation is possible at all: the corpus root is missing or not a single
 * file of the corpus could be read. Every other problem is reported as a finding.
 */
public class CorpusUnavailableException extends Exception {

    private final Path location;

    public CorpusUnavailableException(Path location, String message) {
        super(message);
        this.location = location;
    }

    /**
     * Returns the corpus root or first corpus path, {@code null} for an empty path list.
     *
     * @return offending location
     */
    public Path getLocation() {
        return location;
    }
}
