package com.docvalidator.core.parser;

import java.nio.file.Path;

/**
 * Thrown when a documentation file cannot be read at all.
 *
 * <p>Invalid byte sequences are not a parse failure: they are replaced and reported on the
 * parsed file instead (see {@link com.docvalidator.core.model.DocumentationFile#encodingNotice()}).</p>
 */
public class ParseException extends Exception {

    /**
     * Cause category of a parse failure.
     */
    public enum Kind {
        /** The path does not exist or is not a regular file. */
        NOT_FOUND,
        /** The file exists but reading it failed. */
        UNREADABLE
    }

    private final Path path;
    private final Kind kind;

    public ParseException(Path path, Kind kind, String message) {
        super(message);
        this.path = path;
        this.kind = kind;
    }

    public ParseException(Path path, Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
        this.kind = kind;
    }

    public Path getPath() {
        return path;
    }

    public Kind getKind() {
        return kind;
    }
}
