package com.docvalidator.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-file outcome of a validation run, including files that failed to parse.
 *
 * @param path file path as given to the engine
 * @param name file name
 * @param status validation status
 * @param lastModified last modification time, {@code null} if unknown
 * @param lastValidated completion time of the run, {@code null} if not validated
 * @param errors number of ERROR findings for this file
 * @param warnings number of WARNING findings for this file
 */
public record FileStatus(
    String path,
    String name,
    ValidationStatus status,
    Instant lastModified,
    Instant lastValidated,
    int errors,
    int warnings
) {
    public FileStatus {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }
}
