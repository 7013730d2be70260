package com.docvalidator.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Change-detection metadata of a file.
 *
 * @param sizeBytes file size in bytes
 * @param lastModified last modification time
 * @param contentHash first 16 hex characters of the SHA-256 of the raw bytes
 */
public record FileFingerprint(
    long sizeBytes,
    Instant lastModified,
    String contentHash
) {
    public FileFingerprint {
        Objects.requireNonNull(lastModified, "lastModified must not be null");
        Objects.requireNonNull(contentHash, "contentHash must not be null");
    }
}
