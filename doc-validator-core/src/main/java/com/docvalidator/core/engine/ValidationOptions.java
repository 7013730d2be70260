package com.docvalidator.core.engine;

import com.docvalidator.core.config.ValidationConfig;

import java.nio.file.Path;
import java.util.List;

/**
 * Options of a single validation run.
 *
 * @param strict escalate structural and completeness warnings to errors; any warning fails the run
 * @param targetFiles files to report on; empty means the whole corpus
 * @param config rule configuration
 */
public record ValidationOptions(
    boolean strict,
    List<Path> targetFiles,
    ValidationConfig config
) {
    public ValidationOptions {
        targetFiles = targetFiles == null
            ? List.of()
            : targetFiles.stream().map(path -> path.toAbsolutePath().normalize()).toList();
        if (config == null) {
            config = ValidationConfig.defaults();
        }
    }

    /**
     * Non-strict run over the whole corpus with the built-in configuration.
     *
     * @return default options
     */
    public static ValidationOptions defaults() {
        return new ValidationOptions(false, List.of(), ValidationConfig.defaults());
    }

    public ValidationOptions withStrict(boolean value) {
        return new ValidationOptions(value, targetFiles, config);
    }

    public ValidationOptions withTargetFiles(List<Path> files) {
        return new ValidationOptions(strict, files, config);
    }

    public ValidationOptions withConfig(ValidationConfig value) {
        return new ValidationOptions(strict, targetFiles, value);
    }

    public boolean hasTargetFiles() {
        return !targetFiles.isEmpty();
    }
}
