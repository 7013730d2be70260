package com.docvalidator.cli;

import com.docvalidator.core.config.ConfigLoader;
import com.docvalidator.core.config.ValidationConfig;
import com.docvalidator.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Options that locate the corpus and its configuration, shared by all commands as a mixin.
 *
 * <p>Without {@code --root} the first existing directory among the configured candidates
 * ({@code docs}, {@code demo-docs}, {@code test-docs}) below the working directory is used,
 * otherwise the working directory itself. Without {@code --config},
 * {@value ConfigLoader#DEFAULT_CONFIG_FILE} is looked up in the working directory, then in the
 * documentation root.</p>
 */
public class CorpusOptions {

    private static final Logger log = LoggerFactory.getLogger(CorpusOptions.class);

    @Option(
        names = {"-r", "--root"},
        description = "Documentation root directory (default: docs, demo-docs or test-docs if present)"
    )
    private Path root;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: " + ConfigLoader.DEFAULT_CONFIG_FILE + ")"
    )
    private Path configPath;

    private final Path workingDirectory = Path.of("").toAbsolutePath();

    /**
     * Loads the configuration; missing or invalid files yield the defaults.
     *
     * @return configuration
     */
    public ValidationConfig loadConfig() {
        if (configPath != null) {
            return ConfigLoader.load(workingDirectory.resolve(configPath), true);
        }
        Path inWorkingDirectory = workingDirectory.resolve(ConfigLoader.DEFAULT_CONFIG_FILE);
        if (Files.exists(inWorkingDirectory) || root == null) {
            return ConfigLoader.load(inWorkingDirectory);
        }
        return ConfigLoader.load(workingDirectory.resolve(root).resolve(ConfigLoader.DEFAULT_CONFIG_FILE));
    }

    /**
     * Resolves the documentation root.
     *
     * @param config active configuration
     * @return absolute documentation root
     */
    public Path resolveRoot(ValidationConfig config) {
        Path resolved = root != null
            ? workingDirectory.resolve(root)
            : FileUtils.resolveDocsRoot(workingDirectory, config.docsDirectoryCandidates());
        resolved = resolved.toAbsolutePath().normalize();
        log.debug("Documentation root: {}", resolved);
        return resolved;
    }

    public Path resolve(Path path) {
        return workingDirectory.resolve(path).toAbsolutePath().normalize();
    }
}
