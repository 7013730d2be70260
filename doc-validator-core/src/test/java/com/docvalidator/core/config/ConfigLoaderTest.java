package com.docvalidator.core.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link ConfigLoader} and {@link ValidationConfig}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_missingFile_returnsDefaults() {
        ValidationConfig config = ConfigLoader.load(tempDir.resolve(ConfigLoader.DEFAULT_CONFIG_FILE));

        assertThat(config).isEqualTo(ValidationConfig.defaults());
        assertThat(config.minContentLength()).isEqualTo(100);
        assertThat(config.requiredTerms()).containsExactly("ATO", "SEM", "CLU", "MEMA");
        assertThat(config.complianceKeyword()).isEqualTo("LD-3.4");
        assertThat(config.reportOrphanFiles()).isFalse();
    }

    @Test
    void load_missingExplicitFile_warnsAndReturnsDefaults() {
        Logger logger = (Logger) LoggerFactory.getLogger(ConfigLoader.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            Path typo = tempDir.resolve("docvalidatr.yaml");

            assertThat(ConfigLoader.load(typo, true)).isEqualTo(ValidationConfig.defaults());
            assertThat(ConfigLoader.load(tempDir.resolve(ConfigLoader.DEFAULT_CONFIG_FILE), false))
                .isEqualTo(ValidationConfig.defaults());

            assertThat(appender.list)
                .extracting(ILoggingEvent::getLevel, ILoggingEvent::getFormattedMessage)
                .containsExactly(tuple(Level.WARN, "Configuration file not found: " + typo + ". Using defaults."));
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void load_partialFile_overridesOnlyGivenKeys() throws Exception {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_CONFIG_FILE);
        Files.writeString(configFile, """
            minContentLength: 250
            requiredTerms: [ATO, SEM]
            reportOrphanFiles: true
            someFutureKey: ignored
            """);

        ValidationConfig config = ConfigLoader.load(configFile);

        assertThat(config.minContentLength()).isEqualTo(250);
        assertThat(config.requiredTerms()).containsExactly("ATO", "SEM");
        assertThat(config.reportOrphanFiles()).isTrue();
        assertThat(config.complianceKeyword()).isEqualTo(ValidationConfig.DEFAULT_COMPLIANCE_KEYWORD);
        assertThat(config.undefinedTermStoplist()).isEqualTo(ValidationConfig.DEFAULT_STOPLIST);
    }

    @Test
    void load_malformedYaml_returnsDefaults() throws Exception {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_CONFIG_FILE);
        Files.writeString(configFile, "minContentLength: [not, a, number\n");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ValidationConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws Exception {
        Path configFile = Files.writeString(tempDir.resolve(ConfigLoader.DEFAULT_CONFIG_FILE), "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ValidationConfig.defaults());
    }

    @Test
    void fileNames_matchWholeBaseNameCaseInsensitively() {
        ValidationConfig config = ValidationConfig.defaults();

        assertThat(config.isTerminologyFile("terminologie")).isTrue();
        assertThat(config.isTerminologyFile("Glossary")).isTrue();
        assertThat(config.isTerminologyFile("glossary-draft")).isFalse();
        assertThat(config.isComplianceFile("MARKER")).isTrue();
        assertThat(config.isComplianceFile("markers-faq")).isFalse();
        assertThat(config.isComplianceFile("readme")).isFalse();
    }

    @Test
    void effectiveParallelism_defaultsToBoundedProcessorCount() {
        assertThat(ValidationConfig.defaults().effectiveParallelism()).isBetween(1, 4);
        assertThat(ValidationConfig.defaults().withRequiredTerms(null).requiredTerms())
            .isEqualTo(ValidationConfig.DEFAULT_REQUIRED_TERMS);
    }
}
