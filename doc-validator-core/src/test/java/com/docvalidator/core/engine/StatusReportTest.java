package com.docvalidator.core.engine;

import com.docvalidator.core.CorpusTestBase;
import com.docvalidator.core.model.FileStatus;
import com.docvalidator.core.model.ValidationStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link StatusReport}.
 */
class StatusReportTest extends CorpusTestBase {

    @Test
    void from_validCorpus_collectsStatistics() throws Exception {
        createValidCorpus();
        createFile("a.md", "# A\n\nSee [b](b.md) for the rest of the chapter and the [pipeline](marker.md).\n");
        createFile("b.md", "# B\n\nBack to [a](a.md).\n");
        ValidationReport report = new ValidationEngine().validateDirectory(tempDir, ValidationOptions.defaults());

        StatusReport status = StatusReport.from(report);

        assertThat(status.files()).hasSize(4);
        assertThat(status.statistics().totalFiles()).isEqualTo(4);
        assertThat(status.statistics().totalTerms()).isEqualTo(4);
        assertThat(status.statistics().brokenReferences()).isZero();
        assertThat(status.statistics().linkEdges()).isEqualTo(4);
        assertThat(status.statistics().linkCycles()).isEqualTo(1);
        assertThat(status.statistics().orphanFiles()).isEmpty();
    }

    @Test
    void overallStatus_anyInvalidFileWins() {
        assertThat(StatusReport.overallStatus(List.of(
            status(ValidationStatus.VALID), status(ValidationStatus.INVALID), status(ValidationStatus.NOT_VALIDATED))))
            .isEqualTo(ValidationStatus.INVALID);
    }

    @Test
    void overallStatus_validWhenSomeFileValidated() {
        assertThat(StatusReport.overallStatus(List.of(status(ValidationStatus.VALID), status(ValidationStatus.NOT_VALIDATED))))
            .isEqualTo(ValidationStatus.VALID);
    }

    @Test
    void overallStatus_noFiles_isNotValidated() {
        assertThat(StatusReport.overallStatus(List.of())).isEqualTo(ValidationStatus.NOT_VALIDATED);
    }

    private static FileStatus status(ValidationStatus value) {
        return new FileStatus("/docs/x.md", "x.md", value, Instant.EPOCH, null, 0, 0);
    }
}
