package com.agilab.image_archiving;

import com.agilab.image_archiving.model.FailureKind;
import com.agilab.image_archiving.model.MediaKind;
import com.agilab.image_archiving.model.ProcessingOutcome;
import com.agilab.image_archiving.model.ProcessingResult;
import com.agilab.image_archiving.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultAggregatorTest {

    private static final SourceFile FIRST = new SourceFile(Path.of("/photos/a.cr2"), MediaKind.RAW, "cr2");
    private static final SourceFile SECOND = new SourceFile(Path.of("/photos/b.jpg"), MediaKind.IMAGE, "jpg");

    private final ResultAggregator aggregator = new ResultAggregator();

    @Test
    void record_shouldKeepTheFirstOutcomeOfAFile() {
        assertThat(aggregator.record(ProcessingResult.renamed(FIRST, Path.of("/archive/a_001.cr2")))).isTrue();
        assertThat(aggregator.record(ProcessingResult.failed(FIRST, FailureKind.INTERNAL_ERROR, "late"))).isFalse();

        var report = aggregator.toReport(List.of(FIRST), Instant.now(), Instant.now(), false, null);

        assertThat(report.get(FIRST.path()).orElseThrow().outcome()).isEqualTo(ProcessingOutcome.RENAMED);
        assertThat(aggregator.size()).isEqualTo(1);
    }

    @Test
    void toReport_shouldReportUnrecordedInputsAsNotProcessed() {
        // Given
        aggregator.record(ProcessingResult.renamed(FIRST, Path.of("/archive/a_001.cr2")));

        // When
        var report = aggregator.toReport(List.of(FIRST, SECOND), Instant.now(), Instant.now(), true, null);

        // Then
        assertThat(report.size()).isEqualTo(2);
        assertThat(report.cancelled()).isTrue();
        var missing = report.get(SECOND.path()).orElseThrow();
        assertThat(missing.outcome()).isEqualTo(ProcessingOutcome.FAILED);
        assertThat(missing.failureKind()).isEqualTo(FailureKind.NOT_PROCESSED);
        assertThat(report.summary())
                .containsEntry(ProcessingOutcome.RENAMED, 1L)
                .containsEntry(ProcessingOutcome.FAILED, 1L)
                .containsEntry(ProcessingOutcome.RENAMED_AND_CONVERTED, 0L);
    }

    @Test
    void toReport_shouldCarryConversionAbortReason() {
        var report = aggregator.toReport(List.of(), Instant.now(), Instant.now(), false, "dnglab not found");

        assertThat(report.findConversionAbortReason()).hasValue("dnglab not found");
        assertThat(report.all()).isEmpty();
    }
}
