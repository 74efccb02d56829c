package com.agilab.image_archiving.report;

import com.agilab.image_archiving.model.FinalReport;
import com.agilab.image_archiving.model.ProcessingOutcome;
import com.agilab.image_archiving.model.ProcessingResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes a {@link FinalReport} as JSON. Files are listed sorted by source path.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReportWriter {

    private final ObjectMapper objectMapper;

    public void write(FinalReport report, Path reportFile) throws IOException {
        var parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(reportFile.toFile(), toDocument(report));
        log.info("Report with {} files written to {}", report.size(), reportFile);
    }

    public ReportDocument toDocument(FinalReport report) {
        var files = report.all().stream()
                .sorted(Comparator.comparing(result -> result.source().path()))
                .map(ReportWriter::toEntry)
                .toList();
        return new ReportDocument(
                report.startedAt(),
                report.finishedAt(),
                report.cancelled(),
                report.conversionAbortReason(),
                report.summary(),
                files);
    }

    private static FileEntry toEntry(ProcessingResult result) {
        return new FileEntry(
                result.source().path().toString(),
                result.source().kind().name(),
                result.outcome().name(),
                Objects.toString(result.target(), null),
                Objects.toString(result.convertedTarget(), null),
                result.failureKind() == null ? null : result.failureKind().name(),
                result.reason());
    }

    public record ReportDocument(Instant startedAt,
                                 Instant finishedAt,
                                 boolean cancelled,
                                 String conversionAbortReason,
                                 Map<ProcessingOutcome, Long> summary,
                                 List<FileEntry> files) {
    }

    public record FileEntry(String source,
                            String kind,
                            String outcome,
                            String target,
                            String converted,
                            String failureKind,
                            String reason) {
    }
}
