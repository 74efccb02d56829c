package com.agilab.image_archiving.util;

import com.agilab.image_archiving.model.FinalReport;
import com.agilab.image_archiving.model.ProcessingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Human-readable descriptions and logging of file outcomes.
 */
@Slf4j
@Component
public class ProcessingResultHandler {

    public String describe(ProcessingResult result) {
        var source = result.source().path();
        return switch (result.outcome()) {
            case RENAMED -> String.format("Renamed '%s' to %s", source, result.target());
            case RENAMED_AND_CONVERTED -> String.format("Renamed '%s' to %s and converted to %s",
                    source, result.target(), result.convertedTarget());
            case PLANNED -> String.format("Would rename '%s' to %s", source, result.target());
            case FAILED -> String.format("Failed to process '%s': %s (%s)",
                    source, result.reason(), result.failureKind());
        };
    }

    public void logResult(ProcessingResult result) {
        if (result.isFailure()) {
            log.error("{}", describe(result));
        } else {
            log.info("{}", describe(result));
        }
    }

    public void logSummary(FinalReport report) {
        log.info("Archive run finished: {} files, {}", report.size(), report.summary());
        report.findConversionAbortReason()
                .ifPresent(reason -> log.error("DNG conversion was aborted: {}", reason));
        if (report.cancelled()) {
            log.warn("The run was cancelled; unprocessed files are listed as NOT_PROCESSED");
        }
        report.failures().forEach(failure -> log.warn("{}", describe(failure)));
    }
}
