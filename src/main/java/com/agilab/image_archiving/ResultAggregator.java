package com.agilab.image_archiving;

import com.agilab.image_archiving.model.FailureKind;
import com.agilab.image_archiving.model.FinalReport;
import com.agilab.image_archiving.model.ProcessingResult;
import com.agilab.image_archiving.model.SourceFile;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Collects per-file outcomes from the workers. Each source file is recorded at most once.
 */
@Slf4j
public class ResultAggregator {

    private final ConcurrentMap<Path, ProcessingResult> results = new ConcurrentHashMap<>();

    public boolean record(ProcessingResult result) {
        var path = result.source().path();
        var previous = results.putIfAbsent(path, result);
        if (previous != null) {
            log.warn("Ignoring second outcome {} for {}, already recorded as {}", result.outcome(), path,
                    previous.outcome());
            return false;
        }
        return true;
    }

    public int size() {
        return results.size();
    }

    /**
     * Builds the report; inputs without a recorded outcome are reported as not processed.
     */
    public FinalReport toReport(List<SourceFile> inputs, Instant startedAt, Instant finishedAt, boolean cancelled,
                                String conversionAbortReason) {
        var all = new HashMap<Path, ProcessingResult>(results);
        var reason = cancelled ? "run cancelled before the file was processed" : "file was never processed";
        for (var input : inputs) {
            all.computeIfAbsent(input.path(),
                    path -> ProcessingResult.failed(input, FailureKind.NOT_PROCESSED, reason));
        }
        return new FinalReport(all, startedAt, finishedAt, cancelled, conversionAbortReason);
    }
}
