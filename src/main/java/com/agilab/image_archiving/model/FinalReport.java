package com.agilab.image_archiving.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of every input file of a run, keyed by source path. Iteration order carries no meaning.
 */
public record FinalReport(Map<Path, ProcessingResult> results,
                          Instant startedAt,
                          Instant finishedAt,
                          boolean cancelled,
                          String conversionAbortReason) {

    public FinalReport {
        results = Map.copyOf(results);
    }

    public Optional<ProcessingResult> get(Path source) {
        return Optional.ofNullable(results.get(source));
    }

    public Collection<ProcessingResult> all() {
        return results.values();
    }

    public List<ProcessingResult> failures() {
        return results.values().stream().filter(ProcessingResult::isFailure).toList();
    }

    public long count(ProcessingOutcome outcome) {
        return results.values().stream().filter(result -> result.outcome() == outcome).count();
    }

    public Map<ProcessingOutcome, Long> summary() {
        var summary = new EnumMap<ProcessingOutcome, Long>(ProcessingOutcome.class);
        for (var outcome : ProcessingOutcome.values()) {
            summary.put(outcome, count(outcome));
        }
        return summary;
    }

    public Optional<String> findConversionAbortReason() {
        return Optional.ofNullable(conversionAbortReason);
    }

    public int size() {
        return results.size();
    }
}
