package com.agilab.image_archiving;

import com.agilab.image_archiving.config.ImageArchiverProperties;
import com.agilab.image_archiving.exception.MetadataToolException;
import com.agilab.image_archiving.metadata.MetadataExtractor;
import com.agilab.image_archiving.model.ExtractionFailure;
import com.agilab.image_archiving.model.FailureKind;
import com.agilab.image_archiving.model.FinalReport;
import com.agilab.image_archiving.model.MetadataResult;
import com.agilab.image_archiving.model.ProcessingResult;
import com.agilab.image_archiving.model.SourceFile;
import com.agilab.image_archiving.planning.PathPlanner;
import com.agilab.image_archiving.planning.SequenceRegistry;
import com.agilab.image_archiving.util.FileOperations;
import com.agilab.image_archiving.util.ProcessingResultHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;

/**
 * Discovers media files and runs them through extract -> place -> convert on a bounded worker pool.
 * Metadata is read in batches; each extracted batch fans out into one task per file.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ArchivePipeline {

    private final ImageArchiverProperties properties;
    private final MetadataExtractor metadataExtractor;
    private final FileProcessor fileProcessor;
    private final FileOperations fileOperations;
    private final ProcessingResultHandler resultHandler;

    public FinalReport run(ArchiveRequest request) throws IOException, InterruptedException {
        return start(request).awaitReport();
    }

    public ArchiveRun start(ArchiveRequest request) throws IOException {
        if (!Files.isDirectory(request.sourceDirectory())) {
            throw new NoSuchFileException(request.sourceDirectory().toString(), null, "Input directory not found");
        }
        var files = fileOperations.findSourceFiles(request.sourceDirectory(), request.destinationDirectory(),
                request.projectName(), request.recursive());
        log.info("Archiving {} media files from {} into {} as project '{}' ({} workers{})", files.size(),
                request.sourceDirectory(), request.destinationDirectory(), request.projectName(),
                request.concurrency(), request.dryRun() ? ", dry run" : "");

        var planner = new PathPlanner(request.destinationDirectory(), new SequenceRegistry(), request.convertRaw());
        var workers = Executors.newFixedThreadPool(request.concurrency(),
                new CustomizableThreadFactory("archive-worker-"));
        var run = new ArchiveRun(request, files, planner, new ResultAggregator(), workers,
                properties.getTerminationTimeout());

        var batchSize = Math.max(1, properties.getMetadataTool().getBatchSize());
        for (var from = 0; from < files.size(); from += batchSize) {
            var batch = files.subList(from, Math.min(files.size(), from + batchSize));
            run.dispatch(() -> processBatch(run, batch));
        }
        run.dispatchComplete();
        return run;
    }

    private void processBatch(ArchiveRun run, List<SourceFile> batch) {
        if (run.isCancelled()) {
            return;
        }
        Map<Path, MetadataResult> metadata;
        try {
            metadata = metadataExtractor.extract(batch.stream().map(SourceFile::path).toList());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            batch.forEach(file -> record(run,
                    ProcessingResult.failed(file, FailureKind.CANCELLED, "metadata extraction cancelled")));
            return;
        } catch (MetadataToolException e) {
            run.fail(e);
            return;
        }

        for (var file : batch) {
            var result = metadata.getOrDefault(file.path(), new ExtractionFailure("no metadata result"));
            run.dispatch(() -> processFile(run, file, result));
        }
    }

    private void processFile(ArchiveRun run, SourceFile file, MetadataResult metadata) {
        if (run.isCancelled()) {
            return;
        }
        ProcessingResult result;
        try {
            result = fileProcessor.processFile(file, metadata, run);
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing {}", file.path(), e);
            result = ProcessingResult.failed(file, FailureKind.INTERNAL_ERROR, e.toString());
        }
        record(run, result);
    }

    private void record(ArchiveRun run, ProcessingResult result) {
        run.record(result);
        resultHandler.logResult(result);
    }
}
