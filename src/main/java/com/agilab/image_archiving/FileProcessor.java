package com.agilab.image_archiving;

import com.agilab.image_archiving.config.ImageArchiverProperties;
import com.agilab.image_archiving.conversion.ConversionOrchestrator;
import com.agilab.image_archiving.exception.FileExceptionHandler;
import com.agilab.image_archiving.exception.FileReadException;
import com.agilab.image_archiving.exception.FileWriteException;
import com.agilab.image_archiving.model.CaptureMetadata;
import com.agilab.image_archiving.model.ConversionJob;
import com.agilab.image_archiving.model.ConversionState;
import com.agilab.image_archiving.model.ExtractionFailure;
import com.agilab.image_archiving.model.FailureKind;
import com.agilab.image_archiving.model.MediaKind;
import com.agilab.image_archiving.model.MetadataResult;
import com.agilab.image_archiving.model.ProcessingResult;
import com.agilab.image_archiving.model.SourceFile;
import com.agilab.image_archiving.model.TargetLocation;
import com.agilab.image_archiving.util.FileOperations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;

/**
 * Per-file continuation after metadata extraction: plan, place, then convert RAW files.
 * Every failure is turned into a {@link ProcessingResult}; nothing escapes to the other files.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileProcessor {

    private final FileOperations fileOperations;
    private final ConversionOrchestrator conversionOrchestrator;
    private final FileExceptionHandler exceptionHandler;
    private final ImageArchiverProperties properties;

    ProcessingResult processFile(SourceFile file, MetadataResult metadataResult, ArchiveRun run) {
        if (metadataResult instanceof ExtractionFailure failure) {
            log.warn("Cannot read metadata of {}: {}", file.path(), failure.reason());
            return ProcessingResult.failed(file, FailureKind.EXTRACTION_FAILED, failure.reason());
        }
        var metadata = (CaptureMetadata) metadataResult;
        var request = run.request();

        if (request.dryRun()) {
            var planned = run.planner().plan(file, metadata, request.projectName());
            log.info("[dry-run] {} -> {}", file.path(), planned.path());
            return ProcessingResult.planned(file, planned.path());
        }

        TargetLocation location;
        try {
            location = place(file, metadata, run);
        } catch (FileReadException | FileWriteException e) {
            exceptionHandler.logException(e);
            return ProcessingResult.failed(file, FailureKind.FILESYSTEM_ERROR, exceptionHandler.describe(e));
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            return ProcessingResult.failed(file, FailureKind.CANCELLED, "placement cancelled");
        }

        if (!request.convertRaw() || !file.isConvertible()) {
            return ProcessingResult.renamed(file, location.path());
        }
        return convert(file, location, run);
    }

    /**
     * Plans and moves the file. A target that appears between planning and moving is not replaced:
     * the file is planned again and gets the next free sequence.
     */
    private TargetLocation place(SourceFile file, CaptureMetadata metadata, ArchiveRun run) {
        var request = run.request();
        for (var attempt = 1; ; attempt++) {
            var location = run.planner().plan(file, metadata, request.projectName());
            try {
                Files.createDirectories(location.directory());
            } catch (IOException e) {
                throw new FileWriteException(location.directory().toString(), "Cannot create directory", e);
            }
            try {
                fileOperations.placeFileWithRetry(file.path(), location.path(), request.keepOriginals());
                log.debug("Placed {} at {}", file.path(), location.path());
                return location;
            } catch (FileAlreadyExistsException e) {
                if (attempt >= properties.getMaxPlacementAttempts()) {
                    throw new FileWriteException(location.path().toString(),
                            "No free target after " + attempt + " attempts", e);
                }
                log.warn("Target {} appeared before the move, planning again", location.path());
            } catch (NoSuchFileException e) {
                throw new FileReadException(file.path().toString(), "Source file disappeared", e);
            } catch (IOException e) {
                throw new FileWriteException(location.path().toString(), "Cannot place " + file.fileName(), e);
            }
        }
    }

    private ProcessingResult convert(SourceFile file, TargetLocation location, ArchiveRun run) {
        var abortReason = run.conversionAbortReason();
        if (abortReason.isPresent()) {
            return ProcessingResult.failed(file, location.path(), FailureKind.TOOL_MISSING,
                    "conversion skipped, " + abortReason.get());
        }
        if (run.isCancelled()) {
            return ProcessingResult.failed(file, location.path(), FailureKind.CANCELLED,
                    "run cancelled before conversion");
        }

        var job = conversionOrchestrator.convert(
                ConversionJob.pending(location.path(), location.withExtension(MediaKind.DNG_EXTENSION)));
        if (job.state() == ConversionState.SUCCEEDED) {
            return ProcessingResult.renamedAndConverted(file, location.path(), job.target());
        }
        if (job.failureKind() == FailureKind.TOOL_MISSING) {
            run.abortConversions(job.reason());
        }
        return ProcessingResult.failed(file, location.path(), job.failureKind(), job.reason());
    }
}
