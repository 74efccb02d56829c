package com.agilab.image_archiving.conversion;

import com.agilab.image_archiving.config.ImageArchiverProperties;
import com.agilab.image_archiving.exception.ProcessTimeoutException;
import com.agilab.image_archiving.exception.ToolUnavailableException;
import com.agilab.image_archiving.exception.TransientConversionException;
import com.agilab.image_archiving.model.ConversionJob;
import com.agilab.image_archiving.model.FailureKind;
import com.agilab.image_archiving.process.ProcessExecutor;
import com.agilab.image_archiving.process.ProcessExecutor.ProcessResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts RAW files to DNG with an external converter (DNGLab).
 * <p>
 * A job only succeeds when the converter exited with code 0 and the DNG exists and is not empty.
 * Any other outcome is a failure carrying the exit code and the converter's stderr.
 */
@Slf4j
@Service
public class ConversionOrchestrator {

    static final String PROCESS_NAME = "dnglab";

    private final ProcessExecutor processExecutor;
    private final ConverterBinaryLocator binaryLocator;
    private final RetryTemplate retryTemplate;
    private final ImageArchiverProperties properties;
    private final Pattern transientErrorPattern;

    public ConversionOrchestrator(ProcessExecutor processExecutor,
                                  ConverterBinaryLocator binaryLocator,
                                  @Qualifier("conversionRetryTemplate") RetryTemplate retryTemplate,
                                  ImageArchiverProperties properties) {
        this.processExecutor = processExecutor;
        this.binaryLocator = binaryLocator;
        this.retryTemplate = retryTemplate;
        this.properties = properties;
        this.transientErrorPattern = Pattern.compile(properties.getConverter().getTransientErrorPattern());
    }

    public ConversionJob convert(ConversionJob job) {
        var binary = binaryLocator.locate();
        if (binary.isEmpty()) {
            var reason = "DNG converter '" + properties.getConverter().getBinary() + "' not found";
            log.error("[{}] {}", job.source().getFileName(), reason);
            return job.failed(FailureKind.TOOL_MISSING, reason);
        }
        if (Files.exists(job.target())) {
            return job.failed(FailureKind.CONVERSION_FAILED, "DNG target already exists: " + job.target());
        }

        var running = job.running();
        var contextInfo = job.source().getFileName().toString();
        var command = buildCommand(binary.get(), job);
        log.info("[{}] Converting to {} using {}", contextInfo, job.target().getFileName(), PROCESS_NAME);

        try {
            var result = retryTemplate.execute(context -> runOnce(command, contextInfo, context.getRetryCount() + 1));
            return toTerminalState(running, result);
        } catch (TransientConversionException e) {
            log.error("[{}] {} still failing after retries: {}", contextInfo, PROCESS_NAME, e.getMessage());
            return failedWithOutput(running, e.getResult());
        } catch (ToolUnavailableException e) {
            log.error("[{}] {}", contextInfo, e.getMessage());
            return running.failed(FailureKind.TOOL_MISSING, e.getMessage());
        } catch (ProcessTimeoutException e) {
            log.error("[{}] {}", contextInfo, e.getMessage());
            deletePartialOutput(job.target());
            return running.failed(FailureKind.TIMEOUT, e.getMessage());
        } catch (InterruptedIOException | BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Conversion cancelled", contextInfo);
            deletePartialOutput(job.target());
            return running.failed(FailureKind.CANCELLED, "conversion cancelled");
        } catch (IOException e) {
            log.error("[{}] {} invocation failed", contextInfo, PROCESS_NAME, e);
            return running.failed(FailureKind.CONVERSION_FAILED, PROCESS_NAME + " invocation failed: " + e.getMessage());
        }
    }

    private ProcessResult runOnce(List<String> command, String contextInfo, int attempt) throws IOException {
        if (attempt > 1) {
            log.warn("[{}] Retrying {} after a transient failure (attempt {})", contextInfo, PROCESS_NAME, attempt);
        }
        ProcessResult result;
        try {
            result = processExecutor.execute(command, contextInfo, properties.getConverter().getTimeout(),
                    PROCESS_NAME);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException(PROCESS_NAME + " interrupted");
        }
        if (!result.isSuccess() && isTransient(result)) {
            throw new TransientConversionException(
                    PROCESS_NAME + " failed with a transient error: " + result.firstStderrLine(), result);
        }
        return result;
    }

    private boolean isTransient(ProcessResult result) {
        return transientErrorPattern.matcher(result.stderr()).find();
    }

    private ConversionJob toTerminalState(ConversionJob running, ProcessResult result) {
        if (!result.isSuccess()) {
            return failedWithOutput(running, result);
        }
        if (!hasOutput(running.target())) {
            log.error("[{}] {} exited 0 but wrote no DNG", running.source().getFileName(), PROCESS_NAME);
            return running.failed(FailureKind.CONVERSION_FAILED, result.exitCode(),
                    PROCESS_NAME + " exited with code 0 but produced no output at " + running.target());
        }
        log.info("[{}] Converted to {}", running.source().getFileName(), running.target());
        return running.succeeded(result.exitCode());
    }

    private ConversionJob failedWithOutput(ConversionJob running, ProcessResult result) {
        deletePartialOutput(running.target());
        var reason = result.stderr().isEmpty()
                ? PROCESS_NAME + " exited with code " + result.exitCode()
                : result.stderr();
        log.error("[{}] {} exited with code {}: {}", running.source().getFileName(), PROCESS_NAME,
                result.exitCode(), result.firstStderrLine());
        return running.failed(FailureKind.CONVERSION_FAILED, result.exitCode(), reason);
    }

    List<String> buildCommand(Path binary, ConversionJob job) {
        var converter = properties.getConverter();
        var command = new ArrayList<String>();
        command.add(binary.toString());
        command.add("convert");
        command.add("--compression");
        command.add(converter.getCompression());
        command.add("--dng-preview");
        command.add(Boolean.toString(converter.isEmbedPreview()));
        command.add(job.source().toString());
        command.add(job.target().toString());
        return command;
    }

    private static boolean hasOutput(Path target) {
        try {
            return Files.isRegularFile(target) && Files.size(target) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    private static void deletePartialOutput(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.warn("Failed to delete partial DNG output: {}", target, e);
        }
    }
}
