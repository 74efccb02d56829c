package com.agilab.image_archiving.process;

import com.agilab.image_archiving.exception.ProcessTimeoutException;
import com.agilab.image_archiving.exception.ToolUnavailableException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

@Component
@Slf4j
public class ProcessExecutor {

    /**
     * Stdout carries ExifTool's JSON for a whole batch, so it gets a larger limit than stderr.
     */
    private static final int MAX_STDOUT_CAPTURE_BYTES = 8 * 1024 * 1024;
    private static final int MAX_STDERR_CAPTURE_BYTES = 16 * 1024;
    private static final long STREAM_DRAIN_TIMEOUT_SECONDS = 5;

    private final ExecutorService streamReaders;

    public ProcessExecutor() {
        var threadFactory = new CustomizableThreadFactory("process-io-");
        threadFactory.setDaemon(true);
        this.streamReaders = Executors.newCachedThreadPool(threadFactory);
    }

    /**
     * Runs a command to completion and captures its output.
     *
     * @param command     the command and its arguments
     * @param contextInfo logging context, usually the file being processed
     * @param timeout     wall-clock limit; the process is killed when exceeded
     * @param processName descriptive name used in logs and messages, e.g. "dnglab"
     * @return exit code plus trimmed stdout and stderr, each truncated to a safe limit
     * @throws ToolUnavailableException if the binary cannot be launched
     * @throws ProcessTimeoutException  if the process ran longer than {@code timeout}
     * @throws IOException              on other I/O failures
     * @throws InterruptedException     if the calling thread is interrupted; the process is killed first
     */
    public ProcessResult execute(List<String> command, String contextInfo, Duration timeout, String processName)
            throws IOException, InterruptedException {

        Process process = start(command, processName);
        var stdoutCapture = new StringBuffer();
        var stderrCapture = new StringBuffer();

        Future<?> stdout = streamReaders.submit(
                new StreamConsumer(process.getInputStream(), MAX_STDOUT_CAPTURE_BYTES, stdoutCapture::append, null));
        Future<?> stderr = streamReaders.submit(
                new StreamConsumer(process.getErrorStream(), MAX_STDERR_CAPTURE_BYTES, stderrCapture::append,
                        line -> log.warn("[{}] [{}-stderr] {}", contextInfo, processName, line)));

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ProcessTimeoutException(processName, timeout);
            }
            awaitDrained(stdout);
            awaitDrained(stderr);
        } catch (InterruptedException e) {
            log.warn("[{}] Interrupted while waiting for {}, killing it", contextInfo, processName);
            process.destroyForcibly();
            throw e;
        }

        return new ProcessResult(process.exitValue(), stdoutCapture.toString().trim(),
                stderrCapture.toString().trim());
    }

    private Process start(List<String> command, String processName) throws ToolUnavailableException {
        try {
            return new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new ToolUnavailableException(processName, command.get(0), e);
        }
    }

    private void awaitDrained(Future<?> reader) throws InterruptedException, IOException {
        try {
            reader.get(STREAM_DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new IOException("Failed to read process output", e.getCause());
        } catch (TimeoutException e) {
            // a child process may still hold the pipe open; keep what was captured so far
            reader.cancel(true);
        }
    }

    @PreDestroy
    public void shutdown() {
        streamReaders.shutdownNow();
    }

    /**
     * Consumes a stream line by line, capturing up to a byte limit and optionally logging each line.
     * Draining both streams concurrently keeps the child from blocking on a full pipe.
     */
    private static class StreamConsumer implements Runnable {
        private final InputStream inputStream;
        private final int maxCaptureBytes;
        private final Consumer<String> captureConsumer;
        private final Consumer<String> lineLogger;
        private int bytesCaptured = 0;

        StreamConsumer(InputStream inputStream, int maxCaptureBytes, Consumer<String> captureConsumer,
                       Consumer<String> lineLogger) {
            this.inputStream = inputStream;
            this.maxCaptureBytes = maxCaptureBytes;
            this.captureConsumer = captureConsumer;
            this.lineLogger = lineLogger;
        }

        @Override
        public void run() {
            try (var reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (lineLogger != null) {
                        lineLogger.accept(line);
                    }
                    if (bytesCaptured < maxCaptureBytes) {
                        var lineWithNewline = line + "\n";
                        captureConsumer.accept(lineWithNewline);
                        bytesCaptured += lineWithNewline.getBytes(StandardCharsets.UTF_8).length;
                    }
                }
            } catch (IOException e) {
                log.debug("Process stream closed while reading", e);
            }
        }
    }

    /**
     * Result of an external process execution.
     *
     * @param exitCode exit code of the process, 0 usually means success
     * @param stdout   captured standard output, truncated to a safe limit
     * @param stderr   captured standard error, truncated to a safe limit
     */
    public record ProcessResult(int exitCode, String stdout, String stderr) {

        public boolean isSuccess() {
            return exitCode == 0;
        }

        public String firstStderrLine() {
            if (stderr.isEmpty()) {
                return "";
            }
            var newline = stderr.indexOf('\n');
            return newline < 0 ? stderr : stderr.substring(0, newline);
        }
    }
}
