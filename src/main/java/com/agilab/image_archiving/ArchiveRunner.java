package com.agilab.image_archiving;

import com.agilab.image_archiving.config.ImageArchiverProperties;
import com.agilab.image_archiving.model.FinalReport;
import com.agilab.image_archiving.report.ReportWriter;
import com.agilab.image_archiving.util.ProcessingResultHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs one archive job with the configured {@code image-archiver.*} properties at startup.
 * A JVM shutdown (Ctrl+C) cancels the run: running tools are killed, and the shutdown hook holds the JVM
 * until the summary and report are written, at most {@code termination-timeout} plus a short grace period.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "image-archiver", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class ArchiveRunner implements ApplicationRunner, ExitCodeGenerator {

    private final ArchivePipeline pipeline;
    private final ImageArchiverProperties properties;
    private final ProcessingResultHandler resultHandler;
    private final ReportWriter reportWriter;

    private static final Duration REPORT_GRACE = Duration.ofSeconds(10);

    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        var request = ArchiveRequest.from(properties);
        var archiveRun = pipeline.start(request);

        var cancelHook = new Thread(() -> cancelAndAwaitReport(archiveRun), "archive-cancel");
        Runtime.getRuntime().addShutdownHook(cancelHook);
        try {
            FinalReport report = archiveRun.awaitReport();
            resultHandler.logSummary(report);
            if (StringUtils.isNotBlank(properties.getReportFile())) {
                reportWriter.write(report, Paths.get(properties.getReportFile()));
            }
            exitCode = report.failures().isEmpty() ? 0 : 1;
        } finally {
            finished.countDown();
            removeHook(cancelHook);
        }
    }

    /**
     * Shutdown hook body: cancels the run, then blocks until {@link #run} has written the summary and report.
     */
    void cancelAndAwaitReport(ArchiveRun archiveRun) {
        log.info("Shutdown requested, cancelling the archive run");
        archiveRun.cancel();
        var limit = properties.getTerminationTimeout().plus(REPORT_GRACE);
        try {
            if (!finished.await(limit.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Archive run did not finish within {}, exiting without a report", limit);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is already shutting down");
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
