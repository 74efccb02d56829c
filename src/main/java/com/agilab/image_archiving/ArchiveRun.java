package com.agilab.image_archiving;

import com.agilab.image_archiving.model.FinalReport;
import com.agilab.image_archiving.model.ProcessingResult;
import com.agilab.image_archiving.model.SourceFile;
import com.agilab.image_archiving.planning.PathPlanner;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle of a running archive job: tracks outstanding tasks on the worker pool, conversion abort and
 * cancellation, and produces the {@link FinalReport}.
 */
@Slf4j
public class ArchiveRun {

    private final ArchiveRequest request;
    private final List<SourceFile> files;
    private final PathPlanner planner;
    private final ResultAggregator aggregator;
    private final ExecutorService workers;
    private final Duration terminationTimeout;
    private final Instant startedAt = Instant.now();

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicReference<String> conversionAbortReason = new AtomicReference<>();
    private final AtomicReference<RuntimeException> fatalError = new AtomicReference<>();
    // one extra permit held by the dispatcher until all batches are submitted
    private final AtomicInteger outstanding = new AtomicInteger(1);
    private final CountDownLatch drained = new CountDownLatch(1);

    ArchiveRun(ArchiveRequest request, List<SourceFile> files, PathPlanner planner, ResultAggregator aggregator,
               ExecutorService workers, Duration terminationTimeout) {
        this.request = request;
        this.files = List.copyOf(files);
        this.planner = planner;
        this.aggregator = aggregator;
        this.workers = workers;
        this.terminationTimeout = terminationTimeout;
    }

    public ArchiveRequest request() {
        return request;
    }

    public PathPlanner planner() {
        return planner;
    }

    public List<SourceFile> files() {
        return files;
    }

    public int completedCount() {
        return aggregator.size();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Optional<String> conversionAbortReason() {
        return Optional.ofNullable(conversionAbortReason.get());
    }

    /**
     * Disables conversion for the rest of the run. Returns true for the call that actually aborted.
     */
    public boolean abortConversions(String reason) {
        if (conversionAbortReason.compareAndSet(null, reason)) {
            log.error("DNG conversion aborted for the rest of the run, files are still renamed: {}", reason);
            return true;
        }
        return false;
    }

    /**
     * Stops dispatching, interrupts the workers (which kills running tool processes) and lets
     * {@link #awaitReport()} return once in-flight files are recorded.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("Cancelling archive run of {} after {} of {} files", request.sourceDirectory(),
                    completedCount(), files.size());
            stop();
        }
    }

    void fail(RuntimeException error) {
        if (fatalError.compareAndSet(null, error)) {
            log.error("Aborting archive run: {}", error.getMessage());
            cancelled.set(true);
            stop();
        }
    }

    void record(ProcessingResult result) {
        aggregator.record(result);
    }

    void dispatch(Runnable task) {
        outstanding.incrementAndGet();
        try {
            workers.execute(() -> {
                try {
                    task.run();
                } finally {
                    release();
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Task rejected, run is stopping");
            release();
        }
    }

    void dispatchComplete() {
        release();
    }

    private void release() {
        if (outstanding.decrementAndGet() == 0) {
            drained.countDown();
        }
    }

    private void stop() {
        workers.shutdownNow();
        drained.countDown();
    }

    /**
     * Blocks until every file has an outcome or the run was cancelled.
     *
     * @throws com.agilab.image_archiving.exception.MetadataToolException if the metadata tool could not be invoked
     * @throws InterruptedException if the waiting thread is interrupted; the run is cancelled first
     */
    public FinalReport awaitReport() throws InterruptedException {
        try {
            drained.await();
        } catch (InterruptedException e) {
            cancel();
            throw e;
        }
        workers.shutdown();
        if (!workers.awaitTermination(terminationTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("Workers still busy {} after the run ended", terminationTimeout);
        }
        var fatal = fatalError.get();
        if (fatal != null) {
            throw fatal;
        }
        return aggregator.toReport(files, startedAt, Instant.now(), cancelled.get(), conversionAbortReason.get());
    }
}
