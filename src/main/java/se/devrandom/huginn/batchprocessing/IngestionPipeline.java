/*
 * Huginn - SEI Process Synchronization
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.huginn.batchprocessing;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import se.devrandom.huginn.sei.ProcessFetchResult;
import se.devrandom.huginn.sei.ScopeFallbackOrchestrator;
import se.devrandom.huginn.sei.SeiAuthenticationException;
import se.devrandom.huginn.storage.BulkWriteStats;
import se.devrandom.huginn.storage.PendingProcess;
import se.devrandom.huginn.storage.ProcessStore;
import se.devrandom.huginn.storage.SyncStatisticsService;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fetches processes concurrently and persists them through a single writer.
 *
 * Up to {@code concurrency} fetches run at once. Each pushes its result onto a queue holding
 * twice the flush threshold, so fetch threads block when the writer falls behind. The writer
 * is the only thread that touches the store. It flushes whenever its buffer reaches the
 * threshold, flushes early when the queue has been quiet for a poll interval and the buffer is
 * at least half full, and flushes the remainder once every fetch has finished.
 */
@Component
public class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    static final long POLL_TIMEOUT_MS = 500;
    static final long PROGRESS_LOG_INTERVAL_MS = 10_000;
    static final Duration SHUTDOWN_TIMEOUT = Duration.ofMinutes(2);

    private final ScopeFallbackOrchestrator orchestrator;
    private final ProcessStore processStore;
    private final SyncStatisticsService statisticsService;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    // Counted down once the run in progress has flushed and returned
    private final AtomicReference<CountDownLatch> activeRun = new AtomicReference<>();

    @Autowired
    public IngestionPipeline(ScopeFallbackOrchestrator orchestrator, ProcessStore processStore,
                             SyncStatisticsService statisticsService) {
        this.orchestrator = orchestrator;
        this.processStore = processStore;
        this.statisticsService = statisticsService;
    }

    /**
     * Stops dispatching new fetches. In-flight fetches finish and the writer flushes what they
     * return before {@link #run} comes back.
     */
    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            log.warn("Stop requested, no new processes will be dispatched");
        }
    }

    /**
     * Requests a stop and blocks until the run in progress has flushed its results, or the
     * timeout passes. Returns true if no run is left in progress.
     */
    public boolean stopAndAwait(Duration timeout) {
        requestStop();
        CountDownLatch finished = activeRun.get();
        if (finished == null) {
            return true;
        }
        log.info("Waiting up to {}s for in-flight fetches and the final flush", timeout.toSeconds());
        try {
            if (finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("Sync stopped cleanly");
                return true;
            }
            log.error("Sync did not finish within {}s, unflushed results are lost", timeout.toSeconds());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for the sync to finish");
            return false;
        }
    }

    /**
     * Runs before the store is closed on context shutdown, since this bean depends on it.
     */
    @PreDestroy
    public void shutdown() {
        if (activeRun.get() != null) {
            stopAndAwait(SHUTDOWN_TIMEOUT);
        }
    }

    public IngestionSummary run(List<PendingProcess> records, int concurrency, int flushThreshold) {
        return run(records, concurrency, flushThreshold, null);
    }

    /**
     * @param deadline no fetch is dispatched after this instant (null for none)
     * @throws SeiAuthenticationException if SEI login failed; thrown after the writer has flushed
     *                                    everything fetched before the failure
     */
    public IngestionSummary run(List<PendingProcess> records, int concurrency, int flushThreshold, Instant deadline) {
        if (concurrency < 1 || flushThreshold < 1) {
            throw new IllegalArgumentException("concurrency and flushThreshold must be positive");
        }
        if (records.isEmpty()) {
            log.info("No processes to sync");
            return IngestionSummary.EMPTY;
        }

        CountDownLatch finished = new CountDownLatch(1);
        activeRun.set(finished);
        try {
            log.info("Syncing {} processes (concurrency={}, flushThreshold={}, deadline={})",
                    records.size(), concurrency, flushThreshold, deadline != null ? deadline : "none");

            BlockingQueue<ProcessFetchResult> queue = new ArrayBlockingQueue<>(2 * flushThreshold);
            Semaphore permits = new Semaphore(concurrency);
            AtomicReference<SeiAuthenticationException> authFailure = new AtomicReference<>();
            AtomicBoolean producersDone = new AtomicBoolean(false);
            Progress progress = new Progress(records.size());

            ExecutorService fetchPool = Executors.newFixedThreadPool(concurrency, namedThreads("sync-fetch-"));
            ExecutorService writerPool = Executors.newSingleThreadExecutor(namedThreads("sync-writer-"));
            Future<WriterTotals> writer = writerPool.submit(() -> drain(queue, flushThreshold, producersDone, progress));

            int dispatched = 0;
            try {
                for (PendingProcess record : records) {
                    if (!acquire(permits, deadline, authFailure)) {
                        break;
                    }
                    fetchPool.execute(() -> fetchOne(record, queue, permits, authFailure, progress));
                    dispatched++;
                }
            } finally {
                fetchPool.shutdown();
                awaitFetches(fetchPool);
                producersDone.set(true);
            }

            WriterTotals totals = awaitWriter(writer, writerPool);
            int notDispatched = records.size() - dispatched + progress.authAbandoned.get();
            if (notDispatched > 0) {
                statisticsService.addNotDispatched(notDispatched);
            }

            IngestionSummary summary = new IngestionSummary(totals.succeeded, totals.notFound, totals.accessDenied,
                    totals.errored, notDispatched, totals.documentsSaved, totals.progressionsSaved,
                    totals.bulkWrites, totals.failedWrites);
            log.info("Sync finished: {}", summary);

            stopRequested.set(false);

            SeiAuthenticationException failure = authFailure.get();
            if (failure != null) {
                log.error("Sync aborted, SEI authentication failed: {}", failure.getMessage());
                throw failure;
            }
            return summary;
        } finally {
            activeRun.compareAndSet(finished, null);
            finished.countDown();
        }
    }

    /**
     * Waits for a fetch slot. Returns false once the run should stop dispatching.
     */
    private boolean acquire(Semaphore permits, Instant deadline,
                            AtomicReference<SeiAuthenticationException> authFailure) {
        try {
            while (true) {
                if (shouldStopDispatching(deadline, authFailure)) {
                    return false;
                }
                if (permits.tryAcquire(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    // A finishing fetch may have requested the stop just before releasing its slot
                    if (shouldStopDispatching(deadline, authFailure)) {
                        permits.release();
                        return false;
                    }
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while dispatching, no new processes will be dispatched");
            return false;
        }
    }

    private boolean shouldStopDispatching(Instant deadline, AtomicReference<SeiAuthenticationException> authFailure) {
        if (stopRequested.get() || authFailure.get() != null) {
            return true;
        }
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            log.warn("Deadline {} reached, no new processes will be dispatched", deadline);
            return true;
        }
        return false;
    }

    private void fetchOne(PendingProcess record, BlockingQueue<ProcessFetchResult> queue, Semaphore permits,
                          AtomicReference<SeiAuthenticationException> authFailure, Progress progress) {
        try {
            ProcessFetchResult result;
            try {
                result = orchestrator.fetchProcess(record.protocol(), record.scopeName());
            } catch (SeiAuthenticationException e) {
                authFailure.compareAndSet(null, e);
                progress.authAbandoned.incrementAndGet();
                return;
            } catch (RuntimeException e) {
                log.error("{}: fetch failed: {}", record.protocol(), e.getMessage(), e);
                result = ProcessFetchResult.error(record.protocol(), e.getClass().getSimpleName() + ": " + e.getMessage());
            }

            queue.put(result);
            progress.fetched(queue.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{}: interrupted before its result was queued", record.protocol());
        } finally {
            permits.release();
        }
    }

    private WriterTotals drain(BlockingQueue<ProcessFetchResult> queue, int flushThreshold,
                               AtomicBoolean producersDone, Progress progress) {
        WriterTotals totals = new WriterTotals();
        List<ProcessFetchResult> buffer = new ArrayList<>(flushThreshold);
        try {
            while (true) {
                ProcessFetchResult result = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (result != null) {
                    buffer.add(result);
                    if (buffer.size() >= flushThreshold) {
                        flush(buffer, totals, "full");
                    }
                    continue;
                }
                // Order matters: once producers are done the queue can only shrink
                if (producersDone.get() && queue.isEmpty()) {
                    break;
                }
                if (!buffer.isEmpty() && buffer.size() * 2 >= flushThreshold) {
                    flush(buffer, totals, "partial");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Writer interrupted, flushing {} buffered results", buffer.size());
        }

        if (!buffer.isEmpty()) {
            flush(buffer, totals, "final");
        }
        progress.logNow();
        return totals;
    }

    private void flush(List<ProcessFetchResult> buffer, WriterTotals totals, String reason) {
        List<ProcessFetchResult> batch = new ArrayList<>(buffer);
        buffer.clear();

        long start = System.currentTimeMillis();
        try {
            BulkWriteStats stats = processStore.bulkUpsert(batch);
            totals.bulkWrites++;
            totals.documentsSaved += stats.documents();
            totals.progressionsSaved += stats.progressions();
            statisticsService.recordBulkWrite(stats);

            for (ProcessFetchResult result : batch) {
                switch (result.status()) {
                    case SUCCESS -> {
                        totals.succeeded++;
                        statisticsService.incrementSucceeded();
                    }
                    case NOT_FOUND -> {
                        totals.notFound++;
                        statisticsService.incrementNotFound();
                    }
                    case ACCESS_DENIED -> {
                        totals.accessDenied++;
                        statisticsService.incrementAccessDenied();
                    }
                    case ERROR -> {
                        totals.errored++;
                        statisticsService.incrementErrored(result.protocol());
                    }
                }
            }
            log.info("Flushed {} results ({}) in {}ms: {} documents, {} progressions",
                    batch.size(), reason, System.currentTimeMillis() - start, stats.documents(), stats.progressions());
        } catch (SQLException | RuntimeException e) {
            // Rolled back; sync_status is untouched so a re-run picks these up again
            log.error("Bulk write of {} results failed, counting them as errors: {}", batch.size(), e.getMessage(), e);
            totals.failedWrites++;
            totals.errored += batch.size();
            statisticsService.incrementFailedWrites();
            for (ProcessFetchResult result : batch) {
                statisticsService.incrementErrored(result.protocol());
            }
        }
    }

    private static void awaitFetches(ExecutorService fetchPool) {
        try {
            while (!fetchPool.awaitTermination(1, TimeUnit.MINUTES)) {
                log.info("Waiting for in-flight fetches to finish");
            }
        } catch (InterruptedException e) {
            fetchPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static WriterTotals awaitWriter(Future<WriterTotals> writer, ExecutorService writerPool) {
        try {
            return writer.get();
        } catch (InterruptedException e) {
            writer.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the writer", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Writer failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            writerPool.shutdown();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger threadCounter = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // Only touched by the writer thread; published to the caller through its Future
    private static final class WriterTotals {
        int succeeded;
        int notFound;
        int accessDenied;
        int errored;
        int documentsSaved;
        int progressionsSaved;
        int bulkWrites;
        int failedWrites;
    }

    private static final class Progress {
        private final int total;
        private final AtomicInteger fetched = new AtomicInteger(0);
        private final AtomicInteger authAbandoned = new AtomicInteger(0);
        private final AtomicLong lastLoggedAt = new AtomicLong(System.currentTimeMillis());

        Progress(int total) {
            this.total = total;
        }

        void fetched(int queued) {
            int done = fetched.incrementAndGet();
            long now = System.currentTimeMillis();
            long last = lastLoggedAt.get();
            if (now - last >= PROGRESS_LOG_INTERVAL_MS && lastLoggedAt.compareAndSet(last, now)) {
                log.info("Progress: {}/{} processes fetched, {} queued for writing", done, total, queued);
            }
        }

        void logNow() {
            log.info("Progress: {}/{} processes fetched", fetched.get(), total);
        }
    }
}
