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
package se.devrandom.huginn.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters for one sync job run.
 */
@Service
public class SyncStatisticsService {
    private static final Logger log = LoggerFactory.getLogger(SyncStatisticsService.class);
    private static final int MAX_FAILED_PROTOCOLS = 1000;

    // Metadata sync
    private final AtomicLong processesSucceeded = new AtomicLong(0);
    private final AtomicLong processesNotFound = new AtomicLong(0);
    private final AtomicLong processesAccessDenied = new AtomicLong(0);
    private final AtomicLong processesErrored = new AtomicLong(0);
    private final AtomicLong processesNotDispatched = new AtomicLong(0);
    private final AtomicLong documentsSaved = new AtomicLong(0);
    private final AtomicLong progressionsSaved = new AtomicLong(0);
    private final AtomicInteger bulkWrites = new AtomicInteger(0);
    private final AtomicInteger failedWrites = new AtomicInteger(0);

    // Document downloads
    private final AtomicLong documentsDownloaded = new AtomicLong(0);
    private final AtomicLong documentsFailed = new AtomicLong(0);
    private final AtomicLong bytesTransferred = new AtomicLong(0);

    private final Instant jobStartTime = Instant.now();
    private volatile Instant jobEndTime;
    private volatile Map<String, Long> metadataStatusTotals = Map.of();

    // Bounded to prevent memory issues on large runs
    private final ConcurrentLinkedQueue<String> failedProtocols = new ConcurrentLinkedQueue<>();

    // ===== Metadata Sync Methods =====

    public void incrementSucceeded() {
        processesSucceeded.incrementAndGet();
    }

    public void incrementNotFound() {
        processesNotFound.incrementAndGet();
    }

    public void incrementAccessDenied() {
        processesAccessDenied.incrementAndGet();
    }

    public void incrementErrored(String protocol) {
        processesErrored.incrementAndGet();
        if (failedProtocols.size() < MAX_FAILED_PROTOCOLS) {
            failedProtocols.add(protocol);
        }
    }

    public void addNotDispatched(long count) {
        processesNotDispatched.addAndGet(count);
    }

    public void recordBulkWrite(BulkWriteStats stats) {
        bulkWrites.incrementAndGet();
        documentsSaved.addAndGet(stats.documents());
        progressionsSaved.addAndGet(stats.progressions());
    }

    public void incrementFailedWrites() {
        failedWrites.incrementAndGet();
    }

    public void setMetadataStatusTotals(Map<String, Long> totals) {
        this.metadataStatusTotals = Map.copyOf(totals);
    }

    // ===== Document Download Methods =====

    public void incrementDocumentDownloaded(long bytes) {
        documentsDownloaded.incrementAndGet();
        bytesTransferred.addAndGet(bytes);
    }

    public void incrementDocumentFailed() {
        documentsFailed.incrementAndGet();
    }

    // ===== Getters for Current Values =====

    public long getProcessesSucceeded() {
        return processesSucceeded.get();
    }

    public long getProcessesNotFound() {
        return processesNotFound.get();
    }

    public long getProcessesAccessDenied() {
        return processesAccessDenied.get();
    }

    public long getProcessesErrored() {
        return processesErrored.get();
    }

    public long getProcessesNotDispatched() {
        return processesNotDispatched.get();
    }

    public int getFailedWrites() {
        return failedWrites.get();
    }

    public long getDocumentsDownloaded() {
        return documentsDownloaded.get();
    }

    public long getDocumentsFailed() {
        return documentsFailed.get();
    }

    public int getBulkWrites() {
        return bulkWrites.get();
    }

    // ===== Summary Report Generation =====

    public void markJobComplete() {
        this.jobEndTime = Instant.now();
    }

    public String generateSummaryReport() {
        if (jobEndTime == null) {
            markJobComplete();
        }

        Duration duration = Duration.between(jobStartTime, jobEndTime);
        long minutes = duration.toMinutes();
        long seconds = duration.getSeconds() % 60;

        StringBuilder report = new StringBuilder();
        report.append("\n");
        report.append(String.format("Duration: %dm %ds%n", minutes, seconds));
        report.append("\n");

        long succeeded = processesSucceeded.get();
        long notFound = processesNotFound.get();
        long accessDenied = processesAccessDenied.get();
        long errored = processesErrored.get();

        report.append("Process Metadata:\n");
        report.append(String.format("  - Succeeded: %,d%n", succeeded));
        report.append(String.format("  - Not found: %,d%n", notFound));
        report.append(String.format("  - Access denied (all units tried): %,d%n", accessDenied));
        report.append(String.format("  - Errors: %,d%n", errored));
        long notDispatched = processesNotDispatched.get();
        if (notDispatched > 0) {
            report.append(String.format("  - Not dispatched (stopped early): %,d%n", notDispatched));
        }
        report.append(String.format("  - Documents saved: %,d%n", documentsSaved.get()));
        report.append(String.format("  - Progressions saved: %,d%n", progressionsSaved.get()));
        report.append(String.format("  - Bulk writes: %d (%d failed)%n", bulkWrites.get(), failedWrites.get()));
        report.append("\n");

        if (!metadataStatusTotals.isEmpty()) {
            report.append("Sync Status Totals (all runs):\n");
            metadataStatusTotals.forEach((status, total) ->
                    report.append(String.format("  - %s: %,d%n", status, total)));
            report.append("\n");
        }

        long downloaded = documentsDownloaded.get();
        long downloadFailed = documentsFailed.get();
        if (downloaded + downloadFailed > 0) {
            long bytes = bytesTransferred.get();
            report.append("Document Downloads:\n");
            report.append(String.format("  - Downloaded and stored: %,d%n", downloaded));
            report.append(String.format("  - Failed: %,d%n", downloadFailed));
            report.append(String.format("  - Total bytes transferred: %s%n", formatBytes(bytes)));
            if (duration.getSeconds() > 0 && bytes > 0) {
                double mbPerSecond = (bytes / 1024.0 / 1024.0) / duration.getSeconds();
                report.append(String.format("  - Average throughput: %.2f MB/s%n", mbPerSecond));
            }
            report.append("\n");
        }

        if (!failedProtocols.isEmpty()) {
            report.append("Failed Protocols (first 10):\n");
            int count = 0;
            for (String protocol : failedProtocols) {
                report.append(String.format("  - %s%n", protocol));
                if (++count >= 10) break;
            }
            if (failedProtocols.size() > 10) {
                report.append(String.format("  ... and %d more%n", failedProtocols.size() - 10));
            }
            report.append("\n");
        }

        // Not-found and access-denied are terminal answers, not failures
        long failedCount = errored + downloadFailed;
        long processedCount = succeeded + notFound + accessDenied + errored + downloaded + downloadFailed;
        double failureRate = processedCount > 0 ? (double) failedCount / processedCount : 0.0;

        String status;
        if (failureRate > 0.5) {
            status = "FAILED (>50% failure rate)";
        } else if (failureRate > 0.1) {
            status = "WARNING (>10% failure rate)";
        } else {
            status = "SUCCESS";
        }

        report.append(String.format("Overall Status: %s", status));

        return report.toString();
    }

    /**
     * Formats bytes into human-readable format (B, KB, MB, GB).
     */
    private String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        } else if (bytes < 1024 * 1024) {
            return String.format("%.2f KB", bytes / 1024.0);
        } else if (bytes < 1024 * 1024 * 1024) {
            return String.format("%.2f MB", bytes / 1024.0 / 1024.0);
        } else {
            return String.format("%.2f GB", bytes / 1024.0 / 1024.0 / 1024.0);
        }
    }

    public void reset() {
        processesSucceeded.set(0);
        processesNotFound.set(0);
        processesAccessDenied.set(0);
        processesErrored.set(0);
        processesNotDispatched.set(0);
        documentsSaved.set(0);
        progressionsSaved.set(0);
        bulkWrites.set(0);
        failedWrites.set(0);
        documentsDownloaded.set(0);
        documentsFailed.set(0);
        bytesTransferred.set(0);
        failedProtocols.clear();
        metadataStatusTotals = Map.of();
        jobEndTime = null;

        log.info("Statistics reset");
    }
}
