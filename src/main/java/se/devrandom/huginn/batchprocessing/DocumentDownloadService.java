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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import se.devrandom.huginn.sei.SeiApiClient;
import se.devrandom.huginn.sei.SeiAuthenticationException;
import se.devrandom.huginn.storage.PendingDocument;
import se.devrandom.huginn.storage.PostgresService;
import se.devrandom.huginn.storage.S3Service;
import se.devrandom.huginn.storage.SyncStatisticsService;

import java.io.IOException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Downloads pending document binaries into S3 and tracks their status in PostgreSQL.
 */
@Service
public class DocumentDownloadService {
    private static final Logger log = LoggerFactory.getLogger(DocumentDownloadService.class);

    // Generous for a large binary plus upload retries
    private static final long TASK_TIMEOUT_MINUTES = 10;
    // Claims older than this were left behind by a run that died before recording a result
    static final int STALE_CLAIM_MINUTES = 60;

    private final PostgresService postgresService;
    private final S3Service s3Service;
    private final SeiApiClient apiClient;
    private final SyncStatisticsService statisticsService;

    public record Summary(int downloaded, int failed) {
    }

    @Autowired
    public DocumentDownloadService(PostgresService postgresService, S3Service s3Service, SeiApiClient apiClient,
                                   SyncStatisticsService statisticsService) {
        this.postgresService = postgresService;
        this.s3Service = s3Service;
        this.apiClient = apiClient;
        this.statisticsService = statisticsService;
    }

    /**
     * @throws SeiAuthenticationException if SEI login failed; documents already finished keep their status
     */
    public Summary downloadPending(int limit, int concurrency, int maxAttempts) throws SQLException, IOException {
        int released = postgresService.releaseStaleDocumentClaims(STALE_CLAIM_MINUTES, maxAttempts);
        if (released > 0) {
            log.warn("Released {} documents stuck in processing for over {} minutes", released, STALE_CLAIM_MINUTES);
        }

        List<PendingDocument> documents = postgresService.loadPendingDocuments(limit, maxAttempts);
        if (documents.isEmpty()) {
            log.info("No documents pending download");
            return new Summary(0, 0);
        }
        log.info("Downloading {} documents (concurrency={}, maxAttempts={})", documents.size(), concurrency, maxAttempts);

        s3Service.ensureBucketExists();

        AtomicInteger threadCounter = new AtomicInteger(0);
        ExecutorService executor = Executors.newFixedThreadPool(concurrency, r -> {
            Thread thread = new Thread(r);
            thread.setName("doc-download-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        record Submitted(PendingDocument document, Future<DocumentDownloadResult> future) {
        }

        int downloaded = 0;
        int failed = 0;
        int statusWriteFailures = 0;
        Set<String> touchedProtocols = new LinkedHashSet<>();
        SeiAuthenticationException authFailure = null;

        try {
            List<Submitted> submitted = new ArrayList<>();
            for (PendingDocument document : documents) {
                try {
                    postgresService.markDocumentDownloading(document.rowId());
                } catch (SQLException e) {
                    log.error("Could not claim document {} for download, skipping it: {}",
                            document.documentId(), e.getMessage());
                    continue;
                }
                touchedProtocols.add(document.protocol());
                submitted.add(new Submitted(document,
                        executor.submit(new DocumentDownloadTask(document, apiClient, s3Service, statisticsService))));
            }

            for (Submitted entry : submitted) {
                PendingDocument document = entry.document();
                DocumentDownloadResult result;
                if (authFailure != null) {
                    entry.future().cancel(true);
                    result = DocumentDownloadResult.failed(document.rowId(), "Not attempted: " + authFailure.getMessage());
                } else {
                    try {
                        result = entry.future().get(TASK_TIMEOUT_MINUTES, TimeUnit.MINUTES);
                    } catch (TimeoutException e) {
                        log.error("Download of document {} timed out after {} minutes, cancelling it",
                                document.documentId(), TASK_TIMEOUT_MINUTES);
                        entry.future().cancel(true);
                        statisticsService.incrementDocumentFailed();
                        result = DocumentDownloadResult.failed(document.rowId(), "Timed out");
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException("Interrupted while waiting for document downloads", e);
                    } catch (ExecutionException e) {
                        if (e.getCause() instanceof SeiAuthenticationException authError) {
                            authFailure = authError;
                            result = DocumentDownloadResult.failed(document.rowId(), "Not attempted: " + authError.getMessage());
                        } else {
                            log.error("Error executing download of document {}", document.documentId(), e.getCause());
                            statisticsService.incrementDocumentFailed();
                            result = DocumentDownloadResult.failed(document.rowId(), String.valueOf(e.getCause()));
                        }
                    }
                }

                try {
                    if (record(result, maxAttempts)) {
                        downloaded++;
                    } else {
                        failed++;
                    }
                } catch (SQLException e) {
                    // Row stays in processing until releaseStaleDocumentClaims hands it back
                    log.error("Could not record the result of document {} ({}): {}",
                            document.documentId(), result.status(), e.getMessage(), e);
                    statusWriteFailures++;
                    failed++;
                }
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                    log.warn("Download executor did not terminate in 60 seconds, forcing shutdown");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            refreshProgress(touchedProtocols);
        }

        if (statusWriteFailures > 0) {
            log.warn("{} document results could not be recorded", statusWriteFailures);
        }
        log.info("Document downloads complete: downloaded={}, failed={}", downloaded, failed);

        if (authFailure != null) {
            throw authFailure;
        }
        return new Summary(downloaded, failed);
    }

    private void refreshProgress(Set<String> protocols) {
        try {
            postgresService.refreshDocumentProgress(protocols);
        } catch (SQLException e) {
            log.error("Could not refresh document progress of {} processes: {}", protocols.size(), e.getMessage(), e);
        }
    }

    private boolean record(DocumentDownloadResult result, int maxAttempts) throws SQLException {
        if (result.status() == DocumentDownloadResult.Status.SUCCESS) {
            postgresService.markDocumentDownloaded(result.rowId(), s3Service.getBucketName(), result.storagePath(),
                    result.sizeBytes(), result.sha256(), result.fileFormat());
            return true;
        }
        postgresService.markDocumentFailed(result.rowId(), result.errorMessage(), maxAttempts);
        return false;
    }
}
