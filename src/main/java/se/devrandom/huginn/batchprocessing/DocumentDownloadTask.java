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
import se.devrandom.huginn.sei.FetchOutcome;
import se.devrandom.huginn.sei.SeiApiClient;
import se.devrandom.huginn.sei.SeiAuthenticationException;
import se.devrandom.huginn.sei.objects.DownloadedContent;
import se.devrandom.huginn.storage.PendingDocument;
import se.devrandom.huginn.storage.S3Service;
import se.devrandom.huginn.storage.SyncStatisticsService;
import se.devrandom.huginn.util.RetryUtil;

import java.util.concurrent.Callable;

/**
 * Downloads one document binary from SEI and stores it in S3.
 *
 * The SEI call goes through the request executor, which already retries. The S3 upload is
 * retried here on transient failures only. Document bytes are held in memory (bounded by the
 * WebClient buffer limit).
 */
public class DocumentDownloadTask implements Callable<DocumentDownloadResult> {
    private static final Logger log = LoggerFactory.getLogger(DocumentDownloadTask.class);

    static final int UPLOAD_ATTEMPTS = 3;
    static final long UPLOAD_INITIAL_DELAY_MS = 1000;

    private final PendingDocument document;
    private final SeiApiClient apiClient;
    private final S3Service s3Service;
    private final SyncStatisticsService statisticsService;

    public DocumentDownloadTask(PendingDocument document, SeiApiClient apiClient, S3Service s3Service,
                                SyncStatisticsService statisticsService) {
        this.document = document;
        this.apiClient = apiClient;
        this.s3Service = s3Service;
        this.statisticsService = statisticsService;
    }

    /**
     * @throws SeiAuthenticationException if SEI login failed; every other failure is a FAILED result
     */
    @Override
    public DocumentDownloadResult call() {
        long documentId = document.documentId();

        FetchOutcome<DownloadedContent> outcome;
        try {
            outcome = apiClient.downloadDocument(document.scopeId(), documentId);
        } catch (SeiAuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            return failed("Download failed: " + e.getMessage());
        }

        if (!outcome.isSuccess()) {
            return failed("Download refused: " + outcome);
        }
        DownloadedContent content = outcome.payload();
        if (content.size() == 0) {
            return failed("SEI returned an empty document");
        }

        String extension = content.fileExtension();
        String sha256 = S3Service.sha256Hex(content.content());
        String key = s3Service.buildDocumentKey(document.protocol(), documentId, extension);
        String contentType = content.contentType() != null && !content.contentType().isBlank()
                ? content.contentType()
                : S3Service.contentTypeFor(extension);

        try {
            RetryUtil.executeWithRetry(
                    () -> s3Service.uploadDocument(content.content(), key, contentType, sha256,
                            document.protocol(), documentId),
                    UPLOAD_ATTEMPTS, UPLOAD_INITIAL_DELAY_MS, "Upload of document " + documentId);
        } catch (Exception e) {
            return failed("Upload failed: " + e.getMessage());
        }

        statisticsService.incrementDocumentDownloaded(content.size());
        log.debug("Stored document {} of {} at {} ({} bytes)", documentId, document.protocol(), key, content.size());
        return DocumentDownloadResult.success(document.rowId(), key, content.size(), sha256, extension);
    }

    private DocumentDownloadResult failed(String message) {
        log.error("Document {} of {} failed (attempt {}): {}",
                document.documentId(), document.protocol(), document.attempts() + 1, message);
        statisticsService.incrementDocumentFailed();
        return DocumentDownloadResult.failed(document.rowId(), message);
    }
}
