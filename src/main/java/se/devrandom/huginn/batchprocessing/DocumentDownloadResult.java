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

/**
 * Result of one document download task
 */
public class DocumentDownloadResult {
    public enum Status {
        SUCCESS,   // Downloaded and stored in S3
        FAILED     // SEI refused or failed, or the upload failed after retries
    }

    private final Status status;
    private final long rowId;
    private final String storagePath;
    private final long sizeBytes;
    private final String sha256;
    private final String fileFormat;
    private final String errorMessage;

    private DocumentDownloadResult(Status status, long rowId, String storagePath, long sizeBytes,
                                   String sha256, String fileFormat, String errorMessage) {
        this.status = status;
        this.rowId = rowId;
        this.storagePath = storagePath;
        this.sizeBytes = sizeBytes;
        this.sha256 = sha256;
        this.fileFormat = fileFormat;
        this.errorMessage = errorMessage;
    }

    public static DocumentDownloadResult success(long rowId, String storagePath, long sizeBytes,
                                                 String sha256, String fileFormat) {
        return new DocumentDownloadResult(Status.SUCCESS, rowId, storagePath, sizeBytes, sha256, fileFormat, null);
    }

    public static DocumentDownloadResult failed(long rowId, String errorMessage) {
        return new DocumentDownloadResult(Status.FAILED, rowId, null, 0, null, null, errorMessage);
    }

    public Status status() {
        return status;
    }

    public long rowId() {
        return rowId;
    }

    public String storagePath() {
        return storagePath;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    public String sha256() {
        return sha256;
    }

    public String fileFormat() {
        return fileFormat;
    }

    public String errorMessage() {
        return errorMessage;
    }
}
