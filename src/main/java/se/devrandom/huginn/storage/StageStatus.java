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

import se.devrandom.huginn.sei.ProcessFetchResult;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of one sync stage (metadata, documents, progressions) as stored in sync_status,
 * and of a single document download.
 */
public enum StageStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    ERROR("error"),
    NOT_FOUND("not_found"),
    ACCESS_DENIED("access_denied");

    /**
     * Metadata statuses a re-run skips.
     */
    public static final Set<StageStatus> TERMINAL = EnumSet.of(COMPLETED, NOT_FOUND, ACCESS_DENIED);

    private final String dbValue;

    StageStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static StageStatus fromDbValue(String value) {
        for (StageStatus status : values()) {
            if (status.dbValue.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown stage status: " + value);
    }

    public static StageStatus forMetadata(ProcessFetchResult.Status status) {
        return switch (status) {
            case SUCCESS -> COMPLETED;
            case NOT_FOUND -> NOT_FOUND;
            case ACCESS_DENIED -> ACCESS_DENIED;
            case ERROR -> ERROR;
        };
    }
}
