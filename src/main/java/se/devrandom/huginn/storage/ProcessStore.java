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

import java.sql.SQLException;
import java.util.List;

/**
 * Persistence used by the ingestion writer.
 */
public interface ProcessStore {

    /**
     * Persists a batch of fetch results in one transaction: processes, then their documents and
     * progressions, then one sync status row per protocol. Idempotent on protocol and on the
     * children's natural keys.
     *
     * @throws SQLException if the transaction failed and was rolled back
     */
    BulkWriteStats bulkUpsert(List<ProcessFetchResult> results) throws SQLException;
}
