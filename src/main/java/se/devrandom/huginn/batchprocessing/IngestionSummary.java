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
 * Aggregate counters of one ingestion run.
 *
 * @param notDispatched records never fetched because the run was stopped, hit its deadline or lost authentication
 * @param failedWrites  bulk upserts that were rolled back; their items are counted as errored
 */
public record IngestionSummary(
        int succeeded,
        int notFound,
        int accessDenied,
        int errored,
        int notDispatched,
        int documentsSaved,
        int progressionsSaved,
        int bulkWrites,
        int failedWrites) {

    public static final IngestionSummary EMPTY = new IngestionSummary(0, 0, 0, 0, 0, 0, 0, 0, 0);

    public int processed() {
        return succeeded + notFound + accessDenied + errored;
    }
}
