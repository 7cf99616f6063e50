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
package se.devrandom.huginn.sei;

import se.devrandom.huginn.sei.objects.DocumentRecord;
import se.devrandom.huginn.sei.objects.ProcessRecord;
import se.devrandom.huginn.sei.objects.ProgressionRecord;

import java.util.List;

/**
 * Outcome of fetching one process across its candidate units. Carried through the ingestion
 * queue to the writer, which owns it from then on.
 */
public final class ProcessFetchResult {
    public enum Status {
        SUCCESS,
        NOT_FOUND,
        ACCESS_DENIED,   // no candidate unit could see the process
        ERROR
    }

    private final Status status;
    private final String protocol;
    private final String scopeName;
    private final String scopeId;
    private final ProcessRecord process;
    private final List<DocumentRecord> documents;
    private final List<ProgressionRecord> progressions;
    private final String message;
    private final List<String> triedScopes;

    private ProcessFetchResult(Status status, String protocol, String scopeName, String scopeId,
                               ProcessRecord process, List<DocumentRecord> documents,
                               List<ProgressionRecord> progressions, String message, List<String> triedScopes) {
        this.status = status;
        this.protocol = protocol;
        this.scopeName = scopeName;
        this.scopeId = scopeId;
        this.process = process;
        this.documents = documents;
        this.progressions = progressions;
        this.message = message;
        this.triedScopes = triedScopes;
    }

    public static ProcessFetchResult success(String protocol, String scopeName, String scopeId, ProcessRecord process,
                                             List<DocumentRecord> documents, List<ProgressionRecord> progressions,
                                             List<String> triedScopes) {
        return new ProcessFetchResult(Status.SUCCESS, protocol, scopeName, scopeId, process,
                List.copyOf(documents), List.copyOf(progressions), null, List.copyOf(triedScopes));
    }

    public static ProcessFetchResult notFound(String protocol, String scopeName, String message) {
        return new ProcessFetchResult(Status.NOT_FOUND, protocol, scopeName, null, null,
                List.of(), List.of(), message, scopeName != null ? List.of(scopeName) : List.of());
    }

    public static ProcessFetchResult accessDenied(String protocol, List<String> triedScopes, String message) {
        return new ProcessFetchResult(Status.ACCESS_DENIED, protocol, null, null, null,
                List.of(), List.of(), message, List.copyOf(triedScopes));
    }

    public static ProcessFetchResult error(String protocol, String message) {
        return new ProcessFetchResult(Status.ERROR, protocol, null, null, null,
                List.of(), List.of(), message, List.of());
    }

    public Status status() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public String protocol() {
        return protocol;
    }

    /**
     * Unit the process was found under (SUCCESS) or last tried (NOT_FOUND).
     */
    public String scopeName() {
        return scopeName;
    }

    public String scopeId() {
        return scopeId;
    }

    public ProcessRecord process() {
        return process;
    }

    public List<DocumentRecord> documents() {
        return documents;
    }

    public List<ProgressionRecord> progressions() {
        return progressions;
    }

    public String message() {
        return message;
    }

    public List<String> triedScopes() {
        return triedScopes;
    }

    @Override
    public String toString() {
        return "ProcessFetchResult{" + protocol + " " + status
                + (scopeName != null ? " via " + scopeName : "")
                + (message != null ? ": " + message : "") + "}";
    }
}
