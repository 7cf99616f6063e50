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

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import se.devrandom.huginn.sei.objects.DocumentRecord;
import se.devrandom.huginn.sei.objects.DownloadedContent;
import se.devrandom.huginn.sei.objects.ProcessRecord;
import se.devrandom.huginn.sei.objects.ProgressionRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Typed wrappers around the SEI REST endpoints used by the sync.
 */
@Component
public class SeiApiClient {

    static final int DOCUMENTS_PAGE_SIZE = 15;
    static final int PROGRESSIONS_PAGE_SIZE = 100;

    private final SeiRequestExecutor requestExecutor;
    private final ParallelPaginator paginator;

    @Autowired
    public SeiApiClient(SeiRequestExecutor requestExecutor, ParallelPaginator paginator) {
        this.requestExecutor = requestExecutor;
        this.paginator = paginator;
    }

    public FetchOutcome<ProcessRecord> consultProcess(String scopeId, String protocol) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("protocolo_procedimento", protocol);
        params.put("sin_retornar_atributos", "N");
        params.put("sinal_completo", "S");
        return requestExecutor.get(unitPath(scopeId, "/procedimentos/consulta"), params)
                .map(body -> ProcessRecord.fromApi(protocol, body));
    }

    public FetchOutcome<List<DocumentRecord>> listDocuments(String scopeId, String protocol) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("protocolo_procedimento", protocol);
        params.put("sinal_completo", "S");
        return paginator.fetchAll(unitPath(scopeId, "/procedimentos/documentos"), params, "Documentos", DOCUMENTS_PAGE_SIZE)
                .map(items -> mapAll(items, DocumentRecord::fromApi));
    }

    public FetchOutcome<List<ProgressionRecord>> listProgressions(String scopeId, String protocol) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("protocolo_procedimento", protocol);
        params.put("sinal_atributos", "S");
        return paginator.fetchAll(unitPath(scopeId, "/procedimentos/andamentos"), params, "Andamentos", PROGRESSIONS_PAGE_SIZE)
                .map(items -> mapAll(items, ProgressionRecord::fromApi));
    }

    public FetchOutcome<DownloadedContent> downloadDocument(String scopeId, long documentId) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("protocolo_documento", documentId);
        return requestExecutor.download(unitPath(scopeId, "/documentos/baixar"), params);
    }

    private static String unitPath(String scopeId, String suffix) {
        return "/v1/unidades/" + scopeId + suffix;
    }

    private static <T> List<T> mapAll(List<JsonNode> items, Function<JsonNode, T> mapper) {
        List<T> mapped = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            if (item != null && item.isObject()) {
                mapped.add(mapper.apply(item));
            }
        }
        return mapped;
    }
}
