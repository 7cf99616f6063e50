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
package se.devrandom.huginn.sei.objects;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of a paginated SEI list endpoint, normalized.
 * SEI returns either {"<itemsKey>": [...], "Info": {"TotalPaginas": n, "TotalItens": m}} or a bare array;
 * a bare array is a single page.
 */
public record PageEnvelope(List<JsonNode> items, int totalPages, int totalItems) {

    public static PageEnvelope from(JsonNode body, String itemsKey) {
        List<JsonNode> items = new ArrayList<>();

        if (body == null || body.isNull() || body.isMissingNode()) {
            return new PageEnvelope(items, 1, 0);
        }

        if (body.isArray()) {
            body.forEach(items::add);
            return new PageEnvelope(items, 1, items.size());
        }

        JsonNode itemsNode = body.path(itemsKey);
        if (itemsNode.isArray()) {
            itemsNode.forEach(items::add);
        }

        JsonNode info = body.path("Info");
        int totalPages = Math.max(1, info.path("TotalPaginas").asInt(1));
        int totalItems = info.path("TotalItens").asInt(items.size());
        return new PageEnvelope(items, totalPages, totalItems);
    }
}
