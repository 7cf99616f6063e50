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
import se.devrandom.huginn.util.SeiDates;

import java.time.LocalDateTime;

/**
 * A progression event ("andamento") in a process history.
 * progressionId is unique within its process.
 */
public record ProgressionRecord(
        long progressionId,
        String task,
        String description,
        String user,
        String originUnit,
        LocalDateTime occurredAt,
        JsonNode attributes,
        JsonNode raw) {

    public static ProgressionRecord fromApi(JsonNode node) {
        return new ProgressionRecord(
                SeiJson.longValue(node, "IdAndamento"),
                SeiJson.text(node, "Tarefa"),
                SeiJson.text(node, "Descricao"),
                userOf(node.path("Usuario")),
                SeiJson.nestedText(node, "Unidade", "Descricao"),
                SeiDates.parse(SeiJson.text(node, "DataHora")),
                SeiJson.array(node, "Atributos"),
                node);
    }

    // Usuario is either {"Sigla": ..., "Nome": ...} or a plain string
    private static String userOf(JsonNode usuario) {
        if (usuario.isObject()) {
            String sigla = SeiJson.text(usuario, "Sigla");
            return sigla != null && !sigla.isEmpty() ? sigla : SeiJson.text(usuario, "Nome");
        }
        if (usuario.isMissingNode() || usuario.isNull()) {
            return null;
        }
        return usuario.asText();
    }
}
