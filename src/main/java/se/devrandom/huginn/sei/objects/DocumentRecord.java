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
 * A document attached to a process. documentId (IdDocumento) is the natural key.
 */
public record DocumentRecord(
        long documentId,
        String number,
        String documentType,
        LocalDateTime documentDate,
        String generatingUser,
        String generatingUnit,
        boolean signed,
        JsonNode signatories,
        String accessLevel,
        JsonNode raw) {

    public static DocumentRecord fromApi(JsonNode node) {
        return new DocumentRecord(
                SeiJson.longValue(node, "IdDocumento"),
                SeiJson.text(node, "Numero"),
                SeiJson.nestedText(node, "Serie", "Nome"),
                SeiDates.parse(SeiJson.text(node, "Data")),
                SeiJson.text(node, "UsuarioGerador"),
                SeiJson.nestedText(node, "UnidadeGeradora", "Descricao"),
                "S".equals(SeiJson.text(node, "SinAssinado")),
                SeiJson.array(node, "Assinantes"),
                SeiJson.text(node, "NivelAcesso"),
                node);
    }
}
