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
 * Process ("procedimento") metadata as returned by the consulta endpoint.
 */
public record ProcessRecord(
        String protocol,
        long procedureId,
        String procedureType,
        String specification,
        String accessLevel,
        String legalHypothesis,
        String observation,
        LocalDateTime openedAt,
        LocalDateTime concludedAt,
        JsonNode interestedParties,
        JsonNode subjects,
        String generatingUnit,
        JsonNode raw) {

    public static ProcessRecord fromApi(String protocol, JsonNode node) {
        return new ProcessRecord(
                protocol,
                SeiJson.longValue(node, "IdProcedimento"),
                SeiJson.nestedText(node, "TipoProcedimento", "Nome"),
                SeiJson.text(node, "Especificacao"),
                SeiJson.text(node, "NivelAcesso"),
                SeiJson.text(node, "HipoteseLegal"),
                SeiJson.text(node, "Observacao"),
                SeiDates.parse(SeiJson.text(node, "DataAutuacao")),
                SeiDates.parse(SeiJson.text(node, "DataConclusao")),
                SeiJson.array(node, "Interessados"),
                SeiJson.array(node, "Assuntos"),
                SeiJson.nestedText(node, "UnidadeGeradora", "Descricao"),
                node);
    }
}
