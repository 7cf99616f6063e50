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
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
public class SeiLoginResponse {
    public String token;
    public List<Unidade> unidades = new ArrayList<>();
    public SeiLoginResponse() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
    public static class Unidade {
        public String id;
        public String sigla;
        public Unidade() {}
    }

    /**
     * Units with both name and id, in the order SEI returned them.
     */
    public List<ScopeEntry> scopeEntries() {
        List<ScopeEntry> entries = new ArrayList<>();
        if (unidades == null) {
            return entries;
        }
        for (Unidade unidade : unidades) {
            if (unidade != null && unidade.sigla != null && unidade.id != null) {
                entries.add(new ScopeEntry(unidade.sigla, unidade.id));
            }
        }
        return entries;
    }
}
