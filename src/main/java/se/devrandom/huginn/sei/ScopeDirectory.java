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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import se.devrandom.huginn.sei.objects.ScopeEntry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Unit name to unit id table, loaded from the login response.
 * The table is replaced wholesale on every login and never mutated in place.
 */
@Component
public class ScopeDirectory {
    private static final Logger log = LoggerFactory.getLogger(ScopeDirectory.class);
    private static final String SEPARATOR = "/";
    private static final int DIAGNOSTIC_SAMPLE = 5;

    private volatile Map<String, String> idsByName = Collections.emptyMap();

    public void replace(Collection<ScopeEntry> entries) {
        Map<String, String> table = new LinkedHashMap<>();
        for (ScopeEntry entry : entries) {
            table.putIfAbsent(entry.name(), entry.id());
        }
        idsByName = Collections.unmodifiableMap(table);
        log.debug("Scope directory loaded with {} units", table.size());
    }

    public boolean isLoaded() {
        return !idsByName.isEmpty();
    }

    public int size() {
        return idsByName.size();
    }

    /**
     * Exact name first, then ever shorter "/"-delimited prefixes of it.
     */
    public Optional<String> resolve(String name) {
        return resolveEntry(name).map(ScopeEntry::id);
    }

    /**
     * Like {@link #resolve}, but returns the unit that matched, which is a prefix of
     * {@code name} when there is no exact match.
     */
    public Optional<ScopeEntry> resolveEntry(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        Map<String, String> table = idsByName;

        String exact = table.get(name);
        if (exact != null) {
            return Optional.of(new ScopeEntry(name, exact));
        }

        String[] segments = name.split(SEPARATOR);
        for (int length = segments.length - 1; length >= 1; length--) {
            String prefix = String.join(SEPARATOR, Arrays.copyOf(segments, length));
            String id = table.get(prefix);
            if (id != null) {
                log.debug("Unit {} resolved via prefix {}", name, prefix);
                return Optional.of(new ScopeEntry(prefix, id));
            }
        }

        logUnresolved(name, table);
        return Optional.empty();
    }

    /**
     * All units of the tenant (the tenant itself and everything below it),
     * most path segments first. Ties keep the order SEI returned them in.
     */
    public List<ScopeEntry> siblingsOfTenant(String tenantPrefix) {
        List<ScopeEntry> siblings = new ArrayList<>();
        if (tenantPrefix == null || tenantPrefix.isBlank()) {
            return siblings;
        }
        for (Map.Entry<String, String> entry : idsByName.entrySet()) {
            String name = entry.getKey();
            if (name.equals(tenantPrefix) || name.startsWith(tenantPrefix + SEPARATOR)) {
                siblings.add(new ScopeEntry(name, entry.getValue()));
            }
        }
        siblings.sort(Comparator.comparingInt(ScopeEntry::depth).reversed());
        return siblings;
    }

    /**
     * First segment of a unit name, e.g. "SEAD-PI" for "SEAD-PI/GAB/NTI".
     */
    public static String tenantOf(String scopeName) {
        if (scopeName == null) {
            return null;
        }
        int slash = scopeName.indexOf(SEPARATOR);
        return slash < 0 ? scopeName : scopeName.substring(0, slash);
    }

    private void logUnresolved(String name, Map<String, String> table) {
        String tenant = tenantOf(name);
        List<String> available = new ArrayList<>();
        for (String known : table.keySet()) {
            if (known.equals(tenant) || known.startsWith(tenant + SEPARATOR)) {
                available.add(known);
            }
        }
        log.warn("Unit {} not found among {} known units; {} available under {}: {}",
                name, table.size(), available.size(), tenant,
                available.subList(0, Math.min(DIAGNOSTIC_SAMPLE, available.size())));
    }
}
