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

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Classifies SEI error bodies of the form {"detail": [{"msg": "..."}, ...]}.
 *
 * SEI only signals "no access" and "not found" through message text, so this is a substring
 * heuristic. Both vocabularies are configurable (huginn.errors.*) for installations whose
 * wording differs.
 */
@Component
public class SeiErrorClassifier {
    private static final Logger log = LoggerFactory.getLogger(SeiErrorClassifier.class);

    static final List<String> DEFAULT_ACCESS_DENIED_PATTERNS = List.of(
            "não possui acesso ao processo",
            "does not have access to process");

    static final List<String> DEFAULT_NOT_FOUND_PATTERNS = List.of(
            "não encontrado",
            "not found",
            "não existe",
            "does not exist");

    public enum Classification {
        SCOPE_ACCESS_DENIED,
        NOT_FOUND,
        UNCLASSIFIED
    }

    private final List<String> accessDeniedPatterns;
    private final List<String> notFoundPatterns;

    @Autowired
    public SeiErrorClassifier(
            @Value("${huginn.errors.access-denied-patterns:}") String[] accessDeniedPatterns,
            @Value("${huginn.errors.not-found-patterns:}") String[] notFoundPatterns) {
        this.accessDeniedPatterns = normalize(accessDeniedPatterns, DEFAULT_ACCESS_DENIED_PATTERNS);
        this.notFoundPatterns = normalize(notFoundPatterns, DEFAULT_NOT_FOUND_PATTERNS);
        log.debug("Error classifier: access denied {}, not found {}", this.accessDeniedPatterns, this.notFoundPatterns);
    }

    public SeiErrorClassifier() {
        this(new String[0], new String[0]);
    }

    /**
     * Access denial takes precedence over not-found.
     */
    public Classification classify(String responseBody) {
        List<String> messages = detailMessages(responseBody);
        if (messages.isEmpty()) {
            return Classification.UNCLASSIFIED;
        }
        for (String message : messages) {
            if (containsAny(message, accessDeniedPatterns)) {
                return Classification.SCOPE_ACCESS_DENIED;
            }
        }
        for (String message : messages) {
            if (containsAny(message, notFoundPatterns)) {
                return Classification.NOT_FOUND;
            }
        }
        return Classification.UNCLASSIFIED;
    }

    /**
     * The detail messages joined with "; ", or the raw body (truncated) when it has none.
     */
    public String describe(String responseBody) {
        List<String> messages = detailMessages(responseBody);
        if (!messages.isEmpty()) {
            return String.join("; ", messages);
        }
        if (responseBody == null || responseBody.isBlank()) {
            return "";
        }
        return responseBody.length() > 200 ? responseBody.substring(0, 200) + "..." : responseBody;
    }

    List<String> detailMessages(String responseBody) {
        List<String> messages = new ArrayList<>();
        if (responseBody == null || responseBody.isBlank()) {
            return messages;
        }
        try {
            JSONObject json = new JSONObject(responseBody);
            Object detail = json.opt("detail");
            if (detail instanceof JSONArray items) {
                for (int i = 0; i < items.length(); i++) {
                    JSONObject item = items.optJSONObject(i);
                    if (item != null && item.has("msg")) {
                        messages.add(item.optString("msg"));
                    } else if (item == null && items.opt(i) instanceof String text) {
                        messages.add(text);
                    }
                }
            } else if (detail instanceof String text) {
                messages.add(text);
            }
        } catch (JSONException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
        }
        return messages;
    }

    private static boolean containsAny(String message, List<String> patterns) {
        String lower = message.toLowerCase(Locale.ROOT);
        for (String pattern : patterns) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> normalize(String[] configured, List<String> defaults) {
        List<String> patterns = new ArrayList<>();
        if (configured != null) {
            Arrays.stream(configured)
                    .map(String::trim)
                    .filter(p -> !p.isEmpty())
                    .map(p -> p.toLowerCase(Locale.ROOT))
                    .forEach(patterns::add);
        }
        return patterns.isEmpty() ? defaults : List.copyOf(patterns);
    }
}
