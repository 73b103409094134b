package com.github.dimitryivaniuta.canvas.http.middleware.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks secrets before they reach a log line.
 *
 * <p>A header name or JSON key is sensitive when it contains one of the configured fields,
 * ignoring case: {@code access_token} and {@code X-Refresh-Token} both match {@code token}.
 * JSON is walked recursively through objects and arrays. Anything that does not parse as a JSON
 * object or array gets a regex pass over {@code field=value} and {@code field: value}.
 */
public class SensitiveDataSanitizer {

    public static final String REDACTED = "***REDACTED***";

    private final List<String> fields;
    private final List<Pattern> inlinePatterns;
    private final ObjectMapper objectMapper;

    public SensitiveDataSanitizer(List<String> fields, ObjectMapper objectMapper) {
        this.fields = fields.stream()
                .filter(f -> f != null && !f.isBlank())
                .map(f -> f.toLowerCase(Locale.ROOT))
                .toList();
        this.inlinePatterns = this.fields.stream()
                .map(f -> Pattern.compile("(" + Pattern.quote(f) + "\\s*[=:]\\s*)([^\\s&,}\"']+)", Pattern.CASE_INSENSITIVE))
                .toList();
        this.objectMapper = objectMapper;
    }

    public boolean isSensitive(String name) {
        if (name == null) return false;
        String lower = name.toLowerCase(Locale.ROOT);
        for (String f : fields) {
            if (lower.contains(f)) return true;
        }
        return false;
    }

    public Map<String, List<String>> sanitizeHeaders(Map<String, List<String>> headers) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        headers.forEach((name, values) ->
                out.put(name, isSensitive(name) ? List.of(REDACTED) : new ArrayList<>(values)));
        return out;
    }

    /** The URI as text with sensitive query parameters masked. */
    public String sanitizeUri(URI uri) {
        String raw = uri.toString();
        String query = uri.getRawQuery();
        if (query == null || query.isEmpty()) return raw;
        int start = raw.indexOf('?') + 1;
        return raw.substring(0, start) + sanitizeText(query) + raw.substring(start + query.length());
    }

    public String sanitizeBody(String body) {
        if (body == null || body.isEmpty()) return body;

        JsonNode json = parseContainer(body);
        if (json != null) {
            redact(json);
            try {
                return objectMapper.writeValueAsString(json);
            } catch (JsonProcessingException e) {
                return sanitizeText(body);
            }
        }
        return sanitizeText(body);
    }

    private JsonNode parseContainer(String body) {
        String trimmed = body.trim();
        if (!(trimmed.startsWith("{") || trimmed.startsWith("["))) return null;
        try {
            JsonNode node = objectMapper.readTree(trimmed);
            return (node != null && node.isContainerNode()) ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private void redact(JsonNode node) {
        if (node instanceof ObjectNode obj) {
            Iterator<Map.Entry<String, JsonNode>> it = obj.fields();
            List<String> sensitive = new ArrayList<>();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (isSensitive(e.getKey())) {
                    sensitive.add(e.getKey());
                } else {
                    redact(e.getValue());
                }
            }
            sensitive.forEach(k -> obj.put(k, REDACTED));
        } else if (node instanceof ArrayNode arr) {
            arr.forEach(this::redact);
        }
    }

    private String sanitizeText(String body) {
        String out = body;
        for (Pattern p : inlinePatterns) {
            out = p.matcher(out).replaceAll("$1" + Matcher.quoteReplacement(REDACTED));
        }
        return out;
    }
}
