package org.lite.toolgateway.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The custom-headers credential slot: a JSON object of header name to string
 * value. Headers the gateway owns may not be supplied.
 */
public final class CustomHeaders {

    public static final Set<String> FORBIDDEN_HEADERS = Set.of("authorization", "host", "content-length");

    private static final Pattern HEADER_NAME = Pattern.compile("^[!#$%&'*+.^_`|~0-9A-Za-z-]{1,128}$");

    private CustomHeaders() {
    }

    public static boolean isForbidden(String headerName) {
        return headerName == null || FORBIDDEN_HEADERS.contains(headerName.toLowerCase(Locale.ROOT));
    }

    /**
     * Parse and validate.
     *
     * @throws IllegalArgumentException naming the first problem found; the
     *                                  message never echoes header values
     */
    public static Map<String, String> parse(ObjectMapper objectMapper, String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("customHeaders must be a JSON object");
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("customHeaders must be a JSON object");
        }

        Map<String, String> headers = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (!HEADER_NAME.matcher(name).matches()) {
                throw new IllegalArgumentException("customHeaders contains an invalid header name");
            }
            if (isForbidden(name)) {
                throw new IllegalArgumentException("customHeaders may not set " + name);
            }
            JsonNode value = field.getValue();
            if (!value.isTextual() || containsLineBreak(value.asText())) {
                throw new IllegalArgumentException("customHeaders value for " + name + " must be a single-line string");
            }
            headers.put(name, value.asText());
        }
        return headers;
    }

    private static boolean containsLineBreak(String value) {
        return value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0;
    }
}
