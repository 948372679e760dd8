package org.miniworker.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;

import java.io.InputStream;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsing JSON bodies and reading path parameters
 */
public class HttpRequestUtil {

    /**
     * Reads the request body as a JSON object. An empty body yields an empty map.
     * On malformed JSON a 400 is sent and {@code null} returned; the caller must stop.
     */
    public static Map<String, Object> parseJson(HttpServerExchange exchange) {
        try (InputStream is = exchange.getInputStream()) {
            byte[] body = is.readAllBytes();
            if (body.length == 0) {
                return new LinkedHashMap<>();
            }
            Map<String, Object> parsed = JsonUtil.mapper().readValue(body, new TypeReference<LinkedHashMap<String, Object>>() {});
            return parsed != null ? parsed : new LinkedHashMap<>();
        } catch (Exception e) {
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid JSON: " + e.getMessage());
            return null;
        }
    }

    /**
     * Path template parameter, e.g. {@code name} of {@code /workers/{name}}.
     */
    public static String pathParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.getFirst();
    }

    // Read nested objects eg {"parameters": {...}}
    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return null;
    }
}
