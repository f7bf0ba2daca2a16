package com.codearena.harness;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Renders JSON values as Go source literals, directed by the declared Go
 * parameter type.
 */
public final class GoLiteralRenderer {

    private static final Set<String> INTEGER_TYPES = Set.of(
            "int", "int8", "int16", "int32", "int64",
            "uint", "uint8", "uint16", "uint32", "uint64", "byte", "rune");
    private static final Set<String> FLOAT_TYPES = Set.of("float32", "float64");
    private static final Set<String> DYNAMIC_TYPES = Set.of("interface{}", "any");

    private final ObjectMapper objectMapper;

    public GoLiteralRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param value  the argument value, may be null
     * @param goType declared parameter type, or null when unknown
     */
    public String render(JsonNode value, String goType) {
        JsonNode v = value == null || value.isMissingNode() ? objectMapper.nullNode() : value;
        String type = goType == null ? "" : goType.replaceAll("\\s+", "");
        String lower = type.toLowerCase(Locale.ROOT);

        if (INTEGER_TYPES.contains(lower) || FLOAT_TYPES.contains(lower)) {
            return v.isNumber() ? v.toString() : lower + "(" + v + ")";
        }
        if (lower.equals("string")) {
            return quote(v.isValueNode() ? v.asText() : v.toString());
        }
        if (lower.equals("bool")) {
            return v.isBoolean() ? v.toString() : "bool(" + v + ")";
        }
        if (type.startsWith("[]")) {
            return renderSlice(v, type);
        }
        if (type.startsWith("map[string]")) {
            return renderMap(v, type);
        }
        if (DYNAMIC_TYPES.contains(lower)) {
            return renderDynamic(v);
        }
        return v.toString();
    }

    /** A Go interpreted string literal holding {@code text}. */
    public String quote(String text) {
        try {
            return objectMapper.writeValueAsString(text);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode string literal", e);
        }
    }

    private String renderSlice(JsonNode v, String type) {
        if (v.isNull()) return "nil";
        if (!v.isArray()) return v.toString();
        String elementType = type.substring(2);
        var sb = new StringBuilder(type).append('{');
        for (int i = 0; i < v.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(render(v.get(i), elementType));
        }
        return sb.append('}').toString();
    }

    private String renderMap(JsonNode v, String type) {
        if (v.isNull()) return "nil";
        if (!v.isObject()) return v.toString();
        String valueType = type.substring("map[string]".length());
        var sb = new StringBuilder(type).append('{');
        Iterator<Map.Entry<String, JsonNode>> fields = v.fields();
        boolean first = true;
        while (fields.hasNext()) {
            var field = fields.next();
            if (!first) sb.append(", ");
            sb.append(quote(field.getKey())).append(": ").append(render(field.getValue(), valueType));
            first = false;
        }
        return sb.append('}').toString();
    }

    private String renderDynamic(JsonNode v) {
        if (v.isNull()) return "nil";
        if (v.isTextual()) return quote(v.textValue());
        if (v.isArray()) return renderSlice(v, "[]interface{}");
        if (v.isObject()) return renderMap(v, "map[string]interface{}");
        return v.toString();
    }
}
