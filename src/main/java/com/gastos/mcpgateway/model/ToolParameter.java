package com.gastos.mcpgateway.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declared input parameter of a tool.
 */
public record ToolParameter(
        String name,
        ParamType type,
        String description,
        boolean required,
        Object defaultValue,    // applied when the caller omits the parameter
        Double minimum,         // NUMBER / INTEGER only
        Double maximum,
        List<String> allowedValues  // STRING only, empty when unrestricted
) {

    public ToolParameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        allowedValues = allowedValues != null ? List.copyOf(allowedValues) : List.of();
    }

    public static ToolParameter of(String name, ParamType type, String description) {
        return new ToolParameter(name, type, description, false, null, null, null, List.of());
    }

    public ToolParameter asRequired() {
        return new ToolParameter(name, type, description, true, defaultValue, minimum, maximum, allowedValues);
    }

    public ToolParameter withDefault(Object value) {
        return new ToolParameter(name, type, description, required, value, minimum, maximum, allowedValues);
    }

    public ToolParameter between(double min, double max) {
        return new ToolParameter(name, type, description, required, defaultValue, min, max, allowedValues);
    }

    public ToolParameter oneOf(String... values) {
        return new ToolParameter(name, type, description, required, defaultValue, minimum, maximum, List.of(values));
    }

    /**
     * JSON-schema fragment for this parameter.
     */
    public Map<String, Object> schema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", type.schemaType());
        if (!allowedValues.isEmpty()) {
            schema.put("enum", allowedValues);
        }
        if (minimum != null) {
            schema.put("minimum", minimum);
        }
        if (maximum != null) {
            schema.put("maximum", maximum);
        }
        if (description != null) {
            schema.put("description", description);
        }
        if (defaultValue != null) {
            schema.put("default", defaultValue);
        }
        return schema;
    }

    public enum ParamType {
        STRING("string"),
        NUMBER("number"),
        INTEGER("integer"),
        BOOLEAN("boolean"),
        OBJECT("object");

        private final String schemaType;

        ParamType(String schemaType) {
            this.schemaType = schemaType;
        }

        public String schemaType() {
            return schemaType;
        }
    }
}
