package com.gastos.mcpgateway.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of a registered tool: name, purpose, declared parameters
 * and the scope a caller needs to invoke it (null when none is required).
 */
public record ToolDescriptor(
        String name,
        String description,
        List<ToolParameter> parameters,
        String requiredScope
) {

    public ToolDescriptor {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        Objects.requireNonNull(description, "description");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    /**
     * JSON-schema "inputSchema" object, properties in declaration order.
     */
    public Map<String, Object> inputSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (ToolParameter parameter : parameters) {
            properties.put(parameter.name(), parameter.schema());
        }
        List<String> required = parameters.stream()
                .filter(ToolParameter::required)
                .map(ToolParameter::name)
                .toList();

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    /**
     * Discovery representation: name, description and inputSchema.
     */
    public Map<String, Object> schema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("name", name);
        schema.put("description", description);
        schema.put("inputSchema", inputSchema());
        return schema;
    }
}
