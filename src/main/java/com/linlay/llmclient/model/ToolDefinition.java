package com.linlay.llmclient.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ToolDefinition(
        ToolKind kind,
        String name,
        String description,
        JsonNode parameters,
        Map<String, Object> metadata
) {

    public ToolDefinition {
        Objects.requireNonNull(name, "tool name cannot be null");
        kind = kind == null ? ToolKind.FUNCTION : kind;
        parameters = parameters == null || parameters.isNull() || parameters.isMissingNode()
                ? defaultParameters()
                : parameters.deepCopy();
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ToolDefinition function(String name, String description, JsonNode parameters) {
        return new ToolDefinition(ToolKind.FUNCTION, name, description, parameters, null);
    }

    private static ObjectNode defaultParameters() {
        ObjectNode schema = JsonNodeFactory.instance.objectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        schema.put("additionalProperties", true);
        return schema;
    }
}
