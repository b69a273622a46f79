package com.linlay.llmclient.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

public sealed interface ToolChoice {

    static ToolChoice auto() {
        return new Auto();
    }

    static ToolChoice any() {
        return new Any();
    }

    static ToolChoice none() {
        return new None();
    }

    static ToolChoice tool(String name) {
        return new Tool(name);
    }

    record Auto() implements ToolChoice {
    }

    record Any() implements ToolChoice {
    }

    record None() implements ToolChoice {
    }

    record Tool(String name) implements ToolChoice {
        public Tool {
            Objects.requireNonNull(name, "tool name cannot be null");
        }
    }

    record Custom(JsonNode value) implements ToolChoice {
        public Custom {
            Objects.requireNonNull(value, "custom tool choice cannot be null");
            value = value.deepCopy();
        }
    }
}
