package com.linlay.llmclient.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

public sealed interface ResponseFormat {

    static ResponseFormat text() {
        return new Text();
    }

    static ResponseFormat jsonObject() {
        return new JsonObject();
    }

    static ResponseFormat jsonSchema(JsonNode schema) {
        return new JsonSchema("response_schema", schema, true);
    }

    record Text() implements ResponseFormat {
    }

    record JsonObject() implements ResponseFormat {
    }

    record JsonSchema(String name, JsonNode schema, boolean strict) implements ResponseFormat {
        public JsonSchema {
            Objects.requireNonNull(schema, "schema cannot be null");
            name = name == null || name.isBlank() ? "response_schema" : name;
            schema = schema.deepCopy();
        }
    }

    record Custom(JsonNode value) implements ResponseFormat {
        public Custom {
            Objects.requireNonNull(value, "custom response format cannot be null");
            value = value.deepCopy();
        }
    }
}
