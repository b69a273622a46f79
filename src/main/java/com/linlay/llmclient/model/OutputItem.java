package com.linlay.llmclient.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

public sealed interface OutputItem {

    int index();

    record MessageOutput(int index, Message message) implements OutputItem {
        public MessageOutput {
            Objects.requireNonNull(message, "message cannot be null");
        }
    }

    record ToolCallOutput(int index, ContentPart.ToolCall call) implements OutputItem {
        public ToolCallOutput {
            Objects.requireNonNull(call, "call cannot be null");
        }
    }

    record ToolResultOutput(int index, ContentPart.ToolResult result) implements OutputItem {
        public ToolResultOutput {
            Objects.requireNonNull(result, "result cannot be null");
        }
    }

    record ReasoningOutput(int index, String text) implements OutputItem {
        public ReasoningOutput {
            text = text == null ? "" : text;
        }
    }

    record CustomOutput(int index, JsonNode data) implements OutputItem {
    }
}
