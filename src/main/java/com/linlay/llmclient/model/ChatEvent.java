package com.linlay.llmclient.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 流式增量事件。一个 {@link ChatChunk} 按顺序携带零到多个事件。
 */
public sealed interface ChatEvent {

    record TextDelta(int index, String text) implements ChatEvent {
        public TextDelta {
            text = text == null ? "" : text;
        }
    }

    record ToolCallDelta(int index, String id, String name, String argumentsDelta) implements ChatEvent {
    }

    record ReasoningDelta(String text) implements ChatEvent {
        public ReasoningDelta {
            text = text == null ? "" : text;
        }
    }

    record FinishSignal(FinishReason reason, String rawReason) implements ChatEvent {
    }

    record Done() implements ChatEvent {
    }

    record ErrorEvent(String message, JsonNode raw) implements ChatEvent {
    }

    record Custom(JsonNode data) implements ChatEvent {
    }
}
