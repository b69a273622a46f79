package com.linlay.llmclient.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/**
 * 统一的多模态消息内容片段。
 * <p>
 * 某个 provider 接受哪些片段由 provider 自己声明并校验，模型层不做全局限制。
 */
public sealed interface ContentPart {

    static Text text(String text) {
        return new Text(text);
    }

    static ToolCall toolCall(String id, String name, JsonNode arguments) {
        return new ToolCall(id, name, arguments, ToolKind.FUNCTION);
    }

    static ToolResult toolResult(String callId, JsonNode output) {
        return new ToolResult(callId, output, false);
    }

    static ToolResult toolResult(String callId, String output) {
        return new ToolResult(callId, JsonNodeFactory.instance.textNode(output), false);
    }

    record Text(String text) implements ContentPart {
        public Text {
            text = text == null ? "" : text;
        }
    }

    record Image(ImageSource source, ImageDetail detail) implements ContentPart {
        public Image {
            Objects.requireNonNull(source, "image source cannot be null");
        }
    }

    record Audio(MediaSource source, String mimeType) implements ContentPart {
        public Audio {
            Objects.requireNonNull(source, "audio source cannot be null");
        }
    }

    record Video(MediaSource source, String mimeType) implements ContentPart {
        public Video {
            Objects.requireNonNull(source, "video source cannot be null");
        }
    }

    record FileRef(String fileId, String purpose) implements ContentPart {
        public FileRef {
            Objects.requireNonNull(fileId, "fileId cannot be null");
        }
    }

    record ToolCall(String id, String name, JsonNode arguments, ToolKind kind) implements ContentPart {
        public ToolCall {
            Objects.requireNonNull(name, "tool call name cannot be null");
            arguments = arguments == null ? JsonNodeFactory.instance.objectNode() : arguments.deepCopy();
            kind = kind == null ? ToolKind.FUNCTION : kind;
        }
    }

    record ToolResult(String callId, JsonNode output, boolean isError) implements ContentPart {
        public ToolResult {
            output = output == null ? JsonNodeFactory.instance.nullNode() : output.deepCopy();
        }

        public String outputText() {
            return output.isTextual() ? output.asText() : output.toString();
        }
    }

    record CustomData(JsonNode data) implements ContentPart {
        public CustomData {
            data = data == null ? JsonNodeFactory.instance.nullNode() : data.deepCopy();
        }
    }

    sealed interface ImageSource {
        record Url(String url) implements ImageSource {
        }

        record Base64(String data, String mimeType) implements ImageSource {
        }

        record FileId(String fileId) implements ImageSource {
        }
    }

    sealed interface MediaSource {
        record Inline(String data) implements MediaSource {
        }

        record Url(String url) implements MediaSource {
        }

        record FileId(String fileId) implements MediaSource {
        }
    }

    enum ImageDetail {
        LOW,
        HIGH,
        AUTO
    }
}
