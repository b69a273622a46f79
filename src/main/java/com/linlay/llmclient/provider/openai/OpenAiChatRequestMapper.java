package com.linlay.llmclient.provider.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.llmclient.error.LlmException;
import com.linlay.llmclient.model.ChatOptions;
import com.linlay.llmclient.model.ChatRequest;
import com.linlay.llmclient.model.ContentPart;
import com.linlay.llmclient.model.Message;
import com.linlay.llmclient.model.ResponseFormat;
import com.linlay.llmclient.model.Role;
import com.linlay.llmclient.model.ToolChoice;
import com.linlay.llmclient.model.ToolDefinition;
import com.linlay.llmclient.model.ToolKind;
import com.linlay.llmclient.validation.RequestValidators;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 统一请求 → OpenAI Chat Completions 请求体。
 */
public class OpenAiChatRequestMapper {

    private final ObjectMapper objectMapper;

    public OpenAiChatRequestMapper(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public ObjectNode toBody(ChatRequest request, String model, boolean stream) {
        ChatOptions options = request.options();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.set("messages", toMessages(request.messages()));

        if (options.temperature() != null) {
            body.put("temperature", options.temperature());
        }
        if (options.topP() != null) {
            body.put("top_p", options.topP());
        }
        // max_tokens rather than max_completion_tokens: compatible gateways mostly only know the former
        if (options.maxOutputTokens() != null) {
            body.put("max_tokens", options.maxOutputTokens());
        }
        if (options.presencePenalty() != null) {
            body.put("presence_penalty", options.presencePenalty());
        }
        if (options.frequencyPenalty() != null) {
            body.put("frequency_penalty", options.frequencyPenalty());
        }
        if (options.parallelToolCalls() != null) {
            body.put("parallel_tool_calls", options.parallelToolCalls());
        }
        ChatOptions.ReasoningOptions reasoning = options.reasoning();
        if (reasoning != null) {
            if (reasoning.effort() != null) {
                body.put("reasoning_effort", reasoning.effort().name().toLowerCase(Locale.ROOT));
            }
            if (reasoning.budgetTokens() != null) {
                body.put("max_reasoning_tokens", reasoning.budgetTokens());
            }
            putAll(body, reasoning.extra());
        }
        if (!request.tools().isEmpty()) {
            body.set("tools", toTools(request.tools()));
        }
        if (request.toolChoice() != null) {
            body.set("tool_choice", toToolChoice(request.toolChoice()));
        }
        if (request.responseFormat() != null) {
            body.set("response_format", toResponseFormat(request.responseFormat()));
        }
        if (!request.metadata().isEmpty()) {
            body.set("metadata", objectMapper.valueToTree(request.metadata()));
        }
        putAll(body, options.extra());
        body.put("stream", stream);
        if (stream) {
            body.putObject("stream_options").put("include_usage", true);
        }
        return body;
    }

    ArrayNode toMessages(List<Message> messages) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Message message : messages) {
            array.add(toMessage(message));
        }
        return array;
    }

    ObjectNode toMessage(Message message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("role", message.role().value());
        if (message.name() != null) {
            node.put("name", message.name());
        }
        if (message.role() == Role.TOOL) {
            ContentPart.ToolResult result = RequestValidators.requireSingleToolResult(message);
            node.put("tool_call_id", RequestValidators.requireToolCallId(result));
            node.put("content", result.outputText());
            return node;
        }

        List<JsonNode> contentParts = new ArrayList<>();
        ArrayNode toolCalls = objectMapper.createArrayNode();
        for (ContentPart part : message.content()) {
            if (part instanceof ContentPart.ToolCall call) {
                toolCalls.add(toToolCall(call));
            } else if (part instanceof ContentPart.ToolResult) {
                throw LlmException.validation("tool results must be sent in a tool role message");
            } else {
                contentParts.add(toContentPart(part));
            }
        }

        if (contentParts.isEmpty()) {
            node.putNull("content");
        } else if (contentParts.size() == 1 && message.content().get(0) instanceof ContentPart.Text text
                && toolCalls.isEmpty()) {
            node.put("content", text.text());
        } else {
            node.putArray("content").addAll(contentParts);
        }
        if (!toolCalls.isEmpty()) {
            node.set("tool_calls", toolCalls);
        }
        return node;
    }

    JsonNode toContentPart(ContentPart part) {
        ObjectNode node = objectMapper.createObjectNode();
        if (part instanceof ContentPart.Text text) {
            node.put("type", "text");
            node.put("text", text.text());
        } else if (part instanceof ContentPart.Image image) {
            String detail = image.detail() == null ? "auto" : image.detail().name().toLowerCase(Locale.ROOT);
            if (image.source() instanceof ContentPart.ImageSource.Url url) {
                node.put("type", "image_url");
                ObjectNode imageUrl = node.putObject("image_url");
                imageUrl.put("url", url.url());
                imageUrl.put("detail", detail);
            } else if (image.source() instanceof ContentPart.ImageSource.Base64 base64) {
                String mime = base64.mimeType() == null ? "application/octet-stream" : base64.mimeType();
                node.put("type", "image_url");
                ObjectNode imageUrl = node.putObject("image_url");
                imageUrl.put("url", "data:" + mime + ";base64," + base64.data());
                imageUrl.put("detail", detail);
            } else if (image.source() instanceof ContentPart.ImageSource.FileId fileId) {
                node.put("type", "input_image");
                node.putObject("input_image").put("file_id", fileId.fileId());
            }
        } else if (part instanceof ContentPart.Audio audio) {
            node.put("type", "input_audio");
            ObjectNode inputAudio = node.putObject("input_audio");
            inputAudio.put("data", mediaReference(audio.source()));
            inputAudio.put("format", audio.mimeType() == null ? "wav" : audio.mimeType());
        } else if (part instanceof ContentPart.Video video) {
            node.put("type", "input_video");
            ObjectNode inputVideo = node.putObject("input_video");
            ObjectNode source = inputVideo.putObject("source");
            if (video.source() instanceof ContentPart.MediaSource.Inline inline) {
                source.put("data", inline.data());
            } else if (video.source() instanceof ContentPart.MediaSource.FileId fileId) {
                source.put("file_id", fileId.fileId());
            } else if (video.source() instanceof ContentPart.MediaSource.Url url) {
                source.put("url", url.url());
            }
            inputVideo.put("format", video.mimeType());
        } else if (part instanceof ContentPart.FileRef file) {
            node.put("type", "file");
            node.putObject("file").put("file_id", file.fileId());
        } else if (part instanceof ContentPart.CustomData custom) {
            return custom.data().deepCopy();
        }
        return node;
    }

    private ObjectNode toToolCall(ContentPart.ToolCall call) {
        if (call.kind() != ToolKind.FUNCTION) {
            throw LlmException.validation("OpenAI only supports function tool calls");
        }
        ObjectNode node = objectMapper.createObjectNode();
        if (call.id() != null) {
            node.put("id", call.id());
        }
        node.put("type", "function");
        ObjectNode function = node.putObject("function");
        function.put("name", call.name());
        function.put("arguments", call.arguments() == null ? "{}" : call.arguments().toString());
        return node;
    }

    ArrayNode toTools(List<ToolDefinition> tools) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ToolDefinition tool : tools) {
            if (tool.kind() != ToolKind.FUNCTION) {
                throw LlmException.validation("OpenAI Chat tools only support function definitions");
            }
            ObjectNode node = array.addObject();
            node.put("type", "function");
            ObjectNode function = node.putObject("function");
            function.put("name", tool.name());
            if (tool.description() != null && !tool.description().isBlank()) {
                function.put("description", tool.description());
            }
            function.set("parameters", tool.parameters());
        }
        return array;
    }

    JsonNode toToolChoice(ToolChoice choice) {
        if (choice instanceof ToolChoice.Auto) {
            return objectMapper.getNodeFactory().textNode("auto");
        }
        if (choice instanceof ToolChoice.Any) {
            return objectMapper.getNodeFactory().textNode("required");
        }
        if (choice instanceof ToolChoice.None) {
            return objectMapper.getNodeFactory().textNode("none");
        }
        if (choice instanceof ToolChoice.Tool tool) {
            ObjectNode node = objectMapper.createObjectNode();
            node.put("type", "function");
            node.putObject("function").put("name", tool.name());
            return node;
        }
        return ((ToolChoice.Custom) choice).value().deepCopy();
    }

    JsonNode toResponseFormat(ResponseFormat format) {
        ObjectNode node = objectMapper.createObjectNode();
        if (format instanceof ResponseFormat.Text) {
            node.put("type", "text");
        } else if (format instanceof ResponseFormat.JsonObject) {
            node.put("type", "json_object");
        } else if (format instanceof ResponseFormat.JsonSchema schema) {
            node.put("type", "json_schema");
            ObjectNode jsonSchema = node.putObject("json_schema");
            jsonSchema.put("name", schema.name());
            jsonSchema.set("schema", schema.schema());
            jsonSchema.put("strict", schema.strict());
        } else if (format instanceof ResponseFormat.Custom custom) {
            return custom.value().deepCopy();
        }
        return node;
    }

    private void putAll(ObjectNode body, Map<String, Object> values) {
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            body.set(entry.getKey(), objectMapper.valueToTree(entry.getValue()));
        }
    }

    private static String mediaReference(ContentPart.MediaSource source) {
        if (source instanceof ContentPart.MediaSource.Inline inline) {
            return inline.data();
        }
        if (source instanceof ContentPart.MediaSource.FileId fileId) {
            return fileId.fileId();
        }
        return ((ContentPart.MediaSource.Url) source).url();
    }
}
