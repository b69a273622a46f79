package com.linlay.llmclient.provider.anthropic;

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
import java.util.Map;
import java.util.Objects;

/**
 * 统一请求 → Anthropic Messages 请求体。system/developer 消息合并到顶层 {@code system}。
 */
public class AnthropicRequestMapper {

    static final String LABEL = "Anthropic Messages";

    private final ObjectMapper objectMapper;

    public AnthropicRequestMapper(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public ObjectNode toBody(ChatRequest request, String model, boolean stream) {
        ChatOptions options = request.options();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);

        List<String> systemTexts = new ArrayList<>();
        ArrayNode messages = objectMapper.createArrayNode();
        for (Message message : request.messages()) {
            if (message.role() == Role.SYSTEM || message.role() == Role.DEVELOPER) {
                String text = systemText(message);
                if (!text.isEmpty()) {
                    systemTexts.add(text);
                }
            } else {
                messages.add(toMessage(message));
            }
        }
        RequestValidators.requireConversationMessage(request, LABEL);
        body.set("messages", messages);
        if (!systemTexts.isEmpty()) {
            body.put("system", String.join("\n\n", systemTexts));
        }

        body.put("max_tokens", RequestValidators.requireMaxOutputTokens(request, LABEL, "max_tokens"));
        if (options.temperature() != null) {
            body.put("temperature", options.temperature());
        }
        if (options.topP() != null) {
            body.put("top_p", options.topP());
        }
        if (options.reasoning() != null) {
            JsonNode thinking = toThinking(options.reasoning());
            if (thinking != null) {
                body.set("thinking", thinking);
            }
        }
        if (!request.tools().isEmpty()) {
            body.set("tools", toTools(request.tools()));
        }
        if (request.toolChoice() != null) {
            boolean parallel = options.parallelToolCalls() == null || options.parallelToolCalls();
            JsonNode choice = toToolChoice(request.toolChoice(), parallel);
            if (choice != null) {
                body.set("tool_choice", choice);
            }
        }
        if (request.responseFormat() != null && !(request.responseFormat() instanceof ResponseFormat.Text)) {
            throw RequestValidators.unsupported("structured_output");
        }
        if (!request.metadata().isEmpty()) {
            body.set("metadata", objectMapper.valueToTree(request.metadata()));
        }
        for (Map.Entry<String, Object> entry : options.extra().entrySet()) {
            body.set(entry.getKey(), objectMapper.valueToTree(entry.getValue()));
        }
        body.put("stream", stream);
        return body;
    }

    ObjectNode toMessage(Message message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("role", message.role() == Role.ASSISTANT ? "assistant" : "user");
        ArrayNode blocks = node.putArray("content");
        if (message.role() == Role.TOOL) {
            blocks.add(toToolResult(RequestValidators.requireSingleToolResult(message)));
            return node;
        }
        RequestValidators.requireNonEmptyContent(message);
        for (ContentPart part : message.content()) {
            blocks.add(toContentBlock(part));
        }
        return node;
    }

    JsonNode toContentBlock(ContentPart part) {
        ObjectNode block = objectMapper.createObjectNode();
        if (part instanceof ContentPart.Text text) {
            block.put("type", "text");
            block.put("text", text.text());
        } else if (part instanceof ContentPart.Image image) {
            block.put("type", "image");
            ObjectNode source = block.putObject("source");
            if (image.source() instanceof ContentPart.ImageSource.Base64 base64) {
                source.put("type", "base64");
                source.put("media_type", base64.mimeType() == null ? "image/png" : base64.mimeType());
                source.put("data", base64.data());
            } else if (image.source() instanceof ContentPart.ImageSource.Url url) {
                source.put("type", "url");
                source.put("url", url.url());
            } else {
                throw RequestValidators.unsupported("image_source_file_id");
            }
        } else if (part instanceof ContentPart.ToolCall call) {
            block.put("type", "tool_use");
            block.put("id", call.id());
            block.put("name", call.name());
            block.set("input", call.arguments());
        } else if (part instanceof ContentPart.ToolResult result) {
            return toToolResult(result);
        } else if (part instanceof ContentPart.CustomData custom) {
            return custom.data().deepCopy();
        } else {
            throw RequestValidators.unsupported("anthropic_messages_content_type");
        }
        return block;
    }

    private static String systemText(Message message) {
        StringBuilder buffer = new StringBuilder();
        for (ContentPart.Text text : message.partsOf(ContentPart.Text.class)) {
            if (buffer.length() > 0) {
                buffer.append('\n');
            }
            buffer.append(text.text());
        }
        return buffer.toString();
    }

    private ObjectNode toToolResult(ContentPart.ToolResult result) {
        ObjectNode block = objectMapper.createObjectNode();
        block.put("type", "tool_result");
        block.put("tool_use_id", RequestValidators.requireToolCallId(result));
        block.put("content", result.outputText());
        block.put("is_error", result.isError());
        return block;
    }

    /**
     * An explicit {@code thinking} entry in the reasoning extras wins; otherwise a budget enables thinking.
     */
    JsonNode toThinking(ChatOptions.ReasoningOptions reasoning) {
        Object explicit = reasoning.extra().get("thinking");
        if (explicit != null) {
            return objectMapper.valueToTree(explicit);
        }
        if (reasoning.budgetTokens() == null) {
            return null;
        }
        ObjectNode thinking = objectMapper.createObjectNode();
        thinking.put("type", "enabled");
        thinking.put("budget_tokens", reasoning.budgetTokens());
        for (Map.Entry<String, Object> entry : reasoning.extra().entrySet()) {
            thinking.set(entry.getKey(), objectMapper.valueToTree(entry.getValue()));
        }
        return thinking;
    }

    ArrayNode toTools(List<ToolDefinition> tools) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ToolDefinition tool : tools) {
            if (tool.kind() == ToolKind.FUNCTION) {
                ObjectNode node = array.addObject();
                node.put("type", "custom");
                node.put("name", tool.name());
                if (tool.description() != null) {
                    node.put("description", tool.description());
                }
                node.set("input_schema", tool.parameters());
            } else if (tool.kind() == ToolKind.CUSTOM) {
                ObjectNode node = array.addObject();
                Object type = tool.metadata().get("type");
                node.put("type", type == null ? tool.name() : type.toString());
                node.put("name", tool.name());
                for (Map.Entry<String, Object> entry : tool.metadata().entrySet()) {
                    if (!"type".equals(entry.getKey())) {
                        node.set(entry.getKey(), objectMapper.valueToTree(entry.getValue()));
                    }
                }
            } else {
                throw LlmException.validation("Anthropic tools currently only support function or custom tool configs");
            }
        }
        return array;
    }

    JsonNode toToolChoice(ToolChoice choice, boolean parallelToolCalls) {
        if (choice instanceof ToolChoice.None) {
            return null;
        }
        if (choice instanceof ToolChoice.Custom custom) {
            return custom.value().deepCopy();
        }
        ObjectNode node = objectMapper.createObjectNode();
        if (choice instanceof ToolChoice.Auto) {
            node.put("type", "auto");
        } else if (choice instanceof ToolChoice.Any) {
            node.put("type", "any");
        } else if (choice instanceof ToolChoice.Tool tool) {
            node.put("type", "tool");
            node.put("name", tool.name());
        }
        node.put("disable_parallel_tool_use", !parallelToolCalls);
        return node;
    }
}
