package com.linlay.llmclient.provider.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.llmclient.error.LlmException;
import com.linlay.llmclient.model.ChatResponse;
import com.linlay.llmclient.model.ContentPart;
import com.linlay.llmclient.model.FinishReason;
import com.linlay.llmclient.model.Message;
import com.linlay.llmclient.model.OutputItem;
import com.linlay.llmclient.model.ProviderMetadata;
import com.linlay.llmclient.model.Role;
import com.linlay.llmclient.model.TokenUsage;
import com.linlay.llmclient.model.ToolKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.linlay.llmclient.provider.JsonNodes.hasText;
import static com.linlay.llmclient.provider.JsonNodes.isAbsent;
import static com.linlay.llmclient.provider.JsonNodes.optionalInt;
import static com.linlay.llmclient.provider.JsonNodes.optionalLong;
import static com.linlay.llmclient.provider.JsonNodes.optionalText;

public class OpenAiChatResponseMapper {

    private final ObjectMapper objectMapper;
    private final String provider;

    public OpenAiChatResponseMapper(ObjectMapper objectMapper, String provider) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.provider = provider;
    }

    public ChatResponse toResponse(JsonNode root, String endpoint) {
        JsonNode choices = root.path("choices");
        if (!choices.isArray()) {
            throw LlmException.provider(provider, "response has no choices", root.toString(), null);
        }
        List<OutputItem> outputs = new ArrayList<>();
        FinishReason finishReason = null;
        for (JsonNode choice : choices) {
            int index = optionalInt(choice.get("index")) == null ? 0 : optionalInt(choice.get("index"));
            JsonNode message = choice.get("message");
            if (!isAbsent(message)) {
                String reasoning = optionalText(message.get("reasoning_content"));
                if (hasText(reasoning)) {
                    outputs.add(new OutputItem.ReasoningOutput(index, reasoning));
                }
                outputs.add(new OutputItem.MessageOutput(index, toMessage(message)));
                JsonNode toolCalls = message.path("tool_calls");
                if (toolCalls.isArray()) {
                    for (JsonNode toolCall : toolCalls) {
                        outputs.add(new OutputItem.ToolCallOutput(index, toToolCall(toolCall)));
                    }
                }
            }
            if (finishReason == null) {
                finishReason = FinishReason.fromVendor(optionalText(choice.get("finish_reason")));
            }
        }
        ProviderMetadata metadata = new ProviderMetadata(provider, optionalText(root.get("id")), endpoint, root);
        return new ChatResponse(outputs, toUsage(root.get("usage")), finishReason,
                optionalText(root.get("model")), metadata);
    }

    private Message toMessage(JsonNode message) {
        List<ContentPart> content = new ArrayList<>();
        JsonNode contentNode = message.get("content");
        if (contentNode != null && contentNode.isTextual()) {
            content.add(ContentPart.text(contentNode.asText()));
        } else if (contentNode != null && contentNode.isArray()) {
            for (JsonNode part : contentNode) {
                String type = optionalText(part.get("type"));
                if ("text".equals(type) || "output_text".equals(type)) {
                    content.add(ContentPart.text(optionalText(part.get("text"))));
                } else {
                    content.add(new ContentPart.CustomData(part));
                }
            }
        }
        String refusal = optionalText(message.get("refusal"));
        if (hasText(refusal) && content.isEmpty()) {
            content.add(ContentPart.text(refusal));
        }
        return new Message(Role.ASSISTANT, content,
                optionalText(message.get("name")), null);
    }

    private ContentPart.ToolCall toToolCall(JsonNode toolCall) {
        String type = optionalText(toolCall.get("type"));
        if (type != null && !"function".equals(type)) {
            throw LlmException.provider(provider, "unsupported tool type " + type);
        }
        JsonNode function = toolCall.path("function");
        String name = optionalText(function.get("name"));
        return new ContentPart.ToolCall(
                optionalText(toolCall.get("id")),
                name == null ? "" : name,
                parseArguments(optionalText(function.get("arguments"))),
                ToolKind.FUNCTION);
    }

    /**
     * Arguments arrive as a JSON string; malformed text is kept verbatim as a string node.
     */
    JsonNode parseArguments(String arguments) {
        if (!hasText(arguments)) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(arguments);
        } catch (JsonProcessingException ex) {
            return objectMapper.getNodeFactory().textNode(arguments);
        }
    }

    static TokenUsage toUsage(JsonNode usage) {
        if (isAbsent(usage) || !usage.isObject()) {
            return null;
        }
        Long reasoningTokens = optionalLong(usage.path("completion_tokens_details").get("reasoning_tokens"));
        if (reasoningTokens == null) {
            reasoningTokens = optionalLong(usage.get("reasoning_tokens"));
        }
        Map<String, Object> details = new LinkedHashMap<>();
        Long cachedTokens = optionalLong(usage.path("prompt_tokens_details").get("cached_tokens"));
        if (cachedTokens != null) {
            details.put("cached_tokens", cachedTokens);
        }
        return new TokenUsage(
                optionalLong(usage.get("prompt_tokens")),
                optionalLong(usage.get("completion_tokens")),
                reasoningTokens,
                optionalLong(usage.get("total_tokens")),
                details);
    }
}
