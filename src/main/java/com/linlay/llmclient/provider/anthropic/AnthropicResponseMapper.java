package com.linlay.llmclient.provider.anthropic;

import com.fasterxml.jackson.databind.JsonNode;
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

import static com.linlay.llmclient.provider.JsonNodes.isAbsent;
import static com.linlay.llmclient.provider.JsonNodes.optionalLong;
import static com.linlay.llmclient.provider.JsonNodes.optionalText;

public class AnthropicResponseMapper {

    private final String provider;

    public AnthropicResponseMapper(String provider) {
        this.provider = provider;
    }

    public ChatResponse toResponse(JsonNode root, String endpoint) {
        JsonNode content = root.path("content");
        if (!content.isArray()) {
            throw LlmException.provider(provider, "response has no content blocks", root.toString(), null);
        }
        List<OutputItem> outputs = new ArrayList<>();
        List<ContentPart> messageParts = new ArrayList<>();
        List<ContentPart.ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode block : content) {
            String type = optionalText(block.get("type"));
            if ("text".equals(type)) {
                messageParts.add(ContentPart.text(optionalText(block.get("text"))));
            } else if ("thinking".equals(type)) {
                outputs.add(new OutputItem.ReasoningOutput(0, optionalText(block.get("thinking"))));
            } else if ("tool_use".equals(type)) {
                String name = optionalText(block.get("name"));
                JsonNode input = block.get("input");
                toolCalls.add(new ContentPart.ToolCall(optionalText(block.get("id")),
                        name == null ? "" : name,
                        isAbsent(input) ? null : input,
                        ToolKind.FUNCTION));
            } else if ("image".equals(type) && block.path("source").has("data")) {
                JsonNode source = block.get("source");
                messageParts.add(new ContentPart.Image(
                        new ContentPart.ImageSource.Base64(optionalText(source.get("data")),
                                optionalText(source.get("media_type"))),
                        null));
            } else if (!"redacted_thinking".equals(type)) {
                messageParts.add(new ContentPart.CustomData(block));
            }
        }
        if (!messageParts.isEmpty()) {
            outputs.add(new OutputItem.MessageOutput(0, new Message(Role.ASSISTANT, messageParts)));
        }
        for (ContentPart.ToolCall call : toolCalls) {
            outputs.add(new OutputItem.ToolCallOutput(0, call));
        }

        ProviderMetadata metadata = new ProviderMetadata(provider, optionalText(root.get("id")), endpoint, root);
        return new ChatResponse(outputs,
                toUsage(root.get("usage"), null),
                FinishReason.fromVendor(optionalText(root.get("stop_reason"))),
                optionalText(root.get("model")),
                metadata);
    }

    /**
     * @param knownInputTokens input tokens reported earlier in a stream, used when {@code usage} omits them
     */
    static TokenUsage toUsage(JsonNode usage, Long knownInputTokens) {
        if (isAbsent(usage) || !usage.isObject()) {
            return null;
        }
        Long input = optionalLong(usage.get("input_tokens"));
        if (input == null) {
            input = knownInputTokens;
        }
        Long output = optionalLong(usage.get("output_tokens"));
        Map<String, Object> details = new LinkedHashMap<>();
        Long cacheCreation = optionalLong(usage.get("cache_creation_input_tokens"));
        if (cacheCreation != null) {
            details.put("cache_creation_input_tokens", cacheCreation);
        }
        Long cacheRead = optionalLong(usage.get("cache_read_input_tokens"));
        if (cacheRead != null) {
            details.put("cache_read_input_tokens", cacheRead);
        }
        Long total = input != null && output != null ? input + output : null;
        return new TokenUsage(input, output, null, total, details);
    }
}
