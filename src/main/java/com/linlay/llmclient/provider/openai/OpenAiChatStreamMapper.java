package com.linlay.llmclient.provider.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.llmclient.model.ChatChunk;
import com.linlay.llmclient.model.ChatEvent;
import com.linlay.llmclient.model.FinishReason;
import com.linlay.llmclient.model.ProviderMetadata;
import com.linlay.llmclient.model.TokenUsage;
import com.linlay.llmclient.stream.SseEventMapper;
import com.linlay.llmclient.stream.SseFrame;

import java.util.ArrayList;
import java.util.List;

import static com.linlay.llmclient.provider.JsonNodes.hasText;
import static com.linlay.llmclient.provider.JsonNodes.isAbsent;
import static com.linlay.llmclient.provider.JsonNodes.optionalInt;
import static com.linlay.llmclient.provider.JsonNodes.optionalText;

/**
 * OpenAI Chat Completions 流式增量 → {@link ChatChunk}。流以 {@code [DONE]} 结束。
 */
public class OpenAiChatStreamMapper implements SseEventMapper {

    private final ProviderMetadata metadata;

    public OpenAiChatStreamMapper(String provider, String endpoint) {
        this.metadata = ProviderMetadata.of(provider, endpoint);
    }

    @Override
    public ChatChunk map(SseFrame frame, JsonNode payload) {
        JsonNode error = payload.get("error");
        if (!isAbsent(error)) {
            String message = optionalText(error.get("message"));
            return ChatChunk.of(List.of(new ChatEvent.ErrorEvent(message == null ? error.toString() : message, payload)),
                    null, metadata);
        }

        List<ChatEvent> events = new ArrayList<>();
        JsonNode choices = payload.path("choices");
        if (choices.isArray()) {
            for (JsonNode choice : choices) {
                appendChoiceEvents(choice, events);
            }
        }
        TokenUsage usage = OpenAiChatResponseMapper.toUsage(payload.get("usage"));
        if (events.isEmpty() && usage == null) {
            return null;
        }
        return ChatChunk.of(events, usage, metadata.withRaw(payload));
    }

    private void appendChoiceEvents(JsonNode choice, List<ChatEvent> events) {
        Integer choiceIndex = optionalInt(choice.get("index"));
        int index = choiceIndex == null ? 0 : choiceIndex;
        JsonNode delta = choice.path("delta");

        String reasoning = optionalText(delta.get("reasoning_content"));
        if (hasText(reasoning)) {
            events.add(new ChatEvent.ReasoningDelta(reasoning));
        }
        JsonNode content = delta.get("content");
        if (content != null && content.isTextual() && !content.asText().isEmpty()) {
            events.add(new ChatEvent.TextDelta(index, content.asText()));
        } else if (content != null && content.isArray()) {
            for (JsonNode part : content) {
                String text = optionalText(part.get("text"));
                if (hasText(text)) {
                    events.add(new ChatEvent.TextDelta(index, text));
                } else {
                    events.add(new ChatEvent.Custom(part));
                }
            }
        }

        JsonNode toolCalls = delta.path("tool_calls");
        if (toolCalls.isArray()) {
            for (JsonNode toolCall : toolCalls) {
                Integer toolIndex = optionalInt(toolCall.get("index"));
                String id = optionalText(toolCall.get("id"));
                JsonNode function = toolCall.path("function");
                String name = optionalText(function.get("name"));
                String arguments = optionalText(function.get("arguments"));
                if (!hasText(id) && toolIndex == null && !hasText(name) && !hasText(arguments)) {
                    continue;
                }
                events.add(new ChatEvent.ToolCallDelta(toolIndex == null ? index : toolIndex, id, name,
                        arguments == null ? "" : arguments));
            }
        }

        String finishReason = optionalText(choice.get("finish_reason"));
        if (hasText(finishReason)) {
            events.add(new ChatEvent.FinishSignal(FinishReason.fromVendor(finishReason), finishReason));
        }
    }
}
