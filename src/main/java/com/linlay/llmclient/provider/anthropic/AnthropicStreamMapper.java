package com.linlay.llmclient.provider.anthropic;

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
import static com.linlay.llmclient.provider.JsonNodes.optionalLong;
import static com.linlay.llmclient.provider.JsonNodes.optionalText;

/**
 * Anthropic Messages 流事件 → {@link ChatChunk}。
 * <p>
 * 每个流一个实例：{@code message_start} 中的 input_tokens 会被记住，用于补全 {@code message_delta} 的用量。
 * {@code message_stop} 产生终止 chunk。
 */
public class AnthropicStreamMapper implements SseEventMapper {

    private final ProviderMetadata metadata;
    private Long inputTokens;

    public AnthropicStreamMapper(String provider, String endpoint) {
        this.metadata = ProviderMetadata.of(provider, endpoint);
    }

    @Override
    public ChatChunk map(SseFrame frame, JsonNode payload) {
        String type = optionalText(payload.get("type"));
        if (type == null) {
            type = frame.event();
        }
        if (type == null) {
            return null;
        }
        switch (type) {
            case "message_start":
                return onMessageStart(payload);
            case "content_block_start":
                return onBlockStart(payload);
            case "content_block_delta":
                return onBlockDelta(payload);
            case "message_delta":
                return onMessageDelta(payload);
            case "message_stop":
                return new ChatChunk(List.of(new ChatEvent.Done()), null, true, metadata.withRaw(payload));
            case "error":
                return onError(payload);
            case "ping":
            case "content_block_stop":
                return null;
            default:
                return ChatChunk.of(List.of(new ChatEvent.Custom(payload)), null, metadata.withRaw(payload));
        }
    }

    private ChatChunk onMessageStart(JsonNode payload) {
        JsonNode message = payload.path("message");
        inputTokens = optionalLong(message.path("usage").get("input_tokens"));
        ProviderMetadata started = new ProviderMetadata(metadata.provider(), optionalText(message.get("id")),
                metadata.endpoint(), payload);
        return ChatChunk.of(List.of(), null, started);
    }

    private ChatChunk onBlockStart(JsonNode payload) {
        int index = blockIndex(payload);
        JsonNode block = payload.path("content_block");
        String blockType = optionalText(block.get("type"));
        if ("tool_use".equals(blockType)) {
            return chunk(new ChatEvent.ToolCallDelta(index, optionalText(block.get("id")),
                    optionalText(block.get("name")), ""), payload);
        }
        if ("text".equals(blockType) && hasText(optionalText(block.get("text")))) {
            return chunk(new ChatEvent.TextDelta(index, optionalText(block.get("text"))), payload);
        }
        return null;
    }

    private ChatChunk onBlockDelta(JsonNode payload) {
        int index = blockIndex(payload);
        JsonNode delta = payload.path("delta");
        String deltaType = optionalText(delta.get("type"));
        if ("input_json_delta".equals(deltaType)) {
            String partial = optionalText(delta.get("partial_json"));
            return chunk(new ChatEvent.ToolCallDelta(index, null, null, partial == null ? "" : partial), payload);
        }
        if ("thinking_delta".equals(deltaType)) {
            return chunk(new ChatEvent.ReasoningDelta(optionalText(delta.get("thinking"))), payload);
        }
        String text = optionalText(delta.get("text"));
        if (text != null) {
            return chunk(new ChatEvent.TextDelta(index, text), payload);
        }
        if ("signature_delta".equals(deltaType)) {
            return null;
        }
        return chunk(new ChatEvent.Custom(payload), payload);
    }

    private ChatChunk onMessageDelta(JsonNode payload) {
        JsonNode delta = payload.path("delta");
        List<ChatEvent> events = new ArrayList<>();
        String stopReason = optionalText(delta.get("stop_reason"));
        if (hasText(stopReason)) {
            events.add(new ChatEvent.FinishSignal(FinishReason.fromVendor(stopReason), stopReason));
        }
        JsonNode usageNode = payload.get("usage");
        if (isAbsent(usageNode)) {
            usageNode = delta.get("usage");
        }
        TokenUsage usage = AnthropicResponseMapper.toUsage(usageNode, inputTokens);
        if (events.isEmpty() && usage == null) {
            return null;
        }
        return ChatChunk.of(events, usage, metadata.withRaw(payload));
    }

    private ChatChunk onError(JsonNode payload) {
        JsonNode error = payload.path("error");
        String message = optionalText(error.get("message"));
        return chunk(new ChatEvent.ErrorEvent(message == null ? payload.toString() : message, payload), payload);
    }

    private ChatChunk chunk(ChatEvent event, JsonNode payload) {
        return ChatChunk.of(List.of(event), null, metadata.withRaw(payload));
    }

    private static int blockIndex(JsonNode payload) {
        Integer index = optionalInt(payload.get("index"));
        return index == null ? 0 : index;
    }
}
