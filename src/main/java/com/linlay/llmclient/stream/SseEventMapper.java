package com.linlay.llmclient.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.llmclient.model.ChatChunk;

/**
 * 供应商流事件到统一 {@link ChatChunk} 的映射策略，由各 provider 提供。
 */
public interface SseEventMapper {

    /**
     * Payload that ends the stream, compared after trimming. {@code null} disables the sentinel.
     */
    default String terminalSentinel() {
        return "[DONE]";
    }

    /**
     * Maps one parsed payload. Returning {@code null} skips the event.
     */
    ChatChunk map(SseFrame frame, JsonNode payload);
}
