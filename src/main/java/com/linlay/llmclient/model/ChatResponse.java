package com.linlay.llmclient.model;

import java.util.List;

public record ChatResponse(
        List<OutputItem> outputs,
        TokenUsage usage,
        FinishReason finishReason,
        String model,
        ProviderMetadata provider
) {

    public ChatResponse {
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    /**
     * Text of every assistant message output, in output order.
     */
    public String text() {
        StringBuilder builder = new StringBuilder();
        for (OutputItem item : outputs) {
            if (item instanceof OutputItem.MessageOutput messageOutput) {
                builder.append(messageOutput.message().joinedText());
            }
        }
        return builder.toString();
    }

    public List<ContentPart.ToolCall> toolCalls() {
        return outputs.stream()
                .filter(OutputItem.ToolCallOutput.class::isInstance)
                .map(item -> ((OutputItem.ToolCallOutput) item).call())
                .toList();
    }
}
