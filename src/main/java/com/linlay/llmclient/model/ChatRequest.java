package com.linlay.llmclient.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 统一请求结构：每次调用新建，发送过程中只会被 patch 引擎生成新值，不会原地修改。
 */
public record ChatRequest(
        List<Message> messages,
        ChatOptions options,
        List<ToolDefinition> tools,
        ToolChoice toolChoice,
        ResponseFormat responseFormat,
        Map<String, Object> metadata
) {

    public ChatRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        options = options == null ? ChatOptions.defaults() : options;
        tools = tools == null ? List.of() : List.copyOf(tools);
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ChatRequest of(Message... messages) {
        return builder().messages(List.of(messages)).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .messages(messages)
                .options(options)
                .tools(tools)
                .toolChoice(toolChoice)
                .responseFormat(responseFormat)
                .metadata(metadata);
    }

    public static final class Builder {
        private final List<Message> messages = new ArrayList<>();
        private ChatOptions options;
        private final List<ToolDefinition> tools = new ArrayList<>();
        private ToolChoice toolChoice;
        private ResponseFormat responseFormat;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder message(Message message) {
            this.messages.add(message);
            return this;
        }

        public Builder messages(List<Message> messages) {
            if (messages != null) {
                this.messages.addAll(messages);
            }
            return this;
        }

        public Builder options(ChatOptions options) {
            this.options = options;
            return this;
        }

        public Builder tool(ToolDefinition tool) {
            this.tools.add(tool);
            return this;
        }

        public Builder tools(List<ToolDefinition> tools) {
            if (tools != null) {
                this.tools.addAll(tools);
            }
            return this;
        }

        public Builder toolChoice(ToolChoice toolChoice) {
            this.toolChoice = toolChoice;
            return this;
        }

        public Builder responseFormat(ResponseFormat responseFormat) {
            this.responseFormat = responseFormat;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public ChatRequest build() {
            return new ChatRequest(messages, options, tools, toolChoice, responseFormat, metadata);
        }
    }
}
