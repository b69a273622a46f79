package com.linlay.llmclient.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record Message(
        Role role,
        List<ContentPart> content,
        String name,
        Map<String, Object> metadata
) {

    public Message {
        Objects.requireNonNull(role, "role cannot be null");
        content = content == null ? List.of() : List.copyOf(content);
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Message(Role role, List<ContentPart> content) {
        this(role, content, null, null);
    }

    public static Message text(Role role, String text) {
        return new Message(role, List.of(ContentPart.text(text)));
    }

    public static Message system(String text) {
        return text(Role.SYSTEM, text);
    }

    public static Message user(String text) {
        return text(Role.USER, text);
    }

    public static Message assistant(String text) {
        return text(Role.ASSISTANT, text);
    }

    public static Message toolResult(String callId, JsonNode output) {
        return new Message(Role.TOOL, List.of(ContentPart.toolResult(callId, output)));
    }

    /**
     * Concatenates every text part, ignoring non-text content.
     */
    public String joinedText() {
        StringBuilder builder = new StringBuilder();
        for (ContentPart part : content) {
            if (part instanceof ContentPart.Text text) {
                builder.append(text.text());
            }
        }
        return builder.toString();
    }

    public <T extends ContentPart> List<T> partsOf(Class<T> type) {
        return content.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }
}
