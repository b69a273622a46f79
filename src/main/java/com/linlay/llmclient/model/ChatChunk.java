package com.linlay.llmclient.model;

import java.util.List;

public record ChatChunk(
        List<ChatEvent> events,
        TokenUsage usage,
        boolean terminal,
        ProviderMetadata provider
) {

    public ChatChunk {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static ChatChunk of(List<ChatEvent> events, TokenUsage usage, ProviderMetadata provider) {
        return new ChatChunk(events, usage, false, provider);
    }

    public static ChatChunk done(ProviderMetadata provider) {
        return new ChatChunk(List.of(new ChatEvent.Done()), null, true, provider);
    }

    public boolean isDone() {
        return events.stream().anyMatch(ChatEvent.Done.class::isInstance);
    }

    public boolean hasError() {
        return events.stream().anyMatch(ChatEvent.ErrorEvent.class::isInstance);
    }

    /**
     * A chunk ends its stream when it is terminal, carries {@code Done} or carries an error event.
     */
    public boolean endsStream() {
        return terminal || isDone() || hasError();
    }

    public String text() {
        StringBuilder builder = new StringBuilder();
        for (ChatEvent event : events) {
            if (event instanceof ChatEvent.TextDelta delta) {
                builder.append(delta.text());
            }
        }
        return builder.toString();
    }
}
