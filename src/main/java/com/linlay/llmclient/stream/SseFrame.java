package com.linlay.llmclient.stream;

/**
 * One dispatched server-sent event. {@code data} holds the joined data lines.
 */
public record SseFrame(String event, String id, Long retry, String data) {
}
