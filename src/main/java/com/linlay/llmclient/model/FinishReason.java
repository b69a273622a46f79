package com.linlay.llmclient.model;

import java.util.Locale;

public enum FinishReason {
    STOP,
    LENGTH,
    TOOL_CALLS,
    CONTENT_FILTER,
    ERROR,
    OTHER;

    /**
     * Normalizes the stop reasons of the supported vendors. Returns {@code null} for blank input.
     */
    public static FinishReason fromVendor(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "stop", "end_turn", "stop_sequence" -> STOP;
            case "length", "max_tokens", "model_context_window_exceeded" -> LENGTH;
            case "tool_calls", "tool_use", "function_call" -> TOOL_CALLS;
            case "content_filter", "refusal" -> CONTENT_FILTER;
            case "error" -> ERROR;
            default -> OTHER;
        };
    }
}
