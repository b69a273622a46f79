package com.linlay.llmclient.error;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps a failed HTTP status plus the vendor's error message onto the shared taxonomy,
 * so every adapter classifies the same situation the same way.
 */
public final class ErrorClassifier {

    private static final Set<String> TOKEN_LIMIT_CODES = Set.of(
            "context_length_exceeded",
            "max_context_length_exceeded",
            "prompt_tokens_exceeded",
            "context_window_exceeded"
    );
    private static final List<String> TOKEN_LIMIT_HINTS = List.of(
            "context length",
            "context window",
            "token limit",
            "maximum output tokens",
            "max output tokens",
            "prompt is too long"
    );
    private static final char[] MODEL_DELIMITERS = {'`', '"', '\''};

    private ErrorClassifier() {
    }

    public static LlmException classify(
            String provider,
            int status,
            String message,
            String code,
            Duration retryAfter,
            String rawBody
    ) {
        String normalizedMessage = message == null || message.isBlank() ? "unknown error" : message;
        if (code != null && !code.isBlank()) {
            normalizedMessage = normalizedMessage + " (" + code + ")";
        }
        if (status == 401 || status == 403) {
            return LlmException.auth(normalizedMessage);
        }
        if (status == 429) {
            return LlmException.rateLimit(normalizedMessage, retryAfter);
        }
        if (looksLikeTokenLimitError(code, normalizedMessage)) {
            return LlmException.tokenLimitExceeded(normalizedMessage);
        }
        if (status == 404 || "model_not_found".equalsIgnoreCase(code)) {
            String model = extractModelIdentifier(normalizedMessage);
            if (model != null || "model_not_found".equalsIgnoreCase(code)) {
                return LlmException.modelNotFound(model, normalizedMessage);
            }
        }
        if (status == 400 || status == 422) {
            return LlmException.validation(normalizedMessage);
        }
        return LlmException.provider(provider, normalizedMessage, rawBody, null);
    }

    /**
     * Fallback when the error body is not in the vendor's error shape.
     */
    public static LlmException unparsed(String provider, int status, String rawBody, Duration retryAfter) {
        if (status == 401 || status == 403) {
            return LlmException.auth("status " + status + ": " + rawBody);
        }
        if (status == 429) {
            return LlmException.rateLimit("status " + status + ": " + rawBody, retryAfter);
        }
        return LlmException.provider(provider, "status " + status + ": " + rawBody, rawBody, null);
    }

    public static boolean looksLikeTokenLimitError(String code, String message) {
        if (code != null) {
            String lower = code.toLowerCase(Locale.ROOT);
            if (TOKEN_LIMIT_CODES.contains(lower) || lower.contains("token")) {
                return true;
            }
        }
        if (message == null) {
            return false;
        }
        String lowerMessage = message.toLowerCase(Locale.ROOT);
        return TOKEN_LIMIT_HINTS.stream().anyMatch(lowerMessage::contains);
    }

    /**
     * Pulls the first quoted token out of messages like {@code The model `gpt-x` does not exist}.
     */
    public static String extractModelIdentifier(String message) {
        if (message == null) {
            return null;
        }
        for (char delimiter : MODEL_DELIMITERS) {
            int start = message.indexOf(delimiter);
            if (start < 0 || start + 1 >= message.length()) {
                continue;
            }
            int end = message.indexOf(delimiter, start + 1);
            if (end < 0) {
                continue;
            }
            String value = message.substring(start + 1, end).trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return null;
    }
}
