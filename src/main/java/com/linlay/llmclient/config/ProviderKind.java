package com.linlay.llmclient.config;

import com.linlay.llmclient.provider.anthropic.AnthropicMessagesProvider;
import com.linlay.llmclient.provider.openai.OpenAiChatProvider;

import java.util.Locale;

public enum ProviderKind {
    OPENAI_CHAT(OpenAiChatProvider.NAME),
    ANTHROPIC_MESSAGES(AnthropicMessagesProvider.NAME);

    private final String value;

    ProviderKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Accepts {@code openai_chat}, {@code openai-chat} or the enum name in any case.
     */
    public static ProviderKind fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().replace('-', '_').toLowerCase(Locale.ROOT);
        for (ProviderKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
