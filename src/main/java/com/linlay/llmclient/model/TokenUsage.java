package com.linlay.llmclient.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record TokenUsage(
        Long promptTokens,
        Long completionTokens,
        Long reasoningTokens,
        Long totalTokens,
        Map<String, Object> details
) {

    public TokenUsage {
        details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public TokenUsage(Long promptTokens, Long completionTokens, Long totalTokens) {
        this(promptTokens, completionTokens, null, totalTokens, null);
    }
}
