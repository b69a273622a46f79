package com.linlay.llmclient.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 采样与生成控制参数，所有字段可空，未设置时由 provider 使用各自的默认值。
 */
public record ChatOptions(
        String model,
        Double temperature,
        Double topP,
        Integer maxOutputTokens,
        Double presencePenalty,
        Double frequencyPenalty,
        Boolean parallelToolCalls,
        ReasoningOptions reasoning,
        Map<String, Object> extra
) {

    public ChatOptions {
        extra = extra == null || extra.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public static ChatOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .model(model)
                .temperature(temperature)
                .topP(topP)
                .maxOutputTokens(maxOutputTokens)
                .presencePenalty(presencePenalty)
                .frequencyPenalty(frequencyPenalty)
                .parallelToolCalls(parallelToolCalls)
                .reasoning(reasoning)
                .extra(extra);
    }

    public record ReasoningOptions(ReasoningEffort effort, Integer budgetTokens, Map<String, Object> extra) {
        public ReasoningOptions {
            extra = extra == null || extra.isEmpty()
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
        }

        public static ReasoningOptions effort(ReasoningEffort effort) {
            return new ReasoningOptions(effort, null, null);
        }

        public static ReasoningOptions budget(int budgetTokens) {
            return new ReasoningOptions(null, budgetTokens, null);
        }
    }

    public enum ReasoningEffort {
        LOW,
        MEDIUM,
        HIGH
    }

    public static final class Builder {
        private String model;
        private Double temperature;
        private Double topP;
        private Integer maxOutputTokens;
        private Double presencePenalty;
        private Double frequencyPenalty;
        private Boolean parallelToolCalls;
        private ReasoningOptions reasoning;
        private final Map<String, Object> extra = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder topP(Double topP) {
            this.topP = topP;
            return this;
        }

        public Builder maxOutputTokens(Integer maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
            return this;
        }

        public Builder presencePenalty(Double presencePenalty) {
            this.presencePenalty = presencePenalty;
            return this;
        }

        public Builder frequencyPenalty(Double frequencyPenalty) {
            this.frequencyPenalty = frequencyPenalty;
            return this;
        }

        public Builder parallelToolCalls(Boolean parallelToolCalls) {
            this.parallelToolCalls = parallelToolCalls;
            return this;
        }

        public Builder reasoning(ReasoningOptions reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder extra(String key, Object value) {
            this.extra.put(key, value);
            return this;
        }

        public Builder extra(Map<String, Object> extra) {
            if (extra != null) {
                this.extra.putAll(extra);
            }
            return this;
        }

        public ChatOptions build() {
            return new ChatOptions(model, temperature, topP, maxOutputTokens, presencePenalty,
                    frequencyPenalty, parallelToolCalls, reasoning, extra);
        }
    }
}
