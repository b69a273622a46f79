package com.linlay.llmclient.client;

import com.linlay.llmclient.error.LlmException;
import com.linlay.llmclient.provider.LlmProvider;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Accumulates (handle, provider) registrations; duplicates are reported by {@link #build()}.
 */
public class LlmClientBuilder {

    private final List<Map.Entry<String, LlmProvider>> registrations = new ArrayList<>();

    public LlmClientBuilder register(String handle, LlmProvider provider) {
        Objects.requireNonNull(handle, "handle cannot be null");
        Objects.requireNonNull(provider, "provider cannot be null");
        registrations.add(Map.entry(handle, provider));
        return this;
    }

    public LlmClient build() {
        Set<String> seen = new HashSet<>();
        Map<String, LlmProvider> providers = new LinkedHashMap<>();
        for (Map.Entry<String, LlmProvider> registration : registrations) {
            if (!seen.add(registration.getKey())) {
                throw LlmException.validation("duplicate handle: " + registration.getKey());
            }
            providers.put(registration.getKey(), registration.getValue());
        }
        return new LlmClient(providers);
    }
}
