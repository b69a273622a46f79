package com.linlay.llmclient.model;

import com.fasterxml.jackson.databind.JsonNode;

public record ProviderMetadata(
        String provider,
        String requestId,
        String endpoint,
        JsonNode raw
) {

    public static ProviderMetadata of(String provider, String endpoint) {
        return new ProviderMetadata(provider, null, endpoint, null);
    }

    public ProviderMetadata withRaw(JsonNode raw) {
        return new ProviderMetadata(provider, requestId, endpoint, raw);
    }
}
