package com.linlay.llmclient.config;

import com.linlay.llmclient.model.Credential;
import com.linlay.llmclient.patch.RequestPatch;
import com.linlay.llmclient.provider.ProviderSettings;
import com.linlay.llmclient.retry.RetryPolicy;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One routable model entry: a handle plus everything needed to build its adapter.
 */
public record ModelConfig(
        String handle,
        ProviderKind provider,
        Credential credential,
        String defaultModel,
        String baseUrl,
        Map<String, Object> extra,
        RequestPatch patch,
        RetryPolicy retry,
        Duration timeout
) {

    public ModelConfig {
        credential = credential == null ? Credential.none() : credential;
        extra = extra == null || extra.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
        patch = patch == null ? RequestPatch.empty() : patch;
        retry = retry == null ? RetryPolicy.noRetry() : retry;
    }

    public static ModelConfig of(String handle, ProviderKind provider, Credential credential) {
        return new ModelConfig(handle, provider, credential, null, null, null, null, null, null);
    }

    public ModelConfig withDefaultModel(String defaultModel) {
        return new ModelConfig(handle, provider, credential, defaultModel, baseUrl, extra, patch, retry, timeout);
    }

    public ModelConfig withBaseUrl(String baseUrl) {
        return new ModelConfig(handle, provider, credential, defaultModel, baseUrl, extra, patch, retry, timeout);
    }

    public ModelConfig withPatch(RequestPatch patch) {
        return new ModelConfig(handle, provider, credential, defaultModel, baseUrl, extra, patch, retry, timeout);
    }

    public ModelConfig withRetry(RetryPolicy retry) {
        return new ModelConfig(handle, provider, credential, defaultModel, baseUrl, extra, patch, retry, timeout);
    }

    public ProviderSettings toSettings() {
        return new ProviderSettings(baseUrl, credential, defaultModel, extra, patch, retry, timeout);
    }
}
