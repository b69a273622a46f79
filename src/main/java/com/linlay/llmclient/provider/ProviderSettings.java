package com.linlay.llmclient.provider;

import com.linlay.llmclient.model.Credential;
import com.linlay.llmclient.patch.RequestPatch;
import com.linlay.llmclient.retry.RetryPolicy;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-instance adapter settings. {@code extra} carries vendor options such as
 * {@code organization} or {@code version}.
 */
public record ProviderSettings(
        String baseUrl,
        Credential credential,
        String defaultModel,
        Map<String, Object> extra,
        RequestPatch patch,
        RetryPolicy retry,
        Duration timeout
) {

    public ProviderSettings {
        credential = credential == null ? Credential.none() : credential;
        extra = extra == null || extra.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
        patch = patch == null ? RequestPatch.empty() : patch;
        retry = retry == null ? RetryPolicy.noRetry() : retry;
    }

    public static ProviderSettings of(Credential credential) {
        return new ProviderSettings(null, credential, null, null, null, null, null);
    }

    public ProviderSettings withBaseUrl(String baseUrl) {
        return new ProviderSettings(baseUrl, credential, defaultModel, extra, patch, retry, timeout);
    }

    public ProviderSettings withDefaultModel(String defaultModel) {
        return new ProviderSettings(baseUrl, credential, defaultModel, extra, patch, retry, timeout);
    }

    public ProviderSettings withPatch(RequestPatch patch) {
        return new ProviderSettings(baseUrl, credential, defaultModel, extra, patch, retry, timeout);
    }

    public ProviderSettings withExtra(Map<String, Object> extra) {
        return new ProviderSettings(baseUrl, credential, defaultModel, extra, patch, retry, timeout);
    }

    public ProviderSettings withRetry(RetryPolicy retry) {
        return new ProviderSettings(baseUrl, credential, defaultModel, extra, patch, retry, timeout);
    }

    public String extraText(String key) {
        Object value = extra.get(key);
        return value == null ? null : value.toString();
    }
}
