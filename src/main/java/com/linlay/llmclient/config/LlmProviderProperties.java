package com.linlay.llmclient.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.llmclient.error.LlmException;
import com.linlay.llmclient.model.Credential;
import com.linlay.llmclient.patch.RequestPatch;
import com.linlay.llmclient.retry.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code llm.models[*]} 配置，顺序即注册顺序。
 */
@Validated
@ConfigurationProperties(prefix = "llm")
public class LlmProviderProperties {

    @Valid
    private List<ModelEntry> models = new ArrayList<>();

    public List<ModelEntry> getModels() {
        return models;
    }

    public void setModels(List<ModelEntry> models) {
        this.models = models == null ? new ArrayList<>() : models;
    }

    public List<ModelConfig> toModelConfigs(ObjectMapper objectMapper) {
        List<ModelConfig> configs = new ArrayList<>();
        for (ModelEntry entry : models) {
            configs.add(entry.toModelConfig(objectMapper));
        }
        return configs;
    }

    public enum CredentialType {
        API_KEY,
        BEARER,
        SERVICE_ACCOUNT,
        NONE
    }

    public static class ModelEntry {
        @NotBlank
        private String handle;
        @NotNull
        private ProviderKind provider;
        private String model;
        private String baseUrl;
        private Duration timeout;
        private Map<String, String> extra = new LinkedHashMap<>();
        @Valid
        private CredentialProperties credential = new CredentialProperties();
        @Valid
        private PatchProperties patch = new PatchProperties();
        @Valid
        private RetryProperties retry;

        ModelConfig toModelConfig(ObjectMapper objectMapper) {
            return new ModelConfig(
                    handle,
                    provider,
                    credential == null ? Credential.none() : credential.toCredential(objectMapper),
                    model,
                    baseUrl,
                    new LinkedHashMap<>(extra),
                    patch == null ? RequestPatch.empty() : patch.toPatch(objectMapper),
                    retry == null ? RetryPolicy.noRetry() : retry.toPolicy(),
                    timeout
            );
        }

        public String getHandle() {
            return handle;
        }

        public void setHandle(String handle) {
            this.handle = handle;
        }

        public ProviderKind getProvider() {
            return provider;
        }

        public void setProvider(ProviderKind provider) {
            this.provider = provider;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Map<String, String> getExtra() {
            return extra;
        }

        public void setExtra(Map<String, String> extra) {
            this.extra = extra == null ? new LinkedHashMap<>() : extra;
        }

        public CredentialProperties getCredential() {
            return credential;
        }

        public void setCredential(CredentialProperties credential) {
            this.credential = credential;
        }

        public PatchProperties getPatch() {
            return patch;
        }

        public void setPatch(PatchProperties patch) {
            this.patch = patch;
        }

        public RetryProperties getRetry() {
            return retry;
        }

        public void setRetry(RetryProperties retry) {
            this.retry = retry;
        }
    }

    public static class CredentialProperties {
        private CredentialType type = CredentialType.API_KEY;
        private String header;
        private String key;
        private String token;
        private String json;

        Credential toCredential(ObjectMapper objectMapper) {
            CredentialType resolved = type == null ? CredentialType.NONE : type;
            return switch (resolved) {
                case API_KEY -> StringUtils.hasText(key) ? new Credential.ApiKey(header, key) : Credential.none();
                case BEARER -> StringUtils.hasText(token) ? Credential.bearer(token) : Credential.none();
                case SERVICE_ACCOUNT -> new Credential.ServiceAccount(readJson(objectMapper));
                case NONE -> Credential.none();
            };
        }

        private JsonNode readJson(ObjectMapper objectMapper) {
            if (!StringUtils.hasText(json)) {
                throw LlmException.invalidConfig("credential.json", "service account credential requires json");
            }
            try {
                return objectMapper.readTree(json);
            } catch (JsonProcessingException ex) {
                throw LlmException.invalidConfig("credential.json", "invalid service account json", ex);
            }
        }

        public CredentialType getType() {
            return type;
        }

        public void setType(CredentialType type) {
            this.type = type;
        }

        public String getHeader() {
            return header;
        }

        public void setHeader(String header) {
            this.header = header;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public String getJson() {
            return json;
        }

        public void setJson(String json) {
            this.json = json;
        }
    }

    /**
     * Header values left empty delete the header, the same as a null value in {@link RequestPatch}.
     */
    public static class PatchProperties {
        private String url;
        private Map<String, Object> body = new LinkedHashMap<>();
        private Map<String, String> headers = new LinkedHashMap<>();
        private List<String> removeFields = new ArrayList<>();

        RequestPatch toPatch(ObjectMapper objectMapper) {
            ObjectNode bodyNode = body == null || body.isEmpty() ? null : objectMapper.valueToTree(body);
            Map<String, String> headerMap = new LinkedHashMap<>();
            if (headers != null) {
                headers.forEach((name, value) -> headerMap.put(name, StringUtils.hasLength(value) ? value : null));
            }
            return new RequestPatch(url, bodyNode, headerMap, removeFields == null ? List.of() : removeFields);
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public Map<String, Object> getBody() {
            return body;
        }

        public void setBody(Map<String, Object> body) {
            this.body = body;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }

        public List<String> getRemoveFields() {
            return removeFields;
        }

        public void setRemoveFields(List<String> removeFields) {
            this.removeFields = removeFields;
        }
    }

    public static class RetryProperties {
        @Min(1)
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(8);
        private double multiplier = RetryPolicy.DEFAULT_MULTIPLIER;

        RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, baseDelay, maxDelay, multiplier);
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }
    }
}
