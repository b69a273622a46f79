package com.linlay.llmclient.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.llmclient.client.LlmClient;
import com.linlay.llmclient.client.LlmClientBuilder;
import com.linlay.llmclient.error.LlmException;
import com.linlay.llmclient.logging.LlmCallLogger;
import com.linlay.llmclient.provider.LlmProvider;
import com.linlay.llmclient.provider.anthropic.AnthropicMessagesProvider;
import com.linlay.llmclient.provider.openai.OpenAiChatProvider;
import com.linlay.llmclient.transport.HttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 根据有序的 {@link ModelConfig} 构建适配器与路由客户端。
 * <p>
 * 所有条目先全部校验并实例化，任何一个失败都不会注册任何 handle。
 */
public class ProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(ProviderFactory.class);

    private final ObjectMapper objectMapper;
    private final LlmCallLogger callLogger;

    public ProviderFactory(ObjectMapper objectMapper) {
        this(objectMapper, null);
    }

    public ProviderFactory(ObjectMapper objectMapper, LlmCallLogger callLogger) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.callLogger = callLogger;
    }

    public LlmProvider create(ModelConfig config, HttpTransport transport) {
        Objects.requireNonNull(config, "config cannot be null");
        if (config.provider() == null) {
            throw LlmException.invalidConfig("provider", "provider is required for handle " + config.handle());
        }
        return switch (config.provider()) {
            case OPENAI_CHAT -> new OpenAiChatProvider(config.toSettings(), transport, objectMapper, callLogger);
            case ANTHROPIC_MESSAGES -> new AnthropicMessagesProvider(config.toSettings(), transport, objectMapper, callLogger);
        };
    }

    public LlmClient createClient(List<ModelConfig> configs, HttpTransport transport) {
        Objects.requireNonNull(transport, "transport cannot be null");
        Set<String> handles = new HashSet<>();
        for (ModelConfig config : configs) {
            if (!StringUtils.hasText(config.handle())) {
                throw LlmException.invalidConfig("handle", "handle must not be blank");
            }
            if (!handles.add(config.handle())) {
                throw LlmException.validation("duplicate handle: " + config.handle());
            }
        }

        Map<String, LlmProvider> providers = new LinkedHashMap<>();
        for (ModelConfig config : configs) {
            providers.put(config.handle(), create(config, transport));
        }

        LlmClientBuilder builder = LlmClient.builder();
        providers.forEach((handle, provider) -> {
            builder.register(handle, provider);
            log.info("Registered LLM handle '{}' -> {}", handle, provider.name());
        });
        return builder.build();
    }
}
