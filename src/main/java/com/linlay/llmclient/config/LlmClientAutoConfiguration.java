package com.linlay.llmclient.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.llmclient.client.LlmClient;
import com.linlay.llmclient.logging.LlmCallLogger;
import com.linlay.llmclient.logging.LlmExchangeLoggingFilter;
import com.linlay.llmclient.logging.LlmInteractionLogProperties;
import com.linlay.llmclient.transport.HttpTransport;
import com.linlay.llmclient.transport.WebClientHttpTransport;
import io.netty.handler.logging.LogLevel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;

@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties({LlmProviderProperties.class, LlmInteractionLogProperties.class})
public class LlmClientAutoConfiguration {

    private static final String LLM_WIRETAP_LOGGER = "com.linlay.llmclient.wiretap";

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean(destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = "llmConnectionProvider")
    public ConnectionProvider llmConnectionProvider() {
        return ConnectionProvider.builder("llm-pool")
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public HttpTransport llmHttpTransport(
            LlmInteractionLogProperties logProperties,
            @Qualifier("llmConnectionProvider") ConnectionProvider llmConnectionProvider) {
        return new WebClientHttpTransport(loggingWebClientBuilder(logProperties, llmConnectionProvider));
    }

    private WebClient.Builder loggingWebClientBuilder(
            LlmInteractionLogProperties logProperties,
            ConnectionProvider llmConnectionProvider) {
        HttpClient httpClient = HttpClient.create(llmConnectionProvider);
        if (logProperties.isEnabled() && !logProperties.isMaskSensitive()) {
            httpClient = httpClient.wiretap(LLM_WIRETAP_LOGGER, LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);
        }

        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build());
        if (!logProperties.isEnabled()) {
            return builder;
        }

        return builder.filter(new LlmExchangeLoggingFilter(logProperties.isMaskSensitive()));
    }

    @Bean
    @ConditionalOnMissingBean
    public LlmCallLogger llmCallLogger(LlmInteractionLogProperties logProperties) {
        return new LlmCallLogger(logProperties);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProviderFactory llmProviderFactory(ObjectMapper objectMapper, LlmCallLogger llmCallLogger) {
        return new ProviderFactory(objectMapper, llmCallLogger);
    }

    @Bean
    @ConditionalOnMissingBean
    public LlmClient llmClient(
            LlmProviderProperties properties,
            ProviderFactory llmProviderFactory,
            HttpTransport llmHttpTransport,
            ObjectMapper objectMapper) {
        return llmProviderFactory.createClient(properties.toModelConfigs(objectMapper), llmHttpTransport);
    }
}
