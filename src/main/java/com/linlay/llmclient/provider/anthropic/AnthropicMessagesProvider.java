package com.linlay.llmclient.provider.anthropic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.llmclient.error.LlmException;
import com.linlay.llmclient.logging.LlmCallLogger;
import com.linlay.llmclient.model.CapabilityDescriptor;
import com.linlay.llmclient.model.ChatRequest;
import com.linlay.llmclient.model.ChatResponse;
import com.linlay.llmclient.provider.AbstractHttpProvider;
import com.linlay.llmclient.provider.ProviderSettings;
import com.linlay.llmclient.stream.SseEventMapper;
import com.linlay.llmclient.transport.HttpTransport;
import com.linlay.llmclient.validation.RequestValidators;
import org.springframework.http.HttpHeaders;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.linlay.llmclient.provider.JsonNodes.hasText;

/**
 * Anthropic Messages API 适配器。
 * <p>
 * settings.extra 支持 {@code version}（anthropic-version，默认 2023-06-01）与 {@code beta}（anthropic-beta）。
 */
public class AnthropicMessagesProvider extends AbstractHttpProvider {

    public static final String NAME = "anthropic_messages";
    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    public static final String DEFAULT_VERSION = "2023-06-01";

    private static final CapabilityDescriptor CAPABILITIES = CapabilityDescriptor.builder()
            .stream(true)
            .imageInput(true)
            .audioInput(false)
            .videoInput(false)
            .tools(true)
            .structuredOutput(false)
            .parallelToolCalls(true)
            .build();

    private final String apiKey;
    private final String endpoint;
    private final AnthropicRequestMapper requestMapper;
    private final AnthropicResponseMapper responseMapper;
    private final AnthropicErrorParser errorParser;

    public AnthropicMessagesProvider(ProviderSettings settings, HttpTransport transport, ObjectMapper objectMapper) {
        this(settings, transport, objectMapper, null);
    }

    public AnthropicMessagesProvider(
            ProviderSettings settings,
            HttpTransport transport,
            ObjectMapper objectMapper,
            LlmCallLogger callLogger
    ) {
        super(settings, transport, objectMapper, callLogger);
        this.apiKey = resolveSecret(NAME, settings.credential());
        this.endpoint = resolveEndpoint(settings.baseUrl(), DEFAULT_BASE_URL, "/messages");
        this.requestMapper = new AnthropicRequestMapper(objectMapper);
        this.responseMapper = new AnthropicResponseMapper(NAME);
        this.errorParser = new AnthropicErrorParser(objectMapper, NAME);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CapabilityDescriptor capabilities() {
        return CAPABILITIES;
    }

    @Override
    protected String endpoint() {
        return endpoint;
    }

    @Override
    protected Map<String, String> defaultHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("x-api-key", apiKey);
        headers.put(HttpHeaders.CONTENT_TYPE, "application/json");
        String version = settings.extraText("version");
        headers.put("anthropic-version", hasText(version) ? version : DEFAULT_VERSION);
        String beta = settings.extraText("beta");
        if (hasText(beta)) {
            headers.put("anthropic-beta", beta);
        }
        return headers;
    }

    @Override
    protected ObjectNode buildBody(ChatRequest request, boolean stream) {
        String model = RequestValidators.requireModel(request, settings.defaultModel(), AnthropicRequestMapper.LABEL);
        return requestMapper.toBody(request, model, stream);
    }

    @Override
    protected LlmException parseError(int status, String rawBody, HttpHeaders headers) {
        return errorParser.parse(status, rawBody, retryAfter(headers));
    }

    @Override
    protected ChatResponse parseResponse(JsonNode body) {
        return responseMapper.toResponse(body, endpoint);
    }

    @Override
    protected SseEventMapper eventMapper() {
        return new AnthropicStreamMapper(NAME, endpoint);
    }
}
