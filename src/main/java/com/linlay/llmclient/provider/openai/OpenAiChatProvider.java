package com.linlay.llmclient.provider.openai;

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
 * OpenAI Chat Completions 适配器，也适用于 OpenAI 兼容网关（通过 baseUrl 指定）。
 * <p>
 * settings.extra 支持 {@code organization} 与 {@code project}，分别映射到对应请求头。
 */
public class OpenAiChatProvider extends AbstractHttpProvider {

    public static final String NAME = "openai_chat";
    public static final String DEFAULT_BASE_URL = "https://api.openai.com";
    private static final String LABEL = "OpenAI Chat";

    private static final CapabilityDescriptor CAPABILITIES = CapabilityDescriptor.builder()
            .stream(true)
            .imageInput(true)
            .audioInput(true)
            .videoInput(false)
            .tools(true)
            .structuredOutput(true)
            .parallelToolCalls(true)
            .build();

    private final String apiKey;
    private final String endpoint;
    private final OpenAiChatRequestMapper requestMapper;
    private final OpenAiChatResponseMapper responseMapper;
    private final OpenAiErrorParser errorParser;

    public OpenAiChatProvider(ProviderSettings settings, HttpTransport transport, ObjectMapper objectMapper) {
        this(settings, transport, objectMapper, null);
    }

    public OpenAiChatProvider(
            ProviderSettings settings,
            HttpTransport transport,
            ObjectMapper objectMapper,
            LlmCallLogger callLogger
    ) {
        super(settings, transport, objectMapper, callLogger);
        this.apiKey = resolveSecret(NAME, settings.credential());
        this.endpoint = resolveEndpoint(settings.baseUrl(), DEFAULT_BASE_URL, "/chat/completions");
        this.requestMapper = new OpenAiChatRequestMapper(objectMapper);
        this.responseMapper = new OpenAiChatResponseMapper(objectMapper, NAME);
        this.errorParser = new OpenAiErrorParser(objectMapper, NAME);
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
        headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        headers.put(HttpHeaders.CONTENT_TYPE, "application/json");
        String organization = settings.extraText("organization");
        if (hasText(organization)) {
            headers.put("OpenAI-Organization", organization);
        }
        String project = settings.extraText("project");
        if (hasText(project)) {
            headers.put("OpenAI-Project", project);
        }
        return headers;
    }

    @Override
    protected ObjectNode buildBody(ChatRequest request, boolean stream) {
        String model = RequestValidators.requireModel(request, settings.defaultModel(), LABEL);
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
        return new OpenAiChatStreamMapper(NAME, endpoint);
    }
}
