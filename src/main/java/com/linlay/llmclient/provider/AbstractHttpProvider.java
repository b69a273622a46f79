package com.linlay.llmclient.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.llmclient.error.LlmException;
import com.linlay.llmclient.logging.LlmCallLogger;
import com.linlay.llmclient.model.ChatChunk;
import com.linlay.llmclient.model.ChatRequest;
import com.linlay.llmclient.model.ChatResponse;
import com.linlay.llmclient.model.Credential;
import com.linlay.llmclient.patch.PatchedRequest;
import com.linlay.llmclient.patch.RequestPatchEngine;
import com.linlay.llmclient.retry.RetryAfterParser;
import com.linlay.llmclient.retry.RetryExecutor;
import com.linlay.llmclient.stream.ChatStreamDecoder;
import com.linlay.llmclient.stream.SseEventMapper;
import com.linlay.llmclient.transport.HttpRequest;
import com.linlay.llmclient.transport.HttpResponse;
import com.linlay.llmclient.transport.HttpStreamResponse;
import com.linlay.llmclient.transport.HttpTransport;
import com.linlay.llmclient.validation.RequestValidators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP 适配器模板：校验 → 构建 body → 应用 RequestPatch → 按重试策略发送 → 解析响应或流。
 * <p>
 * 子类只负责供应商相关的映射钩子。RequestPatch 在构造时校验，格式错误以 INVALID_CONFIG 失败。
 */
public abstract class AbstractHttpProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpProvider.class);

    protected final HttpTransport transport;
    protected final ObjectMapper objectMapper;
    protected final ProviderSettings settings;
    private final RetryExecutor retryExecutor;
    private final LlmCallLogger callLogger;

    protected AbstractHttpProvider(
            ProviderSettings settings,
            HttpTransport transport,
            ObjectMapper objectMapper,
            LlmCallLogger callLogger
    ) {
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.callLogger = callLogger == null ? new LlmCallLogger() : callLogger;
        settings.patch().validate();
        this.retryExecutor = new RetryExecutor(settings.retry());
    }

    /**
     * Full request URL before any patch override.
     */
    protected abstract String endpoint();

    /**
     * Vendor headers including authentication.
     */
    protected abstract Map<String, String> defaultHeaders();

    protected abstract ObjectNode buildBody(ChatRequest request, boolean stream);

    protected abstract LlmException parseError(int status, String rawBody, HttpHeaders headers);

    protected abstract ChatResponse parseResponse(JsonNode body);

    /**
     * Returns a mapper for one stream; mappers may keep per-stream state.
     */
    protected abstract SseEventMapper eventMapper();

    @Override
    public Mono<ChatResponse> chat(ChatRequest request) {
        return Mono.defer(() -> {
            HttpRequest httpRequest = prepare(request, false);
            String traceId = callLogger.generateTraceId();
            long startNanos = System.nanoTime();
            callLogger.logRequest(log, traceId, name(), httpRequest.url(), httpRequest.headers(),
                    httpRequest.bodyAsString(), false);
            return retryExecutor.execute(() -> transport.send(httpRequest).map(this::toChatResponse))
                    .doOnSuccess(response -> callLogger.info(log, "[{}][{}] LLM chat finished in {} ms, finishReason={}",
                            traceId, name(), callLogger.elapsedMs(startNanos),
                            response == null ? null : response.finishReason()))
                    .doOnError(ex -> callLogger.info(log, "[{}][{}] LLM chat failed in {} ms: {}",
                            traceId, name(), callLogger.elapsedMs(startNanos), ex.getMessage()));
        });
    }

    @Override
    public Flux<ChatChunk> streamChat(ChatRequest request) {
        return Flux.defer(() -> {
            if (!capabilities().stream()) {
                return Flux.error(RequestValidators.unsupported("stream"));
            }
            HttpRequest httpRequest = prepare(request, true);
            String traceId = callLogger.generateTraceId();
            long startNanos = System.nanoTime();
            StringBuilder responseBuffer = new StringBuilder();
            callLogger.logRequest(log, traceId, name(), httpRequest.url(), httpRequest.headers(),
                    httpRequest.bodyAsString(), true);
            return retryExecutor.executeStream(() -> transport.sendStream(httpRequest)
                            .flatMapMany(response -> openStream(response, httpRequest.url())))
                    .doOnNext(chunk -> callLogger.appendChunkLog(log, responseBuffer, chunk, traceId))
                    .doOnComplete(() -> callLogger.info(log, "[{}][{}] LLM stream finished in {} ms:\n{}",
                            traceId, name(), callLogger.elapsedMs(startNanos), responseBuffer))
                    .doOnError(ex -> callLogger.info(log, "[{}][{}] LLM stream failed in {} ms: {}",
                            traceId, name(), callLogger.elapsedMs(startNanos), ex.getMessage()));
        });
    }

    /**
     * Validates, builds the vendor body and applies the configured patch.
     */
    protected HttpRequest prepare(ChatRequest request, boolean stream) {
        Objects.requireNonNull(request, "request cannot be null");
        RequestValidators.requireCapabilities(request, capabilities());
        ObjectNode body = buildBody(request, stream);
        Map<String, String> headers = new LinkedHashMap<>(defaultHeaders());
        headers.put(HttpHeaders.ACCEPT, stream ? "text/event-stream" : "application/json");
        PatchedRequest patched = RequestPatchEngine.apply(body, headers, endpoint(), settings.patch());
        String json;
        try {
            json = objectMapper.writeValueAsString(patched.body());
        } catch (JsonProcessingException ex) {
            throw LlmException.validation("failed to serialize request: " + ex.getOriginalMessage());
        }
        return HttpRequest.postJson(patched.url(), patched.headers(), json, settings.timeout());
    }

    private ChatResponse toChatResponse(HttpResponse response) {
        String rawBody = response.bodyAsString();
        if (!response.isSuccess()) {
            throw parseError(response.status(), rawBody, response.headers());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException ex) {
            throw LlmException.provider(name(), "failed to parse response: " + ex.getOriginalMessage(), rawBody, ex);
        }
        return parseResponse(root);
    }

    private Flux<ChatChunk> openStream(HttpStreamResponse response, String url) {
        if (!response.isSuccess()) {
            return readFully(response.body())
                    .flatMapMany(rawBody -> Flux.<ChatChunk>error(parseError(response.status(), rawBody, response.headers())));
        }
        return new ChatStreamDecoder(objectMapper, name(), url, eventMapper()).decode(response.body());
    }

    private static Mono<String> readFully(Flux<byte[]> body) {
        return body.collect(ByteArrayOutputStream::new, (buffer, chunk) -> buffer.write(chunk, 0, chunk.length))
                .map(buffer -> buffer.toString(StandardCharsets.UTF_8));
    }

    /**
     * Extracts the API secret; service accounts and missing credentials are rejected with AUTH.
     */
    protected static String resolveSecret(String providerName, Credential credential) {
        if (credential instanceof Credential.ApiKey apiKey && JsonNodes.hasText(apiKey.key())) {
            return apiKey.key();
        }
        if (credential instanceof Credential.Bearer bearer && JsonNodes.hasText(bearer.token())) {
            return bearer.token();
        }
        if (credential instanceof Credential.ServiceAccount) {
            throw LlmException.auth("provider " + providerName + " does not support service account credential");
        }
        throw LlmException.auth("provider " + providerName + " requires credential");
    }

    /**
     * Joins {@code base} and {@code path}, dropping a duplicated {@code /v1}.
     */
    protected static String resolveEndpoint(String baseUrl, String defaultBaseUrl, String path) {
        String base = JsonNodes.hasText(baseUrl) ? baseUrl.trim() : defaultBaseUrl;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (base.toLowerCase(Locale.ROOT).endsWith("/v1")) {
            return base + path;
        }
        return base + "/v1" + path;
    }

    protected Duration retryAfter(HttpHeaders headers) {
        return RetryAfterParser.parse(headers);
    }
}
