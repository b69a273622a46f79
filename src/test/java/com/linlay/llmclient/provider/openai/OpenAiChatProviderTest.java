package com.linlay.llmclient.provider.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.llmclient.error.LlmErrorKind;
import com.linlay.llmclient.error.LlmException;
import com.linlay.llmclient.model.ChatChunk;
import com.linlay.llmclient.model.ChatEvent;
import com.linlay.llmclient.model.ChatOptions;
import com.linlay.llmclient.model.ChatRequest;
import com.linlay.llmclient.model.ChatResponse;
import com.linlay.llmclient.model.ContentPart;
import com.linlay.llmclient.model.Credential;
import com.linlay.llmclient.model.FinishReason;
import com.linlay.llmclient.model.Message;
import com.linlay.llmclient.model.OutputItem;
import com.linlay.llmclient.model.ResponseFormat;
import com.linlay.llmclient.model.Role;
import com.linlay.llmclient.model.ToolChoice;
import com.linlay.llmclient.model.ToolDefinition;
import com.linlay.llmclient.patch.RequestPatch;
import com.linlay.llmclient.provider.ProviderSettings;
import com.linlay.llmclient.retry.RetryPolicy;
import com.linlay.llmclient.transport.FixedPayloadTransport;
import com.linlay.llmclient.transport.HttpStreamResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiChatProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final FixedPayloadTransport transport = new FixedPayloadTransport();

    private OpenAiChatProvider provider(ProviderSettings settings) {
        return new OpenAiChatProvider(settings, transport, objectMapper);
    }

    private ProviderSettings settings() {
        return ProviderSettings.of(Credential.apiKey("sk-test")).withDefaultModel("gpt-4o-mini");
    }

    private JsonNode sentBody() throws IOException {
        return objectMapper.readTree(transport.lastRequest().bodyAsString());
    }

    @Test
    void shouldBuildChatCompletionsBodyWithToolsAndSchema() throws Exception {
        transport.respond(200, """
                {"id":"chatcmpl-1","model":"gpt-4o-mini","choices":[{"index":0,"message":{"role":"assistant","content":"hi"},"finish_reason":"stop"}]}
                """);
        ChatRequest request = ChatRequest.builder()
                .message(Message.system("be brief"))
                .message(Message.user("weather?"))
                .options(ChatOptions.builder().temperature(0.3).maxOutputTokens(64).parallelToolCalls(false)
                        .reasoning(ChatOptions.ReasoningOptions.effort(ChatOptions.ReasoningEffort.HIGH))
                        .extra("seed", 7).build())
                .tool(ToolDefinition.function("get_weather", "Look up weather",
                        objectMapper.readTree("{\"type\":\"object\",\"properties\":{\"city\":{\"type\":\"string\"}}}")))
                .toolChoice(ToolChoice.tool("get_weather"))
                .responseFormat(ResponseFormat.jsonSchema(objectMapper.readTree("{\"type\":\"object\"}")))
                .build();

        provider(settings()).chat(request).block();

        assertThat(transport.lastRequest().url()).isEqualTo("https://api.openai.com/v1/chat/completions");
        assertThat(transport.lastRequest().header("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(transport.lastRequest().header("Accept")).isEqualTo("application/json");
        JsonNode body = sentBody();
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o-mini");
        assertThat(body.path("messages").get(0).path("role").asText()).isEqualTo("system");
        assertThat(body.path("messages").get(1).path("content").asText()).isEqualTo("weather?");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(64);
        assertThat(body.path("parallel_tool_calls").asBoolean()).isFalse();
        assertThat(body.path("reasoning_effort").asText()).isEqualTo("high");
        assertThat(body.path("seed").asInt()).isEqualTo(7);
        assertThat(body.path("tools").get(0).path("function").path("name").asText()).isEqualTo("get_weather");
        assertThat(body.path("tool_choice").path("function").path("name").asText()).isEqualTo("get_weather");
        assertThat(body.path("response_format").path("type").asText()).isEqualTo("json_schema");
        assertThat(body.path("stream").asBoolean()).isFalse();
    }

    @Test
    void shouldMapToolRoundTripMessages() throws Exception {
        transport.respond(200, "{\"choices\":[]}");
        Message assistant = new Message(Role.ASSISTANT, List.of(
                ContentPart.toolCall("call_1", "get_weather", objectMapper.readTree("{\"city\":\"Paris\"}"))));
        ChatRequest request = ChatRequest.builder()
                .message(Message.user("weather?"))
                .message(assistant)
                .message(Message.toolResult("call_1", objectMapper.readTree("{\"temp\":21}")))
                .build();

        provider(settings()).chat(request).block();

        JsonNode messages = sentBody().path("messages");
        assertThat(messages.get(1).path("content").isNull()).isTrue();
        assertThat(messages.get(1).path("tool_calls").get(0).path("function").path("arguments").asText())
                .isEqualTo("{\"city\":\"Paris\"}");
        assertThat(messages.get(2).path("role").asText()).isEqualTo("tool");
        assertThat(messages.get(2).path("tool_call_id").asText()).isEqualTo("call_1");
    }

    @Test
    void shouldRejectToolMessageWithoutSingleResult() {
        ChatRequest request = ChatRequest.of(Message.user("hi"), Message.text(Role.TOOL, "not a result"));

        assertThatThrownBy(() -> provider(settings()).chat(request).block())
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("tool role expects a single ToolResult content");
        assertThat(transport.requests()).isEmpty();
    }

    @Test
    void shouldRequireModel() {
        ProviderSettings noModel = ProviderSettings.of(Credential.apiKey("sk-test"));

        assertThatThrownBy(() -> provider(noModel).chat(ChatRequest.of(Message.user("hi"))).block())
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("model is required for OpenAI Chat");
    }

    @Test
    void shouldRejectMissingCredentialAtConstruction() {
        assertThatThrownBy(() -> provider(ProviderSettings.of(Credential.none())))
                .isInstanceOf(LlmException.class)
                .satisfies(ex -> assertThat(((LlmException) ex).kind()).isEqualTo(LlmErrorKind.AUTH));
    }

    @Test
    void shouldParseResponseOutputsUsageAndFinishReason() {
        transport.respond(200, """
                {"id":"chatcmpl-9","model":"gpt-4o-mini",
                 "choices":[{"index":0,"finish_reason":"tool_calls","message":{"role":"assistant","content":"checking",
                   "reasoning_content":"need weather",
                   "tool_calls":[{"id":"call_1","type":"function","function":{"name":"get_weather","arguments":"{\\"city\\":\\"Paris\\"}"}}]}}],
                 "usage":{"prompt_tokens":12,"completion_tokens":8,"total_tokens":20,"completion_tokens_details":{"reasoning_tokens":3}}}
                """);

        ChatResponse response = provider(settings()).chat(ChatRequest.of(Message.user("weather?"))).block();

        assertThat(response.finishReason()).isEqualTo(FinishReason.TOOL_CALLS);
        assertThat(response.text()).isEqualTo("checking");
        assertThat(response.outputs()).hasAtLeastOneElementOfType(OutputItem.ReasoningOutput.class);
        assertThat(response.toolCalls()).singleElement()
                .satisfies(call -> assertThat(call.arguments().path("city").asText()).isEqualTo("Paris"));
        assertThat(response.usage().promptTokens()).isEqualTo(12L);
        assertThat(response.usage().reasoningTokens()).isEqualTo(3L);
        assertThat(response.provider().requestId()).isEqualTo("chatcmpl-9");
    }

    @Test
    void shouldClassifyErrorResponses() {
        HttpHeaders retryHeaders = new HttpHeaders();
        retryHeaders.add("Retry-After", "4");
        transport.respond(429, retryHeaders, "{\"error\":{\"message\":\"Rate limit reached\",\"code\":\"rate_limit_exceeded\"}}")
                .respond(400, "{\"error\":{\"message\":\"This model's maximum context length is 8192 tokens\",\"code\":\"context_length_exceeded\"}}")
                .respond(404, "{\"error\":{\"message\":\"The model `gpt-9` does not exist\",\"code\":\"model_not_found\"}}")
                .respond(401, "{\"error\":{\"message\":\"Incorrect API key\"}}")
                .respond(502, "<html>bad gateway</html>");
        OpenAiChatProvider provider = provider(settings());
        ChatRequest request = ChatRequest.of(Message.user("hi"));

        LlmException rateLimit = catchLlm(provider, request);
        assertThat(rateLimit.kind()).isEqualTo(LlmErrorKind.RATE_LIMIT);
        assertThat(rateLimit.retryAfter()).contains(Duration.ofSeconds(4));
        assertThat(catchLlm(provider, request).kind()).isEqualTo(LlmErrorKind.TOKEN_LIMIT_EXCEEDED);
        LlmException notFound = catchLlm(provider, request);
        assertThat(notFound.kind()).isEqualTo(LlmErrorKind.MODEL_NOT_FOUND);
        assertThat(notFound.model()).contains("gpt-9");
        assertThat(catchLlm(provider, request).kind()).isEqualTo(LlmErrorKind.AUTH);
        LlmException gateway = catchLlm(provider, request);
        assertThat(gateway.kind()).isEqualTo(LlmErrorKind.PROVIDER);
        assertThat(gateway.getMessage()).contains("status 502");
    }

    @Test
    void shouldApplyRequestPatchBeforeSending() throws Exception {
        transport.respond(200, "{\"choices\":[]}");
        RequestPatch patch = new RequestPatch("https://proxy.local/v1/chat/completions",
                (ObjectNode) objectMapper.readTree("{\"temperature\":0.9,\"extra_body\":{\"top_k\":5}}"),
                Map.of("X-Trace", "on"),
                List.of("stream"));

        provider(settings().withPatch(patch))
                .chat(ChatRequest.builder().message(Message.user("hi"))
                        .options(ChatOptions.builder().temperature(0.1).build()).build())
                .block();

        assertThat(transport.lastRequest().url()).isEqualTo("https://proxy.local/v1/chat/completions");
        assertThat(transport.lastRequest().header("X-Trace")).isEqualTo("on");
        JsonNode body = sentBody();
        assertThat(body.path("temperature").asDouble()).isEqualTo(0.9);
        assertThat(body.path("extra_body").path("top_k").asInt()).isEqualTo(5);
        assertThat(body.has("stream")).isFalse();
    }

    @Test
    void shouldRejectMalformedPatchAtConstruction() {
        RequestPatch patch = new RequestPatch(null, null, null, List.of("a..b"));

        assertThatThrownBy(() -> provider(settings().withPatch(patch)))
                .isInstanceOf(LlmException.class)
                .satisfies(ex -> assertThat(((LlmException) ex).kind()).isEqualTo(LlmErrorKind.INVALID_CONFIG));
    }

    @Test
    void shouldStreamDeltasToolCallsAndUsage() throws Exception {
        transport.respondStream(200,
                "data: {\"id\":\"c1\",\"choices\":[{\"index\":0,\"delta\":{\"role\":\"assistant\",\"content\":\"Hel\"}}]}\n\n",
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"lo\"}}]}\n\n"
                        + "data: {\"choices\":[{\"index\":0,\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_1\",\"function\":{\"name\":\"f\",\"arguments\":\"{\\\"a\\\"\"}}]}}]}\n\n",
                "data: {\"choices\":[{\"index\":0,\"delta\":{},\"finish_reason\":\"stop\"}]}\n\n",
                "data: {\"choices\":[],\"usage\":{\"prompt_tokens\":5,\"completion_tokens\":2,\"total_tokens\":7}}\n\n",
                "data: [DONE]\n\n");

        List<ChatChunk> chunks = provider(settings()).streamChat(ChatRequest.of(Message.user("hi"))).collectList().block();

        assertThat(sentBody().path("stream").asBoolean()).isTrue();
        assertThat(sentBody().path("stream_options").path("include_usage").asBoolean()).isTrue();
        assertThat(transport.lastRequest().header("Accept")).isEqualTo("text/event-stream");
        assertThat(chunks).extracting(ChatChunk::text).startsWith("Hel", "lo");
        assertThat(chunks.get(2).events()).singleElement()
                .isEqualTo(new ChatEvent.ToolCallDelta(0, "call_1", "f", "{\"a\""));
        assertThat(chunks.get(3).events()).singleElement()
                .isEqualTo(new ChatEvent.FinishSignal(FinishReason.STOP, "stop"));
        assertThat(chunks.get(4).usage().totalTokens()).isEqualTo(7L);
        assertThat(chunks.get(chunks.size() - 1).isDone()).isTrue();
    }

    @Test
    void shouldCloseStreamBodyWhenCallerStopsReading() {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        byte[] first = "data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"Hel\"}}]}\n\n"
                .getBytes(StandardCharsets.UTF_8);
        Flux<byte[]> body = Flux.concat(Flux.just(first), Flux.<byte[]>never())
                .doOnCancel(() -> cancelled.set(true));
        transport.respondStream(new HttpStreamResponse(200, new HttpHeaders(), body));

        List<ChatChunk> chunks = provider(settings()).streamChat(ChatRequest.of(Message.user("hi")))
                .take(1)
                .collectList()
                .block(Duration.ofSeconds(5));

        assertThat(chunks).extracting(ChatChunk::text).containsExactly("Hel");
        assertThat(cancelled).isTrue();
    }

    @Test
    void shouldSurfaceStreamErrorStatusAsClassifiedError() {
        transport.respondStream(401, "{\"error\":{\"message\":\"bad key\"}}");

        assertThatThrownBy(() -> provider(settings()).streamChat(ChatRequest.of(Message.user("hi"))).collectList().block())
                .isInstanceOf(LlmException.class)
                .satisfies(ex -> assertThat(((LlmException) ex).kind()).isEqualTo(LlmErrorKind.AUTH));
    }

    @Test
    void shouldRetryTransportFailuresWithConfiguredPolicy() {
        transport.fail(LlmException.transport("connection reset"))
                .respond(200, "{\"choices\":[{\"index\":0,\"message\":{\"content\":\"ok\"},\"finish_reason\":\"stop\"}]}");
        ProviderSettings retrying = settings().withRetry(new RetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(1)));

        ChatResponse response = provider(retrying).chat(ChatRequest.of(Message.user("hi"))).block();

        assertThat(response.text()).isEqualTo("ok");
        assertThat(transport.requests()).hasSize(2);
    }

    private static LlmException catchLlm(OpenAiChatProvider provider, ChatRequest request) {
        try {
            provider.chat(request).block();
        } catch (LlmException ex) {
            return ex;
        }
        throw new AssertionError("expected LlmException");
    }
}
