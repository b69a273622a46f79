package com.linlay.llmclient.provider.anthropic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import com.linlay.llmclient.provider.ProviderSettings;
import com.linlay.llmclient.transport.FixedPayloadTransport;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnthropicMessagesProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final FixedPayloadTransport transport = new FixedPayloadTransport();

    private AnthropicMessagesProvider provider(ProviderSettings settings) {
        return new AnthropicMessagesProvider(settings, transport, objectMapper);
    }

    private ProviderSettings settings() {
        return ProviderSettings.of(Credential.apiKey("ak-test")).withDefaultModel("claude-3-5-sonnet");
    }

    private ChatRequest.Builder baseRequest() {
        return ChatRequest.builder().options(ChatOptions.builder().maxOutputTokens(256).build());
    }

    private JsonNode sentBody() throws IOException {
        return objectMapper.readTree(transport.lastRequest().bodyAsString());
    }

    @Test
    void shouldHoistSystemMessagesAndSendVersionHeaders() throws Exception {
        transport.respond(200, "{\"id\":\"msg_1\",\"content\":[],\"stop_reason\":\"end_turn\"}");
        ChatRequest request = baseRequest()
                .message(Message.system("rule one"))
                .message(Message.text(Role.DEVELOPER, "rule two"))
                .message(Message.user("hello"))
                .build();

        provider(settings().withExtra(Map.of("beta", "tools-2024-04-04"))).chat(request).block();

        assertThat(transport.lastRequest().url()).isEqualTo("https://api.anthropic.com/v1/messages");
        assertThat(transport.lastRequest().header("x-api-key")).isEqualTo("ak-test");
        assertThat(transport.lastRequest().header("anthropic-version")).isEqualTo("2023-06-01");
        assertThat(transport.lastRequest().header("anthropic-beta")).isEqualTo("tools-2024-04-04");
        JsonNode body = sentBody();
        assertThat(body.path("system").asText()).isEqualTo("rule one\n\nrule two");
        assertThat(body.path("messages")).hasSize(1);
        assertThat(body.path("messages").get(0).path("content").get(0).path("text").asText()).isEqualTo("hello");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(256);
    }

    @Test
    void shouldRejectSystemOnlyRequests() {
        ChatRequest request = baseRequest().message(Message.system("only rules")).build();

        assertThatThrownBy(() -> provider(settings()).chat(request).block())
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("Anthropic Messages request requires at least one user/assistant message");
    }

    @Test
    void shouldRequireMaxOutputTokens() {
        ChatRequest request = ChatRequest.of(Message.user("hi"));

        assertThatThrownBy(() -> provider(settings()).chat(request).block())
                .isInstanceOf(LlmException.class)
                .satisfies(ex -> assertThat(((LlmException) ex).kind()).isEqualTo(LlmErrorKind.VALIDATION))
                .hasMessageContaining("max_tokens");
    }

    @Test
    void shouldRejectStructuredOutputAsUnsupported() throws Exception {
        ChatRequest request = baseRequest()
                .message(Message.user("hi"))
                .responseFormat(ResponseFormat.jsonSchema(objectMapper.readTree("{\"type\":\"object\"}")))
                .build();

        assertThatThrownBy(() -> provider(settings()).chat(request).block())
                .isInstanceOf(LlmException.class)
                .satisfies(ex -> assertThat(((LlmException) ex).feature()).isEqualTo("structured_output"));
    }

    @Test
    void shouldMapToolsToolChoiceAndToolResults() throws Exception {
        transport.respond(200, "{\"content\":[]}");
        ChatRequest request = ChatRequest.builder()
                .options(ChatOptions.builder().maxOutputTokens(100).parallelToolCalls(false)
                        .reasoning(ChatOptions.ReasoningOptions.budget(2048)).build())
                .message(Message.user("weather?"))
                .message(new Message(Role.ASSISTANT, List.of(
                        ContentPart.toolCall("toolu_1", "get_weather", objectMapper.readTree("{\"city\":\"Oslo\"}")))))
                .message(Message.toolResult("toolu_1", objectMapper.readTree("\"-3C\"")))
                .tool(ToolDefinition.function("get_weather", "Look up weather",
                        objectMapper.readTree("{\"type\":\"object\"}")))
                .toolChoice(ToolChoice.any())
                .build();

        provider(settings()).chat(request).block();

        JsonNode body = sentBody();
        assertThat(body.path("tools").get(0).path("input_schema").path("type").asText()).isEqualTo("object");
        assertThat(body.path("tool_choice").path("type").asText()).isEqualTo("any");
        assertThat(body.path("tool_choice").path("disable_parallel_tool_use").asBoolean()).isTrue();
        assertThat(body.path("thinking").path("budget_tokens").asInt()).isEqualTo(2048);
        JsonNode toolUse = body.path("messages").get(1).path("content").get(0);
        assertThat(toolUse.path("type").asText()).isEqualTo("tool_use");
        assertThat(toolUse.path("input").path("city").asText()).isEqualTo("Oslo");
        JsonNode toolResult = body.path("messages").get(2);
        assertThat(toolResult.path("role").asText()).isEqualTo("user");
        assertThat(toolResult.path("content").get(0).path("tool_use_id").asText()).isEqualTo("toolu_1");
    }

    @Test
    void shouldParseContentBlocksUsageAndStopReason() {
        transport.respond(200, """
                {"id":"msg_01","model":"claude-3-5-sonnet","stop_reason":"tool_use",
                 "content":[{"type":"thinking","thinking":"consider"},
                            {"type":"text","text":"Let me check."},
                            {"type":"tool_use","id":"toolu_9","name":"get_weather","input":{"city":"Oslo"}}],
                 "usage":{"input_tokens":30,"output_tokens":12,"cache_read_input_tokens":4}}
                """);

        ChatResponse response = provider(settings()).chat(baseRequest().message(Message.user("hi")).build()).block();

        assertThat(response.finishReason()).isEqualTo(FinishReason.TOOL_CALLS);
        assertThat(response.text()).isEqualTo("Let me check.");
        assertThat(response.outputs().get(0)).isEqualTo(new OutputItem.ReasoningOutput(0, "consider"));
        assertThat(response.toolCalls()).singleElement()
                .satisfies(call -> assertThat(call.id()).isEqualTo("toolu_9"));
        assertThat(response.usage().totalTokens()).isEqualTo(42L);
        assertThat(response.usage().details()).containsEntry("cache_read_input_tokens", 4L);
        assertThat(response.provider().requestId()).isEqualTo("msg_01");
    }

    @Test
    void shouldClassifyAnthropicErrors() {
        transport.respond(400, "{\"type\":\"error\",\"error\":{\"type\":\"invalid_request_error\",\"message\":\"prompt is too long: 210000 tokens > 200000 maximum\"}}")
                .respond(403, "{\"type\":\"error\",\"error\":{\"type\":\"permission_error\",\"message\":\"forbidden\"}}")
                .respond(529, "{\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\",\"message\":\"Overloaded\"}}");
        AnthropicMessagesProvider provider = provider(settings());
        ChatRequest request = baseRequest().message(Message.user("hi")).build();

        assertThatThrownBy(() -> provider.chat(request).block())
                .satisfies(ex -> assertThat(((LlmException) ex).kind()).isEqualTo(LlmErrorKind.TOKEN_LIMIT_EXCEEDED));
        assertThatThrownBy(() -> provider.chat(request).block())
                .satisfies(ex -> assertThat(((LlmException) ex).kind()).isEqualTo(LlmErrorKind.AUTH));
        assertThatThrownBy(() -> provider.chat(request).block())
                .satisfies(ex -> assertThat(((LlmException) ex).kind()).isEqualTo(LlmErrorKind.PROVIDER))
                .hasMessageContaining("Overloaded");
    }

    @Test
    void shouldStreamTextToolInputAndTerminateOnMessageStop() {
        transport.respondStream(200,
                "event: message_start\ndata: {\"type\":\"message_start\",\"message\":{\"id\":\"msg_s\",\"usage\":{\"input_tokens\":25,\"output_tokens\":1}}}\n\n",
                "event: ping\ndata: {\"type\":\"ping\"}\n\n",
                "event: content_block_delta\ndata: {\"type\":\"content_block_delta\",\"index\":0,\"delta\":{\"type\":\"text_delta\",\"text\":\"Hi\"}}\n\n",
                "event: content_block_start\ndata: {\"type\":\"content_block_start\",\"index\":1,\"content_block\":{\"type\":\"tool_use\",\"id\":\"toolu_1\",\"name\":\"f\",\"input\":{}}}\n\n",
                "event: content_block_delta\ndata: {\"type\":\"content_block_delta\",\"index\":1,\"delta\":{\"type\":\"input_json_delta\",\"partial_json\":\"{\\\"x\\\":1}\"}}\n\n",
                "event: content_block_stop\ndata: {\"type\":\"content_block_stop\",\"index\":1}\n\n",
                "event: message_delta\ndata: {\"type\":\"message_delta\",\"delta\":{\"stop_reason\":\"end_turn\"},\"usage\":{\"output_tokens\":9}}\n\n",
                "event: message_stop\ndata: {\"type\":\"message_stop\"}\n\n",
                "event: ping\ndata: {\"type\":\"ping\"}\n\n");

        List<ChatChunk> chunks = provider(settings())
                .streamChat(baseRequest().message(Message.user("hi")).build())
                .collectList().block();

        assertThat(chunks).hasSize(6);
        assertThat(chunks.get(0).provider().requestId()).isEqualTo("msg_s");
        assertThat(chunks.get(1).text()).isEqualTo("Hi");
        assertThat(chunks.get(2).events()).containsExactly(new ChatEvent.ToolCallDelta(1, "toolu_1", "f", ""));
        assertThat(chunks.get(3).events()).containsExactly(new ChatEvent.ToolCallDelta(1, null, null, "{\"x\":1}"));
        assertThat(chunks.get(4).events()).containsExactly(new ChatEvent.FinishSignal(FinishReason.STOP, "end_turn"));
        assertThat(chunks.get(4).usage().promptTokens()).isEqualTo(25L);
        assertThat(chunks.get(4).usage().totalTokens()).isEqualTo(34L);
        assertThat(chunks.get(5).terminal()).isTrue();
    }

    @Test
    void shouldEndStreamOnErrorEvent() {
        transport.respondStream(200,
                "event: error\ndata: {\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\",\"message\":\"Overloaded\"}}\n\n");

        List<ChatChunk> chunks = provider(settings())
                .streamChat(baseRequest().message(Message.user("hi")).build())
                .collectList().block();

        assertThat(chunks).singleElement().satisfies(chunk -> {
            assertThat(chunk.hasError()).isTrue();
            assertThat(chunk.events().get(0)).isInstanceOf(ChatEvent.ErrorEvent.class);
        });
    }

    @Test
    void shouldRejectServiceAccountCredential() throws Exception {
        ProviderSettings settings = ProviderSettings.of(new Credential.ServiceAccount(objectMapper.readTree("{}")));

        assertThatThrownBy(() -> provider(settings))
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("does not support service account credential");
    }
}
