package com.linlay.llmclient.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChatModelTest {

    @Test
    void shouldNormalizeVendorFinishReasons() {
        assertThat(FinishReason.fromVendor("end_turn")).isEqualTo(FinishReason.STOP);
        assertThat(FinishReason.fromVendor("max_tokens")).isEqualTo(FinishReason.LENGTH);
        assertThat(FinishReason.fromVendor("tool_use")).isEqualTo(FinishReason.TOOL_CALLS);
        assertThat(FinishReason.fromVendor("something_new")).isEqualTo(FinishReason.OTHER);
        assertThat(FinishReason.fromVendor(" ")).isNull();
    }

    @Test
    void shouldTreatErrorAndDoneChunksAsStreamEnd() {
        ChatChunk text = ChatChunk.of(List.of(new ChatEvent.TextDelta(0, "a")), null, null);
        ChatChunk error = ChatChunk.of(List.of(new ChatEvent.ErrorEvent("boom", null)), null, null);

        assertThat(text.endsStream()).isFalse();
        assertThat(error.endsStream()).isTrue();
        assertThat(ChatChunk.done(null).endsStream()).isTrue();
    }

    @Test
    void shouldCopyMessageContentDefensively() {
        List<ContentPart> parts = new ArrayList<>(List.of(ContentPart.text("a")));
        Message message = new Message(Role.USER, parts);
        parts.add(ContentPart.text("b"));

        assertThat(message.content()).hasSize(1);
        assertThat(message.joinedText()).isEqualTo("a");
    }

    @Test
    void shouldHideSecretsInCredentialToString() {
        assertThat(Credential.apiKey("sk-123").toString()).doesNotContain("sk-123");
        assertThat(Credential.bearer("tok").toString()).doesNotContain("tok");
    }
}
