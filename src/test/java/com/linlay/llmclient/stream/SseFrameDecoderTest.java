package com.linlay.llmclient.stream;

import com.linlay.llmclient.error.LlmErrorKind;
import com.linlay.llmclient.error.LlmException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SseFrameDecoderTest {

    private static final String STREAM = """
            : keep-alive
            event: message
            id: 7
            retry: 1500
            data: {"a":1}

            data:first
            data: second\r
            \r
            data: 你好🙂

            """;

    @Test
    void shouldProduceSameFramesForWholeBufferAndByteAtATime() {
        byte[] bytes = STREAM.getBytes(StandardCharsets.UTF_8);

        SseFrameDecoder whole = new SseFrameDecoder("test");
        List<SseFrame> expected = new ArrayList<>(whole.feed(bytes));
        expected.addAll(whole.finish());

        SseFrameDecoder split = new SseFrameDecoder("test");
        List<SseFrame> actual = new ArrayList<>();
        for (byte b : bytes) {
            actual.addAll(split.feed(new byte[]{b}));
        }
        actual.addAll(split.finish());

        assertThat(actual).isEqualTo(expected);
        assertThat(expected).hasSize(3);
        assertThat(expected.get(0)).isEqualTo(new SseFrame("message", "7", 1500L, "{\"a\":1}"));
        assertThat(expected.get(1).data()).isEqualTo("first\nsecond");
        assertThat(expected.get(2).data()).isEqualTo("你好🙂");
    }

    @Test
    void shouldFlushTrailingEventWithoutBlankLine() {
        SseFrameDecoder decoder = new SseFrameDecoder("test");

        assertThat(decoder.feed("data: tail".getBytes(StandardCharsets.UTF_8))).isEmpty();
        assertThat(decoder.finish()).containsExactly(new SseFrame(null, null, null, "tail"));
    }

    @Test
    void shouldIgnoreInvalidRetryValue() {
        SseFrameDecoder decoder = new SseFrameDecoder("test");

        List<SseFrame> frames = decoder.feed("retry: soon\ndata: x\n\n".getBytes(StandardCharsets.UTF_8));

        assertThat(frames).containsExactly(new SseFrame(null, null, null, "x"));
    }

    @Test
    void shouldRejectInvalidUtf8AsProviderError() {
        SseFrameDecoder decoder = new SseFrameDecoder("test");

        assertThatThrownBy(() -> decoder.feed(new byte[]{'d', 'a', 't', 'a', ':', (byte) 0xC3, (byte) 0x28, '\n'}))
                .isInstanceOf(LlmException.class)
                .satisfies(ex -> assertThat(((LlmException) ex).kind()).isEqualTo(LlmErrorKind.PROVIDER));
    }
}
