package com.linlay.llmclient.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.llmclient.error.LlmException;
import com.linlay.llmclient.model.ChatChunk;
import com.linlay.llmclient.model.ProviderMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 将 SSE 字节流解码为有序、惰性的 {@link ChatChunk} 序列。
 * <p>
 * 终止哨兵（默认 {@code [DONE]}）产生带 Done 的终止块并取消上游；无法解析的负载是致命错误；
 * 上游在终止信号之前结束则以 STREAM_CLOSED 结束。
 */
public class ChatStreamDecoder {

    private static final Logger log = LoggerFactory.getLogger(ChatStreamDecoder.class);

    private final ObjectMapper objectMapper;
    private final String provider;
    private final String endpoint;
    private final SseEventMapper mapper;

    public ChatStreamDecoder(ObjectMapper objectMapper, String provider, String endpoint, SseEventMapper mapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.provider = provider;
        this.endpoint = endpoint;
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
    }

    /**
     * The returned Flux accepts a single subscriber; a second subscription fails with
     * {@link IllegalStateException}.
     */
    public Flux<ChatChunk> decode(Flux<byte[]> source) {
        AtomicBoolean subscribed = new AtomicBoolean(false);
        return Flux.defer(() -> {
            if (!subscribed.compareAndSet(false, true)) {
                return Flux.error(new IllegalStateException("chat stream can only be consumed once"));
            }
            SseFrameDecoder frameDecoder = new SseFrameDecoder(provider);
            AtomicBoolean terminated = new AtomicBoolean(false);

            return source
                    .onErrorMap(ex -> !(ex instanceof LlmException),
                            ex -> LlmException.transport("stream read failed: " + ex.getMessage(), ex))
                    .concatMap(bytes -> mapFrames(sink -> frameDecoder.feed(bytes, sink), terminated))
                    .concatWith(Flux.defer(() -> terminated.get()
                            ? Flux.empty()
                            : mapFrames(frameDecoder::finish, terminated)))
                    .takeUntil(ChatChunk::endsStream)
                    .concatWith(Flux.defer(() -> terminated.get()
                            ? Flux.empty()
                            : Flux.error(LlmException.streamClosed("stream ended before a terminal event"))));
        });
    }

    /**
     * Runs one framing step. Framing stops at the first chunk that ends the stream, so bytes
     * buffered behind a terminal frame are never decoded. A framing or parse failure is emitted
     * after the chunks that preceded it.
     */
    private Flux<ChatChunk> mapFrames(Consumer<Predicate<SseFrame>> framing, AtomicBoolean terminated) {
        List<ChatChunk> chunks = new ArrayList<>();
        try {
            framing.accept(frame -> {
                ChatChunk chunk = toChunk(frame);
                if (chunk == null) {
                    return true;
                }
                chunks.add(chunk);
                if (chunk.endsStream()) {
                    terminated.set(true);
                    return false;
                }
                return true;
            });
        } catch (LlmException ex) {
            return Flux.fromIterable(chunks).concatWith(Flux.error(ex));
        }
        return Flux.fromIterable(chunks);
    }

    private ChatChunk toChunk(SseFrame frame) {
        String data = frame.data();
        String sentinel = mapper.terminalSentinel();
        if (sentinel != null && sentinel.equals(data.trim())) {
            return ChatChunk.done(ProviderMetadata.of(provider, endpoint));
        }
        if (data.isBlank()) {
            return null;
        }
        JsonNode payload;
        try {
            payload = objectMapper.readTree(data);
        } catch (JsonProcessingException ex) {
            log.warn("[{}] failed to parse stream event: {}", provider, abbreviate(data));
            throw LlmException.provider(provider, "failed to parse stream event", data, ex);
        }
        return mapper.map(frame, payload);
    }

    private static String abbreviate(String value) {
        return value.length() <= 200 ? value : value.substring(0, 200) + "...";
    }
}
