package com.linlay.llmclient.stream;

import com.linlay.llmclient.error.LlmException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * Incremental SSE framer. Bytes are buffered until a full line is available, so a
 * multi-byte character split across reads decodes correctly. Not thread-safe: one
 * instance per stream.
 */
public final class SseFrameDecoder {

    private final String provider;
    private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);

    private byte[] pending = new byte[0];

    private String event;
    private String id;
    private Long retry;
    private final StringBuilder data = new StringBuilder();
    private boolean hasData;
    private boolean stopped;

    public SseFrameDecoder(String provider) {
        this.provider = provider;
    }

    public List<SseFrame> feed(byte[] chunk) {
        List<SseFrame> frames = new ArrayList<>();
        feed(chunk, frames::add);
        return frames;
    }

    /**
     * Frames {@code chunk} and hands each dispatched frame to {@code sink}. When the sink returns
     * {@code false} framing stops at once: lines after that frame are never decoded, and later
     * input is discarded.
     *
     * @return {@code false} once the sink has stopped the decoder
     */
    public boolean feed(byte[] chunk, Predicate<SseFrame> sink) {
        if (stopped || chunk == null || chunk.length == 0) {
            return !stopped;
        }
        byte[] buffer = concat(pending, chunk);
        int lineStart = 0;
        for (int i = 0; i < buffer.length && !stopped; i++) {
            if (buffer[i] == '\n') {
                processLine(decodeLine(buffer, lineStart, i), sink);
                lineStart = i + 1;
            }
        }
        pending = stopped ? new byte[0] : Arrays.copyOfRange(buffer, lineStart, buffer.length);
        return !stopped;
    }

    /**
     * Flushes a trailing line and any event not yet closed by a blank line.
     */
    public List<SseFrame> finish() {
        List<SseFrame> frames = new ArrayList<>();
        finish(frames::add);
        return frames;
    }

    public void finish(Predicate<SseFrame> sink) {
        if (stopped) {
            return;
        }
        if (pending.length > 0) {
            byte[] tail = pending;
            pending = new byte[0];
            processLine(decodeLine(tail, 0, tail.length), sink);
        }
        if (!stopped) {
            dispatch(sink);
        }
    }

    private void processLine(String line, Predicate<SseFrame> sink) {
        if (line.isEmpty()) {
            dispatch(sink);
            return;
        }
        if (line.startsWith(":")) {
            return;
        }
        int colon = line.indexOf(':');
        String field = colon < 0 ? line : line.substring(0, colon);
        String value = colon < 0 ? "" : line.substring(colon + 1);
        if (value.startsWith(" ")) {
            value = value.substring(1);
        }
        switch (field) {
            case "data" -> {
                if (hasData) {
                    data.append('\n');
                }
                data.append(value);
                hasData = true;
            }
            case "event" -> event = value;
            case "id" -> id = value;
            case "retry" -> retry = parseRetry(value);
            default -> {
                // unknown fields are ignored
            }
        }
    }

    private void dispatch(Predicate<SseFrame> sink) {
        SseFrame frame = hasData ? new SseFrame(event, id, retry, data.toString()) : null;
        event = null;
        id = null;
        retry = null;
        data.setLength(0);
        hasData = false;
        if (frame != null && !sink.test(frame)) {
            stopped = true;
        }
    }

    private String decodeLine(byte[] buffer, int start, int end) {
        int length = end - start;
        if (length > 0 && buffer[end - 1] == '\r') {
            length--;
        }
        try {
            return utf8.decode(ByteBuffer.wrap(buffer, start, length)).toString();
        } catch (CharacterCodingException ex) {
            throw LlmException.provider(provider, "invalid UTF-8 in stream chunk", null, ex);
        }
    }

    private static Long parseRetry(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static byte[] concat(byte[] head, byte[] tail) {
        if (head.length == 0) {
            return tail;
        }
        byte[] merged = Arrays.copyOf(head, head.length + tail.length);
        System.arraycopy(tail, 0, merged, head.length, tail.length);
        return merged;
    }
}
