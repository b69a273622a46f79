package com.linlay.llmclient.transport;

import org.springframework.http.HttpHeaders;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Transport that replays queued responses in order and records every request it receives.
 * Used to exercise adapters without a network.
 */
public class FixedPayloadTransport implements HttpTransport {

    private final Deque<Object> replies = new ConcurrentLinkedDeque<>();
    private final List<HttpRequest> requests = new CopyOnWriteArrayList<>();

    public FixedPayloadTransport respond(int status, String body) {
        return respond(status, new HttpHeaders(), body);
    }

    public FixedPayloadTransport respond(int status, HttpHeaders headers, String body) {
        replies.add(new HttpResponse(status, headers, body.getBytes(StandardCharsets.UTF_8)));
        return this;
    }

    /**
     * Queues a stream reply whose body is delivered as the given chunks.
     */
    public FixedPayloadTransport respondStream(int status, String... chunks) {
        List<byte[]> parts = new ArrayList<>(chunks.length);
        for (String chunk : chunks) {
            parts.add(chunk.getBytes(StandardCharsets.UTF_8));
        }
        replies.add(new HttpStreamResponse(status, new HttpHeaders(), Flux.fromIterable(parts)));
        return this;
    }

    public FixedPayloadTransport respondStream(HttpStreamResponse response) {
        replies.add(response);
        return this;
    }

    public FixedPayloadTransport fail(Throwable error) {
        replies.add(error);
        return this;
    }

    public List<HttpRequest> requests() {
        return Collections.unmodifiableList(requests);
    }

    public HttpRequest lastRequest() {
        if (requests.isEmpty()) {
            throw new IllegalStateException("no request has been sent");
        }
        return requests.get(requests.size() - 1);
    }

    @Override
    public Mono<HttpResponse> send(HttpRequest request) {
        return Mono.defer(() -> {
            requests.add(request);
            Object reply = nextReply();
            if (reply instanceof Throwable error) {
                return Mono.error(error);
            }
            if (reply instanceof HttpResponse response) {
                return Mono.just(response);
            }
            return Mono.error(new IllegalStateException("queued reply is not a plain response: " + reply));
        });
    }

    @Override
    public Mono<HttpStreamResponse> sendStream(HttpRequest request) {
        return Mono.defer(() -> {
            requests.add(request);
            Object reply = nextReply();
            if (reply instanceof Throwable error) {
                return Mono.error(error);
            }
            if (reply instanceof HttpStreamResponse response) {
                return Mono.just(response);
            }
            if (reply instanceof HttpResponse response) {
                return Mono.just(new HttpStreamResponse(response.status(), response.headers(),
                        Flux.just(response.body())));
            }
            return Mono.error(new IllegalStateException("unexpected queued reply: " + reply));
        });
    }

    private Object nextReply() {
        Object reply = replies.poll();
        if (reply == null) {
            throw new IllegalStateException("no queued reply left");
        }
        return reply;
    }
}
