package com.linlay.llmclient.provider;

import com.linlay.llmclient.model.CapabilityDescriptor;
import com.linlay.llmclient.model.ChatChunk;
import com.linlay.llmclient.model.ChatRequest;
import com.linlay.llmclient.model.ChatResponse;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 供应商适配器契约。实现必须线程安全，可被多个并发调用共享。
 */
public interface LlmProvider {

    Mono<ChatResponse> chat(ChatRequest request);

    /**
     * Opens a stream. The returned Flux is lazy and cancelling it closes the connection.
     */
    Flux<ChatChunk> streamChat(ChatRequest request);

    CapabilityDescriptor capabilities();

    String name();
}
