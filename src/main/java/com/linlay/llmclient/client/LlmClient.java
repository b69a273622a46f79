package com.linlay.llmclient.client;

import com.linlay.llmclient.model.CapabilityDescriptor;
import com.linlay.llmclient.model.ChatChunk;
import com.linlay.llmclient.model.ChatRequest;
import com.linlay.llmclient.model.ChatResponse;
import com.linlay.llmclient.provider.LlmProvider;
import com.linlay.llmclient.retry.RetryExecutor;
import com.linlay.llmclient.retry.RetryPolicy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * 按 handle 路由到已注册的供应商适配器。注册表构建后不可变，可被并发共享。
 * <p>
 * 未知 handle 以 {@link HandleNotFoundException} 失败；能力筛选只读取静态的 {@link CapabilityDescriptor}。
 */
public class LlmClient {

    private final Map<String, LlmProvider> providers;

    LlmClient(Map<String, LlmProvider> providers) {
        this.providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
    }

    public static LlmClientBuilder builder() {
        return new LlmClientBuilder();
    }

    public Mono<ChatResponse> chat(String handle, ChatRequest request) {
        return Mono.defer(() -> provider(handle).chat(request));
    }

    public Flux<ChatChunk> streamChat(String handle, ChatRequest request) {
        return Flux.defer(() -> provider(handle).streamChat(request));
    }

    /**
     * @param deadline overall budget; {@code null} for none
     */
    public Mono<ChatResponse> chatWithRetry(String handle, ChatRequest request, RetryPolicy policy, Duration deadline) {
        return Mono.defer(() -> {
            LlmProvider provider = provider(handle);
            return new RetryExecutor(policy).execute(() -> provider.chat(request), deadline);
        });
    }

    /**
     * Retries opening the stream until its first chunk arrives; later failures surface unchanged.
     */
    public Flux<ChatChunk> streamChatWithRetry(String handle, ChatRequest request, RetryPolicy policy, Duration deadline) {
        return Flux.defer(() -> {
            LlmProvider provider = provider(handle);
            return new RetryExecutor(policy).executeStream(() -> provider.streamChat(request), deadline);
        });
    }

    public CapabilityDescriptor capabilities(String handle) {
        return provider(handle).capabilities();
    }

    public List<String> handles() {
        return List.copyOf(providers.keySet());
    }

    public List<String> handlesSupportingTools() {
        return handlesMatching(CapabilityDescriptor::tools);
    }

    public List<String> handlesSupportingStream() {
        return handlesMatching(CapabilityDescriptor::stream);
    }

    private List<String> handlesMatching(Predicate<CapabilityDescriptor> predicate) {
        return providers.entrySet().stream()
                .filter(entry -> predicate.test(entry.getValue().capabilities()))
                .map(Map.Entry::getKey)
                .toList();
    }

    private LlmProvider provider(String handle) {
        LlmProvider provider = providers.get(handle);
        if (provider == null) {
            throw new HandleNotFoundException(handle);
        }
        return provider;
    }
}
