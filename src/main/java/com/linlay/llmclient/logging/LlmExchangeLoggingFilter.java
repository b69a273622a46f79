package com.linlay.llmclient.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import reactor.core.publisher.Mono;

/**
 * WebClient 过滤器：在 debug 级别记录每次供应商 HTTP 交换的方法、URL、状态码与（脱敏后的）头部。
 */
public class LlmExchangeLoggingFilter implements ExchangeFilterFunction {

    private static final Logger log = LoggerFactory.getLogger(LlmExchangeLoggingFilter.class);

    private final boolean maskSensitive;

    public LlmExchangeLoggingFilter(boolean maskSensitive) {
        this.maskSensitive = maskSensitive;
    }

    @Override
    public Mono<ClientResponse> filter(ClientRequest request, ExchangeFunction next) {
        if (!log.isDebugEnabled()) {
            return next.exchange(request);
        }
        String target = request.method() + " " + LlmLogSanitizer.maskUrl(request.url().toString(), maskSensitive);
        log.debug("[llm-http] -> {} headers={}", target, LlmLogSanitizer.maskHeaders(request.headers(), maskSensitive));
        long startNanos = System.nanoTime();
        return next.exchange(request)
                .doOnNext(response -> log.debug("[llm-http] <- {} status={} in {} ms headers={}",
                        target,
                        response.statusCode().value(),
                        (System.nanoTime() - startNanos) / 1_000_000,
                        LlmLogSanitizer.maskHeaders(response.headers().asHttpHeaders(), maskSensitive)));
    }
}
