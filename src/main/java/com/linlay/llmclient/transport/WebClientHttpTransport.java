package com.linlay.llmclient.transport;

import com.linlay.llmclient.error.LlmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.TimeoutException;

/**
 * 基于 Spring WebClient / Reactor Netty 的传输实现。
 */
public class WebClientHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(WebClientHttpTransport.class);

    private final WebClient webClient;

    public WebClientHttpTransport(WebClient.Builder builder) {
        this(builder.build());
    }

    public WebClientHttpTransport(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Mono<HttpResponse> send(HttpRequest request) {
        Mono<HttpResponse> response = webClient.method(request.method())
                .uri(URI.create(request.url()))
                .headers(headers -> request.headers().forEach(headers::set))
                .bodyValue(request.body())
                .exchangeToMono(clientResponse -> clientResponse.bodyToMono(byte[].class)
                        .defaultIfEmpty(new byte[0])
                        .map(body -> new HttpResponse(
                                clientResponse.statusCode().value(),
                                clientResponse.headers().asHttpHeaders(),
                                body)));
        if (request.timeout() != null) {
            response = response.timeout(request.timeout());
        }
        return response.onErrorMap(ex -> !(ex instanceof LlmException), ex -> mapError(request, ex));
    }

    @Override
    public Mono<HttpStreamResponse> sendStream(HttpRequest request) {
        Mono<ResponseEntity<Flux<byte[]>>> entity = webClient.method(request.method())
                .uri(URI.create(request.url()))
                .headers(headers -> request.headers().forEach(headers::set))
                .bodyValue(request.body())
                .retrieve()
                // status handling belongs to the provider's error parser
                .onStatus(status -> true, clientResponse -> Mono.empty())
                .toEntityFlux(byte[].class);
        if (request.timeout() != null) {
            entity = entity.timeout(request.timeout());
        }
        return entity
                .map(responseEntity -> new HttpStreamResponse(
                        responseEntity.getStatusCode().value(),
                        HttpHeaders.readOnlyHttpHeaders(responseEntity.getHeaders()),
                        responseEntity.getBody() == null
                                ? Flux.empty()
                                : responseEntity.getBody()
                                .onErrorMap(ex -> !(ex instanceof LlmException), ex -> mapError(request, ex))))
                .onErrorMap(ex -> !(ex instanceof LlmException), ex -> mapError(request, ex));
    }

    private LlmException mapError(HttpRequest request, Throwable ex) {
        if (isConnectionError(ex)) {
            log.warn("HTTP transport failure url={}: {}", request.url(), ex.getMessage());
            return LlmException.transport(describe(ex), ex);
        }
        return LlmException.unknown("HTTP call failed: " + describe(ex), ex);
    }

    static boolean isConnectionError(Throwable ex) {
        if (ex instanceof IOException || ex instanceof WebClientRequestException || ex instanceof TimeoutException) {
            return true;
        }
        Throwable cause = ex.getCause();
        return cause instanceof IOException || cause instanceof TimeoutException;
    }

    private static String describe(Throwable ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }
}
