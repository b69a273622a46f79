package com.linlay.llmclient.transport;

import org.springframework.http.HttpHeaders;
import reactor.core.publisher.Flux;

/**
 * Status and headers of an opened stream; {@code body} is read lazily and cancelling it closes the connection.
 */
public record HttpStreamResponse(int status, HttpHeaders headers, Flux<byte[]> body) {

    public HttpStreamResponse {
        headers = headers == null ? new HttpHeaders() : headers;
        body = body == null ? Flux.empty() : body;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
