package com.linlay.llmclient.transport;

import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;

public record HttpResponse(int status, HttpHeaders headers, byte[] body) {

    public HttpResponse {
        headers = headers == null ? new HttpHeaders() : headers;
        body = body == null ? new byte[0] : body;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
