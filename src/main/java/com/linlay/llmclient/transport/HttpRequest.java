package com.linlay.llmclient.transport;

import org.springframework.http.HttpMethod;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record HttpRequest(
        HttpMethod method,
        String url,
        Map<String, String> headers,
        byte[] body,
        Duration timeout
) {

    public HttpRequest {
        method = method == null ? HttpMethod.POST : method;
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? new byte[0] : body;
    }

    public static HttpRequest postJson(String url, Map<String, String> headers, String json, Duration timeout) {
        Map<String, String> merged = new LinkedHashMap<>(headers == null ? Map.of() : headers);
        if (merged.keySet().stream().noneMatch("Content-Type"::equalsIgnoreCase)) {
            merged.put("Content-Type", "application/json");
        }
        return new HttpRequest(HttpMethod.POST, url, merged, json.getBytes(StandardCharsets.UTF_8), timeout);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
