package com.linlay.llmclient.provider.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.llmclient.error.ErrorClassifier;
import com.linlay.llmclient.error.LlmException;

import java.time.Duration;

import static com.linlay.llmclient.provider.JsonNodes.isAbsent;
import static com.linlay.llmclient.provider.JsonNodes.optionalText;

/**
 * Parses {@code {"error": {"message", "type", "code"}}} bodies; anything else falls back to the raw body.
 */
public class OpenAiErrorParser {

    private final ObjectMapper objectMapper;
    private final String provider;

    public OpenAiErrorParser(ObjectMapper objectMapper, String provider) {
        this.objectMapper = objectMapper;
        this.provider = provider;
    }

    public LlmException parse(int status, String rawBody, Duration retryAfter) {
        JsonNode error = readErrorNode(rawBody);
        if (isAbsent(error) || !error.isObject()) {
            return ErrorClassifier.unparsed(provider, status, rawBody, retryAfter);
        }
        return ErrorClassifier.classify(provider, status,
                optionalText(error.get("message")),
                optionalText(error.get("code")),
                retryAfter,
                rawBody);
    }

    private JsonNode readErrorNode(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(rawBody).get("error");
        } catch (JsonProcessingException ex) {
            return null;
        }
    }
}
