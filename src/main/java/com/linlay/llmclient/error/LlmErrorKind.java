package com.linlay.llmclient.error;

public enum LlmErrorKind {
    TRANSPORT("transport error"),
    AUTH("auth failure"),
    RATE_LIMIT("rate limited"),
    VALIDATION("invalid request"),
    UNSUPPORTED_FEATURE("feature unsupported"),
    PROVIDER("provider error"),
    TOKEN_LIMIT_EXCEEDED("token limit exceeded"),
    MODEL_NOT_FOUND("model not found"),
    STREAM_CLOSED("stream closed unexpectedly"),
    INVALID_CONFIG("invalid configuration"),
    ABORTED("request aborted"),
    NOT_IMPLEMENTED("not implemented"),
    UNKNOWN("unknown error");

    private final String label;

    LlmErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Only throttling and network failures are worth re-issuing a call for.
     */
    public boolean isTransient() {
        return this == RATE_LIMIT || this == TRANSPORT;
    }
}
