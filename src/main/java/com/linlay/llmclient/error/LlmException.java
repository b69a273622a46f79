package com.linlay.llmclient.error;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * 统一的 LLM 调用异常，按 {@link LlmErrorKind} 分类，调用方据此决定重试、降级或直接报错。
 */
public class LlmException extends RuntimeException {

    private final LlmErrorKind kind;
    private final String detail;
    private final String provider;
    private final String subject;
    private final Duration retryAfter;
    private final String rawDetail;

    protected LlmException(
            LlmErrorKind kind,
            String detail,
            String provider,
            String subject,
            Duration retryAfter,
            String rawDetail,
            Throwable cause
    ) {
        super(formatMessage(kind, detail, provider, subject), cause);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.detail = detail;
        this.provider = provider;
        this.subject = subject;
        this.retryAfter = retryAfter;
        this.rawDetail = rawDetail;
    }

    public static LlmException transport(String message) {
        return transport(message, null);
    }

    public static LlmException transport(String message, Throwable cause) {
        return new LlmException(LlmErrorKind.TRANSPORT, message, null, null, null, null, cause);
    }

    public static LlmException auth(String message) {
        return new LlmException(LlmErrorKind.AUTH, message, null, null, null, null, null);
    }

    public static LlmException rateLimit(String message, Duration retryAfter) {
        return new LlmException(LlmErrorKind.RATE_LIMIT, message, null, null, retryAfter, null, null);
    }

    public static LlmException validation(String message) {
        return new LlmException(LlmErrorKind.VALIDATION, message, null, null, null, null, null);
    }

    public static LlmException unsupportedFeature(String feature) {
        return new LlmException(LlmErrorKind.UNSUPPORTED_FEATURE, null, null, feature, null, null, null);
    }

    public static LlmException provider(String provider, String message) {
        return provider(provider, message, null, null);
    }

    public static LlmException provider(String provider, String message, String rawDetail, Throwable cause) {
        return new LlmException(LlmErrorKind.PROVIDER, message, provider, null, null, rawDetail, cause);
    }

    public static LlmException tokenLimitExceeded(String message) {
        return new LlmException(LlmErrorKind.TOKEN_LIMIT_EXCEEDED, message, null, null, null, null, null);
    }

    public static LlmException modelNotFound(String model, String message) {
        return new LlmException(LlmErrorKind.MODEL_NOT_FOUND, message, null, model, null, null, null);
    }

    public static LlmException streamClosed(String message) {
        return new LlmException(LlmErrorKind.STREAM_CLOSED, message, null, null, null, null, null);
    }

    public static LlmException invalidConfig(String field, String reason) {
        return invalidConfig(field, reason, null);
    }

    public static LlmException invalidConfig(String field, String reason, Throwable cause) {
        return new LlmException(LlmErrorKind.INVALID_CONFIG, reason, null, field, null, null, cause);
    }

    public static LlmException aborted(String message) {
        return aborted(message, null);
    }

    public static LlmException aborted(String message, Throwable cause) {
        return new LlmException(LlmErrorKind.ABORTED, message, null, null, null, null, cause);
    }

    public static LlmException notImplemented(String feature) {
        return new LlmException(LlmErrorKind.NOT_IMPLEMENTED, null, null, feature, null, null, null);
    }

    public static LlmException unknown(String message, Throwable cause) {
        return new LlmException(LlmErrorKind.UNKNOWN, message, null, null, null, null, cause);
    }

    public LlmErrorKind kind() {
        return kind;
    }

    public boolean isTransient() {
        return kind.isTransient();
    }

    /**
     * The message without the kind prefix.
     */
    public String detail() {
        return detail;
    }

    public String provider() {
        return provider;
    }

    /**
     * Feature name for UNSUPPORTED_FEATURE / NOT_IMPLEMENTED.
     */
    public String feature() {
        return kind == LlmErrorKind.UNSUPPORTED_FEATURE || kind == LlmErrorKind.NOT_IMPLEMENTED ? subject : null;
    }

    public Optional<String> model() {
        return kind == LlmErrorKind.MODEL_NOT_FOUND ? Optional.ofNullable(subject) : Optional.empty();
    }

    /**
     * Configuration field for INVALID_CONFIG.
     */
    public String field() {
        return kind == LlmErrorKind.INVALID_CONFIG ? subject : null;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public String rawDetail() {
        return rawDetail;
    }

    private static String formatMessage(LlmErrorKind kind, String detail, String provider, String subject) {
        return switch (kind) {
            case UNSUPPORTED_FEATURE, NOT_IMPLEMENTED -> kind.label() + ": " + subject;
            case PROVIDER -> "provider " + (provider == null ? "unknown" : provider) + " error: " + detail;
            case INVALID_CONFIG -> "invalid configuration for " + subject + ": " + detail;
            default -> kind.label() + ": " + detail;
        };
    }
}
