package com.linlay.llmclient.logging;

import com.linlay.llmclient.model.ChatChunk;
import com.linlay.llmclient.model.ChatEvent;
import org.slf4j.Logger;

import java.util.Map;
import java.util.UUID;

/**
 * LLM 调用日志工具：traceId 生成、请求/增量日志、耗时计算，按配置脱敏。
 */
public class LlmCallLogger {

    private final boolean enabled;
    private final boolean maskSensitive;
    private final int maxBodyChars;

    public LlmCallLogger() {
        this(null);
    }

    public LlmCallLogger(LlmInteractionLogProperties properties) {
        this.enabled = properties == null || properties.isEnabled();
        this.maskSensitive = properties == null || properties.isMaskSensitive();
        this.maxBodyChars = properties == null
                ? LlmInteractionLogProperties.DEFAULT_MAX_BODY_CHARS
                : properties.getMaxBodyChars();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String generateTraceId() {
        return "llm-" + UUID.randomUUID().toString().replace("-", "");
    }

    public long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    public String sanitizeText(String text) {
        return LlmLogSanitizer.maskText(text, maskSensitive);
    }

    public void info(Logger logger, String pattern, Object... arguments) {
        if (enabled) {
            logger.info(pattern, arguments);
        }
    }

    public void debug(Logger logger, String pattern, Object... arguments) {
        if (enabled) {
            logger.debug(pattern, arguments);
        }
    }

    public void logRequest(Logger logger, String traceId, String provider, String url,
                           Map<String, String> headers, String body, boolean stream) {
        if (!enabled) {
            return;
        }
        logger.info("[{}][{}] LLM {} request url={}", traceId, provider, stream ? "stream" : "chat",
                LlmLogSanitizer.maskUrl(url, maskSensitive));
        logger.debug("[{}][{}] LLM request headers={}, body={}", traceId, provider,
                LlmLogSanitizer.maskHeaders(headers, maskSensitive), truncate(sanitizeText(body)));
    }

    public void appendChunkLog(Logger logger, StringBuilder buffer, ChatChunk chunk, String traceId) {
        if (!enabled || chunk == null) {
            return;
        }
        for (ChatEvent event : chunk.events()) {
            if (event instanceof ChatEvent.TextDelta delta) {
                String content = sanitizeText(delta.text());
                buffer.append(content);
                logger.debug("[{}][delta] content: {}", traceId, content);
            } else if (event instanceof ChatEvent.ToolCallDelta call) {
                String arguments = sanitizeText(call.argumentsDelta());
                buffer.append("\n[tool_call] id=").append(call.id() == null ? "" : call.id())
                        .append(", name=").append(call.name() == null ? "" : call.name())
                        .append(", args=").append(arguments);
                logger.debug("[{}][delta] tool_call index={}, id={}, name={}, args={}", traceId,
                        call.index(), call.id(), call.name(), arguments);
            } else if (event instanceof ChatEvent.FinishSignal finish) {
                buffer.append("\n[finish_reason] ").append(finish.rawReason());
                logger.debug("[{}][delta] finish_reason={}", traceId, finish.rawReason());
            } else if (event instanceof ChatEvent.ErrorEvent error) {
                buffer.append("\n[error] ").append(sanitizeText(error.message()));
            }
        }
    }

    private String truncate(String body) {
        if (maxBodyChars <= 0 || body.length() <= maxBodyChars) {
            return body;
        }
        return body.substring(0, maxBodyChars) + "...(" + body.length() + " chars)";
    }
}
