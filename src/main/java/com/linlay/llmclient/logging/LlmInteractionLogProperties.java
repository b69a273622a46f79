package com.linlay.llmclient.logging;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code llm.logging.*}：供应商调用日志开关、脱敏以及请求体日志长度上限。
 */
@ConfigurationProperties(prefix = "llm.logging")
public class LlmInteractionLogProperties {

    public static final int DEFAULT_MAX_BODY_CHARS = 4096;

    /**
     * Logs request lines, stream summaries and timings for every provider call.
     */
    private boolean enabled = true;
    /**
     * Masks credentials in headers, bodies and URLs. Raw wiretap logging only runs when this is off.
     */
    private boolean maskSensitive = true;
    /**
     * Request bodies longer than this are cut in debug logs; {@code 0} or less logs them whole.
     */
    private int maxBodyChars = DEFAULT_MAX_BODY_CHARS;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isMaskSensitive() {
        return maskSensitive;
    }

    public void setMaskSensitive(boolean maskSensitive) {
        this.maskSensitive = maskSensitive;
    }

    public int getMaxBodyChars() {
        return maxBodyChars;
    }

    public void setMaxBodyChars(int maxBodyChars) {
        this.maxBodyChars = maxBodyChars;
    }
}
