package com.linlay.llmclient.logging;

import org.springframework.http.HttpHeaders;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 日志脱敏：认证头、JSON 中的密钥字段、Bearer token 以及 URL 中的 key 参数。
 */
public final class LlmLogSanitizer {

    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HEADERS = Set.of(
            "authorization",
            "proxy-authorization",
            "x-api-key",
            "api-key",
            "x-goog-api-key",
            "x-access-token",
            "access-token"
    );
    private static final Pattern JSON_SECRET_VALUE_PATTERN = Pattern.compile(
            "(?i)(\"(?:authorization|api[_-]?key|access[_-]?token|refresh[_-]?token|token|secret|password)\"\\s*:\\s*)\"([^\"]*)\""
    );
    private static final Pattern BEARER_TOKEN_PATTERN = Pattern.compile("(?i)(Bearer\\s+)[A-Za-z0-9._\\-+/=]+");
    private static final Pattern URL_KEY_PARAM_PATTERN = Pattern.compile("(?i)([?&](?:key|api[_-]?key|access[_-]?token)=)[^&#]*");

    private LlmLogSanitizer() {
    }

    public static boolean isSensitiveHeader(String name) {
        return name != null && SENSITIVE_HEADERS.contains(name.toLowerCase(Locale.ROOT));
    }

    public static HttpHeaders maskHeaders(HttpHeaders headers, boolean maskSensitive) {
        HttpHeaders safeHeaders = new HttpHeaders();
        if (headers == null) {
            return safeHeaders;
        }
        safeHeaders.putAll(headers);
        if (!maskSensitive) {
            return safeHeaders;
        }
        for (String name : headers.keySet()) {
            if (isSensitiveHeader(name)) {
                safeHeaders.set(name, MASK);
            }
        }
        return safeHeaders;
    }

    /**
     * Plain header maps, as adapters build them before the transport call.
     */
    public static Map<String, String> maskHeaders(Map<String, String> headers, boolean maskSensitive) {
        Map<String, String> safeHeaders = new LinkedHashMap<>();
        if (headers == null) {
            return safeHeaders;
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            boolean sensitive = maskSensitive && isSensitiveHeader(entry.getKey());
            safeHeaders.put(entry.getKey(), sensitive ? MASK : entry.getValue());
        }
        return safeHeaders;
    }

    public static String maskUrl(String url, boolean maskSensitive) {
        if (url == null || !maskSensitive) {
            return url;
        }
        return URL_KEY_PARAM_PATTERN.matcher(url).replaceAll("$1" + MASK);
    }

    public static String maskText(String text, boolean maskSensitive) {
        if (text == null || text.isEmpty() || !maskSensitive) {
            return text == null ? "" : text;
        }
        String masked = JSON_SECRET_VALUE_PATTERN.matcher(text).replaceAll("$1\"" + MASK + "\"");
        return BEARER_TOKEN_PATTERN.matcher(masked).replaceAll("$1" + MASK);
    }
}
