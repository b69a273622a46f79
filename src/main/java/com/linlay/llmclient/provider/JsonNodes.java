package com.linlay.llmclient.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Null-tolerant readers for vendor payloads.
 */
public final class JsonNodes {

    private JsonNodes() {
    }

    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    public static String optionalText(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
    }

    public static Integer optionalInt(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isInt() || node.isLong()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    public static Long optionalLong(JsonNode node) {
        if (isAbsent(node) || !node.isNumber()) {
            return null;
        }
        return node.asLong();
    }

    public static boolean hasText(String text) {
        return text != null && !text.isBlank();
    }
}
