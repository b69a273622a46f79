package com.linlay.llmclient.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 鉴权信息。ServiceAccount 与 None 默认被所有 provider 拒绝，除非 provider 显式支持。
 */
public sealed interface Credential {

    static Credential apiKey(String key) {
        return new ApiKey(null, key);
    }

    static Credential bearer(String token) {
        return new Bearer(token);
    }

    static Credential none() {
        return new None();
    }

    record ApiKey(String header, String key) implements Credential {
        @Override
        public String toString() {
            return "ApiKey[header=" + header + ", key=***]";
        }
    }

    record Bearer(String token) implements Credential {
        @Override
        public String toString() {
            return "Bearer[token=***]";
        }
    }

    record ServiceAccount(JsonNode json) implements Credential {
        @Override
        public String toString() {
            return "ServiceAccount[json=***]";
        }
    }

    record None() implements Credential {
    }
}
