package com.linlay.llmclient.patch;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

public record PatchedRequest(ObjectNode body, Map<String, String> headers, String url) {
}
