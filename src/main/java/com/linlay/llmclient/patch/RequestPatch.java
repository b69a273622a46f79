package com.linlay.llmclient.patch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.llmclient.error.LlmException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 运行时请求覆盖：url 替换、body 深度合并、header 设置/删除、按路径删除字段。
 * <p>
 * header 值为 {@code null} 表示删除该 header。
 */
public record RequestPatch(
        String url,
        ObjectNode body,
        Map<String, String> headers,
        List<String> removeFields
) {

    public RequestPatch {
        body = body == null ? null : body.deepCopy();
        headers = headers == null || headers.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        removeFields = removeFields == null ? List.of() : List.copyOf(removeFields);
    }

    public static RequestPatch empty() {
        return new RequestPatch(null, null, null, null);
    }

    public boolean isEmpty() {
        return (url == null || url.isBlank()) && body == null && headers.isEmpty() && removeFields.isEmpty();
    }

    /**
     * Parses every removal path and checks the body fragment depth.
     *
     * @throws LlmException INVALID_CONFIG when a path is malformed or the fragment nests too deeply
     */
    public List<FieldPath> validate() {
        if (url != null && url.isBlank()) {
            throw LlmException.invalidConfig("patch.url", "url override must not be blank");
        }
        for (String name : headers.keySet()) {
            if (name == null || name.isBlank()) {
                throw LlmException.invalidConfig("patch.headers", "header name must not be blank");
            }
        }
        if (body != null && depthOf(body) > RequestPatchEngine.MAX_DEPTH) {
            throw LlmException.invalidConfig("patch.body", "body fragment nests deeper than " + RequestPatchEngine.MAX_DEPTH);
        }
        List<FieldPath> paths = new ArrayList<>(removeFields.size());
        for (String raw : removeFields) {
            paths.add(FieldPath.parse(raw));
        }
        return paths;
    }

    private static int depthOf(JsonNode node) {
        if (!node.isContainerNode()) {
            return 0;
        }
        int max = 0;
        Iterator<JsonNode> elements = node.elements();
        while (elements.hasNext()) {
            max = Math.max(max, depthOf(elements.next()));
            if (max > RequestPatchEngine.MAX_DEPTH) {
                break;
            }
        }
        return max + 1;
    }
}
