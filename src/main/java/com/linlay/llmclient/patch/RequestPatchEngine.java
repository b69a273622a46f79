package com.linlay.llmclient.patch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 请求覆盖引擎：按 url → body 深度合并 → headers → 字段删除 的固定顺序生成新请求，输入不被修改。
 */
public final class RequestPatchEngine {

    public static final int MAX_DEPTH = 64;

    private RequestPatchEngine() {
    }

    public static PatchedRequest apply(ObjectNode body, Map<String, String> headers, String url, RequestPatch patch) {
        ObjectNode baseBody = body == null ? JsonNodeFactory.instance.objectNode() : body;
        Map<String, String> baseHeaders = headers == null ? Map.of() : headers;
        if (patch == null || patch.isEmpty()) {
            return new PatchedRequest(baseBody.deepCopy(), Collections.unmodifiableMap(new LinkedHashMap<>(baseHeaders)), url);
        }
        List<FieldPath> removals = patch.validate();

        String patchedUrl = patch.url() == null ? url : patch.url();

        ObjectNode patchedBody = patch.body() == null
                ? baseBody.deepCopy()
                : (ObjectNode) deepMerge(baseBody, patch.body());

        Map<String, String> patchedHeaders = applyHeaders(baseHeaders, patch.headers());

        removeFields(patchedBody, removals);
        return new PatchedRequest(patchedBody, Collections.unmodifiableMap(patchedHeaders), patchedUrl);
    }

    /**
     * Returns a new tree: objects merge key by key, anything else is replaced by the patch value.
     */
    public static JsonNode deepMerge(JsonNode base, JsonNode patch) {
        return merge(base, patch, 0);
    }

    private static JsonNode merge(JsonNode base, JsonNode patch, int depth) {
        if (patch == null) {
            return base == null ? null : base.deepCopy();
        }
        if (base == null || !base.isObject() || !patch.isObject() || depth >= MAX_DEPTH) {
            return patch.deepCopy();
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = patch.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = merged.get(field.getKey());
            merged.set(field.getKey(), merge(existing, field.getValue(), depth + 1));
        }
        return merged;
    }

    private static Map<String, String> applyHeaders(Map<String, String> original, Map<String, String> overrides) {
        Map<String, String> result = new LinkedHashMap<>(original);
        for (Map.Entry<String, String> override : overrides.entrySet()) {
            result.keySet().removeIf(name -> name.equalsIgnoreCase(override.getKey()));
            if (override.getValue() != null) {
                result.put(override.getKey(), override.getValue());
            }
        }
        return result;
    }

    /**
     * Index removals that share a parent array run together, highest index first, at the
     * position of the first of them; everything else runs in the given order.
     */
    static void removeFields(ObjectNode body, List<FieldPath> paths) {
        Set<String> groupedParents = new HashSet<>();
        for (FieldPath path : paths) {
            if (!path.last().isIndex()) {
                removeOne(body, path.parent(), path.last());
                continue;
            }
            String parentKey = path.parentKey();
            if (!groupedParents.add(parentKey)) {
                continue;
            }
            List<FieldPath.Segment> targets = new ArrayList<>();
            for (FieldPath candidate : paths) {
                if (candidate.last().isIndex() && candidate.parentKey().equals(parentKey)
                        && !targets.contains(candidate.last())) {
                    targets.add(candidate.last());
                }
            }
            JsonNode container = navigate(body, path.parent());
            if (container instanceof ArrayNode array) {
                List<Integer> indices = targets.stream()
                        .map(FieldPath.Segment::index)
                        .distinct()
                        .sorted(Comparator.reverseOrder())
                        .toList();
                for (Integer index : indices) {
                    if (index < array.size()) {
                        array.remove(index);
                    }
                }
            } else {
                // object parents keep the keys as written: "01" and "1" are different fields
                for (FieldPath.Segment target : targets) {
                    removeAt(container, target);
                }
            }
        }
    }

    private static void removeOne(ObjectNode body, List<FieldPath.Segment> parent, FieldPath.Segment last) {
        removeAt(navigate(body, parent), last);
    }

    private static JsonNode navigate(JsonNode root, List<FieldPath.Segment> segments) {
        JsonNode current = root;
        for (FieldPath.Segment segment : segments) {
            if (current == null) {
                return null;
            }
            if (current.isObject()) {
                current = current.get(segment.name());
            } else if (current.isArray() && segment.isIndex()) {
                current = current.get(segment.index());
            } else {
                return null;
            }
        }
        return current;
    }

    private static void removeAt(JsonNode container, FieldPath.Segment segment) {
        if (container instanceof ObjectNode object) {
            object.remove(segment.name());
        } else if (container instanceof ArrayNode array && segment.isIndex() && segment.index() < array.size()) {
            array.remove(segment.index());
        }
    }
}
