package com.linlay.llmclient.patch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.llmclient.error.LlmErrorKind;
import com.linlay.llmclient.error.LlmException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestPatchEngineTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ObjectNode json(String text) throws Exception {
        return (ObjectNode) objectMapper.readTree(text);
    }

    @Test
    void shouldDeepMergeNestedObjects() throws Exception {
        JsonNode merged = RequestPatchEngine.deepMerge(
                json("{\"a\":{\"x\":1,\"y\":2}}"),
                json("{\"a\":{\"y\":9,\"z\":3}}"));

        assertThat(merged).isEqualTo(json("{\"a\":{\"x\":1,\"y\":9,\"z\":3}}"));
    }

    @Test
    void shouldReplaceArraysWholesale() throws Exception {
        JsonNode merged = RequestPatchEngine.deepMerge(
                json("{\"stop\":[\"a\",\"b\"],\"n\":{\"k\":1}}"),
                json("{\"stop\":[\"c\"],\"n\":5}"));

        assertThat(merged).isEqualTo(json("{\"stop\":[\"c\"],\"n\":5}"));
    }

    @Test
    void shouldApplyUrlBodyHeadersAndRemovalsWithoutMutatingInputs() throws Exception {
        ObjectNode body = json("{\"temperature\":0.2,\"unsafe_field\":true}");
        Map<String, String> headers = Map.of("X-Dbg", "1");
        Map<String, String> patchHeaders = new HashMap<>();
        patchHeaders.put("X-Dbg", null);
        RequestPatch patch = new RequestPatch("https://proxy/x", json("{\"temperature\":0.5}"), patchHeaders,
                List.of("unsafe_field"));

        PatchedRequest patched = RequestPatchEngine.apply(body, headers, "https://api/y", patch);

        assertThat(patched.url()).isEqualTo("https://proxy/x");
        assertThat(patched.body()).isEqualTo(json("{\"temperature\":0.5}"));
        assertThat(patched.headers()).isEmpty();
        assertThat(body).isEqualTo(json("{\"temperature\":0.2,\"unsafe_field\":true}"));
        assertThat(headers).containsEntry("X-Dbg", "1");
    }

    @Test
    void shouldMatchHeaderNamesCaseInsensitively() {
        RequestPatch patch = new RequestPatch(null, null, Map.of("authorization", "Bearer other"), null);

        PatchedRequest patched = RequestPatchEngine.apply(objectMapper.createObjectNode(),
                Map.of("Authorization", "Bearer key", "Accept", "application/json"), "u", patch);

        assertThat(patched.headers())
                .containsEntry("authorization", "Bearer other")
                .containsEntry("Accept", "application/json")
                .doesNotContainKey("Authorization");
    }

    @Test
    void shouldRemoveArrayElementByIndex() throws Exception {
        RequestPatch patch = new RequestPatch(null, null, null, List.of("a.b.0"));

        PatchedRequest patched = RequestPatchEngine.apply(json("{\"a\":{\"b\":[\"x\",\"y\"]}}"), Map.of(), "u", patch);

        assertThat(patched.body()).isEqualTo(json("{\"a\":{\"b\":[\"y\"]}}"));
    }

    @Test
    void shouldApplySameArrayRemovalsInDescendingOrder() throws Exception {
        RequestPatch patch = new RequestPatch(null, null, null, List.of("items.0", "items.2", "other"));

        PatchedRequest patched = RequestPatchEngine.apply(json("{\"items\":[\"a\",\"b\",\"c\",\"d\"],\"other\":1}"),
                Map.of(), "u", patch);

        assertThat(patched.body()).isEqualTo(json("{\"items\":[\"b\",\"d\"]}"));
    }

    @Test
    void shouldIgnoreMissingRemovalPaths() throws Exception {
        RequestPatch patch = new RequestPatch(null, null, null, List.of("missing.deep", "a.b.9", "a.b.x"));

        PatchedRequest patched = RequestPatchEngine.apply(json("{\"a\":{\"b\":[1]}}"), Map.of(), "u", patch);

        assertThat(patched.body()).isEqualTo(json("{\"a\":{\"b\":[1]}}"));
    }

    @Test
    void shouldRemoveNumericObjectKeys() throws Exception {
        RequestPatch patch = new RequestPatch(null, null, null, List.of("codes.404"));

        PatchedRequest patched = RequestPatchEngine.apply(json("{\"codes\":{\"404\":\"gone\",\"500\":\"err\"}}"),
                Map.of(), "u", patch);

        assertThat(patched.body()).isEqualTo(json("{\"codes\":{\"500\":\"err\"}}"));
    }

    @Test
    void shouldRemoveZeroPaddedObjectKeyAsWritten() throws Exception {
        RequestPatch patch = new RequestPatch(null, null, null, List.of("meta.01"));

        PatchedRequest patched = RequestPatchEngine.apply(json("{\"meta\":{\"01\":true,\"1\":false}}"),
                Map.of(), "u", patch);

        assertThat(patched.body()).isEqualTo(json("{\"meta\":{\"1\":false}}"));
    }

    @Test
    void shouldRemoveArrayElementOnceWhenPathsSpellSameIndexDifferently() throws Exception {
        RequestPatch patch = new RequestPatch(null, null, null, List.of("items.01", "items.1"));

        PatchedRequest patched = RequestPatchEngine.apply(json("{\"items\":[\"a\",\"b\",\"c\"]}"),
                Map.of(), "u", patch);

        assertThat(patched.body()).isEqualTo(json("{\"items\":[\"a\",\"c\"]}"));
    }

    @Test
    void shouldRejectMalformedRemovalPaths() {
        for (String path : List.of("", "a..b", ".a", "a.", "a.-1")) {
            RequestPatch patch = new RequestPatch(null, null, null, List.of(path));

            assertThatThrownBy(patch::validate)
                    .as("path '%s'", path)
                    .isInstanceOf(LlmException.class)
                    .satisfies(ex -> assertThat(((LlmException) ex).kind()).isEqualTo(LlmErrorKind.INVALID_CONFIG));
        }
    }

    @Test
    void shouldRejectBodyNestedBeyondDepthLimit() {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode current = root;
        for (int i = 0; i < RequestPatchEngine.MAX_DEPTH + 1; i++) {
            current = current.putObject("n");
        }
        RequestPatch patch = new RequestPatch(null, root, null, null);

        assertThatThrownBy(patch::validate)
                .isInstanceOf(LlmException.class)
                .satisfies(ex -> assertThat(((LlmException) ex).field()).isEqualTo("patch.body"));
    }

    @Test
    void shouldReturnCopiesForEmptyPatch() throws Exception {
        ObjectNode body = json("{\"a\":1}");

        PatchedRequest patched = RequestPatchEngine.apply(body, Map.of("H", "v"), "u", RequestPatch.empty());
        patched.body().put("b", 2);

        assertThat(body).isEqualTo(json("{\"a\":1}"));
        assertThat(patched.url()).isEqualTo("u");
    }
}
