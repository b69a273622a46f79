package com.linlay.llmclient.validation;

import com.linlay.llmclient.error.LlmException;
import com.linlay.llmclient.model.CapabilityDescriptor;
import com.linlay.llmclient.model.ChatRequest;
import com.linlay.llmclient.model.ContentPart;
import com.linlay.llmclient.model.Message;
import com.linlay.llmclient.model.ResponseFormat;
import com.linlay.llmclient.model.Role;

import java.util.List;

/**
 * 跨 provider 共享的请求校验，保证同一种违规在所有 provider 上给出相同的错误类型与措辞。
 */
public final class RequestValidators {

    private RequestValidators() {
    }

    public static void requireConversationMessage(ChatRequest request, String providerLabel) {
        boolean hasConversation = request.messages().stream()
                .anyMatch(message -> message.role().isConversational());
        if (!hasConversation) {
            throw LlmException.validation(providerLabel + " request requires at least one user/assistant message");
        }
    }

    /**
     * Returns the single tool result carried by a tool-role message.
     */
    public static ContentPart.ToolResult requireSingleToolResult(Message message) {
        List<ContentPart> content = message.content();
        if (message.role() != Role.TOOL
                || content.size() != 1
                || !(content.get(0) instanceof ContentPart.ToolResult result)) {
            throw LlmException.validation("tool role expects a single ToolResult content");
        }
        return result;
    }

    public static String requireToolCallId(ContentPart.ToolResult result) {
        if (result.callId() == null || result.callId().isBlank()) {
            throw LlmException.validation("tool message missing call_id");
        }
        return result.callId();
    }

    public static void requireNonEmptyContent(Message message) {
        if (message.content().isEmpty()) {
            throw LlmException.validation("message must contain at least one content part");
        }
    }

    public static String requireModel(ChatRequest request, String defaultModel, String providerLabel) {
        String model = request.options().model();
        if (model != null && !model.isBlank()) {
            return model;
        }
        if (defaultModel != null && !defaultModel.isBlank()) {
            return defaultModel;
        }
        throw LlmException.validation("model is required for " + providerLabel);
    }

    public static int requireMaxOutputTokens(ChatRequest request, String providerLabel, String wireName) {
        Integer maxOutputTokens = request.options().maxOutputTokens();
        if (maxOutputTokens == null) {
            throw LlmException.validation(
                    providerLabel + " requires ChatOptions.maxOutputTokens (mapped to " + wireName + ")");
        }
        if (maxOutputTokens <= 0) {
            throw LlmException.validation("maxOutputTokens must be positive");
        }
        return maxOutputTokens;
    }

    /**
     * Rejects request features the adapter declared it does not support.
     */
    public static void requireCapabilities(ChatRequest request, CapabilityDescriptor capabilities) {
        if (!request.tools().isEmpty() && !capabilities.tools()) {
            throw LlmException.unsupportedFeature("tools");
        }
        if (Boolean.TRUE.equals(request.options().parallelToolCalls()) && !capabilities.parallelToolCalls()) {
            throw LlmException.unsupportedFeature("parallel_tool_calls");
        }
        if (request.responseFormat() instanceof ResponseFormat.JsonSchema && !capabilities.structuredOutput()) {
            throw LlmException.unsupportedFeature("structured_output");
        }
        for (Message message : request.messages()) {
            for (ContentPart part : message.content()) {
                if (part instanceof ContentPart.Image && !capabilities.imageInput()) {
                    throw LlmException.unsupportedFeature("image_input");
                }
                if (part instanceof ContentPart.Audio && !capabilities.audioInput()) {
                    throw LlmException.unsupportedFeature("audio_input");
                }
                if (part instanceof ContentPart.Video && !capabilities.videoInput()) {
                    throw LlmException.unsupportedFeature("video_input");
                }
            }
        }
    }

    public static LlmException unsupported(String feature) {
        return LlmException.unsupportedFeature(feature);
    }
}
