package com.linlay.llmclient.patch;

import com.linlay.llmclient.error.LlmException;

import java.util.ArrayList;
import java.util.List;

/**
 * Dot-delimited path into a JSON body, e.g. {@code messages.0.name}. Numeric segments
 * address array elements when the parent is an array and object keys otherwise.
 */
public record FieldPath(String raw, List<Segment> segments) {

    public FieldPath {
        segments = List.copyOf(segments);
    }

    public static FieldPath parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw LlmException.invalidConfig("patch.remove_fields", "removal path must not be blank");
        }
        String[] parts = raw.split("\\.", -1);
        List<Segment> segments = new ArrayList<>(parts.length);
        for (String part : parts) {
            if (part.isEmpty()) {
                throw LlmException.invalidConfig("patch.remove_fields", "empty segment in removal path '" + raw + "'");
            }
            if (part.startsWith("-") && isDigits(part.substring(1))) {
                throw LlmException.invalidConfig("patch.remove_fields", "negative index in removal path '" + raw + "'");
            }
            segments.add(new Segment(part, isDigits(part) ? parseIndex(raw, part) : null));
        }
        if (segments.size() > RequestPatchEngine.MAX_DEPTH) {
            throw LlmException.invalidConfig("patch.remove_fields", "removal path '" + raw + "' is too deep");
        }
        return new FieldPath(raw, segments);
    }

    public Segment last() {
        return segments.get(segments.size() - 1);
    }

    public List<Segment> parent() {
        return segments.subList(0, segments.size() - 1);
    }

    /**
     * Key identifying the container the last segment points into.
     */
    String parentKey() {
        StringBuilder builder = new StringBuilder();
        for (Segment segment : parent()) {
            builder.append(segment.name()).append('.');
        }
        return builder.toString();
    }

    private static boolean isDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static Integer parseIndex(String raw, String part) {
        try {
            return Integer.parseInt(part);
        } catch (NumberFormatException ex) {
            throw LlmException.invalidConfig("patch.remove_fields", "index out of range in removal path '" + raw + "'", ex);
        }
    }

    public record Segment(String name, Integer index) {

        public boolean isIndex() {
            return index != null;
        }
    }
}
