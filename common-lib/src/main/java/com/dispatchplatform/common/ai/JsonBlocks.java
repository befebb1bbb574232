package com.dispatchplatform.common.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the structured block out of free-form service output. The service is asked for bare
 * JSON but may wrap it in prose or code fences; the outermost {@code {...}} span is parsed.
 */
public final class JsonBlocks {

    private static final Pattern OBJECT_BLOCK = Pattern.compile("\\{[\\s\\S]*\\}");

    private JsonBlocks() {}

    /** Returns the parsed object, or empty when no block is present or it does not parse. */
    public static Optional<JsonNode> extract(String text, ObjectMapper objectMapper) {
        if (text == null || text.isBlank()) return Optional.empty();
        Matcher matcher = OBJECT_BLOCK.matcher(text);
        if (!matcher.find()) return Optional.empty();
        try {
            JsonNode node = objectMapper.readTree(matcher.group());
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    /** Text of {@code field}, or {@code null} when missing, null or blank. */
    public static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) return null;
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
