package com.clapgrow.channels.whatsapp.ingress.extract;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Null-safe reads of nested fields from untyped gateway payloads.
 */
public final class JsonFields {

    private JsonFields() {
    }

    public static JsonNode at(JsonNode node, String... path) {
        JsonNode current = node;
        for (String field : path) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(field);
        }
        return current;
    }

    /**
     * A non-blank string at {@code path}. Numbers are rendered as text.
     */
    public static Optional<String> text(JsonNode node, String... path) {
        JsonNode value = at(node, path);
        if (value == null || !(value.isTextual() || value.isNumber())) {
            return Optional.empty();
        }
        String text = value.asText();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    public static Optional<Boolean> bool(JsonNode node, String... path) {
        JsonNode value = at(node, path);
        if (value == null) {
            return Optional.empty();
        }
        if (value.isBoolean()) {
            return Optional.of(value.booleanValue());
        }
        if (value.isTextual() && ("true".equalsIgnoreCase(value.asText()) || "false".equalsIgnoreCase(value.asText()))) {
            return Optional.of(Boolean.parseBoolean(value.asText()));
        }
        return Optional.empty();
    }

    /**
     * A number at {@code path}, also accepted as numeric text or as a protobuf {@code {low, high}} long.
     */
    public static Optional<Long> number(JsonNode node, String... path) {
        JsonNode value = at(node, path);
        if (value == null) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(value.longValue());
        }
        if (value.isTextual()) {
            try {
                return Optional.of(Long.parseLong(value.asText().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        if (value.isObject() && value.has("low")) {
            long low = value.get("low").asLong() & 0xFFFFFFFFL;
            long high = value.has("high") ? value.get("high").asLong() : 0L;
            return Optional.of((high << 32) | low);
        }
        return Optional.empty();
    }
}
