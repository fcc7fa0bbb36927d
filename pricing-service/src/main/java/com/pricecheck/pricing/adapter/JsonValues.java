package com.pricecheck.pricing.adapter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Lenient readers for the loosely-typed fields found in source responses: numbers sometimes
 * arrive as strings and optional fields as {@code null}.
 */
final class JsonValues {

    private JsonValues() {}

    /**
     * @return the first field that holds a finite, non-negative number
     */
    static Optional<Double> firstPrice(JsonNode node, String... fields) {
        for (String field : fields) {
            Optional<Double> value = number(node.path(field));
            if (value.isPresent() && value.get() >= 0.0) {
                return value;
            }
        }
        return Optional.empty();
    }

    static int firstCount(JsonNode node, String... fields) {
        for (String field : fields) {
            Optional<Double> value = number(node.path(field));
            if (value.isPresent()) {
                return (int) Math.max(0, Math.min(Integer.MAX_VALUE, value.get()));
            }
        }
        return 0;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }

    private static Optional<Double> number(JsonNode value) {
        double parsed;
        if (value.isNumber()) {
            parsed = value.asDouble();
        } else if (value.isTextual()) {
            try {
                parsed = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return Double.isFinite(parsed) ? Optional.of(parsed) : Optional.empty();
    }
}
