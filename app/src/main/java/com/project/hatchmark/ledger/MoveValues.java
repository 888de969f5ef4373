package com.project.hatchmark.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import org.web3j.utils.Numeric;

import java.util.Locale;

/**
 * Readers for Move values as they appear in RPC JSON.
 *
 * <p>Object ids arrive either as a plain string or wrapped as {@code {"id": ...}} or
 * {@code {"bytes": ...}}. Byte vectors arrive either as a hex string or as an array of numbers.
 * u64 values arrive as strings. Every reader throws {@link IllegalArgumentException} on a shape
 * it does not recognise.
 */
public final class MoveValues {

    private MoveValues() {
    }

    public static String objectId(JsonNode node, String field) {
        JsonNode value = node;
        while (value != null && value.isObject()) {
            if (value.has("id")) {
                value = value.get("id");
            } else if (value.has("bytes")) {
                value = value.get("bytes");
            } else {
                break;
            }
        }
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException(field + " is not an object id: " + node);
        }
        return value.asText().toLowerCase(Locale.ROOT);
    }

    /**
     * Hex of a {@code vector<u8>}, lowercase, without prefix.
     */
    public static String bytesHex(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException(field + " is missing");
        }
        if (node.isTextual()) {
            return Numeric.cleanHexPrefix(node.asText()).toLowerCase(Locale.ROOT);
        }
        if (node.isArray()) {
            byte[] bytes = new byte[node.size()];
            for (int i = 0; i < bytes.length; i++) {
                JsonNode element = node.get(i);
                if (!element.canConvertToInt() || element.asInt() < 0 || element.asInt() > 255) {
                    throw new IllegalArgumentException(field + " has a non-byte element: " + element);
                }
                bytes[i] = (byte) element.asInt();
            }
            return Numeric.toHexStringNoPrefix(bytes);
        }
        throw new IllegalArgumentException(field + " is neither hex nor a byte array: " + node);
    }

    public static long u64(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException(field + " is missing");
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(field + " is not a number: " + node, e);
            }
        }
        throw new IllegalArgumentException(field + " is not a number: " + node);
    }

    public static String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException(field + " is missing");
        }
        if (!node.isValueNode()) {
            throw new IllegalArgumentException(field + " is not a string: " + node);
        }
        return node.asText();
    }

    public static String optionalText(JsonNode node) {
        return node == null || node.isNull() ? "" : node.asText();
    }
}
