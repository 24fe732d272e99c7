package io.defcheck.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Shared JSON node helpers for the type and enum checks.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class JsonNodeUtils {

    /** Number of allowed values shown in an enum message before the ellipsis. */
    static final int MAX_DISPLAYED_ENUM_VALUES = 6;

    private JsonNodeUtils() {
        // utility class
    }

    /**
     * Returns {@code true} if the node carries a value.
     *
     * <ul>
     * <li>Java {@code null}, {@code MissingNode} → absent</li>
     * <li>{@code NullNode} → absent (JSON {@code null} marks an optional field)</li>
     * <li>Anything else → present</li>
     * </ul>
     */
    public static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode();
    }

    /**
     * JSON type name of a value, as used in {@code TYPE_MISMATCH} messages:
     * {@code string}, {@code boolean}, {@code integer}, {@code number},
     * {@code array}, {@code object} or {@code null}.
     */
    public static String observedTypeName(JsonNode node) {
        if (!isPresent(node)) {
            return "null";
        }
        if (node.isTextual()) {
            return "string";
        }
        if (node.isBoolean()) {
            return "boolean";
        }
        if (node.isIntegralNumber()) {
            return "integer";
        }
        if (node.isNumber()) {
            return "number";
        }
        if (node.isArray()) {
            return "array";
        }
        if (node.isObject()) {
            return "object";
        }
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    /**
     * Enum membership. Numbers compare by numeric value ({@code 5} equals
     * {@code 5.0}); everything else by JSON equality.
     */
    public static boolean enumContains(List<JsonNode> allowed, JsonNode value) {
        for (JsonNode candidate : allowed) {
            if (value.isNumber() && candidate.isNumber()) {
                if (value.decimalValue().compareTo(candidate.decimalValue()) == 0) {
                    return true;
                }
            } else if (candidate.equals(value)) {
                return true;
            }
        }
        return false;
    }

    /** Text shown for a value in messages: raw text for strings, compact JSON otherwise. */
    public static String display(JsonNode node) {
        return node.isTextual() ? node.asText() : node.toString();
    }

    /**
     * Formats the first {@value #MAX_DISPLAYED_ENUM_VALUES} allowed values as
     * {@code ['A', 'B']}, followed by {@code ...} when more exist.
     */
    public static String formatAllowed(List<JsonNode> allowed) {
        String shown = allowed.stream()
                .limit(MAX_DISPLAYED_ENUM_VALUES)
                .map(v -> v.isTextual() ? "'" + v.asText() + "'" : v.toString())
                .collect(Collectors.joining(", ", "[", "]"));
        return allowed.size() > MAX_DISPLAYED_ENUM_VALUES ? shown + "..." : shown;
    }

    /** Message of an {@code INVALID_ENUM} issue. */
    static String invalidEnumMessage(JsonNode value, List<JsonNode> allowed) {
        return "'" + display(value) + "' not in " + formatAllowed(allowed);
    }
}
