package io.defcheck.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.defcheck.core.model.Issue;
import io.defcheck.core.model.IssueCategory;
import io.defcheck.core.model.PrimitiveType;
import io.defcheck.core.model.PropertySpec;
import java.util.Optional;

/**
 * Compares a field value with the primitive type its property declares.
 *
 * <p>
 * {@code null} values and properties without a primitive type are never
 * checked. Booleans never satisfy {@code integer} or {@code number}.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class TypeChecker {

    private TypeChecker() {
        // utility class
    }

    /**
     * Checks one value.
     *
     * @param value the field value (may be null or a {@code NullNode})
     * @param spec  the property declaration
     * @param path  path of the field, used for the issue
     * @return a {@code TYPE_MISMATCH} issue, or empty if the value conforms
     */
    public static Optional<Issue> check(JsonNode value, PropertySpec spec, String path) {
        if (!JsonNodeUtils.isPresent(value)) {
            return Optional.empty();
        }
        Optional<PrimitiveType> declared = spec.declaredType();
        if (declared.isEmpty()) {
            return Optional.empty();
        }

        PrimitiveType expected = declared.get();
        if (matches(value, expected)) {
            return Optional.empty();
        }
        if (value.isBoolean() && (expected == PrimitiveType.INTEGER || expected == PrimitiveType.NUMBER)) {
            return Optional.of(mismatch(path, expected, "boolean"));
        }
        return Optional.of(mismatch(path, expected, JsonNodeUtils.observedTypeName(value)));
    }

    static boolean matches(JsonNode value, PrimitiveType expected) {
        return switch (expected) {
            case STRING -> value.isTextual();
            case BOOLEAN -> value.isBoolean();
            case INTEGER -> value.isIntegralNumber();
            case NUMBER -> value.isNumber();
            case ARRAY -> value.isArray();
            case OBJECT -> value.isObject();
        };
    }

    private static Issue mismatch(String path, PrimitiveType expected, String actual) {
        return new Issue(IssueCategory.TYPE_MISMATCH, path, "expected " + expected.keyword() + ", got " + actual);
    }
}
