package io.defcheck.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Primitive types a Swagger property may declare through its {@code type} keyword.
 *
 * <ul>
 *   <li>{@link #STRING}: text
 *   <li>{@link #BOOLEAN}: logical value
 *   <li>{@link #INTEGER}: whole number
 *   <li>{@link #NUMBER}: whole or fractional number
 *   <li>{@link #ARRAY}: sequence
 *   <li>{@link #OBJECT}: keyed mapping
 * </ul>
 */
public enum PrimitiveType {
    STRING,
    BOOLEAN,
    INTEGER,
    NUMBER,
    ARRAY,
    OBJECT;

    /** The keyword as written in the schema ({@code "string"}, {@code "integer"}, ...). */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a schema {@code type} keyword to a primitive type. Unrecognised keywords (e.g.
     * {@code "file"}) map to empty so the property is treated as untyped.
     */
    public static Optional<PrimitiveType> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        for (PrimitiveType type : values()) {
            if (type.keyword().equals(keyword)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
