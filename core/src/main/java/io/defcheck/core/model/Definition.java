package io.defcheck.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named schema entry: an object's properties, an enumeration's allowed values,
 * or both when the source document declares both.
 *
 * <p>
 * Thread-safe and immutable. Property order follows the source document.
 *
 * @param name       fully-qualified dotted name, e.g. {@code Namespace.Standard.TradeItem}
 * @param properties declared properties by name
 * @param enumValues allowed values in schema order (empty when not an enum)
 */
public record Definition(String name, Map<String, PropertySpec> properties, List<JsonNode> enumValues) {

    public Definition {
        Objects.requireNonNull(name, "name must not be null");
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        enumValues = List.copyOf(enumValues);
    }

    /** The final dot-separated segment of the name. */
    public String shortName() {
        return shortNameOf(name);
    }

    /** Returns {@code true} if this definition declares a non-empty enumeration. */
    public boolean isEnum() {
        return !enumValues.isEmpty();
    }

    /** Returns the declaration of the given property, or null if undeclared. */
    public PropertySpec property(String propertyName) {
        return properties.get(propertyName);
    }

    /** Returns the substring after the last {@code .} of a dotted name. */
    public static String shortNameOf(String dottedName) {
        return dottedName.substring(dottedName.lastIndexOf('.') + 1);
    }
}
