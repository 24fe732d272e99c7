package io.defcheck.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of definitions keyed by fully-qualified name, in source order.
 *
 * <p>
 * Loaded once per validation run and shared read-only between all documents
 * (and all worker threads) of that run. The map passed to the constructor is
 * defensively copied.
 */
public final class Schema {

    private final String source;
    private final Map<String, Definition> definitions;

    public Schema(String source, Map<String, Definition> definitions) {
        this.source = source;
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    /** Returns an empty schema (no definitions). */
    public static Schema empty() {
        return new Schema(null, Map.of());
    }

    /** Where the schema was loaded from, or null if unknown. */
    public String source() {
        return source;
    }

    /** Returns the definition with this exact full name, or null. */
    public Definition get(String fullName) {
        return definitions.get(fullName);
    }

    public boolean contains(String fullName) {
        return definitions.containsKey(fullName);
    }

    /** All definitions in source order. */
    public Collection<Definition> definitions() {
        return definitions.values();
    }

    /** Fully-qualified definition names in source order. */
    public Collection<String> names() {
        return definitions.keySet();
    }

    public int size() {
        return definitions.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Schema other)) {
            return false;
        }
        return Objects.equals(source, other.source) && definitions.equals(other.definitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, definitions);
    }

    @Override
    public String toString() {
        return "Schema[source=" + source + ", definitions=" + definitions.size() + "]";
    }
}
