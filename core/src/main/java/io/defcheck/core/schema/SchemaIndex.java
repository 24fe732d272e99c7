package io.defcheck.core.schema;

import io.defcheck.core.model.Definition;
import io.defcheck.core.model.Schema;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Short-name lookup over a {@link Schema}.
 *
 * <p>
 * When several definitions share a short name, the one whose full name contains
 * the preferred namespace marker wins regardless of order; among equally
 * preferred candidates the first one seen is kept.
 *
 * <p>
 * Thread-safe: built once, read-only afterwards.
 */
public final class SchemaIndex {

    /** Namespace marker of GS1 standard entities. */
    public static final String DEFAULT_PREFERRED_MARKER = "Standard";

    private final Map<String, String> fullNameByShortName;
    private final String preferredMarker;

    private SchemaIndex(Map<String, String> fullNameByShortName, String preferredMarker) {
        this.fullNameByShortName = Collections.unmodifiableMap(fullNameByShortName);
        this.preferredMarker = preferredMarker;
    }

    /** Builds an index preferring {@value #DEFAULT_PREFERRED_MARKER} definitions. */
    public static SchemaIndex build(Schema schema) {
        return build(schema, DEFAULT_PREFERRED_MARKER);
    }

    /**
     * Builds an index over all definitions of the schema.
     *
     * @param schema          the schema to index
     * @param preferredMarker substring marking preferred full names
     * @return the index, empty for an empty schema
     */
    public static SchemaIndex build(Schema schema, String preferredMarker) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(preferredMarker, "preferredMarker must not be null");

        Map<String, String> index = new LinkedHashMap<>();
        for (String fullName : schema.names()) {
            String shortName = Definition.shortNameOf(fullName);
            String existing = index.get(shortName);
            if (existing == null || (!existing.contains(preferredMarker) && fullName.contains(preferredMarker))) {
                index.put(shortName, fullName);
            }
        }
        return new SchemaIndex(index, preferredMarker);
    }

    /** Returns the full name indexed under this short name, or null. */
    public String lookup(String shortName) {
        return fullNameByShortName.get(shortName);
    }

    public String preferredMarker() {
        return preferredMarker;
    }

    public int size() {
        return fullNameByShortName.size();
    }

    public boolean isEmpty() {
        return fullNameByShortName.isEmpty();
    }
}
