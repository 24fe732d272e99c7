package io.defcheck.core.schema;

import io.defcheck.core.model.Definition;
import io.defcheck.core.model.Schema;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a {@code $ref} pointer or a bare definition name into the full name of a
 * definition in the schema.
 *
 * <p>
 * Exact full-name matches win; otherwise the short name goes through the
 * {@link SchemaIndex}. Thread-safe.
 */
public final class ReferenceResolver {

    /** Pointer prefix of Swagger 2 local definition references. */
    public static final String DEFINITIONS_POINTER = "#/definitions/";

    private final Schema schema;
    private final SchemaIndex index;

    public ReferenceResolver(Schema schema, SchemaIndex index) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.index = Objects.requireNonNull(index, "index must not be null");
    }

    /** Creates a resolver with an index using the default preferred marker. */
    public static ReferenceResolver of(Schema schema) {
        return new ReferenceResolver(schema, SchemaIndex.build(schema));
    }

    /**
     * Resolves a reference or name.
     *
     * @param refOrName {@code #/definitions/Foo}, {@code Ns.Foo} or {@code Foo}
     * @return the full definition name, or empty if nothing matches
     */
    public Optional<String> resolve(String refOrName) {
        if (refOrName == null || refOrName.isBlank()) {
            return Optional.empty();
        }
        String name = refOrName.startsWith(DEFINITIONS_POINTER)
                ? refOrName.substring(DEFINITIONS_POINTER.length())
                : refOrName;
        if (schema.contains(name)) {
            return Optional.of(name);
        }
        return Optional.ofNullable(index.lookup(Definition.shortNameOf(name)));
    }

    /** Resolves and returns the definition itself, or empty. */
    public Optional<Definition> resolveDefinition(String refOrName) {
        return resolve(refOrName).map(schema::get);
    }

    public Schema schema() {
        return schema;
    }

    public SchemaIndex index() {
        return index;
    }
}
