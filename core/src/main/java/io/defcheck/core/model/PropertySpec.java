package io.defcheck.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declaration of a single definition property.
 *
 * <p>
 * Implementations are a sealed hierarchy: every shape a Swagger property can
 * take is one of the variants below, so the validator matches on the variant
 * instead of probing the raw JSON for {@code $ref}, {@code items} or
 * {@code enum} keys at every step.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface PropertySpec {

    /**
     * The primitive type the value must have, if the property declares one that
     * the type check understands.
     */
    Optional<PrimitiveType> declaredType();

    // ── Implementations ──

    /** A property with a primitive {@code type} and nothing else to check. */
    record Primitive(PrimitiveType type) implements PropertySpec {
        public Primitive {
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public Optional<PrimitiveType> declaredType() {
            return Optional.of(type);
        }
    }

    /**
     * A property with an inline {@code enum}. The primitive type is optional.
     *
     * @param type    declared primitive type, or null if none
     * @param allowed allowed values in schema order
     */
    record Enumerated(PrimitiveType type, List<JsonNode> allowed) implements PropertySpec {
        public Enumerated {
            allowed = List.copyOf(allowed);
        }

        @Override
        public Optional<PrimitiveType> declaredType() {
            return Optional.ofNullable(type);
        }
    }

    /**
     * A property pointing at another definition.
     *
     * @param ref the raw {@code $ref} value, e.g. {@code #/definitions/Brand}
     */
    record Reference(String ref) implements PropertySpec {
        public Reference {
            Objects.requireNonNull(ref, "ref must not be null");
        }

        @Override
        public Optional<PrimitiveType> declaredType() {
            return Optional.empty();
        }
    }

    /**
     * A {@code type: array} property.
     *
     * @param items element declaration; {@link Untyped} when {@code items} is absent
     */
    record ArrayOf(PropertySpec items) implements PropertySpec {
        public ArrayOf {
            Objects.requireNonNull(items, "items must not be null");
        }

        @Override
        public Optional<PrimitiveType> declaredType() {
            return Optional.of(PrimitiveType.ARRAY);
        }
    }

    /** A property with no recognised type, reference or enum. Never checked. */
    record Untyped() implements PropertySpec {
        @Override
        public Optional<PrimitiveType> declaredType() {
            return Optional.empty();
        }
    }
}
