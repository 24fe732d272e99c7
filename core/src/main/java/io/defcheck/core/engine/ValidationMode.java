package io.defcheck.core.engine;

/**
 * How the validator treats a value bound to an object definition that is not an
 * object (e.g. a {@code $ref} field holding a bare string).
 *
 * <ul>
 * <li>{@link #LENIENT}: skip such values silently. Reports stay comparable
 * with earlier runs (default).</li>
 * <li>{@link #STRICT}: report them as {@code TYPE_MISMATCH}.</li>
 * </ul>
 */
public enum ValidationMode {
    /** Skip non-object values at definition boundaries (default). */
    LENIENT,

    /** Report non-object values at definition boundaries. */
    STRICT
}
