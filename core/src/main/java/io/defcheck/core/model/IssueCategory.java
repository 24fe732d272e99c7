package io.defcheck.core.model;

/**
 * Kind of discrepancy. None of them is fatal to a run; every one is reported as an
 * {@link Issue}.
 *
 * <ul>
 * <li>{@link #SCHEMA_NOT_FOUND}: referenced or requested definition is absent;
 * the subtree is not checked further.</li>
 * <li>{@link #UNKNOWN_FIELD}: document field with no counterpart in the
 * definition.</li>
 * <li>{@link #TYPE_MISMATCH}: declared primitive type does not match the
 * value.</li>
 * <li>{@link #INVALID_ENUM}: value (or its wrapped {@code Value}) is not a
 * member of the enumeration.</li>
 * <li>{@link #PARSE_ERROR}: the document is not JSON at all.</li>
 * </ul>
 */
public enum IssueCategory {
    SCHEMA_NOT_FOUND,
    UNKNOWN_FIELD,
    TYPE_MISMATCH,
    INVALID_ENUM,
    PARSE_ERROR
}
