package io.defcheck.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.defcheck.core.model.Definition;
import io.defcheck.core.model.Issue;
import io.defcheck.core.model.IssueCategory;
import io.defcheck.core.model.PropertySpec;
import io.defcheck.core.model.Schema;
import io.defcheck.core.schema.ReferenceResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursively checks a JSON value against a schema definition and collects every
 * discrepancy as an {@link Issue}.
 *
 * <p>
 * Per field, in document order:
 * <ol>
 * <li>undeclared field → {@code UNKNOWN_FIELD}, nothing else is checked;</li>
 * <li>type check ({@link TypeChecker});</li>
 * <li>inline enum membership;</li>
 * <li>{@code $ref} objects: wrapper-enum {@code Value} check or recursion;</li>
 * <li>arrays of {@code $ref}: per-element enum check or recursion.</li>
 * </ol>
 *
 * <p>
 * Recursion follows the document tree, never the schema graph, so cyclic
 * definitions terminate. Validation never throws; an unresolvable definition
 * becomes a {@code SCHEMA_NOT_FOUND} issue and only that subtree is skipped.
 *
 * <p>
 * Thread-safe: holds only the read-only resolver and the mode. Each call
 * allocates its own issue list.
 */
public final class StructuralValidator {

    private static final Logger LOG = LoggerFactory.getLogger(StructuralValidator.class);

    /** Key holding the coded value of a wrapper-enum object. */
    public static final String WRAPPED_VALUE_KEY = "Value";

    private final ReferenceResolver resolver;
    private final ValidationMode mode;

    public StructuralValidator(ReferenceResolver resolver, ValidationMode mode) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    /** Creates a lenient validator with a default index over the schema. */
    public static StructuralValidator forSchema(Schema schema) {
        return new StructuralValidator(ReferenceResolver.of(schema), ValidationMode.LENIENT);
    }

    public ReferenceResolver resolver() {
        return resolver;
    }

    public ValidationMode mode() {
        return mode;
    }

    /**
     * Validates a value against a definition.
     *
     * @param value          the JSON value
     * @param definitionName full or short definition name, or a {@code $ref} pointer
     * @param path           path of the value; prefix of all issue paths
     * @return issues in traversal order, empty if the value conforms
     */
    public List<Issue> validate(JsonNode value, String definitionName, String path) {
        List<Issue> issues = new ArrayList<>();
        validateInto(value, definitionName, path, issues);
        return issues;
    }

    private void validateInto(JsonNode value, String definitionName, String path, List<Issue> issues) {
        Schema schema = resolver.schema();
        Optional<String> resolved =
                schema.contains(definitionName) ? Optional.of(definitionName) : resolver.resolve(definitionName);
        if (resolved.isEmpty()) {
            LOG.debug("Definition '{}' not found at path '{}'", definitionName, path);
            issues.add(new Issue(IssueCategory.SCHEMA_NOT_FOUND, path, "'" + bareName(definitionName) + "' not in spec"));
            return;
        }
        validateDefinition(value, schema.get(resolved.get()), path, issues);
    }

    private void validateDefinition(JsonNode value, Definition definition, String path, List<Issue> issues) {
        if (value == null || !value.isObject()) {
            if (mode == ValidationMode.STRICT && JsonNodeUtils.isPresent(value)) {
                issues.add(notAnObject(value, definition, path));
            }
            return;
        }

        for (Map.Entry<String, JsonNode> field : value.properties()) {
            String key = field.getKey();
            JsonNode fieldValue = field.getValue();
            String fieldPath = path.isEmpty() ? key : path + "." + key;

            PropertySpec spec = definition.property(key);
            if (spec == null) {
                issues.add(new Issue(
                        IssueCategory.UNKNOWN_FIELD,
                        fieldPath,
                        "not in '" + definition.shortName() + "' (has "
                                + definition.properties().size() + " properties)"));
                continue;
            }

            TypeChecker.check(fieldValue, spec, fieldPath).ifPresent(issues::add);

            if (spec instanceof PropertySpec.Enumerated enumerated) {
                checkInlineEnum(fieldValue, enumerated, fieldPath, issues);
            } else if (spec instanceof PropertySpec.Reference reference) {
                checkReference(fieldValue, reference, fieldPath, issues);
            } else if (spec instanceof PropertySpec.ArrayOf arrayOf) {
                checkArray(fieldValue, arrayOf, fieldPath, issues);
            }
            // Primitive and Untyped: the type check above is all there is
        }
    }

    private static void checkInlineEnum(
            JsonNode value, PropertySpec.Enumerated enumerated, String path, List<Issue> issues) {
        if (JsonNodeUtils.isPresent(value) && !JsonNodeUtils.enumContains(enumerated.allowed(), value)) {
            issues.add(new Issue(
                    IssueCategory.INVALID_ENUM, path, JsonNodeUtils.invalidEnumMessage(value, enumerated.allowed())));
        }
    }

    private void checkReference(JsonNode value, PropertySpec.Reference reference, String path, List<Issue> issues) {
        if (!JsonNodeUtils.isPresent(value)) {
            return;
        }
        if (!value.isObject() && mode == ValidationMode.LENIENT) {
            return;
        }

        Optional<Definition> target = resolver.resolveDefinition(reference.ref());
        if (target.isEmpty()) {
            validateInto(value, reference.ref(), path, issues);
            return;
        }

        Definition definition = target.get();
        if (!definition.isEnum()) {
            validateDefinition(value, definition, path, issues);
        } else if (value.isObject()) {
            JsonNode inner = value.get(WRAPPED_VALUE_KEY);
            if (JsonNodeUtils.isPresent(inner) && !JsonNodeUtils.enumContains(definition.enumValues(), inner)) {
                issues.add(new Issue(
                        IssueCategory.INVALID_ENUM,
                        path + "." + WRAPPED_VALUE_KEY,
                        JsonNodeUtils.invalidEnumMessage(inner, definition.enumValues())));
            }
        } else if (!JsonNodeUtils.enumContains(definition.enumValues(), value)) {
            // strict only: a bare scalar is checked like an unwrapped array item
            issues.add(new Issue(
                    IssueCategory.INVALID_ENUM, path, JsonNodeUtils.invalidEnumMessage(value, definition.enumValues())));
        }
    }

    private void checkArray(JsonNode value, PropertySpec.ArrayOf arrayOf, String path, List<Issue> issues) {
        if (value == null || !value.isArray()) {
            return;
        }
        if (!(arrayOf.items() instanceof PropertySpec.Reference itemRef)) {
            return;
        }

        Optional<Definition> target = resolver.resolveDefinition(itemRef.ref());
        if (target.isEmpty()) {
            validateInto(value, itemRef.ref(), path, issues);
            return;
        }

        Definition definition = target.get();
        for (int i = 0; i < value.size(); i++) {
            JsonNode item = value.get(i);
            String itemPath = path + "[" + i + "]";
            if (definition.isEnum()) {
                JsonNode inner = item.isObject() ? item.get(WRAPPED_VALUE_KEY) : item;
                if (JsonNodeUtils.isPresent(inner) && !JsonNodeUtils.enumContains(definition.enumValues(), inner)) {
                    issues.add(new Issue(
                            IssueCategory.INVALID_ENUM,
                            itemPath,
                            JsonNodeUtils.invalidEnumMessage(inner, definition.enumValues())));
                }
            } else if (item.isObject() || mode == ValidationMode.STRICT) {
                validateDefinition(item, definition, itemPath, issues);
            }
        }
    }

    private static Issue notAnObject(JsonNode value, Definition definition, String path) {
        return new Issue(
                IssueCategory.TYPE_MISMATCH,
                path,
                "expected object (" + definition.shortName() + "), got " + JsonNodeUtils.observedTypeName(value));
    }

    private static String bareName(String refOrName) {
        return refOrName.startsWith(ReferenceResolver.DEFINITIONS_POINTER)
                ? refOrName.substring(ReferenceResolver.DEFINITIONS_POINTER.length())
                : refOrName;
    }
}
