package io.defcheck.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.defcheck.core.error.DefinitionNotFoundException;
import io.defcheck.core.model.DocumentLayout;
import io.defcheck.core.model.Issue;
import io.defcheck.core.model.IssueCategory;
import io.defcheck.core.model.Schema;
import io.defcheck.core.model.SourceDocument;
import io.defcheck.core.model.ValidationResult;
import io.defcheck.core.schema.ReferenceResolver;
import io.defcheck.core.schema.SchemaIndex;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds the entry points of each document into the {@link StructuralValidator}
 * and collects the issues per document.
 *
 * <p>
 * Entry points come from the {@link DocumentLayout}: the primary entity under
 * the root key (or the whole document), every element of the child-link array,
 * and the primary entity embedded in each child link. Issues of one document are
 * concatenated in that order.
 *
 * <p>
 * Thread-safe: documents share only the read-only schema and index.
 */
public final class ValidationRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ValidationRunner.class);

    private final StructuralValidator validator;
    private final DocumentLayout layout;
    private final String rootDefinition;

    /**
     * Creates a runner.
     *
     * @param validator the validator to apply
     * @param layout    entry points of each document
     * @throws DefinitionNotFoundException if the layout's root definition does not resolve
     */
    public ValidationRunner(StructuralValidator validator, DocumentLayout layout) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.layout = Objects.requireNonNull(layout, "layout must not be null");
        ReferenceResolver resolver = validator.resolver();
        this.rootDefinition = resolver.resolve(layout.rootDefinition())
                .orElseThrow(() -> new DefinitionNotFoundException(
                        layout.rootDefinition(), resolver.schema().source()));
    }

    /**
     * Wires index, resolver, validator and runner for one schema.
     *
     * @param schema          the schema to validate against
     * @param layout          entry points of each document
     * @param mode            lenient or strict handling of non-object values
     * @param preferredMarker namespace marker preferred by the short-name index
     * @return a ready runner
     * @throws DefinitionNotFoundException if the layout's root definition does not resolve
     */
    public static ValidationRunner forSchema(
            Schema schema, DocumentLayout layout, ValidationMode mode, String preferredMarker) {
        ReferenceResolver resolver = new ReferenceResolver(schema, SchemaIndex.build(schema, preferredMarker));
        return new ValidationRunner(new StructuralValidator(resolver, mode), layout);
    }

    /** Full name of the resolved root definition. */
    public String rootDefinition() {
        return rootDefinition;
    }

    public StructuralValidator validator() {
        return validator;
    }

    /**
     * Validates every entry point of one parsed document.
     *
     * @param document the parsed document
     * @return all issues of the document in traversal order
     */
    public List<Issue> validateDocument(JsonNode document) {
        JsonNode rootValue = document.has(layout.rootKey()) ? document.get(layout.rootKey()) : document;
        List<Issue> issues = new ArrayList<>(validator.validate(rootValue, rootDefinition, layout.rootKey()));

        if (!layout.hasChildLinks()) {
            return issues;
        }
        JsonNode children = document.path(layout.childLinkKey());
        if (!children.isArray() || children.isEmpty()) {
            return issues;
        }
        String childDefinition = validator.resolver().resolve(layout.childLinkDefinition()).orElse(null);
        if (childDefinition == null) {
            LOG.debug("Child link definition '{}' not in schema, skipping {} child links",
                    layout.childLinkDefinition(), children.size());
            return issues;
        }

        String nestedSuffix = String.join(".", layout.nestedRootPath());
        for (int i = 0; i < children.size(); i++) {
            JsonNode child = children.get(i);
            String childPath = layout.childLinkKey() + "[" + i + "]";
            issues.addAll(validator.validate(child, childDefinition, childPath));

            JsonNode nested = nestedRoot(child);
            if (nested != null) {
                issues.addAll(validator.validate(nested, rootDefinition, childPath + "." + nestedSuffix));
            }
        }
        return issues;
    }

    /**
     * Validates one source document. An unparseable document yields a single
     * {@code PARSE_ERROR} and no structural checks.
     */
    public List<Issue> validate(SourceDocument document) {
        if (!document.isParsed()) {
            return List.of(new Issue(IssueCategory.PARSE_ERROR, "", document.parseError()));
        }
        List<Issue> issues = validateDocument(document.content());
        LOG.debug("Validated {}: {} issues", document.id(), issues.size());
        return issues;
    }

    /** Validates all documents sequentially, keeping their order in the result. */
    public ValidationResult run(List<SourceDocument> documents) {
        Map<String, List<Issue>> results = new LinkedHashMap<>();
        for (SourceDocument document : documents) {
            results.put(document.id(), validate(document));
        }
        return logged(new ValidationResult(results));
    }

    /**
     * Validates all documents on the given executor. The result keeps the input
     * order regardless of completion order.
     */
    public ValidationResult run(List<SourceDocument> documents, ExecutorService executor) {
        List<CompletableFuture<List<Issue>>> futures = new ArrayList<>(documents.size());
        for (SourceDocument document : documents) {
            futures.add(CompletableFuture.supplyAsync(() -> validate(document), executor));
        }
        Map<String, List<Issue>> results = new LinkedHashMap<>();
        for (int i = 0; i < documents.size(); i++) {
            results.put(documents.get(i).id(), futures.get(i).join());
        }
        return logged(new ValidationResult(results));
    }

    private JsonNode nestedRoot(JsonNode child) {
        if (layout.nestedRootPath().isEmpty()) {
            return null;
        }
        JsonNode current = child;
        for (String key : layout.nestedRootPath()) {
            current = current.path(key);
        }
        return current.isObject() && !current.isEmpty() ? current : null;
    }

    private ValidationResult logged(ValidationResult result) {
        LOG.info("Validation complete: documents={}, valid={}, invalid={}",
                result.documentCount(), result.validCount(), result.invalidCount());
        return result;
    }
}
