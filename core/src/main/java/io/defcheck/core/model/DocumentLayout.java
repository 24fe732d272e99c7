package io.defcheck.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Where the validation entry points sit inside a document.
 *
 * <p>
 * A document holds a primary entity under {@code rootKey} (or is the entity
 * itself when that key is missing) plus an optional array of child links under
 * {@code childLinkKey}. Every child link may embed another primary entity at
 * {@code nestedRootPath}.
 *
 * @param rootKey             key of the primary entity, also the path prefix
 * @param rootDefinition      definition name (short or full) of the primary entity
 * @param childLinkKey        key of the child-link array, or null for none
 * @param childLinkDefinition definition name of a child link
 * @param nestedRootPath      keys leading from a child link to its embedded entity
 */
public record DocumentLayout(
        String rootKey,
        String rootDefinition,
        String childLinkKey,
        String childLinkDefinition,
        List<String> nestedRootPath) {

    public DocumentLayout {
        Objects.requireNonNull(rootKey, "rootKey must not be null");
        Objects.requireNonNull(rootDefinition, "rootDefinition must not be null");
        nestedRootPath = nestedRootPath == null ? List.of() : List.copyOf(nestedRootPath);
    }

    /** Layout of GS1 firstbase catalogue item documents. */
    public static DocumentLayout firstbase() {
        return new DocumentLayout(
                "TradeItem",
                "TradeItem",
                "CatalogueItemChildItemLink",
                "CatalogueItemChildItemLink",
                List.of("CatalogueItem", "TradeItem"));
    }

    /** A layout with a single entry point and no child links. */
    public static DocumentLayout rootOnly(String rootKey, String rootDefinition) {
        return new DocumentLayout(rootKey, rootDefinition, null, null, List.of());
    }

    public boolean hasChildLinks() {
        return childLinkKey != null && childLinkDefinition != null;
    }
}
