package io.defcheck.core.error;

/**
 * Thrown when an entry-point definition required to start a run (e.g. the
 * document layout's root definition) cannot be resolved in the schema.
 */
public final class DefinitionNotFoundException extends DefcheckException {

    private static final long serialVersionUID = 1L;

    private final String definitionName;

    public DefinitionNotFoundException(String definitionName, String source) {
        super("Definition '" + definitionName + "' not found in " + (source == null ? "schema" : source), source);
        this.definitionName = definitionName;
    }

    /** The short or full name that failed to resolve. */
    public String definitionName() {
        return definitionName;
    }
}
