package io.defcheck.cli.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.defcheck.core.model.Schema;
import io.defcheck.core.schema.SchemaIndex;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * Prints one definition of a Swagger document for inspection
 * ({@code --dump-schema NAME}).
 *
 * <p>
 * The name may be short or fully qualified. When nothing matches, up to
 * {@value #MAX_SUGGESTIONS} definitions whose names contain it
 * (case-insensitive) are suggested.
 */
public final class SchemaDumper {

    static final int MAX_SUGGESTIONS = 10;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PrintStream out;

    public SchemaDumper(PrintStream out) {
        this.out = out;
    }

    /**
     * Dumps a definition.
     *
     * @param label   schema label
     * @param swagger the raw Swagger document, printed verbatim
     * @param schema  the parsed schema, used for name lookup
     * @param index   short-name index of the schema
     * @param name    short or full definition name
     * @return {@code true} if the definition was found
     */
    public boolean dump(String label, JsonNode swagger, Schema schema, SchemaIndex index, String name) {
        String fullName = index.lookup(name) != null ? index.lookup(name) : name;
        JsonNode definition = swagger.path("definitions").get(fullName);
        if (definition != null) {
            out.println();
            out.println("[" + label + "] " + fullName + ":");
            out.println(pretty(definition));
            return true;
        }

        String needle = name.toLowerCase(Locale.ROOT);
        List<String> matches = schema.names().stream()
                .filter(n -> n.toLowerCase(Locale.ROOT).contains(needle))
                .limit(MAX_SUGGESTIONS)
                .toList();
        out.println();
        if (!matches.isEmpty()) {
            out.println("[" + label + "] '" + name + "' not found. Did you mean:");
            matches.forEach(m -> out.println("  " + m));
        } else {
            out.println("[" + label + "] '" + name + "' not found in " + schema.size() + " definitions.");
        }
        return false;
    }

    private static String pretty(JsonNode node) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
