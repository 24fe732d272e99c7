package io.defcheck.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.defcheck.core.engine.ValidationMode;
import io.defcheck.core.model.DocumentLayout;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link CheckerConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Supports three invocation patterns:
 * <ul>
 * <li>{@code --config /path/to/defcheck.yaml}: loads the given file, which must
 * exist</li>
 * <li>Default: loads {@code defcheck.yaml} from the current directory if it
 * exists</li>
 * <li>Neither: built-in defaults (GS1 firstbase APIs)</li>
 * </ul>
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable counts as
 * set if and only if it is defined AND its trimmed value is non-empty; blank
 * values leave the YAML value in place.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Config file picked up from the working directory when no path is given. */
    public static final String DEFAULT_CONFIG_FILE = "defcheck.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link CheckerConfig} from the given YAML file, applying overrides
     * from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the configuration with defaults applied
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CheckerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link CheckerConfig} from the given YAML file, applying overrides
     * from the supplied lookup function ({@code null} = variable not defined).
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the configuration with env overrides applied
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CheckerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Resolves the configuration for a run: the explicit file if given, else
     * {@value #DEFAULT_CONFIG_FILE} in {@code workingDir} if present, else the
     * defaults. The environment overlay applies in every case.
     *
     * @param explicitPath path from {@code --config}, or null
     * @param workingDir   directory searched for the default file
     * @param envLookup    environment variable lookup function
     * @return the resolved configuration
     */
    public static CheckerConfig resolve(Path explicitPath, Path workingDir, Function<String, String> envLookup) {
        if (explicitPath != null) {
            return load(explicitPath, envLookup);
        }
        Path defaultPath = workingDir.resolve(DEFAULT_CONFIG_FILE);
        if (Files.exists(defaultPath)) {
            return load(defaultPath, envLookup);
        }
        return defaults(envLookup);
    }

    /** Built-in defaults with the environment overlay applied. */
    public static CheckerConfig defaults(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    /**
     * Maps a parsed YAML tree onto the builder, then overlays environment
     * variable overrides.
     */
    private static CheckerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CheckerConfig.Builder builder = CheckerConfig.builder();

        // --- YAML mapping ---

        JsonNode documents = root.path("documents");
        if (documents.has("dir")) builder.documentsDir(documents.get("dir").asText());

        JsonNode cache = root.path("cache");
        if (cache.has("dir")) builder.cacheDir(cache.get("dir").asText());

        JsonNode fetch = root.path("fetch");
        yamlInt(fetch, "fetch", "connect-timeout-ms", builder::connectTimeoutMs);
        yamlInt(fetch, "fetch", "read-timeout-ms", builder::readTimeoutMs);

        JsonNode validation = root.path("validation");
        if (validation.has("mode"))
            builder.validationMode(parseMode(validation.get("mode").asText(), "validation.mode"));
        yamlInt(validation, "validation", "parallelism", builder::parallelism);
        if (validation.has("preferred-namespace"))
            builder.preferredNamespace(validation.get("preferred-namespace").asText());
        yamlInt(validation, "validation", "top-patterns", builder::topPatterns);

        JsonNode layout = root.path("layout");
        if (!layout.isMissingNode()) builder.layout(mapLayout(layout));

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        JsonNode schemas = root.path("schemas");
        if (schemas.isArray()) builder.schemas(mapSchemas(schemas));

        // --- Environment variable overlay ---
        envString(envLookup, "DEFCHECK_DOCUMENTS_DIR", builder::documentsDir);
        envString(envLookup, "DEFCHECK_CACHE_DIR", builder::cacheDir);
        envString(envLookup, "DEFCHECK_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "DEFCHECK_LOG_LEVEL", builder::loggingLevel);
        envString(
                envLookup,
                "DEFCHECK_VALIDATION_MODE",
                value -> builder.validationMode(parseMode(value, "DEFCHECK_VALIDATION_MODE")));

        envInt(envLookup, "DEFCHECK_PARALLELISM", builder::parallelism);
        envInt(envLookup, "DEFCHECK_TOP_PATTERNS", builder::topPatterns);
        envInt(envLookup, "DEFCHECK_CONNECT_TIMEOUT_MS", builder::connectTimeoutMs);
        envInt(envLookup, "DEFCHECK_READ_TIMEOUT_MS", builder::readTimeoutMs);

        return builder.build();
    }

    /** Missing layout keys fall back to the firstbase layout. */
    private static DocumentLayout mapLayout(JsonNode layout) {
        DocumentLayout defaults = DocumentLayout.firstbase();
        String rootKey = textOrDefault(layout, "root-key", defaults.rootKey());
        String rootDefinition = textOrDefault(layout, "root-definition", defaults.rootDefinition());
        String childLinkKey = blankToNull(textOrDefault(layout, "child-link-key", defaults.childLinkKey()));
        String childLinkDefinition =
                blankToNull(textOrDefault(layout, "child-link-definition", defaults.childLinkDefinition()));

        List<String> nestedPath = defaults.nestedRootPath();
        if (layout.has("nested-root-path")) {
            String dotted = layout.get("nested-root-path").asText("");
            nestedPath = dotted.isBlank() ? List.of() : Arrays.asList(dotted.split("\\."));
        }
        return new DocumentLayout(rootKey, rootDefinition, childLinkKey, childLinkDefinition, nestedPath);
    }

    private static List<SchemaSourceConfig> mapSchemas(JsonNode schemas) {
        List<SchemaSourceConfig> sources = new ArrayList<>();
        for (int i = 0; i < schemas.size(); i++) {
            JsonNode entry = schemas.get(i);
            String key = textOrDefault(entry, "key", null);
            String url = textOrDefault(entry, "url", null);
            if (key == null || url == null) {
                throw new ConfigLoadException("schemas[" + i + "] requires both 'key' and 'url'");
            }
            sources.add(new SchemaSourceConfig(
                    key, textOrDefault(entry, "label", null), url, textOrDefault(entry, "cache-file", null)));
        }
        return sources;
    }

    private static ValidationMode parseMode(String value, String origin) {
        try {
            return ValidationMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(origin + " must be 'lenient' or 'strict', got: " + value, e);
        }
    }

    // --- Env var helpers ---

    /**
     * Returns {@code true} if the env var is "set": defined AND non-blank after
     * trimming.
     */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    /** Applies an integer env var override if set. */
    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: " + value, e);
            }
        }
    }

    // --- YAML helpers ---

    /**
     * Applies an integer YAML value if present. Accepts integral numbers and
     * strings holding one; anything else is rejected instead of read as 0.
     */
    private static void yamlInt(JsonNode section, String sectionName, String field, IntConsumer setter) {
        JsonNode node = section.get(field);
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            setter.accept(node.intValue());
            return;
        }
        String value = node.asText().trim();
        try {
            setter.accept(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(sectionName + "." + field + " must be an integer, got: " + node, e);
        }
    }

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.hasNonNull(field) ? node.get(field).asText() : defaultValue;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
