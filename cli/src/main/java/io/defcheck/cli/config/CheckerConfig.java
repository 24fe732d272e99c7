package io.defcheck.cli.config;

import io.defcheck.core.engine.ValidationMode;
import io.defcheck.core.model.DocumentLayout;
import io.defcheck.core.schema.SchemaIndex;
import java.util.List;

/**
 * Root configuration of the defcheck command line tool.
 *
 * <p>
 * Every field has a default matching the GS1 firstbase setup. Use
 * {@link #builder()} to construct instances.
 *
 * @param documentsDir       directory scanned for {@code *.json} documents when
 *                           none are given on the command line
 * @param cacheDir           directory holding downloaded Swagger documents
 * @param connectTimeoutMs   schema download connect timeout in ms
 * @param readTimeoutMs      schema download response timeout in ms
 * @param validationMode     lenient or strict handling of non-object values
 * @param parallelism        worker threads per run; 1 validates sequentially
 * @param preferredNamespace namespace marker preferred by the short-name index
 * @param topPatterns        maximum number of issue patterns printed per schema
 * @param layout             validation entry points of each document
 * @param loggingFormat      json or text
 * @param loggingLevel       root log level
 * @param schemas            Swagger documents to validate against, in order
 */
public record CheckerConfig(
        String documentsDir,
        String cacheDir,
        int connectTimeoutMs,
        int readTimeoutMs,
        ValidationMode validationMode,
        int parallelism,
        String preferredNamespace,
        int topPatterns,
        DocumentLayout layout,
        String loggingFormat,
        String loggingLevel,
        List<SchemaSourceConfig> schemas) {

    public CheckerConfig {
        schemas = List.copyOf(schemas);
    }

    /** Creates a new builder with the defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CheckerConfig}. */
    public static final class Builder {
        private String documentsDir = "./firstbase_json";
        private String cacheDir = ".";
        private int connectTimeoutMs = 10_000;
        private int readTimeoutMs = 30_000;
        private ValidationMode validationMode = ValidationMode.LENIENT;
        private int parallelism = 1;
        private String preferredNamespace = SchemaIndex.DEFAULT_PREFERRED_MARKER;
        private int topPatterns = 50;
        private DocumentLayout layout = DocumentLayout.firstbase();
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";
        private List<SchemaSourceConfig> schemas = SchemaSourceConfig.FIRSTBASE_DEFAULTS;

        Builder() {}

        public Builder documentsDir(String documentsDir) {
            this.documentsDir = documentsDir;
            return this;
        }

        public Builder cacheDir(String cacheDir) {
            this.cacheDir = cacheDir;
            return this;
        }

        public Builder connectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder readTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
            return this;
        }

        public Builder validationMode(ValidationMode validationMode) {
            this.validationMode = validationMode;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder preferredNamespace(String preferredNamespace) {
            this.preferredNamespace = preferredNamespace;
            return this;
        }

        public Builder topPatterns(int topPatterns) {
            this.topPatterns = topPatterns;
            return this;
        }

        public Builder layout(DocumentLayout layout) {
            this.layout = layout;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder schemas(List<SchemaSourceConfig> schemas) {
            this.schemas = schemas;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws ConfigLoadException if a numeric setting is out of range or no
         *                             schema is configured
         */
        public CheckerConfig build() {
            if (parallelism < 1) {
                throw new ConfigLoadException("validation.parallelism must be at least 1, got: " + parallelism);
            }
            if (topPatterns < 0) {
                throw new ConfigLoadException("validation.top-patterns must not be negative, got: " + topPatterns);
            }
            if (connectTimeoutMs <= 0 || readTimeoutMs <= 0) {
                throw new ConfigLoadException("fetch timeouts must be positive");
            }
            if (schemas == null || schemas.isEmpty()) {
                throw new ConfigLoadException("At least one schema must be configured under 'schemas'");
            }
            return new CheckerConfig(
                    documentsDir,
                    cacheDir,
                    connectTimeoutMs,
                    readTimeoutMs,
                    validationMode,
                    parallelism,
                    preferredNamespace,
                    topPatterns,
                    layout,
                    loggingFormat,
                    loggingLevel,
                    schemas);
        }
    }
}
