package io.defcheck.cli.app;

import com.fasterxml.jackson.databind.JsonNode;
import io.defcheck.cli.CliArguments;
import io.defcheck.cli.config.CheckerConfig;
import io.defcheck.cli.config.ConfigLoader;
import io.defcheck.cli.config.SchemaSourceConfig;
import io.defcheck.cli.fetch.SchemaFetchException;
import io.defcheck.cli.fetch.SchemaFetcher;
import io.defcheck.cli.report.SchemaDumper;
import io.defcheck.cli.report.SummaryPrinter;
import io.defcheck.cli.source.DocumentCollector;
import io.defcheck.core.engine.ValidationRunner;
import io.defcheck.core.error.DefcheckException;
import io.defcheck.core.model.Schema;
import io.defcheck.core.model.SourceDocument;
import io.defcheck.core.model.ValidationResult;
import io.defcheck.core.schema.SchemaIndex;
import io.defcheck.core.schema.SwaggerSchemaParser;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one invocation of the checker.
 *
 * <p>
 * Sequence:
 * <ol>
 * <li>Resolve the configuration (file + env overlay) and configure logging</li>
 * <li>With {@code --refresh}, delete the cached Swagger documents</li>
 * <li>With {@code --dump-schema}, print the named definition of every schema and stop</li>
 * <li>Otherwise, for every configured schema: fetch, parse, validate all
 * documents and print the summary</li>
 * </ol>
 *
 * <p>
 * Documents are collected and read once, on the first schema that loads, and
 * reused for the others. A schema that cannot be loaded is reported and counts
 * as a failure; the remaining schemas still run.
 */
public final class CheckerApp {

    private static final Logger LOG = LoggerFactory.getLogger(CheckerApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private CheckerApp() {
        // utility class
    }

    /**
     * Runs with the process environment, working directory and standard output.
     *
     * @param args command-line arguments
     * @return process exit code
     */
    public static int run(String[] args) {
        return run(CliArguments.parse(args), System::getenv, Path.of("").toAbsolutePath(), System.out);
    }

    /**
     * Runs one invocation.
     *
     * @param cli        parsed arguments
     * @param envLookup  environment variable lookup function
     * @param workingDir directory against which relative paths resolve
     * @param out        destination of the report
     * @return 0 when every document passed against every schema, 1 on issues
     *         or a failed schema, 2 on a usage error
     */
    public static int run(CliArguments cli, Function<String, String> envLookup, Path workingDir, PrintStream out) {
        CheckerConfig config = ConfigLoader.resolve(cli.configPath(), workingDir, envLookup);
        LogbackConfigurator.configure(config);
        LOG.debug("Configuration resolved: mode={}, parallelism={}, schemas={}",
                config.validationMode(), config.parallelism(), config.schemas().size());

        SchemaFetcher fetcher = new SchemaFetcher(config, workingDir);
        if (cli.refresh()) {
            int deleted = fetcher.clearCache(config.schemas());
            LOG.info("Cleared {} cached schema(s)", deleted);
        }

        if (cli.dumpSchema()) {
            return dump(cli, config, fetcher, out);
        }

        Path documentsDir = workingDir.resolve(config.documentsDir());
        List<Path> explicit = cli.documents().stream().map(workingDir::resolve).toList();
        List<SourceDocument> documents = null;
        boolean allPassed = true;

        for (SchemaSourceConfig source : config.schemas()) {
            ValidationRunner runner;
            try {
                Schema schema = SwaggerSchemaParser.parse(fetcher.fetch(source, true), source.url());
                runner = ValidationRunner.forSchema(
                        schema, config.layout(), config.validationMode(), config.preferredNamespace());
                out.println(source.label() + ": " + schema.size() + " definitions, "
                        + runner.rootDefinition() + " has "
                        + schema.get(runner.rootDefinition()).properties().size() + " properties");
            } catch (SchemaFetchException | DefcheckException e) {
                LOG.error("Skipping {}: {}", source.label(), e.getMessage());
                allPassed = false;
                continue;
            }

            if (documents == null) {
                documents = DocumentCollector.readAll(DocumentCollector.collect(explicit, documentsDir));
                out.println("Validating " + documents.size() + " files...");
            }

            ValidationResult result = validate(runner, documents, config.parallelism());
            boolean passed = new SummaryPrinter(out).print(source.label(), result, cli.verbose(), config.topPatterns());
            allPassed &= passed;
        }
        return allPassed ? EXIT_OK : EXIT_FAILED;
    }

    private static ValidationResult validate(ValidationRunner runner, List<SourceDocument> documents, int parallelism) {
        if (parallelism <= 1) {
            return runner.run(documents);
        }
        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            return runner.run(documents, executor);
        } finally {
            executor.shutdownNow();
        }
    }

    private static int dump(CliArguments cli, CheckerConfig config, SchemaFetcher fetcher, PrintStream out) {
        if (cli.dumpName() == null) {
            out.println("Usage: defcheck --dump-schema DefinitionName");
            return EXIT_USAGE;
        }
        SchemaDumper dumper = new SchemaDumper(out);
        boolean found = false;
        for (SchemaSourceConfig source : config.schemas()) {
            try {
                JsonNode swagger = fetcher.fetch(source, true);
                Schema schema = SwaggerSchemaParser.parse(swagger, source.url());
                SchemaIndex index = SchemaIndex.build(schema, config.preferredNamespace());
                found |= dumper.dump(source.label(), swagger, schema, index, cli.dumpName());
            } catch (SchemaFetchException | DefcheckException e) {
                LOG.error("Skipping {}: {}", source.label(), e.getMessage());
            }
        }
        return found ? EXIT_OK : EXIT_FAILED;
    }
}
