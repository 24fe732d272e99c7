package io.defcheck.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line.
 *
 * <pre>
 * defcheck [--config FILE] [--verbose|-v] [--refresh] [--dump-schema NAME] [FILE.json ...]
 * </pre>
 *
 * @param configPath  explicit configuration file, or null
 * @param verbose     print per-document results
 * @param refresh     delete cached Swagger documents before loading
 * @param dumpSchema  true when {@code --dump-schema} was given
 * @param dumpName    definition to dump, or null if the name was omitted
 * @param documents   explicit {@code .json} documents; empty means scan the documents directory
 */
public record CliArguments(
        Path configPath, boolean verbose, boolean refresh, boolean dumpSchema, String dumpName, List<Path> documents) {

    public CliArguments {
        documents = List.copyOf(documents);
    }

    /**
     * Parses the command line.
     *
     * @param args raw arguments
     * @return the parsed arguments
     * @throws IllegalArgumentException on an unknown option or {@code --config}
     *                                  without a path
     */
    public static CliArguments parse(String[] args) {
        Path configPath = null;
        boolean verbose = false;
        boolean refresh = false;
        boolean dumpSchema = false;
        String dumpName = null;
        List<Path> documents = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--config requires a file path argument");
                    }
                    configPath = Path.of(args[++i]);
                }
                case "--verbose", "-v" -> verbose = true;
                case "--refresh" -> refresh = true;
                case "--dump-schema" -> {
                    dumpSchema = true;
                    if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        dumpName = args[++i];
                    }
                }
                default -> {
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (arg.endsWith(".json")) {
                        documents.add(Path.of(arg));
                    }
                }
            }
        }
        return new CliArguments(configPath, verbose, refresh, dumpSchema, dumpName, documents);
    }
}
