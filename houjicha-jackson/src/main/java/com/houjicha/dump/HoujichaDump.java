package com.houjicha.dump;

import com.houjicha.ParseResult;
import com.houjicha.Parser;
import com.houjicha.json.AstJsonException;
import com.houjicha.json.AstJsonProvider;
import com.houjicha.json.AstJsonSerializer;
import com.houjicha.json.ResultFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Parses houjicha files and prints each file's AST and diagnostics as JSON,
 * one object per file: {@code {"file": ..., "document": ..., "errors": [...]}}.
 *
 * Usage:
 *   java -cp ... com.houjicha.dump.HoujichaDump [options] <file.houjicha|dir>...
 *
 * Options:
 *   --pretty        Pretty-print each JSON object
 *   --errors-only   Omit the document, print only the diagnostics
 *   --json=NAME     JSON binding to use; the first one on the class path by default
 *
 * Exit status: 0 when no file has errors, 1 when any file has parse errors,
 * 2 on a usage error or an unreadable file.
 */
public class HoujichaDump {
    private static final Logger LOG = LoggerFactory.getLogger(HoujichaDump.class);

    public static final String EXTENSION = ".houjicha";

    public static final int EXIT_OK = 0;
    public static final int EXIT_PARSE_ERRORS = 1;
    public static final int EXIT_FAILURE = 2;

    private final Config config;

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage(System.err);
            System.exit(EXIT_FAILURE);
        }
        System.exit(new HoujichaDump(config).run(System.out, System.err));
    }

    public HoujichaDump(Config config) {
        this.config = config;
    }

    /**
     * Dump every input file to {@code out}.
     *
     * @return the process exit status
     */
    public int run(PrintStream out, PrintStream err) {
        AstJsonSerializer serializer;
        try {
            AstJsonProvider provider = config.json == null
                ? AstJsonProvider.load()
                : AstJsonProvider.load(config.json);
            serializer = provider.serializer();
        } catch (AstJsonException e) {
            LOG.error("No usable JSON binding", e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        List<Path> files;
        try {
            files = discoverFiles();
        } catch (IOException e) {
            LOG.error("Failed to list input files", e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        ResultFormat format = new ResultFormat(null, !config.errorsOnly, config.pretty);

        boolean anyParseErrors = false;
        boolean anyFailures = false;

        for (Path file : files) {
            try {
                ParseResult result = Parser.parse(Files.readString(file, StandardCharsets.UTF_8));
                LOG.debug("{}: {} claims, {} errors", file,
                          result.document().claims().size(), result.errors().size());
                out.println(serializer.serializeResult(result, format.forFile(file.toString())));
                anyParseErrors |= result.hasErrors();
            } catch (AstJsonException e) {
                LOG.error("Failed to write JSON for {}", file, e);
                err.println("Error: " + e.getMessage());
                anyFailures = true;
            } catch (IOException e) {
                LOG.error("Failed to read {}", file, e);
                err.println("Error: cannot read " + file + ": " + e.getMessage());
                anyFailures = true;
            }
        }

        if (anyFailures) {
            return EXIT_FAILURE;
        }
        return anyParseErrors ? EXIT_PARSE_ERRORS : EXIT_OK;
    }

    /**
     * Expand the inputs: files are taken as given, directories are walked for
     * {@code *.houjicha} files in path order.
     */
    List<Path> discoverFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path input : config.inputs) {
            if (!Files.exists(input)) {
                throw new IOException("No such file or directory: " + input);
            }
            if (Files.isDirectory(input)) {
                try (Stream<Path> paths = Files.walk(input)) {
                    files.addAll(paths.filter(Files::isRegularFile)
                                      .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                                      .sorted()
                                      .collect(Collectors.toList()));
                }
            } else {
                files.add(input);
            }
        }
        return files;
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: HoujichaDump [--pretty] [--errors-only] [--json=NAME] <file" + EXTENSION + "|dir>...");
        err.println();
        err.println("Options:");
        err.println("  --pretty        Pretty-print each JSON object");
        err.println("  --errors-only   Print diagnostics without the document");
        err.println("  --json=NAME     JSON binding to use (default: first on the class path)");
    }

    public static class Config {
        boolean pretty = false;
        boolean errorsOnly = false;
        String json = null;
        List<Path> inputs = new ArrayList<>();

        /**
         * @return the parsed options, or null when the arguments are invalid
         */
        public static Config parse(String[] args) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.equals("--pretty")) {
                    config.pretty = true;
                } else if (arg.equals("--errors-only")) {
                    config.errorsOnly = true;
                } else if (arg.startsWith("--json=")) {
                    config.json = arg.substring("--json=".length());
                } else if (!arg.startsWith("-")) {
                    config.inputs.add(Path.of(arg));
                } else {
                    System.err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.inputs.isEmpty()) {
                System.err.println("Error: No input files specified");
                return null;
            }

            return config;
        }
    }
}
