package com.returnlint.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.returnlint.Diagnostic;
import com.returnlint.InvalidPolicyException;
import com.returnlint.Linter;
import com.returnlint.PipeReturnLinter;
import com.returnlint.Policy;
import com.returnlint.PolicyConfig;
import com.returnlint.ReturnLinter;
import com.returnlint.ast.Node;
import com.returnlint.jackson.JacksonAstJsonProvider;
import com.returnlint.json.AstJsonException;
import com.returnlint.json.AstJsonProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Command-line driver: lints function trees that an external parser has written as JSON.
 *
 * Usage:
 *   java -cp ... com.returnlint.cli.ReturnLintCli [options] <tree.json...>
 *
 * Options:
 *   --return-style=implicit|explicit   Return style (default: implicit)
 *   --allow-implicit-else=true|false   Allow terminal if without else (default: true)
 *   --return-functions=f,g             Extra exit functions for explicit style
 *   --except=f,g                       Extra functions that are never checked
 *   --config=PATH                      JSON config file; flags override it
 *   --pipe-return                      Also flag pipelines ending in return() anywhere
 *   --format=text|json                 Output format (default: text)
 *   --threads=N                        Number of worker threads (default: available processors)
 *
 * Exit codes: 0 no lints, 1 lints found, 2 usage, configuration or input errors.
 */
public class ReturnLintCli {

    static final int EXIT_CLEAN = 0;
    static final int EXIT_LINTS = 1;
    static final int EXIT_ERROR = 2;

    private static final Logger LOG = LoggerFactory.getLogger(ReturnLintCli.class);

    private final Config config;
    private final JacksonAstJsonProvider provider;

    public static void main(String[] args) {
        System.exit(launch(args, System.out, System.err));
    }

    static int launch(String[] args, PrintStream out, PrintStream err) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage(err);
            return EXIT_ERROR;
        }
        if (config.help) {
            printUsage(out);
            return EXIT_CLEAN;
        }
        return new ReturnLintCli(config).run(out);
    }

    public ReturnLintCli(Config config) {
        this.config = config;
        this.provider = new JacksonAstJsonProvider();
    }

    /**
     * Lints every input file and prints the results in input order.
     *
     * @return the process exit code
     */
    public int run(PrintStream out) {
        Policy policy;
        try {
            policy = loadPolicy();
        } catch (InvalidPolicyException | AstJsonException | IOException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return EXIT_ERROR;
        }
        LOG.debug("Using {}", policy);

        List<Linter> linters = new ArrayList<>();
        linters.add(new ReturnLinter(policy));
        if (config.pipeReturn) {
            linters.add(new PipeReturnLinter());
        }

        List<FileResult> results = lintAll(linters);

        boolean failed = false;
        boolean linted = false;
        for (FileResult result : results) {
            if (result.error != null) {
                failed = true;
            } else if (!result.diagnostics.isEmpty()) {
                linted = true;
            }
        }

        if (config.format == Format.JSON) {
            printJson(results, out);
        } else {
            printText(results, out);
        }

        if (failed) {
            return EXIT_ERROR;
        }
        return linted ? EXIT_LINTS : EXIT_CLEAN;
    }

    Policy loadPolicy() throws IOException {
        PolicyConfig fileConfig = PolicyConfig.EMPTY;
        if (config.configFile != null) {
            String json = Files.readString(config.configFile);
            fileConfig = provider.getDeserializer().deserializeConfig(json);
        }
        return fileConfig.overriddenBy(config.overrides()).toPolicy();
    }

    private List<FileResult> lintAll(List<Linter> linters) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, config.threads));
        try {
            List<Future<FileResult>> futures = new ArrayList<>();
            for (Path input : config.inputs) {
                futures.add(executor.submit(() -> lintFile(input, linters)));
            }
            List<FileResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), config.inputs.get(i)));
            }
            return results;
        } finally {
            executor.shutdown();
        }
    }

    private static FileResult await(Future<FileResult> future, Path input) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FileResult.failed(input, "interrupted");
        } catch (ExecutionException e) {
            LOG.error("Unexpected failure while linting {}", input, e.getCause());
            return FileResult.failed(input, String.valueOf(e.getCause()));
        }
    }

    private FileResult lintFile(Path input, List<Linter> linters) {
        Node tree;
        try {
            tree = provider.getDeserializer().deserializeTree(Files.readString(input));
        } catch (IOException | AstJsonException e) {
            LOG.warn("Skipping {}: {}", input, e.getMessage());
            return FileResult.failed(input, e.getMessage());
        }
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Linter linter : linters) {
            diagnostics.addAll(linter.lint(tree));
        }
        LOG.debug("{}: {} lint(s)", input, diagnostics.size());
        return new FileResult(input, diagnostics, null);
    }

    private static void printText(List<FileResult> results, PrintStream out) {
        for (FileResult result : results) {
            if (result.error != null) {
                out.println(result.file + ": error: " + result.error);
                continue;
            }
            for (Diagnostic d : result.diagnostics) {
                out.println(result.file + ":" + d.loc().start().line() + ":" + d.loc().start().column() +
                    ": " + d.severity().label() + ": " + d.message() + " [" + d.linter() + "]");
            }
        }
    }

    private void printJson(List<FileResult> results, PrintStream out) {
        ObjectMapper mapper = provider.getObjectMapper();
        ArrayNode files = mapper.createArrayNode();
        for (FileResult result : results) {
            ObjectNode file = files.addObject();
            file.put("file", result.file.toString());
            if (result.error != null) {
                file.put("error", result.error);
            } else {
                file.set("lints", mapper.valueToTree(result.diagnostics));
            }
        }
        try {
            out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(files));
        } catch (IOException e) {
            throw new AstJsonException("Failed to write results", e);
        }
    }

    static void printUsage(PrintStream out) {
        out.println("Usage: ReturnLintCli [options] <tree.json...>");
        out.println();
        out.println("Options:");
        out.println("  --return-style=implicit|explicit  Return style (default: implicit)");
        out.println("  --allow-implicit-else=true|false  Allow terminal if without else (default: true)");
        out.println("  --return-functions=f,g            Extra exit functions for explicit style");
        out.println("  --except=f,g                      Extra functions that are never checked");
        out.println("  --config=PATH                     JSON config file; flags override it");
        out.println("  --pipe-return                     Also flag pipelines ending in return() anywhere");
        out.println("  --format=text|json                Output format (default: text)");
        out.println("  --threads=N                       Number of worker threads (default: CPU count)");
        out.println("  --help                            Show this help");
        out.println();
        out.println("Examples:");
        out.println("  ReturnLintCli --return-style=explicit build/trees/*.json");
        out.println("  ReturnLintCli --config=returnlint.json --format=json utils.json");
    }

    // ==================== Helper Classes ====================

    enum Format {
        TEXT, JSON
    }

    static final class FileResult {
        final Path file;
        final List<Diagnostic> diagnostics;
        final String error;

        FileResult(Path file, List<Diagnostic> diagnostics, String error) {
            this.file = file;
            this.diagnostics = diagnostics;
            this.error = error;
        }

        static FileResult failed(Path file, String error) {
            return new FileResult(file, List.of(), error);
        }
    }

    public static class Config {
        String returnStyle;
        Boolean allowImplicitElse;
        List<String> returnFunctions;
        List<String> except;
        Path configFile;
        boolean help = false;
        boolean pipeReturn = false;
        Format format = Format.TEXT;
        int threads = Runtime.getRuntime().availableProcessors();
        List<Path> inputs = new ArrayList<>();

        PolicyConfig overrides() {
            return new PolicyConfig(returnStyle, allowImplicitElse, returnFunctions, except);
        }

        /**
         * Parses command-line arguments.
         *
         * @return the configuration, or null if the arguments are invalid
         */
        public static Config parse(String[] args) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    config.help = true;
                    return config;
                } else if (arg.startsWith("--return-style=")) {
                    config.returnStyle = arg.substring(15);
                } else if (arg.startsWith("--allow-implicit-else=")) {
                    String value = arg.substring(22);
                    if (!value.equals("true") && !value.equals("false")) {
                        System.err.println("Invalid value for --allow-implicit-else: " + value);
                        return null;
                    }
                    config.allowImplicitElse = Boolean.valueOf(value);
                } else if (arg.startsWith("--return-functions=")) {
                    config.returnFunctions = splitNames(arg.substring(19));
                } else if (arg.startsWith("--except=")) {
                    config.except = splitNames(arg.substring(9));
                } else if (arg.startsWith("--config=")) {
                    config.configFile = Path.of(arg.substring(9));
                } else if (arg.equals("--pipe-return")) {
                    config.pipeReturn = true;
                } else if (arg.startsWith("--format=")) {
                    String format = arg.substring(9).toUpperCase();
                    try {
                        config.format = Format.valueOf(format);
                    } catch (IllegalArgumentException e) {
                        System.err.println("Invalid format: " + format);
                        return null;
                    }
                } else if (arg.startsWith("--threads=")) {
                    try {
                        config.threads = Integer.parseInt(arg.substring(10));
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid thread count: " + arg.substring(10));
                        return null;
                    }
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

        private static List<String> splitNames(String value) {
            return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        }
    }
}
