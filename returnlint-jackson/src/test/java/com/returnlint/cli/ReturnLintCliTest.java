package com.returnlint.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.returnlint.Policy;
import com.returnlint.ReturnStyle;
import com.returnlint.jackson.ReturnLintJackson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ReturnLintCliTest {

    @TempDir
    Path dir;

    private Path addOne;
    private Path positive;

    @BeforeEach
    void copyTrees() throws IOException {
        addOne = copy("add-one.json");
        positive = copy("positive.json");
    }

    private Path copy(String name) throws IOException {
        Path target = dir.resolve(name);
        try (InputStream in = getClass().getResourceAsStream("/trees/" + name)) {
            assertNotNull(in);
            Files.copy(in, target);
        }
        return target;
    }

    private static final class Run {
        final int exitCode;
        final String output;

        Run(int exitCode, String output) {
            this.exitCode = exitCode;
            this.output = output;
        }
    }

    private static Run run(String... args) {
        ReturnLintCli.Config config = ReturnLintCli.Config.parse(args);
        assertNotNull(config, "arguments should parse");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int exitCode = new ReturnLintCli(config).run(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        return new Run(exitCode, buffer.toString(StandardCharsets.UTF_8));
    }

    // ==================== Argument parsing ====================

    @Test
    void parsesAllOptions() {
        ReturnLintCli.Config config = ReturnLintCli.Config.parse(new String[] {
            "--return-style=explicit", "--allow-implicit-else=false", "--return-functions=abort, halt",
            "--except=main", "--pipe-return", "--format=json", "--threads=2", "a.json", "b.json"
        });

        assertNotNull(config);
        assertEquals("explicit", config.returnStyle);
        assertEquals(Boolean.FALSE, config.allowImplicitElse);
        assertEquals(List.of("abort", "halt"), config.returnFunctions);
        assertEquals(List.of("main"), config.except);
        assertTrue(config.pipeReturn);
        assertEquals(ReturnLintCli.Format.JSON, config.format);
        assertEquals(2, config.threads);
        assertEquals(List.of(Path.of("a.json"), Path.of("b.json")), config.inputs);
    }

    @Test
    void rejectsBadArguments() {
        assertNull(ReturnLintCli.Config.parse(new String[] {}));
        assertNull(ReturnLintCli.Config.parse(new String[] {"--verbose", "a.json"}));
        assertNull(ReturnLintCli.Config.parse(new String[] {"--format=xml", "a.json"}));
        assertNull(ReturnLintCli.Config.parse(new String[] {"--allow-implicit-else=no", "a.json"}));
        assertNull(ReturnLintCli.Config.parse(new String[] {"--threads=many", "a.json"}));
    }

    @Test
    void helpPrintsUsageAndExitsCleanly() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int exitCode = ReturnLintCli.launch(new String[] {"--help"},
            new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(ReturnLintCli.EXIT_CLEAN, exitCode);
        assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("Usage: ReturnLintCli"));
        assertEquals("", err.toString(StandardCharsets.UTF_8));
    }

    @Test
    void badArgumentsPrintUsageToStderr() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int exitCode = ReturnLintCli.launch(new String[] {"--verbose"},
            new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(ReturnLintCli.EXIT_ERROR, exitCode);
        assertEquals("", out.toString(StandardCharsets.UTF_8));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage: ReturnLintCli"));
    }

    @Test
    void flagsOverrideConfigFile() throws IOException {
        Path configFile = dir.resolve("returnlint.json");
        Files.writeString(configFile, "{\"return_style\": \"explicit\", \"except\": [\"main\"]}");
        ReturnLintCli.Config config = ReturnLintCli.Config.parse(new String[] {
            "--config=" + configFile, "--allow-implicit-else=false", "a.json"
        });

        Policy policy = new ReturnLintCli(config).loadPolicy();

        assertEquals(ReturnStyle.EXPLICIT, policy.style());
        assertFalse(policy.allowImplicitElse());
        assertTrue(policy.isExempt("main"));
    }

    // ==================== Runs ====================

    @Test
    void cleanRunExitsZero() {
        Run result = run("--return-style=explicit", addOne.toString());

        assertEquals(ReturnLintCli.EXIT_CLEAN, result.exitCode);
        assertEquals("", result.output);
    }

    @Test
    void lintsArePrintedPerFileInInputOrder() {
        Run result = run("--allow-implicit-else=false", "--threads=2", addOne.toString(), positive.toString());

        assertEquals(ReturnLintCli.EXIT_LINTS, result.exitCode);
        String[] lines = result.output.strip().split("\\R");
        assertEquals(2, lines.length);
        assertEquals(addOne + ":2:3: style: Use implicit return behavior; explicit return() is not needed. [return_linter]",
            lines[0]);
        assertTrue(lines[1].startsWith(positive + ":2:3: warning: All functions with terminal if statements"));
    }

    @Test
    void jsonFormatGroupsLintsByFile() throws IOException {
        Run result = run("--format=json", addOne.toString(), positive.toString());

        ObjectMapper mapper = ReturnLintJackson.createObjectMapper();
        JsonNode files = mapper.readTree(result.output);
        assertEquals(2, files.size());
        assertEquals(addOne.toString(), files.get(0).get("file").asText());
        assertEquals(1, files.get(0).get("lints").size());
        assertEquals("style", files.get(0).get("lints").get(0).get("type").asText());
        assertEquals(0, files.get(1).get("lints").size());
    }

    @Test
    void unreadableInputIsReportedAndOthersStillLinted() throws IOException {
        Path broken = dir.resolve("broken.json");
        Files.writeString(broken, "{\"type\": ");

        Run result = run(broken.toString(), addOne.toString(), dir.resolve("missing.json").toString());

        assertEquals(ReturnLintCli.EXIT_ERROR, result.exitCode);
        assertTrue(result.output.contains(broken + ": error: "));
        assertTrue(result.output.contains(addOne + ":2:3: style: "));
        assertTrue(result.output.contains("missing.json: error: "));
    }

    @Test
    void invalidStyleIsAConfigurationError() {
        Run result = run("--return-style=sometimes", addOne.toString());

        assertEquals(ReturnLintCli.EXIT_ERROR, result.exitCode);
        assertEquals("", result.output);
    }

    @Test
    void pipeReturnLinterRunsOnRequest() throws IOException {
        Path tree = dir.resolve("pipeline.json");
        Files.writeString(tree, """
            {
              "type": "Block",
              "loc": { "start": { "line": 1, "column": 1 }, "end": { "line": 2, "column": 20 } },
              "statements": [
                {
                  "type": "PipeStage",
                  "loc": { "start": { "line": 1, "column": 1 }, "end": { "line": 2, "column": 10 } },
                  "operator": "%>%",
                  "lhs": { "type": "OtherExpression", "loc": { "start": { "line": 1, "column": 1 }, "end": { "line": 1, "column": 1 } }, "description": "x" },
                  "rhs": { "type": "Call", "loc": { "start": { "line": 2, "column": 3 }, "end": { "line": 2, "column": 10 } }, "callee": "return" }
                }
              ]
            }
            """);

        assertEquals(ReturnLintCli.EXIT_CLEAN, run(tree.toString()).exitCode);

        Run result = run("--pipe-return", tree.toString());
        assertEquals(ReturnLintCli.EXIT_LINTS, result.exitCode);
        assertTrue(result.output.contains(":2:3: warning: Avoid return() as the final step of a magrittr pipeline"));
        assertTrue(result.output.contains("[pipe_return_linter]"));
    }
}
